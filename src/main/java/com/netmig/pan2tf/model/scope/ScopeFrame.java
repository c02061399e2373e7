package com.netmig.pan2tf.model.scope;

import com.netmig.pan2tf.model.tree.ConfigNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * One lookup table of a scope chain: the nodes under which a scope declares
 * its objects. The shared frame has one base per shared fragment.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode(of = {"domain", "name", "kind"})
public final class ScopeFrame {

    public static final String SHARED_NAME = "shared";

    private final ScopeKind kind;
    private final ScopeDomain domain;
    private final String name;
    private final List<ConfigNode> bases;

    /**
     * The entry element that owns this frame (device-group, template, ... entry), null for shared
     */
    private final ConfigNode origin;

    public static ScopeFrame of(ScopeKind kind, ScopeDomain domain, String name,
                                List<ConfigNode> bases, ConfigNode origin) {
        return new ScopeFrame(kind, domain, name, List.copyOf(bases), origin);
    }

    /**
     * Same tables, playing another role in a chain (a device group seen as an ancestor).
     */
    public ScopeFrame as(ScopeKind otherKind) {
        return otherKind == kind ? this : new ScopeFrame(otherKind, domain, name, bases, origin);
    }

    /**
     * Stable identity of the frame, independent of its role in a chain.
     */
    public String getId() {
        return domain.getLabel() + ":" + name;
    }

    @Override
    public String toString() {
        return domain == ScopeDomain.SHARED ? SHARED_NAME : domain.getLabel() + " '" + name + "'";
    }
}
