package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.exception.UnresolvedReferenceException;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectRef;
import com.netmig.pan2tf.model.UnresolvedReference;
import com.netmig.pan2tf.model.scope.ScopeChain;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.model.tree.Placement;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks names up along a scope chain.
 * <p>
 * Frames are searched in precedence order and the first frame holding an
 * authored declaration wins; within a frame the later declaration wins. Stubs
 * never satisfy a lookup, whatever their distance from the consumer.
 */
@Slf4j
public class ScopeResolver {

    @Getter
    private final ConfigTree tree;
    private final Map<String, FrameIndex> indexes = new HashMap<>();

    public ScopeResolver(ConfigTree tree) {
        this.tree = tree;
    }

    public FrameIndex index(ScopeFrame frame) {
        return indexes.computeIfAbsent(frame.getId(), id -> FrameIndex.build(tree, frame));
    }

    /**
     * Resolve a reference to its authoritative node.
     *
     * @throws UnresolvedReferenceException when no frame of the chain holds an authored declaration
     */
    public ConfigNode resolve(ObjectRef ref, ScopeChain chain) throws UnresolvedReferenceException {
        Lookup lookup = lookup(ref.getName(), List.of(ref.getCategory()), chain);
        if (lookup.getMatch().isPresent()) {
            return lookup.getMatch().get().getNode();
        }
        throw new UnresolvedReferenceException(List.of(new UnresolvedReference(
                null, null, chain.getOwner().toString(), null,
                List.of(ref.getCategory()), ref.getName(), lookup.isStubSeen())));
    }

    /**
     * Search a name among several categories. In each frame the categories are
     * tried in the given order before moving to the next frame.
     */
    public Lookup lookup(String name, List<Category> categories, ScopeChain chain) {
        boolean stubSeen = false;
        for (ScopeFrame frame : chain.getFrames()) {
            FrameIndex index = index(frame);
            for (Category category : categories) {
                Optional<Placement> placement = index.authored(category, name);
                if (placement.isPresent()) {
                    log.debug("Resolved {} '{}' for {} in {}", category.getToken(), name, chain.getOwner(), frame);
                    return new Lookup(Optional.of(new Match(frame, category, placement.get())), stubSeen);
                }
                stubSeen |= index.hasStub(category, name);
            }
        }
        return new Lookup(Optional.empty(), stubSeen);
    }

    /**
     * Outcome of a lookup; remembers whether stubs of the name were passed over
     */
    @Getter
    public static final class Lookup {
        private final Optional<Match> match;
        private final boolean stubSeen;

        Lookup(Optional<Match> match, boolean stubSeen) {
            this.match = match;
            this.stubSeen = stubSeen;
        }
    }
}
