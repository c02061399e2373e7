package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.exception.UnresolvedReferenceException;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.UnresolvedReference;
import com.netmig.pan2tf.model.scope.ScopeChain;
import com.netmig.pan2tf.model.tree.ConfigNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * Replaces stub declarations with the authored declaration they point at.
 * <p>
 * A stub is an entry that only names an object: its children are identity
 * markers ({@code id}, {@code uuid}) and nothing else, or, for categories with
 * known content fields, it carries none of them and no description either.
 */
@Slf4j
public class ReferenceNormalizer {

    public static final Set<String> IDENTITY_MARKERS = Set.of("id", "uuid");
    private static final String DESCRIPTION = "description";

    private final ScopeResolver resolver;

    public ReferenceNormalizer(ScopeResolver resolver) {
        this.resolver = resolver;
    }

    public static boolean isStub(ConfigNode node, Category category) {
        if (node.hasChildren() && node.getChildren().stream()
                .allMatch(child -> IDENTITY_MARKERS.contains(child.getTag()))) {
            return true;
        }
        if (category.getContentFields().isEmpty()) {
            return false;
        }
        for (ConfigNode child : node.getChildren()) {
            if (category.getContentFields().contains(child.getTag()) || DESCRIPTION.equals(child.getTag())) {
                return false;
            }
        }
        return true;
    }

    /**
     * The authored node standing behind a declaration: the node itself when it is
     * authored, otherwise the nearest authored declaration of the name in the chain.
     *
     * @throws UnresolvedReferenceException when the name is only ever declared as a stub
     */
    public ConfigNode normalize(ConfigNode node, Category category, ScopeChain chain)
            throws UnresolvedReferenceException {
        if (!isStub(node, category)) {
            return node;
        }
        ScopeResolver.Lookup lookup = resolver.lookup(node.getName(), List.of(category), chain);
        if (lookup.getMatch().isPresent()) {
            log.debug("Stub {} '{}' in {} stands for the declaration in {}",
                    category.getToken(), node.getName(), chain.getOwner(), lookup.getMatch().get().getFrame());
            return lookup.getMatch().get().getNode();
        }
        throw new UnresolvedReferenceException(List.of(new UnresolvedReference(
                category, node.getName(), chain.getOwner().toString(), null,
                List.of(category), node.getName(), true)));
    }
}
