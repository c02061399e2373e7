package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.exception.UnresolvedReferenceException;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectRef;
import com.netmig.pan2tf.model.scope.ScopeChain;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.Placement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks every scope frame in traversal order and collects its effective declarations.
 * <p>
 * Traversal order is shared, device groups in declared order, vsys, firewall
 * devices, templates, then template stacks; within a frame, categories in enum
 * order and names in first-declared order.
 */
@Slf4j
public class DeclarationCollector {

    private final ScopeResolver resolver;
    private final ScopeChainFactory chains;
    private final ReferenceNormalizer normalizer;
    private final Set<Category> excluded;

    public DeclarationCollector(ScopeResolver resolver, ScopeChainFactory chains, Set<Category> excluded) {
        this.resolver = resolver;
        this.chains = chains;
        this.normalizer = new ReferenceNormalizer(resolver);
        this.excluded = excluded.isEmpty() ? EnumSet.noneOf(Category.class) : EnumSet.copyOf(excluded);
    }

    public DeclarationSet collect() {
        List<Declaration> declarations = new ArrayList<>();
        List<Declaration> stubOwners = new ArrayList<>();

        for (ScopeFrame frame : resolver.getTree().getCatalog().allFrames()) {
            FrameIndex index = resolver.index(frame);
            ScopeChain chain = chains.chainFor(frame);
            for (Category category : Category.values()) {
                if (excluded.contains(category)) {
                    continue;
                }
                for (Map.Entry<String, Placement> entry : index.authored(category).entrySet()) {
                    declarations.add(new Declaration(frame, category, entry.getKey(), entry.getValue(),
                            chain, declarations.size()));
                }
                for (Map.Entry<String, Placement> entry : index.stubs(category).entrySet()) {
                    stubOwners.add(new Declaration(frame, category, entry.getKey(), entry.getValue(), chain, -1));
                }
            }
        }

        DeclarationSet authoredOnly = new DeclarationSet(declarations, Map.of());
        Map<ScopedRef, Declaration> aliases = new LinkedHashMap<>();
        for (Declaration stub : stubOwners) {
            try {
                ConfigNode authored = normalizer.normalize(stub.getNode(), stub.getCategory(), stub.getChain());
                authoredOnly.declarationOf(authored).ifPresent(target -> aliases.put(
                        new ScopedRef(stub.getFrame().getId(), new ObjectRef(stub.getCategory(), stub.getName())),
                        target));
            } catch (UnresolvedReferenceException e) {
                log.warn("Stub {} in {} points at nothing authored and is ignored", stub.label(), stub.getFrame());
            }
        }

        log.info("Collected {} declaration(s) and {} stub(s) across {} scope frame(s)",
                declarations.size(), stubOwners.size(), resolver.getTree().getCatalog().allFrames().size());
        return new DeclarationSet(declarations, aliases);
    }
}
