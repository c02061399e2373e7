package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.tree.ConfigNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every authored declaration of an export in traversal order, plus the stub
 * declarations and the authored declaration each one stands for.
 */
public class DeclarationSet {

    private final List<Declaration> declarations;
    private final Map<ScopedRef, Declaration> stubAliases;
    private final Map<ConfigNode, Declaration> byNode = new IdentityHashMap<>();

    public DeclarationSet(List<Declaration> declarations, Map<ScopedRef, Declaration> stubAliases) {
        this.declarations = List.copyOf(declarations);
        this.stubAliases = Collections.unmodifiableMap(new LinkedHashMap<>(stubAliases));
        for (Declaration declaration : declarations) {
            byNode.put(declaration.getNode(), declaration);
        }
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public Map<ScopedRef, Declaration> getStubAliases() {
        return stubAliases;
    }

    public Optional<Declaration> declarationOf(ConfigNode node) {
        return Optional.ofNullable(byNode.get(node));
    }

    public int size() {
        return declarations.size();
    }
}
