package com.netmig.pan2tf.dedup;

import com.netmig.pan2tf.exception.CyclicDependencyException;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ResolvedReference;
import com.netmig.pan2tf.model.UnresolvedReference;
import com.netmig.pan2tf.resolve.Declaration;
import com.netmig.pan2tf.resolve.DeclarationSet;
import com.netmig.pan2tf.resolve.FieldExtractor;
import com.netmig.pan2tf.resolve.Link;
import com.netmig.pan2tf.resolve.ReferenceResolver;
import com.netmig.pan2tf.resolve.Resolution;
import com.netmig.pan2tf.resolve.ScopedRef;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses structurally identical declarations into one object.
 * <p>
 * Hashes are computed post-order: a declaration's references contribute the
 * hash of their targets, so two groups are equal only when their members are.
 * A declaration whose references fail, directly or through a target, gets no
 * hash and is left out.
 */
@Slf4j
public class Deduplicator {

    private final ReferenceResolver references;
    private final StructuralHasher hasher = new StructuralHasher();
    private final Map<Declaration, String> hashes = new HashMap<>();
    private final Set<Declaration> incomplete = new HashSet<>();
    private final LinkedHashSet<Declaration> visiting = new LinkedHashSet<>();

    public Deduplicator(ReferenceResolver references) {
        this.references = references;
    }

    public DedupResult canonicalize(DeclarationSet declarations) throws CyclicDependencyException {
        List<UnresolvedReference> unresolved = new ArrayList<>();
        for (Declaration declaration : declarations.getDeclarations()) {
            unresolved.addAll(references.resolve(declaration).getErrors());
        }

        Map<ScopedRef, ObjectKey> mapping = new LinkedHashMap<>();
        Map<ObjectKey, ObjectDefinition> definitions = new LinkedHashMap<>();
        List<Declaration> omitted = new ArrayList<>();

        for (Declaration declaration : declarations.getDeclarations()) {
            String hash = hashOf(declaration);
            if (hash == null) {
                omitted.add(declaration);
                continue;
            }
            ObjectKey key = new ObjectKey(declaration.getCategory(), hash);
            mapping.put(scopedRef(declaration), key);
            ObjectDefinition existing = definitions.get(key);
            if (existing != null) {
                existing.addDeclaration(declaration);
                log.debug("{} in {} is identical to the one in {}", declaration.label(),
                        declaration.getFrame(), existing.getRepresentative().getFrame());
                continue;
            }
            definitions.put(key, new ObjectDefinition(key, declaration, FieldExtractor.extract(declaration),
                    resolvedReferences(declaration), definitions.size()));
        }

        for (Map.Entry<ScopedRef, Declaration> alias : declarations.getStubAliases().entrySet()) {
            String hash = hashes.get(alias.getValue());
            if (hash != null) {
                mapping.put(alias.getKey(), new ObjectKey(alias.getValue().getCategory(), hash));
            }
        }

        log.info("Deduplicated {} declaration(s) into {} object(s); {} unresolved reference(s), {} omitted",
                declarations.size(), definitions.size(), unresolved.size(), omitted.size());
        return new DedupResult(mapping, definitions, unresolved, omitted);
    }

    private String hashOf(Declaration declaration) throws CyclicDependencyException {
        if (hashes.containsKey(declaration)) {
            return hashes.get(declaration);
        }
        if (incomplete.contains(declaration)) {
            return null;
        }
        if (visiting.contains(declaration)) {
            throw new CyclicDependencyException(cyclePath(declaration));
        }

        visiting.add(declaration);
        try {
            Resolution resolution = references.resolve(declaration);
            boolean complete = !resolution.hasErrors();
            List<String> canonicalReferences = new ArrayList<>();
            for (Link link : resolution.getLinks()) {
                String targetHash = null;
                if (link.isLinked()) {
                    targetHash = hashOf(link.getTarget());
                    if (targetHash == null) {
                        log.debug("{} in {} depends on incomplete {}", declaration.label(),
                                declaration.getFrame(), link.getTarget());
                        complete = false;
                    }
                }
                canonicalReferences.add(link.canonical(targetHash));
            }
            if (!complete) {
                incomplete.add(declaration);
                return null;
            }
            String hash = hasher.hash(declaration.getCategory(), declaration.getName(),
                    FieldExtractor.extract(declaration), canonicalReferences);
            hashes.put(declaration, hash);
            return hash;
        } finally {
            visiting.remove(declaration);
        }
    }

    private List<String> cyclePath(Declaration repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (Declaration declaration : visiting) {
            inCycle |= declaration.equals(repeated);
            if (inCycle) {
                path.add(declaration.label());
            }
        }
        path.add(repeated.label());
        return path;
    }

    private List<ResolvedReference> resolvedReferences(Declaration declaration) {
        List<ResolvedReference> resolved = new ArrayList<>();
        for (Link link : references.resolve(declaration).getLinks()) {
            Category targetCategory = null;
            ObjectKey targetKey = null;
            if (link.isLinked()) {
                targetCategory = link.getTarget().getCategory();
                targetKey = new ObjectKey(targetCategory, hashes.get(link.getTarget()));
            }
            resolved.add(new ResolvedReference(link.getFieldPath(), link.getValue(), link.getKind(),
                    targetCategory, targetKey, null));
        }
        return resolved;
    }

    private static ScopedRef scopedRef(Declaration declaration) {
        return new ScopedRef(declaration.getFrame().getId(), declaration.toRef());
    }
}
