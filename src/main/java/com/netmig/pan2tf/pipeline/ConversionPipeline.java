package com.netmig.pan2tf.pipeline;

import com.netmig.pan2tf.config.ConversionConfig;
import com.netmig.pan2tf.dedup.DedupResult;
import com.netmig.pan2tf.dedup.Deduplicator;
import com.netmig.pan2tf.dedup.ObjectDefinition;
import com.netmig.pan2tf.emit.ResourceEmitter;
import com.netmig.pan2tf.exception.ConversionException;
import com.netmig.pan2tf.exception.CyclicDependencyException;
import com.netmig.pan2tf.exception.NameCollisionExhaustedException;
import com.netmig.pan2tf.exception.UnresolvedReferenceException;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ResolvedReference;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.naming.NameRegistry;
import com.netmig.pan2tf.naming.NameSanitizer;
import com.netmig.pan2tf.resolve.Declaration;
import com.netmig.pan2tf.resolve.DeclarationCollector;
import com.netmig.pan2tf.resolve.DeclarationSet;
import com.netmig.pan2tf.resolve.ReferenceResolver;
import com.netmig.pan2tf.resolve.ScopeChainFactory;
import com.netmig.pan2tf.resolve.ScopeResolver;
import com.netmig.pan2tf.resolve.TemplateMatcher;
import com.netmig.pan2tf.synth.DependencyGraph;
import com.netmig.pan2tf.synth.DependencyGraphBuilder;
import com.netmig.pan2tf.synth.EmittedResource;
import com.netmig.pan2tf.synth.Synthesizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the conversion stages in order: collect declarations, resolve and
 * deduplicate, assign identifiers, build the dependency graph and order it.
 * Each stage consumes the whole output of the previous one.
 */
@Slf4j
public class ConversionPipeline {

    private final ConversionConfig config;

    public ConversionPipeline(ConversionConfig config) {
        this.config = config;
    }

    /**
     * Convert a loaded export.
     *
     * @throws UnresolvedReferenceException when references fail and abortOnUnresolved is set
     * @throws CyclicDependencyException when objects reference each other in a loop
     * @throws NameCollisionExhaustedException when no free identifier is left for a name
     */
    public ConversionResult convert(ConfigTree tree) throws ConversionException {
        Set<Category> excluded = config.getExcludedCategories().isEmpty()
                ? EnumSet.noneOf(Category.class)
                : EnumSet.copyOf(config.getExcludedCategories());
        if (!excluded.isEmpty()) {
            log.info("Excluding categories: {}", excluded);
        }

        ScopeResolver resolver = new ScopeResolver(tree);
        ScopeChainFactory chains = new ScopeChainFactory(tree.getCatalog(),
                new TemplateMatcher(config.getTemplatePrefixes()));
        DeclarationSet declarations = new DeclarationCollector(resolver, chains, excluded).collect();

        Deduplicator deduplicator = new Deduplicator(new ReferenceResolver(resolver, declarations, excluded));
        DedupResult dedup = deduplicator.canonicalize(declarations);
        if (!dedup.getUnresolved().isEmpty()) {
            dedup.getUnresolved().forEach(unresolved -> log.warn("Unresolved: {}", unresolved.describe()));
            if (config.isAbortOnUnresolved()) {
                throw new UnresolvedReferenceException(dedup.getUnresolved());
            }
        }

        NameSanitizer sanitizer = new NameSanitizer(
                new NameRegistry(config.getNamespaceMode(), config.getMaxSuffixAttempts()));
        List<CanonicalObject> objects = canonicalObjects(dedup, sanitizer);

        DependencyGraph graph = new DependencyGraphBuilder().build(objects);
        List<CanonicalObject> ordered = new Synthesizer().emitOrder(graph);
        log.info("Conversion produced {} object(s) from {} declaration(s)", ordered.size(), declarations.size());
        return new ConversionResult(ordered, dedup.getUnresolved(), dedup, graph);
    }

    /**
     * Render every object of a result, in emission order.
     */
    public List<EmittedResource> emit(ConversionResult result, ResourceEmitter emitter)
            throws CyclicDependencyException {
        return new Synthesizer().synthesize(result.getGraph(), emitter);
    }

    private List<CanonicalObject> canonicalObjects(DedupResult dedup, NameSanitizer sanitizer)
            throws NameCollisionExhaustedException {
        // Identifiers first: references may point at objects seen later
        Map<ObjectKey, String> identifiers = new HashMap<>();
        for (ObjectDefinition definition : dedup.getDefinitions().values()) {
            identifiers.put(definition.getKey(), sanitizer.sanitize(definition.getKey(),
                    definition.getKey().getCategory(), definition.getName()));
        }

        List<CanonicalObject> objects = new ArrayList<>();
        for (ObjectDefinition definition : dedup.getDefinitions().values()) {
            CanonicalObject.CanonicalObjectBuilder builder = CanonicalObject.builder()
                    .key(definition.getKey())
                    .identifier(identifiers.get(definition.getKey()))
                    .name(definition.getName())
                    .fields(Collections.unmodifiableMap(definition.getFields()))
                    .ordinal(definition.getOrdinal());

            Set<ObjectKey> dependencies = new LinkedHashSet<>();
            for (ResolvedReference reference : definition.getReferences()) {
                String targetIdentifier = null;
                if (reference.isLinked()) {
                    targetIdentifier = identifiers.get(reference.getTargetKey());
                    dependencies.add(reference.getTargetKey());
                }
                builder.reference(new ResolvedReference(reference.getFieldPath(), reference.getValue(),
                        reference.getKind(), reference.getTargetCategory(), reference.getTargetKey(),
                        targetIdentifier));
            }
            builder.dependencies(dependencies);

            Set<String> origins = new LinkedHashSet<>();
            for (Declaration declaration : definition.getDeclarations()) {
                origins.add(declaration.getFrame().toString());
            }
            builder.origins(origins);
            objects.add(builder.build());
        }
        return objects;
    }
}
