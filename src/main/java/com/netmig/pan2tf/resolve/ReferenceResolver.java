package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ReferenceKind;
import com.netmig.pan2tf.model.ReferenceSpec;
import com.netmig.pan2tf.model.ReferenceSpecs;
import com.netmig.pan2tf.model.UnresolvedReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the reference fields of declarations against their scope chains.
 * <p>
 * Each value is tried as an object name first, then as a predefined name, then
 * as an inline address where the field allows one. Optional fields fall back to
 * an external reference; required fields record an {@link UnresolvedReference}.
 * Results are cached per declaration.
 */
@Slf4j
public class ReferenceResolver {

    private static final String IPV4 = "(?:\\d{1,3}\\.){3}\\d{1,3}";
    private static final String IPV6 = "[0-9a-fA-F]{0,4}(?::[0-9a-fA-F]{0,4}){2,7}";
    private static final Pattern LITERAL_ADDRESS = Pattern.compile(
            IPV4 + "(?:/\\d{1,2})?|" + IPV4 + "-" + IPV4 + "|"
                    + IPV6 + "(?:/\\d{1,3})?|" + IPV6 + "-" + IPV6);

    private final ScopeResolver resolver;
    private final DeclarationSet declarations;
    private final Set<Category> excluded;
    private final Map<Declaration, Resolution> cache = new HashMap<>();

    public ReferenceResolver(ScopeResolver resolver, DeclarationSet declarations, Set<Category> excluded) {
        this.resolver = resolver;
        this.declarations = declarations;
        this.excluded = excluded.isEmpty() ? EnumSet.noneOf(Category.class) : EnumSet.copyOf(excluded);
    }

    public static boolean isLiteralAddress(String value) {
        return LITERAL_ADDRESS.matcher(value).matches();
    }

    public Resolution resolve(Declaration declaration) {
        return cache.computeIfAbsent(declaration, this::doResolve);
    }

    private Resolution doResolve(Declaration declaration) {
        List<Link> links = new ArrayList<>();
        List<UnresolvedReference> errors = new ArrayList<>();

        for (ReferenceSpec spec : ReferenceSpecs.of(declaration.getCategory())) {
            String fieldPath = spec.getFieldPath();
            for (String value : declaration.getNode().values(spec.getPath())) {
                ScopeResolver.Lookup lookup = resolver.lookup(value, spec.getTargets(), declaration.getChain());
                if (lookup.getMatch().isPresent()) {
                    Match match = lookup.getMatch().get();
                    if (excluded.contains(match.getCategory())) {
                        links.add(new Link(fieldPath, value, ReferenceKind.EXTERNAL, null));
                        continue;
                    }
                    Declaration target = declarations.declarationOf(match.getNode())
                            .orElseThrow(() -> new IllegalStateException(
                                    "No declaration recorded for " + match.getNode() + " in " + match.getFrame()));
                    links.add(new Link(fieldPath, value, ReferenceKind.LINKED, target));
                } else if (spec.isPredefined(value)) {
                    links.add(new Link(fieldPath, value, ReferenceKind.PREDEFINED, null));
                } else if (spec.isLiteralAddress() && isLiteralAddress(value)) {
                    links.add(new Link(fieldPath, value, ReferenceKind.LITERAL, null));
                } else if (spec.isOptional() && !lookup.isStubSeen()) {
                    log.debug("{} in {} refers to '{}' ({}) which is not in the export, treating it as external",
                            declaration.label(), declaration.getFrame(), value, fieldPath);
                    links.add(new Link(fieldPath, value, ReferenceKind.EXTERNAL, null));
                } else {
                    errors.add(new UnresolvedReference(declaration.getCategory(), declaration.getName(),
                            declaration.getFrame().toString(), fieldPath, spec.getTargets(), value,
                            lookup.isStubSeen()));
                }
            }
        }

        if (!errors.isEmpty()) {
            log.debug("{} in {} has {} unresolved reference(s)",
                    declaration.label(), declaration.getFrame(), errors.size());
        }
        return new Resolution(declaration, links, errors);
    }
}
