package com.netmig.pan2tf.naming;

import com.netmig.pan2tf.exception.NameCollisionExhaustedException;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;

import java.util.Locale;

/**
 * Maps source names onto identifiers valid in the target language.
 */
public class NameSanitizer {

    private final NameRegistry registry;

    public NameSanitizer(NameRegistry registry) {
        this.registry = registry;
    }

    /**
     * Sanitised, unique identifier for an object. The same key always gets the same identifier.
     */
    public String sanitize(ObjectKey key, Category category, String rawName) throws NameCollisionExhaustedException {
        return registry.assign(key, category, baseIdentifier(category, rawName));
    }

    /**
     * Lowercase, characters outside {@code [a-z0-9_]} replaced by {@code _}, runs
     * of {@code _} collapsed and trimmed. Empty or digit-leading results are
     * prefixed with the category token.
     */
    public static String baseIdentifier(Category category, String rawName) {
        String identifier = rawName == null ? "" : rawName.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_|_$", "");
        if (identifier.isEmpty()) {
            return category.getToken();
        }
        if (Character.isDigit(identifier.charAt(0))) {
            return category.getToken() + "_" + identifier;
        }
        return identifier;
    }
}
