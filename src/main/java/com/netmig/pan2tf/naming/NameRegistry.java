package com.netmig.pan2tf.naming;

import com.netmig.pan2tf.exception.NameCollisionExhaustedException;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Identifiers handed out during one run.
 * <p>
 * A key always gets back the identifier it was first given. A different key
 * asking for a taken identifier gets the next free numeric suffix, starting at
 * {@code _2}. One registry belongs to one run; independent runs use their own.
 */
@Slf4j
public class NameRegistry {

    private static final String GLOBAL_NAMESPACE = "*";

    private final NamespaceMode mode;
    private final int maxSuffixAttempts;
    private final Map<ObjectKey, String> byKey = new HashMap<>();
    private final Map<String, Set<String>> taken = new HashMap<>();
    private final Map<String, Integer> nextSuffix = new HashMap<>();

    public NameRegistry(NamespaceMode mode, int maxSuffixAttempts) {
        if (maxSuffixAttempts < 1) {
            throw new IllegalArgumentException("maxSuffixAttempts must be at least 1, got " + maxSuffixAttempts);
        }
        this.mode = mode;
        this.maxSuffixAttempts = maxSuffixAttempts;
    }

    public String assign(ObjectKey key, Category category, String baseIdentifier)
            throws NameCollisionExhaustedException {
        String existing = byKey.get(key);
        if (existing != null) {
            return existing;
        }

        String namespace = mode == NamespaceMode.GLOBAL ? GLOBAL_NAMESPACE : category.getToken();
        Set<String> used = taken.computeIfAbsent(namespace, ns -> new HashSet<>());
        String identifier = baseIdentifier;
        if (used.contains(identifier)) {
            String collisionKey = namespace + "/" + baseIdentifier;
            int suffix = nextSuffix.getOrDefault(collisionKey, 2);
            int attempts = 0;
            do {
                if (attempts++ >= maxSuffixAttempts) {
                    throw new NameCollisionExhaustedException(baseIdentifier, maxSuffixAttempts);
                }
                identifier = baseIdentifier + "_" + suffix++;
            } while (used.contains(identifier));
            nextSuffix.put(collisionKey, suffix);
            log.debug("Identifier '{}' is taken in namespace '{}', using '{}' for {}",
                    baseIdentifier, namespace, identifier, key);
        }

        used.add(identifier);
        byKey.put(key, identifier);
        return identifier;
    }

    public NamespaceMode getMode() {
        return mode;
    }

    public int size() {
        return byKey.size();
    }
}
