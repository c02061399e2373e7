package com.netmig.pan2tf.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One deduplicated, fully resolved object ready for emission.
 * Every scope that declared an identical object shares this instance.
 */
@Value
@Builder(toBuilder = true)
public class CanonicalObject {

    ObjectKey key;

    /**
     * Sanitised target identifier, unique within its namespace
     */
    String identifier;

    /**
     * Name as written in the export
     */
    String name;

    /**
     * Content of the representative declaration: strings, string lists,
     * nested maps and lists of maps, in source order
     */
    Map<String, Object> fields;

    @Singular
    List<ResolvedReference> references;

    /**
     * Keys of linked referents, in reference order without duplicates
     */
    @Singular
    List<ObjectKey> dependencies;

    /**
     * Scopes that declared this object, first-seen first
     */
    @Singular
    List<String> origins;

    /**
     * Traversal position of the first declaration
     */
    int ordinal;

    public Category getCategory() {
        return key.getCategory();
    }

    /**
     * Identifiers of linked referents, in dependency order.
     */
    public List<String> getDependencyIdentifiers() {
        return references.stream()
                .filter(ResolvedReference::isLinked)
                .map(ResolvedReference::getTargetIdentifier)
                .distinct()
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return getCategory().getToken() + " '" + name + "' (" + identifier + ")";
    }
}
