package com.netmig.pan2tf.dedup;

import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ObjectRef;
import com.netmig.pan2tf.model.UnresolvedReference;
import com.netmig.pan2tf.resolve.Declaration;
import com.netmig.pan2tf.resolve.ScopedRef;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of deduplication.
 * <ul>
 *   <li>mapping: every name as seen from every scope (stubs included) to its object key</li>
 *   <li>definitions: one per key, in first-seen order</li>
 *   <li>unresolved: every failed reference</li>
 *   <li>omitted: declarations left out because they or something they use did not resolve</li>
 * </ul>
 */
@Getter
@AllArgsConstructor
public class DedupResult {

    private final Map<ScopedRef, ObjectKey> mapping;
    private final Map<ObjectKey, ObjectDefinition> definitions;
    private final List<UnresolvedReference> unresolved;
    private final List<Declaration> omitted;

    public Optional<ObjectKey> keyOf(String scopeId, ObjectRef ref) {
        return Optional.ofNullable(mapping.get(new ScopedRef(scopeId, ref)));
    }

    public Optional<ObjectDefinition> definitionOf(String scopeId, ObjectRef ref) {
        return keyOf(scopeId, ref).map(definitions::get);
    }
}
