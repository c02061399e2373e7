package com.netmig.pan2tf.pipeline;

import com.netmig.pan2tf.dedup.DedupResult;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.UnresolvedReference;
import com.netmig.pan2tf.synth.DependencyGraph;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of one conversion run: the canonical objects in emission order and
 * every reference that could not be resolved
 */
@Getter
@AllArgsConstructor
public class ConversionResult {

    /**
     * Canonical objects, each after everything it references
     */
    private final List<CanonicalObject> objects;

    private final List<UnresolvedReference> unresolved;

    private final DedupResult dedup;

    private final DependencyGraph graph;

    public boolean hasUnresolved() {
        return !unresolved.isEmpty();
    }

    public List<CanonicalObject> objectsOf(Category category) {
        return objects.stream()
                .filter(object -> object.getCategory() == category)
                .collect(Collectors.toList());
    }

    /**
     * Canonical objects of a category carrying a source name, in emission order.
     */
    public List<CanonicalObject> named(Category category, String name) {
        return objects.stream()
                .filter(object -> object.getCategory() == category && object.getName().equals(name))
                .collect(Collectors.toList());
    }

    public Optional<CanonicalObject> find(Category category, String name) {
        return named(category, name).stream().findFirst();
    }

    public int indexOf(CanonicalObject object) {
        return objects.indexOf(object);
    }
}
