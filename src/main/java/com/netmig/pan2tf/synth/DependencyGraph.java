package com.netmig.pan2tf.synth;

import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.ObjectKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical objects and the "emit after" edges between them
 */
public class DependencyGraph {

    private final Map<ObjectKey, CanonicalObject> nodes = new LinkedHashMap<>();
    private final Map<ObjectKey, List<ObjectKey>> outgoing = new LinkedHashMap<>();
    private final List<DependencyEdge> edges = new ArrayList<>();

    void addNode(CanonicalObject object) {
        nodes.put(object.getKey(), object);
        outgoing.putIfAbsent(object.getKey(), new ArrayList<>());
    }

    void addEdge(ObjectKey referrer, ObjectKey referent) {
        List<ObjectKey> targets = outgoing.get(referrer);
        if (!targets.contains(referent)) {
            targets.add(referent);
            edges.add(new DependencyEdge(referrer, referent));
        }
    }

    public Collection<CanonicalObject> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public CanonicalObject node(ObjectKey key) {
        return nodes.get(key);
    }

    public boolean contains(ObjectKey key) {
        return nodes.containsKey(key);
    }

    /**
     * Referents of an object, in reference order.
     */
    public List<ObjectKey> dependenciesOf(ObjectKey key) {
        return Collections.unmodifiableList(outgoing.getOrDefault(key, List.of()));
    }

    public List<DependencyEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public int size() {
        return nodes.size();
    }
}
