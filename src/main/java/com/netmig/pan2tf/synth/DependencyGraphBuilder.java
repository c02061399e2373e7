package com.netmig.pan2tf.synth;

import com.netmig.pan2tf.exception.CyclicDependencyException;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.ObjectKey;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;

/**
 * Builds the dependency graph: one edge per linked reference.
 */
@Slf4j
public class DependencyGraphBuilder {

    public DependencyGraph build(Collection<CanonicalObject> objects) throws CyclicDependencyException {
        DependencyGraph graph = new DependencyGraph();
        for (CanonicalObject object : objects) {
            graph.addNode(object);
        }
        for (CanonicalObject object : objects) {
            for (ObjectKey dependency : object.getDependencies()) {
                if (dependency.equals(object.getKey())) {
                    throw new CyclicDependencyException(List.of(label(object), label(object)));
                }
                if (!graph.contains(dependency)) {
                    throw new IllegalStateException(object + " depends on " + dependency
                            + " which is not part of the graph");
                }
                graph.addEdge(object.getKey(), dependency);
            }
        }
        log.info("Dependency graph: {} object(s), {} edge(s)", graph.size(), graph.getEdges().size());
        return graph;
    }

    static String label(CanonicalObject object) {
        return object.getCategory().getToken() + " '" + object.getName() + "'";
    }
}
