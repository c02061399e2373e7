package com.netmig.pan2tf.synth;

import com.netmig.pan2tf.emit.ResourceEmitter;
import com.netmig.pan2tf.exception.CyclicDependencyException;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.ObjectKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders canonical objects so every object comes after what it references.
 * <p>
 * Depth-first topological sort. Roots are taken by category priority, then by
 * first-seen ordinal, and dependencies are visited in that same order, so the
 * output is identical for identical input.
 */
@Slf4j
public class Synthesizer {

    private static final Comparator<CanonicalObject> EMISSION_ORDER = Comparator
            .comparingInt((CanonicalObject o) -> o.getCategory().getPriority())
            .thenComparingInt(CanonicalObject::getOrdinal);

    private enum Mark { IN_PROGRESS, DONE }

    public List<CanonicalObject> emitOrder(DependencyGraph graph) throws CyclicDependencyException {
        List<CanonicalObject> roots = new ArrayList<>(graph.getNodes());
        roots.sort(EMISSION_ORDER);

        Map<ObjectKey, Mark> marks = new HashMap<>();
        List<CanonicalObject> path = new ArrayList<>();
        List<CanonicalObject> order = new ArrayList<>(roots.size());
        for (CanonicalObject root : roots) {
            visit(graph, root, marks, path, order);
        }
        return order;
    }

    /**
     * Hands every object to the emitter in dependency order.
     */
    public List<EmittedResource> synthesize(DependencyGraph graph, ResourceEmitter emitter)
            throws CyclicDependencyException {
        List<EmittedResource> emitted = new ArrayList<>();
        for (CanonicalObject object : emitOrder(graph)) {
            emitted.add(new EmittedResource(object, emitter.emit(object)));
        }
        log.info("Synthesized {} resource(s)", emitted.size());
        return emitted;
    }

    private void visit(DependencyGraph graph, CanonicalObject object, Map<ObjectKey, Mark> marks,
                       List<CanonicalObject> path, List<CanonicalObject> order) throws CyclicDependencyException {
        Mark mark = marks.get(object.getKey());
        if (mark == Mark.DONE) {
            return;
        }
        if (mark == Mark.IN_PROGRESS) {
            List<String> cycle = new ArrayList<>();
            for (CanonicalObject onPath : path.subList(path.indexOf(object), path.size())) {
                cycle.add(DependencyGraphBuilder.label(onPath));
            }
            cycle.add(DependencyGraphBuilder.label(object));
            throw new CyclicDependencyException(cycle);
        }

        marks.put(object.getKey(), Mark.IN_PROGRESS);
        path.add(object);
        List<CanonicalObject> dependencies = new ArrayList<>();
        for (ObjectKey key : graph.dependenciesOf(object.getKey())) {
            dependencies.add(graph.node(key));
        }
        dependencies.sort(EMISSION_ORDER);
        for (CanonicalObject dependency : dependencies) {
            visit(graph, dependency, marks, path, order);
        }
        path.remove(path.size() - 1);
        marks.put(object.getKey(), Mark.DONE);
        order.add(object);
    }
}
