package com.netmig.pan2tf.synth;

import com.netmig.pan2tf.exception.CyclicDependencyException;
import com.netmig.pan2tf.model.CanonicalObject;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dependency graph construction and emission order
 */
class SynthesizerTest {

    private static CanonicalObject object(Category category, String name, int ordinal, CanonicalObject... deps) {
        CanonicalObject.CanonicalObjectBuilder builder = CanonicalObject.builder()
                .key(new ObjectKey(category, name))
                .identifier(name)
                .name(name)
                .fields(Map.of())
                .ordinal(ordinal);
        for (CanonicalObject dep : deps) {
            builder.dependency(dep.getKey());
        }
        return builder.build();
    }

    private static List<String> identifiers(List<CanonicalObject> objects) {
        return objects.stream().map(CanonicalObject::getIdentifier).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Referents come before referrers whatever their ordinal")
    void testDependenciesFirst() throws Exception {
        CanonicalObject tag = object(Category.TAG, "t", 5);
        CanonicalObject address = object(Category.ADDRESS, "a", 9, tag);
        CanonicalObject group = object(Category.ADDRESS_GROUP, "g", 0, address);
        CanonicalObject rule = object(Category.SECURITY_RULE, "r", 1, group);

        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(rule, group, address, tag));
        List<CanonicalObject> order = new Synthesizer().emitOrder(graph);

        assertEquals(List.of("t", "a", "g", "r"), identifiers(order));
        assertEquals(3, graph.getEdges().size());
    }

    @Test
    @DisplayName("Independent objects follow category priority, then first-seen order")
    void testPriorityThenOrdinal() throws Exception {
        CanonicalObject rule = object(Category.SECURITY_RULE, "r", 0);
        CanonicalObject second = object(Category.ADDRESS, "a2", 2);
        CanonicalObject first = object(Category.ADDRESS, "a1", 1);
        CanonicalObject zone = object(Category.ZONE, "z", 3);

        List<CanonicalObject> order = new Synthesizer().emitOrder(
                new DependencyGraphBuilder().build(List.of(rule, second, zone, first)));

        assertEquals(List.of("a1", "a2", "z", "r"), identifiers(order));
    }

    @Test
    @DisplayName("Order is identical for identical input")
    void testDeterministic() throws Exception {
        CanonicalObject a = object(Category.ADDRESS, "a", 0);
        CanonicalObject b = object(Category.ADDRESS, "b", 1);
        CanonicalObject g = object(Category.ADDRESS_GROUP, "g", 2, b, a);

        List<String> first = identifiers(new Synthesizer().emitOrder(new DependencyGraphBuilder().build(List.of(g, a, b))));
        List<String> second = identifiers(new Synthesizer().emitOrder(new DependencyGraphBuilder().build(List.of(g, a, b))));

        assertEquals(first, second);
        assertEquals(List.of("a", "b", "g"), first);
    }

    @Test
    @DisplayName("A cycle is reported with its full path")
    void testCycle() throws Exception {
        ObjectKey aKey = new ObjectKey(Category.ADDRESS_GROUP, "a");
        ObjectKey bKey = new ObjectKey(Category.ADDRESS_GROUP, "b");
        CanonicalObject a = CanonicalObject.builder().key(aKey).identifier("a").name("a")
                .fields(Map.of()).ordinal(0).dependency(bKey).build();
        CanonicalObject b = CanonicalObject.builder().key(bKey).identifier("b").name("b")
                .fields(Map.of()).ordinal(1).dependency(aKey).build();
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(a, b));

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class,
                () -> new Synthesizer().emitOrder(graph));
        assertEquals(List.of("address_group 'a'", "address_group 'b'", "address_group 'a'"), e.getCyclePath());
    }

    @Test
    @DisplayName("Self dependency is rejected while building the graph")
    void testSelfDependency() {
        ObjectKey key = new ObjectKey(Category.ADDRESS_GROUP, "self");
        CanonicalObject self = CanonicalObject.builder().key(key).identifier("self").name("self")
                .fields(Map.of()).ordinal(0).dependency(key).build();

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class,
                () -> new DependencyGraphBuilder().build(List.of(self)));
        assertEquals(2, e.getCyclePath().size());
    }

    @Test
    @DisplayName("Dependency outside the graph is a programming error")
    void testMissingDependency() {
        CanonicalObject orphan = object(Category.ADDRESS_GROUP, "g", 0, object(Category.ADDRESS, "gone", 1));

        assertThrows(IllegalStateException.class, () -> new DependencyGraphBuilder().build(List.of(orphan)));
    }

    @Test
    @DisplayName("Emitter sees objects in emission order")
    void testSynthesize() throws Exception {
        CanonicalObject a = object(Category.ADDRESS, "a", 1);
        CanonicalObject g = object(Category.ADDRESS_GROUP, "g", 0, a);

        List<EmittedResource> emitted = new Synthesizer().synthesize(
                new DependencyGraphBuilder().build(List.of(g, a)), object -> "# " + object.getIdentifier());

        assertEquals(2, emitted.size());
        assertEquals("# a", emitted.get(0).getText());
        assertSame(g, emitted.get(1).getObject());
    }
}
