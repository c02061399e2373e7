package com.netmig.pan2tf.dedup;

import com.netmig.pan2tf.exception.CyclicDependencyException;
import com.netmig.pan2tf.loader.TreeLoader;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.ObjectKey;
import com.netmig.pan2tf.model.ObjectRef;
import com.netmig.pan2tf.model.ReferenceKind;
import com.netmig.pan2tf.model.ResolvedReference;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.resolve.DeclarationCollector;
import com.netmig.pan2tf.resolve.DeclarationSet;
import com.netmig.pan2tf.resolve.ReferenceResolver;
import com.netmig.pan2tf.resolve.ScopeChainFactory;
import com.netmig.pan2tf.resolve.ScopeResolver;
import com.netmig.pan2tf.resolve.TemplateMatcher;
import org.junit.jupiter.api.*;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural deduplication of declarations across scopes
 */
class DeduplicatorTest {

    private static final String BRANCH = "device-group:DG-Branch";
    private static final String CAMPUS = "device-group:DG-Campus";

    private static DedupResult canonicalize(ConfigTree tree) throws CyclicDependencyException {
        ScopeResolver resolver = new ScopeResolver(tree);
        ScopeChainFactory chains = new ScopeChainFactory(tree.getCatalog(), new TemplateMatcher(List.of("DG-")));
        DeclarationSet declarations = new DeclarationCollector(resolver, chains, Set.of()).collect();
        return new Deduplicator(new ReferenceResolver(resolver, declarations, Set.of())).canonicalize(declarations);
    }

    private ConfigTree loadFixture() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/panorama.xml")) {
            return new TreeLoader().load(in);
        }
    }

    private static String twoGroups(String branchService, String campusService) {
        return "<config><devices><entry name=\"localhost.localdomain\"><device-group>"
                + "<entry name=\"DG-Branch\"><service>" + branchService + "</service></entry>"
                + "<entry name=\"DG-Campus\"><service>" + campusService + "</service></entry>"
                + "</device-group></entry></devices></config>";
    }

    @Test
    @DisplayName("Identical objects in two device groups share one key")
    void testIdenticalObjectsMerge() throws Exception {
        DedupResult result = canonicalize(loadFixture());
        ObjectRef svcWeb = new ObjectRef(Category.SERVICE, "svc-web");

        ObjectKey branch = result.keyOf(BRANCH, svcWeb).orElseThrow();
        ObjectKey campus = result.keyOf(CAMPUS, svcWeb).orElseThrow();
        assertEquals(branch, campus, "svc-web should be deduplicated");

        ObjectDefinition definition = result.getDefinitions().get(branch);
        assertEquals(2, definition.getDeclarations().size());
        assertEquals(1, result.getDefinitions().values().stream()
                .filter(d -> d.getKey().getCategory() == Category.SERVICE && "svc-web".equals(d.getName()))
                .count());
    }

    @Test
    @DisplayName("Stub declarations map to the key of their authored declaration")
    void testStubAliasMapping() throws Exception {
        DedupResult result = canonicalize(loadFixture());
        ObjectRef addrA = new ObjectRef(Category.ADDRESS, "addr-A");

        assertEquals(result.keyOf("shared:shared", addrA), result.keyOf(BRANCH, addrA));
        assertEquals(1, result.getDefinitions().values().stream()
                .filter(d -> "addr-A".equals(d.getName()))
                .count(), "The stub should not become an object of its own");
    }

    @Test
    @DisplayName("Group references carry the key of their members")
    void testReferencesCarryTargetKeys() throws Exception {
        DedupResult result = canonicalize(loadFixture());
        ObjectDefinition group = result.definitionOf(BRANCH, new ObjectRef(Category.ADDRESS_GROUP, "grp-1"))
                .orElseThrow();

        List<ResolvedReference> members = new ArrayList<>();
        for (ResolvedReference reference : group.getReferences()) {
            if ("static".equals(reference.getFieldPath())) {
                members.add(reference);
            }
        }
        assertEquals(2, members.size());
        assertEquals(ReferenceKind.LINKED, members.get(0).getKind());
        assertEquals(result.keyOf("shared:shared", new ObjectRef(Category.ADDRESS, "addr-A")).orElseThrow(),
                members.get(0).getTargetKey());
    }

    @Test
    @DisplayName("Canonicalisation is idempotent")
    void testIdempotent() throws Exception {
        DedupResult first = canonicalize(loadFixture());
        DedupResult second = canonicalize(loadFixture());

        assertEquals(first.getMapping(), second.getMapping());
        assertEquals(List.copyOf(first.getDefinitions().keySet()), List.copyOf(second.getDefinitions().keySet()));
    }

    @Test
    @DisplayName("Description and member order do not split identical objects")
    void testMetadataAndOrderIgnored() throws Exception {
        DedupResult result = canonicalize(new TreeLoader().parse(twoGroups(
                "<entry name=\"s\"><description>one</description><protocol><tcp><port>80</port></tcp></protocol>"
                        + "</entry>",
                "<entry name=\"s\"><protocol><tcp><port>80</port></tcp></protocol>"
                        + "<description>two</description></entry>")));

        assertEquals(1, result.getDefinitions().size());
    }

    @Test
    @DisplayName("Different content keeps objects apart")
    void testDifferentContentKeptApart() throws Exception {
        DedupResult result = canonicalize(new TreeLoader().parse(twoGroups(
                "<entry name=\"s\"><protocol><tcp><port>80</port></tcp></protocol></entry>",
                "<entry name=\"s\"><protocol><tcp><port>8080</port></tcp></protocol></entry>")));

        assertEquals(2, result.getDefinitions().size());
        assertNotEquals(result.keyOf(BRANCH, new ObjectRef(Category.SERVICE, "s")),
                result.keyOf(CAMPUS, new ObjectRef(Category.SERVICE, "s")));
    }

    @Test
    @DisplayName("Groups referencing each other are a cycle")
    void testGroupCycle() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config><shared><address-group>"
                + "<entry name=\"g1\"><static><member>g2</member></static></entry>"
                + "<entry name=\"g2\"><static><member>g1</member></static></entry>"
                + "</address-group></shared></config>");

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class, () -> canonicalize(tree));
        assertEquals(List.of("address_group 'g1'", "address_group 'g2'", "address_group 'g1'"), e.getCyclePath());
    }

    @Test
    @DisplayName("A group containing itself is a cycle")
    void testSelfReference() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config><shared><address-group>"
                + "<entry name=\"loop\"><static><member>loop</member></static></entry>"
                + "</address-group></shared></config>");

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class, () -> canonicalize(tree));
        assertEquals(List.of("address_group 'loop'", "address_group 'loop'"), e.getCyclePath());
    }

    @Test
    @DisplayName("Declarations with unresolved references are omitted, and so are their dependents")
    void testIncompleteDeclarationsOmitted() throws Exception {
        DedupResult result = canonicalize(new TreeLoader().parse("<config><shared><address-group>"
                + "<entry name=\"inner\"><static><member>missing</member></static></entry>"
                + "<entry name=\"outer\"><static><member>inner</member></static></entry>"
                + "</address-group></shared></config>"));

        assertEquals(1, result.getUnresolved().size(), "Only the missing member is reported");
        assertEquals("missing", result.getUnresolved().get(0).getMissingName());
        assertEquals(2, result.getOmitted().size());
        assertTrue(result.getDefinitions().isEmpty());
    }
}
