package com.netmig.pan2tf.partition;

import com.netmig.pan2tf.config.ConversionConfig;
import com.netmig.pan2tf.loader.TreeLoader;
import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.pipeline.ConversionPipeline;
import com.netmig.pan2tf.pipeline.ConversionResult;
import org.junit.jupiter.api.*;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Splitting a Panorama export per device group
 */
class DeviceGroupPartitionerTest {

    private final DeviceGroupPartitioner partitioner = new DeviceGroupPartitioner(List.of("DG-", "dg-"), "10.0.0");

    private ConfigTree loadFixture() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/panorama.xml")) {
            return new TreeLoader().load(in);
        }
    }

    @Test
    @DisplayName("One partition per device group with its template side")
    void testPartitionsFromFixture() throws Exception {
        Map<String, Partition> partitions = partitioner.partition(loadFixture());

        assertEquals(List.of("DG-Branch", "DG-Campus"), List.copyOf(partitions.keySet()));

        Partition branch = partitions.get("DG-Branch");
        assertEquals(List.of("Branch"), branch.getTemplates());
        assertTrue(branch.getTemplateStacks().isEmpty());
        assertFalse(branch.hasWarnings());
        assertEquals(List.of("DG-Branch"), List.copyOf(branch.getTree().getCatalog().getDeviceGroups().keySet()));
        assertEquals("10.1.0", branch.getTree().getRoot().getAttribute("version"),
                "The source version should be carried over");

        Partition campus = partitions.get("DG-Campus");
        assertEquals(List.of("Campus-Stack"), campus.getTemplateStacks());
        assertEquals(List.of("Branch"), campus.getTemplates());
    }

    @Test
    @DisplayName("Each partition converts on its own without unresolved references")
    void testPartitionConvertsStandalone() throws Exception {
        Map<String, Partition> partitions = partitioner.partition(loadFixture());
        ConversionPipeline pipeline = new ConversionPipeline(new ConversionConfig());

        for (Partition partition : partitions.values()) {
            ConversionResult result = pipeline.convert(partition.getTree());
            assertFalse(result.hasUnresolved(), partition.getGroupName() + " should be self-contained");
            assertTrue(result.find(Category.ADDRESS, "dns-server").isPresent(), "Shared objects are included");
            assertTrue(result.find(Category.ZONE, "trust").isPresent(), "Template zones are included");
        }
    }

    @Test
    @DisplayName("A group matching both a stack and a template keeps both")
    void testStackAndMatchedTemplate() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config><devices><entry name=\"localhost.localdomain\">"
                + "<device-group><entry name=\"DG-HQ\"><devices><entry name=\"0009\"/></devices></entry>"
                + "</device-group>"
                + "<template><entry name=\"Common\"/><entry name=\"HQ\"/></template>"
                + "<template-stack><entry name=\"S\"><templates><member>Common</member></templates>"
                + "<devices><entry name=\"0009\"/></devices></entry></template-stack>"
                + "</entry></devices></config>");

        Partition hq = partitioner.partition(tree).get("DG-HQ");

        assertEquals(List.of("S"), hq.getTemplateStacks());
        assertEquals(List.of("Common", "HQ"), hq.getTemplates());
        assertEquals(List.of("Common", "HQ"), List.copyOf(hq.getTree().getCatalog().getTemplates().keySet()),
                "The group's own template should be written into the partition");
    }

    @Test
    @DisplayName("Ancestors and their parent-dg hierarchy are carried along")
    void testAncestorsCarried() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config>"
                + "<devices><entry name=\"localhost.localdomain\"><device-group>"
                + "<entry name=\"Parent\"/><entry name=\"Child\"/>"
                + "</device-group></entry></devices>"
                + "<readonly><devices><entry name=\"localhost.localdomain\"><device-group>"
                + "<entry name=\"Child\"><parent-dg>Parent</parent-dg></entry>"
                + "</device-group></entry></devices></readonly>"
                + "</config>");

        Map<String, Partition> partitions = partitioner.partition(tree);

        ConfigTree child = partitions.get("Child").getTree();
        assertEquals(List.of("Child", "Parent"), List.copyOf(child.getCatalog().getDeviceGroups().keySet()));
        assertEquals(List.of("Parent"), child.getCatalog().ancestorsOf("Child"));
        assertEquals("10.0.0", child.getRoot().getAttribute("version"), "Default version when the source has none");

        ConfigTree parent = partitions.get("Parent").getTree();
        assertEquals(List.of("Parent"), List.copyOf(parent.getCatalog().getDeviceGroups().keySet()));
        assertTrue(parent.getRoot().child("readonly").isEmpty());
    }

    @Test
    @DisplayName("Missing template is reported as a warning")
    void testNoTemplateWarning() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config><devices><entry name=\"localhost.localdomain\">"
                + "<device-group><entry name=\"DG-Orphan\"/></device-group>"
                + "<template><entry name=\"HQ\"/></template>"
                + "</entry></devices></config>");

        Partition orphan = partitioner.partition(tree).get("DG-Orphan");

        assertTrue(orphan.hasWarnings());
        assertTrue(orphan.getWarnings().get(0).contains("DG-Orphan"));
        assertTrue(orphan.getTemplates().isEmpty());
    }

    @Test
    @DisplayName("Shared fragments are merged into one shared section")
    void testSharedMerged() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config>"
                + "<shared><address><entry name=\"a\"><fqdn>a.example.com</fqdn></entry></address></shared>"
                + "<devices><entry name=\"localhost.localdomain\">"
                + "<shared><address><entry name=\"b\"><fqdn>b.example.com</fqdn></entry></address></shared>"
                + "<device-group><entry name=\"G\"/></device-group>"
                + "</entry></devices></config>");

        ConfigTree partition = partitioner.partition(tree).get("G").getTree();

        assertEquals(1, partition.getCatalog().getShared().getBases().size());
        assertEquals(List.of("a", "b"), partition.getRoot().values("shared/address/entry"));
    }

    @Test
    @DisplayName("File names replace separators and spaces")
    void testSafeFileName() {
        assertEquals("DG_Branch_1.xml", DeviceGroupPartitioner.safeFileName("DG Branch/1"));
        assertEquals("a_b.xml", DeviceGroupPartitioner.safeFileName("a\\b"));
    }
}
