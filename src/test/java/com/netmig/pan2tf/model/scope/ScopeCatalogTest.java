package com.netmig.pan2tf.model.scope;

import com.netmig.pan2tf.loader.TreeLoader;
import com.netmig.pan2tf.model.tree.ConfigTree;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeCatalogTest {

    private static final String HIERARCHY = "<config>"
            + "<devices><entry name=\"localhost.localdomain\"><device-group>"
            + "<entry name=\"Region\"/><entry name=\"Site\"/><entry name=\"Floor\"/>"
            + "</device-group></entry></devices>"
            + "<readonly><devices><entry name=\"localhost.localdomain\"><device-group>"
            + "<entry name=\"Site\"><parent-dg>Region</parent-dg></entry>"
            + "<entry name=\"Floor\"><parent-dg>Site</parent-dg></entry>"
            + "</device-group></entry></devices></readonly>"
            + "</config>";

    @Test
    @DisplayName("Ancestors are listed nearest first")
    void testAncestorsNearestFirst() throws Exception {
        ScopeCatalog catalog = new TreeLoader().parse(HIERARCHY).getCatalog();

        assertEquals(List.of("Site", "Region"), catalog.ancestorsOf("Floor"));
        assertEquals(List.of(), catalog.ancestorsOf("Region"));
    }

    @Test
    @DisplayName("A loop in the parent hierarchy ends the walk")
    void testHierarchyLoop() throws Exception {
        ScopeCatalog catalog = new TreeLoader().parse("<config>"
                + "<devices><entry name=\"localhost.localdomain\"><device-group>"
                + "<entry name=\"A\"/><entry name=\"B\"/>"
                + "</device-group></entry></devices>"
                + "<readonly><devices><entry name=\"localhost.localdomain\"><device-group>"
                + "<entry name=\"A\"><parent-dg>B</parent-dg></entry>"
                + "<entry name=\"B\"><parent-dg>A</parent-dg></entry>"
                + "</device-group></entry></devices></readonly>"
                + "</config>").getCatalog();

        assertEquals(List.of("B"), catalog.ancestorsOf("A"));
    }

    @Test
    @DisplayName("Firewall export yields vsys and device frames")
    void testFirewallFrames() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config><devices><entry name=\"localhost.localdomain\">"
                + "<network/><vsys><entry name=\"vsys1\"/><entry name=\"vsys2\"/></vsys>"
                + "</entry></devices></config>");
        ScopeCatalog catalog = tree.getCatalog();

        assertEquals(List.of("vsys1", "vsys2"), List.copyOf(catalog.getVsys().keySet()));
        assertEquals("localhost.localdomain", catalog.deviceOfVsys("vsys1").getName());
        assertTrue(catalog.getDeviceGroups().isEmpty());
        assertEquals(ScopeDomain.SHARED, catalog.allFrames().get(0).getDomain(), "Shared should come first");
    }

    @Test
    @DisplayName("Shared fragments outside scope containers are all collected")
    void testSharedFragments() throws Exception {
        ConfigTree tree = new TreeLoader().parse("<config><shared><tag/></shared>"
                + "<devices><entry name=\"localhost.localdomain\"><shared><address/></shared>"
                + "<template><entry name=\"T\"><config><shared><service/></shared></config></entry></template>"
                + "</entry></devices></config>");

        assertEquals(2, tree.getCatalog().getShared().getBases().size(),
                "Template-local shared sections are not global shared fragments");
    }
}
