package com.netmig.pan2tf.partition;

import com.netmig.pan2tf.model.scope.ScopeCatalog;
import com.netmig.pan2tf.model.scope.ScopeDomain;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.resolve.ScopeChainFactory;
import com.netmig.pan2tf.resolve.TemplateMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a Panorama export into one self-contained export per device group.
 * <p>
 * A partition holds the group with its ancestors and their parent-dg hierarchy,
 * every shared fragment merged into a single shared section, and the template
 * side the group uses: matching template stacks with their templates, and the
 * name-matched template. Each partition converts on its own.
 */
@Slf4j
public class DeviceGroupPartitioner {

    private static final String LOCALHOST = "localhost.localdomain";
    private static final String VERSION = "version";

    private final List<String> templatePrefixes;
    private final String defaultVersion;
    private final SharedSectionMerger merger = new SharedSectionMerger();

    public DeviceGroupPartitioner(List<String> templatePrefixes, String defaultVersion) {
        this.templatePrefixes = templatePrefixes;
        this.defaultVersion = defaultVersion;
    }

    public Map<String, Partition> partition(ConfigTree tree) {
        ScopeCatalog catalog = tree.getCatalog();
        ScopeChainFactory chains = new ScopeChainFactory(catalog, new TemplateMatcher(templatePrefixes));
        ConfigNode shared = merger.merge(catalog.getShared().getBases());
        String version = tree.getRoot().getAttribute(VERSION) != null
                ? tree.getRoot().getAttribute(VERSION) : defaultVersion;

        Map<String, Partition> partitions = new LinkedHashMap<>();
        for (String group : catalog.getDeviceGroups().keySet()) {
            partitions.put(group, build(catalog, chains, group, shared, version));
        }
        log.info("Partitioned export into {} device group(s) from {} shared fragment(s)",
                partitions.size(), catalog.getShared().getBases().size());
        return partitions;
    }

    private Partition build(ScopeCatalog catalog, ScopeChainFactory chains, String group,
                            ConfigNode shared, String version) {
        List<String> warnings = new ArrayList<>();
        ConfigNode root = new ConfigNode(ConfigTree.ROOT_TAG, Map.of(VERSION, version), null, -1);
        ConfigNode localhost = root.addElement("devices").addChild(ConfigNode.entry(LOCALHOST));

        List<String> lineage = new ArrayList<>();
        lineage.add(group);
        lineage.addAll(catalog.ancestorsOf(group));
        ConfigNode groups = localhost.addElement("device-group");
        for (String name : lineage) {
            groups.addChild(catalog.getDeviceGroups().get(name).getOrigin().deepCopy());
        }

        List<String> templates = new ArrayList<>();
        List<String> stacks = new ArrayList<>();
        ConfigNode templateContainer = null;
        ConfigNode stackContainer = null;
        for (ScopeFrame frame : chains.templateFramesFor(group)) {
            if (frame.getDomain() == ScopeDomain.TEMPLATE_STACK) {
                if (stackContainer == null) {
                    stackContainer = localhost.addElement("template-stack");
                }
                stackContainer.addChild(frame.getOrigin().deepCopy());
                stacks.add(frame.getName());
            } else {
                if (templateContainer == null) {
                    templateContainer = localhost.addElement("template");
                }
                templateContainer.addChild(frame.getOrigin().deepCopy());
                templates.add(frame.getName());
            }
        }
        if (templates.isEmpty() && stacks.isEmpty()) {
            String warning = "No template or template stack matches device group '" + group + "'";
            log.warn(warning);
            warnings.add(warning);
        }

        root.addChild(shared.deepCopy());

        if (lineage.size() > 1) {
            ConfigNode readonlyGroups = root.addElement("readonly").addElement("devices")
                    .addChild(ConfigNode.entry(LOCALHOST)).addElement("device-group");
            for (String name : lineage) {
                catalog.parentOf(name).ifPresent(parent -> readonlyGroups.addChild(ConfigNode.entry(name))
                        .addChild(ConfigNode.leaf("parent-dg", parent)));
            }
        }

        log.debug("Partition '{}': {} group(s), templates {}, stacks {}", group, lineage.size(), templates, stacks);
        return new Partition(group, new ConfigTree(root), templates, stacks, warnings);
    }

    /**
     * File name for a partition, with path separators and spaces replaced.
     */
    public static String safeFileName(String group) {
        return group.replace('/', '_').replace('\\', '_').replace(' ', '_') + ".xml";
    }
}
