package com.netmig.pan2tf.model.scope;

import com.netmig.pan2tf.model.tree.ConfigNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Index of every scope frame found in an export, Panorama or firewall.
 *
 * <pre>
 * config/shared                                           shared fragment(s)
 * config/devices/entry/device-group/entry                 device groups
 * config/readonly/devices/entry/device-group/entry        parent-dg hierarchy
 * config/devices/entry/template/entry/config/devices/entry        templates
 * config/devices/entry/template-stack/entry/config/devices/entry  template stacks
 * config/devices/entry/vsys/entry                         firewall vsys
 * config/devices/entry (with vsys or network)             firewall device
 * </pre>
 */
@Slf4j
public final class ScopeCatalog {

    private static final Set<String> NON_SHARED_CONTAINERS =
            Set.of("template", "template-stack", "device-group", "vsys", "readonly");

    private final ScopeFrame shared;
    private final Map<String, ScopeFrame> deviceGroups = new LinkedHashMap<>();
    private final Map<String, String> parents = new LinkedHashMap<>();
    private final Map<String, List<String>> groupDevices = new LinkedHashMap<>();
    private final Map<String, ScopeFrame> vsys = new LinkedHashMap<>();
    private final Map<String, ScopeFrame> vsysDevice = new LinkedHashMap<>();
    private final Map<String, ScopeFrame> devices = new LinkedHashMap<>();
    private final Map<String, ScopeFrame> templates = new LinkedHashMap<>();
    private final Map<String, ScopeFrame> templateStacks = new LinkedHashMap<>();
    private final Map<String, List<String>> stackTemplates = new LinkedHashMap<>();
    private final Map<String, List<String>> stackDevices = new LinkedHashMap<>();

    private ScopeCatalog(ScopeFrame shared) {
        this.shared = shared;
    }

    public static ScopeCatalog of(ConfigNode root) {
        List<ConfigNode> sharedBases = new ArrayList<>();
        collectShared(root, sharedBases);
        ScopeCatalog catalog = new ScopeCatalog(ScopeFrame.of(ScopeKind.SHARED, ScopeDomain.SHARED,
                ScopeFrame.SHARED_NAME, sharedBases, null));

        for (ConfigNode group : root.select("devices/entry/device-group/entry")) {
            String name = group.getName();
            if (name == null) {
                continue;
            }
            if (catalog.deviceGroups.containsKey(name)) {
                log.warn("Device group '{}' is declared more than once, keeping the last declaration", name);
            }
            catalog.deviceGroups.put(name, ScopeFrame.of(ScopeKind.DEVICE_GROUP_LOCAL,
                    ScopeDomain.DEVICE_GROUP, name, List.of(group), group));
            catalog.groupDevices.put(name, group.values("devices/entry"));
        }

        for (ConfigNode group : root.select("readonly/devices/entry/device-group/entry")) {
            String parent = group.childText("parent-dg");
            if (group.getName() != null && parent != null) {
                catalog.parents.put(group.getName(), parent);
            }
        }

        List<ConfigNode> firewallDevices = new ArrayList<>();
        for (ConfigNode device : root.select("devices/entry")) {
            if (device.child("vsys").isPresent() || device.child("network").isPresent()) {
                firewallDevices.add(device);
            }
        }
        boolean qualifyVsys = firewallDevices.size() > 1;
        for (ConfigNode device : firewallDevices) {
            String deviceName = device.getName() != null ? device.getName() : "localhost.localdomain";
            ScopeFrame deviceFrame = ScopeFrame.of(ScopeKind.TEMPLATE, ScopeDomain.DEVICE,
                    deviceName, List.of(device), device);
            catalog.devices.put(deviceName, deviceFrame);
            for (ConfigNode vsysEntry : device.select("vsys/entry")) {
                String name = qualifyVsys ? deviceName + "/" + vsysEntry.getName() : vsysEntry.getName();
                ScopeFrame frame = ScopeFrame.of(ScopeKind.DEVICE_GROUP_LOCAL, ScopeDomain.VSYS,
                        name, List.of(vsysEntry), vsysEntry);
                catalog.vsys.put(name, frame);
                catalog.vsysDevice.put(name, deviceFrame);
            }
        }

        for (ConfigNode template : root.select("devices/entry/template/entry")) {
            if (template.getName() != null) {
                catalog.templates.put(template.getName(), ScopeFrame.of(ScopeKind.TEMPLATE,
                        ScopeDomain.TEMPLATE, template.getName(), template.select("config/devices/entry"), template));
            }
        }

        for (ConfigNode stack : root.select("devices/entry/template-stack/entry")) {
            String name = stack.getName();
            if (name == null) {
                continue;
            }
            catalog.templateStacks.put(name, ScopeFrame.of(ScopeKind.TEMPLATE_STACK,
                    ScopeDomain.TEMPLATE_STACK, name, stack.select("config/devices/entry"), stack));
            catalog.stackTemplates.put(name, stack.values("templates/member"));
            catalog.stackDevices.put(name, stack.values("devices/entry"));
        }

        log.debug("Scope catalog: {} shared fragment(s), {} device group(s), {} vsys, {} template(s), {} stack(s)",
                sharedBases.size(), catalog.deviceGroups.size(), catalog.vsys.size(),
                catalog.templates.size(), catalog.templateStacks.size());
        return catalog;
    }

    private static void collectShared(ConfigNode node, List<ConfigNode> found) {
        for (ConfigNode child : node.getChildren()) {
            if ("shared".equals(child.getTag())) {
                found.add(child);
            } else if (!NON_SHARED_CONTAINERS.contains(child.getTag())) {
                collectShared(child, found);
            }
        }
    }

    public ScopeFrame getShared() {
        return shared;
    }

    public Map<String, ScopeFrame> getDeviceGroups() {
        return Collections.unmodifiableMap(deviceGroups);
    }

    public Optional<ScopeFrame> deviceGroup(String name) {
        return Optional.ofNullable(deviceGroups.get(name));
    }

    public Optional<String> parentOf(String group) {
        return Optional.ofNullable(parents.get(group));
    }

    /**
     * Ancestor device groups of a group, nearest first. Parents that are not
     * declared in the export and loops in the hierarchy end the walk.
     */
    public List<String> ancestorsOf(String group) {
        List<String> ancestors = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        seen.add(group);
        String current = parents.get(group);
        while (current != null) {
            if (!seen.add(current)) {
                log.warn("Device group hierarchy loops at '{}' while walking up from '{}'", current, group);
                break;
            }
            if (!deviceGroups.containsKey(current)) {
                log.warn("Parent device group '{}' of '{}' is not declared in the export", current, group);
                break;
            }
            ancestors.add(current);
            current = parents.get(current);
        }
        return ancestors;
    }

    public List<String> devicesOf(String group) {
        return groupDevices.getOrDefault(group, List.of());
    }

    public Map<String, ScopeFrame> getVsys() {
        return Collections.unmodifiableMap(vsys);
    }

    public ScopeFrame deviceOfVsys(String vsysName) {
        return vsysDevice.get(vsysName);
    }

    public Map<String, ScopeFrame> getDevices() {
        return Collections.unmodifiableMap(devices);
    }

    public Map<String, ScopeFrame> getTemplates() {
        return Collections.unmodifiableMap(templates);
    }

    public Optional<ScopeFrame> template(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    public Map<String, ScopeFrame> getTemplateStacks() {
        return Collections.unmodifiableMap(templateStacks);
    }

    public List<String> templatesOfStack(String stack) {
        return stackTemplates.getOrDefault(stack, List.of());
    }

    public List<String> devicesOfStack(String stack) {
        return stackDevices.getOrDefault(stack, List.of());
    }

    /**
     * Every frame in traversal order: shared, device groups in declared order,
     * vsys, firewall devices, templates, template stacks.
     */
    public List<ScopeFrame> allFrames() {
        List<ScopeFrame> frames = new ArrayList<>();
        frames.add(shared);
        frames.addAll(deviceGroups.values());
        frames.addAll(vsys.values());
        frames.addAll(devices.values());
        frames.addAll(templates.values());
        frames.addAll(templateStacks.values());
        return frames;
    }
}
