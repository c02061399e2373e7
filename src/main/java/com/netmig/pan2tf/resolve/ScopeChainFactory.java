package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.scope.ScopeCatalog;
import com.netmig.pan2tf.model.scope.ScopeChain;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.scope.ScopeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the precedence chain that applies to declarations of each scope.
 *
 * <pre>
 * shared          [shared]
 * device group    [group, ancestors nearest first, stacks each followed by its templates,
 *                  the name-matched template, shared]
 * vsys            [vsys, device, shared]
 * template        [template, shared]
 * template stack  [stack, its templates, shared]
 * </pre>
 */
@Slf4j
public class ScopeChainFactory {

    private final ScopeCatalog catalog;
    private final TemplateMatcher templateMatcher;
    private final Map<String, ScopeChain> chains = new HashMap<>();

    public ScopeChainFactory(ScopeCatalog catalog, TemplateMatcher templateMatcher) {
        this.catalog = catalog;
        this.templateMatcher = templateMatcher;
    }

    /**
     * Chain seen by the declarations of a frame. Chains are built once per frame.
     */
    public ScopeChain chainFor(ScopeFrame frame) {
        return chains.computeIfAbsent(frame.getId(), id -> build(frame));
    }

    private ScopeChain build(ScopeFrame frame) {
        List<ScopeFrame> frames = new ArrayList<>();
        frames.add(frame);
        switch (frame.getDomain()) {
            case DEVICE_GROUP:
                for (String ancestor : catalog.ancestorsOf(frame.getName())) {
                    frames.add(catalog.getDeviceGroups().get(ancestor).as(ScopeKind.DEVICE_GROUP_ANCESTOR));
                }
                frames.addAll(templateFramesFor(frame.getName()));
                break;
            case VSYS:
                ScopeFrame device = catalog.deviceOfVsys(frame.getName());
                if (device != null) {
                    frames.add(device);
                }
                break;
            case TEMPLATE_STACK:
                frames.addAll(stackTemplates(frame.getName()));
                break;
            default:
                break;
        }
        if (frame != catalog.getShared()) {
            frames.add(catalog.getShared());
        }
        ScopeChain chain = new ScopeChain(frames);
        log.debug("Scope chain for {}: {}", frame, chain);
        return chain;
    }

    /**
     * Template-side frames of a device group: every matching stack followed by
     * its templates, then the name-matched template unless a stack already holds it.
     */
    public List<ScopeFrame> templateFramesFor(String groupName) {
        List<ScopeFrame> frames = new ArrayList<>();
        for (String stack : matchingStacks(groupName)) {
            frames.add(catalog.getTemplateStacks().get(stack));
            for (ScopeFrame template : stackTemplates(stack)) {
                if (!frames.contains(template)) {
                    frames.add(template);
                }
            }
        }
        matchedTemplate(groupName)
                .flatMap(catalog::template)
                .filter(template -> !frames.contains(template))
                .ifPresent(frames::add);
        return frames;
    }

    /**
     * Name of the template a device group maps to by naming convention.
     */
    public Optional<String> matchedTemplate(String groupName) {
        return templateMatcher.match(groupName, catalog.getTemplates().keySet());
    }

    /**
     * Stacks pushed to the same devices as the group, or listing the group's name among their devices.
     */
    public List<String> matchingStacks(String groupName) {
        List<String> groupDevices = catalog.devicesOf(groupName);
        List<String> matches = new ArrayList<>();
        for (String stack : catalog.getTemplateStacks().keySet()) {
            List<String> stackDevices = catalog.devicesOfStack(stack);
            if (stackDevices.contains(groupName) || !Collections.disjoint(stackDevices, groupDevices)) {
                matches.add(stack);
            }
        }
        return matches;
    }

    private List<ScopeFrame> stackTemplates(String stack) {
        List<ScopeFrame> frames = new ArrayList<>();
        for (String name : catalog.templatesOfStack(stack)) {
            ScopeFrame template = catalog.getTemplates().get(name);
            if (template == null) {
                log.warn("Template stack '{}' lists template '{}' which is not declared", stack, name);
                continue;
            }
            frames.add(template);
        }
        return frames;
    }
}
