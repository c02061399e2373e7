package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.tree.ConfigNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a declaration node into plain content fields.
 * <ul>
 *   <li>text element: String</li>
 *   <li>member list: List of String</li>
 *   <li>entry list: List of names, or List of Map when entries carry content</li>
 *   <li>container: nested Map</li>
 *   <li>empty element: empty Map (a flag)</li>
 * </ul>
 * Identity markers and XML attributes are dropped. Rules get a {@code rulebase}
 * field telling pre, post and local rules apart.
 */
public final class FieldExtractor {

    public static final String NAME = "name";
    public static final String RULEBASE = "rulebase";

    private FieldExtractor() {
    }

    public static Map<String, Object> extract(Declaration declaration) {
        Map<String, Object> fields = fieldsOf(declaration.getNode());
        if (declaration.getCategory().isRule()) {
            fields.put(RULEBASE, Category.rulebaseOf(declaration.getPlacement().getPath()));
        }
        return fields;
    }

    static Map<String, Object> fieldsOf(ConfigNode node) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (ConfigNode child : node.getChildren()) {
            if (ReferenceNormalizer.IDENTITY_MARKERS.contains(child.getTag())) {
                continue;
            }
            fields.put(child.getTag(), valueOf(child));
        }
        return fields;
    }

    private static Object valueOf(ConfigNode node) {
        if (!node.hasChildren()) {
            return node.getText() != null ? node.getText() : new LinkedHashMap<String, Object>();
        }
        if (node.getChildren().stream().allMatch(ConfigNode::isMember)) {
            List<String> members = new ArrayList<>();
            for (ConfigNode member : node.getChildren()) {
                if (member.hasText()) {
                    members.add(member.getText().trim());
                }
            }
            return members;
        }
        if (node.getChildren().stream().allMatch(ConfigNode::isEntry)) {
            boolean namesOnly = node.getChildren().stream().noneMatch(ConfigNode::hasChildren);
            List<Object> entries = new ArrayList<>();
            for (ConfigNode entry : node.getChildren()) {
                if (namesOnly) {
                    entries.add(entry.getName());
                } else {
                    Map<String, Object> entryFields = new LinkedHashMap<>();
                    entryFields.put(NAME, entry.getName());
                    entryFields.putAll(fieldsOf(entry));
                    entries.add(entryFields);
                }
            }
            return entries;
        }
        return fieldsOf(node);
    }
}
