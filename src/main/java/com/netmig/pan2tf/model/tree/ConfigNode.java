package com.netmig.pan2tf.model.tree;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One element of a loaded configuration export.
 * Keeps the element tag, its attributes in document order, its own text and its
 * children in source order. Named objects are {@code <entry name="...">} elements,
 * list values are {@code <member>} elements.
 */
@Getter
public class ConfigNode {

    public static final String ENTRY = "entry";
    public static final String MEMBER = "member";
    public static final String NAME_ATTRIBUTE = "name";
    public static final String WILDCARD = "*";

    private final String tag;
    private final Map<String, String> attributes;
    private final String text;
    private final int position;
    private final List<ConfigNode> children = new ArrayList<>();

    public ConfigNode(String tag, Map<String, String> attributes, String text, int position) {
        this.tag = tag;
        this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
        this.text = text;
        this.position = position;
    }

    public static ConfigNode element(String tag) {
        return new ConfigNode(tag, null, null, -1);
    }

    public static ConfigNode entry(String name) {
        return new ConfigNode(ENTRY, Map.of(NAME_ATTRIBUTE, name), null, -1);
    }

    public static ConfigNode leaf(String tag, String text) {
        return new ConfigNode(tag, null, text, -1);
    }

    public String getName() {
        return attributes.get(NAME_ATTRIBUTE);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public List<ConfigNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isEntry() {
        return ENTRY.equals(tag);
    }

    public boolean isMember() {
        return MEMBER.equals(tag);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public ConfigNode addChild(ConfigNode child) {
        children.add(child);
        return child;
    }

    /**
     * Puts a replacement at the position of an existing child.
     */
    public ConfigNode replaceChild(ConfigNode existing, ConfigNode replacement) {
        int index = children.indexOf(existing);
        if (index < 0) {
            throw new IllegalArgumentException(existing + " is not a child of " + this);
        }
        children.set(index, replacement);
        return replacement;
    }

    /**
     * Appends a child container and returns it, for building trees fluently.
     */
    public ConfigNode addElement(String childTag) {
        return addChild(element(childTag));
    }

    public List<ConfigNode> children(String childTag) {
        List<ConfigNode> result = new ArrayList<>();
        for (ConfigNode child : children) {
            if (childTag.equals(child.tag)) {
                result.add(child);
            }
        }
        return result;
    }

    public Optional<ConfigNode> child(String childTag) {
        for (ConfigNode child : children) {
            if (childTag.equals(child.tag)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public Optional<ConfigNode> entryNamed(String name) {
        ConfigNode found = null;
        for (ConfigNode child : children) {
            if (child.isEntry() && name.equals(child.getName())) {
                found = child;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Select descendants by a slash separated tag path, e.g. {@code "static/member"}.
     * A {@code "*"} segment matches any tag. Results keep document order.
     */
    public List<ConfigNode> select(String path) {
        List<ConfigNode> current = List.of(this);
        if (path == null || path.isEmpty()) {
            return current;
        }
        for (String segment : path.split("/")) {
            List<ConfigNode> next = new ArrayList<>();
            for (ConfigNode node : current) {
                for (ConfigNode child : node.children) {
                    if (WILDCARD.equals(segment) || segment.equals(child.tag)) {
                        next.add(child);
                    }
                }
            }
            if (next.isEmpty()) {
                return List.of();
            }
            current = next;
        }
        return current;
    }

    /**
     * Text of the first node at the given path, or null.
     */
    public String childText(String path) {
        List<ConfigNode> nodes = select(path);
        if (nodes.isEmpty() || !nodes.get(0).hasText()) {
            return null;
        }
        return nodes.get(0).getText().trim();
    }

    /**
     * Values found at a path: entry names for entries, trimmed text otherwise.
     * Blank values are skipped.
     */
    public List<String> values(String path) {
        List<String> values = new ArrayList<>();
        for (ConfigNode node : select(path)) {
            String value = node.isEntry() ? node.getName() : node.getText();
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    public ConfigNode deepCopy() {
        ConfigNode copy = new ConfigNode(tag, attributes, text, position);
        for (ConfigNode child : children) {
            copy.children.add(child.deepCopy());
        }
        return copy;
    }

    /**
     * Number of {@code entry} elements in this subtree, this node excluded.
     */
    public int countEntries() {
        int count = 0;
        for (ConfigNode child : children) {
            if (child.isEntry()) {
                count++;
            }
            count += child.countEntries();
        }
        return count;
    }

    @Override
    public String toString() {
        String name = getName();
        return name != null ? tag + "[" + name + "]" : tag;
    }
}
