package com.netmig.pan2tf.partition;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.resolve.ReferenceNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Deep-merges shared fragments into one {@code shared} section.
 * <p>
 * Named entries are merged by name and the later declaration replaces the earlier
 * one in place, the way lookups treat all shared fragments as a single frame. A stub
 * never replaces an authored entry. Members are merged by value, containers are
 * merged recursively. Inputs are not modified.
 */
@Slf4j
public class SharedSectionMerger {

    public static final String SHARED = "shared";

    public ConfigNode merge(List<ConfigNode> fragments) {
        ConfigNode merged = ConfigNode.element(SHARED);
        for (ConfigNode fragment : fragments) {
            mergeInto(merged, fragment, "");
        }
        return merged;
    }

    private void mergeInto(ConfigNode target, ConfigNode source, String path) {
        for (ConfigNode child : source.getChildren()) {
            if (child.isEntry() && child.getName() != null) {
                mergeEntry(target, child, path);
            } else if (child.isMember()) {
                boolean present = target.children(ConfigNode.MEMBER).stream()
                        .anyMatch(member -> member.getText() != null && member.getText().equals(child.getText()));
                if (!present) {
                    target.addChild(child.deepCopy());
                }
            } else {
                String childPath = path.isEmpty() ? child.getTag() : path + "/" + child.getTag();
                Optional<ConfigNode> existing = target.child(child.getTag());
                if (existing.isPresent()) {
                    mergeInto(existing.get(), child, childPath);
                } else {
                    target.addChild(child.deepCopy());
                }
            }
        }
    }

    private void mergeEntry(ConfigNode target, ConfigNode entry, String path) {
        Optional<ConfigNode> existing = target.entryNamed(entry.getName());
        if (existing.isEmpty()) {
            target.addChild(entry.deepCopy());
            return;
        }
        Optional<Category> category = Category.forPath(path);
        if (category.isPresent() && ReferenceNormalizer.isStub(entry, category.get())
                && !ReferenceNormalizer.isStub(existing.get(), category.get())) {
            log.debug("Shared {} '{}' stub ignored, an authored declaration was merged earlier",
                    category.get().getToken(), entry.getName());
            return;
        }
        log.debug("Shared {} '{}' replaced by a later fragment", path, entry.getName());
        target.replaceChild(existing.get(), entry.deepCopy());
    }
}
