package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.tree.ConfigTree;
import com.netmig.pan2tf.model.tree.Placement;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name tables of one scope frame, split into authored declarations and stubs.
 * A name declared twice keeps its first position and its last authored node.
 * A name with any authored declaration in the frame is never a stub.
 */
@Slf4j
public final class FrameIndex {

    private final ScopeFrame frame;
    private final Map<Category, Map<String, Placement>> authored = new EnumMap<>(Category.class);
    private final Map<Category, Map<String, Placement>> stubs = new EnumMap<>(Category.class);

    private FrameIndex(ScopeFrame frame) {
        this.frame = frame;
    }

    static FrameIndex build(ConfigTree tree, ScopeFrame frame) {
        FrameIndex index = new FrameIndex(frame);
        for (Category category : Category.values()) {
            Map<String, Placement> authoredNames = new LinkedHashMap<>();
            Map<String, Placement> stubNames = new LinkedHashMap<>();
            for (Placement placement : tree.placementsOf(frame, category)) {
                String name = placement.getNode().getName();
                if (ReferenceNormalizer.isStub(placement.getNode(), category)) {
                    stubNames.put(name, placement);
                    continue;
                }
                if (authoredNames.containsKey(name)) {
                    log.warn("{} '{}' is declared more than once in {}, the later declaration wins",
                            category.getToken(), name, frame);
                }
                authoredNames.put(name, placement);
            }
            stubNames.keySet().removeAll(authoredNames.keySet());
            if (!authoredNames.isEmpty()) {
                index.authored.put(category, authoredNames);
            }
            if (!stubNames.isEmpty()) {
                index.stubs.put(category, stubNames);
            }
        }
        return index;
    }

    public ScopeFrame getFrame() {
        return frame;
    }

    public Optional<Placement> authored(Category category, String name) {
        return Optional.ofNullable(authored.getOrDefault(category, Map.of()).get(name));
    }

    public boolean hasStub(Category category, String name) {
        return stubs.getOrDefault(category, Map.of()).containsKey(name);
    }

    /**
     * Authored declarations of a category, in first-declared order.
     */
    public Map<String, Placement> authored(Category category) {
        return Collections.unmodifiableMap(authored.getOrDefault(category, Map.of()));
    }

    /**
     * Names declared in this frame only as stubs.
     */
    public Map<String, Placement> stubs(Category category) {
        return Collections.unmodifiableMap(stubs.getOrDefault(category, Map.of()));
    }
}
