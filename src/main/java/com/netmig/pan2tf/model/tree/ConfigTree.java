package com.netmig.pan2tf.model.tree;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.scope.ScopeCatalog;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A loaded export: the root {@code config} node and the scope frames found in it.
 */
@Getter
public class ConfigTree {

    public static final String ROOT_TAG = "config";

    private final ConfigNode root;
    private final ScopeCatalog catalog;

    public ConfigTree(ConfigNode root) {
        this.root = root;
        this.catalog = ScopeCatalog.of(root);
    }

    /**
     * Every declaration of a category in a frame, in source order across the
     * frame's bases and the category's paths.
     */
    public List<ConfigNode> childrenOf(ScopeFrame frame, Category category) {
        List<ConfigNode> result = new ArrayList<>();
        for (Placement placement : placementsOf(frame, category)) {
            result.add(placement.getNode());
        }
        return result;
    }

    /**
     * Same as {@link #childrenOf}, keeping the path each node was found under.
     */
    public List<Placement> placementsOf(ScopeFrame frame, Category category) {
        List<Placement> result = new ArrayList<>();
        for (ConfigNode base : frame.getBases()) {
            for (String path : category.getPaths()) {
                for (ConfigNode node : base.select(path + "/" + ConfigNode.ENTRY)) {
                    if (node.getName() != null) {
                        result.add(new Placement(node, path));
                    }
                }
            }
        }
        return result;
    }

    /**
     * The effective declaration of a name in a frame: when a name is declared
     * twice the later one wins.
     */
    public Optional<ConfigNode> find(ScopeFrame frame, Category category, String name) {
        ConfigNode found = null;
        for (ConfigNode node : childrenOf(frame, category)) {
            if (name.equals(node.getName())) {
                found = node;
            }
        }
        return Optional.ofNullable(found);
    }
}
