package com.netmig.pan2tf.resolve;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.model.scope.ScopeFrame;
import com.netmig.pan2tf.model.tree.ConfigNode;
import com.netmig.pan2tf.model.tree.Placement;
import lombok.Value;

/**
 * The authored node a name resolved to, and where it was found
 */
@Value
public class Match {
    ScopeFrame frame;
    Category category;
    Placement placement;

    public ConfigNode getNode() {
        return placement.getNode();
    }
}
