package com.netmig.pan2tf.model.tree;

import lombok.Value;

/**
 * A declaration node together with the category path it was found under.
 */
@Value
public class Placement {
    ConfigNode node;
    String path;
}
