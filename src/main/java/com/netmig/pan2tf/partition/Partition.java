package com.netmig.pan2tf.partition;

import com.netmig.pan2tf.model.tree.ConfigTree;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * A self-contained export for one device group
 */
@Getter
@AllArgsConstructor
public class Partition {

    private final String groupName;

    private final ConfigTree tree;

    /**
     * Templates carried into the partition, stack members included
     */
    private final List<String> templates;

    private final List<String> templateStacks;

    /**
     * Things the partition could not include, e.g. no matching template
     */
    private final List<String> warnings;

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
