package com.netmig.pan2tf.synth;

import com.netmig.pan2tf.model.ObjectKey;
import lombok.Value;

/**
 * The referrer must be emitted after the referent
 */
@Value
public class DependencyEdge {
    ObjectKey referrer;
    ObjectKey referent;
}
