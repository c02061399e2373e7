package com.netmig.pan2tf.synth;

import com.netmig.pan2tf.model.CanonicalObject;
import lombok.Value;

/**
 * A canonical object and the text an emitter produced for it
 */
@Value
public class EmittedResource {
    CanonicalObject object;
    String text;
}
