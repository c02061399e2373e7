package com.netmig.pan2tf.emit;

import com.netmig.pan2tf.model.CanonicalObject;

/**
 * Renders one canonical object as target text.
 * Implementations only read resolved content; they never look names up.
 */
public interface ResourceEmitter {

    String emit(CanonicalObject object);
}
