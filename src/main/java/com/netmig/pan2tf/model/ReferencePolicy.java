package com.netmig.pan2tf.model;

/**
 * What happens when a reference names nothing the export declares
 */
public enum ReferencePolicy {
    /**
     * The name must resolve to an object, a predefined name or a literal
     */
    REQUIRED,

    /**
     * The name may refer to something that lives only on the device
     * (App-ID applications, predefined URL categories, interfaces created elsewhere)
     */
    OPTIONAL
}
