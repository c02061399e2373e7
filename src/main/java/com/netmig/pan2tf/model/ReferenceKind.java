package com.netmig.pan2tf.model;

/**
 * How a reference value was satisfied
 */
public enum ReferenceKind {
    /**
     * Points at a canonical object converted in the same run
     */
    LINKED,

    /**
     * A built-in name such as {@code any} or {@code application-default}
     */
    PREDEFINED,

    /**
     * An inline IP address, network or range
     */
    LITERAL,

    /**
     * An optional reference to something not present in the export
     */
    EXTERNAL
}
