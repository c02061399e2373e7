package com.netmig.pan2tf.naming;

/**
 * Scope within which target identifiers must be unique
 */
public enum NamespaceMode {
    /**
     * Identifiers are unique per resource type; an address and a service may share one
     */
    PER_CATEGORY,

    /**
     * Identifiers are unique across all resource types
     */
    GLOBAL
}
