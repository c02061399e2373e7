package com.netmig.pan2tf.model.scope;

/**
 * Layers of the export's precedence hierarchy.
 */
public enum ScopeKind {
    /**
     * The device group (or firewall vsys) that declares the consuming object
     */
    DEVICE_GROUP_LOCAL,

    /**
     * A parent device group, nearest first
     */
    DEVICE_GROUP_ANCESTOR,

    /**
     * A template, or the device entry of a firewall export
     */
    TEMPLATE,

    /**
     * A template stack; overrides the templates it lists
     */
    TEMPLATE_STACK,

    /**
     * All shared fragments of the document
     */
    SHARED
}
