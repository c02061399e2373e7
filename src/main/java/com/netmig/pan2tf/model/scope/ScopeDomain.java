package com.netmig.pan2tf.model.scope;

/**
 * Where in the export a scope frame comes from. Together with the frame name it
 * identifies a frame independently of the precedence role it plays in a chain.
 */
public enum ScopeDomain {
    SHARED("shared"),
    DEVICE_GROUP("device-group"),
    VSYS("vsys"),
    DEVICE("device"),
    TEMPLATE("template"),
    TEMPLATE_STACK("template-stack");

    private final String label;

    ScopeDomain(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
