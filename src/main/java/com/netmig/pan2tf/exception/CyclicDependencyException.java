package com.netmig.pan2tf.exception;

import java.util.List;

/**
 * Objects reference each other in a loop. The path starts and ends with the same object.
 */
public class CyclicDependencyException extends ConversionException {

    private final List<String> cyclePath;

    public CyclicDependencyException(List<String> cyclePath) {
        super("Dependency cycle: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
