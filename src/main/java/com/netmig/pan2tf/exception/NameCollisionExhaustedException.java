package com.netmig.pan2tf.exception;

import lombok.Getter;

/**
 * No free identifier was found for a name within the configured number of suffixes
 */
@Getter
public class NameCollisionExhaustedException extends ConversionException {

    private final String baseIdentifier;
    private final int attempts;

    public NameCollisionExhaustedException(String baseIdentifier, int attempts) {
        super(String.format("No free identifier for '%s' after %d suffix attempts", baseIdentifier, attempts));
        this.baseIdentifier = baseIdentifier;
        this.attempts = attempts;
    }
}
