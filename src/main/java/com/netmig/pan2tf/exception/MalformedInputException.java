package com.netmig.pan2tf.exception;

/**
 * The export is not well-formed XML or is not a configuration export
 */
public class MalformedInputException extends ConversionException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
