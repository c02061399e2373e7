package com.netmig.pan2tf.exception;

/**
 * Base class for every failure of a conversion run
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
