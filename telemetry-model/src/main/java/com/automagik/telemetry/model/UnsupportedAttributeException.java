package com.automagik.telemetry.model;

/** Raised when a raw attribute value has no scalar representation. */
public class UnsupportedAttributeException extends IllegalArgumentException {

    public UnsupportedAttributeException(String message) {
        super(message);
    }
}
