package com.testfleet.core.identity;

/**
 * No build identity could be formed for the working tree. Fatal: a run
 * cannot be correlated with its reports without one.
 */
public class IdentityException extends RuntimeException {

    public IdentityException(String message) {
        super(message);
    }

    public IdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
