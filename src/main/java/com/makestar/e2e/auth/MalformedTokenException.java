package com.makestar.e2e.auth;

/**
 * A token could not be decoded far enough to read its expiry claim. Always recovered where it is caught,
 * usually by substituting a conservative default expiry.
 */
public class MalformedTokenException extends Exception {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
