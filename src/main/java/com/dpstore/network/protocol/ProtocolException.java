package com.dpstore.network.protocol;

/**
 * Thrown when a frame cannot be encoded or decoded.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
