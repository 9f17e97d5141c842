package com.dpstore.backend;

import java.io.IOException;

/**
 * A backend server rejected the credentials of a connection.
 */
public class AuthenticationException extends IOException {

    public AuthenticationException(String message) {
        super(message);
    }
}
