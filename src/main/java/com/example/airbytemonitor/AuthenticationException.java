package com.example.airbytemonitor;

/**
 * Raised when the client-credentials exchange against the Airbyte token endpoint fails.
 */
public class AuthenticationException extends Exception {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
