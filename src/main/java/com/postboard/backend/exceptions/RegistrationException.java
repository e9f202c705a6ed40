package com.postboard.backend.exceptions;

/**
 * Registration was rejected. The message is safe to show to the person registering.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
