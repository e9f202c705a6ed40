package com.postboard.backend.exceptions;

/**
 * Thrown when a username supplied in a path or payload does not match any registered user.
 */
public class UserNotFoundException extends RuntimeException {

    private final String username;

    public UserNotFoundException(String username) {
        super("User not found: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
