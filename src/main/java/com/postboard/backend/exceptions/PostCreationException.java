package com.postboard.backend.exceptions;

public class PostCreationException extends RuntimeException {

    public PostCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
