package com.postboard.backend.exceptions;

/**
 * Thrown when the notification batch for a post could not be written after the post itself
 * was committed. The post identified by {@link #getPostId()} is durable; its recipients were
 * not notified.
 */
public class NotificationFanoutException extends RuntimeException {

    private final Long postId;

    public NotificationFanoutException(Long postId, Throwable cause) {
        super("Post " + postId + " was saved but notifications could not be created: " + cause.getMessage(), cause);
        this.postId = postId;
    }

    public Long getPostId() {
        return postId;
    }
}
