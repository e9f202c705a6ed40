package com.postboard.backend.dto;

import lombok.Value;

/**
 * Result of publishing a post: the stored post and how many notifications it fanned out to.
 */
@Value
public class PublishedPost {
    PostDto post;
    int notified;
}
