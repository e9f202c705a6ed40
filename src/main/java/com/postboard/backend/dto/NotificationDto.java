package com.postboard.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDto {
    private Long id;
    private String message;

    @JsonProperty("is_read")
    private boolean read;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("post_id")
    private Long postId;
}
