package com.postboard.backend.payload;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON body for the public post-creation endpoint. The author is named by username.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostRequest {
    private String title;
    private String content;
    private String username;

    // every top-level key the body carried, known or not
    @JsonIgnore
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Set<String> receivedKeys;

    public void setTitle(String title) {
        this.title = title;
        markReceived("title");
    }

    public void setContent(String content) {
        this.content = content;
        markReceived("content");
    }

    public void setUsername(String username) {
        this.username = username;
        markReceived("username");
    }

    @JsonAnySetter
    public void otherField(String key, Object value) {
        markReceived(key);
    }

    private void markReceived(String key) {
        if (receivedKeys == null) {
            receivedKeys = new LinkedHashSet<>();
        }
        receivedKeys.add(key);
    }

    /**
     * True only for a body with no keys at all, such as {@code {}}.
     */
    @JsonIgnore
    public boolean isEmpty() {
        return (receivedKeys == null || receivedKeys.isEmpty()) && title == null && content == null && username == null;
    }

    /**
     * Names of the required fields that are absent or blank, in declaration order.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(title)) {
            missing.add("title");
        }
        if (isBlank(content)) {
            missing.add("content");
        }
        if (isBlank(username)) {
            missing.add("username");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
