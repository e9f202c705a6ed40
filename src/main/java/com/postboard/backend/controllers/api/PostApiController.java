package com.postboard.backend.controllers.api;

import com.postboard.backend.dto.PublishedPost;
import com.postboard.backend.exceptions.NotificationFanoutException;
import com.postboard.backend.exceptions.PostCreationException;
import com.postboard.backend.models.Post;
import com.postboard.backend.payload.CreatePostRequest;
import com.postboard.backend.services.PostService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class PostApiController {

    static final String PUBLIC_POSTS_PATH = "/api/public/posts_21201532";

    private final PostService postService;

    // /api/posts needs a session, the public address does not
    @GetMapping({"/api/posts", PUBLIC_POSTS_PATH})
    public ResponseEntity<Map<String, Object>> listPosts() {
        return ResponseEntity.ok(Map.of("posts", postService.getAllPosts()));
    }

    /**
     * Creates a post for the named author and notifies every other user.
     * Reachable without a session: the author is taken from the payload.
     * An unknown author is answered with 404 by {@code GlobalExceptionHandler}.
     */
    @PostMapping(PUBLIC_POSTS_PATH)
    public ResponseEntity<Map<String, Object>> createPost(@RequestBody(required = false) CreatePostRequest request) {
        if (request == null || request.isEmpty()) {
            return error(HttpStatus.BAD_REQUEST, "No data provided");
        }

        List<String> missing = request.missingFields();
        if (!missing.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Title, content, and username are required");
            body.put("details", missing);
            return ResponseEntity.badRequest().body(body);
        }

        if (request.getTitle().length() > Post.MAX_TITLE_LENGTH) {
            return error(HttpStatus.BAD_REQUEST, "Title must be at most 200 characters");
        }

        try {
            PublishedPost published = postService.publish(request.getUsername(), request.getTitle(), request.getContent());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Post created successfully");
            body.put("post", published.getPost());
            body.put("notified", published.getNotified());
            return ResponseEntity.status(HttpStatus.CREATED).body(body);

        } catch (NotificationFanoutException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Failed to create post");
            body.put("details", e.getMessage());
            body.put("post_id", e.getPostId());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);

        } catch (PostCreationException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Failed to create post");
            body.put("details", String.valueOf(e.getCause().getMessage()));
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
