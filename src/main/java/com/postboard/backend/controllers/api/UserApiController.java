package com.postboard.backend.controllers.api;

import com.postboard.backend.services.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * User listing. {@code /api/users} is session-gated by the security filter chain,
 * {@code /api/public/users} is not; the handler is the same.
 */
@RestController
@RequiredArgsConstructor
public class UserApiController {

    private final UserService userService;

    @GetMapping({"/api/users", "/api/public/users"})
    public ResponseEntity<Map<String, Object>> listUsers() {
        return ResponseEntity.ok(Map.of("users", userService.getAllUsers()));
    }
}
