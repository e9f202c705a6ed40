package com.postboard.backend.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the dashboard page renders for the logged-in user.
 */
@Value
@Builder
public class DashboardView {
    UserDto user;
    List<PostDto> recentPosts;
    long totalPosts;
    long unreadNotifications;
}
