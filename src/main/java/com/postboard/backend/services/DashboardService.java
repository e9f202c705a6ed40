package com.postboard.backend.services;

import com.postboard.backend.dto.DashboardView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private final UserService userService;
    private final PostService postService;
    private final NotificationService notificationService;

    @Transactional(readOnly = true)
    public DashboardView getDashboard(Long userId) {
        return DashboardView.builder()
                .user(userService.getById(userId))
                .recentPosts(postService.getRecentPostsForUser(userId))
                .totalPosts(postService.countPostsForUser(userId))
                .unreadNotifications(notificationService.countUnread(userId))
                .build();
    }
}
