package com.postboard.backend.controllers;

import com.postboard.backend.auth.SessionUser;
import com.postboard.backend.services.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping("/notifications")
    public String notifications(@AuthenticationPrincipal SessionUser user, Model model) {
        model.addAttribute("username", user.getUsername());
        model.addAttribute("notifications", notificationService.getForUser(user.getId()));
        model.addAttribute("unreadCount", notificationService.countUnread(user.getId()));
        return "notifications";
    }
}
