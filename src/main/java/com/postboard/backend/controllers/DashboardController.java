package com.postboard.backend.controllers;

import com.postboard.backend.auth.SessionAuthenticator;
import com.postboard.backend.auth.SessionUser;
import com.postboard.backend.exceptions.UserNotFoundException;
import com.postboard.backend.services.DashboardService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
@RequiredArgsConstructor
@Slf4j
public class DashboardController {

    private final DashboardService dashboardService;
    private final SessionAuthenticator sessionAuthenticator;

    @GetMapping("/dashboard")
    public String dashboard(@AuthenticationPrincipal SessionUser user, HttpServletRequest request, Model model) {
        try {
            model.addAttribute("dashboard", dashboardService.getDashboard(user.getId()));
            return "dashboard";
        } catch (UserNotFoundException e) {
            // session outlived its user row
            log.warn("Session for user id {} has no matching user, clearing it", user.getId());
            sessionAuthenticator.logout(request);
            return "redirect:/login";
        }
    }
}
