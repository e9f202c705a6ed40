package com.postboard.backend.auth;

import com.postboard.backend.exceptions.RegistrationException;
import com.postboard.backend.payload.RegisterRequest;
import com.postboard.backend.services.RegistrationService;
import com.postboard.backend.util.FlashMessages;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * Browser entry pages: landing redirect, login, registration and logout. None of these
 * require a session.
 */
@Controller
@Slf4j
public class AuthController {

    static final String INVALID_CREDENTIALS = "Invalid username or password";

    private final SessionAuthenticator sessionAuthenticator;
    private final RegistrationService registrationService;

    public AuthController(SessionAuthenticator sessionAuthenticator, RegistrationService registrationService) {
        this.sessionAuthenticator = sessionAuthenticator;
        this.registrationService = registrationService;
    }

    @GetMapping("/")
    public String home(@AuthenticationPrincipal SessionUser user) {
        return user != null ? "redirect:/dashboard" : "redirect:/login";
    }

    @GetMapping("/login")
    public String loginPage() {
        return "login";
    }

    @PostMapping("/login")
    public String login(@RequestParam(defaultValue = "") String username,
                        @RequestParam(defaultValue = "") String password,
                        HttpServletRequest request,
                        HttpServletResponse response,
                        Model model,
                        RedirectAttributes redirectAttributes) {
        try {
            sessionAuthenticator.login(username, password, request, response);
            FlashMessages.flash(redirectAttributes, FlashMessages.SUCCESS, "Login successful!");
            return "redirect:/dashboard";
        } catch (AuthenticationException e) {
            // same message for unknown user and wrong password
            log.warn("Failed login attempt for username '{}'", username);
            FlashMessages.inline(model, FlashMessages.ERROR, INVALID_CREDENTIALS);
            model.addAttribute("username", username);
            return "login";
        }
    }

    @GetMapping("/register")
    public String registerPage() {
        return "register";
    }

    @PostMapping("/register")
    public String register(@RequestParam(defaultValue = "") String username,
                           @RequestParam(defaultValue = "") String email,
                           @RequestParam(defaultValue = "") String password,
                           @RequestParam(name = "confirm_password", defaultValue = "") String confirmPassword,
                           Model model,
                           RedirectAttributes redirectAttributes) {
        RegisterRequest registerRequest = RegisterRequest.builder()
                .username(username)
                .email(email)
                .password(password)
                .confirmPassword(confirmPassword)
                .build();

        try {
            registrationService.register(registerRequest);
            FlashMessages.flash(redirectAttributes, FlashMessages.SUCCESS, "Registration successful! Please login.");
            return "redirect:/login";
        } catch (RegistrationException e) {
            FlashMessages.inline(model, FlashMessages.ERROR, e.getMessage());
            model.addAttribute("username", username);
            model.addAttribute("email", email);
            return "register";
        }
    }

    @GetMapping("/logout")
    public String logout(HttpServletRequest request, RedirectAttributes redirectAttributes) {
        sessionAuthenticator.logout(request);
        FlashMessages.flash(redirectAttributes, FlashMessages.INFO, "You have been logged out");
        return "redirect:/login";
    }
}
