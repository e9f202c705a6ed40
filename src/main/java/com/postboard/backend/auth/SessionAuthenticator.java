package com.postboard.backend.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.context.SecurityContextRepository;
import org.springframework.stereotype.Component;

/**
 * Establishes and tears down the session record. A logged-in session holds the Spring Security
 * context plus the {@value #USER_ID_ATTRIBUTE} and {@value #USERNAME_ATTRIBUTE} attributes.
 */
@Component
@Slf4j
public class SessionAuthenticator {

    public static final String USER_ID_ATTRIBUTE = "user_id";
    public static final String USERNAME_ATTRIBUTE = "username";

    private final AuthenticationManager authenticationManager;
    private final SecurityContextRepository securityContextRepository;

    public SessionAuthenticator(AuthenticationManager authenticationManager,
                                SecurityContextRepository securityContextRepository) {
        this.authenticationManager = authenticationManager;
        this.securityContextRepository = securityContextRepository;
    }

    /**
     * Checks the credentials and, on success, binds the user to the current session.
     *
     * @throws AuthenticationException when the username is unknown or the password does not match;
     *                                 both cases surface as the same exception type
     */
    public SessionUser login(String username, String password,
                             HttpServletRequest request, HttpServletResponse response) {
        Authentication authentication = authenticationManager.authenticate(
                UsernamePasswordAuthenticationToken.unauthenticated(username, password));
        SessionUser principal = (SessionUser) authentication.getPrincipal();

        // rotate the id so a pre-login session cannot be reused
        if (request.getSession(false) != null) {
            request.changeSessionId();
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
        securityContextRepository.saveContext(context, request, response);

        HttpSession session = request.getSession(true);
        session.setAttribute(USER_ID_ATTRIBUTE, principal.getId());
        session.setAttribute(USERNAME_ATTRIBUTE, principal.getUsername());

        log.info("User {} (id {}) logged in", principal.getUsername(), principal.getId());
        return principal;
    }

    /**
     * Clears the session record whether or not one exists.
     */
    public void logout(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            Object username = session.getAttribute(USERNAME_ATTRIBUTE);
            session.invalidate();
            log.info("Session cleared for {}", username != null ? username : "anonymous visitor");
        }
        SecurityContextHolder.clearContext();
    }
}
