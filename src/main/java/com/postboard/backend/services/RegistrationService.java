package com.postboard.backend.services;

import com.postboard.backend.exceptions.RegistrationException;
import com.postboard.backend.models.User;
import com.postboard.backend.payload.RegisterRequest;
import com.postboard.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationService {

    static final String FIELDS_REQUIRED = "All fields are required";
    static final String PASSWORDS_DO_NOT_MATCH = "Passwords do not match";
    static final String USERNAME_TOO_LONG = "Username must be at most " + User.MAX_USERNAME_LENGTH + " characters";
    static final String EMAIL_TOO_LONG = "Email must be at most " + User.MAX_EMAIL_LENGTH + " characters";
    static final String USERNAME_TAKEN = "Username already exists";
    static final String EMAIL_TAKEN = "Email already exists";
    static final String REGISTRATION_FAILED = "Registration failed. Please try again.";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    /**
     * Creates a user after checking, in order: all fields present, password confirmation,
     * column lengths, username uniqueness, email uniqueness. The first failing check wins.
     * The email is stored as given; its format is not checked.
     *
     * @throws RegistrationException with a message fit for display when any check fails or the
     *                               insert is rejected by the database
     */
    public User register(RegisterRequest request) {
        validate(request);

        User user = User.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .createdAt(OffsetDateTime.now(clock))
                .build();

        try {
            // saveAndFlush runs in its own transaction, a constraint violation rolls it back
            User saved = userRepository.saveAndFlush(user);
            log.info("✅ Registered user {} (id {})", saved.getUsername(), saved.getId());
            return saved;
        } catch (DataAccessException e) {
            log.error("❌ Failed to persist registration for {}: {}", request.getUsername(), e.getMessage(), e);
            throw new RegistrationException(REGISTRATION_FAILED, e);
        }
    }

    private void validate(RegisterRequest request) {
        if (isBlank(request.getUsername()) || isBlank(request.getEmail())
                || isBlank(request.getPassword()) || isBlank(request.getConfirmPassword())) {
            throw new RegistrationException(FIELDS_REQUIRED);
        }
        if (!request.getPassword().equals(request.getConfirmPassword())) {
            throw new RegistrationException(PASSWORDS_DO_NOT_MATCH);
        }
        if (request.getUsername().length() > User.MAX_USERNAME_LENGTH) {
            throw new RegistrationException(USERNAME_TOO_LONG);
        }
        if (request.getEmail().length() > User.MAX_EMAIL_LENGTH) {
            throw new RegistrationException(EMAIL_TOO_LONG);
        }
        if (userRepository.existsByUsername(request.getUsername())) {
            log.info("Registration rejected, username {} taken", request.getUsername());
            throw new RegistrationException(USERNAME_TAKEN);
        }
        if (userRepository.existsByEmail(request.getEmail())) {
            log.info("Registration rejected, email {} taken", request.getEmail());
            throw new RegistrationException(EMAIL_TAKEN);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
