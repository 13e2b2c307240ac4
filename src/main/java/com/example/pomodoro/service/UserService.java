package com.example.pomodoro.service;

import com.example.pomodoro.exception.ConflictException;
import com.example.pomodoro.model.User;
import com.example.pomodoro.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Account storage. Uniqueness of username and email is enforced by the database;
 * this class only translates a violated constraint into the matching conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;

    // Must run outside a transaction: the insert has to finish before the lookups that classify a violation.
    public User createUser(String username, String email, String passwordHash) {
        String normalizedEmail = normalizeEmail(email);
        User user = User.builder()
                .username(username)
                .email(normalizedEmail)
                .passwordHash(passwordHash)
                .build();
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            if (userRepository.existsByUsername(username)) {
                throw new ConflictException(ConflictException.Field.USERNAME);
            }
            if (userRepository.existsByEmail(normalizedEmail)) {
                throw new ConflictException(ConflictException.Field.EMAIL);
            }
            throw ex;
        }
    }

    /**
     * Usernames match exactly; emails match regardless of case.
     */
    public Optional<User> findByUsernameOrEmail(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        Optional<User> byUsername = userRepository.findByUsername(identifier);
        if (byUsername.isPresent()) {
            return byUsername;
        }
        return userRepository.findByEmail(normalizeEmail(identifier));
    }

    public Optional<User> findById(Long id) {
        return userRepository.findById(id);
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
