package com.example.pomodoro.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Salted one-way password hashing. The stored string is a BCrypt hash,
 * which embeds the version, cost and salt next to the digest.
 */
@Component
@Slf4j
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Password must not be null");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException ex) {
            log.debug("Password verification failed on malformed input: {}", ex.getMessage());
            return false;
        }
    }

    /**
     * A valid hash of an unguessable value. Checking a password against it costs the same
     * as a real check, so unknown accounts answer as slowly as wrong passwords.
     */
    public String dummyHash() {
        return dummyHash;
    }
}
