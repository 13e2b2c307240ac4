package com.example.pomodoro.security;

/**
 * Identity resolved from a verified token. Trusted for the duration of one request;
 * the user row is not re-read.
 */
public record AuthenticatedUser(Long userId, String username) {
}
