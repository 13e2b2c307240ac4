package com.example.pomodoro.security;

import lombok.Getter;

@Getter
public class TokenVerificationException extends RuntimeException {

    public enum Kind { EXPIRED, MALFORMED, SIGNATURE_INVALID }

    private final Kind kind;

    public TokenVerificationException(Kind kind, Throwable cause) {
        super("Token rejected: " + kind, cause);
        this.kind = kind;
    }

    public TokenVerificationException(Kind kind) {
        this(kind, null);
    }
}
