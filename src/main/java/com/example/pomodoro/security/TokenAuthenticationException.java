package com.example.pomodoro.security;

import lombok.Getter;
import org.springframework.security.core.AuthenticationException;

@Getter
public class TokenAuthenticationException extends AuthenticationException {

    @Getter
    public enum Reason {
        AUTHENTICATION_REQUIRED("Authentication required"),
        MALFORMED_AUTH_HEADER("Invalid authorization header format"),
        TOKEN_EXPIRED("Token has expired"),
        TOKEN_MALFORMED("Invalid token"),
        SIGNATURE_INVALID("Invalid token signature");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public TokenAuthenticationException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public static TokenAuthenticationException from(TokenVerificationException ex) {
        Reason reason = switch (ex.getKind()) {
            case EXPIRED -> Reason.TOKEN_EXPIRED;
            case MALFORMED -> Reason.TOKEN_MALFORMED;
            case SIGNATURE_INVALID -> Reason.SIGNATURE_INVALID;
        };
        return new TokenAuthenticationException(reason);
    }
}
