package com.example.pomodoro.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationRequiredException extends AppException {

    public AuthenticationRequiredException() {
        super(HttpStatus.UNAUTHORIZED, "Authentication required");
    }
}
