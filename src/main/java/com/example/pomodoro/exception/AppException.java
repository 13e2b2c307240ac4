package com.example.pomodoro.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for failures that are reported to the client as-is.
 * The message ends up in the {@code error} field of the response body.
 */
@Getter
public abstract class AppException extends RuntimeException {

    private final HttpStatus status;

    protected AppException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }
}
