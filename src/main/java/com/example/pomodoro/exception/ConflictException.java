package com.example.pomodoro.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Registration clashed with an existing account. Reported as 400, not 409,
 * because the frontend treats every registration rejection the same way.
 */
@Getter
public class ConflictException extends AppException {

    public enum Field { USERNAME, EMAIL }

    private final Field field;

    public ConflictException(Field field) {
        super(HttpStatus.BAD_REQUEST, field == Field.USERNAME ? "Username already exists" : "Email already exists");
        this.field = field;
    }
}
