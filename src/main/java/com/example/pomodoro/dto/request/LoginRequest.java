package com.example.pomodoro.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class LoginRequest {
    // username or email
    @NotBlank(message = "Username and password are required")
    String username;

    @NotBlank(message = "Username and password are required")
    String password;
}
