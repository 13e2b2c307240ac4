package com.example.pomodoro.dto.request;

import jakarta.validation.GroupSequence;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Presence is checked before format, so a missing field is always reported as missing.
 */
@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@GroupSequence({RegisterRequest.class, RegisterRequest.Format.class})
public class RegisterRequest {

    public interface Format {
    }

    @NotBlank(message = "Username is required")
    @Pattern(regexp = "^[A-Za-z0-9_]{3,50}$", groups = Format.class,
            message = "Username must be 3-50 characters: letters, digits and underscores only")
    String username;

    @NotBlank(message = "Email is required")
    @Email(regexp = "^[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$", groups = Format.class,
            message = "Invalid email address")
    @Size(max = 255, groups = Format.class, message = "Invalid email address")
    String email;

    @NotBlank(message = "Password is required")
    @Size(min = 6, groups = Format.class, message = "Password must be at least 6 characters")
    String password;

    public void setUsername(String username) {
        this.username = username == null ? null : username.trim();
    }

    public void setEmail(String email) {
        this.email = email == null ? null : email.trim();
    }
}
