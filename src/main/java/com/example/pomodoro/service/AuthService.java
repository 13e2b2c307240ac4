package com.example.pomodoro.service;

import com.example.pomodoro.dto.request.LoginRequest;
import com.example.pomodoro.dto.request.RegisterRequest;
import com.example.pomodoro.dto.response.AuthResponse;
import com.example.pomodoro.dto.response.RegisterResponse;
import com.example.pomodoro.dto.response.UserResponse;
import com.example.pomodoro.exception.InvalidCredentialsException;
import com.example.pomodoro.exception.NotFoundException;
import com.example.pomodoro.exception.ValidationException;
import com.example.pomodoro.model.User;
import com.example.pomodoro.security.AuthenticatedUser;
import com.example.pomodoro.security.JwtTokenService;
import com.example.pomodoro.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    // BCrypt only reads the first 72 bytes
    private static final int MAX_PASSWORD_BYTES = 72;

    private final UserService userService;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService tokenService;

    public RegisterResponse register(RegisterRequest req) {
        if (req.getPassword().getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw new ValidationException("Password is too long");
        }

        User user = userService.createUser(req.getUsername(), req.getEmail(), passwordHasher.hash(req.getPassword()));
        log.info("Registered user id={} username={}", user.getId(), user.getUsername());
        return RegisterResponse.builder()
                .message("User registered successfully")
                .user(UserResponse.summary(user))
                .build();
    }

    /**
     * Unknown identifier and wrong password fail identically, down to the hashing work done.
     */
    public AuthResponse login(LoginRequest req) {
        String identifier = req.getUsername() == null ? null : req.getUsername().trim();
        Optional<User> user = userService.findByUsernameOrEmail(identifier);

        String storedHash = user.map(User::getPasswordHash).orElse(passwordHasher.dummyHash());
        boolean passwordMatches = passwordHasher.verify(req.getPassword(), storedHash);
        if (user.isEmpty() || !passwordMatches) {
            log.info("Failed login attempt");
            throw new InvalidCredentialsException();
        }

        User u = user.get();
        String token = tokenService.issue(u.getId(), u.getUsername());
        log.info("User id={} logged in", u.getId());
        return AuthResponse.builder()
                .message("Login successful")
                .token(token)
                .user(UserResponse.summary(u))
                .build();
    }

    public UserResponse me(AuthenticatedUser caller) {
        return userService.findById(caller.userId())
                .map(UserResponse::detail)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }
}
