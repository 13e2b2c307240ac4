package com.example.pomodoro.controller;

import com.example.pomodoro.dto.request.LoginRequest;
import com.example.pomodoro.dto.request.RegisterRequest;
import com.example.pomodoro.dto.response.AuthResponse;
import com.example.pomodoro.dto.response.RegisterResponse;
import com.example.pomodoro.dto.response.UserResponse;
import com.example.pomodoro.helper.UserHelper;
import com.example.pomodoro.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final UserHelper userHelper;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(req));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest req) {
        return ResponseEntity.ok(authService.login(req));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(authService.me(userHelper.getCurrentUser()));
    }
}
