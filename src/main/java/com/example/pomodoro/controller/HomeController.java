package com.example.pomodoro.controller;

import com.example.pomodoro.dto.response.MessageResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HomeController {

    @GetMapping("/")
    public MessageResponse home() {
        return new MessageResponse("Backend is running");
    }
}
