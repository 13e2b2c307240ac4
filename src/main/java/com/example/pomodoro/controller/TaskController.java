package com.example.pomodoro.controller;

import com.example.pomodoro.dto.request.TaskCreationRequest;
import com.example.pomodoro.dto.request.TaskUpdateRequest;
import com.example.pomodoro.dto.response.MessageResponse;
import com.example.pomodoro.dto.response.TaskListResponse;
import com.example.pomodoro.dto.response.TaskResponse;
import com.example.pomodoro.helper.UserHelper;
import com.example.pomodoro.service.TaskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Every operation is scoped to the caller resolved by the auth filter.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
@FieldDefaults(level = lombok.AccessLevel.PRIVATE, makeFinal = true)
public class TaskController {
    TaskService taskService;
    UserHelper userHelper;

    @GetMapping
    public ResponseEntity<TaskListResponse> getTasks() {
        return ResponseEntity.ok(new TaskListResponse(taskService.listForOwner(userHelper.getCurrentUserId())));
    }

    @PostMapping
    public ResponseEntity<TaskResponse> addTask(@Valid @RequestBody TaskCreationRequest request) {
        TaskResponse created = taskService.create(userHelper.getCurrentUserId(), request.getText());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> deleteTask(@PathVariable Long id) {
        taskService.delete(userHelper.getCurrentUserId(), id);
        return ResponseEntity.ok(new MessageResponse("Task deleted"));
    }

    @PostMapping("/{id}/pomodoro")
    public ResponseEntity<TaskResponse> incrementPomodoro(@PathVariable Long id) {
        return ResponseEntity.ok(taskService.incrementPomodoro(userHelper.getCurrentUserId(), id));
    }

    /**
     * Mark a task done or not done.
     */
    @PatchMapping("/{id}")
    public ResponseEntity<TaskResponse> updateTask(@PathVariable Long id,
                                                   @Valid @RequestBody TaskUpdateRequest request) {
        return ResponseEntity.ok(taskService.setCompleted(userHelper.getCurrentUserId(), id, request.getCompleted()));
    }
}
