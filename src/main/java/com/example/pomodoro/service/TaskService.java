package com.example.pomodoro.service;

import com.example.pomodoro.dto.response.TaskResponse;
import com.example.pomodoro.exception.NotFoundException;
import com.example.pomodoro.exception.ValidationException;
import com.example.pomodoro.model.Task;
import com.example.pomodoro.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tasks are always addressed through their owner. A task that exists but belongs to
 * someone else is reported exactly like a missing one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskService {

    static final int MAX_TEXT_LENGTH = 500;

    private final TaskRepository taskRepository;

    @Transactional(readOnly = true)
    public List<TaskResponse> listForOwner(Long ownerId) {
        return taskRepository.findByOwnerIdOrderByIdAsc(ownerId).stream()
                .map(TaskResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public TaskResponse create(Long ownerId, String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Task text is required");
        }
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException("Task text must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        Task task = taskRepository.save(Task.builder()
                .ownerId(ownerId)
                .text(trimmed)
                .build());
        log.info("User id={} created task id={}", ownerId, task.getId());
        return TaskResponse.from(task);
    }

    @Transactional
    public void delete(Long ownerId, Long taskId) {
        if (taskRepository.deleteByIdAndOwnerId(taskId, ownerId) == 0) {
            throw taskNotFound();
        }
        log.info("User id={} deleted task id={}", ownerId, taskId);
    }

    @Transactional
    public TaskResponse incrementPomodoro(Long ownerId, Long taskId) {
        if (taskRepository.incrementPomodoroCount(taskId, ownerId) == 0) {
            throw taskNotFound();
        }
        // The row stays locked by our update until commit, so this read sees our own increment.
        Task task = taskRepository.findByIdAndOwnerId(taskId, ownerId).orElseThrow(this::taskNotFound);
        log.debug("Task id={} pomodoro count now {}", taskId, task.getPomodoroCount());
        return TaskResponse.from(task);
    }

    @Transactional
    public TaskResponse setCompleted(Long ownerId, Long taskId, boolean completed) {
        if (taskRepository.updateCompleted(taskId, ownerId, completed) == 0) {
            throw taskNotFound();
        }
        Task task = taskRepository.findByIdAndOwnerId(taskId, ownerId).orElseThrow(this::taskNotFound);
        log.info("User id={} marked task id={} completed={}", ownerId, taskId, completed);
        return TaskResponse.from(task);
    }

    private NotFoundException taskNotFound() {
        return new NotFoundException("Task not found");
    }
}
