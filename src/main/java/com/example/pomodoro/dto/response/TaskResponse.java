package com.example.pomodoro.dto.response;

import com.example.pomodoro.model.Task;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TaskResponse {
    Long id;
    String text;
    boolean completed;
    int pomodoroCount;

    public static TaskResponse from(Task task) {
        return TaskResponse.builder()
                .id(task.getId())
                .text(task.getText())
                .completed(task.isCompleted())
                .pomodoroCount(task.getPomodoroCount())
                .build();
    }
}
