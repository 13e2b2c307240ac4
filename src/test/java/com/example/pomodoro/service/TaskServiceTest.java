package com.example.pomodoro.service;

import com.example.pomodoro.IntegrationTestSupport;
import com.example.pomodoro.dto.response.TaskResponse;
import com.example.pomodoro.exception.NotFoundException;
import com.example.pomodoro.exception.ValidationException;
import com.example.pomodoro.model.Task;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskServiceTest extends IntegrationTestSupport {

    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    @Autowired
    private TaskService taskService;

    @Test
    void createTrimsTextAndStartsAtZero() {
        TaskResponse task = taskService.create(ALICE, "  Write report  ");

        assertThat(task.getId()).isNotNull();
        assertThat(task.getText()).isEqualTo("Write report");
        assertThat(task.isCompleted()).isFalse();
        assertThat(task.getPomodoroCount()).isZero();
        assertThat(taskService.listForOwner(ALICE)).extracting(TaskResponse::getId).containsExactly(task.getId());
    }

    @Test
    void createRejectsEmptyOrOversizedText() {
        assertThatThrownBy(() -> taskService.create(ALICE, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> taskService.create(ALICE, "")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> taskService.create(ALICE, " \t ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> taskService.create(ALICE, "x".repeat(TaskService.MAX_TEXT_LENGTH + 1)))
                .isInstanceOf(ValidationException.class);
        assertThat(taskRepository.count()).isZero();
    }

    @Test
    void sequentialIncrementsAreCounted() {
        Long id = taskService.create(ALICE, "Focus").getId();

        for (int i = 0; i < 10; i++) {
            taskService.incrementPomodoro(ALICE, id);
        }

        assertThat(taskRepository.findById(id)).get().extracting(Task::getPomodoroCount).isEqualTo(10);
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        Long id = taskService.create(ALICE, "Focus").getId();
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            results.add(pool.submit(() -> {
                start.await();
                int succeeded = 0;
                for (int i = 0; i < perThread; i++) {
                    try {
                        taskService.incrementPomodoro(ALICE, id);
                        succeeded++;
                    } catch (DataAccessException ex) {
                        // a lock timeout is a failed increment, not a lost one
                    }
                }
                return succeeded;
            }));
        }
        start.countDown();

        int succeeded = 0;
        for (Future<Integer> result : results) {
            succeeded += result.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(succeeded).isPositive();
        assertThat(taskRepository.findById(id)).get().extracting(Task::getPomodoroCount).isEqualTo(succeeded);
    }

    @Test
    void foreignTasksCannotBeTouched() {
        Long id = taskService.create(ALICE, "Alice only").getId();

        assertThatThrownBy(() -> taskService.delete(BOB, id)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> taskService.incrementPomodoro(BOB, id)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> taskService.setCompleted(BOB, id, true)).isInstanceOf(NotFoundException.class);

        Task stored = taskRepository.findById(id).orElseThrow();
        assertThat(stored.getPomodoroCount()).isZero();
        assertThat(stored.isCompleted()).isFalse();
        assertThat(taskService.listForOwner(BOB)).isEmpty();
    }

    @Test
    void deleteRemovesOnlyTheOwnersTask() {
        Long id = taskService.create(ALICE, "Done soon").getId();

        taskService.delete(ALICE, id);

        assertThat(taskRepository.existsById(id)).isFalse();
        assertThatThrownBy(() -> taskService.delete(ALICE, id)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void orphanedRowsBelongToNobody() {
        taskRepository.save(Task.builder().ownerId(Task.ORPHAN_OWNER_ID).text("legacy").build());
        taskService.create(ALICE, "mine");

        assertThat(taskService.listForOwner(ALICE)).extracting(TaskResponse::getText).containsExactly("mine");
    }
}
