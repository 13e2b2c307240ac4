package com.example.pomodoro.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "tasks", indexes = {
    @Index(name = "idx_tasks_owner", columnList = "owner_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {
    /** Owner assigned to rows that predate user accounts. No user ever has this id. */
    public static final long ORPHAN_OWNER_ID = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(nullable = false, length = 500)
    private String text;

    @Column(nullable = false)
    @Builder.Default
    private boolean completed = false;

    @Column(name = "pomodoro_count", nullable = false)
    @Builder.Default
    private int pomodoroCount = 0;
}
