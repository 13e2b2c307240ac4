package com.example.pomodoro.repository;

import com.example.pomodoro.model.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    List<Task> findByOwnerIdOrderByIdAsc(Long ownerId);

    Optional<Task> findByIdAndOwnerId(Long id, Long ownerId);

    // Single UPDATE statement: the row lock taken by the database serialises concurrent increments.
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Task t SET t.pomodoroCount = t.pomodoroCount + 1 WHERE t.id = :id AND t.ownerId = :ownerId")
    int incrementPomodoroCount(@Param("id") Long id, @Param("ownerId") Long ownerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Task t SET t.completed = :completed WHERE t.id = :id AND t.ownerId = :ownerId")
    int updateCompleted(@Param("id") Long id, @Param("ownerId") Long ownerId, @Param("completed") boolean completed);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Task t WHERE t.id = :id AND t.ownerId = :ownerId")
    int deleteByIdAndOwnerId(@Param("id") Long id, @Param("ownerId") Long ownerId);
}
