package com.intteq.broker.rpc.tasks;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A task owned by a user. Timestamps are UTC wall-clock times.
 */
@Entity
@Table(name = "tasks", indexes = @Index(name = "ix_tasks_owner_id", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TaskEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Setter(AccessLevel.NONE)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    @Setter(AccessLevel.NONE)
    private Long ownerId;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(length = 65_535)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskStatus status = TaskStatus.TODO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    @Column(name = "created_at")
    @Setter(AccessLevel.NONE)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public TaskEntity(Long ownerId, String title, String description, LocalDateTime now) {
        this.ownerId = ownerId;
        this.title = title;
        this.description = description;
        this.createdAt = now;
        this.updatedAt = now;
    }
}
