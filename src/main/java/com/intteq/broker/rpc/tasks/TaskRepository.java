package com.intteq.broker.rpc.tasks;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TaskRepository extends JpaRepository<TaskEntity, Long> {

    List<TaskEntity> findByOwnerIdOrderByIdDesc(Long ownerId);

    Optional<TaskEntity> findByIdAndOwnerId(Long id, Long ownerId);
}
