package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of tasks keyed by id.
 */
public interface TaskRepository {

    void save(Task task);

    Optional<Task> findById(String id);

    List<Task> findAll();

    void delete(String id);
}
