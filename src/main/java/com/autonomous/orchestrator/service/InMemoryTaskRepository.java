package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTaskRepository implements TaskRepository {

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.getId(), task);
    }

    @Override
    public Optional<Task> findById(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public void delete(String id) {
        tasks.remove(id);
    }

    @Override
    public List<Task> findAll() {
        List<Task> all = new ArrayList<>(tasks.values());
        all.sort(Comparator.comparing(Task::getCreatedAt));
        return all;
    }
}
