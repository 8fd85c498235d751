package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.model.Task;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each task as {@code tasks/<id>.json} under the data path. Writes go to a temp file
 * first and are moved into place so a crash never leaves a half-written record.
 */
@Slf4j
public class JsonFileTaskRepository implements TaskRepository {

    private final Path tasksDir;
    private final ObjectMapper mapper;

    public JsonFileTaskRepository(String dataPath) {
        this.tasksDir = Paths.get(dataPath, "tasks");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public void save(Task task) {
        try {
            Files.createDirectories(tasksDir);
            Path target = tasksDir.resolve(task.getId() + ".json");
            Path temp = tasksDir.resolve(task.getId() + ".json.tmp");
            // held across the write so concurrent saves of one task land in order
            synchronized (task) {
                Files.write(temp, mapper.writeValueAsBytes(task));
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist task " + task.getId(), e);
        }
    }

    @Override
    public Optional<Task> findById(String id) {
        Path file = tasksDir.resolve(id + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.ofNullable(read(file));
    }

    @Override
    public void delete(String id) {
        try {
            Files.deleteIfExists(tasksDir.resolve(id + ".json"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete task " + id, e);
        }
    }

    @Override
    public List<Task> findAll() {
        List<Task> tasks = new ArrayList<>();
        if (!Files.isDirectory(tasksDir)) {
            return tasks;
        }
        try (Stream<Path> files = Files.list(tasksDir)) {
            files.filter(path -> path.getFileName().toString().endsWith(".json"))
                .map(this::read)
                .filter(task -> task != null)
                .forEach(tasks::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list tasks in " + tasksDir, e);
        }
        tasks.sort(Comparator.comparing(Task::getCreatedAt));
        return tasks;
    }

    private Task read(Path file) {
        try {
            return mapper.readValue(file.toFile(), Task.class);
        } catch (IOException e) {
            log.warn("Skipping unreadable task record. file={}, error={}", file, e.getMessage());
            return null;
        }
    }
}
