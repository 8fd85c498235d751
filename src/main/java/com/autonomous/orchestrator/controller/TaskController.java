package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.TaskFilter;
import com.autonomous.orchestrator.model.TaskSpec;
import com.autonomous.orchestrator.model.TaskStatus;
import com.autonomous.orchestrator.model.TaskView;
import com.autonomous.orchestrator.service.Orchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final Orchestrator orchestrator;

    public TaskController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<?> submit(@RequestBody TaskSpec spec) {
        String id = orchestrator.submit(spec);
        TaskView task = orchestrator.getStatus(id);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
            "id", id,
            "status", task.getStatus()
        ));
    }

    @GetMapping("/{id}")
    public TaskView get(@PathVariable String id) {
        return orchestrator.getStatus(id);
    }

    @GetMapping
    public List<TaskView> list(@RequestParam(required = false) TaskStatus status,
                               @RequestParam(required = false) AgentType type,
                               @RequestParam(defaultValue = "50") int limit,
                               @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || limit > 500) {
            throw new IllegalArgumentException("limit must be between 1 and 500");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return orchestrator.list(TaskFilter.builder()
            .status(status)
            .type(type)
            .limit(limit)
            .offset(offset)
            .build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        boolean cancelled = orchestrator.cancel(id);
        return ResponseEntity.ok(Map.of(
            "id", id,
            "cancelled", cancelled,
            "status", orchestrator.getStatus(id).getStatus()
        ));
    }
}
