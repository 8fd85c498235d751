package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.AgentDescriptor;
import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.SystemStatus;
import com.autonomous.orchestrator.service.Orchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class AgentController {

    private final Orchestrator orchestrator;

    public AgentController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/agents")
    public List<AgentDescriptor> agents() {
        return orchestrator.agents();
    }

    @GetMapping("/agents/{type}")
    public ResponseEntity<?> agent(@PathVariable AgentType type) {
        Optional<AgentDescriptor> descriptor = orchestrator.agent(type);
        if (descriptor.isEmpty()) {
            return notRegistered(type);
        }
        return ResponseEntity.ok(descriptor.get());
    }

    @GetMapping("/agents/{type}/capabilities")
    public ResponseEntity<?> capabilities(@PathVariable AgentType type) {
        Optional<AgentDescriptor> descriptor = orchestrator.agent(type);
        if (descriptor.isEmpty()) {
            return notRegistered(type);
        }
        return ResponseEntity.ok(descriptor.get().getCapabilities());
    }

    @GetMapping("/status")
    public SystemStatus status() {
        return orchestrator.systemStatus();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    // submissions naming an unregistered type get 400 instead
    private static ResponseEntity<?> notRegistered(AgentType type) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
            "code", "AGENT_NOT_FOUND",
            "message", "No agent registered for type: " + type
        ));
    }
}
