package com.autonomous.orchestrator.controller;

import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.CostEntry;
import com.autonomous.orchestrator.model.CostHistoryFilter;
import com.autonomous.orchestrator.model.CostSummary;
import com.autonomous.orchestrator.service.Orchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/costs")
public class CostController {

    private final Orchestrator orchestrator;

    public CostController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/summary")
    public CostSummary summary() {
        return orchestrator.costSummary();
    }

    /**
     * Spend entries since the last reset, newest first. {@code from}/{@code to} are ISO-8601 instants.
     */
    @GetMapping("/history")
    public List<CostEntry> history(@RequestParam(required = false) String taskId,
                                   @RequestParam(required = false) AgentType agent,
                                   @RequestParam(required = false) Instant from,
                                   @RequestParam(required = false) Instant to,
                                   @RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > 500) {
            throw new IllegalArgumentException("limit must be between 1 and 500");
        }
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return orchestrator.costHistory(CostHistoryFilter.builder()
            .taskId(taskId)
            .agentType(agent)
            .from(from)
            .to(to)
            .limit(limit)
            .build());
    }

    @PostMapping("/confirm")
    public ResponseEntity<?> confirm() {
        boolean resumed = orchestrator.confirmContinue();
        return ResponseEntity.ok(Map.of(
            "resumed", resumed,
            "summary", orchestrator.costSummary()
        ));
    }

    @PostMapping("/reset")
    public CostSummary reset() {
        orchestrator.resetCosts();
        return orchestrator.costSummary();
    }
}
