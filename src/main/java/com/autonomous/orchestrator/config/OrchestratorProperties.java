package com.autonomous.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the {@code orchestrator.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /** Upper bound on tasks in the RUNNING state. */
    private int maxParallelTasks = 3;

    /** Spend ceiling in USD before new admissions pause. */
    private double costLimitUsd = 5.0;

    /** Share of the ceiling at which a warning is logged. */
    private double warningThresholdPercent = 80.0;

    private boolean enableResultVerification = true;

    private boolean enableCostTracking = true;

    private String defaultModel = "sonnet";

    private String verificationModel = "opus";

    /** Model invocations per generation round, first call included. */
    private int maxAttempts = 3;

    private Duration retryBackoff = Duration.ofMillis(500);

    private double retryBackoffMultiplier = 2.0;

    /** Regenerations allowed after a rejected verification. */
    private int verificationRetryLimit = 2;

    /** Maximum duration of a single model call; a call that runs longer fails and is retried. */
    private Duration taskTimeout = Duration.ofMinutes(30);

    /** 0 keeps the queue unbounded. */
    private int queueCapacity = 0;

    private int maxTokens = 4096;

    private int maxPromptLength = 20_000;

    private int knowledgeContextSize = 3;

    private String dataPath = "data";

    private boolean persistenceEnabled = true;

    private String agentsPath = "config/agents";

    private String cliPath = "claude";

    private Maintenance maintenance = new Maintenance();

    @Data
    public static class Maintenance {
        private boolean enabled = false;
        // ISO-8601 in yml (PT5M), it also drives @Scheduled
        private Duration interval = Duration.ofMinutes(5);
        private String prompt = "Run a health re-check of the orchestrator: summarize the current cost ledger "
            + "and task backlog below and flag anything that needs operator attention.";
    }
}
