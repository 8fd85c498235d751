package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.CostEntry;
import com.autonomous.orchestrator.model.CostHistoryFilter;
import com.autonomous.orchestrator.model.CostOperation;
import com.autonomous.orchestrator.model.CostSummary;
import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.LedgerStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Running total of model spend against the configured ceiling.
 * <p>
 * Every read and write goes through this object's monitor, so a usage record that crosses
 * the ceiling and the admission check in {@link #tryAdmit(Runnable)} can never interleave.
 * Once paused, the ledger stays paused until {@link #confirmContinue()}, which grants one more
 * ceiling's worth of spend on top of the total at confirmation time.
 * <p>
 * Entries are appended to {@code costs.jsonl} under the data path and replayed on startup.
 */
@Slf4j
@Service
public class CostLedger {

    private static final String COSTS_FILE = "costs.jsonl";

    private final ApplicationEventPublisher events;
    private final ObjectMapper mapper;
    private final List<CostEntry> entries = new ArrayList<>();

    private final double costLimit;
    private final double warningRatio;
    private final boolean trackingEnabled;
    private boolean persistenceEnabled;
    private String dataPath;

    private double total;
    private double pauseMark;
    private boolean paused;
    private boolean warned;

    public CostLedger(OrchestratorProperties properties, ApplicationEventPublisher events) {
        this.events = events;
        this.costLimit = properties.getCostLimitUsd();
        this.warningRatio = properties.getWarningThresholdPercent() / 100.0;
        this.trackingEnabled = properties.isEnableCostTracking();
        this.persistenceEnabled = properties.isPersistenceEnabled();
        this.dataPath = properties.getDataPath();
        this.pauseMark = costLimit;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public synchronized void setDataPath(String path) {
        this.dataPath = path;
        this.persistenceEnabled = true;
    }

    @PostConstruct
    public synchronized void init() {
        if (!persistenceEnabled) {
            return;
        }
        Path costsFile = Paths.get(dataPath, COSTS_FILE);
        if (!Files.exists(costsFile)) {
            return;
        }
        try (Stream<String> lines = Files.lines(costsFile)) {
            lines.filter(line -> !line.isBlank()).forEach(this::replay);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load cost ledger from " + costsFile, e);
        }
        log.info("Restored cost ledger. total={}, pauseMark={}, paused={}", total, pauseMark, paused);
    }

    /**
     * Adds one usage record and returns the new total. Negative amounts are rejected so the
     * total never decreases.
     */
    public double recordUsage(CostEntry entry) {
        if (entry.getCostUsd() < 0 || Double.isNaN(entry.getCostUsd())) {
            throw new IllegalArgumentException("Cost must be a non-negative amount: " + entry.getCostUsd());
        }
        if (entry.getTimestamp() == null) {
            entry.setTimestamp(Instant.now());
        }
        if (entry.getOperation() == null) {
            entry.setOperation(CostOperation.GENERATION);
        }

        CostThresholdReachedEvent reached = null;
        double newTotal;
        synchronized (this) {
            entries.add(entry);
            total += entry.getCostUsd();
            newTotal = total;
            persist(entry);

            if (trackingEnabled && !warned && total >= pauseMark * warningRatio && total < pauseMark) {
                warned = true;
                log.warn("Cost ledger approaching ceiling. total={}, pauseAt={}", total, pauseMark);
            }
            if (trackingEnabled && !paused && total >= pauseMark) {
                paused = true;
                reached = new CostThresholdReachedEvent(total, pauseMark);
                log.warn("Cost ceiling reached, pausing admission. total={}, pauseAt={}", total, pauseMark);
            }
        }
        if (reached != null) {
            events.publishEvent(reached);
        }
        return newTotal;
    }

    /**
     * Convenience overload for bare amounts.
     */
    public double recordUsage(double amount) {
        return recordUsage(CostEntry.builder().costUsd(amount).operation(CostOperation.GENERATION).build());
    }

    public synchronized LedgerStatus checkThreshold() {
        return paused ? LedgerStatus.PAUSED_NEEDS_CONFIRMATION : LedgerStatus.OK;
    }

    public synchronized boolean isPaused() {
        return paused;
    }

    /**
     * Runs {@code admission} only if the ledger is not paused, atomically with respect to
     * {@link #recordUsage(CostEntry)}.
     */
    public synchronized boolean tryAdmit(Runnable admission) {
        if (paused) {
            return false;
        }
        admission.run();
        return true;
    }

    /**
     * Clears the pause without touching the total. Calling it while not paused does nothing.
     *
     * @return true if the ledger was paused
     */
    public synchronized boolean confirmContinue() {
        if (!paused) {
            return false;
        }
        CostEntry marker = marker(CostOperation.CONFIRMATION);
        entries.add(marker);
        persist(marker);
        applyConfirmation();
        log.info("Cost pause confirmed. total={}, nextPauseAt={}", total, pauseMark);
        return true;
    }

    /**
     * Operator reset: zeroes the total and clears any pause. The only way the total goes down.
     */
    public synchronized void reset() {
        CostEntry marker = marker(CostOperation.RESET);
        persist(marker);
        applyReset();
        log.info("Cost ledger reset by operator");
    }

    public synchronized double getTotal() {
        return total;
    }

    public double getCostLimit() {
        return costLimit;
    }

    public synchronized CostSummary summary() {
        Map<String, Double> byModel = new TreeMap<>();
        Map<String, Double> byAgent = new TreeMap<>();
        Map<String, Double> byOperation = new TreeMap<>();
        long tokens = 0;
        for (CostEntry entry : entries) {
            if (!isSpend(entry)) {
                continue;
            }
            tokens += entry.getTokensUsed();
            byModel.merge(String.valueOf(entry.getModel()), entry.getCostUsd(), Double::sum);
            byAgent.merge(String.valueOf(entry.getAgentType()), entry.getCostUsd(), Double::sum);
            byOperation.merge(entry.getOperation().name(), entry.getCostUsd(), Double::sum);
        }
        return CostSummary.builder()
            .totalCost(total)
            .totalTokens(tokens)
            .costLimit(costLimit)
            .nextPauseAt(pauseMark)
            .costByModel(byModel)
            .costByAgent(byAgent)
            .costByOperation(byOperation)
            .approachingLimit(trackingEnabled && total >= pauseMark * warningRatio)
            .paused(paused)
            .status(paused ? LedgerStatus.PAUSED_NEEDS_CONFIRMATION : LedgerStatus.OK)
            .build();
    }

    /**
     * Spend entries recorded since the last reset, newest first.
     */
    public synchronized List<CostEntry> history(CostHistoryFilter filter) {
        CostHistoryFilter effective = filter != null ? filter : CostHistoryFilter.builder().build();
        List<CostEntry> matching = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0 && matching.size() < effective.getLimit(); i--) {
            CostEntry entry = entries.get(i);
            if (isSpend(entry) && effective.matches(entry)) {
                matching.add(entry);
            }
        }
        return matching;
    }

    private void replay(String line) {
        CostEntry entry;
        try {
            entry = mapper.readValue(line, CostEntry.class);
        } catch (IOException e) {
            log.warn("Skipping malformed cost entry. error={}", e.getMessage());
            return;
        }
        if (entry.getOperation() == CostOperation.RESET) {
            applyReset();
        } else if (entry.getOperation() == CostOperation.CONFIRMATION) {
            entries.add(entry);
            applyConfirmation();
        } else {
            entries.add(entry);
            total += entry.getCostUsd();
            if (trackingEnabled && total >= pauseMark) {
                paused = true;
            }
        }
    }

    private void applyConfirmation() {
        paused = false;
        warned = false;
        pauseMark = total + costLimit;
    }

    private void applyReset() {
        entries.clear();
        total = 0.0;
        paused = false;
        warned = false;
        pauseMark = costLimit;
    }

    private static boolean isSpend(CostEntry entry) {
        return entry.getOperation() == CostOperation.GENERATION || entry.getOperation() == CostOperation.VERIFICATION;
    }

    private CostEntry marker(CostOperation operation) {
        return CostEntry.builder()
            .timestamp(Instant.now())
            .operation(operation)
            .build();
    }

    private void persist(CostEntry entry) {
        if (!persistenceEnabled) {
            return;
        }
        try {
            Path costsFile = Paths.get(dataPath, COSTS_FILE);
            Files.createDirectories(costsFile.toAbsolutePath().getParent());
            String json = mapper.writeValueAsString(entry);
            Files.writeString(costsFile, json + "\n", StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // the in-memory total stays authoritative for this process
            log.error("Failed to persist cost entry. taskId={}, cost={}, error={}",
                entry.getTaskId(), entry.getCostUsd(), e.getMessage(), e);
        }
    }
}
