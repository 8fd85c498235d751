package com.autonomous.orchestrator.service;

import com.autonomous.orchestrator.config.OrchestratorProperties;
import com.autonomous.orchestrator.model.AgentType;
import com.autonomous.orchestrator.model.CostEntry;
import com.autonomous.orchestrator.model.CostHistoryFilter;
import com.autonomous.orchestrator.model.CostOperation;
import com.autonomous.orchestrator.model.CostSummary;
import com.autonomous.orchestrator.model.CostThresholdReachedEvent;
import com.autonomous.orchestrator.model.LedgerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CostLedgerTest {

    private OrchestratorProperties properties;
    private List<Object> published;
    private CostLedger ledger;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.setPersistenceEnabled(false);
        properties.setCostLimitUsd(5.0);
        published = new CopyOnWriteArrayList<>();
        ledger = new CostLedger(properties, published::add);
    }

    @Test
    void shouldAccumulateUsage() {
        assertEquals(1.5, ledger.recordUsage(1.5), 0.0001);
        assertEquals(3.0, ledger.recordUsage(1.5), 0.0001);
        assertEquals(3.0, ledger.getTotal(), 0.0001);
        assertEquals(LedgerStatus.OK, ledger.checkThreshold());
    }

    @Test
    void shouldRejectNegativeAmount() {
        ledger.recordUsage(1.0);

        assertThrows(IllegalArgumentException.class, () -> ledger.recordUsage(-0.5));
        assertEquals(1.0, ledger.getTotal(), 0.0001);
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        properties.setCostLimitUsd(1_000_000);
        ledger = new CostLedger(properties, published::add);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1000; i++) {
                        ledger.recordUsage(0.25);
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(2000.0, ledger.getTotal(), 0.0001);
    }

    @Test
    void shouldPauseAtCeilingAndPublishOnce() {
        ledger.recordUsage(4.0);
        assertFalse(ledger.isPaused());

        ledger.recordUsage(1.0);
        ledger.recordUsage(0.5);

        assertEquals(LedgerStatus.PAUSED_NEEDS_CONFIRMATION, ledger.checkThreshold());
        List<Object> reached = published.stream()
            .filter(CostThresholdReachedEvent.class::isInstance)
            .collect(Collectors.toList());
        assertEquals(1, reached.size());
        assertEquals(5.0, ((CostThresholdReachedEvent) reached.get(0)).getTotalCost(), 0.0001);
    }

    @Test
    void shouldRefuseAdmissionWhilePaused() {
        ledger.recordUsage(5.0);
        Runnable admission = () -> fail("must not admit while paused");

        assertFalse(ledger.tryAdmit(admission));
    }

    @Test
    void shouldResumeWithoutResettingTotalOnConfirm() {
        ledger.recordUsage(6.0);

        assertTrue(ledger.confirmContinue());

        assertEquals(6.0, ledger.getTotal(), 0.0001);
        assertEquals(LedgerStatus.OK, ledger.checkThreshold());
        assertEquals(11.0, ledger.summary().getNextPauseAt(), 0.0001);
        boolean[] admitted = {false};
        assertTrue(ledger.tryAdmit(() -> admitted[0] = true));
        assertTrue(admitted[0]);
    }

    @Test
    void shouldIgnoreConfirmWhenNotPaused() {
        ledger.recordUsage(1.0);

        assertFalse(ledger.confirmContinue());
        assertFalse(ledger.confirmContinue());
        assertEquals(5.0, ledger.summary().getNextPauseAt(), 0.0001);
    }

    @Test
    void shouldPauseAgainAfterAnotherCeilingOfSpend() {
        ledger.recordUsage(5.0);
        ledger.confirmContinue();

        ledger.recordUsage(4.9);
        assertFalse(ledger.isPaused());
        ledger.recordUsage(0.1);
        assertTrue(ledger.isPaused());
    }

    @Test
    void shouldNeverPauseWhenTrackingDisabled() {
        properties.setEnableCostTracking(false);
        ledger = new CostLedger(properties, published::add);

        ledger.recordUsage(50.0);

        assertFalse(ledger.isPaused());
        assertEquals(50.0, ledger.getTotal(), 0.0001);
        assertTrue(published.isEmpty());
    }

    @Test
    void shouldZeroTotalOnReset() {
        ledger.recordUsage(7.0);

        ledger.reset();

        assertEquals(0.0, ledger.getTotal(), 0.0001);
        assertFalse(ledger.isPaused());
        assertEquals(5.0, ledger.summary().getNextPauseAt(), 0.0001);
    }

    @Test
    void shouldSummarizeByModelAgentAndOperation() {
        ledger.recordUsage(entry("sonnet", AgentType.CODING, CostOperation.GENERATION, 1.0, 1000));
        ledger.recordUsage(entry("opus", AgentType.CODING, CostOperation.VERIFICATION, 0.5, 200));
        ledger.recordUsage(entry("sonnet", AgentType.DESIGN, CostOperation.GENERATION, 2.0, 3000));

        CostSummary summary = ledger.summary();

        assertEquals(3.5, summary.getTotalCost(), 0.0001);
        assertEquals(4200, summary.getTotalTokens());
        assertEquals(3.0, summary.getCostByModel().get("sonnet"), 0.0001);
        assertEquals(1.5, summary.getCostByAgent().get("CODING"), 0.0001);
        assertEquals(0.5, summary.getCostByOperation().get("VERIFICATION"), 0.0001);
        assertFalse(summary.isApproachingLimit());
    }

    @Test
    void shouldFlagApproachingLimitAtWarningThreshold() {
        ledger.recordUsage(4.0);

        assertTrue(ledger.summary().isApproachingLimit());
        assertFalse(ledger.summary().isPaused());
    }

    @Test
    void shouldRestoreTotalAndPauseFromDisk() throws Exception {
        ledger.setDataPath(tempDir.toString());
        ledger.recordUsage(entry("sonnet", AgentType.CODING, CostOperation.GENERATION, 3.0, 100));
        ledger.recordUsage(entry("sonnet", AgentType.CODING, CostOperation.GENERATION, 2.5, 100));
        assertTrue(Files.exists(tempDir.resolve("costs.jsonl")));

        CostLedger restored = new CostLedger(properties, published::add);
        restored.setDataPath(tempDir.toString());
        restored.init();

        assertEquals(5.5, restored.getTotal(), 0.0001);
        assertTrue(restored.isPaused());
    }

    @Test
    void shouldReplayConfirmationAndResetMarkers() {
        ledger.setDataPath(tempDir.toString());
        ledger.recordUsage(9.0);
        ledger.reset();
        ledger.recordUsage(6.0);
        ledger.confirmContinue();
        ledger.recordUsage(1.0);

        CostLedger restored = new CostLedger(properties, published::add);
        restored.setDataPath(tempDir.toString());
        restored.init();

        assertEquals(7.0, restored.getTotal(), 0.0001);
        assertFalse(restored.isPaused());
        assertEquals(11.0, restored.summary().getNextPauseAt(), 0.0001);
    }

    @Test
    void shouldListHistoryNewestFirstWithFilters() {
        ledger.recordUsage(at("t-1", AgentType.CODING, 0.1, "2024-01-01T10:00:00Z"));
        ledger.recordUsage(at("t-2", AgentType.DESIGN, 0.2, "2024-01-01T11:00:00Z"));
        ledger.recordUsage(at("t-1", AgentType.CODING, 0.3, "2024-01-01T12:00:00Z"));

        List<CostEntry> all = ledger.history(null);
        List<CostEntry> forTask = ledger.history(CostHistoryFilter.builder().taskId("t-1").build());
        List<CostEntry> design = ledger.history(CostHistoryFilter.builder().agentType(AgentType.DESIGN).build());
        List<CostEntry> window = ledger.history(CostHistoryFilter.builder()
            .from(Instant.parse("2024-01-01T11:00:00Z"))
            .to(Instant.parse("2024-01-01T12:00:00Z"))
            .build());
        List<CostEntry> latest = ledger.history(CostHistoryFilter.builder().limit(1).build());

        assertEquals(List.of(0.3, 0.2, 0.1), costs(all));
        assertEquals(List.of(0.3, 0.1), costs(forTask));
        assertEquals(List.of(0.2), costs(design));
        assertEquals(List.of(0.2), costs(window));
        assertEquals(List.of(0.3), costs(latest));
    }

    @Test
    void shouldLeaveMarkersOutOfHistory() {
        ledger.recordUsage(6.0);
        ledger.confirmContinue();
        ledger.recordUsage(0.5);

        assertEquals(List.of(0.5, 6.0), costs(ledger.history(null)));

        ledger.reset();
        assertTrue(ledger.history(null).isEmpty());
    }

    private static CostEntry at(String taskId, AgentType agent, double cost, String timestamp) {
        return CostEntry.builder()
            .taskId(taskId)
            .agentType(agent)
            .model("sonnet")
            .operation(CostOperation.GENERATION)
            .costUsd(cost)
            .timestamp(Instant.parse(timestamp))
            .build();
    }

    private static List<Double> costs(List<CostEntry> entries) {
        return entries.stream().map(CostEntry::getCostUsd).collect(Collectors.toList());
    }

    private static CostEntry entry(String model, AgentType agent, CostOperation operation, double cost, long tokens) {
        return CostEntry.builder()
            .taskId("task-1")
            .model(model)
            .agentType(agent)
            .operation(operation)
            .costUsd(cost)
            .tokensUsed(tokens)
            .build();
    }
}
