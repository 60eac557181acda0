package me.golemcore.careergraph.auto;

import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.service.ReconciliationService;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronExpression;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReconciliationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private ReconciliationService reconciliationService;
    private CareerGraphProperties properties;
    private ReconciliationScheduler scheduler;

    @BeforeEach
    void setUp() {
        reconciliationService = mock(ReconciliationService.class);
        properties = new CareerGraphProperties();
        scheduler = new ReconciliationScheduler(reconciliationService, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldPrependSecondsToFiveFieldCron() {
        assertEquals("0 23 1 * * *", ReconciliationScheduler.normalizeCronExpression("23 1 * * *"));
    }

    @Test
    void shouldKeepSixFieldCron() {
        assertEquals("0 23 1 * * *", ReconciliationScheduler.normalizeCronExpression("  0 23 1 * * *  "));
    }

    @Test
    void shouldRejectMalformedCron() {
        assertThrows(IllegalArgumentException.class, () -> ReconciliationScheduler.normalizeCronExpression(""));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationScheduler.normalizeCronExpression("1 * *"));
        assertThrows(IllegalArgumentException.class,
                () -> ReconciliationScheduler.normalizeCronExpression("99 1 * * *"));
    }

    @Test
    void shouldComputeNextDailyRun() {
        CronExpression cron = CronExpression.parse("0 23 1 * * *");

        assertEquals(Instant.parse("2026-03-01T01:23:00Z"),
                ReconciliationScheduler.computeNextExecution(cron, ZoneOffset.UTC, NOW));
        assertEquals(Instant.parse("2026-03-02T01:23:00Z"), ReconciliationScheduler.computeNextExecution(cron,
                ZoneOffset.UTC, Instant.parse("2026-03-01T01:23:00Z")));
    }

    @Test
    void shouldHonorConfiguredZone() {
        CronExpression cron = CronExpression.parse("0 23 1 * * *");

        assertEquals(Instant.parse("2026-03-01T00:23:00Z"),
                ReconciliationScheduler.computeNextExecution(cron, ZoneId.of("Europe/Berlin"), NOW));
    }

    @Test
    void shouldScheduleFirstRunOnInit() {
        properties.getReconciliation().setCron("23 1 * * *");
        properties.getReconciliation().setZone("UTC");

        scheduler.init();

        assertEquals(Instant.parse("2026-03-01T01:23:00Z"), scheduler.getNextRunAt());
    }

    @Test
    void shouldStayIdleWhenDisabled() {
        properties.getReconciliation().setEnabled(false);

        scheduler.init();

        assertNull(scheduler.getNextRunAt());
    }

    @Test
    void shouldSurviveFailedScheduledRun() {
        when(reconciliationService.rebuild()).thenThrow(GraphException.sourceInvalid("Job source is empty"));

        assertDoesNotThrow(() -> scheduler.runScheduled());
        verify(reconciliationService).rebuild();
    }

    @Test
    void shouldSkipRunWhileRebuildInProgress() {
        when(reconciliationService.rebuild()).thenThrow(new IllegalStateException("A rebuild is already running"));

        assertDoesNotThrow(() -> scheduler.runScheduled());
    }
}
