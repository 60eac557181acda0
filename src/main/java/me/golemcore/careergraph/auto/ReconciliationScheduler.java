package me.golemcore.careergraph.auto;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.service.ReconciliationService;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Triggers the full rebuild on the {@code careergraph.reconciliation.cron}
 * schedule (daily at 01:23 by default) from a single daemon thread. Each run
 * schedules the next one from the cron expression, so a long rebuild never
 * overlaps itself.
 */
@Component
@Slf4j
public class ReconciliationScheduler {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;

    private final ReconciliationService reconciliationService;
    private final CareerGraphProperties properties;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> nextRun;
    private CronExpression cron;
    private ZoneId zone;
    private volatile Instant nextRunAt;

    public ReconciliationScheduler(ReconciliationService reconciliationService, CareerGraphProperties properties,
            Clock clock) {
        this.reconciliationService = reconciliationService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        CareerGraphProperties.ReconciliationProperties config = properties.getReconciliation();
        if (!config.isEnabled()) {
            log.info("[Rebuild] Scheduled reconciliation disabled");
            return;
        }

        cron = CronExpression.parse(normalizeCronExpression(config.getCron()));
        zone = config.getZone() != null && !config.getZone().isBlank()
                ? ZoneId.of(config.getZone())
                : clock.getZone();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconciliation-scheduler");
            t.setDaemon(true);
            return t;
        });
        scheduleNext();
    }

    @PreDestroy
    public void shutdown() {
        if (nextRun != null) {
            nextRun.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Rebuild] Scheduler shut down");
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    void runScheduled() {
        try {
            reconciliationService.rebuild();
        } catch (IllegalStateException e) {
            log.warn("[Rebuild] Skipping scheduled run: {}", e.getMessage());
        } catch (GraphException e) {
            log.error("[Rebuild] Scheduled run failed ({}): {}", e.getKind(), e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - keep the schedule alive
            log.error("[Rebuild] Scheduled run failed", e);
        } finally {
            if (scheduler != null && !scheduler.isShutdown()) {
                scheduleNext();
            }
        }
    }

    private void scheduleNext() {
        Instant now = clock.instant();
        Instant next = computeNextExecution(cron, zone, now);
        if (next == null) {
            log.warn("[Rebuild] Cron expression {} never fires again", properties.getReconciliation().getCron());
            return;
        }
        nextRunAt = next;
        long delayMillis = Math.max(0, Duration.between(now, next).toMillis());
        nextRun = scheduler.schedule(this::runScheduled, delayMillis, TimeUnit.MILLISECONDS);
        log.info("[Rebuild] Next scheduled rebuild at {}", next);
    }

    static Instant computeNextExecution(CronExpression cron, ZoneId zone, Instant now) {
        ZonedDateTime next = cron.next(now.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Accepts 5-field (minute-first) or 6-field (second-first) cron expressions
     * and returns the 6-field form.
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new IllegalArgumentException("Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }
        return sixFieldCron;
    }
}
