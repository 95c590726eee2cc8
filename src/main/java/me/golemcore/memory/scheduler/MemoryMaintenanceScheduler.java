package me.golemcore.memory.scheduler;

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

import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.MaintenanceTickEvent;
import me.golemcore.memory.domain.model.SummaryKind;
import me.golemcore.memory.domain.model.TurnAppendedEvent;
import me.golemcore.memory.domain.service.CrystallizationService;
import me.golemcore.memory.domain.service.GraphCuratorService;
import me.golemcore.memory.domain.service.GraphIngestionService;
import me.golemcore.memory.domain.service.SummarizerService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.infrastructure.event.SpringEventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background maintenance driven by typed events.
 *
 * <p>
 * A single thread publishes a {@link MaintenanceTickEvent} at a fixed rate
 * and also consumes {@link TurnAppendedEvent}s handed over by the event bus,
 * so appends never wait on maintenance. Each event runs at most one job at a
 * time: if a job is in progress, the event is skipped and the next tick picks
 * up the work.
 * <ul>
 * <li>turn appended: create a crystal if one is due</li>
 * <li>tick: crystal check, optional summarization and graph ingestion when
 * their backlogs call for it, curation on its own interval</li>
 * </ul>
 */
@Component
@Slf4j
public class MemoryMaintenanceScheduler {

    private final CrystallizationService crystallizationService;
    private final SummarizerService summarizerService;
    private final GraphIngestionService ingestionService;
    private final GraphCuratorService curatorService;
    private final SpringEventBus eventBus;
    private final MemoryProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private volatile Instant lastCuration;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public MemoryMaintenanceScheduler(CrystallizationService crystallizationService,
            SummarizerService summarizerService, GraphIngestionService ingestionService,
            GraphCuratorService curatorService, SpringEventBus eventBus, MemoryProperties properties, Clock clock) {
        this.crystallizationService = crystallizationService;
        this.summarizerService = summarizerService;
        this.ingestionService = ingestionService;
        this.curatorService = curatorService;
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("[Scheduler] Maintenance scheduler disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-maintenance");
            t.setDaemon(true);
            return t;
        });
        int tickSeconds = properties.getScheduler().getTickSeconds();
        tickTask = scheduler.scheduleAtFixedRate(
                () -> eventBus.publish(new MaintenanceTickEvent(clock.instant())),
                tickSeconds,
                tickSeconds,
                TimeUnit.SECONDS);
        log.info("[Scheduler] Started with tick interval: {}s", tickSeconds);
    }

    @PreDestroy
    public void shutdown() {
        curatorService.requestStop();
        if (tickTask != null) {
            tickTask.cancel(false);
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
        log.info("[Scheduler] Shut down");
    }

    @EventListener
    public void onTurnAppended(TurnAppendedEvent event) {
        ScheduledExecutorService executor = scheduler;
        if (executor == null) {
            return;
        }
        try {
            executor.execute(() -> handleTurnAppended(event));
        } catch (RejectedExecutionException e) {
            log.debug("[Scheduler] Shutting down, dropped event for turn {}", event.turnId());
        }
    }

    /**
     * Runs on the scheduler thread, since ticks are published from it.
     */
    @EventListener
    public void onTick(MaintenanceTickEvent event) {
        runExclusive("tick", () -> {
            checkCrystallization();
            if (properties.getScheduler().isAutoSummarize()) {
                autoSummarize();
            }
            if (properties.getScheduler().isAutoIngest()) {
                autoIngest();
            }
            if (properties.getCurator().isEnabled()) {
                curateIfDue(event.at());
            }
        });
    }

    void handleTurnAppended(TurnAppendedEvent event) {
        runExclusive("turn " + event.turnId(), this::checkCrystallization);
    }

    private void runExclusive(String cause, Runnable job) {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Scheduler] {} skipped: previous job still in progress", cause);
            return;
        }
        try {
            job.run();
        } finally {
            executing.set(false);
        }
    }

    private void checkCrystallization() {
        try {
            crystallizationService.crystallizeIfDue()
                    .ifPresent(c -> log.info("[Scheduler] Created {}", c.getFilename()));
        } catch (SubstrateException e) {
            log.warn("[Scheduler] Crystallization skipped ({}): {}", e.getKind(), e.getMessage());
        }
    }

    private void autoSummarize() {
        try {
            long backlog = summarizerService.backlogCount();
            if (backlog <= properties.getSummaries().getRecommendedBacklog()) {
                return;
            }
            summarizerService.summarizeAndStore(0, SummaryKind.WORK)
                    .ifPresent(s -> log.info("[Scheduler] Auto-summarized {} ({} turns)", s.getId(),
                            s.getMessageCount()));
        } catch (SubstrateException e) {
            log.warn("[Scheduler] Auto-summarization skipped ({}): {}", e.getKind(), e.getMessage());
        }
    }

    private void autoIngest() {
        try {
            if (!ingestionService.stats().recommended()) {
                return;
            }
            ingestionService.ingestBatch(0);
        } catch (SubstrateException e) {
            log.warn("[Scheduler] Auto-ingestion skipped ({}): {}", e.getKind(), e.getMessage());
        }
    }

    private void curateIfDue(Instant now) {
        Duration interval = Duration.ofMinutes(properties.getCurator().getIntervalMinutes());
        Instant last = lastCuration;
        if (last != null && Duration.between(last, now).compareTo(interval) < 0) {
            return;
        }
        lastCuration = now;
        try {
            curatorService.curate();
        } catch (SubstrateException e) {
            log.warn("[Scheduler] Curation skipped ({}): {}", e.getKind(), e.getMessage());
        }
    }
}
