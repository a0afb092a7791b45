/*
 * Copyright (c) 2024. The ModKit Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.modkit.dispatch;

import com.modkit.metrics.ContainerMetric;
import com.modkit.metrics.IContainerMeter;
import com.modkit.sysprops.props.DispatchTickIntervalMillis;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically feeds due dispatch records back into the pipeline.
 *
 * <p>Each record is executed at most once: it is flagged processing when claimed and removed from
 * the queue when the pipeline finishes, whether the pipeline succeeded or failed. Failures are
 * logged and never retried.
 */
@Slf4j
public class DispatchScheduler {
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final DispatchQueue queue;
    private final IActivityResolver resolver;
    private final IActivityPipeline pipeline;
    private final Clock clock;
    private final Duration tickInterval;
    private final ScheduledExecutorService jobScheduler;
    private final IContainerMeter meter;
    private volatile ScheduledFuture<?> tickFuture;

    public DispatchScheduler(DispatchQueue queue,
                             IActivityResolver resolver,
                             IActivityPipeline pipeline,
                             Clock clock,
                             ScheduledExecutorService jobScheduler) {
        this(queue, resolver, pipeline, clock,
            Duration.ofMillis(DispatchTickIntervalMillis.INSTANCE.get()), jobScheduler);
    }

    public DispatchScheduler(DispatchQueue queue,
                             IActivityResolver resolver,
                             IActivityPipeline pipeline,
                             Clock clock,
                             Duration tickInterval,
                             ScheduledExecutorService jobScheduler) {
        this.queue = queue;
        this.resolver = resolver;
        this.pipeline = pipeline;
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.jobScheduler = jobScheduler;
        this.meter = IContainerMeter.get(queue.container());
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            log.debug("[DispatchScheduler] container={} started, tick every {}ms",
                queue.container(), tickInterval.toMillis());
            scheduleTick();
        }
    }

    /**
     * Stop ticking. Executions already handed to the pipeline run to completion.
     */
    public CompletableFuture<Void> stop() {
        if (started.compareAndSet(true, false)) {
            ScheduledFuture<?> future = tickFuture;
            if (future != null) {
                future.cancel(false);
            }
            CompletableFuture<Void> onDone = new CompletableFuture<>();
            jobScheduler.execute(() -> onDone.complete(null));
            log.debug("[DispatchScheduler] container={} stopped", queue.container());
            return onDone;
        }
        return CompletableFuture.completedFuture(null);
    }

    public boolean isStarted() {
        return started.get();
    }

    private void scheduleTick() {
        if (!started.get()) {
            return;
        }
        tickFuture = jobScheduler.schedule(() -> {
            try {
                tick();
            } catch (Throwable e) {
                log.error("[DispatchScheduler] container={} tick failed", queue.container(), e);
            } finally {
                scheduleTick();
            }
        }, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Run one pass: claim every due record and hand it to the pipeline. Returns once all claimed
     * records have finished executing; the caller is never blocked while they run.
     */
    public CompletableFuture<Void> tick() {
        Instant now = clock.instant();
        List<ActivityDispatch> due = queue.claimDue(now);
        if (due.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        log.debug("[DispatchScheduler] container={} {} record(s) due", queue.container(), due.size());
        CompletableFuture<?>[] executions = due.stream()
            .map(dispatch -> execute(dispatch, now))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(executions);
    }

    private CompletableFuture<Void> execute(ActivityDispatch dispatch, Instant now) {
        Duration overdue = Duration.between(dispatch.dueAt(), now);
        boolean tardy = dispatch.getTardyTolerant().isTardy(overdue, tickInterval);
        if (tardy) {
            meter.recordCount(ContainerMetric.DispatchTardyCount);
            log.warn("[DispatchScheduler] container={} {} is {}ms overdue, flagged tardy",
                queue.container(), dispatch, overdue.toMillis());
        }
        DispatchContext context = new DispatchContext(dispatch.getId(),
            dispatch.getAction(),
            dispatch.getType(),
            ActivitySource.dispatch(dispatch.getIdentifier()),
            dispatch.getGotoTarget(),
            dispatch.isDryRun(),
            tardy,
            overdue);
        log.info("[DispatchScheduler] container={} executing {} (dryRun={})",
            queue.container(), dispatch, dispatch.isDryRun());
        long startNanos = System.nanoTime();
        CompletableFuture<Void> run;
        try {
            run = resolver.getActivity(dispatch.getActivity())
                .thenCompose(fresh -> pipeline.processActivity(fresh, context));
        } catch (Throwable e) {
            run = CompletableFuture.failedFuture(e);
        }
        return run.handle((v, e) -> {
            queue.complete(dispatch.getId());
            meter.timer(ContainerMetric.DispatchExecuteLatency)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            if (e != null) {
                meter.recordCount(ContainerMetric.DispatchExecuteFailureCount);
                log.error("[DispatchScheduler] container={} dispatch failed: id={}, action={}, identifier={}, "
                        + "activity={}", queue.container(), dispatch.getId(), dispatch.getAction(),
                    dispatch.getIdentifier(), dispatch.getActivity().id(), e);
            } else {
                meter.recordCount(ContainerMetric.DispatchExecuteCount);
            }
            return null;
        });
    }
}
