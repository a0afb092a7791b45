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

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import com.modkit.util.ThreadUtil;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class DispatchSchedulerTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final ActivityRef COMMENT = ActivityRef.comment("t1_c", "t3_p", "sub1");

    @Mock
    private IActivityResolver resolver;
    @Mock
    private IActivityPipeline pipeline;
    private AutoCloseable closeable;
    private ScheduledExecutorService jobScheduler;
    private MutableClock clock;
    private DispatchQueue queue;
    private DispatchScheduler scheduler;

    @BeforeMethod
    public void setup() {
        closeable = MockitoAnnotations.openMocks(this);
        when(resolver.getActivity(any())).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));
        when(pipeline.processActivity(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        jobScheduler = ThreadUtil.timerExecutor("dispatch-test-%d", 1);
        clock = new MutableClock(T0);
        queue = new DispatchQueue("sub1");
        scheduler = new DispatchScheduler(queue, resolver, pipeline, clock, Duration.ofSeconds(1), jobScheduler);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        scheduler.stop().join();
        jobScheduler.shutdownNow();
        queue.close();
        closeable.close();
    }

    private ActivityDispatch queued(Duration delay, String identifier, TardyTolerance tolerance) {
        ActivityDispatch dispatch = ActivityDispatch.builder()
            .activity(COMMENT)
            .queuedAt(clock.instant())
            .delay(delay)
            .identifier(identifier)
            .gotoTarget("rule2")
            .tardyTolerant(tolerance)
            .action("recheck")
            .build();
        queue.add(dispatch);
        return dispatch;
    }

    @Test
    public void dueRecordRunsOnceAndLeavesQueue() {
        queued(Duration.ofSeconds(2), "tagA", null);

        clock.advance(Duration.ofSeconds(1));
        scheduler.tick().join();
        verify(pipeline, never()).processActivity(any(), any());

        clock.advance(Duration.ofSeconds(2));
        scheduler.tick().join();
        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(pipeline, times(1)).processActivity(eq(COMMENT), context.capture());
        assertEquals(queue.size(), 0);

        DispatchContext ctx = context.getValue();
        assertEquals(ctx.source(), ActivitySource.dispatch("tagA"));
        assertEquals(ctx.source().toString(), "dispatch:tagA");
        assertEquals(ctx.gotoTarget(), "rule2");
        assertEquals(ctx.action(), "recheck");
        assertEquals(ctx.overdue(), Duration.ofSeconds(1));
        assertFalse(ctx.dryRun());
        assertFalse(ctx.tardy());

        scheduler.tick().join();
        verify(pipeline, times(1)).processActivity(any(), any());
    }

    @Test
    public void failedExecutionStillRemoved() {
        when(pipeline.processActivity(any(), any()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("ban failed")));
        queued(Duration.ofSeconds(1), null, null);
        clock.advance(Duration.ofSeconds(5));

        scheduler.tick().join();
        assertEquals(queue.size(), 0);
        scheduler.tick().join();
        verify(pipeline, times(1)).processActivity(any(), any());
    }

    @Test
    public void synchronousThrowStillRemoved() {
        when(resolver.getActivity(any())).thenThrow(new IllegalStateException("platform down"));
        queued(Duration.ofSeconds(1), null, null);
        clock.advance(Duration.ofSeconds(5));

        scheduler.tick().join();
        assertEquals(queue.size(), 0);
        verify(pipeline, never()).processActivity(any(), any());
    }

    @Test
    public void sourceWithoutIdentifier() {
        queued(Duration.ZERO, null, null);
        scheduler.tick().join();
        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(pipeline).processActivity(any(), context.capture());
        assertNull(context.getValue().source().identifier());
        assertEquals(context.getValue().source().toString(), "dispatch");
    }

    @Test
    public void tardyFlagging() {
        queued(Duration.ofSeconds(10), "strict", TardyTolerance.NOT_TOLERANT);
        queued(Duration.ofSeconds(10), "lenient", TardyTolerance.ALWAYS);
        queued(Duration.ofSeconds(10), "window", TardyTolerance.of(Duration.ofMinutes(5)));
        queued(Duration.ofSeconds(10), "short", TardyTolerance.of(Duration.ofMinutes(1)));
        clock.advance(Duration.ofSeconds(10).plusMinutes(2));

        scheduler.tick().join();
        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(pipeline, times(4)).processActivity(any(), context.capture());
        for (DispatchContext ctx : context.getAllValues()) {
            assertEquals(ctx.overdue(), Duration.ofMinutes(2));
            switch (ctx.source().identifier()) {
                case "strict":
                case "short":
                    assertTrue(ctx.tardy(), ctx.source().identifier());
                    break;
                default:
                    assertFalse(ctx.tardy(), ctx.source().identifier());
            }
        }
    }

    @Test
    public void dryRunCarriedThrough() {
        queue.add(ActivityDispatch.builder()
            .activity(COMMENT).queuedAt(T0).delay(Duration.ZERO).dryRun(true).type(DispatchType.RERUN).build());
        scheduler.tick().join();
        ArgumentCaptor<DispatchContext> context = ArgumentCaptor.forClass(DispatchContext.class);
        verify(pipeline).processActivity(any(), context.capture());
        assertTrue(context.getValue().dryRun());
        assertEquals(context.getValue().type(), DispatchType.RERUN);
    }

    @Test
    public void inFlightRecordNotReselected() {
        CompletableFuture<Void> running = new CompletableFuture<>();
        when(pipeline.processActivity(any(), any())).thenReturn(running);
        queued(Duration.ZERO, null, null);

        CompletableFuture<Void> firstTick = scheduler.tick();
        assertFalse(firstTick.isDone());
        scheduler.tick().join();
        verify(pipeline, times(1)).processActivity(any(), any());
        assertEquals(queue.size(), 1);

        running.complete(null);
        firstTick.join();
        assertEquals(queue.size(), 0);
    }

    @Test
    public void backgroundTicking() {
        queued(Duration.ofMillis(100), null, null);
        clock.advance(Duration.ofSeconds(1));
        scheduler.start();
        assertTrue(scheduler.isStarted());
        await().atMost(5, TimeUnit.SECONDS).until(() -> queue.size() == 0);
        verify(pipeline).processActivity(any(), any());

        scheduler.stop().join();
        assertFalse(scheduler.isStarted());
    }
}
