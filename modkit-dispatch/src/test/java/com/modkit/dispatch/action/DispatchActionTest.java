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

package com.modkit.dispatch.action;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.modkit.dispatch.ActivityDispatch;
import com.modkit.dispatch.ActivityRef;
import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchTarget;
import com.modkit.dispatch.DispatchType;
import com.modkit.dispatch.IActivityResolver;
import com.modkit.dispatch.MutableClock;
import com.modkit.dispatch.OnExistingFound;
import com.modkit.sysprops.props.DispatchDelaysDisabled;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class DispatchActionTest {
    private static final ActivityRef POST = ActivityRef.submission("t3_p", "sub1");
    private static final ActivityRef COMMENT = ActivityRef.comment("t1_c", "t3_p", "sub1");
    private static final ActivityRef FRESH_POST = ActivityRef.submission("t3_p", "sub1");

    @Mock
    private IActivityResolver resolver;
    private AutoCloseable closeable;
    private MutableClock clock;
    private DispatchQueue queue;

    @BeforeMethod
    public void setup() {
        closeable = MockitoAnnotations.openMocks(this);
        when(resolver.getSubmissionForComment(any())).thenReturn(CompletableFuture.completedFuture(FRESH_POST));
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        queue = new DispatchQueue("sub1");
    }

    @AfterMethod
    public void tearDown() throws Exception {
        System.clearProperty(DispatchDelaysDisabled.INSTANCE.propKey());
        DispatchDelaysDisabled.INSTANCE.resolve();
        queue.close();
        closeable.close();
    }

    private DispatchActionConfig config(DispatchTarget... targets) {
        DispatchActionConfig config = new DispatchActionConfig();
        config.setDelay("2 minutes");
        config.setTarget(List.of(targets));
        return config;
    }

    private DispatchAction action(DispatchActionConfig config) {
        return new DispatchAction("delayedCheck", config, queue, resolver, clock);
    }

    @Test
    public void queuesSelf() {
        DispatchActionConfig config = config(DispatchTarget.SELF);
        config.setIdentifier("tagA");
        config.setGotoTarget("rule2");
        ActionResult result = action(config).process(COMMENT, false).join();

        assertTrue(result.triggered());
        assertFalse(result.dryRun());
        assertEquals(result.result(),
            "Delay: 2 minutes | Identifier: tagA | Goto: rule2 | Dispatch Results: This Activity (t1_c)");
        ActivityDispatch queued = queue.find(d -> true).get(0);
        assertEquals(queued.getActivity(), COMMENT);
        assertEquals(queued.getType(), DispatchType.DISPATCH);
        assertEquals(queued.getDelay(), Duration.ofMinutes(2));
        assertEquals(queued.getQueuedAt(), clock.instant());
        assertEquals(queued.getIdentifier(), "tagA");
        assertEquals(queued.getGotoTarget(), "rule2");
        assertEquals(queued.getAction(), "delayedCheck");
        assertNull(queued.getDryRun());
    }

    @Test
    public void parentOfCommentIsFetched() {
        ActionResult result = action(config(DispatchTarget.SELF, DispatchTarget.PARENT)).process(COMMENT, false).join();
        assertTrue(result.triggered());
        assertTrue(result.result().endsWith(
            "Dispatch Results: This Activity (t1_c) <<>> Comment's parent Submission (t3_p)"));
        verify(resolver).getSubmissionForComment(COMMENT);
        assertEquals(queue.size(), 2);
        assertEquals(queue.find(d -> d.getActivity().isSubmission()).get(0).getActivity(), FRESH_POST);
    }

    @Test
    public void parentOnlyOnSubmissionIsNotTriggered() {
        ActionResult result = action(config(DispatchTarget.PARENT)).process(POST, false).join();
        assertFalse(result.triggered());
        assertEquals(result.result(), "Cannot use 'parent' as target because Activity is a Submission.");
        assertEquals(queue.size(), 0);
    }

    @Test
    public void parentWithSelfOnSubmissionRevertsToSelf() {
        ActionResult result = action(config(DispatchTarget.SELF, DispatchTarget.PARENT)).process(POST, false).join();
        assertTrue(result.triggered());
        assertEquals(queue.size(), 1);
        verify(resolver, never()).getSubmissionForComment(any());
    }

    @Test
    public void rejectsAnyTarget() {
        assertThrows(IllegalArgumentException.class, () -> action(config(DispatchTarget.ANY)));
        DispatchActionConfig noDelay = new DispatchActionConfig();
        assertThrows(NullPointerException.class, () -> action(noDelay));
    }

    @Test
    public void skipPolicyReportsExisting() {
        DispatchActionConfig config = config(DispatchTarget.SELF);
        config.setOnExistingFound(OnExistingFound.SKIP);
        DispatchAction action = action(config);
        action.process(COMMENT, false).join();
        clock.advance(Duration.ofSeconds(30));

        ActionResult second = action.process(COMMENT, false).join();
        assertEquals(queue.size(), 1);
        assertTrue(second.result().contains(
            "Dispatch activities ([1] Queued At 2024-03-01 10:00:00Z for 2 minutes) already exist for "
                + "This Activity (t1_c) and existing behavior is SKIP so nothing queued"), second.result());
    }

    @Test
    public void replacePolicy() {
        DispatchActionConfig config = config(DispatchTarget.SELF);
        config.setOnExistingFound(OnExistingFound.REPLACE);
        DispatchAction action = action(config);
        action.process(COMMENT, false).join();
        String firstId = queue.find(d -> true).get(0).getId();

        action.process(COMMENT, false).join();
        assertEquals(queue.size(), 1);
        assertFalse(queue.find(d -> true).get(0).getId().equals(firstId));
    }

    @Test
    public void explicitDryRunQueuesNothing() {
        DispatchActionConfig config = config(DispatchTarget.SELF, DispatchTarget.PARENT);
        config.setDryRun(true);
        ActionResult result = action(config).process(COMMENT, false).join();
        assertTrue(result.dryRun());
        assertTrue(result.triggered());
        assertEquals(queue.size(), 0);
        verify(resolver, never()).getSubmissionForComment(any());
    }

    @Test
    public void simulatedRunQueuesDryRunRecord() {
        ActionResult result = action(config(DispatchTarget.SELF, DispatchTarget.PARENT)).process(COMMENT, true).join();
        assertTrue(result.dryRun());
        assertEquals(queue.size(), 2);
        assertTrue(queue.find(d -> true).stream().allMatch(ActivityDispatch::isDryRun));
        // the parent is a stub, no platform call for a simulated run
        verify(resolver, never()).getSubmissionForComment(any());
        assertEquals(queue.find(d -> d.getActivity().isSubmission()).get(0).getActivity().id(), "t3_p");
    }

    @Test
    public void delaysDisabledForcesShortDelay() {
        System.setProperty(DispatchDelaysDisabled.INSTANCE.propKey(), "true");
        DispatchDelaysDisabled.INSTANCE.resolve();
        ActionResult result = action(config(DispatchTarget.SELF)).process(COMMENT, false).join();
        assertEquals(queue.find(d -> true).get(0).getDelay(), Duration.ofSeconds(1));
        assertTrue(result.result().startsWith("Delay: 1 second |"));
    }

    @Test
    public void rerunQueuesRerunRecord() {
        new RerunAction("rerun", config(DispatchTarget.SELF), queue, resolver, clock).process(POST, false).join();
        assertEquals(queue.find(d -> true).get(0).getType(), DispatchType.RERUN);
    }
}
