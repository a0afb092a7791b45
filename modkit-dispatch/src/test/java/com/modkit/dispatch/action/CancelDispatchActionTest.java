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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import com.modkit.dispatch.ActivityDispatch;
import com.modkit.dispatch.ActivityRef;
import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchTarget;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class CancelDispatchActionTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final ActivityRef POST = ActivityRef.submission("t3_p", "sub1");
    private static final ActivityRef COMMENT = ActivityRef.comment("t1_c", "t3_p", "sub1");
    private static final ActivityRef ELSEWHERE = ActivityRef.submission("t3_x", "sub1");

    private DispatchQueue queue;

    @BeforeMethod
    public void setup() {
        queue = new DispatchQueue("sub1");
    }

    @AfterMethod
    public void tearDown() {
        queue.close();
    }

    private ActivityDispatch queue(ActivityRef activity, String identifier) {
        ActivityDispatch dispatch = ActivityDispatch.builder()
            .activity(activity).queuedAt(T0).delay(Duration.ofMinutes(10)).identifier(identifier).build();
        queue.add(dispatch);
        return dispatch;
    }

    private Set<String> remainingIdentifiers() {
        return queue.find(d -> true).stream()
            .map(d -> d.getActivity().id() + "/" + d.getIdentifier())
            .collect(Collectors.toSet());
    }

    private CancelDispatchAction action(List<String> identifiers, DispatchTarget... targets) {
        CancelDispatchActionConfig config = new CancelDispatchActionConfig();
        config.setTarget(List.of(targets));
        config.setIdentifiers(identifiers);
        return new CancelDispatchAction("cancel", config, queue);
    }

    @Test
    public void nullSentinelAndConcreteIdentifier() {
        queue(COMMENT, null);
        queue(COMMENT, "tagA");
        queue(COMMENT, "tagB");

        ActionResult result = action(Arrays.asList(null, "tagA"), DispatchTarget.SELF).process(COMMENT, false).join();
        assertTrue(result.triggered());
        assertEquals(result.result(), "Cancelled Dispatch Actions: Comment t1_c, Comment t1_c");
        assertEquals(remainingIdentifiers(), Set.of("t1_c/tagB"));
    }

    @Test
    public void omittedIdentifiersMatchAnything() {
        queue(COMMENT, null);
        queue(COMMENT, "tagA");
        queue(ELSEWHERE, "tagA");
        action(null, DispatchTarget.SELF).process(COMMENT, false).join();
        assertEquals(remainingIdentifiers(), Set.of("t3_x/tagA"));
    }

    @Test
    public void parentOnlyOnSubmission() {
        queue(POST, null);
        ActionResult result = action(null, DispatchTarget.PARENT).process(POST, false).join();
        assertFalse(result.triggered());
        assertEquals(result.result(),
            "Cannot use 'parent' as target because Activity is a Submission and no other targets specified.");
        assertEquals(queue.size(), 1);
    }

    @Test
    public void parentFallsBackToOtherTargets() {
        queue(POST, null);
        ActionResult result = action(null, DispatchTarget.PARENT, DispatchTarget.SELF).process(POST, false).join();
        assertTrue(result.triggered());
        assertEquals(queue.size(), 0);
    }

    @Test
    public void parentOfComment() {
        queue(POST, "tagA");
        queue(COMMENT, "tagA");
        action(List.of("tagA"), DispatchTarget.PARENT).process(COMMENT, false).join();
        assertEquals(remainingIdentifiers(), Set.of("t1_c/tagA"));
    }

    @Test
    public void anyTargetMatchesByIdentifierOnly() {
        queue(POST, "tagA");
        queue(ELSEWHERE, "tagA");
        queue(ELSEWHERE, "tagB");
        ActionResult result = action(List.of("tagA"), DispatchTarget.ANY).process(COMMENT, false).join();
        assertEquals(result.result(), "Cancelled Dispatch Actions: Submission t3_p, Submission t3_x");
        assertEquals(remainingIdentifiers(), Set.of("t3_x/tagB"));
    }

    @Test
    public void nothingToCancel() {
        ActionResult result = action(List.of("tagA"), DispatchTarget.ANY).process(COMMENT, false).join();
        assertTrue(result.triggered());
        assertEquals(result.result(), "No Dispatch Actions cancelled");
    }

    @Test
    public void dryRunLeavesQueueIntact() {
        queue(COMMENT, "tagA");
        ActionResult result = action(List.of("tagA"), DispatchTarget.SELF).process(COMMENT, true).join();
        assertTrue(result.dryRun());
        assertEquals(result.result(), "Cancelled Dispatch Actions: Comment t1_c");
        assertEquals(queue.size(), 1);
    }

    @Test
    public void processingRecordSurvives() {
        queue(COMMENT, "tagA");
        queue.claimDue(T0.plus(Duration.ofHours(1)));
        ActionResult result = action(null, DispatchTarget.SELF).process(COMMENT, false).join();
        assertEquals(result.result(), "No Dispatch Actions cancelled");
        assertEquals(queue.size(), 1);
    }
}
