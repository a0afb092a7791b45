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

import com.google.common.base.Preconditions;
import com.modkit.dispatch.ActivityDispatch;
import com.modkit.dispatch.ActivityRef;
import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchTarget;
import com.modkit.dispatch.DispatchType;
import com.modkit.dispatch.EnqueueOutcome;
import com.modkit.dispatch.IActivityResolver;
import com.modkit.dispatch.IdentifierFilter;
import com.modkit.dispatch.OnExistingFound;
import com.modkit.sysprops.props.DispatchDelaysDisabled;
import com.modkit.sysprops.props.DispatchForcedDelayMillis;
import com.modkit.util.DurationResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared producer logic: resolve the real targets, check the queue for colliding records, apply the
 * configured policy and queue a new record per target.
 */
@Slf4j
abstract class AbstractDispatchAction implements IAction {
    private static final DateTimeFormatter QUEUED_AT_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    protected final String name;
    protected final DispatchActionConfig config;
    protected final DispatchQueue queue;
    protected final IActivityResolver resolver;
    protected final Clock clock;
    private final List<DispatchTarget> targets;

    protected AbstractDispatchAction(String name,
                                     DispatchActionConfig config,
                                     DispatchQueue queue,
                                     IActivityResolver resolver,
                                     Clock clock) {
        Preconditions.checkNotNull(config.getDelay(), "%s requires a delay", name);
        Preconditions.checkArgument(!config.getDelay().isNegative(), "%s has a negative delay", name);
        this.targets = config.getTarget() == null || config.getTarget().isEmpty()
            ? List.of(DispatchTarget.SELF) : List.copyOf(config.getTarget());
        Preconditions.checkArgument(!targets.contains(DispatchTarget.ANY),
            "'any' target is only valid when cancelling dispatches");
        this.name = name;
        this.config = config;
        this.queue = queue;
        this.resolver = resolver;
        this.clock = clock;
    }

    protected abstract DispatchType dispatchType();

    @Override
    public String name() {
        return name;
    }

    /**
     * The delay records are queued with. Operators can force a short fixed delay for every action.
     */
    Duration effectiveDelay() {
        if (DispatchDelaysDisabled.INSTANCE.get()) {
            return Duration.ofMillis(DispatchForcedDelayMillis.INSTANCE.get());
        }
        return config.getDelay();
    }

    @Override
    public CompletableFuture<ActionResult> process(ActivityRef item, boolean runDryRun) {
        boolean actionDryRun = Boolean.TRUE.equals(config.getDryRun());
        boolean dryRun = runDryRun || actionDryRun;

        List<DispatchTarget> realTargets = targets;
        if (item.isSubmission()) {
            if (targets.contains(DispatchTarget.PARENT)) {
                if (!targets.contains(DispatchTarget.SELF)) {
                    return CompletableFuture.completedFuture(ActionResult.notTriggered(name, dryRun,
                        "Cannot use 'parent' as target because Activity is a Submission."));
                }
                log.warn("[{}] Cannot use 'parent' as target because Activity is a Submission. Reverted to 'self'",
                    name);
            }
            realTargets = List.of(DispatchTarget.SELF);
        }

        Duration delay = effectiveDelay();
        List<CompletableFuture<String>> hints = new ArrayList<>();
        for (DispatchTarget target : realTargets) {
            hints.add(resolveTarget(item, target, dryRun)
                .thenApply(activity -> queueFor(item, target, activity, delay, runDryRun, actionDryRun)));
        }
        return CompletableFuture.allOf(hints.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                String result = describe(delay, hints.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList()));
                log.debug("[{}] {}", name, result);
                return ActionResult.triggered(name, dryRun, result);
            });
    }

    private CompletableFuture<ActivityRef> resolveTarget(ActivityRef item, DispatchTarget target, boolean dryRun) {
        if (target == DispatchTarget.SELF) {
            return CompletableFuture.completedFuture(item);
        }
        // a simulated run never executes, spare the platform call
        return dryRun ? CompletableFuture.completedFuture(item.parentStub()) : resolver.getSubmissionForComment(item);
    }

    private String queueFor(ActivityRef item,
                            DispatchTarget target,
                            ActivityRef activity,
                            Duration delay,
                            boolean runDryRun,
                            boolean actionDryRun) {
        String hint = target == DispatchTarget.SELF
            ? String.format("This Activity (%s)", item.id())
            : String.format("Comment's parent Submission (%s)", activity.id());
        ActivityDispatch candidate = ActivityDispatch.builder()
            .activity(activity)
            .type(dispatchType())
            .queuedAt(clock.instant())
            .delay(delay)
            .identifier(config.getIdentifier())
            .gotoTarget(config.getGotoTarget())
            .onExistingFound(config.getOnExistingFound())
            .tardyTolerant(config.getTardyTolerant())
            .cancelIfQueued(config.getCancelIfQueued())
            .action(name)
            .dryRun(runDryRun ? Boolean.TRUE : config.getDryRun())
            .build();

        List<ActivityDispatch> colliding;
        if (actionDryRun) {
            IdentifierFilter collision = IdentifierFilter.forCollision(config.getIdentifier());
            colliding = queue.find(existing -> existing.getActivity().id().equals(activity.id())
                && collision.matches(existing.getIdentifier()));
        } else {
            EnqueueOutcome outcome = queue.enqueue(candidate, config.getOnExistingFound());
            colliding = outcome.colliding();
        }
        if (colliding.isEmpty()) {
            return hint;
        }
        return describeCollision(colliding, hint, config.getOnExistingFound());
    }

    private static String describeCollision(List<ActivityDispatch> colliding, String hint, OnExistingFound policy) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < colliding.size(); i++) {
            ActivityDispatch existing = colliding.get(i);
            entries.add(String.format("[%d] Queued At %s for %s", i + 1,
                QUEUED_AT_FORMAT.format(existing.getQueuedAt()), DurationResolver.humanize(existing.getDelay())));
        }
        String existingRes = String.format("Dispatch activities (%s) already exist for %s",
            String.join(" ", entries), hint);
        switch (policy) {
            case SKIP:
                return existingRes + " and existing behavior is SKIP so nothing queued";
            case REPLACE:
                return existingRes + " and existing behavior is REPLACE so replaced existing";
            case IGNORE:
            default:
                return existingRes + " but existing behavior is IGNORE so adding new dispatch activity anyway";
        }
    }

    private String describe(Duration delay, List<String> hints) {
        StringBuilder result = new StringBuilder("Delay: ").append(DurationResolver.humanize(delay));
        if (config.getIdentifier() != null) {
            result.append(" | Identifier: ").append(config.getIdentifier());
        }
        if (config.getGotoTarget() != null) {
            result.append(" | Goto: ").append(config.getGotoTarget());
        }
        return result.append(" | Dispatch Results: ").append(String.join(" <<>> ", hints)).toString();
    }
}
