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

import com.modkit.dispatch.ActivityDispatch;
import com.modkit.dispatch.ActivityRef;
import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchTarget;
import com.modkit.dispatch.IdentifierFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Removes queued dispatch records matching a target and identifier filter without running them.
 */
@Slf4j
public class CancelDispatchAction implements IAction {
    private final String name;
    private final CancelDispatchActionConfig config;
    private final DispatchQueue queue;
    private final List<DispatchTarget> targets;
    private final IdentifierFilter identifiers;

    public CancelDispatchAction(String name, CancelDispatchActionConfig config, DispatchQueue queue) {
        this.name = name;
        this.config = config;
        this.queue = queue;
        this.targets = config.getTarget() == null || config.getTarget().isEmpty()
            ? List.of(DispatchTarget.SELF) : List.copyOf(config.getTarget());
        this.identifiers = IdentifierFilter.forCancel(config.getIdentifiers());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<ActionResult> process(ActivityRef item, boolean runDryRun) {
        boolean dryRun = runDryRun || Boolean.TRUE.equals(config.getDryRun());

        List<DispatchTarget> realTargets = targets;
        if (item.isSubmission() && targets.contains(DispatchTarget.PARENT)) {
            realTargets = targets.stream().filter(t -> t != DispatchTarget.PARENT).collect(Collectors.toList());
            if (realTargets.isEmpty()) {
                return CompletableFuture.completedFuture(ActionResult.notTriggered(name, dryRun,
                    "Cannot use 'parent' as target because Activity is a Submission and no other targets specified."));
            }
            log.warn("[{}] Cannot use 'parent' as target because Activity is a Submission. Using other targets "
                + "instead ({})", name, realTargets);
        }

        List<String> cancelled = new ArrayList<>();
        for (DispatchTarget target : realTargets) {
            Predicate<ActivityDispatch> filter = matcherFor(item, target);
            List<ActivityDispatch> matched = dryRun
                ? queue.find(filter.and(dispatch -> !dispatch.isProcessing()))
                : queue.cancel(filter);
            List<String> matchedHints = matched.stream()
                .map(dispatch -> dispatch.getActivity().describe())
                .collect(Collectors.toList());
            cancelled.addAll(matchedHints);
            log.debug("[{}] Identifiers: {} | Target: {} | Results: {}", name, identifiers.describe(),
                targetHint(target), matchedHints.isEmpty() ? "None Found" : String.join(", ", matchedHints));
        }
        return CompletableFuture.completedFuture(ActionResult.triggered(name, dryRun, cancelled.isEmpty()
            ? "No Dispatch Actions cancelled"
            : "Cancelled Dispatch Actions: " + String.join(", ", cancelled)));
    }

    private Predicate<ActivityDispatch> matcherFor(ActivityRef item, DispatchTarget target) {
        String activityId;
        switch (target) {
            case PARENT:
                activityId = item.parentId();
                break;
            case ANY:
                activityId = null;
                break;
            case SELF:
            default:
                activityId = item.id();
                break;
        }
        return dispatch -> (activityId == null || dispatch.getActivity().id().equals(activityId))
            && identifiers.matches(dispatch.getIdentifier());
    }

    private static String targetHint(DispatchTarget target) {
        switch (target) {
            case PARENT:
                return "This Comment's parent Submission";
            case ANY:
                return "Any";
            case SELF:
            default:
                return "This Activity";
        }
    }
}
