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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Pending dispatch records of one container.
 *
 * <p>Every read and write happens under a single lock so that a collision scan and the insert or
 * replace following it form one atomic step. Records being executed are flagged processing and
 * can neither be selected again nor cancelled.
 */
@Slf4j
public class DispatchQueue {
    private final String container;
    private final IContainerMeter meter;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ActivityDispatch> records = new LinkedHashMap<>();

    public DispatchQueue(String container) {
        this.container = container;
        this.meter = IContainerMeter.get(container);
        IContainerMeter.gauging(container, ContainerMetric.DispatchQueueSizeGauge, this::size);
    }

    public String container() {
        return container;
    }

    /**
     * Add a record unconditionally.
     *
     * @throws IllegalStateException if a record with the same id is queued
     */
    public void add(ActivityDispatch dispatch) {
        lock.lock();
        try {
            insert(dispatch);
        } finally {
            lock.unlock();
        }
    }

    private void insert(ActivityDispatch dispatch) {
        if (records.containsKey(dispatch.getId())) {
            throw new IllegalStateException("Dispatch " + dispatch.getId() + " is already queued");
        }
        records.put(dispatch.getId(), dispatch);
        meter.recordCount(ContainerMetric.DispatchEnqueueCount);
        log.debug("[DispatchQueue] container={} queued {}", container, dispatch);
    }

    /**
     * Look for records on the same activity whose identifier collides with the candidate's, apply
     * {@code policy}, and insert the candidate unless the policy says to skip.
     */
    public EnqueueOutcome enqueue(ActivityDispatch candidate, OnExistingFound policy) {
        IdentifierFilter collision = IdentifierFilter.forCollision(candidate.getIdentifier());
        lock.lock();
        try {
            List<ActivityDispatch> colliding = records.values().stream()
                .filter(existing -> existing.getActivity().id().equals(candidate.getActivity().id()))
                .filter(existing -> collision.matches(existing.getIdentifier()))
                .collect(Collectors.toList());
            if (colliding.isEmpty()) {
                insert(candidate);
                return new EnqueueOutcome(true, colliding, List.of());
            }
            switch (policy) {
                case SKIP:
                    meter.recordCount(ContainerMetric.DispatchSkipCount);
                    log.debug("[DispatchQueue] container={} skipped {}, {} colliding record(s) queued",
                        container, candidate, colliding.size());
                    return new EnqueueOutcome(false, colliding, List.of());
                case REPLACE:
                    List<ActivityDispatch> replaced = new ArrayList<>();
                    for (ActivityDispatch existing : colliding) {
                        if (existing.isProcessing()) {
                            // already executing, it leaves the queue by itself
                            continue;
                        }
                        records.remove(existing.getId());
                        replaced.add(existing);
                    }
                    meter.recordCount(ContainerMetric.DispatchReplaceCount, replaced.size());
                    log.debug("[DispatchQueue] container={} replaced {} record(s) with {}",
                        container, replaced.size(), candidate);
                    insert(candidate);
                    return new EnqueueOutcome(true, colliding, replaced);
                case IGNORE:
                default:
                    insert(candidate);
                    return new EnqueueOutcome(true, colliding, List.of());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the record with {@code id} if it is still queued.
     */
    public Optional<ActivityDispatch> remove(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(records.remove(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every idle record accepted by {@code filter}. Records being executed are left alone.
     */
    public List<ActivityDispatch> cancel(Predicate<ActivityDispatch> filter) {
        List<ActivityDispatch> cancelled = new ArrayList<>();
        lock.lock();
        try {
            Iterator<ActivityDispatch> itr = records.values().iterator();
            while (itr.hasNext()) {
                ActivityDispatch dispatch = itr.next();
                if (!filter.test(dispatch)) {
                    continue;
                }
                if (dispatch.isProcessing()) {
                    log.debug("[DispatchQueue] container={} cannot cancel {} because it is processing",
                        container, dispatch);
                    continue;
                }
                itr.remove();
                cancelled.add(dispatch);
            }
        } finally {
            lock.unlock();
        }
        if (!cancelled.isEmpty()) {
            meter.recordCount(ContainerMetric.DispatchCancelCount, cancelled.size());
            log.debug("[DispatchQueue] container={} cancelled {}", container, cancelled);
        }
        return cancelled;
    }

    /**
     * Cancel records whose activity is {@code activityId} when they ask to be dropped on a fresh
     * occurrence from {@code source}.
     */
    public List<ActivityDispatch> cancelIfQueued(String activityId, ActivitySource source) {
        return cancel(dispatch -> dispatch.getActivity().id().equals(activityId)
            && dispatch.getCancelIfQueued().shouldCancel(source));
    }

    /**
     * Atomically select the idle records due at {@code now}, oldest first, and flag them processing.
     */
    public List<ActivityDispatch> claimDue(Instant now) {
        lock.lock();
        try {
            List<ActivityDispatch> due = records.values().stream()
                .filter(dispatch -> !dispatch.isProcessing() && dispatch.isDue(now))
                .sorted(Comparator.comparing(ActivityDispatch::getQueuedAt))
                .collect(Collectors.toList());
            due.forEach(dispatch -> dispatch.setProcessing(true));
            return due;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a record after its execution finished, successfully or not.
     */
    void complete(String id) {
        lock.lock();
        try {
            ActivityDispatch dispatch = records.remove(id);
            if (dispatch == null) {
                log.warn("[DispatchQueue] container={} completed dispatch {} was not queued", container, id);
            }
        } finally {
            lock.unlock();
        }
    }

    public List<ActivityDispatch> find(Predicate<ActivityDispatch> filter) {
        lock.lock();
        try {
            return records.values().stream().filter(filter).collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether {@code activityId} has a queued record whose identifier is accepted by {@code identifiers}.
     */
    public boolean isDispatched(String activityId, IdentifierFilter identifiers) {
        return !find(dispatch -> dispatch.getActivity().id().equals(activityId)
            && identifiers.matches(dispatch.getIdentifier())).isEmpty();
    }

    public List<DispatchSummary> summary() {
        lock.lock();
        try {
            return records.values().stream()
                .sorted(Comparator.comparing(ActivityDispatch::dueAt))
                .map(DispatchSummary::of)
                .collect(Collectors.toList());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        IContainerMeter.stopGauging(container, ContainerMetric.DispatchQueueSizeGauge);
    }
}
