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

import com.google.common.base.Preconditions;

/**
 * A handle to a piece of content. The handle is not refreshed by this module, callers that need
 * current state resolve it through {@link IActivityResolver}.
 *
 * @param id        the platform wide id, e.g. {@code t3_abc} or {@code t1_def}
 * @param kind      whether this is a root submission or a reply
 * @param parentId  the id of the submission a comment belongs to, null for submissions
 * @param container the moderated container the content lives in
 */
public record ActivityRef(String id, ActivityKind kind, String parentId, String container) {
    public ActivityRef {
        Preconditions.checkNotNull(id, "activity id");
        Preconditions.checkNotNull(kind, "activity kind");
        Preconditions.checkArgument(kind == ActivityKind.SUBMISSION || parentId != null,
            "comment %s has no parent submission", id);
    }

    public static ActivityRef submission(String id, String container) {
        return new ActivityRef(id, ActivityKind.SUBMISSION, null, container);
    }

    public static ActivityRef comment(String id, String parentId, String container) {
        return new ActivityRef(id, ActivityKind.COMMENT, parentId, container);
    }

    public boolean isSubmission() {
        return kind == ActivityKind.SUBMISSION;
    }

    /**
     * An unresolved reference to the submission this comment belongs to.
     */
    public ActivityRef parentStub() {
        Preconditions.checkState(!isSubmission(), "%s is a submission", id);
        return submission(parentId, container);
    }

    public String describe() {
        return (isSubmission() ? "Submission " : "Comment ") + id;
    }
}
