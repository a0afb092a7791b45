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
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.modkit.dispatch.ActivitySource;
import com.modkit.dispatch.ActivitySourceType;
import com.modkit.dispatch.CancelIfQueued;
import com.modkit.dispatch.DispatchTarget;
import com.modkit.dispatch.OnExistingFound;
import com.modkit.dispatch.TardyTolerance;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.testng.annotations.Test;

public class ActionConfigParsingTest {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    @Test
    public void defaults() throws Exception {
        DispatchActionConfig config = mapper.readValue("delay: 2 minutes\n", DispatchActionConfig.class);
        assertEquals(config.getDelay(), Duration.ofMinutes(2));
        assertEquals(config.getTarget(), List.of(DispatchTarget.SELF));
        assertEquals(config.getOnExistingFound(), OnExistingFound.IGNORE);
        assertEquals(config.getTardyTolerant(), TardyTolerance.NOT_TOLERANT);
        assertEquals(config.getCancelIfQueued(), CancelIfQueued.NEVER);
        assertNull(config.getIdentifier());
        assertNull(config.getGotoTarget());
        assertNull(config.getDryRun());
    }

    @Test
    public void fullDispatchConfig() throws Exception {
        String yaml = String.join("\n",
            "name: recheck",
            "delay: PT1H30M",
            "identifier: tagA",
            "goto: rule2",
            "target: parent",
            "onExistingFound: replace",
            "tardyTolerant: 5 minutes",
            "cancelIfQueued:",
            "  - poll",
            "  - user:mod1",
            "dryRun: true",
            "");
        DispatchActionConfig config = mapper.readValue(yaml, DispatchActionConfig.class);
        assertEquals(config.getName(), "recheck");
        assertEquals(config.getDelay(), Duration.ofMinutes(90));
        assertEquals(config.getIdentifier(), "tagA");
        assertEquals(config.getGotoTarget(), "rule2");
        assertEquals(config.getTarget(), List.of(DispatchTarget.PARENT));
        assertEquals(config.getOnExistingFound(), OnExistingFound.REPLACE);
        assertEquals(config.getTardyTolerant(), TardyTolerance.of(Duration.ofMinutes(5)));
        assertEquals(config.getCancelIfQueued().sources(), List.of(
            ActivitySource.of(ActivitySourceType.POLL), ActivitySource.parse("user:mod1")));
        assertTrue(config.getDryRun());
    }

    @Test
    public void structuredDelayAndBooleanFlags() throws Exception {
        String yaml = String.join("\n",
            "delay:",
            "  hours: 1",
            "  minute: 15",
            "tardyTolerant: true",
            "cancelIfQueued: true",
            "target: [self, parent]",
            "");
        DispatchActionConfig config = mapper.readValue(yaml, DispatchActionConfig.class);
        assertEquals(config.getDelay(), Duration.ofMinutes(75));
        assertEquals(config.getTardyTolerant(), TardyTolerance.ALWAYS);
        assertTrue(config.getCancelIfQueued().isAny());
        assertEquals(config.getTarget(), List.of(DispatchTarget.SELF, DispatchTarget.PARENT));
    }

    @Test
    public void cancelIdentifierForms() throws Exception {
        CancelDispatchActionConfig omitted = mapper.readValue("target: any\n", CancelDispatchActionConfig.class);
        assertNull(omitted.getIdentifiers());
        assertEquals(omitted.getTarget(), List.of(DispatchTarget.ANY));

        CancelDispatchActionConfig explicitNull = mapper.readValue("identifier: null\n", CancelDispatchActionConfig.class);
        assertEquals(explicitNull.getIdentifiers(), Arrays.asList((String) null));

        CancelDispatchActionConfig single = mapper.readValue("identifier: tagA\n", CancelDispatchActionConfig.class);
        assertEquals(single.getIdentifiers(), List.of("tagA"));

        CancelDispatchActionConfig mixed = mapper.readValue("identifier: [null, tagA]\n",
            CancelDispatchActionConfig.class);
        assertEquals(mixed.getIdentifiers(), Arrays.asList(null, "tagA"));
        assertEquals(mixed.getTarget(), List.of(DispatchTarget.SELF));
        assertFalse(Boolean.TRUE.equals(mixed.getDryRun()));
    }
}
