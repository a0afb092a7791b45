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

package com.modkit.sysprops;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.modkit.sysprops.parser.BooleanParser;
import com.modkit.sysprops.parser.LongParser;
import com.modkit.sysprops.parser.SysPropParseException;
import com.modkit.sysprops.props.DispatchDelaysDisabled;
import com.modkit.sysprops.props.DispatchTickIntervalMillis;
import java.util.HashSet;
import java.util.Set;
import org.reflections.Reflections;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public class ModKitSysPropTest {

    @AfterMethod
    public void tearDown() {
        System.clearProperty(DispatchDelaysDisabled.INSTANCE.propKey());
        System.clearProperty(DispatchTickIntervalMillis.INSTANCE.propKey());
        DispatchDelaysDisabled.INSTANCE.resolve();
        DispatchTickIntervalMillis.INSTANCE.resolve();
    }

    @Test
    public void propKeyNoConflict() {
        Reflections reflections = new Reflections(ModKitSysProp.class.getPackageName());
        Set<String> propKeys = new HashSet<>();
        for (Class<? extends ModKitSysProp> subclass : reflections.getSubTypesOf(ModKitSysProp.class)) {
            try {
                ModKitSysProp<?, ?> instance = (ModKitSysProp<?, ?>) subclass.getField("INSTANCE").get(null);
                assertTrue(propKeys.add(instance.propKey()), "Duplicate propKey found: " + instance.propKey());
            } catch (NoSuchFieldException | IllegalAccessException e) {
                throw new RuntimeException("Failed to access INSTANCE field of subclass: " + subclass.getName(), e);
            }
        }
        assertFalse(propKeys.isEmpty());
    }

    @Test
    public void resolveBoolean() {
        assertFalse(DispatchDelaysDisabled.INSTANCE.get());

        System.setProperty(DispatchDelaysDisabled.INSTANCE.propKey(), " YES ");
        DispatchDelaysDisabled.INSTANCE.resolve();
        assertTrue(DispatchDelaysDisabled.INSTANCE.get());
    }

    @Test
    public void fallbackToDefaultOnBadValue() {
        System.setProperty(DispatchTickIntervalMillis.INSTANCE.propKey(), "1");
        DispatchTickIntervalMillis.INSTANCE.resolve();
        assertEquals(DispatchTickIntervalMillis.INSTANCE.get(), DispatchTickIntervalMillis.INSTANCE.defaultValue());

        System.setProperty(DispatchTickIntervalMillis.INSTANCE.propKey(), "250");
        DispatchTickIntervalMillis.INSTANCE.resolve();
        assertEquals(DispatchTickIntervalMillis.INSTANCE.get(), Long.valueOf(250));
    }

    @Test
    public void parsers() {
        assertEquals(LongParser.POSITIVE.parse("1_000"), Long.valueOf(1000));
        assertThrows(SysPropParseException.class, () -> LongParser.POSITIVE.parse("0"));
        assertThrows(SysPropParseException.class, () -> LongParser.NON_NEGATIVE.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> LongParser.between(5, 5));
        assertFalse(BooleanParser.INSTANCE.parse("off"));
        assertThrows(SysPropParseException.class, () -> BooleanParser.INSTANCE.parse("maybe"));
    }
}
