/*
 * Copyright (C) 2015 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.hp.exprcalc;

import junit.framework.TestCase;

import java.util.Properties;

public class SettingsTest extends TestCase {

    public void testDefaults() {
        Settings s = Settings.fromProperties(new Properties());
        assertEquals(256, s.maxInput());
        assertEquals(8, s.digits());
        assertEquals(1000000, s.axisLimit());
    }

    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty(Settings.MAX_INPUT, "40");
        p.setProperty(Settings.DIGITS, " 3 ");
        p.setProperty(Settings.AXIS_LIMIT, "500");
        Settings s = Settings.fromProperties(p);
        assertEquals(40, s.maxInput());
        assertEquals(3, s.digits());
        assertEquals(500, s.axisLimit());
    }

    public void testMalformedValuesKeepDefaults() {
        Properties p = new Properties();
        p.setProperty(Settings.MAX_INPUT, "lots");
        p.setProperty(Settings.DIGITS, "-1");
        p.setProperty(Settings.AXIS_LIMIT, "0");
        Settings s = Settings.fromProperties(p);
        assertEquals(256, s.maxInput());
        assertEquals(8, s.digits());
        assertEquals(1000000, s.axisLimit());
    }

    public void testParamInfoNamesEveryProperty() {
        assertEquals(3, Settings.PARAM_INFO.length);
        assertEquals(Settings.MAX_INPUT, Settings.PARAM_INFO[0][0]);
        assertEquals(Settings.DIGITS, Settings.PARAM_INFO[1][0]);
        assertEquals(Settings.AXIS_LIMIT, Settings.PARAM_INFO[2][0]);
    }

    public void testConstructorRejectsBadValues() {
        try {
            new Settings(0, 8, 10);
            fail("accepted zero maximum input");
        } catch (IllegalArgumentException expected) {
        }
    }
}
