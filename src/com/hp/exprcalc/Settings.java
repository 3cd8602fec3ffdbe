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

import java.util.Properties;

/**
 * Tunable limits shared by the calculator and grapher front ends.
 * Values are read from properties named as in {@link #PARAM_INFO}; a
 * missing or malformed value keeps its default.
 */
public final class Settings {

    static final String MAX_INPUT = "exprcalc.max_input";
    static final String DIGITS = "exprcalc.digits";
    static final String AXIS_LIMIT = "exprcalc.axis_limit";

    public static final int DEFAULT_DIGITS = 8;
    public static final int DEFAULT_AXIS_LIMIT = 1000000;

    /**
     * Name, format and meaning of each recognized property.
     */
    public static final String[][] PARAM_INFO = {
        {MAX_INPUT, "decimal integer > 0", "longest accepted expression"},
        {DIGITS, "decimal integer >= 0", "digits after the point in results"},
        {AXIS_LIMIT, "decimal integer > 0", "largest absolute graph axis bound"},
    };

    private final int maxInput;
    private final int digits;
    private final int axisLimit;

    public Settings(int maxInput, int digits, int axisLimit) {
        if (maxInput <= 0 || digits < 0 || axisLimit <= 0) {
            throw new IllegalArgumentException("Bad settings: " + maxInput
                    + ", " + digits + ", " + axisLimit);
        }
        this.maxInput = maxInput;
        this.digits = digits;
        this.axisLimit = axisLimit;
    }

    public static Settings defaults() {
        return new Settings(ExpressionValidator.DEFAULT_MAX_LENGTH, DEFAULT_DIGITS,
                DEFAULT_AXIS_LIMIT);
    }

    public static Settings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static Settings fromProperties(Properties p) {
        int maxInput = intParameter(p, MAX_INPUT, ExpressionValidator.DEFAULT_MAX_LENGTH, 1);
        int digits = intParameter(p, DIGITS, DEFAULT_DIGITS, 0);
        int axisLimit = intParameter(p, AXIS_LIMIT, DEFAULT_AXIS_LIMIT, 1);
        return new Settings(maxInput, digits, axisLimit);
    }

    private static int intParameter(Properties p, String name, int dflt, int min) {
        String s = p.getProperty(name);
        if (null == s) return dflt;
        int result;
        try {
            result = Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            System.out.println("Format error in " + name + ": " + s);
            return dflt;
        }
        if (result < min) {
            System.out.println(name + " must be at least " + min + ": " + s);
            return dflt;
        }
        return result;
    }

    public int maxInput() {
        return maxInput;
    }

    public int digits() {
        return digits;
    }

    public int axisLimit() {
        return axisLimit;
    }
}
