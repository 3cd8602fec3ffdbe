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

package com.hp.exprcalc.frontend;

import com.hp.exprcalc.EvaluationOutcome;
import com.hp.exprcalc.ExpressionEngine;
import com.hp.exprcalc.Settings;

import java.util.Locale;

/**
 * State behind the calculator display: the current value of x and the
 * text shown for an evaluated expression.
 */
public class CalculatorModel {
    public static final String EMPTY_INPUT = "Empty input";
    public static final String TOO_LARGE_INPUT = "Too large input";
    public static final String MATH_ERROR = "Error in calculation";
    public static final String INPUT_ERROR = "Error in input";

    private final ExpressionEngine engine;
    private final String resultFormat;
    private double x = 0;

    public CalculatorModel() {
        this(Settings.defaults());
    }

    public CalculatorModel(Settings settings) {
        engine = new ExpressionEngine(settings.maxInput());
        resultFormat = "%." + settings.digits() + "f";
    }

    /**
     * Evaluate text at the current x and return the string to display.
     */
    public String calculateValue(String text) {
        if (text == null || text.length() == 0) {
            return EMPTY_INPUT;
        }
        if (text.length() > engine.maxLength()) {
            return TOO_LARGE_INPUT;
        }
        EvaluationOutcome outcome = engine.evaluate(text, x);
        switch (outcome.status()) {
            case SUCCESS:
                return String.format(Locale.ROOT, resultFormat, outcome.value());
            case MATH_ERROR:
                return MATH_ERROR;
            case INPUT_ERROR:
                return INPUT_ERROR;
            default:
                throw new AssertionError(outcome.status());
        }
    }

    /**
     * Try to change x.
     * @param xText new value as typed
     * @param previousX text currently shown for x
     * @return xText if it was accepted, otherwise previousX
     */
    public String setX(String xText, String previousX) {
        if (!isDecimal(xText, engine.maxLength())) {
            return previousX;
        }
        x = Double.parseDouble(xText);
        return xText;
    }

    public double getX() {
        return x;
    }

    // An optional minus sign followed by digits with at most one point.
    static boolean isDecimal(String s, int maxLength) {
        if (s == null || s.length() == 0 || s.length() > maxLength) return false;
        int start = s.charAt(0) == '-' ? 1 : 0;
        int digits = 0;
        boolean point = false;
        for (int i = start; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') {
                ++digits;
            } else if (c == '.' && !point) {
                point = true;
            } else {
                return false;
            }
        }
        return digits > 0;
    }
}
