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

import com.hp.exprcalc.ExpressionEngine;
import com.hp.exprcalc.SamplePoint;
import com.hp.exprcalc.Settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Samples an expression over the x axis range for plotting.
 * <P>
 * Use is in three steps, as driven by the graph window: {@link #check}
 * the expression, {@link #setAxis} the ranges, then
 * {@link #calculateGraph}.  Points are computed only if both earlier
 * steps succeeded.
 */
public class GraphModel {
    public static final String EMPTY_INPUT = CalculatorModel.EMPTY_INPUT;
    public static final String TOO_LARGE_INPUT = CalculatorModel.TOO_LARGE_INPUT;
    public static final String INCORRECT_INPUT = "Incorrect input";
    public static final String INVALID_CORDS = "Invalid cords";

    static final int MAX_BOUND_LENGTH = 9;  // characters in an axis bound

    private final ExpressionEngine engine;
    private final int axisLimit;

    private boolean allow = false;
    private int minX = -10;
    private int maxX = 10;
    private int minY = -10;
    private int maxY = 10;
    private List<SamplePoint> points = Collections.emptyList();

    public GraphModel() {
        this(Settings.defaults());
    }

    public GraphModel(Settings settings) {
        engine = new ExpressionEngine(settings.maxInput());
        axisLimit = settings.axisLimit();
    }

    /**
     * Check the expression to plot.
     * @return an error message, or the empty string if it may be plotted
     */
    public String check(String text) {
        allow = false;
        if (text == null || text.length() == 0) {
            return EMPTY_INPUT;
        }
        if (text.length() > engine.maxLength()) {
            return TOO_LARGE_INPUT;
        }
        if (!engine.isValid(text)) {
            return INCORRECT_INPUT;
        }
        allow = true;
        return "";
    }

    /**
     * Set the axis ranges.  All four bounds must be integers, each min
     * below its max, all within the configured limit.
     * @param previous message currently shown
     * @return previous if the ranges were accepted, otherwise an error
     *         message
     */
    public String setAxis(String previous, String minXText, String maxXText,
                          String minYText, String maxYText) {
        if (!(isBound(minXText) && isBound(maxXText)
                && isBound(minYText) && isBound(maxYText))) {
            allow = false;
            return INVALID_CORDS;
        }
        int newMinX = Integer.parseInt(minXText);
        int newMaxX = Integer.parseInt(maxXText);
        int newMinY = Integer.parseInt(minYText);
        int newMaxY = Integer.parseInt(maxYText);
        if (!validRange(newMinX, newMaxX) || !validRange(newMinY, newMaxY)) {
            allow = false;
            return INVALID_CORDS;
        }
        minX = newMinX;
        maxX = newMaxX;
        minY = newMinY;
        maxY = newMaxY;
        return previous;
    }

    private static boolean isBound(String s) {
        if (s == null || s.length() == 0 || s.length() > MAX_BOUND_LENGTH) return false;
        try {
            Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return false;
        }
        return true;
    }

    private boolean validRange(int min, int max) {
        return min < max
                && min >= -axisLimit && max <= axisLimit;
    }

    /**
     * Distance between sample points for an x range of the given width.
     */
    static double step(int span) {
        double h = 0.01;
        if (span >= 20) h = 0.1;
        if (span >= 200) h = 1;
        if (span >= 10000) h = 2;
        if (span >= 100000) h = 4;
        if (span >= 200000) h = 8;
        return h;
    }

    // minX, minX + h, ... up to but excluding maxX.
    static double[] samples(int minX, int maxX) {
        double h = step(maxX - minX);
        List<Double> xs = new ArrayList<Double>();
        for (double x = minX; x < maxX; x = minX + xs.size() * h) {
            xs.add(x);
        }
        double[] result = new double[xs.size()];
        for (int i = 0; i < result.length; ++i) {
            result[i] = xs.get(i);
        }
        return result;
    }

    /**
     * Recompute the points for text, or clear them if the last check or
     * axis update failed, or text is not a valid expression.
     */
    public void calculateGraph(String text) {
        if (!allow || !engine.isValid(text)) {
            points = Collections.emptyList();
            return;
        }
        points = Collections.unmodifiableList(engine.evaluateMany(text, samples(minX, maxX)));
    }

    public List<SamplePoint> getPoints() {
        return points;
    }

    public int getMinX() { return minX; }

    public int getMaxX() { return maxX; }

    public int getMinY() { return minY; }

    public int getMaxY() { return maxY; }
}
