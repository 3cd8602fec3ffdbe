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

/**
 * Result of one evaluation: a value, a math error, or an input error.
 * The value exists only for {@link Status#SUCCESS}.
 */
public final class EvaluationOutcome {

    public enum Status {
        SUCCESS,
        /** Well formed input hit an undefined operation. */
        MATH_ERROR,
        /** The text was rejected before tokenization. */
        INPUT_ERROR
    }

    private static final EvaluationOutcome MATH_ERROR_OUTCOME =
            new EvaluationOutcome(Status.MATH_ERROR, Double.NaN);
    private static final EvaluationOutcome INPUT_ERROR_OUTCOME =
            new EvaluationOutcome(Status.INPUT_ERROR, Double.NaN);

    private final Status status;
    private final double value;

    private EvaluationOutcome(Status status, double value) {
        this.status = status;
        this.value = value;
    }

    public static EvaluationOutcome success(double value) {
        return new EvaluationOutcome(Status.SUCCESS, value);
    }

    public static EvaluationOutcome mathError() {
        return MATH_ERROR_OUTCOME;
    }

    public static EvaluationOutcome inputError() {
        return INPUT_ERROR_OUTCOME;
    }

    public Status status() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * @throws IllegalStateException unless this is a success
     */
    public double value() {
        if (status != Status.SUCCESS) {
            throw new IllegalStateException("No value for " + status);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationOutcome)) return false;
        EvaluationOutcome other = (EvaluationOutcome) o;
        return status == other.status
                && (status != Status.SUCCESS
                    || Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value));
    }

    @Override
    public int hashCode() {
        if (status != Status.SUCCESS) return status.hashCode();
        long bits = Double.doubleToLongBits(value);
        return 31 * status.hashCode() + (int) (bits ^ (bits >>> 32));
    }

    @Override
    public String toString() {
        return status == Status.SUCCESS ? "SUCCESS(" + value + ")" : status.toString();
    }
}
