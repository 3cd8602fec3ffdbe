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

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for evaluating single-variable expressions.
 * <P>
 * Each call runs validation, tokenization, postfix conversion and
 * evaluation on fresh data; an engine keeps only its maximum input
 * length, so one instance may be shared freely, including across
 * threads.
 */
public final class ExpressionEngine {

    private final ExpressionValidator validator;

    public ExpressionEngine() {
        this(ExpressionValidator.DEFAULT_MAX_LENGTH);
    }

    /**
     * @param maxLength longest expression text accepted
     */
    public ExpressionEngine(int maxLength) {
        validator = new ExpressionValidator(maxLength);
    }

    public int maxLength() {
        return validator.maxLength();
    }

    /**
     * Is the text a syntactically valid expression?
     */
    public boolean isValid(String expression) {
        return validator.validate(expression);
    }

    /**
     * Evaluate expression with the variable bound to x.
     */
    public EvaluationOutcome evaluate(String expression, double x) {
        if (!validator.validate(expression)) {
            return EvaluationOutcome.inputError();
        }
        List<Token> infix = ExpressionTokenizer.tokenize(expression, x);
        List<Token> postfix = PostfixConverter.toPostfix(infix);
        try {
            return EvaluationOutcome.success(PostfixEvaluator.evaluate(postfix));
        } catch (MathDomainException e) {
            return EvaluationOutcome.mathError();
        }
    }

    /**
     * Evaluate expression at each of xValues in turn, keeping the points
     * where evaluation succeeds.  Points with a math error are left out.
     * @throws IllegalArgumentException if expression is not valid
     */
    public List<SamplePoint> evaluateMany(String expression, double[] xValues) {
        if (!validator.validate(expression)) {
            throw new IllegalArgumentException("Invalid expression: " + expression);
        }
        List<SamplePoint> result = new ArrayList<SamplePoint>();
        for (double x : xValues) {
            EvaluationOutcome y = evaluate(expression, x);
            if (y.isSuccess()) {
                result.add(new SamplePoint(x, y.value()));
            }
        }
        return result;
    }
}
