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
 * Converts validated expression text into an infix token sequence.
 * The variable is replaced by a number token holding the current value
 * of <TT>x</tt>, implicit multiplications get an explicit <TT>MUL</tt>
 * token, and a unary minus becomes <TT>NEGATE</tt>.
 */
public final class ExpressionTokenizer {

    private ExpressionTokenizer() {}

    /**
     * @param validatedText text accepted by {@link ExpressionValidator}
     * @param x value substituted for the variable
     * @throws IllegalArgumentException if the text could not have
     *         passed validation
     */
    public static List<Token> tokenize(String validatedText, double x) {
        List<Token> raw = ExpressionScanner.scan(validatedText);
        if (raw == null) {
            throw new IllegalArgumentException("Unvalidated expression: " + validatedText);
        }
        List<Token> result = new ArrayList<Token>(2 * raw.size());
        Token.Kind prev = null;  // kind as scanned, NEGATE for a unary minus
        for (Token t : raw) {
            Token.Kind k = t.kind();
            if (ExpressionValidator.impliesMultiplication(prev, k)) {
                result.add(Token.of(Token.Kind.MUL));
            }
            if (k == Token.Kind.MINUS && ExpressionValidator.isUnaryPosition(prev)) {
                k = Token.Kind.NEGATE;
                t = Token.of(k);
            } else if (k == Token.Kind.VARIABLE) {
                t = Token.number(x);
            }
            result.add(t);
            prev = k;
        }
        return result;
    }
}
