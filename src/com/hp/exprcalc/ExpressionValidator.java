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

import java.util.List;

/**
 * Syntax check run on raw expression text before anything is tokenized.
 * <P>
 * Accepted text consists of decimal literals, the variable <TT>x</tt>,
 * the operators <TT>+ - * / mod ^</tt>, the functions
 * <TT>sin cos tan asin acos atan sqrt ln log</tt>, each applied to a
 * bracketed argument, and balanced brackets.  Whitespace may appear
 * between tokens but not inside a number or a word.
 * A <TT>-</tt> at the start, after an open bracket or after another
 * operator is a unary minus.  A number or <TT>x</tt> followed by an open
 * bracket, a function or <TT>x</tt>, and a closing bracket followed by
 * an open bracket, a number, <TT>x</tt> or a function, denote an
 * implicit multiplication.
 */
public final class ExpressionValidator {

    /**
     * Longest expression accepted unless configured otherwise.
     */
    public static final int DEFAULT_MAX_LENGTH = 256;

    private final int maxLength;

    public ExpressionValidator() {
        this(DEFAULT_MAX_LENGTH);
    }

    public ExpressionValidator(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("Bad maximum length: " + maxLength);
        }
        this.maxLength = maxLength;
    }

    public int maxLength() {
        return maxLength;
    }

    /**
     * Check raw expression text.
     * @param rawText text as typed, possibly with whitespace
     * @return true if the text may be passed on to the tokenizer
     */
    public boolean validate(String rawText) {
        if (rawText == null || rawText.isEmpty() || rawText.length() > maxLength) {
            return false;
        }
        List<Token> tokens = ExpressionScanner.scan(rawText);
        if (tokens == null || tokens.isEmpty()) {
            return false;
        }
        return bracketsBalanced(tokens) && wellFormed(tokens);
    }

    private static boolean bracketsBalanced(List<Token> tokens) {
        int depth = 0;
        for (Token t : tokens) {
            if (t.kind() == Token.Kind.LEFT_PAREN) {
                ++depth;
            } else if (t.kind() == Token.Kind.RIGHT_PAREN) {
                if (--depth < 0) return false;
            }
        }
        return depth == 0;
    }

    private static boolean wellFormed(List<Token> tokens) {
        Token.Kind prev = null;
        for (Token t : tokens) {
            if (!mayFollow(prev, t.kind())) return false;
            prev = t.kind();
        }
        return prev.isOperand() || prev == Token.Kind.RIGHT_PAREN;
    }

    // prev == null stands for the start of the expression.
    private static boolean mayFollow(Token.Kind prev, Token.Kind next) {
        if (isUnaryPosition(prev)) {
            return startsOperand(next) || next == Token.Kind.MINUS;
        }
        if (prev.isFunction()) {
            return next == Token.Kind.LEFT_PAREN;
        }
        // prev is an operand or a closing bracket
        return next.isBinaryOperator()
                || next == Token.Kind.RIGHT_PAREN
                || impliesMultiplication(prev, next);
    }

    private static boolean startsOperand(Token.Kind k) {
        return k.isOperand() || k.isFunction() || k == Token.Kind.LEFT_PAREN;
    }

    /**
     * Would a <TT>-</tt> after prev be a unary minus?
     * @param prev preceding kind, or null at the start of the expression
     */
    static boolean isUnaryPosition(Token.Kind prev) {
        return prev == null
                || prev == Token.Kind.LEFT_PAREN
                || prev == Token.Kind.NEGATE
                || prev.isBinaryOperator();
    }

    /**
     * Is the juxtaposition of prev and next, with no operator between
     * them, read as a multiplication?
     */
    static boolean impliesMultiplication(Token.Kind prev, Token.Kind next) {
        if (prev == null) return false;
        if (prev.isOperand()) {
            return next == Token.Kind.LEFT_PAREN
                    || next == Token.Kind.VARIABLE
                    || next.isFunction();
        }
        if (prev == Token.Kind.RIGHT_PAREN) {
            return startsOperand(next);
        }
        return false;
    }
}
