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
 * The unit exchanged between the scanner, tokenizer, postfix converter
 * and evaluator.  Tokens are immutable.  Only <TT>NUMBER</tt> tokens
 * carry a meaningful value; the precedence is fixed by the kind.
 */
public final class Token {

    // Precedence ranks.  Brackets use the sentinel rank so that no
    // operator is ever popped past an open bracket.
    static final int BRACKET_PREC = 0;
    static final int ADDITIVE_PREC = 1;
    static final int MULTIPLICATIVE_PREC = 2;
    static final int NEGATE_PREC = 3;
    static final int POWER_PREC = 4;
    static final int FUNCTION_PREC = 5;

    /**
     * The closed set of token kinds.
     */
    public enum Kind {
        NUMBER(null, -1),
        VARIABLE("x", -1),
        LEFT_PAREN("(", BRACKET_PREC),
        RIGHT_PAREN(")", BRACKET_PREC),
        PLUS("+", ADDITIVE_PREC),
        MINUS("-", ADDITIVE_PREC),
        MUL("*", MULTIPLICATIVE_PREC),
        DIV("/", MULTIPLICATIVE_PREC),
        MOD("mod", MULTIPLICATIVE_PREC),
        NEGATE("-", NEGATE_PREC),   // unary minus, never produced by the scanner
        POWER("^", POWER_PREC),
        SIN("sin", FUNCTION_PREC),
        COS("cos", FUNCTION_PREC),
        TAN("tan", FUNCTION_PREC),
        ASIN("asin", FUNCTION_PREC),
        ACOS("acos", FUNCTION_PREC),
        ATAN("atan", FUNCTION_PREC),
        SQRT("sqrt", FUNCTION_PREC),
        LN("ln", FUNCTION_PREC),
        LOG("log", FUNCTION_PREC);

        private final String spelling;
        private final int precedence;

        Kind(String spelling, int precedence) {
            this.spelling = spelling;
            this.precedence = precedence;
        }

        /**
         * The source text for this kind, or null for numbers.
         */
        public String spelling() {
            return spelling;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isOperand() {
            return this == NUMBER || this == VARIABLE;
        }

        public boolean isFunction() {
            return precedence == FUNCTION_PREC;
        }

        public boolean isBinaryOperator() {
            switch (this) {
                case PLUS:
                case MINUS:
                case MUL:
                case DIV:
                case MOD:
                case POWER:
                    return true;
                default:
                    return false;
            }
        }

        /**
         * Prefix operators take their single operand from the right:
         * the functions and unary minus.
         */
        public boolean isPrefix() {
            return this == NEGATE || isFunction();
        }

        public boolean isRightAssociative() {
            return this == POWER;
        }
    }

    private final Kind kind;
    private final double value;

    private Token(Kind kind, double value) {
        this.kind = kind;
        this.value = value;
    }

    // Shared instances for every kind that carries no value.
    private static final Token[] SIMPLE = new Token[Kind.values().length];
    static {
        for (Kind k : Kind.values()) {
            SIMPLE[k.ordinal()] = new Token(k, 0.0);
        }
    }

    /**
     * The token for a kind that carries no value.
     */
    public static Token of(Kind kind) {
        if (kind == Kind.NUMBER) {
            throw new IllegalArgumentException("Number tokens need a value");
        }
        return SIMPLE[kind.ordinal()];
    }

    public static Token number(double value) {
        return new Token(Kind.NUMBER, value);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The numeric value; meaningful only for <TT>NUMBER</tt> tokens.
     */
    public double value() {
        return value;
    }

    public int precedence() {
        return kind.precedence();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return kind == t.kind
                && Double.doubleToLongBits(value) == Double.doubleToLongBits(t.value);
    }

    @Override
    public int hashCode() {
        long bits = Double.doubleToLongBits(value);
        return 31 * kind.hashCode() + (int) (bits ^ (bits >>> 32));
    }

    @Override
    public String toString() {
        if (kind == Kind.NUMBER) {
            return String.valueOf(value);
        }
        if (kind == Kind.NEGATE) {
            return "neg";
        }
        return kind.spelling();
    }
}
