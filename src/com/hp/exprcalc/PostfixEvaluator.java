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
 * Evaluates a postfix token sequence with a single operand stack.
 * <P>
 * Angles are in radians, <TT>log</tt> is base 10 and <TT>ln</tt> is the
 * natural logarithm.  <TT>mod</tt> takes the sign of the dividend.
 * Evaluation stops at the first operation outside its domain.  A NaN or
 * infinite intermediate result counts as such a failure, so a successful
 * evaluation always yields a finite value.
 */
public final class PostfixEvaluator {

    private PostfixEvaluator() {}

    /**
     * @param postfix tokens from {@link PostfixConverter}
     * @return the value of the expression
     * @throws MathDomainException if an operation is undefined for its
     *         operands
     * @throws IllegalStateException if the sequence is not a complete
     *         postfix expression
     */
    public static double evaluate(List<Token> postfix) {
        double[] stack = new double[postfix.size()];
        int stackPtr = 0;   // Number of valid entries.

        for (Token t : postfix) {
            Token.Kind k = t.kind();
            if (k == Token.Kind.NUMBER) {
                // A substituted x or a very long literal may not be finite.
                if (Double.isNaN(t.value()) || Double.isInfinite(t.value())) {
                    throw new MathDomainException(k, "Non-finite operand " + t.value());
                }
                stack[stackPtr++] = t.value();
            } else if (k.isBinaryOperator()) {
                require(stackPtr, 2, t);
                double right = stack[--stackPtr];
                double left = stack[stackPtr - 1];
                stack[stackPtr - 1] = applyBinary(k, left, right);
            } else if (k.isPrefix()) {
                require(stackPtr, 1, t);
                stack[stackPtr - 1] = applyUnary(k, stack[stackPtr - 1]);
            } else {
                throw new IllegalStateException("Unexpected token in postfix sequence: " + t);
            }
        }
        if (stackPtr != 1) {
            throw new IllegalStateException(stackPtr + " values left on operand stack");
        }
        return stack[0];
    }

    private static void require(int stackPtr, int n, Token t) {
        if (stackPtr < n) {
            throw new IllegalStateException("Operand stack underflow at " + t);
        }
    }

    static double applyBinary(Token.Kind op, double left, double right) {
        double result;
        switch (op) {
            case PLUS:
                result = left + right;
                break;
            case MINUS:
                result = left - right;
                break;
            case MUL:
                result = left * right;
                break;
            case DIV:
                if (right == 0.0) throw new MathDomainException(op, "Division by zero");
                result = left / right;
                break;
            case MOD:
                if (right == 0.0) throw new MathDomainException(op, "mod by zero");
                result = left % right;
                break;
            case POWER:
                result = Math.pow(left, right);
                break;
            default:
                throw new IllegalArgumentException("Not a binary operator: " + op);
        }
        return checked(op, result);
    }

    static double applyUnary(Token.Kind f, double arg) {
        double result;
        switch (f) {
            case NEGATE:
                result = -arg;
                break;
            case SIN:
                result = Math.sin(arg);
                break;
            case COS:
                result = Math.cos(arg);
                break;
            case TAN:
                result = Math.tan(arg);
                break;
            case ASIN:
                if (arg < -1.0 || arg > 1.0) throw new MathDomainException(f, "asin argument outside [-1, 1]");
                result = Math.asin(arg);
                break;
            case ACOS:
                if (arg < -1.0 || arg > 1.0) throw new MathDomainException(f, "acos argument outside [-1, 1]");
                result = Math.acos(arg);
                break;
            case ATAN:
                result = Math.atan(arg);
                break;
            case SQRT:
                if (arg < 0.0) throw new MathDomainException(f, "Square root of negative number");
                result = Math.sqrt(arg);
                break;
            case LN:
                if (arg <= 0.0) throw new MathDomainException(f, "ln(non-positive number)");
                result = Math.log(arg);
                break;
            case LOG:
                if (arg <= 0.0) throw new MathDomainException(f, "log(non-positive number)");
                result = Math.log10(arg);
                break;
            default:
                throw new IllegalArgumentException("Not a unary operator: " + f);
        }
        return checked(f, result);
    }

    private static double checked(Token.Kind op, double result) {
        if (Double.isNaN(result)) {
            throw new MathDomainException(op, "Undefined result of " + op.spelling());
        }
        if (Double.isInfinite(result)) {
            throw new MathDomainException(op, "Overflow in " + op.spelling());
        }
        return result;
    }
}
