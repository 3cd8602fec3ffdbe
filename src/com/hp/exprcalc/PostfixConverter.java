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
 * Shunting-yard conversion of an infix token sequence to postfix (RPN)
 * order.
 * <P>
 * Binary operators are grouped left to right, except <TT>^</tt>, which
 * groups right to left.  Functions and unary minus are prefix operators:
 * they are pushed without popping anything and leave the stack once a
 * lower precedence operator or the end of the input arrives.  Unary
 * minus binds tighter than <TT>* / mod</tt> but looser than <TT>^</tt>,
 * so <TT>-3^2</tt> is -9.
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * @param infix tokens from {@link ExpressionTokenizer}; brackets
     *        must balance
     * @throws IllegalStateException on unbalanced brackets, which the
     *         validator should already have rejected
     */
    public static List<Token> toPostfix(List<Token> infix) {
        List<Token> output = new ArrayList<Token>(infix.size());
        Token[] stack = new Token[infix.size()];
        int stackPtr = 0;   // Number of valid entries.

        for (Token t : infix) {
            Token.Kind k = t.kind();
            if (k == Token.Kind.NUMBER) {
                output.add(t);
            } else if (k == Token.Kind.LEFT_PAREN || k.isPrefix()) {
                stack[stackPtr++] = t;
            } else if (k == Token.Kind.RIGHT_PAREN) {
                while (stackPtr > 0 && stack[stackPtr - 1].kind() != Token.Kind.LEFT_PAREN) {
                    output.add(stack[--stackPtr]);
                }
                if (stackPtr == 0) {
                    throw new IllegalStateException("Unmatched ')'");
                }
                stack[--stackPtr] = null;
            } else if (k.isBinaryOperator()) {
                while (stackPtr > 0 && popsBefore(stack[stackPtr - 1], t)) {
                    output.add(stack[--stackPtr]);
                }
                stack[stackPtr++] = t;
            } else {
                throw new IllegalStateException("Unexpected token in infix sequence: " + t);
            }
        }
        while (stackPtr > 0) {
            Token top = stack[--stackPtr];
            if (top.kind() == Token.Kind.LEFT_PAREN) {
                throw new IllegalStateException("Unmatched '('");
            }
            output.add(top);
        }
        return output;
    }

    // Should top leave the stack before the binary operator incoming is
    // pushed?  Open brackets have the lowest rank and are never popped.
    private static boolean popsBefore(Token top, Token incoming) {
        if (incoming.kind().isRightAssociative()) {
            return top.precedence() > incoming.precedence();
        }
        return top.precedence() >= incoming.precedence();
    }
}
