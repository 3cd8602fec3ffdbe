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

// Splits expression text into raw tokens.  Whitespace may separate
// tokens but never appears inside a number or a word.
// No grammar is checked here; '-' is always MINUS and 'x' stays VARIABLE.
final class ExpressionScanner {

    // Multi-letter words, longest candidates first so that "asin" is
    // never read as an 'a' followed by "sin".
    private static final Token.Kind[] WORDS = {
        Token.Kind.ASIN, Token.Kind.ACOS, Token.Kind.ATAN, Token.Kind.SQRT,
        Token.Kind.SIN, Token.Kind.COS, Token.Kind.TAN, Token.Kind.LOG,
        Token.Kind.MOD, Token.Kind.LN
    };

    private ExpressionScanner() {}

    /**
     * Scan text.  Returns null if some character cannot be classified
     * or a digit run is not a well formed decimal literal.
     */
    static List<Token> scan(String text) {
        List<Token> result = new ArrayList<Token>();
        int len = text.length();
        int i = 0;
        while (i < len) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                ++i;
                continue;
            }
            if (isDigit(c) || c == '.') {
                int end = numberEnd(text, i);
                if (end < 0) return null;
                result.add(Token.number(Double.parseDouble(text.substring(i, end))));
                i = end;
                continue;
            }
            Token.Kind k = simpleKind(c);
            if (k != null) {
                result.add(Token.of(k));
                ++i;
                continue;
            }
            k = wordAt(text, i);
            if (k == null) return null;
            result.add(Token.of(k));
            i += k.spelling().length();
        }
        return result;
    }

    // End of the maximal digit run starting at start, or -1 if the run
    // has more than one point or no digit at all.
    private static int numberEnd(String text, int start) {
        int points = 0;
        int digits = 0;
        int i = start;
        for (; i < text.length(); ++i) {
            char c = text.charAt(i);
            if (c == '.') {
                ++points;
            } else if (isDigit(c)) {
                ++digits;
            } else {
                break;
            }
        }
        if (points > 1 || digits == 0) return -1;
        return i;
    }

    // ASCII digits only.
    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static Token.Kind simpleKind(char c) {
        switch (c) {
            case 'x': return Token.Kind.VARIABLE;
            case '(': return Token.Kind.LEFT_PAREN;
            case ')': return Token.Kind.RIGHT_PAREN;
            case '+': return Token.Kind.PLUS;
            case '-': return Token.Kind.MINUS;
            case '*': return Token.Kind.MUL;
            case '/': return Token.Kind.DIV;
            case '^': return Token.Kind.POWER;
            default: return null;
        }
    }

    private static Token.Kind wordAt(String text, int i) {
        for (Token.Kind k : WORDS) {
            if (text.startsWith(k.spelling(), i)) return k;
        }
        return null;
    }
}
