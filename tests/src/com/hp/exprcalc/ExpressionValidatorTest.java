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

import junit.framework.AssertionFailedError;
import junit.framework.TestCase;

public class ExpressionValidatorTest extends TestCase {
    private static final ExpressionValidator VALIDATOR = new ExpressionValidator();

    private static void checkValid(String s) {
        if (!VALIDATOR.validate(s)) throw new AssertionFailedError("rejected: " + s);
    }

    private static void checkInvalid(String s) {
        if (VALIDATOR.validate(s)) throw new AssertionFailedError("accepted: " + s);
    }

    public void testAccepted() {
        checkValid("1 + 2 -   3");
        checkValid("1-2*12-3^2");
        checkValid("sin(12)-3");
        checkValid("ln(12)^3-1*(-12+5)");
        checkValid("(cos((-5)))+ln((10/(5*7))^2)-(tan(sin(-3mod2))-5mod3*4/5/7)");
        checkValid("asin(x)+acos(x)+atan(x)+sqrt(x)+log(x)");
        checkValid("x");
        checkValid("3.");
        checkValid(".5");
        checkValid("0.25");
        checkValid("\t2 ^ 3\n");
    }

    public void testUnaryMinus() {
        checkValid("-x");
        checkValid("-(1+2)");
        checkValid("-sin(x)");
        checkValid("2*-3");
        checkValid("2^-x");
        checkValid("5mod-2");
        checkValid("--3");
        checkValid("(-5)");
        checkInvalid("+3");
        checkInvalid("2*+3");
        checkInvalid("(+3)");
    }

    public void testImplicitMultiplication() {
        checkValid("2x");
        checkValid("2(x+1)");
        checkValid("2sin(x)");
        checkValid("xsin(x)");
        checkValid("x(1)");
        checkValid("x x");
        checkValid("(x+1)(x-1)");
        checkValid("(1)2");
        checkValid("(1)x");
        checkValid("(1)cos(x)");
        checkValid("sqrt(4)sqrt(4)");
        checkInvalid("x2");
        checkInvalid("x.5");
    }

    public void testBrackets() {
        checkInvalid("(()");
        checkInvalid("())(");
        checkInvalid(")(");
        checkInvalid("(1+2");
        checkInvalid("1+2)");
        checkInvalid("()");
        checkInvalid("sin()");
        checkInvalid("(1+)");
        checkInvalid("(*1)");
        checkValid("((((1))))");
    }

    public void testOperators() {
        checkInvalid("1+");
        checkInvalid("2*");
        checkInvalid("*2");
        checkInvalid("mod 3");
        checkInvalid("3 mod");
        checkInvalid("2**3");
        checkInvalid("2*/3");
        checkInvalid("2^^3");
        checkInvalid("1-");
    }

    public void testFunctionsNeedBrackets() {
        checkInvalid("sin 2");
        checkInvalid("sin");
        checkInvalid("2+log");
        checkInvalid("sqrt-4");
        checkInvalid("log(-)");
    }

    public void testCharacters() {
        checkInvalid("2 + y");
        checkInvalid("exp(1)");
        checkInvalid("2#3");
        checkInvalid("1,5");
        checkInvalid("sinx");
        checkInvalid("X");
    }

    public void testNumbers() {
        checkInvalid("1..2");
        checkInvalid("1.2.3");
        checkInvalid(".");
        checkInvalid("2+.");
    }

    public void testWhitespaceSeparatesTokens() {
        checkValid(" 1 +\t2 ");
        checkValid("sin (x) mod 2");
        checkInvalid("2 3");
        checkInvalid("1 .5");
        checkInvalid("s in(1)");
        checkInvalid("7 m o d 4");
        checkInvalid("sq rt(4)");
    }

    public void testLength() {
        checkInvalid(null);
        checkInvalid("");
        checkInvalid("   ");
        StringBuilder sb = new StringBuilder("1");
        for (int i = 0; i < 127; ++i) {
            sb.append("+1");
        }
        sb.insert(0, ' ');
        assertEquals(256, sb.length());
        checkValid(sb.toString());
        sb.insert(0, ' ');
        checkInvalid(sb.toString());
        ExpressionValidator shortValidator = new ExpressionValidator(5);
        assertTrue(shortValidator.validate("1+2+3"));
        assertFalse(shortValidator.validate("1+2+34"));
    }

    public void testBadMaximum() {
        try {
            new ExpressionValidator(0);
            fail("accepted zero maximum length");
        } catch (IllegalArgumentException expected) {
        }
    }
}
