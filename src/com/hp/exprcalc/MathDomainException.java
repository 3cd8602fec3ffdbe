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
 * Thrown when a well formed expression applies an operation outside its
 * domain, e.g. division by zero or the square root of a negative number.
 */
public class MathDomainException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    private final Token.Kind operation;

    public MathDomainException(Token.Kind operation, String s) {
        super(s);
        this.operation = operation;
    }

    /**
     * The operator or function that failed.
     */
    public Token.Kind getOperation() {
        return operation;
    }
}
