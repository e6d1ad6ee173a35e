/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

/**
 * Thrown while walking a parsed expression: unresolved names, bad argument
 * counts, domain violations and runaway user-defined recursion.
 */
public class EvaluationException extends CalculatorException {
    public EvaluationException(ErrorKind kind, String message) {
        super(kind, message, NO_POSITION);
        if (kind.isSyntax()) {
            throw new IllegalArgumentException("Not an evaluation error kind: " + kind);
        }
    }

    static EvaluationException of(ErrorKind kind, String key, Object... args) {
        return new EvaluationException(kind, Messages.get(key, args));
    }
}
