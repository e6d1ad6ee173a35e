/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

/**
 * Arithmetic operators, with the binding strength used by both the parser
 * and the pretty-printer.
 */
public enum Operator {
    PLUS('+', Operator.PREC_ADDITIVE),
    MINUS('-', Operator.PREC_ADDITIVE),
    TIMES('*', Operator.PREC_MULTIPLICATIVE),
    DIVIDE('/', Operator.PREC_MULTIPLICATIVE),
    MODULO('%', Operator.PREC_MULTIPLICATIVE),
    POWER('^', Operator.PREC_POWER);

    // Precedence levels, lowest binding first.  Unary prefix signs sit
    // between multiplication and exponentiation, so -5^2 is -(5^2).
    static final int PREC_ADDITIVE = 1;
    static final int PREC_MULTIPLICATIVE = 2;
    static final int PREC_UNARY = 3;
    static final int PREC_POWER = 4;
    static final int PREC_PRIMARY = 5;

    private final char mSymbol;
    private final int mPrecedence;

    Operator(char symbol, int precedence) {
        mSymbol = symbol;
        mPrecedence = precedence;
    }

    public char symbol() {
        return mSymbol;
    }

    public int precedence() {
        return mPrecedence;
    }

    public boolean isRightAssociative() {
        return this == POWER;
    }

    // Only + and - may also appear as prefix operators.
    public boolean isSign() {
        return this == PLUS || this == MINUS;
    }

    /**
     * Returns the operator written as {@code c}, or null if there is none.
     */
    public static Operator forSymbol(char c) {
        switch (c) {
        case '+': return PLUS;
        case '-': return MINUS;
        case '*': return TIMES;
        case '/': return DIVIDE;
        case '%': return MODULO;
        case '^': return POWER;
        default:  return null;
        }
    }

    @Override
    public String toString() {
        return String.valueOf(mSymbol);
    }
}
