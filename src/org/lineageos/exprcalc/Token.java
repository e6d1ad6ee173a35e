/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.Objects;

/**
 * A classified piece of expression text.
 */
public final class Token {
    public enum Kind {
        NUMBER, OPERATOR, FUNCTION, CONSTANT, VARIABLE, LEFT_PAREN, RIGHT_PAREN, COMMA
    }

    private final Kind mKind;
    private final String mText;
    private final int mPosition;   // Zero-based offset into the source text.
    private final boolean mImplicit;  // Multiplication inserted by the tokenizer.

    public Token(Kind kind, String text, int position) {
        this(kind, text, position, false);
    }

    private Token(Kind kind, String text, int position, boolean implicit) {
        mKind = Objects.requireNonNull(kind);
        mText = Objects.requireNonNull(text);
        mPosition = position;
        mImplicit = implicit;
    }

    // A '*' that the user did not write, placed at the position of the
    // token it precedes.
    static Token implicitTimes(int position) {
        return new Token(Kind.OPERATOR, "*", position, true);
    }

    public Kind getKind() {
        return mKind;
    }

    public String getText() {
        return mText;
    }

    public int getPosition() {
        return mPosition;
    }

    public boolean isImplicit() {
        return mImplicit;
    }

    public boolean is(Kind kind) {
        return mKind == kind;
    }

    public boolean isOperator(Operator op) {
        return mKind == Kind.OPERATOR && mText.charAt(0) == op.symbol();
    }

    // Operator represented by an OPERATOR token, else null.
    public Operator operator() {
        return mKind == Kind.OPERATOR ? Operator.forSymbol(mText.charAt(0)) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return mKind == t.mKind && mPosition == t.mPosition
                && mImplicit == t.mImplicit && mText.equals(t.mText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mKind, mText, mPosition, mImplicit);
    }

    @Override
    public String toString() {
        return mKind + "(" + mText + ")@" + mPosition;
    }
}
