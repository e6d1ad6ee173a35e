/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

/**
 * Base class for every failure the engine reports.
 * The message is the only part meant for display.
 */
public abstract class CalculatorException extends RuntimeException {
    public static final int NO_POSITION = -1;

    private final ErrorKind mKind;
    private final int mPosition;  // Offset into the source text, or NO_POSITION.

    protected CalculatorException(ErrorKind kind, String message, int position) {
        super(message);
        mKind = kind;
        mPosition = position;
    }

    public ErrorKind getKind() {
        return mKind;
    }

    public boolean hasPosition() {
        return mPosition != NO_POSITION;
    }

    public int getPosition() {
        return mPosition;
    }
}
