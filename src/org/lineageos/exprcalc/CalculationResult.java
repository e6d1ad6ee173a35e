/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.Objects;

/**
 * A computed value together with its display form, as handed to history,
 * UI and export code.  Immutable; built fresh for every evaluation.
 */
public final class CalculationResult {
    /** Kind of value carried.  The real-valued engine only produces numbers. */
    public enum Type { NUMBER }

    private final double mValue;
    private final Type mType;
    private final String mFormatted;
    private final int mPrecision;

    CalculationResult(double value, String formatted, int precision) {
        mValue = value;
        mType = Type.NUMBER;
        mFormatted = Objects.requireNonNull(formatted);
        mPrecision = precision;
    }

    public double getValue() {
        return mValue;
    }

    public Type getType() {
        return mType;
    }

    public String getFormatted() {
        return mFormatted;
    }

    public int getPrecision() {
        return mPrecision;
    }

    @Override
    public String toString() {
        return mFormatted;
    }
}
