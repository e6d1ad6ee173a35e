/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.Locale;

/**
 * Unit in which trigonometric functions take arguments and inverse
 * trigonometric functions return results.
 */
public enum AngleMode {
    DEGREES, RADIANS;

    /**
     * Parse a settings value such as "degrees" or "RAD".
     */
    public static AngleMode fromString(String s) {
        switch (s.trim().toLowerCase(Locale.ROOT)) {
        case "deg":
        case "degrees":
            return DEGREES;
        case "rad":
        case "radians":
            return RADIANS;
        default:
            throw new IllegalArgumentException("Unknown angle mode: " + s);
        }
    }
}
