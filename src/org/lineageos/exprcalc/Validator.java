/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

/**
 * Pre-flight syntax check for live input feedback.  Never throws.
 */
public final class Validator {
    private Validator() {
    }

    public static ValidationResult validate(String text) {
        return validate(text, Parser.DEFAULT_MAX_NESTING);
    }

    public static ValidationResult validate(String text, int maxNesting) {
        try {
            Parser.parse(text, maxNesting);
            return ValidationResult.valid();
        } catch (SyntaxException e) {
            return ValidationResult.invalid(e);
        }
    }
}
