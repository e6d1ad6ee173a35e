/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Validator#validate}: either valid, or a list of
 * problems in source order.
 */
public final class ValidationResult {
    private static final ValidationResult VALID =
            new ValidationResult(Collections.<Diagnostic>emptyList());

    /**
     * One problem found in the text.
     */
    public static final class Diagnostic {
        private final String mMessage;
        private final int mPosition;

        public Diagnostic(String message, int position) {
            mMessage = Objects.requireNonNull(message);
            mPosition = position;
        }

        public String getMessage() {
            return mMessage;
        }

        public boolean hasPosition() {
            return mPosition != CalculatorException.NO_POSITION;
        }

        // Offset into the text, or CalculatorException.NO_POSITION.
        public int getPosition() {
            return mPosition;
        }

        @Override
        public String toString() {
            return hasPosition() ? mMessage + " (at " + mPosition + ")" : mMessage;
        }
    }

    private final List<Diagnostic> mErrors;

    private ValidationResult(List<Diagnostic> errors) {
        mErrors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    static ValidationResult valid() {
        return VALID;
    }

    static ValidationResult invalid(CalculatorException e) {
        return new ValidationResult(Collections.singletonList(
                new Diagnostic(e.getMessage(), e.getPosition())));
    }

    public boolean isValid() {
        return mErrors.isEmpty();
    }

    public List<Diagnostic> getErrors() {
        return mErrors;
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : "invalid " + mErrors;
    }
}
