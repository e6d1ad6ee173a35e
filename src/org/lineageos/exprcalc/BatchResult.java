/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-row outcomes of a {@link BatchEvaluator} run, in input order.
 */
public final class BatchResult {
    /**
     * One evaluated expression: either a result or an error message.
     */
    public static final class Row {
        private final int mIndex;
        private final String mExpression;
        private final CalculationResult mResult;  // Null on failure.
        private final String mError;              // Null on success.
        private final ErrorKind mErrorKind;       // Null on success.

        private Row(int index, String expression, CalculationResult result,
                    String error, ErrorKind errorKind) {
            mIndex = index;
            mExpression = expression;
            mResult = result;
            mError = error;
            mErrorKind = errorKind;
        }

        static Row success(int index, String expression, CalculationResult result) {
            return new Row(index, expression, result, null, null);
        }

        static Row failure(int index, String expression, CalculatorException e) {
            return new Row(index, expression, null, e.getMessage(), e.getKind());
        }

        public int getIndex() {
            return mIndex;
        }

        public String getExpression() {
            return mExpression;
        }

        public boolean isSuccess() {
            return mResult != null;
        }

        public CalculationResult getResult() {
            return mResult;
        }

        public String getError() {
            return mError;
        }

        public ErrorKind getErrorKind() {
            return mErrorKind;
        }

        @Override
        public String toString() {
            return mIndex + ": " + mExpression + " -> "
                    + (isSuccess() ? mResult.getFormatted() : "error: " + mError);
        }
    }

    private final List<Row> mRows;
    private final int mSuccessCount;

    BatchResult(List<Row> rows) {
        mRows = Collections.unmodifiableList(new ArrayList<>(rows));
        int successes = 0;
        for (Row r : mRows) {
            if (r.isSuccess()) ++successes;
        }
        mSuccessCount = successes;
    }

    public List<Row> getRows() {
        return mRows;
    }

    public int getSuccessCount() {
        return mSuccessCount;
    }

    public int getErrorCount() {
        return mRows.size() - mSuccessCount;
    }
}
