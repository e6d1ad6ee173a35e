/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a list of independent expressions, one after another, in a
 * single shared context.  A row that fails to parse or evaluate is
 * recorded with its error message and the remaining rows still run.
 */
public final class BatchEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(BatchEvaluator.class);

    private final ResultFormatter mFormatter;

    public BatchEvaluator(ResultFormatter formatter) {
        mFormatter = formatter;
    }

    public BatchResult evaluate(List<String> expressions, EvalContext ec) {
        List<BatchResult.Row> rows = new ArrayList<>(expressions.size());
        for (int i = 0; i < expressions.size(); ++i) {
            String expression = expressions.get(i) == null ? "" : expressions.get(i).trim();
            try {
                double value = Evaluator.evaluate(
                        Parser.parse(expression, ec.getMaxNesting()), ec);
                rows.add(BatchResult.Row.success(i, expression,
                        mFormatter.toResult(value, ec.getPrecision())));
            } catch (CalculatorException e) {
                LOG.debug("Row {} \"{}\" failed: {}", i, expression, e.getMessage());
                rows.add(BatchResult.Row.failure(i, expression, e));
            }
        }
        BatchResult result = new BatchResult(rows);
        LOG.debug("Batch of {}: {} succeeded, {} failed", rows.size(),
                result.getSuccessCount(), result.getErrorCount());
        return result;
    }
}
