/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Turns doubles into display strings: rounded to a number of significant
 * digits, trailing zeros dropped, and with locale separators applied.
 * <p>
 * Values whose decimal exponent is below -6, or at least the precision,
 * are shown in exponent form, e.g. {@code 1.5e+21}.
 */
public final class ResultFormatter {
    public static final String INFINITY = "∞";
    public static final String NAN = "NaN";

    // Smallest decimal exponent shown without an exponent.
    private static final int MIN_PLAIN_EXPONENT = -6;

    private final char mDecimalSeparator;
    private final String mThousandsSeparator;  // Empty for no grouping.

    public ResultFormatter() {
        this('.', "");
    }

    public ResultFormatter(char decimalSeparator, String thousandsSeparator) {
        if (thousandsSeparator.length() > 1
                || thousandsSeparator.equals(String.valueOf(decimalSeparator))) {
            throw new IllegalArgumentException("Bad separators: '" + decimalSeparator
                    + "' and '" + thousandsSeparator + "'");
        }
        mDecimalSeparator = decimalSeparator;
        mThousandsSeparator = thousandsSeparator;
    }

    public static ResultFormatter fromSettings(CalculatorSettings settings) {
        return new ResultFormatter(settings.getDecimalSeparator(),
                settings.getThousandsSeparator());
    }

    public CalculationResult toResult(double value, int precision) {
        return new CalculationResult(value, format(value, precision), precision);
    }

    public String format(double value, int precision) {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision must be positive: " + precision);
        }
        if (Double.isNaN(value)) return NAN;
        if (Double.isInfinite(value)) return value > 0 ? INFINITY : "-" + INFINITY;
        if (value == 0) return "0";  // Including -0.

        BigDecimal rounded = new BigDecimal(value)
                .round(new MathContext(precision, RoundingMode.HALF_UP));
        // Decimal exponent of the leading digit, after rounding.
        int exponent = rounded.precision() - rounded.scale() - 1;
        BigDecimal stripped = rounded.stripTrailingZeros();
        String sign = stripped.signum() < 0 ? "-" : "";
        if (exponent < MIN_PLAIN_EXPONENT || exponent >= precision) {
            String digits = stripped.unscaledValue().abs().toString();
            StringBuilder sb = new StringBuilder(sign);
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append(mDecimalSeparator).append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
            return sb.toString();
        }
        String plain = stripped.abs().toPlainString();
        int dot = plain.indexOf('.');
        String whole = dot < 0 ? plain : plain.substring(0, dot);
        StringBuilder sb = new StringBuilder(sign);
        sb.append(group(whole));
        if (dot >= 0) {
            sb.append(mDecimalSeparator).append(plain, dot + 1, plain.length());
        }
        return sb.toString();
    }

    // Insert the thousands separator into a string of digits.
    private String group(String digits) {
        if (mThousandsSeparator.isEmpty() || digits.length() <= 3) {
            return digits;
        }
        StringBuilder sb = new StringBuilder();
        int lead = digits.length() % 3;
        if (lead == 0) lead = 3;
        sb.append(digits, 0, lead);
        for (int i = lead; i < digits.length(); i += 3) {
            sb.append(mThousandsSeparator).append(digits, i, i + 3);
        }
        return sb.toString();
    }
}
