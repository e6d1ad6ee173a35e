/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine configuration: defaults for new evaluation contexts and the
 * separators used when formatting results.
 * <p>
 * Read from {@code calculator.properties} on the classpath.  Keys that are
 * absent keep their built-in defaults; keys with unusable values are
 * rejected.
 */
public final class CalculatorSettings {
    private static final Logger LOG = LoggerFactory.getLogger(CalculatorSettings.class);

    public static final String RESOURCE = "calculator.properties";

    public static final String KEY_ANGLE_MODE = "angle_mode";
    public static final String KEY_PRECISION = "precision";
    public static final String KEY_MAX_CALL_DEPTH = "max_call_depth";
    public static final String KEY_MAX_NESTING = "max_nesting";
    public static final String KEY_DECIMAL_SEPARATOR = "decimal_separator";
    public static final String KEY_THOUSANDS_SEPARATOR = "thousands_separator";

    static final int MAX_PRECISION = 100;

    private final AngleMode mAngleMode;
    private final int mPrecision;
    private final int mMaxCallDepth;
    private final int mMaxNesting;
    private final char mDecimalSeparator;
    private final String mThousandsSeparator;

    private CalculatorSettings(AngleMode angleMode, int precision, int maxCallDepth,
                               int maxNesting, char decimalSeparator,
                               String thousandsSeparator) {
        mAngleMode = angleMode;
        mPrecision = precision;
        mMaxCallDepth = maxCallDepth;
        mMaxNesting = maxNesting;
        mDecimalSeparator = decimalSeparator;
        mThousandsSeparator = thousandsSeparator;
    }

    /**
     * Radians, 10 significant digits, '.' as decimal point, no grouping.
     */
    public static CalculatorSettings defaults() {
        return new CalculatorSettings(AngleMode.RADIANS, EvalContext.DEFAULT_PRECISION,
                EvalContext.DEFAULT_MAX_CALL_DEPTH, EvalContext.DEFAULT_MAX_NESTING, '.', "");
    }

    /**
     * Settings from {@value #RESOURCE}, or the defaults if there is no such
     * resource.
     */
    public static CalculatorSettings load() {
        InputStream in = CalculatorSettings.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            LOG.warn("No {} on the classpath, using defaults", RESOURCE);
            return defaults();
        }
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults", RESOURCE, e);
            return defaults();
        }
        return fromProperties(props);
    }

    /**
     * @throws IllegalArgumentException if a value is present but unusable
     */
    public static CalculatorSettings fromProperties(Properties props) {
        CalculatorSettings d = defaults();
        AngleMode angleMode = d.mAngleMode;
        String s = props.getProperty(KEY_ANGLE_MODE);
        if (s != null) {
            angleMode = AngleMode.fromString(s);
        }
        int precision = intProperty(props, KEY_PRECISION, d.mPrecision);
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException(KEY_PRECISION + " must be between 1 and "
                    + MAX_PRECISION + ": " + precision);
        }
        int maxCallDepth = intProperty(props, KEY_MAX_CALL_DEPTH, d.mMaxCallDepth);
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException(KEY_MAX_CALL_DEPTH + " must be positive: "
                    + maxCallDepth);
        }
        int maxNesting = intProperty(props, KEY_MAX_NESTING, d.mMaxNesting);
        if (maxNesting < 1) {
            throw new IllegalArgumentException(KEY_MAX_NESTING + " must be positive: "
                    + maxNesting);
        }
        char decimalSeparator = d.mDecimalSeparator;
        s = props.getProperty(KEY_DECIMAL_SEPARATOR);
        if (s != null) {
            s = s.trim();
            if (!s.equals(".") && !s.equals(",")) {
                throw new IllegalArgumentException(KEY_DECIMAL_SEPARATOR
                        + " must be '.' or ',': " + s);
            }
            decimalSeparator = s.charAt(0);
        }
        String thousandsSeparator = d.mThousandsSeparator;
        s = props.getProperty(KEY_THOUSANDS_SEPARATOR);
        if (s != null) {
            // Not trimmed: a single space is a legal separator.
            if (!s.isEmpty() && !s.equals(",") && !s.equals(".") && !s.equals(" ")) {
                throw new IllegalArgumentException(KEY_THOUSANDS_SEPARATOR
                        + " must be empty, ',', '.' or ' ': " + s);
            }
            thousandsSeparator = s;
        }
        if (thousandsSeparator.equals(String.valueOf(decimalSeparator))) {
            throw new IllegalArgumentException("Decimal and thousands separators are both '"
                    + decimalSeparator + "'");
        }
        return new CalculatorSettings(angleMode, precision, maxCallDepth, maxNesting,
                decimalSeparator, thousandsSeparator);
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
        String s = props.getProperty(key);
        if (s == null) return defaultValue;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + s, e);
        }
    }

    /**
     * A fresh context using these settings and the given stores.
     */
    public EvalContext newContext(VariableStore variables, FunctionStore functions) {
        return new EvalContext(mAngleMode, mPrecision, mMaxCallDepth, mMaxNesting,
                variables, functions);
    }

    public AngleMode getAngleMode() {
        return mAngleMode;
    }

    public int getPrecision() {
        return mPrecision;
    }

    public int getMaxCallDepth() {
        return mMaxCallDepth;
    }

    public int getMaxNesting() {
        return mMaxNesting;
    }

    public char getDecimalSeparator() {
        return mDecimalSeparator;
    }

    public String getThousandsSeparator() {
        return mThousandsSeparator;
    }
}
