/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import static org.junit.Assert.assertEquals;

import java.util.Properties;

import org.junit.Test;

public class CalculatorSettingsTest {

    private static Properties props(String... keysAndValues) {
        Properties p = new Properties();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            p.setProperty(keysAndValues[i], keysAndValues[i + 1]);
        }
        return p;
    }

    @Test
    public void testDefaults() {
        CalculatorSettings s = CalculatorSettings.defaults();
        assertEquals(AngleMode.RADIANS, s.getAngleMode());
        assertEquals(10, s.getPrecision());
        assertEquals(256, s.getMaxCallDepth());
        assertEquals(500, s.getMaxNesting());
        assertEquals('.', s.getDecimalSeparator());
        assertEquals("", s.getThousandsSeparator());
    }

    @Test
    public void testLoadFromClasspath() {
        CalculatorSettings s = CalculatorSettings.load();
        assertEquals(AngleMode.RADIANS, s.getAngleMode());
        assertEquals(10, s.getPrecision());
        assertEquals(256, s.getMaxCallDepth());
    }

    @Test
    public void testEmptyPropertiesGiveDefaults() {
        CalculatorSettings s = CalculatorSettings.fromProperties(new Properties());
        assertEquals(AngleMode.RADIANS, s.getAngleMode());
        assertEquals(10, s.getPrecision());
    }

    @Test
    public void testFromProperties() {
        CalculatorSettings s = CalculatorSettings.fromProperties(props(
                CalculatorSettings.KEY_ANGLE_MODE, "Degrees",
                CalculatorSettings.KEY_PRECISION, " 6 ",
                CalculatorSettings.KEY_MAX_CALL_DEPTH, "32",
                CalculatorSettings.KEY_MAX_NESTING, "64",
                CalculatorSettings.KEY_DECIMAL_SEPARATOR, ",",
                CalculatorSettings.KEY_THOUSANDS_SEPARATOR, " "));
        assertEquals(AngleMode.DEGREES, s.getAngleMode());
        assertEquals(6, s.getPrecision());
        assertEquals(32, s.getMaxCallDepth());
        assertEquals(64, s.getMaxNesting());
        assertEquals(64, s.newContext(new VariableStore(), new FunctionStore()).getMaxNesting());
        assertEquals(',', s.getDecimalSeparator());
        assertEquals(" ", s.getThousandsSeparator());
    }

    @Test
    public void testNewContext() {
        CalculatorSettings s = CalculatorSettings.fromProperties(props(
                CalculatorSettings.KEY_ANGLE_MODE, "deg",
                CalculatorSettings.KEY_PRECISION, "4"));
        VariableStore vars = new VariableStore();
        FunctionStore funcs = new FunctionStore();
        EvalContext ec = s.newContext(vars, funcs);
        assertEquals(AngleMode.DEGREES, ec.getAngleMode());
        assertEquals(4, ec.getPrecision());
        assertEquals(vars, ec.getVariables());
        assertEquals(funcs, ec.getFunctions());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadAngleMode() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_ANGLE_MODE, "grad"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPrecisionTooSmall() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_PRECISION, "0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPrecisionTooLarge() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_PRECISION, "101"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPrecisionNotANumber() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_PRECISION, "ten"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadCallDepth() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_MAX_CALL_DEPTH, "0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadNesting() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_MAX_NESTING, "-1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadDecimalSeparator() {
        CalculatorSettings.fromProperties(props(CalculatorSettings.KEY_DECIMAL_SEPARATOR, ";"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testClashingSeparators() {
        CalculatorSettings.fromProperties(props(
                CalculatorSettings.KEY_DECIMAL_SEPARATOR, ",",
                CalculatorSettings.KEY_THOUSANDS_SEPARATOR, ","));
    }
}
