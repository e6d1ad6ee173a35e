/*
 * Copyright (C) 2015 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lineageos.exprcalc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// This is a collection of mappings between names appearing in expression
// text and the things they stand for: named constants and the lexical
// classes of identifier characters.
//
// Symbols instances are not meaningful; everything here is static.
// All functions are pure.

public final class Symbols {
    // Golden ratio, (1 + sqrt(5)) / 2.
    public static final double PHI = 1.618033988749894848204586834365638;

    public static final double TAU = 2 * Math.PI;

    private static final Map<String, Double> sConstants;
    static {
        Map<String, Double> constants = new LinkedHashMap<>();
        constants.put("pi", Math.PI);
        constants.put("e", Math.E);
        constants.put("phi", PHI);
        constants.put("tau", TAU);
        sConstants = Collections.unmodifiableMap(constants);
    }

    private Symbols() {
    }

    // Case-insensitive; name need not be lower case.
    public static boolean isConstant(String name) {
        return sConstants.containsKey(name.toLowerCase(Locale.ROOT));
    }

    // Value of a named constant.  Callers must check isConstant() first.
    public static double constantValue(String name) {
        Double value = sConstants.get(name.toLowerCase(Locale.ROOT));
        if (value == null) {
            throw new IllegalArgumentException("Not a constant: " + name);
        }
        return value;
    }

    public static Set<String> constantNames() {
        return sConstants.keySet();
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    // ASCII only; we don't accept other scripts' digits in expressions.
    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // Is s a legal variable, function or parameter name?
    public static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty() || !isIdentifierStart(s.charAt(0))) {
            return false;
        }
        for (int i = 1; i < s.length(); ++i) {
            if (!isIdentifierPart(s.charAt(i))) return false;
        }
        return true;
    }
}
