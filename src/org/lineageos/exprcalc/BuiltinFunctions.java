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

// The fixed table of functions every expression may call.
// Everything is computed in IEEE double precision.  Results outside the
// real domain (sqrt(-1), ln(0), 1/0 style overflow) are returned as NaN or
// infinities instead of being reported, so that a single bad value doesn't
// abort a batch.  Only factorial, gamma and root() with a zero index report
// domain errors.

public final class BuiltinFunctions {
    static final int VARIADIC = -1;

    // Largest n for which n! is finite as a double.
    static final int MAX_FACTORIAL = 170;

    // Function name -> number of arguments, or VARIADIC (one or more).
    private static final Map<String, Integer> sArity;
    static {
        Map<String, Integer> arity = new LinkedHashMap<>();
        for (String unary : new String[] {
                "sin", "cos", "tan", "asin", "acos", "atan",
                "sinh", "cosh", "tanh", "asinh", "acosh", "atanh",
                "exp", "ln", "log", "log10", "log2",
                "sqrt", "cbrt", "abs", "floor", "ceil", "round",
                "factorial", "gamma"}) {
            arity.put(unary, 1);
        }
        arity.put("pow", 2);
        arity.put("root", 2);
        arity.put("min", VARIADIC);
        arity.put("max", VARIADIC);
        sArity = Collections.unmodifiableMap(arity);
    }

    // Lanczos approximation, g = 7, n = 9.
    private static final int LANCZOS_G = 7;
    private static final double SQRT_2PI = Math.sqrt(2 * Math.PI);
    // Largest x for which gamma(x) is finite as a double.
    static final double MAX_GAMMA_ARG = 171.61447887182298;
    // Above this, x*x + 1 == x*x and log(2x) is exact to double precision.
    private static final double LARGE_HYPERBOLIC_ARG = 1e8;
    private static final double LN2 = Math.log(2);
    private static final double[] LANCZOS_COEFFICIENTS = {
        0.99999999999980993,
        676.5203681218851,
        -1259.1392167224028,
        771.32342877765313,
        -176.61502916214059,
        12.507343278686905,
        -0.13857109526572012,
        9.9843695780195716e-6,
        1.5056327351493116e-7
    };

    private BuiltinFunctions() {
    }

    public static boolean isBuiltin(String name) {
        return sArity.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return sArity.keySet();
    }

    // Number of arguments name takes, or VARIADIC.
    static int arity(String name) {
        Integer result = sArity.get(name.toLowerCase(Locale.ROOT));
        if (result == null) {
            throw new IllegalArgumentException("Not a built-in function: " + name);
        }
        return result;
    }

    private static double toRadians(double x, EvalContext ec) {
        return ec.getAngleMode() == AngleMode.DEGREES ? Math.toRadians(x) : x;
    }

    private static double fromRadians(double x, EvalContext ec) {
        return ec.getAngleMode() == AngleMode.DEGREES ? Math.toDegrees(x) : x;
    }

    private static void checkArity(String name, double[] args) {
        int expected = arity(name);
        if (expected == VARIADIC) {
            if (args.length < 1) {
                throw EvaluationException.of(ErrorKind.ARITY, "error_arity_at_least",
                        name, 1, args.length);
            }
        } else if (args.length != expected) {
            throw EvaluationException.of(ErrorKind.ARITY, "error_arity",
                    name, expected, args.length);
        }
    }

    /**
     * Apply the named built-in to already evaluated arguments.
     * Angle mode is taken from ec; nothing else in the context is consulted.
     */
    static double call(String name, double[] args, EvalContext ec) {
        name = name.toLowerCase(Locale.ROOT);
        checkArity(name, args);
        switch (name) {
        case "sin":   return Math.sin(toRadians(args[0], ec));
        case "cos":   return Math.cos(toRadians(args[0], ec));
        case "tan":   return Math.tan(toRadians(args[0], ec));
        case "asin":  return fromRadians(Math.asin(args[0]), ec);
        case "acos":  return fromRadians(Math.acos(args[0]), ec);
        case "atan":  return fromRadians(Math.atan(args[0]), ec);
        // Hyperbolic functions take no notice of the angle mode.
        case "sinh":  return Math.sinh(args[0]);
        case "cosh":  return Math.cosh(args[0]);
        case "tanh":  return Math.tanh(args[0]);
        case "asinh": return asinh(args[0]);
        case "acosh": return acosh(args[0]);
        case "atanh": return atanh(args[0]);
        case "exp":   return Math.exp(args[0]);
        case "ln":    return Math.log(args[0]);
        case "log":
        case "log10": return Math.log10(args[0]);
        case "log2":  return log2(args[0]);
        case "sqrt":  return Math.sqrt(args[0]);
        case "cbrt":  return Math.cbrt(args[0]);
        case "abs":   return Math.abs(args[0]);
        case "floor": return Math.floor(args[0]);
        case "ceil":  return Math.ceil(args[0]);
        case "round": return round(args[0]);
        case "pow":   return Math.pow(args[0], args[1]);
        case "root":  return root(args[0], args[1]);
        case "factorial": return factorial(args[0]);
        case "gamma": return gamma(args[0]);
        case "min": {
            double result = args[0];
            for (int i = 1; i < args.length; ++i) result = Math.min(result, args[i]);
            return result;
        }
        case "max": {
            double result = args[0];
            for (int i = 1; i < args.length; ++i) result = Math.max(result, args[i]);
            return result;
        }
        default:
            // arity() already rejected unknown names.
            throw new AssertionError("Unhandled built-in: " + name);
        }
    }

    // Nearest integer, halves rounded up: round(-2.5) is -2.
    static double round(double x) {
        double r = Math.rint(x);
        return r - x == -0.5 ? r + 1 : r;
    }

    // Odd, so computed on |x| where log1p stays accurate near zero.
    static double asinh(double x) {
        double a = Math.abs(x);
        double result;
        if (a > LARGE_HYPERBOLIC_ARG) {
            result = Math.log(a) + LN2;
        } else {
            result = Math.log1p(a + a * a / (1 + Math.sqrt(1 + a * a)));
        }
        return Math.copySign(result, x);
    }

    static double acosh(double x) {
        if (x < 1) return Double.NaN;
        if (x > LARGE_HYPERBOLIC_ARG) {
            return Math.log(x) + LN2;
        }
        return Math.log(x + Math.sqrt(x * x - 1));
    }

    static double atanh(double x) {
        return 0.5 * Math.log1p(2 * x / (1 - x));
    }

    // Exact for powers of two, which Math.log(x) / Math.log(2) is not.
    static double log2(double x) {
        if (x > 0 && !Double.isInfinite(x)) {
            int exponent = Math.getExponent(x);
            if (x == Math.scalb(1.0, exponent)) return exponent;
        }
        return Math.log(x) / Math.log(2);
    }

    // Real n-th root.  Odd roots of negative numbers stay real; even roots
    // of negative numbers are NaN, matching sqrt().
    static double root(double x, double n) {
        if (n == 0) {
            throw EvaluationException.of(ErrorKind.DOMAIN, "error_root_index");
        }
        if (x < 0) {
            boolean oddInteger = n == Math.rint(n) && Math.abs(n % 2) == 1;
            return oddInteger ? -Math.pow(-x, 1 / n) : Double.NaN;
        }
        return Math.pow(x, 1 / n);
    }

    static double factorial(double n) {
        if (Double.isNaN(n) || n < 0 || n != Math.floor(n)) {
            throw EvaluationException.of(ErrorKind.DOMAIN, "error_factorial");
        }
        if (n > MAX_FACTORIAL) {
            return Double.POSITIVE_INFINITY;
        }
        double result = 1;
        for (int i = 2; i <= (int) n; ++i) {
            result *= i;
        }
        return result;
    }

    static double gamma(double x) {
        if (x <= 0 && x == Math.floor(x)) {
            throw EvaluationException.of(ErrorKind.DOMAIN, "error_gamma");
        }
        if (x < 0.5) {
            // Reflection formula.
            return Math.PI / (Math.sin(Math.PI * x) * lanczos(1 - x));
        }
        return lanczos(x);
    }

    private static double lanczos(double x) {
        if (x > MAX_GAMMA_ARG) {
            return Double.POSITIVE_INFINITY;
        }
        double z = x - 1;
        double sum = LANCZOS_COEFFICIENTS[0];
        for (int i = 1; i < LANCZOS_G + 2; ++i) {
            sum += LANCZOS_COEFFICIENTS[i] / (z + i);
        }
        double t = z + LANCZOS_G + 0.5;
        // t^(z + 0.5) alone overflows long before the result does.
        double p = Math.pow(t, (z + 0.5) / 2);
        return SQRT_2PI * p * (p * Math.exp(-t)) * sum;
    }
}
