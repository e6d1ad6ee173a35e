/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything an evaluation depends on besides the expression itself:
 * angle mode, display precision, variable and function bindings, the
 * limit on nested user-defined function calls, and the limit on how deeply
 * expressions may nest.
 * <p>
 * The evaluator never modifies a context.  Calling a user-defined function
 * creates a child context whose parameter bindings shadow, but do not
 * alter, the parent's variables.
 */
public final class EvalContext {
    public static final int DEFAULT_PRECISION = 10;
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;
    public static final int DEFAULT_MAX_NESTING = Parser.DEFAULT_MAX_NESTING;

    private final AngleMode mAngleMode;
    private final int mPrecision;        // Significant digits for display.
    private final int mMaxCallDepth;
    private final int mMaxNesting;       // For parsing, and for evaluation across calls.
    private final VariableStore mVariables;
    private final FunctionStore mFunctions;
    // The following are only set for the body of a user-defined function.
    private final EvalContext mParent;
    private final Map<String, Double> mLocals;
    private final int mDepth;            // Number of enclosing user function calls.

    public EvalContext(AngleMode angleMode, int precision,
                       VariableStore variables, FunctionStore functions) {
        this(angleMode, precision, DEFAULT_MAX_CALL_DEPTH, variables, functions);
    }

    public EvalContext(AngleMode angleMode, int precision, int maxCallDepth,
                       VariableStore variables, FunctionStore functions) {
        this(angleMode, precision, maxCallDepth, DEFAULT_MAX_NESTING, variables, functions);
    }

    public EvalContext(AngleMode angleMode, int precision, int maxCallDepth, int maxNesting,
                       VariableStore variables, FunctionStore functions) {
        if (precision < 1) {
            throw new IllegalArgumentException("Precision must be positive: " + precision);
        }
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("Max call depth must be positive: "
                    + maxCallDepth);
        }
        if (maxNesting < 1) {
            throw new IllegalArgumentException("Max nesting must be positive: " + maxNesting);
        }
        mAngleMode = Objects.requireNonNull(angleMode);
        mPrecision = precision;
        mMaxCallDepth = maxCallDepth;
        mMaxNesting = maxNesting;
        mVariables = Objects.requireNonNull(variables);
        mFunctions = Objects.requireNonNull(functions);
        mParent = null;
        mLocals = Collections.emptyMap();
        mDepth = 0;
    }

    private EvalContext(EvalContext parent, Map<String, Double> locals) {
        mAngleMode = parent.mAngleMode;
        mPrecision = parent.mPrecision;
        mMaxCallDepth = parent.mMaxCallDepth;
        mMaxNesting = parent.mMaxNesting;
        mVariables = parent.mVariables;
        mFunctions = parent.mFunctions;
        mParent = parent;
        mLocals = locals;
        mDepth = parent.mDepth + 1;
    }

    /**
     * Radians, precision 10, no variables or functions.
     */
    public static EvalContext createDefault() {
        return new EvalContext(AngleMode.RADIANS, DEFAULT_PRECISION,
                new VariableStore(), new FunctionStore());
    }

    /**
     * A context with the same settings and stores but a different angle mode.
     */
    public EvalContext withAngleMode(AngleMode angleMode) {
        return new EvalContext(angleMode, mPrecision, mMaxCallDepth, mMaxNesting,
                mVariables, mFunctions);
    }

    // Context for evaluating a function body with the given parameter
    // bindings.
    EvalContext child(Map<String, Double> bindings) {
        return new EvalContext(this, Collections.unmodifiableMap(new HashMap<>(bindings)));
    }

    /**
     * Value of a variable: innermost parameter binding first, then the
     * variable store.  Null if unbound.
     */
    public Double lookupVariable(String name) {
        for (EvalContext c = this; c != null; c = c.mParent) {
            Double value = c.mLocals.get(name);
            if (value != null) return value;
        }
        return mVariables.get(name);
    }

    public UserFunction lookupFunction(String name) {
        return mFunctions.get(name);
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

    public int getDepth() {
        return mDepth;
    }

    public VariableStore getVariables() {
        return mVariables;
    }

    public FunctionStore getFunctions() {
        return mFunctions;
    }
}
