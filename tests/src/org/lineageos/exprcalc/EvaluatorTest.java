/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

public class EvaluatorTest {
    private static final double EPS = 1e-12;

    private VariableStore mVars;
    private FunctionStore mFuncs;
    private EvalContext mContext;

    @Before
    public void setUp() {
        mVars = new VariableStore();
        mFuncs = new FunctionStore();
        mContext = new EvalContext(AngleMode.RADIANS, 10, mVars, mFuncs);
    }

    private double eval(String text) {
        return Evaluator.evaluate(Parser.parse(text), mContext);
    }

    private EvaluationException evalError(String text) {
        try {
            double result = eval(text);
            fail("Expected EvaluationException for \"" + text + "\", got " + result);
            return null;
        } catch (EvaluationException e) {
            return e;
        }
    }

    @Test
    public void testArithmetic() {
        assertEquals(7, eval("1 + 2 * 3"), 0);
        assertEquals(9, eval("(1 + 2) * 3"), 0);
        assertEquals(3, eval("8 - 3 - 2"), 0);
        assertEquals(1, eval("8 / 4 / 2"), 0);
        assertEquals(1, eval("10 % 3"), 0);
        assertEquals(-1, eval("-10 % 3"), 0);
        assertEquals(2.5, eval("5 / 2"), 0);
        assertEquals(0.001, eval("1e-3"), 0);
    }

    @Test
    public void testPowers() {
        assertEquals(Math.pow(2, 81), eval("2^3^4"), 0);
        assertEquals(-25, eval("-5^2"), 0);
        assertEquals(25, eval("(-5)^2"), 0);
        assertEquals(0.125, eval("2^-3"), 0);
    }

    @Test
    public void testUnary() {
        assertEquals(-6, eval("-2 * 3"), 0);
        assertEquals(4, eval("--4"), 0);
        assertEquals(4, eval("+4"), 0);
    }

    @Test
    public void testDivisionByZeroIsIeee() {
        assertEquals(Double.POSITIVE_INFINITY, eval("1 / 0"), 0);
        assertEquals(Double.NEGATIVE_INFINITY, eval("-1 / 0"), 0);
        assertTrue(Double.isNaN(eval("0 / 0")));
        assertTrue(Double.isNaN(eval("5 % 0")));
    }

    @Test
    public void testConstants() {
        assertEquals(Math.PI, eval("pi"), 0);
        assertEquals(Math.E, eval("E"), 0);
        assertEquals((1 + Math.sqrt(5)) / 2, eval("phi"), EPS);
        assertEquals(2 * Math.PI, eval("tau"), 0);
        assertEquals(2 * Math.E, eval("2e"), 0);
    }

    @Test
    public void testVariables() {
        mVars.set("x", 3);
        mVars.set("Rate", 0.5);
        assertEquals(7, eval("2x + 1"), 0);
        assertEquals(1.5, eval("Rate * x"), 0);
    }

    @Test
    public void testUndefinedVariable() {
        EvaluationException e = evalError("x + 1");
        assertEquals(ErrorKind.REFERENCE, e.getKind());
        assertEquals("undefined variable: x", e.getMessage());
        assertFalse(e.hasPosition());
    }

    @Test
    public void testVariablesAreCaseSensitive() {
        mVars.set("x", 1);
        assertEquals("undefined variable: X", evalError("X").getMessage());
    }

    @Test
    public void testUnknownFunction() {
        EvaluationException e = evalError("g(1)");
        assertEquals(ErrorKind.REFERENCE, e.getKind());
        assertEquals("unknown function: g", e.getMessage());
    }

    @Test
    public void testUserFunction() {
        mFuncs.define("f", Collections.singletonList("t"), "t^2 + 1");
        mFuncs.define("hyp", Arrays.asList("a", "b"), "sqrt(a^2 + b^2)");
        assertEquals(10, eval("f(3)"), 0);
        assertEquals(5, eval("hyp(3, 4)"), EPS);
        assertEquals(20, eval("2f(3)"), 0);
    }

    @Test
    public void testZeroArgumentFunction() {
        mFuncs.define("answer", Collections.<String>emptyList(), "42");
        assertEquals(42, eval("answer()"), 0);
    }

    @Test
    public void testParameterShadowsVariable() {
        mVars.set("x", 100);
        mFuncs.define("f", Collections.singletonList("x"), "x + 1");
        assertEquals(3, eval("f(2)"), 0);
        // Arguments are evaluated in the caller's context.
        assertEquals(102, eval("f(x + 1)"), 0);
        // And the caller's binding is untouched.
        assertEquals(100, eval("x"), 0);
    }

    @Test
    public void testBodySeesGlobalVariables() {
        mVars.set("k", 10);
        mFuncs.define("scale", Collections.singletonList("v"), "k * v");
        assertEquals(30, eval("scale(3)"), 0);
        mVars.set("k", 2);
        assertEquals(6, eval("scale(3)"), 0);
    }

    @Test
    public void testNestedCallsSeeEnclosingParameters() {
        mFuncs.define("inner", Collections.singletonList("y"), "y + outerParam");
        mFuncs.define("outer", Collections.singletonList("outerParam"), "inner(1)");
        assertEquals(6, eval("outer(5)"), 0);
    }

    @Test
    public void testForwardReference() {
        mFuncs.define("g", Collections.singletonList("x"), "h(x) * 2");
        assertEquals("unknown function: h", evalError("g(1)").getMessage());
        mFuncs.define("h", Collections.singletonList("x"), "x + 1");
        assertEquals(4, eval("g(1)"), 0);
    }

    @Test
    public void testRedefinitionAffectsLaterEvaluations() {
        ExprNode call = Parser.parse("f(2)");
        mFuncs.define("f", Collections.singletonList("x"), "x * 10");
        assertEquals(20, Evaluator.evaluate(call, mContext), 0);
        mFuncs.define("f", Collections.singletonList("x"), "x * 100");
        assertEquals(200, Evaluator.evaluate(call, mContext), 0);
    }

    @Test
    public void testUserFunctionArity() {
        mFuncs.define("f", Arrays.asList("a", "b"), "a + b");
        EvaluationException e = evalError("f(1)");
        assertEquals(ErrorKind.ARITY, e.getKind());
        assertEquals("Function f expects 2 argument(s) but got 1", e.getMessage());
    }

    @Test
    public void testBuiltinArity() {
        EvaluationException e = evalError("sin(1, 2)");
        assertEquals(ErrorKind.ARITY, e.getKind());
        assertEquals("Function sin expects 1 argument(s) but got 2", e.getMessage());
        assertEquals(ErrorKind.ARITY, evalError("max()").getKind());
    }

    @Test
    public void testInfiniteRecursion() {
        mFuncs.define("loop", Collections.singletonList("n"), "loop(n + 1)");
        EvaluationException e = evalError("loop(0)");
        assertEquals(ErrorKind.RECURSION, e.getKind());
        assertEquals("Maximum call depth of 256 exceeded in loop", e.getMessage());
    }

    @Test
    public void testCallDepthLimit() {
        VariableStore vars = new VariableStore();
        FunctionStore funcs = new FunctionStore();
        EvalContext ec = new EvalContext(AngleMode.RADIANS, 10, 3, vars, funcs);
        funcs.define("a", Collections.singletonList("x"), "b(x) + 1");
        funcs.define("b", Collections.singletonList("x"), "c(x) + 1");
        funcs.define("c", Collections.singletonList("x"), "x");
        assertEquals(2, Evaluator.evaluate(Parser.parse("a(0)"), ec), 0);
        funcs.define("c", Collections.singletonList("x"), "d(x)");
        funcs.define("d", Collections.singletonList("x"), "x");
        try {
            Evaluator.evaluate(Parser.parse("a(0)"), ec);
            fail("Expected RECURSION error");
        } catch (EvaluationException e) {
            assertEquals(ErrorKind.RECURSION, e.getKind());
        }
    }

    @Test
    public void testAngleMode() {
        EvalContext degrees = mContext.withAngleMode(AngleMode.DEGREES);
        assertEquals(1, Evaluator.evaluate(Parser.parse("sin(90)"), degrees), EPS);
        assertEquals(1, Evaluator.evaluate(Parser.parse("sin(pi / 2)"), mContext), EPS);
        assertEquals(45, Evaluator.evaluate(Parser.parse("atan(1)"), degrees), EPS);
    }

    @Test
    public void testContextUnchanged() {
        mVars.set("x", 1);
        mFuncs.define("f", Collections.singletonList("x"), "x * 2");
        eval("f(5) + x");
        assertEquals(1, mVars.size());
        assertEquals(1, mVars.get("x").doubleValue(), 0);
        assertEquals(0, mContext.getDepth());
    }

    @Test
    public void testDeepHandBuiltTree() {
        ExprNode node = new ExprNode.Number(1);
        for (int i = 0; i < 100000; ++i) {
            node = new ExprNode.Unary(Operator.MINUS, node);
        }
        try {
            Evaluator.evaluate(node, mContext);
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals(ErrorKind.RECURSION, e.getKind());
            assertEquals("Evaluation nested more than 500 levels deep", e.getMessage());
        }
    }

    @Test
    public void testNestingCountsAcrossCalls() {
        EvalContext ec = new EvalContext(AngleMode.RADIANS, 10, 256, 20, mVars, mFuncs);
        mFuncs.define("down", Collections.singletonList("n"), "down(n - 1) + 1");
        try {
            Evaluator.evaluate(Parser.parse("down(0)"), ec);
            fail("Expected EvaluationException");
        } catch (EvaluationException e) {
            assertEquals(ErrorKind.RECURSION, e.getKind());
            assertEquals("Evaluation nested more than 20 levels deep", e.getMessage());
        }
    }
}
