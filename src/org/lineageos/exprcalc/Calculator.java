/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.List;

/**
 * Entry point to the expression engine.
 * <p>
 * The static methods are the pure operations: tokenize, parse, validate,
 * pretty-print and evaluate.  An instance adds what depends on
 * configuration, namely new contexts with the configured defaults and
 * display-ready results.
 * <pre>
 *   Calculator calc = new Calculator();
 *   EvalContext ec = calc.newContext();
 *   ec.getVariables().set("x", 3);
 *   ec.getFunctions().define("f", List.of("t"), "t^2 + 1");
 *   calc.calculate("2f(x)", ec).getFormatted();   // "20"
 * </pre>
 * Instances hold no bindings; those live in the stores each caller
 * supplies through its contexts.
 */
public class Calculator {
    private final CalculatorSettings mSettings;
    private final ResultFormatter mFormatter;
    private final BatchEvaluator mBatchEvaluator;

    public Calculator() {
        this(CalculatorSettings.load());
    }

    public Calculator(CalculatorSettings settings) {
        mSettings = settings;
        mFormatter = ResultFormatter.fromSettings(settings);
        mBatchEvaluator = new BatchEvaluator(mFormatter);
    }

    public static List<Token> tokenize(String text) {
        return Tokenizer.tokenize(text);
    }

    public static ExprNode parse(String text) {
        return Parser.parse(text);
    }

    public static ValidationResult validate(String text) {
        return Validator.validate(text);
    }

    public static String prettyPrint(ExprNode node) {
        return PrettyPrinter.print(node);
    }

    public static double evaluate(ExprNode node, EvalContext ec) {
        return Evaluator.evaluate(node, ec);
    }

    /**
     * Radians, precision 10, empty bindings, regardless of configuration.
     */
    public static EvalContext createDefaultContext() {
        return EvalContext.createDefault();
    }

    public CalculatorSettings getSettings() {
        return mSettings;
    }

    /**
     * A context with the configured defaults and empty stores.
     */
    public EvalContext newContext() {
        return newContext(new VariableStore(), new FunctionStore());
    }

    public EvalContext newContext(VariableStore variables, FunctionStore functions) {
        return mSettings.newContext(variables, functions);
    }

    /**
     * Parse and evaluate text, formatting the value to the context's
     * precision.
     *
     * @throws CalculatorException if the text does not parse or evaluate
     */
    public CalculationResult calculate(String text, EvalContext ec) {
        double value = Evaluator.evaluate(Parser.parse(text, ec.getMaxNesting()), ec);
        return mFormatter.toResult(value, ec.getPrecision());
    }

    public BatchResult calculateAll(List<String> expressions, EvalContext ec) {
        return mBatchEvaluator.evaluate(expressions, ec);
    }
}
