/*
 * Copyright (C) 2015 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

//
// This implements the expression evaluation logic.
// Evaluation is a recursive walk over an ExprNode tree in a given
// EvalContext, producing an IEEE double.
//
// Arithmetic follows IEEE 754 throughout.  In particular division and
// remainder by zero produce infinities or NaN rather than errors, since
// a batch of independent expressions should not stop at the first
// pathological row.  The only errors reported are names that don't
// resolve, calls with the wrong number of arguments, the few domain
// violations BuiltinFunctions checks for, and user-defined functions that
// recurse past the context's call depth limit.
//
// Evaluation is recursive.  The nesting depth reached, counted across
// user function calls, is bounded by the context's maxNesting so that
// hand-built trees and deep call chains fail with an EvaluationException
// rather than exhausting the stack.
//
// Function names are resolved here, not by the parser.  A user-defined
// function takes precedence over a built-in of the same name, though
// FunctionStore refuses to create such a function.  Arguments are
// evaluated left to right in the caller's context before the callee's
// body is evaluated in a child context.

package org.lineageos.exprcalc;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Evaluator {
    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private Evaluator() {
    }

    /**
     * Evaluate a parsed expression.
     *
     * @throws EvaluationException for unresolved names, bad argument counts,
     *         domain errors and excessive recursion
     */
    public static double evaluate(ExprNode node, EvalContext ec) {
        return evaluate(node, ec, 1);
    }

    private static double evaluate(ExprNode node, EvalContext ec, int depth) {
        if (depth > ec.getMaxNesting()) {
            throw EvaluationException.of(ErrorKind.RECURSION, "error_eval_too_deep",
                    ec.getMaxNesting());
        }
        switch (node.kind()) {
        case NUMBER:
            return ((ExprNode.Number) node).value();
        case CONSTANT:
            return ((ExprNode.Constant) node).value();
        case VARIABLE: {
            String name = ((ExprNode.Variable) node).name();
            Double value = ec.lookupVariable(name);
            if (value == null) {
                throw EvaluationException.of(ErrorKind.REFERENCE,
                        "error_undefined_variable", name);
            }
            return value;
        }
        case UNARY: {
            ExprNode.Unary u = (ExprNode.Unary) node;
            double operand = evaluate(u.operand(), ec, depth + 1);
            return u.operator() == Operator.MINUS ? -operand : operand;
        }
        case BINARY:
            return evalBinary((ExprNode.Binary) node, ec, depth);
        case CALL:
            return evalCall((ExprNode.Call) node, ec, depth);
        default:
            throw new AssertionError("Unknown node kind " + node.kind());
        }
    }

    private static double evalBinary(ExprNode.Binary b, EvalContext ec, int depth) {
        final double left = evaluate(b.left(), ec, depth + 1);
        final double right = evaluate(b.right(), ec, depth + 1);
        switch (b.operator()) {
        case PLUS:   return left + right;
        case MINUS:  return left - right;
        case TIMES:  return left * right;
        case DIVIDE: return left / right;
        case MODULO: return left % right;
        case POWER:  return Math.pow(left, right);
        default:
            throw new AssertionError("Unknown operator " + b.operator());
        }
    }

    private static double[] evalArgs(List<ExprNode> args, EvalContext ec, int depth) {
        double[] values = new double[args.size()];
        for (int i = 0; i < values.length; ++i) {
            values[i] = evaluate(args.get(i), ec, depth + 1);
        }
        return values;
    }

    private static double evalCall(ExprNode.Call call, EvalContext ec, int depth) {
        final String name = call.name();
        UserFunction fn = ec.lookupFunction(name);
        if (fn != null) {
            return callUserFunction(fn, call.args(), ec, depth);
        }
        if (BuiltinFunctions.isBuiltin(name)) {
            return BuiltinFunctions.call(name, evalArgs(call.args(), ec, depth), ec);
        }
        throw EvaluationException.of(ErrorKind.REFERENCE, "error_unknown_function", name);
    }

    private static double callUserFunction(UserFunction fn, List<ExprNode> args,
                                           EvalContext ec, int depth) {
        if (args.size() != fn.getArity()) {
            throw EvaluationException.of(ErrorKind.ARITY, "error_arity",
                    fn.getName(), fn.getArity(), args.size());
        }
        if (ec.getDepth() >= ec.getMaxCallDepth()) {
            LOG.debug("Call depth {} reached calling {}", ec.getDepth(), fn.getName());
            throw EvaluationException.of(ErrorKind.RECURSION, "error_call_depth",
                    ec.getMaxCallDepth(), fn.getName());
        }
        double[] values = evalArgs(args, ec, depth);
        Map<String, Double> bindings = new HashMap<>();
        List<String> params = fn.getParams();
        for (int i = 0; i < values.length; ++i) {
            bindings.put(params.get(i), values[i]);
        }
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} {} at depth {}", fn.getName(), bindings, ec.getDepth() + 1);
        }
        // The body continues the caller's nesting count.
        return evaluate(fn.getBody(), ec.child(bindings), depth + 1);
    }
}
