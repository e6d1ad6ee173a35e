/*
 * Copyright (C) 2014 The Android Open Source Project
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// A parsed mathematical expression, represented as a tree of nodes.
// Nodes are immutable once built and never share mutable state, so a tree
// may be cached (e.g. as a user-defined function body) and evaluated any
// number of times in different contexts.
// Structural equality is provided so that trees can be compared in tests
// and after a print/parse round trip.
public abstract class ExprNode {
    public enum Kind { NUMBER, CONSTANT, VARIABLE, UNARY, BINARY, CALL }

    private final int mDepth;

    ExprNode(int depth) {
        mDepth = depth;
    }

    public abstract Kind kind();

    /**
     * Number of nodes on the longest path from this node to a leaf; 1 for
     * a leaf.
     */
    public int depth() {
        return mDepth;
    }

    // A numeric literal.  We keep the source text so the pretty-printer
    // reproduces what the user typed rather than a reformatted double.
    public static final class Number extends ExprNode {
        private final double mValue;
        private final String mText;

        public Number(double value, String text) {
            super(1);
            mValue = value;
            mText = Objects.requireNonNull(text);
        }

        public Number(double value) {
            this(value, formatLiteral(value));
        }

        public double value() {
            return mValue;
        }

        public String text() {
            return mText;
        }

        @Override
        public Kind kind() { return Kind.NUMBER; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Number
                    && Double.compare(mValue, ((Number) o).mValue) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(mValue);
        }

        @Override
        public String toString() {
            return "number(" + mText + ")";
        }

        private static String formatLiteral(double value) {
            if (value == Math.rint(value) && Math.abs(value) < 1e15) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }
    }

    // A named constant.  The value is looked up once, at parse time.
    public static final class Constant extends ExprNode {
        private final String mName;
        private final double mValue;

        public Constant(String name, double value) {
            super(1);
            mName = Objects.requireNonNull(name);
            mValue = value;
        }

        public String name() {
            return mName;
        }

        public double value() {
            return mValue;
        }

        @Override
        public Kind kind() { return Kind.CONSTANT; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant && mName.equals(((Constant) o).mName);
        }

        @Override
        public int hashCode() {
            return mName.hashCode();
        }

        @Override
        public String toString() {
            return "constant(" + mName + ")";
        }
    }

    // A variable; resolved against the evaluation context.
    public static final class Variable extends ExprNode {
        private final String mName;

        public Variable(String name) {
            super(1);
            mName = Objects.requireNonNull(name);
        }

        public String name() {
            return mName;
        }

        @Override
        public Kind kind() { return Kind.VARIABLE; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && mName.equals(((Variable) o).mName);
        }

        @Override
        public int hashCode() {
            return mName.hashCode();
        }

        @Override
        public String toString() {
            return "variable(" + mName + ")";
        }
    }

    // Prefix + or -.
    public static final class Unary extends ExprNode {
        private final Operator mOperator;
        private final ExprNode mOperand;

        public Unary(Operator operator, ExprNode operand) {
            super(operand.depth() + 1);
            if (!operator.isSign()) {
                throw new IllegalArgumentException("Not a prefix operator: " + operator);
            }
            mOperator = operator;
            mOperand = Objects.requireNonNull(operand);
        }

        public Operator operator() {
            return mOperator;
        }

        public ExprNode operand() {
            return mOperand;
        }

        @Override
        public Kind kind() { return Kind.UNARY; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unary)) return false;
            Unary u = (Unary) o;
            return mOperator == u.mOperator && mOperand.equals(u.mOperand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(mOperator, mOperand);
        }

        @Override
        public String toString() {
            return "unary(" + mOperator + ", " + mOperand + ")";
        }
    }

    public static final class Binary extends ExprNode {
        private final Operator mOperator;
        private final ExprNode mLeft;
        private final ExprNode mRight;

        public Binary(Operator operator, ExprNode left, ExprNode right) {
            super(Math.max(left.depth(), right.depth()) + 1);
            mOperator = Objects.requireNonNull(operator);
            mLeft = Objects.requireNonNull(left);
            mRight = Objects.requireNonNull(right);
        }

        public Operator operator() {
            return mOperator;
        }

        public ExprNode left() {
            return mLeft;
        }

        public ExprNode right() {
            return mRight;
        }

        @Override
        public Kind kind() { return Kind.BINARY; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary b = (Binary) o;
            return mOperator == b.mOperator && mLeft.equals(b.mLeft) && mRight.equals(b.mRight);
        }

        @Override
        public int hashCode() {
            return Objects.hash(mOperator, mLeft, mRight);
        }

        @Override
        public String toString() {
            return "binary(" + mOperator + ", " + mLeft + ", " + mRight + ")";
        }
    }

    // Function application.  The callee is resolved, and its arity
    // checked, only when the call is evaluated: user-defined functions
    // may be defined after the expression was parsed.
    public static final class Call extends ExprNode {
        private final String mName;
        private final List<ExprNode> mArgs;

        public Call(String name, List<ExprNode> args) {
            super(maxDepth(args) + 1);
            mName = Objects.requireNonNull(name);
            mArgs = Collections.unmodifiableList(new ArrayList<>(args));
        }

        public String name() {
            return mName;
        }

        private static int maxDepth(List<ExprNode> args) {
            int result = 0;
            for (ExprNode arg : args) {
                result = Math.max(result, arg.depth());
            }
            return result;
        }

        public List<ExprNode> args() {
            return mArgs;
        }

        @Override
        public Kind kind() { return Kind.CALL; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Call)) return false;
            Call c = (Call) o;
            return mName.equals(c.mName) && mArgs.equals(c.mArgs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(mName, mArgs);
        }

        @Override
        public String toString() {
            return "call(" + mName + ", " + mArgs + ")";
        }
    }
}
