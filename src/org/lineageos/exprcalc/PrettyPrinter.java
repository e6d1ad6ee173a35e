/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.List;

/**
 * Renders a tree back to canonical text, using as few parentheses as
 * possible without changing how the text parses.
 * <p>
 * Binary operators are surrounded by single spaces, call arguments are
 * separated by ", ", and implicit multiplications come out explicit:
 * {@code 2x} prints as {@code 2 * x}.
 */
public final class PrettyPrinter {
    private PrettyPrinter() {
    }

    public static String print(ExprNode node) {
        StringBuilder sb = new StringBuilder();
        append(sb, node);
        return sb.toString();
    }

    // Binding strength of the node's top level construct.
    static int precedence(ExprNode node) {
        switch (node.kind()) {
        case NUMBER:
            // A negative literal only comes from a hand-built tree.  It
            // prints with a leading '-' and so reads back as a unary minus.
            return ((ExprNode.Number) node).text().startsWith("-")
                    ? Operator.PREC_UNARY : Operator.PREC_PRIMARY;
        case UNARY:
            return Operator.PREC_UNARY;
        case BINARY:
            return ((ExprNode.Binary) node).operator().precedence();
        default:
            return Operator.PREC_PRIMARY;
        }
    }

    private static void append(StringBuilder sb, ExprNode node) {
        switch (node.kind()) {
        case NUMBER:
            sb.append(((ExprNode.Number) node).text());
            break;
        case CONSTANT:
            sb.append(((ExprNode.Constant) node).name());
            break;
        case VARIABLE:
            sb.append(((ExprNode.Variable) node).name());
            break;
        case UNARY: {
            ExprNode.Unary u = (ExprNode.Unary) node;
            sb.append(u.operator().symbol());
            appendOperand(sb, u.operand(), precedence(u.operand()) < Operator.PREC_UNARY);
            break;
        }
        case BINARY: {
            ExprNode.Binary b = (ExprNode.Binary) node;
            Operator op = b.operator();
            int leftPrec = precedence(b.left());
            int rightPrec = precedence(b.right());
            // An operand of equal precedence needs parentheses on the side
            // opposite the operator's associativity.
            boolean wrapLeft = leftPrec < op.precedence()
                    || (leftPrec == op.precedence() && op.isRightAssociative());
            boolean wrapRight = rightPrec < op.precedence()
                    || (rightPrec == op.precedence() && !op.isRightAssociative());
            appendOperand(sb, b.left(), wrapLeft);
            sb.append(' ').append(op.symbol()).append(' ');
            appendOperand(sb, b.right(), wrapRight);
            break;
        }
        case CALL: {
            ExprNode.Call c = (ExprNode.Call) node;
            sb.append(c.name()).append('(');
            List<ExprNode> args = c.args();
            for (int i = 0; i < args.size(); ++i) {
                if (i > 0) sb.append(", ");
                append(sb, args.get(i));
            }
            sb.append(')');
            break;
        }
        default:
            throw new AssertionError("Unknown node kind " + node.kind());
        }
    }

    private static void appendOperand(StringBuilder sb, ExprNode operand, boolean parenthesize) {
        if (parenthesize) sb.append('(');
        append(sb, operand);
        if (parenthesize) sb.append(')');
    }
}
