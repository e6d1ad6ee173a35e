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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

// Turns a token sequence into an ExprNode tree.
//
// Binary + - * / % are handled by precedence climbing; prefix signs and
// the right-associative ^ get their own levels below that, so that ^
// binds tighter than a leading minus:
//
//   expr    = unary { binop expr' }     (binop of at least the current precedence)
//   unary   = ('+' | '-') unary | power
//   power   = primary [ '^' unary ]
//   primary = number | constant | variable | call | '(' expr ')'
//   call    = name '(' [ expr { ',' expr } ] ')'
//
// The parser never evaluates anything and never resolves function names:
// arity is checked when a call is evaluated.
//
// Both the recursion depth of the parse and the depth of the resulting
// tree are limited to maxNesting, so that neither the parser nor a later
// walk over the tree can run out of stack.
public final class Parser {
    public static final int DEFAULT_MAX_NESTING = 500;

    private final List<Token> mTokens;
    private final int mMaxNesting;
    private int mPos;         // Next token to be consumed.
    private int mNesting;     // Active parseUnary() calls.
    private final Deque<Token> mOpenParens = new ArrayDeque<>();
                              // '(' tokens not yet closed, innermost first.

    private Parser(List<Token> tokens, int maxNesting) {
        mTokens = tokens;
        mMaxNesting = maxNesting;
    }

    /**
     * Parse expression text into a tree, allowing
     * {@value #DEFAULT_MAX_NESTING} levels of nesting.
     *
     * @throws SyntaxException if the text is empty, contains an unknown
     *         character, is not a well formed expression, or is nested too
     *         deeply
     */
    public static ExprNode parse(String text) {
        return parse(text, DEFAULT_MAX_NESTING);
    }

    public static ExprNode parse(String text, int maxNesting) {
        if (text == null || text.trim().isEmpty()) {
            throw SyntaxException.parse(CalculatorException.NO_POSITION, "error_empty");
        }
        return parse(Tokenizer.tokenize(text), maxNesting);
    }

    /**
     * Parse an already tokenized expression.
     */
    public static ExprNode parse(List<Token> tokens) {
        return parse(tokens, DEFAULT_MAX_NESTING);
    }

    public static ExprNode parse(List<Token> tokens, int maxNesting) {
        if (maxNesting < 1) {
            throw new IllegalArgumentException("Max nesting must be positive: " + maxNesting);
        }
        if (tokens.isEmpty()) {
            throw SyntaxException.parse(CalculatorException.NO_POSITION, "error_empty");
        }
        Parser p = new Parser(tokens, maxNesting);
        ExprNode result = p.parseExpression(Operator.PREC_ADDITIVE);
        if (!p.atEnd()) {
            // Something is left over after a complete expression.
            throw p.leftoverError(p.current());
        }
        return result;
    }

    // Position for errors about the token at mPos, which may be past the end.
    private int positionHere() {
        return atEnd() ? CalculatorException.NO_POSITION : current().getPosition();
    }

    private SyntaxException tooDeep(int position) {
        return SyntaxException.parse(position, "error_too_deep", mMaxNesting);
    }

    // Reject trees that later recursive walks couldn't handle.
    private ExprNode limited(ExprNode node, int position) {
        if (node.depth() > mMaxNesting) {
            throw tooDeep(position);
        }
        return node;
    }

    private boolean atEnd() {
        return mPos >= mTokens.size();
    }

    private Token current() {
        return atEnd() ? null : mTokens.get(mPos);
    }

    private boolean currentIs(Token.Kind kind) {
        return !atEnd() && mTokens.get(mPos).is(kind);
    }

    private Token advance() {
        return mTokens.get(mPos++);
    }

    // Could t begin an operand?  Used to tell a missing operator from a
    // token that's simply out of place.
    private static boolean canStartOperand(Token t) {
        switch (t.getKind()) {
        case NUMBER:
        case CONSTANT:
        case VARIABLE:
        case FUNCTION:
        case LEFT_PAREN:
            return true;
        default:
            return false;
        }
    }

    // Error for a token that can't follow a complete operand.
    private SyntaxException leftoverError(Token t) {
        if (t.is(Token.Kind.RIGHT_PAREN) && mOpenParens.isEmpty()) {
            return SyntaxException.parse(t.getPosition(), "error_unmatched_rparen",
                    t.getPosition());
        }
        if (canStartOperand(t)) {
            return SyntaxException.parse(t.getPosition(), "error_missing_operator",
                    t.getText());
        }
        return SyntaxException.parse(t.getPosition(), "error_unexpected_token", t.getText());
    }

    // Binary operator at the current position that the expression loop may
    // consume, or null.  ^ is left to parsePower().
    private Operator currentBinary() {
        Token t = current();
        if (t == null) return null;
        Operator op = t.operator();
        return op == Operator.POWER ? null : op;
    }

    private ExprNode parseExpression(int minPrec) {
        ExprNode left = parseUnary();
        Operator op;
        while ((op = currentBinary()) != null && op.precedence() >= minPrec) {
            advance();
            // Left associative: the right operand only absorbs operators
            // that bind strictly tighter.
            int opPosition = mTokens.get(mPos - 1).getPosition();
            ExprNode right = parseExpression(op.precedence() + 1);
            left = limited(new ExprNode.Binary(op, left, right), opPosition);
        }
        return left;
    }

    // Every recursive path through the grammar passes through here, so
    // this is where nesting is counted.
    private ExprNode parseUnary() {
        if (++mNesting > mMaxNesting) {
            throw tooDeep(positionHere());
        }
        ExprNode result;
        Token t = current();
        if (t != null && (t.isOperator(Operator.PLUS) || t.isOperator(Operator.MINUS))) {
            advance();
            result = limited(new ExprNode.Unary(t.operator(), parseUnary()), t.getPosition());
        } else {
            result = parsePower();
        }
        --mNesting;
        return result;
    }

    private ExprNode parsePower() {
        ExprNode base = parsePrimary();
        Token t = current();
        if (t != null && t.isOperator(Operator.POWER)) {
            advance();
            // Right associative, and the exponent may carry its own sign.
            return limited(new ExprNode.Binary(Operator.POWER, base, parseUnary()),
                    t.getPosition());
        }
        return base;
    }

    private ExprNode parsePrimary() {
        if (atEnd()) {
            if (!mOpenParens.isEmpty()) {
                // Input stopped inside parentheses, e.g. "(2 +"
                int pos = mOpenParens.peek().getPosition();
                throw SyntaxException.parse(pos, "error_missing_rparen", pos);
            }
            throw SyntaxException.parse(CalculatorException.NO_POSITION,
                    "error_unexpected_end");
        }
        Token t = advance();
        switch (t.getKind()) {
        case NUMBER:
            return new ExprNode.Number(Double.parseDouble(t.getText()), t.getText());
        case CONSTANT:
            return new ExprNode.Constant(t.getText(), Symbols.constantValue(t.getText()));
        case VARIABLE:
            if (currentIs(Token.Kind.LEFT_PAREN)) {
                // Call to a user-defined function, resolved later.
                return parseCall(t);
            }
            return new ExprNode.Variable(t.getText());
        case FUNCTION:
            if (!currentIs(Token.Kind.LEFT_PAREN)) {
                throw SyntaxException.parse(t.getPosition(), "error_function_needs_paren",
                        t.getText());
            }
            return parseCall(t);
        case LEFT_PAREN: {
            mOpenParens.push(t);
            ExprNode inner = parseExpression(Operator.PREC_ADDITIVE);
            expectClose(t);
            return inner;
        }
        case RIGHT_PAREN:
            if (mOpenParens.isEmpty()) {
                throw SyntaxException.parse(t.getPosition(), "error_unmatched_rparen",
                        t.getPosition());
            }
            throw SyntaxException.parse(t.getPosition(), "error_unexpected_token", t.getText());
        default:
            throw SyntaxException.parse(t.getPosition(), "error_unexpected_token", t.getText());
        }
    }

    // name has been consumed; current token is the '('.
    private ExprNode parseCall(Token name) {
        Token open = advance();
        mOpenParens.push(open);
        List<ExprNode> args = new ArrayList<>();
        if (!currentIs(Token.Kind.RIGHT_PAREN)) {
            args.add(parseExpression(Operator.PREC_ADDITIVE));
            while (currentIs(Token.Kind.COMMA)) {
                advance();
                args.add(parseExpression(Operator.PREC_ADDITIVE));
            }
        }
        expectClose(open);
        return limited(new ExprNode.Call(name.getText(), args), name.getPosition());
    }

    // Consume the ')' matching open.
    private void expectClose(Token open) {
        if (atEnd()) {
            throw SyntaxException.parse(open.getPosition(), "error_missing_rparen",
                    open.getPosition());
        }
        Token t = current();
        if (!t.is(Token.Kind.RIGHT_PAREN)) {
            throw leftoverError(t);
        }
        advance();
        mOpenParens.pop();
    }
}
