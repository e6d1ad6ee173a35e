/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits expression text into tokens.
 * <p>
 * Scanning happens in two passes.  The first classifies characters into
 * numbers, names, operators, parentheses and commas.  The second inserts a
 * multiplication wherever the user juxtaposed two operands that are
 * conventionally multiplied, as in {@code 2x}, {@code 3(4)} or
 * {@code (a)(b)}.  Two adjacent numbers are deliberately left alone so that
 * the parser can report the missing operator.
 */
public final class Tokenizer {
    private final String mText;
    private int mPos;
    private final List<Token> mTokens = new ArrayList<>();

    private Tokenizer(String text) {
        mText = text;
    }

    /**
     * Tokenize text, including the implicit multiplication pass.
     *
     * @throws SyntaxException of kind LEX for an unrecognized character, or
     *         of kind PARSE for a malformed numeric literal
     */
    public static List<Token> tokenize(String text) {
        Tokenizer t = new Tokenizer(text);
        t.scan();
        return insertImplicitMultiplication(t.mTokens);
    }

    private void scan() {
        final int len = mText.length();
        while (mPos < len) {
            char c = mText.charAt(mPos);
            if (Character.isWhitespace(c)) {
                ++mPos;
            } else if (Symbols.isDigit(c) || c == '.') {
                scanNumber();
            } else if (Symbols.isIdentifierStart(c)) {
                scanName();
            } else if (Operator.forSymbol(c) != null) {
                add(Token.Kind.OPERATOR, String.valueOf(c));
            } else if (c == '(') {
                add(Token.Kind.LEFT_PAREN, "(");
            } else if (c == ')') {
                add(Token.Kind.RIGHT_PAREN, ")");
            } else if (c == ',') {
                add(Token.Kind.COMMA, ",");
            } else {
                String bad = new String(Character.toChars(mText.codePointAt(mPos)));
                throw SyntaxException.lex(mPos, "error_bad_char", bad, mPos);
            }
        }
    }

    // Single character token at the current position.
    private void add(Token.Kind kind, String text) {
        mTokens.add(new Token(kind, text, mPos));
        ++mPos;
    }

    // Digits with at most one decimal point, then an optional exponent.
    // Signs are never part of a literal; the parser treats them as
    // operators.
    private void scanNumber() {
        final int start = mPos;
        final int len = mText.length();
        boolean sawDigit = false;
        boolean sawDecimal = false;
        while (mPos < len) {
            char c = mText.charAt(mPos);
            if (Symbols.isDigit(c)) {
                sawDigit = true;
            } else if (c == '.' && !sawDecimal) {
                sawDecimal = true;
            } else {
                break;
            }
            ++mPos;
        }
        if (!sawDigit || (mPos < len && mText.charAt(mPos) == '.')) {
            // A lone '.', or a second decimal point as in 1.2.3
            int end = mPos;
            while (end < len && (Symbols.isDigit(mText.charAt(end))
                    || mText.charAt(end) == '.')) {
                ++end;
            }
            throw SyntaxException.parse(start, "error_bad_number",
                    mText.substring(start, end), start);
        }
        // Only treat e/E as an exponent marker if digits follow; otherwise
        // it's the constant e (or the start of a name) multiplied in.
        if (mPos < len && (mText.charAt(mPos) == 'e' || mText.charAt(mPos) == 'E')) {
            int digitsAt = mPos + 1;
            if (digitsAt < len && (mText.charAt(digitsAt) == '+'
                    || mText.charAt(digitsAt) == '-')) {
                ++digitsAt;
            }
            if (digitsAt < len && Symbols.isDigit(mText.charAt(digitsAt))) {
                mPos = digitsAt;
                while (mPos < len && Symbols.isDigit(mText.charAt(mPos))) {
                    ++mPos;
                }
            }
        }
        mTokens.add(new Token(Token.Kind.NUMBER, mText.substring(start, mPos), start));
    }

    private void scanName() {
        final int start = mPos;
        final int len = mText.length();
        while (mPos < len && Symbols.isIdentifierPart(mText.charAt(mPos))) {
            ++mPos;
        }
        String name = mText.substring(start, mPos);
        String lower = name.toLowerCase(Locale.ROOT);
        if (BuiltinFunctions.isBuiltin(lower)) {
            // Recognized regardless of what follows; the parser insists
            // on the parenthesis.
            mTokens.add(new Token(Token.Kind.FUNCTION, lower, start));
        } else if (Symbols.isConstant(lower)) {
            mTokens.add(new Token(Token.Kind.CONSTANT, lower, start));
        } else {
            mTokens.add(new Token(Token.Kind.VARIABLE, name, start));
        }
    }

    // Would a user writing left immediately followed by right mean a
    // product?
    static boolean impliesMultiplication(Token.Kind left, Token.Kind right) {
        switch (left) {
        case NUMBER:
            return right == Token.Kind.VARIABLE || right == Token.Kind.LEFT_PAREN
                    || right == Token.Kind.FUNCTION || right == Token.Kind.CONSTANT;
        case RIGHT_PAREN:
            return right == Token.Kind.LEFT_PAREN || right == Token.Kind.FUNCTION
                    || right == Token.Kind.VARIABLE || right == Token.Kind.CONSTANT;
        default:
            return false;
        }
    }

    static List<Token> insertImplicitMultiplication(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        Token previous = null;
        for (Token t : tokens) {
            if (previous != null
                    && impliesMultiplication(previous.getKind(), t.getKind())) {
                result.add(Token.implicitTimes(t.getPosition()));
            }
            result.add(t);
            previous = t;
        }
        return result;
    }
}
