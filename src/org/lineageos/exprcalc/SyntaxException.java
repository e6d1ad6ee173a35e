/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

/**
 * Thrown by the tokenizer (kind LEX) and the parser (kind PARSE).
 */
public class SyntaxException extends CalculatorException {
    public SyntaxException(ErrorKind kind, String message, int position) {
        super(kind, message, position);
        if (!kind.isSyntax()) {
            throw new IllegalArgumentException("Not a syntax error kind: " + kind);
        }
    }

    static SyntaxException lex(int position, String key, Object... args) {
        return new SyntaxException(ErrorKind.LEX, Messages.get(key, args), position);
    }

    static SyntaxException parse(int position, String key, Object... args) {
        return new SyntaxException(ErrorKind.PARSE, Messages.get(key, args), position);
    }
}
