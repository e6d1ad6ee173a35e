/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

/**
 * Closed set of failure categories raised by the expression engine.
 * Callers are expected to switch over these rather than inspect messages.
 */
public enum ErrorKind {
    /** Unrecognized character in the input. */
    LEX,
    /** Malformed expression: empty input, bad parentheses, missing operator. */
    PARSE,
    /** Undefined variable or unknown function name. */
    REFERENCE,
    /** Function called with the wrong number of arguments. */
    ARITY,
    /** Argument outside a function's domain, e.g. factorial(-1). */
    DOMAIN,
    /** User-defined function calls nested deeper than the context allows. */
    RECURSION;

    public boolean isSyntax() {
        return this == LEX || this == PARSE;
    }
}
