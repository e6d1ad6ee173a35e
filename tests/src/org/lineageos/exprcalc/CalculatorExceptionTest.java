/*
    SPDX-FileCopyrightText: 2026 The LineageOS Project
    SPDX-License-Identifier: Apache-2.0
*/

package org.lineageos.exprcalc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class CalculatorExceptionTest {

    @Test
    public void testSyntaxKinds() {
        assertTrue(ErrorKind.LEX.isSyntax());
        assertTrue(ErrorKind.PARSE.isSyntax());
        assertFalse(ErrorKind.REFERENCE.isSyntax());
        assertFalse(ErrorKind.RECURSION.isSyntax());
    }

    @Test
    public void testSyntaxException() {
        SyntaxException e = new SyntaxException(ErrorKind.PARSE, "bad", 3);
        assertEquals("bad", e.getMessage());
        assertTrue(e.hasPosition());
        assertEquals(3, e.getPosition());
    }

    @Test
    public void testEvaluationExceptionHasNoPosition() {
        EvaluationException e = new EvaluationException(ErrorKind.DOMAIN, "no");
        assertFalse(e.hasPosition());
        assertEquals(CalculatorException.NO_POSITION, e.getPosition());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSyntaxExceptionRejectsEvaluationKind() {
        new SyntaxException(ErrorKind.ARITY, "x", 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvaluationExceptionRejectsSyntaxKind() {
        new EvaluationException(ErrorKind.LEX, "x");
    }

    @Test
    public void testMessagesFormatArguments() {
        assertEquals("Missing closing parenthesis for '(' at position 12",
                Messages.get("error_missing_rparen", 12));
        assertEquals("Empty expression", Messages.get("error_empty"));
    }
}
