/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.mcpp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private final PreprocessorFixture fixture = new PreprocessorFixture();

    private boolean eval(String expr) throws Exception {
        String out = fixture.preprocess("#if " + expr + "\nyes\n#else\nno\n#endif\n");
        if (out.equals("yes"))
            return true;
        assertEquals("no", out);
        return false;
    }

    private void assertTrueExpr(String expr) throws Exception {
        assertTrue(eval(expr), expr);
        assertEquals(0, fixture.listener.getErrors(), expr);
    }

    private void assertError(String expr, ErrorKind kind) throws Exception {
        assertFalse(eval(expr), expr);
        assertTrue(fixture.listener.hasDiagnostic(kind), expr);
        fixture.listener.clear();
    }

    @Test
    public void testArithmetic() throws Exception {
        assertTrueExpr("1 + 2 * 3 == 7");
        assertTrueExpr("(1 + 2) * 3 == 9");
        assertTrueExpr("10 / 3 == 3");
        assertTrueExpr("10 % 3 == 1");
        assertTrueExpr("-7 / 2 == -3");
        assertTrueExpr("2 - 3 < 0");
        assertFalse(eval("0"));
        assertFalse(eval("5 - 5"));
    }

    @Test
    public void testBitwise() throws Exception {
        assertTrueExpr("~0 == -1");
        assertTrueExpr("(1 << 4) == 16");
        assertTrueExpr("(256 >> 4) == 16");
        assertTrueExpr("(6 & 3) == 2");
        assertTrueExpr("(6 | 3) == 7");
        assertTrueExpr("(6 ^ 3) == 5");
        assertTrueExpr("1 | 2 == 2");
    }

    @Test
    public void testLogical() throws Exception {
        assertTrueExpr("!0");
        assertTrueExpr("!!7 == 1");
        assertTrueExpr("1 && 2");
        assertTrueExpr("0 || 3");
        assertFalse(eval("1 && 0"));
        assertTrueExpr("(2 || 0) == 1");
    }

    @Test
    public void testConditional() throws Exception {
        assertTrueExpr("(1 ? 2 : 3) == 2");
        assertTrueExpr("(0 ? 2 : 3) == 3");
        assertTrueExpr("(0 ? 1 : 0 ? 2 : 3) == 3");
        assertTrueExpr("(1 ? 0 ? 4 : 5 : 6) == 5");
    }

    @Test
    public void testLiterals() throws Exception {
        assertTrueExpr("0x1F == 31");
        assertTrueExpr("0XfF == 255");
        assertTrueExpr("017 == 15");
        assertTrueExpr("0b101 == 5");
        assertTrueExpr("10UL == 10");
        assertTrueExpr("10llu == 10");
        assertTrueExpr("1'000 == 1000");
        assertTrueExpr("0 == 0");
    }

    @Test
    public void testCharacters() throws Exception {
        assertTrueExpr("'A' == 65");
        assertTrueExpr("'\\n' == 10");
        assertTrueExpr("'\\0' == 0");
        assertTrueExpr("'\\x41' == 65");
        assertTrueExpr("'\\101' == 65");
        assertTrueExpr("'\\'' == 39");
        assertTrueExpr("'ab' == 24930");
    }

    @Test
    public void testIdentifiers() throws Exception {
        assertTrueExpr("true");
        assertFalse(eval("false"));
        assertFalse(eval("UNDEFINED_THING"));
        assertEquals(0, fixture.listener.getWarnings());
    }

    @Test
    public void testUndefWarning() throws Exception {
        fixture.pp.addWarning(Warning.UNDEF);
        assertFalse(eval("UNDEFINED_THING"));
        assertEquals(1, fixture.listener.getWarnings());
        assertEquals(0, fixture.listener.getErrors());
    }

    @Test
    public void testDefined() throws Exception {
        fixture.pp.addMacro("FOO");
        assertTrueExpr("defined FOO");
        assertTrueExpr("defined(FOO)");
        assertTrueExpr("defined ( FOO ) && !defined BAR");
        assertTrueExpr("defined __LINE__");
    }

    @Test
    public void testDefinedIsNotExpanded() throws Exception {
        fixture.pp.addMacro("FOO", "BAR");
        assertTrueExpr("defined(FOO)");
        assertFalse(eval("defined(BAR)"));
    }

    @Test
    public void testMacrosAreExpanded() throws Exception {
        fixture.pp.addMacro("VERSION", "3");
        assertTrueExpr("VERSION >= 2");
        assertTrueExpr("VERSION * 2 == 6");
    }

    @Test
    public void testFunctionLikeMacroInCondition() throws Exception {
        fixture.preprocess("#define MAX(a, b) ((a) > (b) ? (a) : (b))\n");
        assertTrueExpr("MAX(2, 7) == 7");
    }

    @Test
    public void testShortCircuit() throws Exception {
        assertFalse(eval("0 && 1 / 0"));
        assertTrueExpr("1 || 1 / 0");
        assertTrueExpr("(1 ? 2 : 1 / 0) == 2");
        assertTrueExpr("(0 ? 1 % 0 : 3) == 3");
    }

    @Test
    public void testDivisionByZero() throws Exception {
        assertError("1 / 0", ErrorKind.DIVISION_BY_ZERO);
        assertError("1 % 0", ErrorKind.DIVISION_BY_ZERO);
    }

    @Test
    public void testMalformedExpressions() throws Exception {
        assertError("1 +", ErrorKind.INVALID_EXPRESSION);
        assertError("(1", ErrorKind.INVALID_EXPRESSION);
        assertError("1 2", ErrorKind.INVALID_EXPRESSION);
        assertError("1.5", ErrorKind.INVALID_EXPRESSION);
        assertError("\"str\"", ErrorKind.INVALID_EXPRESSION);
        assertError("1 ? 2", ErrorKind.INVALID_EXPRESSION);
        assertError("defined", ErrorKind.INVALID_EXPRESSION);
        assertError("defined(FOO", ErrorKind.INVALID_EXPRESSION);
        assertError("defined 3", ErrorKind.INVALID_EXPRESSION);
    }

    private static String parenthesised(int depth) {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < depth; i++)
            buf.append('(');
        buf.append('1');
        for (int i = 0; i < depth; i++)
            buf.append(')');
        return buf.toString();
    }

    @Test
    public void testNesting() throws Exception {
        assertTrueExpr(parenthesised(200));
        assertTrueExpr("- - - - 1 == 1");
        assertError(parenthesised(5000), ErrorKind.INVALID_EXPRESSION);
        assertError("!".repeat(300) + "1", ErrorKind.INVALID_EXPRESSION);
    }

    @Test
    public void testEmptyExpression() throws Exception {
        assertError("", ErrorKind.INVALID_EXPRESSION);
        fixture.pp.addMacro("EMPTY", "");
        assertError("EMPTY", ErrorKind.INVALID_EXPRESSION);
    }

    @Test
    public void testParseNumber() throws Exception {
        assertEquals(42, ExpressionEvaluator.parseNumber(new Token(TokenKind.NUMBER, "42")));
        assertEquals(0x7f, ExpressionEvaluator.parseNumber(new Token(TokenKind.NUMBER, "0x7fU")));
        assertEquals(-1L, ExpressionEvaluator.parseNumber(new Token(TokenKind.NUMBER, "0xFFFFFFFFFFFFFFFF")));
        assertThrows(ExpressionEvaluator.ExpressionException.class,
                () -> ExpressionEvaluator.parseNumber(new Token(TokenKind.NUMBER, "1e5")));
        assertThrows(ExpressionEvaluator.ExpressionException.class,
                () -> ExpressionEvaluator.parseNumber(new Token(TokenKind.NUMBER, "09")));
    }

    @Test
    public void testParseCharacter() throws Exception {
        assertEquals('x', ExpressionEvaluator.parseCharacter(new Token(TokenKind.CHARACTER, "'x'")));
        assertEquals(9, ExpressionEvaluator.parseCharacter(new Token(TokenKind.CHARACTER, "'\\t'")));
        assertEquals(0x41, ExpressionEvaluator.parseCharacter(new Token(TokenKind.CHARACTER, "L'A'")));
    }
}
