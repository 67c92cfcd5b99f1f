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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.anarres.mcpp.PreprocessorFixture.lex;
import static org.junit.jupiter.api.Assertions.*;

public class ExpanderTest {

    private final PreprocessorFixture fixture = new PreprocessorFixture();

    private String preprocess(String text) throws Exception {
        return fixture.preprocess(text);
    }

    @Test
    public void testNoMacrosIsIdentity() throws Exception {
        List<Token> input = lex("int main ( void ) { return 0 ; }");
        List<Token> output = new Expander(fixture.pp).expand(input, fixture.pp.getMacroTable());
        assertEquals(input, output);
    }

    @Test
    public void testObjectLike() throws Exception {
        assertEquals("42", preprocess("#define FOO 42\nFOO\n"));
    }

    @Test
    public void testEmptyObjectLike() throws Exception {
        assertEquals(" X", preprocess("#define EMPTY\nEMPTY X\n"));
    }

    @Test
    public void testPaste() throws Exception {
        List<Token> tokens = fixture.tokens("#define GLUE(a,b) a##b\nGLUE(12,34)\n");
        assertEquals(1, tokens.size());
        assertEquals(TokenKind.NUMBER, tokens.get(0).getKind());
        assertEquals("1234", tokens.get(0).getText());
    }

    @Test
    public void testObjectLikePaste() throws Exception {
        assertEquals("ab", preprocess("#define CAT a ## b\nCAT\n"));
    }

    @Test
    public void testChainedPaste() throws Exception {
        assertEquals("abc", preprocess("#define CAT3(x, y, z) x ## y ## z\nCAT3(a, b, c)\n"));
    }

    @Test
    public void testStringsAreNotMerged() throws Exception {
        List<Token> tokens = fixture.tokens("#define HELLO \"Hello\" \" \" \"World\"\nHELLO\n");
        assertEquals(3, tokens.size());
        for (Token tok : tokens)
            assertEquals(TokenKind.STRING, tok.getKind());
        assertEquals("\"Hello\"", tokens.get(0).getText());
        assertEquals("\" \"", tokens.get(1).getText());
        assertEquals("\"World\"", tokens.get(2).getText());
    }

    @Test
    public void testSelfApplicationTerminates() throws Exception {
        assertEquals("42", preprocess("#define A(x) x\n#define B(x) A(x)\nB(B)(42)\n"));
    }

    @Test
    public void testRecursionIsBlocked() throws Exception {
        assertEquals("x LOOP", preprocess("#define LOOP x LOOP\nLOOP\n"));
        assertEquals("f(f)", preprocess("#define f(x) x(x)\nf(f)\n"));
    }

    @Test
    public void testIndirectRecursion() throws Exception {
        assertEquals("2*9*g", preprocess("#define f(a) a*g\n#define g(a) f(a)\nf(2)(9)\n"));
    }

    @Test
    public void testMutualRecursionTerminates() throws Exception {
        assertEquals("a b a", preprocess("#define a b a\n#define b a b\na\n"));
    }

    @Test
    public void testPointOfUseLookup() throws Exception {
        assertEquals("1\n2", preprocess("#define x 1\n#define f(a) a\nf(x)\n#define x 2\nf(x)\n"));
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.REDEFINITION_CONFLICT));
    }

    @Test
    public void testDeferredSelfReference() throws Exception {
        assertEquals("~, 1()", preprocess("#define EMPTY\n#define CALL(f) f(EMPTY)\n#define PAIR ~, 1\nCALL(PAIR)\n"));
        assertEquals(0, fixture.listener.getErrors());
    }

    @Test
    public void testVariadicForwarding() throws Exception {
        assertEquals("fprintf(stderr, \"%d %d\", a, (b, c))",
                preprocess("#define DEBUG(fmt, ...) fprintf(stderr, fmt, __VA_ARGS__)\nDEBUG(\"%d %d\", a, (b, c))\n"));
    }

    @Test
    public void testVariadicOnly() throws Exception {
        assertEquals("[]\n[1, 2]", preprocess("#define V(...) [__VA_ARGS__]\nV()\nV(1, 2)\n"));
    }

    @Test
    public void testVaOptWithPaste() throws Exception {
        String text = "#define INFO(x, ...) printf(x __VA_OPT__(, ) ##__VA_ARGS__)\n"
                + "INFO(\"hello\")\n"
                + "INFO(\"hello %d\", 42)\n";
        assertEquals("printf(\"hello\")\nprintf(\"hello %d\", 42)", preprocess(text));
        assertEquals(0, fixture.listener.getErrors());
        assertEquals(0, fixture.listener.getWarnings());
    }

    @Test
    public void testVaOptCommaWithoutListener() throws Exception {
        Preprocessor pp = new Preprocessor();
        pp.addInput(new StringLexerSource(
                "#define INFO(x, ...) printf(x __VA_OPT__(, ) ##__VA_ARGS__)\nINFO(\"%d\", 42)\n"));
        List<Token> tokens = new ArrayList<Token>();
        for (Token tok = pp.token(); tok.getKind() != TokenKind.EOF; tok = pp.token())
            tokens.add(tok);
        assertEquals("printf(\"%d\", 42)", TokenPrinter.toString(tokens));
    }

    @Test
    public void testVaOpt() throws Exception {
        assertEquals("f(1)\nf(1, 2)", preprocess("#define F(a, ...) f(a __VA_OPT__(,) __VA_ARGS__)\nF(1)\nF(1, 2)\n"));
    }

    @Test
    public void testGnuCommaPaste() throws Exception {
        fixture.pp.addFeature(Feature.GNU_COMMA_PASTE);
        assertEquals("f(a)\nf(a, b)", preprocess("#define E(fmt, ...) f(fmt, ## __VA_ARGS__)\nE(a)\nE(a, b)\n"));
        assertEquals(0, fixture.listener.getWarnings());
    }

    @Test
    public void testCommaPasteWithoutGnu() throws Exception {
        assertEquals("f(a,)", preprocess("#define E(fmt, ...) f(fmt, ## __VA_ARGS__)\nE(a)\n"));
    }

    @Test
    public void testEmptyArgumentsArePlacemarkers() throws Exception {
        assertEquals("x y", preprocess("#define P(a, b) x a ## b y\nP(,)\n"));
        assertEquals("[]", preprocess("#define Q(a) [a]\nQ()\n"));
    }

    @Test
    public void testInvalidPasteKeepsBothTokens() throws Exception {
        List<Token> tokens = fixture.tokens("#define P(a, b) a ## b\nP(+,/)\n");
        assertEquals(2, tokens.size());
        assertEquals("+/", TokenPrinter.toString(tokens));
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.INVALID_PASTE_RESULT));
    }

    @Test
    public void testPastedArgumentIsNotExpanded() throws Exception {
        assertEquals("FOO_ 1", preprocess("#define FOO 1\n#define P(a) a ## _ a\nP(FOO)\n"));
    }

    @Test
    public void testPasteResultIsRescanned() throws Exception {
        assertEquals("42", preprocess("#define AB 42\n#define P(a, b) a ## b\nP(A, B)\n"));
    }

    @Test
    public void testFunctionLikeWithoutArguments() throws Exception {
        assertEquals("f + 1", preprocess("#define f(x) x\nf + 1\n"));
        assertEquals("z", preprocess("#define Z() z\nZ()\n"));
    }

    @Test
    public void testNestedParenthesesInArguments() throws Exception {
        assertEquals("(a, b) + c", preprocess("#define ADD(x, y) x + y\nADD((a, b), c)\n"));
    }

    @Test
    public void testArityMismatch() throws Exception {
        assertEquals("f(1)", preprocess("#define f(a, b) a + b\nf(1)\n"));
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.ARITY_MISMATCH));
    }

    @Test
    public void testArityMismatchOnZeroParameters() throws Exception {
        assertEquals("Z(1)", preprocess("#define Z() z\nZ(1)\n"));
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.ARITY_MISMATCH));
    }

    @Test
    public void testUnterminatedArguments() throws Exception {
        assertEquals("f(1", preprocess("#define f(a) a\nf(1\n"));
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.UNTERMINATED_ARGUMENTS));
    }

    @Test
    public void testInvocationAcrossLines() throws Exception {
        assertEquals("1 + 2\nnext", preprocess("#define f(a, b) a + b\nf(1,\n2)\nnext\n"));
    }

    @Test
    public void testExpansionStepLimit() throws Exception {
        fixture.pp.setMaxExpansionSteps(3);
        List<Token> tokens = fixture.tokens("#define A B B\n#define B C C\n#define C x\nbefore A after\n");
        assertEquals("before A after", TokenPrinter.toString(tokens));
        assertEquals(TokenKind.INVALID, tokens.get(1).getKind());
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.MACRO_EXPANSION_DEPTH_EXCEEDED));
    }

    @Test
    public void testStepLimitIsPerInvocation() throws Exception {
        fixture.pp.setMaxExpansionSteps(3);
        assertEquals("x x x x x x", preprocess("#define B C C\n#define C x\nB B B\n"));
        assertEquals(0, fixture.listener.getErrors());
    }

    private static String nested(int depth) {
        StringBuilder buf = new StringBuilder("#define f(x) x\n");
        for (int i = 0; i < depth; i++)
            buf.append("f(");
        buf.append('1');
        for (int i = 0; i < depth; i++)
            buf.append(')');
        return buf.append('\n').toString();
    }

    @Test
    public void testDeeplyNestedArguments() throws Exception {
        assertEquals("1", preprocess(nested(3000)));
        assertEquals(0, fixture.listener.getErrors());
    }

    @Test
    public void testDeeplyNestedArgumentsExceedStepLimit() throws Exception {
        fixture.pp.setMaxExpansionSteps(1000);
        List<Token> tokens = fixture.tokens(nested(3000) + "after\n");
        assertEquals(2, tokens.size());
        assertEquals(TokenKind.INVALID, tokens.get(0).getKind());
        assertEquals("f", tokens.get(0).getText());
        assertEquals("after", tokens.get(1).getText());
        assertTrue(fixture.listener.hasDiagnostic(ErrorKind.MACRO_EXPANSION_DEPTH_EXCEEDED));
    }

    @Test
    public void testHidesets() throws Exception {
        MacroTable macros = new MacroTable();
        macros.define(new Macro("FOO", lex("BAR")));
        macros.define(new Macro("BAR", lex("FOO")));
        List<Token> output = new Expander(fixture.pp).expand(lex("FOO"), macros);
        assertEquals(1, output.size());
        Token tok = output.get(0);
        assertEquals("FOO", tok.getText());
        assertTrue(tok.getHideset().contains("FOO"));
        assertTrue(tok.getHideset().contains("BAR"));
    }

    @Test
    public void testArgumentsAreExpandedOnce() throws Exception {
        assertEquals("0 0", preprocess("#define TWICE(x) x x\nTWICE(__COUNTER__)\n"));
    }
}
