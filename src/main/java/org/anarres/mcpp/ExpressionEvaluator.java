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
import java.util.Locale;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.mcpp.TokenKind.*;

/**
 * Evaluates the controlling expression of an #if or #elif.
 *
 * The operator <code>defined</code> is resolved against the
 * {@link MacroTable} before anything else is expanded. The remaining
 * tokens are macro-expanded, and the result is evaluated as an
 * integer constant expression in <code>long</code> arithmetic.
 * Identifiers left after expansion evaluate to 0, except
 * <code>true</code>, which evaluates to 1.
 */
public class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

    /* Carries a diagnostic out of the parse; the expression is then false. */
    /* pp */ static final class ExpressionException extends Exception {

        private static final long serialVersionUID = 1L;

        private final Token token;
        private final ErrorKind kind;

        ExpressionException(@Nonnull Token token, @Nonnull ErrorKind kind, @Nonnull String msg) {
            super(msg);
            this.token = token;
            this.kind = kind;
        }
    }

    private final Preprocessor pp;
    private final Expander expander;

    /* Nesting limit for parentheses, unary operators and conditionals. */
    /* pp */ static final int MAX_DEPTH = 256;

    /* Parser state. */
    private List<Token> tokens;
    private int idx;
    private Token end;
    private int depth;

    public ExpressionEvaluator(@Nonnull Preprocessor pp, @Nonnull Expander expander) {
        this.pp = pp;
        this.expander = expander;
    }

    /**
     * Evaluates an expression.
     *
     * A malformed expression, or one which divides by zero, is
     * reported and evaluates to false.
     *
     * @param directive the directive name token, for positions.
     * @param expr the tokens following the directive name.
     */
    public boolean evaluate(@Nonnull Token directive, @Nonnull List<Token> expr,
            @Nonnull MacroTable macros)
            throws PreprocessorException {
        try {
            List<Token> expanded = expander.expand(resolveDefined(expr, macros), macros);
            long value = value(directive, expanded);
            if (pp.getFeature(Feature.DEBUG))
                LOG.debug("Expression {} evaluated to {}", expanded, value);
            return value != 0;
        } catch (ExpressionException e) {
            pp.error(e.token, e.kind, e.getMessage());
            return false;
        }
    }

    /* Replaces 'defined NAME' and 'defined ( NAME )' by 1 or 0. */
    @Nonnull
    private List<Token> resolveDefined(@Nonnull List<Token> expr, @Nonnull MacroTable macros)
            throws ExpressionException {
        List<Token> out = new ArrayList<Token>(expr.size());
        for (int i = 0; i < expr.size(); i++) {
            Token tok = expr.get(i);
            if (!tok.isIdentifier("defined")) {
                out.add(tok);
                continue;
            }
            boolean paren = false;
            Token la = (++i < expr.size()) ? expr.get(i) : null;
            if (la != null && la.isPunctuator("(")) {
                paren = true;
                la = (++i < expr.size()) ? expr.get(i) : null;
            }
            if (la == null || la.getKind() != IDENTIFIER)
                throw new ExpressionException(la == null ? tok : la, ErrorKind.INVALID_EXPRESSION,
                        "defined() needs identifier, not " + (la == null ? "end of line" : la.getText()));
            if (paren) {
                Token rparen = (++i < expr.size()) ? expr.get(i) : null;
                if (rparen == null || !rparen.isPunctuator(")"))
                    throw new ExpressionException(rparen == null ? la : rparen, ErrorKind.INVALID_EXPRESSION,
                            "Missing ) in defined()");
            }
            String value = macros.isDefined(la.getText()) ? "1" : "0";
            out.add(new Token(NUMBER, tok.getLine(), tok.getColumn(), value)
                    .withWhitespace(tok.hasWhitespace()));
        }
        return out;
    }

    /* Evaluates an expanded expression. */
    private long value(@Nonnull Token directive, @Nonnull List<Token> expr)
            throws ExpressionException, PreprocessorException {
        this.tokens = expr;
        this.idx = 0;
        this.end = new Token(EOF, directive.getLine(), directive.getColumn(), "");
        this.depth = 0;
        if (expr.isEmpty())
            throw new ExpressionException(directive, ErrorKind.INVALID_EXPRESSION,
                    "#" + directive.getText() + " with no expression");
        long value = expr(0, true);
        Token tok = token();
        if (tok.getKind() != EOF)
            throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                    "Trailing tokens in expression: " + tok.getText());
        return value;
    }

    @Nonnull
    private Token token() {
        if (idx < tokens.size())
            return tokens.get(idx++);
        idx++;
        return end;
    }

    private void untoken() {
        idx--;
    }

    private static int priority(@Nonnull Token op) {
        if (op.getKind() != PUNCTUATOR)
            return 0;
        switch (op.getText()) {
            case "/":
            case "%":
            case "*":
                return 11;
            case "+":
            case "-":
                return 10;
            case "<<":
            case ">>":
                return 9;
            case "<":
            case ">":
            case "<=":
            case ">=":
                return 8;
            case "==":
            case "!=":
                return 7;
            case "&":
                return 6;
            case "^":
                return 5;
            case "|":
                return 4;
            case "&&":
                return 3;
            case "||":
                return 2;
            case "?":
                return 1;
            default:
                return 0;
        }
    }

    /*
     * Parses operators binding tighter than the given priority.
     * Nothing is reported from an operand which is not live.
     */
    private long expr(int priority, boolean live)
            throws ExpressionException, PreprocessorException {
        if (depth >= MAX_DEPTH)
            throw new ExpressionException(tokens.get(Math.min(idx, tokens.size() - 1)),
                    ErrorKind.INVALID_EXPRESSION,
                    "Expression nested more than " + MAX_DEPTH + " deep");
        depth++;
        try {
            return expr0(priority, live);
        } finally {
            depth--;
        }
    }

    private long expr0(int priority, boolean live)
            throws ExpressionException, PreprocessorException {
        Token tok = token();
        long lhs;

        switch (tok.getKind()) {
            case PUNCTUATOR:
                switch (tok.getText()) {
                    case "(":
                        lhs = expr(0, live);
                        tok = token();
                        if (!tok.isPunctuator(")"))
                            throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                                    "Missing ) in expression. Got " + describe(tok));
                        break;
                    case "~":
                        lhs = ~expr(11, live);
                        break;
                    case "!":
                        lhs = expr(11, live) == 0 ? 1 : 0;
                        break;
                    case "-":
                        lhs = -expr(11, live);
                        break;
                    case "+":
                        lhs = expr(11, live);
                        break;
                    default:
                        throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                                "Bad token in expression: " + tok.getText());
                }
                break;
            case NUMBER:
                lhs = parseNumber(tok);
                break;
            case CHARACTER:
                lhs = parseCharacter(tok);
                break;
            case IDENTIFIER:
                if (tok.getText().equals("true")) {
                    lhs = 1;
                } else {
                    if (live && !tok.getText().equals("false") && pp.getWarning(Warning.UNDEF))
                        pp.warning(tok, ErrorKind.INVALID_EXPRESSION,
                                "Undefined token '" + tok.getText() + "' encountered in conditional.");
                    lhs = 0;
                }
                break;
            case EOF:
                throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                        "Missing operand in expression");
            default:
                throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                        "Bad token in expression: " + tok.getText());
        }

        for (;;) {
            Token op = token();
            int pri = priority(op);	/* 0 if not a binop. */
            if (pri == 0 || priority >= pri) {
                untoken();
                return lhs;
            }

            if (op.isPunctuator("?")) {
                long trueResult = expr(0, live && lhs != 0);
                tok = token();
                if (!tok.isPunctuator(":"))
                    throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                            "Missing : in conditional expression. Got " + describe(tok));
                long falseResult = expr(0, live && lhs == 0);
                lhs = (lhs != 0) ? trueResult : falseResult;
                continue;
            }

            boolean rhsLive = live;
            if (op.isPunctuator("&&"))
                rhsLive = live && lhs != 0;
            else if (op.isPunctuator("||"))
                rhsLive = live && lhs == 0;
            long rhs = expr(pri, rhsLive);

            switch (op.getText()) {
                case "/":
                    if (rhs == 0) {
                        if (live)
                            throw new ExpressionException(op, ErrorKind.DIVISION_BY_ZERO, "Division by zero");
                        lhs = 0;
                    } else {
                        lhs = lhs / rhs;
                    }
                    break;
                case "%":
                    if (rhs == 0) {
                        if (live)
                            throw new ExpressionException(op, ErrorKind.DIVISION_BY_ZERO, "Modulus by zero");
                        lhs = 0;
                    } else {
                        lhs = lhs % rhs;
                    }
                    break;
                case "*":
                    lhs = lhs * rhs;
                    break;
                case "+":
                    lhs = lhs + rhs;
                    break;
                case "-":
                    lhs = lhs - rhs;
                    break;
                case "<<":
                    lhs = lhs << rhs;
                    break;
                case ">>":
                    lhs = lhs >> rhs;
                    break;
                case "<":
                    lhs = lhs < rhs ? 1 : 0;
                    break;
                case ">":
                    lhs = lhs > rhs ? 1 : 0;
                    break;
                case "<=":
                    lhs = lhs <= rhs ? 1 : 0;
                    break;
                case ">=":
                    lhs = lhs >= rhs ? 1 : 0;
                    break;
                case "==":
                    lhs = lhs == rhs ? 1 : 0;
                    break;
                case "!=":
                    lhs = lhs != rhs ? 1 : 0;
                    break;
                case "&":
                    lhs = lhs & rhs;
                    break;
                case "^":
                    lhs = lhs ^ rhs;
                    break;
                case "|":
                    lhs = lhs | rhs;
                    break;
                case "&&":
                    lhs = (lhs != 0) && (rhs != 0) ? 1 : 0;
                    break;
                case "||":
                    lhs = (lhs != 0) || (rhs != 0) ? 1 : 0;
                    break;
                default:
                    throw new InternalException("Unexpected operator " + op.getText());
            }
        }
    }

    @Nonnull
    private static String describe(@Nonnull Token tok) {
        return tok.getKind() == EOF ? "end of line" : tok.getText();
    }

    /**
     * Parses an integer constant: decimal, octal, hexadecimal or binary,
     * with any combination of u and l suffixes.
     */
    /* pp */ static long parseNumber(@Nonnull Token tok)
            throws ExpressionException {
        String text = tok.getText().replace("'", "").toLowerCase(Locale.ROOT);
        int len = text.length();
        while (len > 0 && (text.charAt(len - 1) == 'u' || text.charAt(len - 1) == 'l'))
            len--;
        text = text.substring(0, len);

        int radix = 10;
        if (text.startsWith("0x")) {
            radix = 16;
            text = text.substring(2);
        } else if (text.startsWith("0b")) {
            radix = 2;
            text = text.substring(2);
        } else if (text.length() > 1 && text.startsWith("0")) {
            radix = 8;
            text = text.substring(1);
        }
        if (text.indexOf('.') >= 0 || (radix != 16 && text.indexOf('e') >= 0) || text.indexOf('p') >= 0)
            throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                    "Floating point constant in expression: " + tok.getText());
        try {
            return Long.parseUnsignedLong(text, radix);
        } catch (NumberFormatException e) {
            throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                    "Invalid integer constant in expression: " + tok.getText());
        }
    }

    /**
     * Parses a character constant. A multi-character constant packs
     * its characters eight bits apiece, as GCC does.
     */
    /* pp */ static long parseCharacter(@Nonnull Token tok)
            throws ExpressionException {
        String text = tok.getText();
        int start = text.indexOf('\'');
        boolean plain = start == 0;
        if (start < 0 || text.length() < start + 3 || text.charAt(text.length() - 1) != '\'')
            throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                    "Invalid character constant: " + text);
        String body = text.substring(start + 1, text.length() - 1);

        List<Long> chars = new ArrayList<Long>();
        for (int i = 0; i < body.length();) {
            char c = body.charAt(i++);
            if (c != '\\') {
                chars.add((long) c);
                continue;
            }
            if (i >= body.length())
                throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                        "Invalid escape in character constant: " + text);
            char e = body.charAt(i++);
            switch (e) {
                case 'a':
                    chars.add(7L);
                    break;
                case 'b':
                    chars.add(8L);
                    break;
                case 'f':
                    chars.add(12L);
                    break;
                case 'n':
                    chars.add(10L);
                    break;
                case 'r':
                    chars.add(13L);
                    break;
                case 't':
                    chars.add(9L);
                    break;
                case 'v':
                    chars.add(11L);
                    break;
                case 'x': {
                    int j = i;
                    while (j < body.length() && Character.digit(body.charAt(j), 16) >= 0)
                        j++;
                    if (j == i)
                        throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                                "\\x used with no following hex digits: " + text);
                    chars.add(Long.parseUnsignedLong(body.substring(i, Math.min(j, i + 16)), 16));
                    i = j;
                    break;
                }
                default:
                    if (e >= '0' && e <= '7') {
                        int j = i - 1;
                        int k = j;
                        while (k < body.length() && k < j + 3 && body.charAt(k) >= '0' && body.charAt(k) <= '7')
                            k++;
                        chars.add(Long.parseLong(body.substring(j, k), 8));
                        i = k;
                    } else {
                        /* \\ \' \" \? and anything unknown stand for themselves. */
                        chars.add((long) e);
                    }
                    break;
            }
        }
        if (chars.isEmpty())
            throw new ExpressionException(tok, ErrorKind.INVALID_EXPRESSION,
                    "Empty character constant");

        if (!plain)
            return chars.get(chars.size() - 1);
        if (chars.size() == 1)
            return chars.get(0) < 256 ? (long) (byte) (long) chars.get(0) : chars.get(0);
        long value = 0;
        for (long c : chars)
            value = (value << 8) | (c & 0xFF);
        return value;
    }
}
