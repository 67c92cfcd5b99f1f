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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.commons.io.FilenameUtils;
import org.pcollections.Empty;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.mcpp.TokenKind.*;

/**
 * Expands macros in a token sequence.
 *
 * Expansion is a rescan over a persistent work-list: the replacement of
 * an invocation is pushed onto the front of the unscanned input and
 * scanned again. Each token carries a hideset naming the macros it was
 * derived from, and a macro is never expanded from a token whose
 * hideset names it. A function-like macro is also not expanded when
 * the closing parenthesis of its invocation carries its name.
 *
 * Replacement-list tokens receive the hideset
 * (HS(name) &#8745; HS(rparen)) &#8746; {name}. Tokens substituted from
 * an argument keep their own hideset.
 *
 * Macros are looked up at the moment of use, so the result depends on
 * the {@link MacroTable} as it stands when {@link #expand} is called.
 */
public class Expander {

    private static final Logger LOG = LoggerFactory.getLogger(Expander.class);

    /* Thrown out of any nested invocation when a budget runs out. */
    private static final class StepLimitException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        StepLimitException() {
            super(null, null, false, false);
        }
    }

    /* The replacements allowed to one top-level invocation, including its argument expansions. */
    private static final class Budget {

        private final int max;
        private int steps;
        /* The furthest input consumed by any invocation charged here. */
        private FList<Token> reach;

        Budget(int max) {
            this.max = max;
        }

        void step() {
            if (++steps > max)
                throw new StepLimitException();
        }
    }

    private static final class Replacement {

        /* The new work-list. */
        private final FList<Token> tokens;
        /* The unscanned input following the invocation. */
        private final FList<Token> after;

        Replacement(@Nonnull FList<Token> tokens, @Nonnull FList<Token> after) {
            this.tokens = tokens;
            this.after = after;
        }
    }

    private static final class Arguments {

        private final List<List<Token>> args;
        private final Token rparen;
        /* The work-list after the closing parenthesis. */
        private final FList<Token> rest;

        Arguments(@Nonnull List<List<Token>> args, @Nonnull Token rparen, @Nonnull FList<Token> rest) {
            this.args = args;
            this.rparen = rparen;
            this.rest = rest;
        }
    }

    /* A substituted token, with whether it came from the variadic argument or a __VA_OPT__ group. */
    private static final class Piece {

        private final Token token;
        private final boolean variadic;
        private final boolean optional;

        Piece(@Nonnull Token token, boolean variadic, boolean optional) {
            this.token = token;
            this.variadic = variadic;
            this.optional = optional;
        }

        Piece(@Nonnull Token token, boolean variadic) {
            this(token, variadic, false);
        }
    }

    private final class Invocation {

        private final Macro macro;
        private final Token name;
        private final PSet<String> hideset;
        private final List<List<Token>> args;
        private final List<List<Token>> expanded;

        Invocation(@Nonnull Macro macro, @Nonnull Token name,
                @Nonnull PSet<String> hideset, @Nonnull List<List<Token>> args) {
            this.macro = macro;
            this.name = name;
            this.hideset = hideset;
            this.args = args;
            this.expanded = new ArrayList<List<Token>>(Collections.<List<Token>>nCopies(args.size(), null));
        }

        @Nonnull
        List<Token> expanded(int idx) {
            List<Token> out = expanded.get(idx);
            if (out == null)
                throw new InternalException("Argument " + idx + " of " + macro.getName() + " was not expanded");
            return out;
        }

        boolean isVariadicArgument(int idx) {
            return macro.isVariadic() && idx == args.size() - 1;
        }

        boolean isVariadicEmpty() {
            return macro.isVariadic() && args.get(args.size() - 1).isEmpty();
        }
    }

    /*
     * An invocation waiting for its arguments to be expanded.
     * At most one argument is being scanned at a time.
     */
    private static final class Call {

        private final Macro macro;
        private final Token name;
        @CheckForNull
        private final Invocation inv;
        private final FList<Token> after;
        /* Arguments still to expand, in order of first use. */
        private final Deque<Integer> pending = new ArrayDeque<Integer>();

        /* The argument being scanned, its unscanned tokens and its output. */
        private int arg = -1;
        private FList<Token> rest;
        private List<Token> out;

        Call(@Nonnull Macro macro, @Nonnull Token name,
                @CheckForNull Invocation inv, @Nonnull FList<Token> after) {
            this.macro = macro;
            this.name = name;
            this.inv = inv;
            this.after = after;
        }

        boolean isScanning() {
            return rest != null;
        }

        void start(int idx) {
            arg = idx;
            rest = FList.from(inv.args.get(idx));
            out = new ArrayList<Token>();
        }

        void complete() {
            inv.expanded.set(arg, out);
            arg = -1;
            rest = null;
            out = null;
        }
    }

    private final Preprocessor pp;

    public Expander(@Nonnull Preprocessor pp) {
        this.pp = pp;
    }

    /**
     * Returns the given tokens with all macros expanded.
     *
     * An invocation which exceeds the step limit of the
     * {@link Preprocessor} is reported, and its whole expansion is
     * replaced by a single {@link TokenKind#INVALID} token spelled as
     * the macro name. Expansion then resumes after the invocation.
     */
    @Nonnull
    public List<Token> expand(@Nonnull List<Token> input, @Nonnull MacroTable macros)
            throws PreprocessorException {
        List<Token> out = new ArrayList<Token>();
        FList<Token> rest = FList.from(input);
        while (!rest.isEmpty()) {
            Token tok = rest.cur;
            Macro m = lookup(tok, macros);
            if (m == null) {
                out.add(tok);
                rest = rest.next;
                continue;
            }

            Budget budget = new Budget(pp.getMaxExpansionSteps());
            FList<Token> end = rest.next;
            List<Token> region = new ArrayList<Token>();
            try {
                Replacement r = replace(m, tok, rest.next, macros, budget);
                if (r == null) {
                    out.add(tok);
                    rest = rest.next;
                    continue;
                }
                end = r.after;
                rest = r.tokens;
                /* A rescan may consume input beyond the invocation, which widens the region. */
                while (rest.size > end.size) {
                    Token t = rest.cur;
                    Macro mm = lookup(t, macros);
                    Replacement rr = (mm == null) ? null : replace(mm, t, rest.next, macros, budget);
                    if (rr == null) {
                        region.add(t);
                        rest = rest.next;
                        continue;
                    }
                    if (rr.after.size < end.size)
                        end = rr.after;
                    rest = rr.tokens;
                }
                out.addAll(region);
            } catch (StepLimitException e) {
                pp.error(tok, ErrorKind.MACRO_EXPANSION_DEPTH_EXCEEDED,
                        "Expansion of macro " + tok.getText() + " exceeded "
                        + pp.getMaxExpansionSteps() + " steps");
                out.add(new Token(INVALID, tok.getLine(), tok.getColumn(), tok.getText())
                        .withWhitespace(tok.hasWhitespace())
                        .withLineStart(tok.isLineStart()));
                rest = end;
                if (budget.reach != null && budget.reach.size < rest.size)
                    rest = budget.reach;
            }
        }
        return out;
    }

    @CheckForNull
    private static Macro lookup(@Nonnull Token tok, @Nonnull MacroTable macros) {
        if (tok.getKind() != IDENTIFIER)
            return null;
        Macro m = macros.getMacro(tok.getText());
        if (m == null)
            return null;
        if (tok.getHideset().contains(m.getName()))
            return null;
        return m;
    }

    /**
     * Replaces one invocation at the head of the work-list.
     *
     * The arguments of an invocation are expanded before it is
     * substituted, and may themselves hold invocations. Those are kept
     * on an explicit stack, so nesting depth is bounded by the step
     * budget and not by the Java stack.
     *
     * @return the replacement, or null if the token is not an
     *	invocation and must be copied through.
     */
    @CheckForNull
    private Replacement replace(@Nonnull Macro m, @Nonnull Token tok,
            @Nonnull FList<Token> after,
            @Nonnull MacroTable macros, @Nonnull Budget budget)
            throws PreprocessorException {
        Call call = begin(m, tok, after, macros, budget);
        if (call == null)
            return null;
        if (budget.reach == null || call.after.size < budget.reach.size)
            budget.reach = call.after;
        Deque<Call> calls = new ArrayDeque<Call>();
        calls.push(call);
        for (;;) {
            call = calls.peek();
            if (!call.isScanning()) {
                Integer idx = call.pending.poll();
                if (idx == null) {
                    Replacement r = finish(call);
                    calls.pop();
                    if (calls.isEmpty())
                        return r;
                    /* Resume the argument scan which found this invocation. */
                    calls.peek().rest = r.tokens;
                    continue;
                }
                call.start(idx);
            }

            /* An argument is scanned on its own, so nothing outside it is consumed. */
            Call nested = null;
            while (nested == null && !call.rest.isEmpty()) {
                Token t = call.rest.cur;
                Macro mm = lookup(t, macros);
                if (mm != null)
                    nested = begin(mm, t, call.rest.next, macros, budget);
                if (nested == null) {
                    call.out.add(t);
                    call.rest = call.rest.next;
                }
            }
            if (nested != null)
                calls.push(nested);
            else
                call.complete();
        }
    }

    /**
     * Recognises an invocation and charges it to the budget.
     *
     * @return the pending invocation, or null if the token is not an
     *	invocation.
     */
    @CheckForNull
    private Call begin(@Nonnull Macro m, @Nonnull Token tok,
            @Nonnull FList<Token> after,
            @Nonnull MacroTable macros, @Nonnull Budget budget)
            throws PreprocessorException {
        if (m.isFunctionLike()) {
            if (after.isEmpty() || !after.cur.isPunctuator("("))
                return null;
            Arguments a = collectArguments(m, tok, after.next);
            if (a == null)
                return null;
            if (a.rparen.getHideset().contains(m.getName()))
                return null;
            if (!checkArity(m, tok, a.args))
                return null;
            budget.step();
            PSet<String> hideset = intersect(tok.getHideset(), a.rparen.getHideset()).plus(m.getName());
            Invocation inv = new Invocation(m, tok, hideset, a.args);
            Call call = new Call(m, tok, inv, a.rest);
            unpasted(m.getBody(), inv, call.pending);
            return call;
        }
        budget.step();
        if (MacroTable.isBuiltin(m))
            return new Call(m, tok, null, after);
        PSet<String> hideset = tok.getHideset().plus(m.getName());
        return new Call(m, tok, new Invocation(m, tok, hideset,
                Collections.<List<Token>>emptyList()), after);
    }

    /*
     * Lists the arguments substituted without pasting, in order of
     * first use. These are the arguments which are macro-expanded.
     */
    @SuppressWarnings("unchecked")
    private static void unpasted(@Nonnull List<Token> body, @Nonnull Invocation inv,
            @Nonnull Collection<Integer> out) {
        boolean paste = false;
        for (int i = 0; i < body.size(); i++) {
            Token t = body.get(i);
            switch (t.getKind()) {
                case M_PASTE:
                    paste = true;
                    continue;
                case M_ARG: {
                    Integer idx = (Integer) t.getValue();
                    boolean raw = paste
                            || (i + 1 < body.size() && body.get(i + 1).getKind() == M_PASTE);
                    if (!raw && !out.contains(idx))
                        out.add(idx);
                    break;
                }
                case M_VA_OPT:
                    if (!inv.isVariadicEmpty())
                        unpasted((List<Token>) t.getValue(), inv, out);
                    break;
                default:
                    break;
            }
            paste = false;
        }
    }

    /* Substitutes an invocation whose arguments are all expanded. */
    @Nonnull
    private Replacement finish(@Nonnull Call call)
            throws PreprocessorException {
        Token tok = call.name;
        FList<Token> after = call.after;
        List<Token> expansion;
        if (call.inv == null) {
            expansion = new ArrayList<Token>();
            expansion.add(builtin(call.macro, tok));
        } else {
            expansion = substitute(call.inv);
        }

        if (pp.getFeature(Feature.DEBUG))
            LOG.debug("Expanded {} to {}", tok, expansion);

        if (expansion.isEmpty()) {
            if (tok.isLineStart() && !after.isEmpty())
                after = after.withHead(after.cur.withLineStart(true));
            return new Replacement(after, after);
        }
        expansion.set(0, expansion.get(0)
                .withWhitespace(tok.hasWhitespace())
                .withLineStart(tok.isLineStart()));
        return new Replacement(FList.concat(expansion, after), after);
    }

    /**
     * Collects the arguments of an invocation, starting after its
     * opening parenthesis.
     */
    @CheckForNull
    private Arguments collectArguments(@Nonnull Macro m, @Nonnull Token tok,
            @Nonnull FList<Token> rest)
            throws PreprocessorException {
        int n = m.getParameterCount();
        List<List<Token>> args = new ArrayList<List<Token>>();
        List<Token> arg = new ArrayList<Token>();
        int depth = 0;
        for (;;) {
            if (rest.isEmpty()) {
                pp.error(tok, ErrorKind.UNTERMINATED_ARGUMENTS,
                        "Unterminated argument list invoking macro " + m.getName());
                return null;
            }
            Token t = rest.cur;
            rest = rest.next;
            /* An invocation may span lines. */
            if (t.isLineStart())
                t = t.withLineStart(false).withWhitespace(true);
            if (t.isPunctuator("(")) {
                depth++;
            } else if (t.isPunctuator(")")) {
                if (depth == 0) {
                    args.add(arg);
                    return new Arguments(args, t, rest);
                }
                depth--;
            } else if (depth == 0 && t.isPunctuator(",")
                    && !(m.isVariadic() && args.size() == n - 1)) {
                args.add(arg);
                arg = new ArrayList<Token>();
                continue;
            }
            arg.add(t);
        }
    }

    private boolean checkArity(@Nonnull Macro m, @Nonnull Token tok, @Nonnull List<List<Token>> args)
            throws PreprocessorException {
        int n = m.getParameterCount();
        if (n == 0 && args.size() == 1 && args.get(0).isEmpty())
            args.clear();
        else if (m.isVariadic() && args.size() == n - 1)
            args.add(new ArrayList<Token>());
        if (args.size() == n)
            return true;
        pp.error(tok, ErrorKind.ARITY_MISMATCH,
                "Macro " + m.getName() + " takes " + n
                + (m.isVariadic() ? " or more" : "")
                + " arguments, but " + args.size() + " were given");
        return false;
    }

    @Nonnull
    private List<Token> substitute(@Nonnull Invocation inv)
            throws PreprocessorException {
        List<Token> out = new ArrayList<Token>();
        for (Piece p : substitute(inv.macro.getBody(), inv))
            if (p.token.getKind() != PLACEMARKER)
                out.add(p.token);
        return out;
    }

    /**
     * Substitutes and pastes one replacement list, or one __VA_OPT__
     * group. Placemarkers are kept so the enclosing list can paste.
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    private List<Piece> substitute(@Nonnull List<Token> body, @Nonnull Invocation inv)
            throws PreprocessorException {
        List<Piece> out = new ArrayList<Piece>();
        boolean paste = false;
        for (int i = 0; i < body.size(); i++) {
            Token t = body.get(i);
            List<Piece> operand = new ArrayList<Piece>();
            switch (t.getKind()) {
                case M_PASTE:
                    paste = true;
                    continue;
                case M_ARG: {
                    int idx = (Integer) t.getValue();
                    boolean variadic = inv.isVariadicArgument(idx);
                    boolean raw = paste
                            || (i + 1 < body.size() && body.get(i + 1).getKind() == M_PASTE);
                    List<Token> arg = raw ? inv.args.get(idx) : inv.expanded(idx);
                    if (arg.isEmpty()) {
                        operand.add(new Piece(Token.PLACEMARKER, variadic));
                        break;
                    }
                    for (Token a : arg)
                        operand.add(new Piece(a, variadic));
                    /* The right operand of ## keeps its own spacing. */
                    if (!paste)
                        operand.set(0, new Piece(arg.get(0).withWhitespace(t.hasWhitespace()), variadic));
                    break;
                }
                case M_VA_OPT:
                    if (!inv.isVariadicEmpty())
                        for (Piece p : substitute((List<Token>) t.getValue(), inv))
                            operand.add(new Piece(p.token, p.variadic, true));
                    if (operand.isEmpty())
                        operand.add(new Piece(Token.PLACEMARKER, false));
                    break;
                default:
                    operand.add(new Piece(t
                            .withHideset(inv.hideset)
                            .withPosition(inv.name.getLine(), inv.name.getColumn()), false));
                    break;
            }
            if (paste) {
                paste(out, operand, inv);
                paste = false;
            } else {
                out.addAll(operand);
            }
        }
        return out;
    }

    /* Pastes the last piece of out to the first piece of the operand. */
    private void paste(@Nonnull List<Piece> out, @Nonnull List<Piece> operand, @Nonnull Invocation inv)
            throws PreprocessorException {
        if (out.isEmpty())
            throw new InternalException("No left operand for ## in " + inv.macro);
        Piece left = out.remove(out.size() - 1);
        Piece right = operand.get(0);
        Token l = left.token;
        Token r = right.token;

        if (right.variadic && l.isPunctuator(",")
                && (left.optional || pp.getFeature(Feature.GNU_COMMA_PASTE))) {
            /*
             * A separating comma is kept beside the variable arguments.
             * GNU: the comma vanishes with an empty variable argument list.
             */
            if (r.getKind() != PLACEMARKER)
                out.add(left);
            out.add(right);
        } else if (l.getKind() == PLACEMARKER) {
            out.add(right);
        } else if (r.getKind() == PLACEMARKER) {
            out.add(left);
        } else {
            Token pasted = LexerSource.lexSingle(l.getText() + r.getText());
            if (pasted == null) {
                pp.warning(inv.name, ErrorKind.INVALID_PASTE_RESULT,
                        "Pasting \"" + l.getText() + "\" and \"" + r.getText()
                        + "\" does not give a valid preprocessing token");
                out.add(left);
                out.add(right);
            } else {
                Token tok = new Token(pasted.getKind(),
                        inv.name.getLine(), inv.name.getColumn(), pasted.getText())
                        .withWhitespace(l.hasWhitespace())
                        .withHideset(inv.hideset);
                out.add(new Piece(tok, false));
            }
        }
        out.addAll(operand.subList(1, operand.size()));
    }

    @Nonnull
    private Token builtin(@Nonnull Macro m, @Nonnull Token tok) {
        TokenKind kind;
        String text;
        if (m == MacroTable.__LINE__) {
            kind = NUMBER;
            text = Integer.toString(tok.getLine());
        } else if (m == MacroTable.__FILE__) {
            kind = STRING;
            text = quote(pp.getSourceName());
        } else if (m == MacroTable.__FILENAME__) {
            kind = STRING;
            text = quote(FilenameUtils.getName(pp.getSourceName()));
        } else if (m == MacroTable.__COUNTER__) {
            kind = NUMBER;
            text = Integer.toString(pp.nextCounter());
        } else if (m == MacroTable.__DATE__) {
            kind = STRING;
            text = quote(pp.getDate());
        } else if (m == MacroTable.__TIME__) {
            kind = STRING;
            text = quote(pp.getTime());
        } else {
            throw new InternalException("Not a built-in macro: " + m);
        }
        return new Token(kind, tok.getLine(), tok.getColumn(), text)
                .withHideset(tok.getHideset().plus(m.getName()));
    }

    @Nonnull
    private static String quote(@Nonnull String text) {
        StringBuilder buf = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == '"')
                buf.append('\\');
            buf.append(c);
        }
        return buf.append('"').toString();
    }

    @Nonnull
    private static PSet<String> intersect(@Nonnull PSet<String> a, @Nonnull PSet<String> b) {
        PSet<String> out = Empty.<String>set();
        for (String s : a)
            if (b.contains(s))
                out = out.plus(s);
        return out;
    }
}
