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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.Stack;
import java.util.TreeMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.mcpp.PreprocessorCommand.*;
import static org.anarres.mcpp.TokenKind.*;

/**
 * A C Preprocessor.
 *
 * The Preprocessor reads its inputs line by line. Directive lines
 * update the {@link MacroTable} or the conditional stack and are not
 * themselves emitted. Runs of visible text lines are handed to the
 * {@link Expander}, whose output forms the token stream returned by
 * {@link #token()}.
 *
 * The output may be reconstructed as text with a {@link TokenPrinter}.
 * File inclusion is not performed: #include and similar directives are
 * passed through to the output.
 */
public class Preprocessor implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    public static final int DEFAULT_MAX_EXPANSION_STEPS = 4096;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMM ppd yyyy", Locale.US);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.US);

    private final List<Source> inputs;

    /* The fundamental engine. */
    private final MacroTable macros;
    private final Stack<ConditionalFrame> states;
    private final Expander expander;
    private final ExpressionEvaluator evaluator;
    private Source source;
    private boolean sourceStart;
    private Token pushback;
    private final Deque<Token> output;

    /* Miscellaneous support. */
    private int counter;
    private final String date;
    private final String time;
    private int maxExpansionSteps;
    private final Set<Feature> features;
    private final Set<Warning> warnings;
    private PreprocessorListener listener;

    /**
     * Constructs a Preprocessor over the given macro table.
     *
     * The table is used directly, so definitions made while
     * preprocessing are visible in it afterwards.
     */
    public Preprocessor(@Nonnull MacroTable macros) {
        this.inputs = new ArrayList<Source>();
        this.macros = macros;
        this.states = new Stack<ConditionalFrame>();
        this.expander = new Expander(this);
        this.evaluator = new ExpressionEvaluator(this, expander);
        this.source = null;
        this.pushback = null;
        this.output = new ArrayDeque<Token>();

        this.counter = 0;
        LocalDateTime now = LocalDateTime.now();
        this.date = DATE_FORMAT.format(now);
        this.time = TIME_FORMAT.format(now);
        this.maxExpansionSteps = DEFAULT_MAX_EXPANSION_STEPS;
        this.features = EnumSet.noneOf(Feature.class);
        this.warnings = EnumSet.noneOf(Warning.class);
        this.listener = null;
    }

    /**
     * Constructs a Preprocessor whose table holds the built-in macros.
     */
    public Preprocessor() {
        this(MacroTable.withBuiltins());
    }

    public Preprocessor(@Nonnull Source initial) {
        this();
        addInput(initial);
    }

    /** Equivalent to
     * 'new Preprocessor(new {@link FileLexerSource}(file))'
     */
    public Preprocessor(@Nonnull File file)
            throws IOException {
        this(new FileLexerSource(file));
    }

    /**
     * Sets the PreprocessorListener which handles events for
     * this Preprocessor.
     */
    public void setListener(@Nonnull PreprocessorListener listener) {
        this.listener = listener;
    }

    /**
     * Returns the PreprocessorListener which handles events for
     * this Preprocessor.
     */
    @CheckForNull
    public PreprocessorListener getListener() {
        return listener;
    }

    /**
     * Returns the feature-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Feature> getFeatures() {
        return features;
    }

    /**
     * Adds a feature to the feature-set of this Preprocessor.
     */
    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    /**
     * Adds features to the feature-set of this Preprocessor.
     */
    public void addFeatures(@Nonnull Collection<Feature> f) {
        features.addAll(f);
    }

    /**
     * Adds features to the feature-set of this Preprocessor.
     */
    public void addFeatures(Feature... f) {
        addFeatures(Arrays.asList(f));
    }

    /**
     * Returns true if the given feature is in
     * the feature-set of this Preprocessor.
     */
    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Returns the warning-set for this Preprocessor.
     *
     * This set may be freely modified by user code.
     */
    @Nonnull
    public Set<Warning> getWarnings() {
        return warnings;
    }

    /**
     * Adds a warning to the warning-set of this Preprocessor.
     */
    public void addWarning(@Nonnull Warning w) {
        warnings.add(w);
    }

    /**
     * Adds warnings to the warning-set of this Preprocessor.
     */
    public void addWarnings(@Nonnull Collection<Warning> w) {
        warnings.addAll(w);
    }

    /**
     * Returns true if the given warning is in
     * the warning-set of this Preprocessor.
     */
    public boolean getWarning(@Nonnull Warning w) {
        return warnings.contains(w);
    }

    /**
     * Sets the number of macro replacements allowed to a single
     * top-level invocation, including the expansion of its arguments.
     */
    public void setMaxExpansionSteps(@Nonnegative int maxExpansionSteps) {
        if (maxExpansionSteps < 1)
            throw new IllegalArgumentException("Expansion step limit must be positive: " + maxExpansionSteps);
        this.maxExpansionSteps = maxExpansionSteps;
    }

    @Nonnegative
    public int getMaxExpansionSteps() {
        return maxExpansionSteps;
    }

    /**
     * Adds input for the Preprocessor.
     *
     * Inputs are processed in the order in which they are added. Each
     * input must close every conditional group it opens.
     */
    public void addInput(@Nonnull Source source) {
        inputs.add(source);
    }

    /**
     * Adds input for the Preprocessor.
     *
     * @see #addInput(Source)
     */
    public void addInput(@Nonnull File file)
            throws IOException {
        addInput(new FileLexerSource(file));
    }

    @Nonnull
    private Diagnostic diagnostic(@Nonnull Token tok, @Nonnull ErrorKind kind, @Nonnull String msg) {
        return new Diagnostic(kind, source == null ? null : source.getName(),
                tok.getLine(), tok.getColumn(), msg);
    }

    /**
     * Handles an error.
     *
     * If a PreprocessorListener is installed, it receives the
     * error. Otherwise, an exception is thrown.
     */
    protected void error(@Nonnull Token tok, @Nonnull ErrorKind kind, @Nonnull String msg)
            throws PreprocessorException {
        Diagnostic d = diagnostic(tok, kind, msg);
        if (listener != null)
            listener.handleError(d);
        else
            throw new PreprocessorException(d);
    }

    /**
     * Handles a warning.
     *
     * If a PreprocessorListener is installed, it receives the
     * warning. Otherwise, an exception is thrown.
     */
    protected void warning(@Nonnull Token tok, @Nonnull ErrorKind kind, @Nonnull String msg)
            throws PreprocessorException {
        if (warnings.contains(Warning.ERROR))
            error(tok, kind, msg);
        else if (listener != null)
            listener.handleWarning(diagnostic(tok, kind, msg));
        else
            throw new PreprocessorException(diagnostic(tok, kind, msg));
    }

    /* Reports an error which abandons the pass. */
    private void fatal(@Nonnull Token tok, @Nonnull ErrorKind kind, @Nonnull String msg)
            throws PreprocessorException {
        Diagnostic d = diagnostic(tok, kind, msg);
        if (listener != null)
            listener.handleError(d);
        throw new PreprocessorException(d);
    }

    /**
     * Adds a Macro to this Preprocessor.
     *
     * A conflicting earlier definition is replaced silently.
     *
     * @throws PreprocessorException if the definition fails or is otherwise illegal.
     */
    public void addMacro(@Nonnull Macro m) throws PreprocessorException {
        /* Already handled as a source error in define(). */
        if ("defined".equals(m.getName()))
            throw new PreprocessorException("Cannot redefine name 'defined'");
        macros.define(m);
    }

    /**
     * Defines the given name as a macro.
     *
     * The String value is lexed into a token stream, which is
     * used as the macro expansion.
     *
     * @throws PreprocessorException if the definition fails or is otherwise illegal.
     */
    public void addMacro(@Nonnull String name, @Nonnull String value)
            throws PreprocessorException {
        try {
            List<Token> body = new ArrayList<Token>();
            StringLexerSource s = new StringLexerSource(value);
            for (;;) {
                Token tok = s.token();
                if (tok.getKind() == EOF)
                    break;
                body.add(body.isEmpty() ? tok.withWhitespace(false).withLineStart(false) : tok.withLineStart(false));
            }
            addMacro(new Macro(name, body));
        } catch (IOException e) {
            throw new PreprocessorException(e);
        }
    }

    /**
     * Defines the given name as a macro, with the value <code>1</code>.
     *
     * This is a convenience method, and is equivalent to
     * <code>addMacro(name, "1")</code>.
     *
     * @throws PreprocessorException if the definition fails or is otherwise illegal.
     */
    public void addMacro(@Nonnull String name)
            throws PreprocessorException {
        addMacro(name, "1");
    }

    /**
     * Returns the macro table of this Preprocessor.
     */
    @Nonnull
    public MacroTable getMacroTable() {
        return macros;
    }

    /**
     * Returns the Map of Macros parsed during the run of this
     * Preprocessor.
     */
    @Nonnull
    public Map<String, Macro> getMacros() {
        return macros.getMacros();
    }

    /**
     * Returns the named macro, or null if not found.
     */
    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.getMacro(name);
    }

    /* Values of the built-in macros. */
    @Nonnull
    /* pp */ String getSourceName() {
        if (source == null || source.getName() == null)
            return "<no file>";
        return source.getName();
    }

    /* pp */ int nextCounter() {
        return counter++;
    }

    @Nonnull
    /* pp */ String getDate() {
        return date;
    }

    @Nonnull
    /* pp */ String getTime() {
        return time;
    }

    /* States */
    private boolean isActive() {
        return states.isEmpty() || states.peek().isActive();
    }

    private void push_state(@Nonnull Token directive, boolean condition) {
        ConditionalFrame frame = new ConditionalFrame(directive, isActive(), condition);
        if (getFeature(Feature.DEBUG))
            LOG.debug("#{} at line {}: {}", directive.getText(), directive.getLine(), frame);
        states.push(frame);
    }

    @Nonnull
    private ConditionalFrame peek_state(@Nonnull Token directive)
            throws PreprocessorException {
        if (states.isEmpty())
            fatal(directive, ErrorKind.UNMATCHED_ELIF_ELSE,
                    "#" + directive.getText() + " without #if");
        return states.peek();
    }

    private void set_state(@Nonnull Token directive, @Nonnull ConditionalFrame frame) {
        if (getFeature(Feature.DEBUG))
            LOG.debug("#{} at line {}: {}", directive.getText(), directive.getLine(), frame);
        states.set(states.size() - 1, frame);
    }

    /* Sources */
    /**
     * Moves to the next input.
     *
     * @return false if there are no more inputs.
     */
    private boolean next_source()
            throws IOException,
            PreprocessorException {
        if (source != null) {
            if (!states.isEmpty()) {
                Token opening = states.peek().getOpening();
                fatal(opening, ErrorKind.UNTERMINATED_CONDITIONAL,
                        "Unterminated #" + opening.getText());
            }
            source.close();
            source = null;
        }
        if (inputs.isEmpty())
            return false;
        source = inputs.remove(0);
        sourceStart = true;
        pushback = null;
        if (getFeature(Feature.DEBUG))
            LOG.debug("Reading {}", source);
        return true;
    }

    /* Returns the next token of the current source, with whitespace folded. */
    @Nonnull
    private Token source_token()
            throws IOException,
            PreprocessorException {
        if (pushback != null) {
            Token tok = pushback;
            pushback = null;
            return tok;
        }
        boolean space = false;
        boolean bol = sourceStart;
        sourceStart = false;
        for (;;) {
            Token tok = source.token();
            if (tok.getKind() == WHITESPACE) {
                space = true;
                bol |= tok.isLineStart();
                continue;
            }
            if (space)
                tok = tok.withWhitespace(true);
            if (bol)
                tok = tok.withLineStart(true);
            return tok;
        }
    }

    /**
     * Returns the tokens of the next line of the current source, or
     * null at the end of the source.
     */
    @CheckForNull
    private List<Token> source_line()
            throws IOException,
            PreprocessorException {
        if (source == null)
            return null;
        Token tok = source_token();
        if (tok.getKind() == EOF)
            return null;
        List<Token> line = new ArrayList<Token>();
        line.add(tok);
        for (;;) {
            tok = source_token();
            if (tok.getKind() == EOF || tok.isLineStart()) {
                pushback = tok;
                return line;
            }
            line.add(tok);
        }
    }

    private static boolean isDirective(@Nonnull List<Token> line) {
        Token tok = line.get(0);
        return tok.isPunctuator("#") || tok.isPunctuator("%:");
    }

    private void expand(@Nonnull List<Token> text)
            throws PreprocessorException {
        if (text.isEmpty())
            return;
        output.addAll(expander.expand(text, macros));
        text.clear();
    }

    /* Reads lines until there is output or the inputs are exhausted. */
    private void fill()
            throws IOException,
            PreprocessorException {
        List<Token> text = new ArrayList<Token>();
        while (output.isEmpty()) {
            List<Token> line = source_line();
            if (line == null) {
                expand(text);
                /* Deliver the output before checking the conditional stack. */
                if (!output.isEmpty())
                    return;
                if (!next_source())
                    return;
            } else if (isDirective(line)) {
                /* Text before a directive sees the macros as they were. */
                expand(text);
                directive(line);
            } else if (isActive()) {
                text.addAll(line);
            }
        }
    }

    private void directive(@Nonnull List<Token> line)
            throws PreprocessorException {
        if (line.size() == 1)
            return;	/* Null directive. */
        Token tok = line.get(1);
        List<Token> args = line.subList(2, line.size());

        if (tok.getKind() != IDENTIFIER) {
            if (isActive())
                error(tok, ErrorKind.INVALID_DIRECTIVE,
                        "Preprocessor directive not a word " + tok.getText());
            return;
        }
        PreprocessorCommand ppcmd = PreprocessorCommand.forText(tok.getText());
        if (ppcmd == null) {
            if (isActive())
                error(tok, ErrorKind.INVALID_DIRECTIVE,
                        "Unknown preprocessor directive " + tok.getText());
            return;
        }
        /* A skipped region is only scanned for conditional nesting. */
        if (!isActive() && !ppcmd.isConditional())
            return;
        if (ppcmd.isPassThrough()) {
            output.addAll(line);
            return;
        }

        switch (ppcmd) {
            case PP_DEFINE:
                define(tok, args);
                break;

            case PP_UNDEF:
                undef(tok, args);
                break;

            case PP_ERROR:
                error(tok, ErrorKind.USER_ERROR, "#error " + TokenPrinter.toString(args).trim());
                break;

            case PP_WARNING:
                warning(tok, ErrorKind.USER_WARNING, "#warning " + TokenPrinter.toString(args).trim());
                break;

            case PP_IF:
                push_state(tok, isActive() && evaluator.evaluate(tok, args, macros));
                break;

            case PP_IFDEF:
                push_state(tok, isActive() && ifdef(tok, args, true));
                break;

            case PP_IFNDEF:
                push_state(tok, isActive() && ifdef(tok, args, false));
                break;

            case PP_ELIF:
            case PP_ELIFDEF:
            case PP_ELIFNDEF: {
                ConditionalFrame state = peek_state(tok);
                if (state.sawElse())
                    fatal(tok, ErrorKind.UNMATCHED_ELIF_ELSE,
                            "#" + tok.getText() + " after #else");
                boolean condition = false;
                /* Not evaluated once a branch is taken, or in a skipped region. */
                if (state.needsCondition()) {
                    if (ppcmd == PP_ELIF)
                        condition = evaluator.evaluate(tok, args, macros);
                    else
                        condition = ifdef(tok, args, ppcmd == PP_ELIFDEF);
                }
                set_state(tok, state.withBranch(condition));
                break;
            }

            case PP_ELSE: {
                ConditionalFrame state = peek_state(tok);
                if (state.sawElse())
                    fatal(tok, ErrorKind.UNMATCHED_ELIF_ELSE, "#else after #else");
                set_state(tok, state.withElse());
                checkExtraTokens(tok, args);
                break;
            }

            case PP_ENDIF:
                peek_state(tok);
                states.pop();
                checkExtraTokens(tok, args);
                break;

            default:
                throw new InternalException("Internal error: Unknown directive " + tok);
        }
    }

    private void checkExtraTokens(@Nonnull Token directive, @Nonnull List<Token> extra)
            throws PreprocessorException {
        if (!extra.isEmpty() && warnings.contains(Warning.ENDIF_LABELS))
            warning(extra.get(0), ErrorKind.INVALID_DIRECTIVE,
                    "Extra tokens at end of #" + directive.getText() + " directive");
    }

    /**
     * Evaluates the condition of #ifdef, #ifndef, #elifdef or #elifndef.
     *
     * @param expected true if the condition holds when the name is defined.
     */
    private boolean ifdef(@Nonnull Token directive, @Nonnull List<Token> args, boolean expected)
            throws PreprocessorException {
        if (args.isEmpty() || args.get(0).getKind() != IDENTIFIER) {
            error(args.isEmpty() ? directive : args.get(0), ErrorKind.INVALID_DIRECTIVE,
                    "Expected identifier after #" + directive.getText()
                    + (args.isEmpty() ? "" : ", not " + args.get(0).getText()));
            return false;
        }
        checkExtraTokens(directive, args.subList(1, args.size()));
        return macros.isDefined(args.get(0).getText()) == expected;
    }

    /**
     * Checks a name given to #define or #undef.
     *
     * @return true if the directive may proceed.
     */
    private boolean checkName(@Nonnull Token tok, @Nonnull String verb)
            throws PreprocessorException {
        String name = tok.getText();
        if ("defined".equals(name)) {
            error(tok, ErrorKind.RESERVED_NAME, "Cannot " + verb + " name 'defined'");
            return false;
        }
        if ("__VA_ARGS__".equals(name) || "__VA_OPT__".equals(name))
            return reserved(tok, "Cannot " + verb + " name '" + name + "'");
        return true;
    }

    /* Reports misuse of __VA_ARGS__ or __VA_OPT__; fatal to the directive only when pedantic. */
    private boolean reserved(@Nonnull Token tok, @Nonnull String msg)
            throws PreprocessorException {
        if (getFeature(Feature.PEDANTIC)) {
            error(tok, ErrorKind.RESERVED_NAME, msg);
            return false;
        }
        warning(tok, ErrorKind.RESERVED_NAME, msg);
        return true;
    }

    private void define(@Nonnull Token directive, @Nonnull List<Token> line)
            throws PreprocessorException {
        if (line.isEmpty()) {
            error(directive, ErrorKind.INVALID_DIRECTIVE, "No macro name given in #define directive");
            return;
        }
        Token tok = line.get(0);
        if (tok.getKind() != IDENTIFIER) {
            error(tok, ErrorKind.INVALID_DIRECTIVE, "Expected identifier, not " + tok.getText());
            return;
        }
        if (!checkName(tok, "redefine"))
            return;
        String name = tok.getText();

        int idx = 1;
        List<String> params = null;
        boolean variadic = false;
        /* A parameter list must follow the name immediately. */
        if (idx < line.size() && line.get(idx).isPunctuator("(") && !line.get(idx).hasWhitespace()) {
            params = new ArrayList<String>();
            idx++;
            if (idx < line.size() && line.get(idx).isPunctuator(")")) {
                idx++;
            } else {
                ARGS:
                for (;;) {
                    if (idx >= line.size()) {
                        error(directive, ErrorKind.INVALID_DIRECTIVE, "Unterminated macro parameter list");
                        return;
                    }
                    Token arg = line.get(idx++);
                    if (arg.isPunctuator("...")) {
                        /* Unnamed variadic macro. */
                        params.add("__VA_ARGS__");
                        variadic = true;
                    } else if (arg.getKind() == IDENTIFIER) {
                        String param = arg.getText();
                        if ("__VA_ARGS__".equals(param) || "__VA_OPT__".equals(param)) {
                            error(arg, ErrorKind.INVALID_DIRECTIVE, param + " can not be used as a parameter name");
                            return;
                        }
                        if (params.contains(param)) {
                            error(arg, ErrorKind.INVALID_DIRECTIVE, "Duplicate macro parameter " + param);
                            return;
                        }
                        params.add(param);
                        if (idx < line.size() && line.get(idx).isPunctuator("...")) {
                            /* GNU named variadic parameter. */
                            variadic = true;
                            idx++;
                        }
                    } else {
                        error(arg, ErrorKind.INVALID_DIRECTIVE, "Bad token in macro parameters: " + arg.getText());
                        return;
                    }

                    if (idx >= line.size()) {
                        error(directive, ErrorKind.INVALID_DIRECTIVE, "Unterminated macro parameter list");
                        return;
                    }
                    Token sep = line.get(idx++);
                    if (sep.isPunctuator(")"))
                        break ARGS;
                    if (variadic) {
                        error(sep, ErrorKind.INVALID_DIRECTIVE, "ellipsis must be on last argument");
                        return;
                    }
                    if (!sep.isPunctuator(",")) {
                        error(sep, ErrorKind.INVALID_DIRECTIVE, "Bad token in macro parameters: " + sep.getText());
                        return;
                    }
                }
            }
        }

        List<Token> body = compile(directive, line.subList(idx, line.size()), params, variadic, false);
        if (body == null)
            return;
        Macro m = new Macro(name, params, variadic, body, source == null ? null : source.getName());
        if (getFeature(Feature.DEBUG))
            LOG.debug("Defined macro {}", m);
        Macro old = macros.define(m);
        if (old != null)
            warning(tok, ErrorKind.REDEFINITION_CONFLICT, "\"" + name + "\" redefined");
    }

    /**
     * Compiles a replacement list, or the operand of __VA_OPT__.
     *
     * @return the compiled tokens, or null if the definition is invalid.
     */
    @CheckForNull
    private List<Token> compile(@Nonnull Token directive, @Nonnull List<Token> tokens,
            @CheckForNull List<String> params, boolean variadic, boolean inVaOpt)
            throws PreprocessorException {
        List<Token> body = new ArrayList<Token>();
        for (int i = 0; i < tokens.size(); i++) {
            Token tok = tokens.get(i);
            if (body.isEmpty())
                tok = tok.withWhitespace(false);
            int idx;

            if (tok.isPunctuator("##") || tok.isPunctuator("%:%:")) {
                if (body.isEmpty()) {
                    error(tok, ErrorKind.INVALID_DIRECTIVE,
                            "'##' cannot appear at either end of " + (inVaOpt ? "__VA_OPT__" : "a macro expansion"));
                    return null;
                }
                body.add(new Token(M_PASTE, tok.getLine(), tok.getColumn(), "##")
                        .withWhitespace(tok.hasWhitespace()));
            } else if (tok.getKind() == IDENTIFIER && params != null
                    && (idx = params.indexOf(tok.getText())) != -1) {
                body.add(new Token(M_ARG, tok.getLine(), tok.getColumn(), tok.getText(), Integer.valueOf(idx))
                        .withWhitespace(tok.hasWhitespace()));
            } else if (tok.isIdentifier("__VA_OPT__") && variadic) {
                if (inVaOpt) {
                    error(tok, ErrorKind.INVALID_DIRECTIVE, "__VA_OPT__ may not appear in a __VA_OPT__ operand");
                    return null;
                }
                if (i + 1 >= tokens.size() || !tokens.get(i + 1).isPunctuator("(")) {
                    error(tok, ErrorKind.INVALID_DIRECTIVE, "__VA_OPT__ must be followed by an open parenthesis");
                    return null;
                }
                int depth = 0;
                int end = i + 1;
                for (; end < tokens.size(); end++) {
                    if (tokens.get(end).isPunctuator("("))
                        depth++;
                    else if (tokens.get(end).isPunctuator(")") && --depth == 0)
                        break;
                }
                if (end >= tokens.size()) {
                    error(tok, ErrorKind.INVALID_DIRECTIVE, "Unterminated __VA_OPT__");
                    return null;
                }
                List<Token> group = compile(directive, tokens.subList(i + 2, end), params, variadic, true);
                if (group == null)
                    return null;
                body.add(new Token(M_VA_OPT, tok.getLine(), tok.getColumn(), "__VA_OPT__", group)
                        .withWhitespace(tok.hasWhitespace()));
                i = end;
            } else {
                if (tok.isIdentifier("__VA_ARGS__")
                        && !reserved(tok, "__VA_ARGS__ can only appear in the expansion of a C99 variadic macro"))
                    return null;
                if (tok.isIdentifier("__VA_OPT__")
                        && !reserved(tok, "__VA_OPT__ can only appear in the expansion of a C99 variadic macro"))
                    return null;
                body.add(tok.withLineStart(false));
            }
        }
        if (!body.isEmpty() && body.get(body.size() - 1).getKind() == M_PASTE) {
            Token tok = body.get(body.size() - 1);
            error(tok, ErrorKind.INVALID_DIRECTIVE,
                    "'##' cannot appear at either end of " + (inVaOpt ? "__VA_OPT__" : "a macro expansion"));
            return null;
        }
        return body;
    }

    private void undef(@Nonnull Token directive, @Nonnull List<Token> line)
            throws PreprocessorException {
        if (line.isEmpty() || line.get(0).getKind() != IDENTIFIER) {
            error(line.isEmpty() ? directive : line.get(0), ErrorKind.INVALID_DIRECTIVE,
                    "Expected identifier" + (line.isEmpty() ? "" : ", not " + line.get(0).getText()));
            return;
        }
        Token tok = line.get(0);
        if (!checkName(tok, "undefine"))
            return;
        if (macros.undef(tok.getText()) && getFeature(Feature.DEBUG))
            LOG.debug("Undefined macro {}", tok.getText());
        checkExtraTokens(directive, line.subList(1, line.size()));
    }

    /**
     * Returns the next preprocessor token.
     *
     * @see Token
     * @return The next fully preprocessed token, or a token of kind
     *	{@link TokenKind#EOF} once every input has been read.
     * @throws IOException if an I/O error occurs.
     * @throws PreprocessorException if a fatal preprocessing error occurs.
     */
    @Nonnull
    public Token token()
            throws IOException,
            PreprocessorException {
        if (output.isEmpty())
            fill();
        Token tok = output.poll();
        if (tok == null)
            tok = new Token(EOF, "");
        if (getFeature(Feature.DEBUG))
            LOG.debug("pp: Returning {}", tok);
        return tok;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();

        if (source != null)
            buf.append(" -> ").append(String.valueOf(source)).append("\n");
        for (Source s : inputs)
            buf.append(" -> ").append(String.valueOf(s)).append("\n");

        Map<String, Macro> macros = new TreeMap<String, Macro>(getMacros());
        for (Macro macro : macros.values()) {
            buf.append("#").append("macro ").append(macro).append("\n");
        }

        return buf.toString();
    }

    @Override
    public void close()
            throws IOException {
        if (source != null)
            source.close();
        for (Source s : inputs) {
            s.close();
        }
    }
}
