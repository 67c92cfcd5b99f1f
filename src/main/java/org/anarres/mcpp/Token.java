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

import java.util.List;
import java.util.Objects;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.Empty;
import org.pcollections.PSet;

/**
 * A preprocessing token.
 *
 * Tokens are immutable. Expansion never modifies a token in place;
 * the <code>with*</code> methods return a modified copy.
 *
 * The hideset of a token is the set of macro names which took part in
 * deriving it, and which therefore may not be expanded from it again.
 */
public final class Token {

    /* pp */ static final Token PLACEMARKER = new Token(TokenKind.PLACEMARKER, -1, -1, "");

    private final TokenKind kind;
    private final int line;
    private final int column;
    private final String text;
    private final Object value;
    private final boolean whitespace;
    private final boolean lineStart;
    private final PSet<String> hideset;

    private Token(@Nonnull TokenKind kind, int line, int column,
            @Nonnull String text, @CheckForNull Object value,
            boolean whitespace, boolean lineStart,
            @Nonnull PSet<String> hideset) {
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.text = text;
        this.value = value;
        this.whitespace = whitespace;
        this.lineStart = lineStart;
        this.hideset = hideset;
    }

    public Token(@Nonnull TokenKind kind, int line, int column,
            @Nonnull String text, @CheckForNull Object value) {
        this(kind, line, column, text, value, false, false, Empty.<String>set());
    }

    public Token(@Nonnull TokenKind kind, int line, int column, @Nonnull String text) {
        this(kind, line, column, text, null);
    }

    /* Sole use of this constructor is tests and predefined macros. */
    public Token(@Nonnull TokenKind kind, @Nonnull String text) {
        this(kind, -1, -1, text, null);
    }

    @Nonnull
    public TokenKind getKind() {
        return kind;
    }

    /**
     * Returns the line at which this token started.
     *
     * Lines are numbered from 1; -1 means the token has no position.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the column at which this token started.
     *
     * Columns are numbered from 0.
     */
    public int getColumn() {
        return column;
    }

    /**
     * Returns the original or generated text of this token.
     */
    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * Returns the payload of a macro-body token, or null.
     */
    @CheckForNull
    public Object getValue() {
        return value;
    }

    /**
     * Returns true if this token was preceded by whitespace on its line.
     */
    public boolean hasWhitespace() {
        return whitespace;
    }

    /**
     * Returns true if this token is the first token of a source line.
     */
    public boolean isLineStart() {
        return lineStart;
    }

    @Nonnull
    public PSet<String> getHideset() {
        return hideset;
    }

    /* pp */ boolean is(@Nonnull TokenKind kind, @Nonnull String text) {
        return this.kind == kind && this.text.equals(text);
    }

    /* pp */ boolean isPunctuator(@Nonnull String text) {
        return is(TokenKind.PUNCTUATOR, text);
    }

    /* pp */ boolean isIdentifier(@Nonnull String text) {
        return is(TokenKind.IDENTIFIER, text);
    }

    @Nonnull
    public Token withWhitespace(boolean whitespace) {
        if (whitespace == this.whitespace)
            return this;
        return new Token(kind, line, column, text, value, whitespace, lineStart, hideset);
    }

    @Nonnull
    public Token withLineStart(boolean lineStart) {
        if (lineStart == this.lineStart)
            return this;
        return new Token(kind, line, column, text, value, whitespace, lineStart, hideset);
    }

    @Nonnull
    public Token withHideset(@Nonnull PSet<String> hideset) {
        if (hideset == this.hideset)
            return this;
        return new Token(kind, line, column, text, value, whitespace, lineStart, hideset);
    }

    @Nonnull
    public Token withPosition(int line, int column) {
        if (line == this.line && column == this.column)
            return this;
        return new Token(kind, line, column, text, value, whitespace, lineStart, hideset);
    }

    /**
     * Returns true if the given token has the same kind, text and
     * payload as this one, ignoring position, spacing and hideset.
     *
     * This is the token comparison used for macro redefinition.
     */
    public boolean isEquivalent(@Nonnull Token o) {
        if (kind != o.kind || !text.equals(o.text))
            return false;
        if (value instanceof List && o.value instanceof List)
            return isEquivalent((List<?>) value, (List<?>) o.value);
        return Objects.equals(value, o.value);
    }

    /* pp */ static boolean isEquivalent(@Nonnull List<?> a, @Nonnull List<?> b) {
        if (a.size() != b.size())
            return false;
        for (int i = 0; i < a.size(); i++) {
            if (!((Token) a.get(i)).isEquivalent((Token) b.get(i)))
                return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(kind);
        if (line != -1)
            buf.append('@').append(line).append(',').append(column);
        buf.append(']');
        buf.append(":\"").append(text).append('"');
        if (!hideset.isEmpty())
            buf.append(hideset);
        return buf.toString();
    }
}
