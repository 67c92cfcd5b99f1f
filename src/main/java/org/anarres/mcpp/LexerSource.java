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

import java.io.IOException;
import java.io.Reader;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.commons.io.IOUtils;

/**
 * Lexes C source text into preprocessing tokens.
 *
 * This is a plain reference lexer: it joins spliced lines, drops
 * comments and records spacing and line starts on the tokens. It
 * does not merge string literals and never expands macros.
 */
public class LexerSource extends Source {

    /* Longest first, so that a scan in order finds the longest match. */
    private static final String[] PUNCTUATORS = {
        "%:%:", "...", "<<=", ">>=",
        "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
        "*=", "/=", "%=", "+=", "-=", "&=", "^=", "|=", "##",
        "<:", ":>", "<%", "%>", "%:", "::",
        "[", "]", "(", ")", "{", "}", ".", "&", "*", "+", "-", "~", "!",
        "/", "%", "<", ">", "^", "|", "?", ":", ";", "=", ",", "#"
    };

    private final Reader reader;
    private final String name;

    /* Spliced text, with the source position of every character. */
    private char[] buf;
    private int[] lines;
    private int[] columns;
    private int idx;

    private boolean bol;

    public LexerSource(@Nonnull Reader reader, @CheckForNull String name) {
        this.reader = reader;
        this.name = name;
        this.bol = true;
    }

    @Override
    public String getName() {
        return name;
    }

    private void init()
            throws IOException {
        if (buf != null)
            return;
        String text = IOUtils.toString(reader);
        int len = text.length();
        buf = new char[len];
        lines = new int[len + 1];
        columns = new int[len + 1];
        int n = 0;
        int line = 1;
        int column = 0;
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                int j = i + 1;
                if (j < len && text.charAt(j) == '\r')
                    j++;
                if (j < len && text.charAt(j) == '\n') {
                    /* Line splice. */
                    i = j;
                    line++;
                    column = 0;
                    continue;
                }
            }
            if (c == '\r') {
                if (i + 1 < len && text.charAt(i + 1) == '\n')
                    continue;
                c = '\n';
            }
            buf[n] = c;
            lines[n] = line;
            columns[n] = column;
            n++;
            if (c == '\n') {
                line++;
                column = 0;
            } else {
                column++;
            }
        }
        lines[n] = line;
        columns[n] = column;
        if (n < len) {
            char[] tmp = new char[n];
            System.arraycopy(buf, 0, tmp, 0, n);
            buf = tmp;
        }
        idx = 0;
    }

    private int peek(int ahead) {
        int i = idx + ahead;
        if (i >= buf.length)
            return -1;
        return buf[i];
    }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    @Override
    public Token token()
            throws IOException {
        init();
        boolean space = false;
        for (;;) {
            int c = peek(0);
            switch (c) {
                case -1:
                    return new Token(TokenKind.EOF, lines[buf.length], columns[buf.length], "");
                case '\n':
                    bol = true;
                    space = false;
                    idx++;
                    continue;
                case ' ':
                case '\t':
                case '\f':
                case '\u000B':
                    space = true;
                    idx++;
                    continue;
                case '/':
                    if (peek(1) == '*') {
                        int start = idx;
                        idx += 2;
                        while (peek(0) != -1 && !(peek(0) == '*' && peek(1) == '/'))
                            idx++;
                        if (peek(0) == -1)
                            return token(start, TokenKind.INVALID, space);
                        idx += 2;
                        space = true;
                        continue;
                    }
                    if (peek(1) == '/') {
                        while (peek(0) != -1 && peek(0) != '\n')
                            idx++;
                        space = true;
                        continue;
                    }
                    break;
                default:
                    break;
            }
            return lex(space);
        }
    }

    @Nonnull
    private Token lex(boolean space) {
        int start = idx;
        int c = peek(0);

        if (isIdentifierStart(c)) {
            int prefix = 0;
            if (c == 'L' || c == 'U')
                prefix = 1;
            else if (c == 'u')
                prefix = peek(1) == '8' ? 2 : 1;
            if (prefix > 0 && (peek(prefix) == '"' || peek(prefix) == '\'')) {
                idx += prefix;
                return quoted(start, space);
            }
            while (isIdentifierPart(peek(0)))
                idx++;
            return token(start, TokenKind.IDENTIFIER, space);
        }

        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            idx++;
            for (;;) {
                int d = peek(0);
                if ((d == '+' || d == '-')
                        && (buf[idx - 1] == 'e' || buf[idx - 1] == 'E'
                        || buf[idx - 1] == 'p' || buf[idx - 1] == 'P')) {
                    idx++;
                } else if (d == '\'' && isIdentifierPart(peek(1))) {
                    idx += 2;
                } else if (isIdentifierPart(d) || d == '.') {
                    idx++;
                } else {
                    break;
                }
            }
            return token(start, TokenKind.NUMBER, space);
        }

        if (c == '"' || c == '\'')
            return quoted(start, space);

        for (String p : PUNCTUATORS) {
            if (matches(p)) {
                idx += p.length();
                return token(start, TokenKind.PUNCTUATOR, space);
            }
        }

        idx++;
        return token(start, TokenKind.INVALID, space);
    }

    private boolean matches(@Nonnull String p) {
        for (int i = 0; i < p.length(); i++)
            if (peek(i) != p.charAt(i))
                return false;
        return true;
    }

    /* Starts at the opening quote. An unterminated literal is INVALID. */
    @Nonnull
    private Token quoted(int start, boolean space) {
        char quote = buf[idx];
        idx++;
        for (;;) {
            int c = peek(0);
            if (c == -1 || c == '\n')
                return token(start, TokenKind.INVALID, space);
            idx++;
            if (c == '\\') {
                if (peek(0) != -1 && peek(0) != '\n')
                    idx++;
            } else if (c == quote) {
                break;
            }
        }
        return token(start, quote == '"' ? TokenKind.STRING : TokenKind.CHARACTER, space);
    }

    @Nonnull
    private Token token(int start, @Nonnull TokenKind kind, boolean space) {
        String text = new String(buf, start, idx - start);
        Token tok = new Token(kind, lines[start], columns[start], text)
                .withWhitespace(space)
                .withLineStart(bol);
        bol = false;
        return tok;
    }

    /**
     * Lexes the given text as exactly one token.
     *
     * @return the token, or null if the text is not one valid token.
     */
    @CheckForNull
    public static Token lexSingle(@Nonnull String text) {
        if (text.isEmpty())
            return null;
        try {
            LexerSource s = new StringLexerSource(text);
            Token tok = s.token();
            switch (tok.getKind()) {
                case EOF:
                case INVALID:
                    return null;
                default:
                    break;
            }
            if (tok.hasWhitespace() || s.token().getKind() != TokenKind.EOF)
                return null;
            return tok;
        } catch (IOException e) {
            throw new InternalException("Cannot read from a string: " + e);
        }
    }

    @Override
    public void close()
            throws IOException {
        reader.close();
    }

    @Override
    public String toString() {
        return "lexer source " + (name == null ? "<anonymous>" : name);
    }
}
