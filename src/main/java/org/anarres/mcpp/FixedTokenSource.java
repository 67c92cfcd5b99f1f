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
import java.util.Arrays;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A {@link Source} which replays a list of tokens produced elsewhere.
 */
public class FixedTokenSource extends Source {

    private static final Token EOF
            = new Token(TokenKind.EOF, "");

    private final List<Token> tokens;
    private final String name;
    private int idx;

    public FixedTokenSource(@Nonnull List<Token> tokens, @CheckForNull String name) {
        this.tokens = new ArrayList<Token>(tokens);
        this.name = name;
        this.idx = 0;
    }

    public FixedTokenSource(@Nonnull List<Token> tokens) {
        this(tokens, null);
    }

    public FixedTokenSource(@Nonnull Token... tokens) {
        this(Arrays.asList(tokens));
    }

    @Override
    public Token token() {
        if (idx >= tokens.size())
            return EOF;
        return tokens.get(idx++);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("constant token stream ").append(tokens);
        return buf.toString();
    }
}
