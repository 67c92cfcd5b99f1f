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
import java.io.IOException;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * An input to the Preprocessor.
 *
 * A Source delivers preprocessing tokens in order, then a token of
 * kind {@link TokenKind#EOF}, which it repeats on every further call.
 * Tokens must carry accurate {@link Token#isLineStart()} and
 * {@link Token#hasWhitespace()} flags.
 *
 * @see FixedTokenSource
 * @see LexerSource
 */
public abstract class Source implements Closeable {

    /**
     * Returns the next token, or an EOF token.
     */
    @Nonnull
    public abstract Token token()
            throws IOException,
            PreprocessorException;

    /**
     * Returns the human-readable name of this Source, as used for
     * __FILE__ and in diagnostics.
     */
    @CheckForNull
    public String getName() {
        return null;
    }

    @Override
    public void close()
            throws IOException {
    }
}
