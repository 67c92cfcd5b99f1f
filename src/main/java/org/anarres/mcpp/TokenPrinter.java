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
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Renders tokens as source text.
 *
 * A token flagged as a line start begins a new line, except at the
 * very start of the output. A token flagged as following whitespace is
 * preceded by a single space. The text of every token is then copied
 * verbatim.
 */
public class TokenPrinter {

    private final Appendable out;
    private boolean first;

    public TokenPrinter(@Nonnull Appendable out) {
        this.out = out;
        this.first = true;
    }

    public void print(@Nonnull Token tok)
            throws IOException {
        if (tok.isLineStart() && !first)
            out.append('\n');
        if (tok.hasWhitespace())
            out.append(' ');
        out.append(tok.getText());
        first = false;
    }

    /**
     * Ends the output with a newline, if anything was printed.
     */
    public void finish()
            throws IOException {
        if (!first)
            out.append('\n');
    }

    @Nonnull
    public static String toString(@Nonnull List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        TokenPrinter printer = new TokenPrinter(buf);
        try {
            for (Token tok : tokens)
                printer.print(tok);
        } catch (IOException e) {
            throw new InternalException("Cannot append to a StringBuilder: " + e);
        }
        return buf.toString();
    }
}
