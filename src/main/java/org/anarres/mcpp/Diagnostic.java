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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A warning or error, with the source position of the offending token.
 */
public final class Diagnostic {

    private final ErrorKind kind;
    private final String source;
    private final int line;
    private final int column;
    private final String message;

    public Diagnostic(@Nonnull ErrorKind kind, @CheckForNull String source,
            int line, int column, @Nonnull String message) {
        this.kind = kind;
        this.source = source;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the name of the source, or null if unknown.
     */
    @CheckForNull
    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append(source == null ? "<no file>" : source);
        buf.append(':').append(line).append(':').append(column);
        buf.append(": ").append(message);
        buf.append(" [").append(kind).append(']');
        return buf.toString();
    }
}
