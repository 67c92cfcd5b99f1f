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

import java.io.StringReader;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A {@link Source} which lexes a String.
 */
public class StringLexerSource extends LexerSource {

    public StringLexerSource(@Nonnull String string, @CheckForNull String name) {
        super(new StringReader(string), name);
    }

    public StringLexerSource(@Nonnull String string) {
        this(string, null);
    }

    @Override
    public String toString() {
        return "string source " + (getName() == null ? "<anonymous>" : getName());
    }
}
