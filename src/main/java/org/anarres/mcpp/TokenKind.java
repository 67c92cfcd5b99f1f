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

/**
 * The kinds of {@link Token}.
 *
 * The set is closed; code which inspects a token switches on its kind.
 * The <code>M_*</code> kinds only occur inside the replacement list
 * of a {@link Macro} and never reach the output.
 */
public enum TokenKind {

    IDENTIFIER,
    NUMBER,
    CHARACTER,
    STRING,
    PUNCTUATOR,
    /** A run of whitespace. Folded into {@link Token#hasWhitespace()} on input. */
    WHITESPACE,
    /** Zero-width stand-in for an empty operand during substitution. */
    PLACEMARKER,
    /** A character the lexer could not classify, or the residue of a failed expansion. */
    INVALID,
    /** End of a {@link Source}. */
    EOF,
    /** A parameter reference. The value is the parameter index. */
    M_ARG,
    /** A <code>##</code> operator in a replacement list. */
    M_PASTE,
    /** A <code>__VA_OPT__</code> group. The value is the compiled group body. */
    M_VA_OPT;

    /* pp */ boolean isMacroOnly() {
        return this == M_ARG || this == M_PASTE || this == M_VA_OPT;
    }
}
