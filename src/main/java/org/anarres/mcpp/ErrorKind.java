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
 * The classes of problem a {@link Preprocessor} can report.
 *
 * @see Diagnostic
 */
public enum ErrorKind {

    /** A macro was redefined with a different definition. The new definition wins. */
    REDEFINITION_CONFLICT(false),
    /** The input ended inside a conditional group. */
    UNTERMINATED_CONDITIONAL(true),
    /** An #elif, #else or #endif without a matching #if, or following an #else. */
    UNMATCHED_ELIF_ELSE(true),
    /** Token pasting did not produce a single valid token. */
    INVALID_PASTE_RESULT(false),
    /** A single top-level invocation needed too many replacements. */
    MACRO_EXPANSION_DEPTH_EXCEEDED(false),
    /** A function-like macro was given the wrong number of arguments. */
    ARITY_MISMATCH(false),
    /** The argument list of a function-like macro was not closed. */
    UNTERMINATED_ARGUMENTS(false),
    INVALID_DIRECTIVE(false),
    INVALID_EXPRESSION(false),
    DIVISION_BY_ZERO(false),
    /** An attempt to define or undefine a reserved name. */
    RESERVED_NAME(false),
    /** Reported by #error. */
    USER_ERROR(false),
    /** Reported by #warning. */
    USER_WARNING(false);

    private final boolean fatal;

    private ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * Returns true if this problem aborts the directive-processing pass.
     */
    public boolean isFatal() {
        return fatal;
    }
}
