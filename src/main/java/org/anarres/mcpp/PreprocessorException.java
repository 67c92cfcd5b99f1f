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
 * Thrown when the directive-processing pass cannot continue.
 *
 * The conditional state is no longer trustworthy after one of these,
 * so the {@link Preprocessor} which threw it should be discarded.
 */
public class PreprocessorException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Diagnostic diagnostic;

    public PreprocessorException(@Nonnull Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public PreprocessorException(@Nonnull String msg) {
        super(msg);
        this.diagnostic = null;
    }

    public PreprocessorException(@Nonnull Throwable cause) {
        super(cause);
        this.diagnostic = null;
    }

    /**
     * Returns the diagnostic which caused this exception, if any.
     */
    @CheckForNull
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
