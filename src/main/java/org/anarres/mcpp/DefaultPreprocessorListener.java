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
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handler for preprocessor events which logs and records them.
 *
 * No diagnostic ever throws from here; the {@link Preprocessor}
 * raises fatal errors itself.
 */
public class DefaultPreprocessorListener implements PreprocessorListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultPreprocessorListener.class);

    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    private int errors;
    private int warnings;

    public void clear() {
        diagnostics.clear();
        errors = 0;
        warnings = 0;
    }

    @Nonnegative
    public int getErrors() {
        return errors;
    }

    @Nonnegative
    public int getWarnings() {
        return warnings;
    }

    /**
     * Returns every diagnostic seen so far, in order.
     */
    @Nonnull
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns true if a diagnostic of the given kind was seen.
     */
    public boolean hasDiagnostic(@Nonnull ErrorKind kind) {
        for (Diagnostic d : diagnostics)
            if (d.getKind() == kind)
                return true;
        return false;
    }

    @Override
    public void handleWarning(Diagnostic diagnostic)
            throws PreprocessorException {
        warnings++;
        diagnostics.add(diagnostic);
        LOG.warn(diagnostic.toString());
    }

    @Override
    public void handleError(Diagnostic diagnostic)
            throws PreprocessorException {
        errors++;
        diagnostics.add(diagnostic);
        LOG.error(diagnostic.toString());
    }
}
