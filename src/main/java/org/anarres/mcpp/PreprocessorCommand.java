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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The directives recognised by the {@link Preprocessor}.
 */
public enum PreprocessorCommand {

    PP_DEFINE("define"),
    PP_ELIF("elif"),
    PP_ELIFDEF("elifdef"),
    PP_ELIFNDEF("elifndef"),
    PP_ELSE("else"),
    PP_ENDIF("endif"),
    PP_ERROR("error"),
    PP_IF("if"),
    PP_IFDEF("ifdef"),
    PP_IFNDEF("ifndef"),
    PP_UNDEF("undef"),
    PP_WARNING("warning"),
    /* Passed through to the output in an active region. */
    PP_INCLUDE("include"),
    PP_INCLUDE_NEXT("include_next"),
    PP_LINE("line"),
    PP_PRAGMA("pragma"),
    PP_IDENT("ident");

    private final String text;

    private PreprocessorCommand(@Nonnull String text) {
        this.text = text;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * Returns true if this directive opens, continues or closes a
     * conditional group, and so must be examined even in a skipped region.
     */
    public boolean isConditional() {
        switch (this) {
            case PP_IF:
            case PP_IFDEF:
            case PP_IFNDEF:
            case PP_ELIF:
            case PP_ELIFDEF:
            case PP_ELIFNDEF:
            case PP_ELSE:
            case PP_ENDIF:
                return true;
            default:
                return false;
        }
    }

    /**
     * Returns true if this directive is copied to the output unchanged.
     */
    public boolean isPassThrough() {
        switch (this) {
            case PP_INCLUDE:
            case PP_INCLUDE_NEXT:
            case PP_LINE:
            case PP_PRAGMA:
            case PP_IDENT:
                return true;
            default:
                return false;
        }
    }

    private static final Map<String, PreprocessorCommand> map;

    static {
        map = new HashMap<String, PreprocessorCommand>();
        for (PreprocessorCommand cmd : PreprocessorCommand.values())
            map.put(cmd.text, cmd);
    }

    /**
     * Returns the command for the given directive name, or null.
     */
    @CheckForNull
    public static PreprocessorCommand forText(@Nonnull String text) {
        return map.get(text);
    }
}
