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
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * A macro object.
 *
 * This encapsulates a name, a parameter list and a compiled replacement
 * list. In the replacement list, parameter references are M_ARG tokens
 * carrying the parameter index, <code>##</code> operators are M_PASTE
 * tokens and <code>__VA_OPT__</code> groups are M_VA_OPT tokens
 * carrying their own compiled body.
 *
 * Macros are immutable once constructed.
 */
public class Macro {

    private final String name;
    /* null for an object-like macro */
    private final List<String> params;
    private final boolean variadic;
    private final List<Token> body;
    private final String source;

    public Macro(@Nonnull String name, @CheckForNull List<String> params,
            boolean variadic, @Nonnull List<Token> body, @CheckForNull String source) {
        if (variadic && (params == null || params.isEmpty()))
            throw new IllegalArgumentException("A variadic macro needs its variadic parameter: " + name);
        this.name = name;
        this.params = params == null ? null : Collections.unmodifiableList(new ArrayList<>(params));
        this.variadic = variadic;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.source = source;
    }

    /** Constructs an object-like macro. */
    public Macro(@Nonnull String name, @Nonnull List<Token> body) {
        this(name, null, false, body, null);
    }

    /* Used for the built-in macros, which have no replacement list. */
    /* pp */ Macro(@Nonnull String name) {
        this(name, Collections.<Token>emptyList());
    }

    /**
     * Returns the name of this macro.
     */
    @Nonnull
    public String getName() {
        return name;
    }

    /**
     * Returns the name of the source which defined this macro, or null.
     */
    @CheckForNull
    public String getSource() {
        return source;
    }

    /**
     * Returns true if this is a function-like macro.
     *
     * Note that a function-like macro may have no parameters.
     */
    public boolean isFunctionLike() {
        return params != null;
    }

    /**
     * Returns the parameter names, including the variadic parameter.
     *
     * An object-like macro has no parameters.
     */
    @Nonnull
    public List<String> getParameters() {
        return params == null ? Collections.<String>emptyList() : params;
    }

    public int getParameterCount() {
        return params == null ? 0 : params.size();
    }

    /**
     * Returns true if the last parameter takes the variable arguments.
     */
    public boolean isVariadic() {
        return variadic;
    }

    @Nonnull
    public List<Token> getBody() {
        return body;
    }

    /**
     * Returns true if the given macro may silently replace this one.
     *
     * Two definitions are identical when they agree in kind, parameter
     * names and variadic flag, and their replacement lists are the same
     * tokens, ignoring whitespace between them.
     */
    public boolean isIdentical(@Nonnull Macro o) {
        if (this == o)
            return true;
        if (!name.equals(o.name) || variadic != o.variadic)
            return false;
        if (params == null ? o.params != null : !params.equals(o.params))
            return false;
        if (body.size() != o.body.size())
            return false;
        for (int i = 0; i < body.size(); i++) {
            if (!body.get(i).isEquivalent(o.body.get(i)))
                return false;
        }
        return true;
    }

    /**
     * Renders the replacement list as source text.
     */
    @Nonnull
    public String getText() {
        StringBuilder buf = new StringBuilder();
        render(buf, body);
        return buf.toString();
    }

    @SuppressWarnings("unchecked")
    private static void render(@Nonnull StringBuilder buf, @Nonnull List<Token> tokens) {
        boolean first = true;
        for (Token tok : tokens) {
            if (!first && tok.hasWhitespace())
                buf.append(' ');
            first = false;
            switch (tok.getKind()) {
                case M_PASTE:
                    buf.append("##");
                    break;
                case M_VA_OPT:
                    buf.append("__VA_OPT__(");
                    render(buf, (List<Token>) tok.getValue());
                    buf.append(')');
                    break;
                default:
                    buf.append(tok.getText());
                    break;
            }
        }
    }

    /**
     * Returns a JSON description of this macro.
     */
    @Nonnull
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", name);
        json.addProperty("functionLike", isFunctionLike());
        if (params != null) {
            JsonArray array = new JsonArray();
            for (String param : params)
                array.add(param);
            json.add("parameters", array);
            json.addProperty("variadic", variadic);
        }
        json.addProperty("body", getText());
        if (source != null)
            json.addProperty("source", source);
        return json;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(name);
        if (params != null) {
            buf.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                if (variadic && i == params.size() - 1 && "__VA_ARGS__".equals(params.get(i)))
                    buf.append("...");
                else
                    buf.append(params.get(i));
                if (variadic && i == params.size() - 1 && !"__VA_ARGS__".equals(params.get(i)))
                    buf.append("...");
            }
            buf.append(')');
        }
        if (!body.isEmpty())
            buf.append(" => ").append(getText());
        return buf.toString();
    }
}
