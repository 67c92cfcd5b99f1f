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

import java.util.Map;
import java.util.TreeMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of macros in scope.
 *
 * The table is backed by a persistent map, so {@link #copy()} is cheap.
 * The {@link Expander} only reads the table; the {@link Preprocessor}
 * mutates it between expansions.
 */
public class MacroTable {

    private static final Logger LOG = LoggerFactory.getLogger(MacroTable.class);

    /* pp */ static final Macro __LINE__ = new Macro("__LINE__");
    /* pp */ static final Macro __FILE__ = new Macro("__FILE__");
    /* pp */ static final Macro __FILENAME__ = new Macro("__FILENAME__");
    /* pp */ static final Macro __COUNTER__ = new Macro("__COUNTER__");
    /* pp */ static final Macro __DATE__ = new Macro("__DATE__");
    /* pp */ static final Macro __TIME__ = new Macro("__TIME__");

    private static final Macro[] BUILTINS = {
        __LINE__, __FILE__, __FILENAME__, __COUNTER__, __DATE__, __TIME__
    };

    private PMap<String, Macro> macros;

    private MacroTable(@Nonnull PMap<String, Macro> macros) {
        this.macros = macros;
    }

    /**
     * Constructs an empty table, without the built-in macros.
     */
    public MacroTable() {
        this(HashTreePMap.<String, Macro>empty());
    }

    /**
     * Constructs a table holding only the built-in macros.
     */
    @Nonnull
    public static MacroTable withBuiltins() {
        MacroTable table = new MacroTable();
        for (Macro m : BUILTINS)
            table.macros = table.macros.plus(m.getName(), m);
        return table;
    }

    /* pp */ static boolean isBuiltin(@Nonnull Macro m) {
        for (Macro b : BUILTINS)
            if (b == m)
                return true;
        return false;
    }

    /**
     * Adds a macro to the table.
     *
     * An identical redefinition leaves the table unchanged. Any other
     * redefinition replaces the old definition.
     *
     * @return the replaced definition if it conflicted with the new one,
     *	otherwise null.
     */
    @CheckForNull
    public Macro define(@Nonnull Macro m) {
        Macro old = macros.get(m.getName());
        if (old != null && old.isIdentical(m)) {
            LOG.debug("Identical redefinition of {}", m.getName());
            return null;
        }
        macros = macros.plus(m.getName(), m);
        return old;
    }

    /**
     * Removes a macro from the table.
     *
     * @return true if the macro was defined.
     */
    public boolean undef(@Nonnull String name) {
        if (!macros.containsKey(name))
            return false;
        macros = macros.minus(name);
        return true;
    }

    public boolean isDefined(@Nonnull String name) {
        return macros.containsKey(name);
    }

    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.get(name);
    }

    /**
     * Returns an immutable snapshot of the macros in the table.
     */
    @Nonnull
    public Map<String, Macro> getMacros() {
        return macros;
    }

    /**
     * Returns an independent table with the same definitions.
     */
    @Nonnull
    public MacroTable copy() {
        return new MacroTable(macros);
    }

    /**
     * Returns the user-visible definitions as a JSON array sorted by name.
     *
     * Built-in macros are omitted.
     */
    @Nonnull
    public JsonArray toJson() {
        JsonArray array = new JsonArray();
        for (Macro m : new TreeMap<>(macros).values())
            if (!isBuiltin(m))
                array.add(m.toJson());
        return array;
    }

    @Override
    public String toString() {
        return "MacroTable" + new TreeMap<>(macros).keySet();
    }
}
