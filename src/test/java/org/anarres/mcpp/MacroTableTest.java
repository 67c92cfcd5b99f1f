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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import static org.anarres.mcpp.PreprocessorFixture.lex;
import static org.junit.jupiter.api.Assertions.*;

public class MacroTableTest {

    private static Macro object(String name, String body) throws Exception {
        return new Macro(name, lex(body));
    }

    @Test
    public void testDefineAndLookup() throws Exception {
        MacroTable table = new MacroTable();
        assertFalse(table.isDefined("FOO"));
        assertNull(table.define(object("FOO", "42")));
        assertTrue(table.isDefined("FOO"));
        assertEquals("42", table.getMacro("FOO").getText());
    }

    @Test
    public void testIdenticalRedefinitionIsSilent() throws Exception {
        MacroTable table = new MacroTable();
        Macro first = object("FOO", "a + b");
        table.define(first);
        assertNull(table.define(object("FOO", "a  +    b")));
        assertNull(table.define(object("FOO", "a+b")));
    }

    @Test
    public void testConflictingRedefinitionReplaces() throws Exception {
        MacroTable table = new MacroTable();
        Macro first = object("FOO", "1");
        table.define(first);
        Macro second = object("FOO", "2");
        assertSame(first, table.define(second));
        assertSame(second, table.getMacro("FOO"));
    }

    @Test
    public void testParametersAffectIdentity() throws Exception {
        List<Token> body = lex("x");
        Macro a = new Macro("F", Arrays.asList("x"), false, body, null);
        Macro b = new Macro("F", Arrays.asList("y"), false, body, null);
        Macro c = new Macro("F", Arrays.asList("x"), true, body, null);
        Macro d = new Macro("F", body);
        assertTrue(a.isIdentical(new Macro("F", Arrays.asList("x"), false, lex("x"), "other.c")));
        assertFalse(a.isIdentical(b));
        assertFalse(a.isIdentical(c));
        assertFalse(a.isIdentical(d));
    }

    @Test
    public void testUndef() throws Exception {
        MacroTable table = new MacroTable();
        table.define(object("FOO", "1"));
        assertTrue(table.undef("FOO"));
        assertFalse(table.isDefined("FOO"));
        assertFalse(table.undef("FOO"));
    }

    @Test
    public void testBuiltins() {
        assertTrue(new MacroTable().getMacros().isEmpty());
        MacroTable table = MacroTable.withBuiltins();
        for (String name : Arrays.asList("__LINE__", "__FILE__", "__FILENAME__", "__COUNTER__", "__DATE__", "__TIME__"))
            assertTrue(table.isDefined(name), name);
    }

    @Test
    public void testCopyIsIndependent() throws Exception {
        MacroTable table = new MacroTable();
        table.define(object("FOO", "1"));
        MacroTable copy = table.copy();
        copy.undef("FOO");
        copy.define(object("BAR", "2"));
        assertTrue(table.isDefined("FOO"));
        assertFalse(table.isDefined("BAR"));
        assertFalse(copy.isDefined("FOO"));
    }

    @Test
    public void testJson() throws Exception {
        MacroTable table = MacroTable.withBuiltins();
        table.define(new Macro("MAX", Arrays.asList("a", "b"), false, lex("a > b ? a : b"), "test.c"));
        table.define(new Macro("EMPTY", Collections.<Token>emptyList()));
        JsonArray json = table.toJson();
        assertEquals(2, json.size());
        JsonObject empty = json.get(0).getAsJsonObject();
        assertEquals("EMPTY", empty.get("name").getAsString());
        assertFalse(empty.get("functionLike").getAsBoolean());
        JsonObject max = json.get(1).getAsJsonObject();
        assertEquals("MAX", max.get("name").getAsString());
        assertEquals(2, max.get("parameters").getAsJsonArray().size());
        assertEquals("a > b ? a : b", max.get("body").getAsString());
        assertEquals("test.c", max.get("source").getAsString());
    }
}
