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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    File dir;

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true);

    private File write(String name, String text) throws Exception {
        File file = new File(dir, name);
        FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
        return file;
    }

    private String output() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testDefineOnCommandLine() throws Exception {
        File input = write("in.c", "#if FOO > 2\nbig FOO\n#endif\nBAR\n");
        assertEquals(0, Main.run(new String[]{"-D", "FOO=3", "-DBAR", input.getPath()}, out));
        assertEquals("big 3\n1\n", output());
    }

    @Test
    public void testUndefine() throws Exception {
        File input = write("in.c", "__LINE__ FOO\n");
        assertEquals(0, Main.run(new String[]{"-D", "FOO=1", "-U", "FOO", "-U", "__LINE__", input.getPath()}, out));
        assertEquals("__LINE__ FOO\n", output());
    }

    @Test
    public void testOutputFile() throws Exception {
        File input = write("in.c", "#define SQ(x) ((x) * (x))\nSQ(2)\n");
        File output = new File(dir, "out.i");
        assertEquals(0, Main.run(new String[]{"-o", output.getPath(), input.getPath()}, out));
        assertEquals("((2) * (2))\n", FileUtils.readFileToString(output, StandardCharsets.UTF_8));
        assertEquals("", output());
    }

    @Test
    public void testDumpMacros() throws Exception {
        File input = write("in.c", "#define MAX(a, b) ((a) > (b) ? (a) : (b))\n#define ONE 1\n");
        assertEquals(0, Main.run(new String[]{"--dump-macros", input.getPath()}, out));
        JsonArray macros = JsonParser.parseString(output()).getAsJsonArray();
        assertEquals(2, macros.size());
        JsonObject max = macros.get(0).getAsJsonObject();
        assertEquals("MAX", max.get("name").getAsString());
        assertTrue(max.get("functionLike").getAsBoolean());
        assertEquals(2, max.get("parameters").getAsJsonArray().size());
        assertEquals("ONE", macros.get(1).getAsJsonObject().get("name").getAsString());
    }

    @Test
    public void testGnuOption() throws Exception {
        File input = write("in.c", "#define E(fmt, ...) f(fmt, ## __VA_ARGS__)\nE(a)\n");
        assertEquals(0, Main.run(new String[]{"--gnu", input.getPath()}, out));
        assertEquals("f(a)\n", output());
    }

    @Test
    public void testErrorExitCode() throws Exception {
        File input = write("in.c", "before\n#error stop\nafter\n");
        assertEquals(1, Main.run(new String[]{input.getPath()}, out));
        assertEquals("before\nafter\n", output());
    }

    @Test
    public void testFatalExitCode() throws Exception {
        File input = write("in.c", "x\n#if 1\ny\n");
        assertEquals(1, Main.run(new String[]{input.getPath()}, out));
        assertEquals("x\ny", output());
    }

    @Test
    public void testWarningsAsErrors() throws Exception {
        File input = write("in.c", "#warning hmm\n");
        assertEquals(0, Main.run(new String[]{input.getPath()}, out));
        assertEquals(1, Main.run(new String[]{"-W", "error", input.getPath()}, out));
    }

    @Test
    public void testBadCommandLine() throws Exception {
        assertEquals(2, Main.run(new String[]{"--no-such-option"}, out));
        assertEquals(2, Main.run(new String[]{"-W", "nonsense", "x.c"}, out));
        assertEquals(2, Main.run(new String[]{"--max-expansion-steps", "0", "x.c"}, out));
    }

    @Test
    public void testHelp() throws Exception {
        assertEquals(0, Main.run(new String[]{"--help"}, out));
        assertTrue(output().contains("--dump-macros"));
    }
}
