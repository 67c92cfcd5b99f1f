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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nonnull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A command-line driver for the Preprocessor.
 *
 * Reads the named files, or standard input, and prints the expanded
 * token stream.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Nonnull
    private static CharSequence getWarnings() {
        StringBuilder buf = new StringBuilder();
        for (Warning w : Warning.values()) {
            if (buf.length() > 0)
                buf.append(", ");
            String name = w.name().toLowerCase(Locale.ROOT);
            buf.append(name.replace('_', '-'));
        }
        return buf;
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out));
    }

    /**
     * Runs the driver.
     *
     * @return 0 on success, 1 if errors were reported or preprocessing
     *	was abandoned, 2 if the command line was not understood.
     */
    public static int run(@Nonnull String[] args, @Nonnull PrintStream out)
            throws IOException {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");

        OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
                "Defines the given macro.")
                .withRequiredArg().ofType(String.class).describedAs("name[=definition]");
        OptionSpec<String> undefineOption = parser.acceptsAll(Arrays.asList("undefine", "U"),
                "Undefines the given macro, previously either builtin or defined using -D.")
                .withRequiredArg().describedAs("name");
        OptionSpec<String> warningOption = parser.acceptsAll(Arrays.asList("warning", "W"),
                "Enables the named warning class (" + getWarnings() + ", all).")
                .withRequiredArg().ofType(String.class).describedAs("warning");
        OptionSpec<Void> noWarningOption = parser.acceptsAll(Arrays.asList("no-warnings", "w"),
                "Disables ALL warnings.");
        OptionSpec<Void> pedanticOption = parser.accepts("pedantic",
                "Treats misuse of __VA_ARGS__ and __VA_OPT__ as an error.");
        OptionSpec<Void> gnuOption = parser.accepts("gnu",
                "Enables the GNU ', ## __VA_ARGS__' extension.");
        OptionSpec<Integer> stepsOption = parser.accepts("max-expansion-steps",
                "Limits the macro replacements of a single invocation.")
                .withRequiredArg().ofType(Integer.class).describedAs("steps")
                .defaultsTo(Preprocessor.DEFAULT_MAX_EXPANSION_STEPS);
        OptionSpec<File> outputOption = parser.acceptsAll(Arrays.asList("output", "o"),
                "Writes the output to the given file.")
                .withRequiredArg().ofType(File.class).describedAs("file");
        OptionSpec<Void> dumpOption = parser.accepts("dump-macros",
                "Prints the final macro table as JSON.");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Files to process.");

        DefaultPreprocessorListener listener = new DefaultPreprocessorListener();
        Preprocessor pp = new Preprocessor();
        pp.setListener(listener);
        try {
            OptionSet options = parser.parse(args);

            if (options.has(helpOption)) {
                parser.printHelpOn(out);
                return 0;
            }

            if (options.has(debugOption))
                pp.addFeature(Feature.DEBUG);
            if (options.has(pedanticOption))
                pp.addFeature(Feature.PEDANTIC);
            if (options.has(gnuOption))
                pp.addFeature(Feature.GNU_COMMA_PASTE);
            pp.setMaxExpansionSteps(options.valueOf(stepsOption));

            if (options.has(noWarningOption))
                pp.getWarnings().clear();

            for (String warning : options.valuesOf(warningOption)) {
                warning = warning.toUpperCase(Locale.ROOT);
                warning = warning.replace('-', '_');
                if (warning.equals("ALL"))
                    pp.addWarnings(EnumSet.allOf(Warning.class));
                else
                    pp.addWarning(Enum.valueOf(Warning.class, warning));
            }

            for (String arg : options.valuesOf(defineOption)) {
                int idx = arg.indexOf('=');
                if (idx == -1)
                    pp.addMacro(arg);
                else
                    pp.addMacro(arg.substring(0, idx), arg.substring(idx + 1));
            }
            for (String arg : options.valuesOf(undefineOption)) {
                pp.getMacroTable().undef(arg);
            }

            List<File> inputs = options.valuesOf(inputsOption);
            if (inputs.isEmpty()) {
                String text = IOUtils.toString(System.in, StandardCharsets.UTF_8);
                pp.addInput(new StringLexerSource(text, "<stdin>"));
            } else {
                for (File input : inputs)
                    pp.addInput(new FileLexerSource(input));
            }

            StringBuilder buf = new StringBuilder();
            TokenPrinter printer = new TokenPrinter(buf);
            try {
                for (;;) {
                    Token tok = pp.token();
                    if (tok.getKind() == TokenKind.EOF)
                        break;
                    printer.print(tok);
                }
                printer.finish();
            } finally {
                /* Whatever was produced before a fatal error is still written. */
                if (options.has(outputOption))
                    FileUtils.writeStringToFile(options.valueOf(outputOption), buf.toString(), StandardCharsets.UTF_8);
                else
                    out.print(buf);
            }

            if (options.has(dumpOption)) {
                Gson gson = new GsonBuilder().setPrettyPrinting().create();
                out.println(gson.toJson(pp.getMacroTable().toJson()));
            }
        } catch (OptionException | IllegalArgumentException e) {
            LOG.error("Bad command line: " + e.getMessage());
            parser.printHelpOn(System.err);
            return 2;
        } catch (PreprocessorException e) {
            LOG.error("Preprocessor failed: " + e.getMessage());
            return 1;
        } finally {
            pp.close();
        }

        return listener.getErrors() > 0 ? 1 : 0;
    }
}
