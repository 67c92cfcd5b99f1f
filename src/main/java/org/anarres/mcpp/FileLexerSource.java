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
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nonnull;

import org.apache.commons.io.FileUtils;

/**
 * A {@link Source} which lexes a file.
 *
 * The file is read eagerly and decoded as UTF-8. Its path is the
 * name seen by __FILE__.
 */
public class FileLexerSource extends LexerSource {

    private final File file;

    public FileLexerSource(@Nonnull File file)
            throws IOException {
        super(new StringReader(FileUtils.readFileToString(file, StandardCharsets.UTF_8)), file.getPath());
        this.file = file;
    }

    @Nonnull
    public File getFile() {
        return file;
    }

    @Override
    public String toString() {
        return "file " + file;
    }
}
