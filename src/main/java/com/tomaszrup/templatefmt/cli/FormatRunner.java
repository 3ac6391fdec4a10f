////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.templatefmt.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.TemplateFormatter;
import com.tomaszrup.templatefmt.util.MdcFileContext;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Formats files (or standard input, named {@code -}) one at a time and
 * reports what happened to each.
 */
class FormatRunner {

    private static final Logger logger = LoggerFactory.getLogger(FormatRunner.class);

    static final String STDIN_NAME = "-";

    private final TemplateFormatter formatter;
    private final Optional<TargetVersion> targetVersion;
    private final boolean check;
    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    FormatRunner(TemplateFormatter formatter, Optional<TargetVersion> targetVersion, boolean check,
            InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.formatter = formatter;
        this.targetVersion = targetVersion;
        this.check = check;
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    FileOutcome formatPath(String name) {
        boolean isStdin = STDIN_NAME.equals(name);
        Path path = isStdin ? null : Paths.get(name);
        MdcFileContext.setFile(path);
        try {
            return isStdin ? formatStdin() : formatFile(path);
        } catch (IOException e) {
            logger.error("Failed to format {}: {}", name, e.toString());
            stderr.println("error: " + MdcFileContext.label(path) + ": " + describe(e));
            return FileOutcome.FAILED;
        } finally {
            MdcFileContext.clear();
        }
    }

    private FileOutcome formatFile(Path path) throws IOException {
        String original = Files.readString(path, StandardCharsets.UTF_8);
        String formatted = formatter.format(original, targetVersion);
        if (formatted.equals(original)) {
            logger.debug("Already formatted");
            return FileOutcome.UNCHANGED;
        }
        if (check) {
            stderr.println("Would reformat: " + path);
            return FileOutcome.WOULD_REFORMAT;
        }
        Files.writeString(path, formatted, StandardCharsets.UTF_8);
        logger.debug("Reformatted");
        return FileOutcome.REFORMATTED;
    }

    private FileOutcome formatStdin() throws IOException {
        byte[] bytes = stdin.readAllBytes();
        String original = StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        String formatted = formatter.format(original, targetVersion);
        boolean changed = !formatted.equals(original);
        if (check) {
            if (changed) {
                stderr.println("Would reformat: " + MdcFileContext.STDIN_LABEL);
                return FileOutcome.WOULD_REFORMAT;
            }
            return FileOutcome.UNCHANGED;
        }
        byte[] out = formatted.getBytes(StandardCharsets.UTF_8);
        stdout.write(out, 0, out.length);
        stdout.flush();
        return changed ? FileOutcome.REFORMATTED : FileOutcome.UNCHANGED;
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        if (message == null || message.isEmpty()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
