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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateFormatterCliTests {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return TemplateFormatterCli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // ------------------------------------------------------------------
    // Usage
    // ------------------------------------------------------------------

    @Test
    void helpPrintsUsage() {
        assertEquals(0, run("", "--help"));
        assertTrue(stdout().contains("usage: template-formatter"));
        assertTrue(stdout().contains("--target-version"));
    }

    @Test
    void versionPrintsProgramName() {
        assertEquals(0, run("", "-V"));
        assertTrue(stdout().startsWith("template-formatter "));
    }

    @Test
    void missingFilenamesIsUsageError() {
        assertEquals(2, run(""));
        assertTrue(stderr().contains("no filenames given"));
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(2, run("", "--bogus", "-"));
        assertTrue(stderr().startsWith("error: "));
    }

    @Test
    void unsupportedTargetVersionIsUsageError() {
        assertEquals(2, run("", "--target-version", "1.0", "-"));
        assertTrue(stderr().contains("Allowed versions are"));
    }

    // ------------------------------------------------------------------
    // Formatting
    // ------------------------------------------------------------------

    @Test
    void rewritesFilesAndSummarizes(@TempDir Path dir) throws IOException {
        Path messy = dir.resolve("messy.html");
        Path clean = dir.resolve("clean.html");
        Files.writeString(messy, "{% load b %}{% load a %}", StandardCharsets.UTF_8);
        Files.writeString(clean, "<p>ok</p>\n", StandardCharsets.UTF_8);

        assertEquals(1, run("", messy.toString(), clean.toString()));
        assertEquals("{% load a b %}\n", Files.readString(messy, StandardCharsets.UTF_8));
        assertTrue(stderr().contains("1 file reformatted, 1 file already formatted"));
    }

    @Test
    void cleanFilesExitWithZero(@TempDir Path dir) throws IOException {
        Path clean = dir.resolve("clean.html");
        Files.writeString(clean, "<p>ok</p>\n", StandardCharsets.UTF_8);

        assertEquals(0, run("", "--target-version", "5.2", clean.toString()));
        assertTrue(stderr().contains("1 file already formatted"));
    }

    @Test
    void checkModeReportsWithoutWriting(@TempDir Path dir) throws IOException {
        Path messy = dir.resolve("messy.html");
        Files.writeString(messy, "{{ a | b }}", StandardCharsets.UTF_8);

        assertEquals(1, run("", "--check", messy.toString()));
        assertEquals("{{ a | b }}", Files.readString(messy, StandardCharsets.UTF_8));
        assertTrue(stderr().contains("Would reformat: "));
        assertTrue(stderr().contains("1 file would be reformatted"));
    }

    @Test
    void stdinToStdout() {
        assertEquals(0, run("{% ifequal a b %}\n{% endifequal %}", "--target-version", "3.1", "-"));
        assertEquals("{% if a == b %}\n{% endif %}\n", stdout());
        assertTrue(stderr().contains("1 file reformatted"));
    }

    @Test
    void missingFileCountsAsFailure(@TempDir Path dir) {
        assertEquals(1, run("", "--target-version", "4.2", dir.resolve("nope.html").toString()));
        assertTrue(stderr().contains("1 file failed to format"));
    }
}
