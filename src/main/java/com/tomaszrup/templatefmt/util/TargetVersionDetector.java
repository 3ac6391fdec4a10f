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
package com.tomaszrup.templatefmt.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort detector for the template-language release a project targets,
 * read from the {@code django} requirement in a {@code pyproject.toml}.
 *
 * <p>Only the {@code [project]} table's {@code dependencies} array is
 * considered. The lower bound of the requirement ({@code >=}, {@code ~=} or
 * {@code ==}) is mapped to the newest supported release not newer than it.
 * This is a line-oriented scan, not a TOML parser: anything it cannot
 * understand simply yields no version.</p>
 */
public final class TargetVersionDetector {

    private static final Logger logger = LoggerFactory.getLogger(TargetVersionDetector.class);

    public static final String MANIFEST_FILE = "pyproject.toml";

    private static final Pattern TABLE_HEADER = Pattern.compile("^\\s*\\[([^\\[\\]]+)\\]\\s*(?:#.*)?$");
    private static final Pattern DEPENDENCIES_START = Pattern.compile("^\\s*dependencies\\s*=\\s*\\[(.*)$");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"|'([^']*)'");
    private static final Pattern REQUIREMENT = Pattern.compile(
            "^\\s*django\\s*(?:\\[[^\\]]*\\])?\\s*(?<spec>[<>=!~][^;]*)?(?:;.*)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LOWER_BOUND = Pattern.compile("(?:>=|~=|==)\\s*(\\d+)\\.(\\d+)");

    private TargetVersionDetector() {
    }

    /**
     * Detect the target release from {@code projectDir/pyproject.toml}.
     *
     * @param projectDir directory expected to contain the manifest
     * @return detected release if found
     */
    public static Optional<TargetVersion> detect(Path projectDir) {
        if (projectDir == null) {
            return Optional.empty();
        }
        Path manifest = projectDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        try {
            Optional<TargetVersion> version = detectFromManifest(Files.readString(manifest));
            logger.debug("Target version from {}: {}", manifest, version.map(TargetVersion::toString).orElse("<none>"));
            return version;
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", manifest, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Detect the target release from manifest text.
     */
    public static Optional<TargetVersion> detectFromManifest(String manifestText) {
        for (String requirement : projectDependencies(manifestText)) {
            Optional<TargetVersion> lowerBound = lowerBound(requirement);
            if (lowerBound.isPresent()) {
                return lowerBound.flatMap(TargetVersion::floorSupported);
            }
        }
        return Optional.empty();
    }

    static List<String> projectDependencies(String manifestText) {
        List<String> dependencies = new ArrayList<>();
        String table = "";
        boolean inArray = false;

        for (String line : manifestText.split("\\R")) {
            if (inArray) {
                inArray = collectQuoted(line, dependencies);
                continue;
            }
            Matcher header = TABLE_HEADER.matcher(line);
            if (header.matches()) {
                table = header.group(1).trim();
                continue;
            }
            if (!"project".equals(table)) {
                continue;
            }
            Matcher start = DEPENDENCIES_START.matcher(line);
            if (start.matches()) {
                inArray = collectQuoted(start.group(1), dependencies);
            }
        }
        return dependencies;
    }

    /**
     * Collect quoted strings from one line of an array.
     *
     * @return true if the array continues on the next line
     */
    private static boolean collectQuoted(String line, List<String> into) {
        String code = stripComment(line);
        Matcher m = QUOTED.matcher(code);
        int afterLast = 0;
        while (m.find()) {
            into.add(m.group(1) != null ? m.group(1) : m.group(2));
            afterLast = m.end();
        }
        return code.indexOf(']', afterLast) < 0;
    }

    private static String stripComment(String line) {
        boolean inDouble = false;
        boolean inSingle = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '#' && !inDouble && !inSingle) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    static Optional<TargetVersion> lowerBound(String requirement) {
        Matcher m = REQUIREMENT.matcher(requirement);
        if (!m.matches() || m.group("spec") == null) {
            return Optional.empty();
        }
        Matcher bound = LOWER_BOUND.matcher(m.group("spec"));
        if (!bound.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(TargetVersion.of(Integer.parseInt(bound.group(1)), Integer.parseInt(bound.group(2))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
