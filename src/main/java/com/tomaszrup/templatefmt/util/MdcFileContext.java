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

import org.slf4j.MDC;

import java.nio.file.Path;

/**
 * Manages the SLF4J MDC (Mapped Diagnostic Context) key {@code "file"} so
 * that every log line written while a template is formatted names that
 * template.
 *
 * <p>Paths under the working directory are shown relative to it (e.g.
 * {@code templates/base.html} instead of
 * {@code /home/user/site/templates/base.html}).</p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * MdcFileContext.setFile(path);
 * try {
 *     // ... all log calls inside here include the file
 * } finally {
 *     MdcFileContext.clear();
 * }
 * }</pre>
 */
public final class MdcFileContext {

    /** MDC key used in the logback pattern via {@code %X{file}}. */
    public static final String MDC_KEY = "file";

    /** Label used for standard input. */
    public static final String STDIN_LABEL = "stdin";

    private static volatile Path workingDirectory;

    private MdcFileContext() {
        // utility class
    }

    /**
     * Sets the directory that file labels are made relative to.
     *
     * @param directory the working directory, or null to always use absolute labels
     */
    public static void setWorkingDirectory(Path directory) {
        workingDirectory = directory == null ? null : directory.toAbsolutePath().normalize();
    }

    /**
     * Sets the MDC {@code "file"} key for the given template path; a null
     * path stands for standard input.
     *
     * @param file the template being formatted
     */
    public static void setFile(Path file) {
        MDC.put(MDC_KEY, label(file));
    }

    /**
     * Computes the label {@link #setFile(Path)} would put in the MDC.
     */
    public static String label(Path file) {
        if (file == null) {
            return STDIN_LABEL;
        }
        Path root = workingDirectory;
        Path absolute = file.toAbsolutePath().normalize();
        if (root != null && absolute.startsWith(root) && !absolute.equals(root)) {
            return root.relativize(absolute).toString().replace('\\', '/');
        }
        return file.toString();
    }

    /**
     * Removes the MDC {@code "file"} key from the current thread.
     */
    public static void clear() {
        MDC.remove(MDC_KEY);
    }
}
