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

import java.util.ArrayList;
import java.util.List;

/**
 * Counts per-file outcomes and derives the summary line and exit code.
 */
public final class FormatSummary {

    static final int EXIT_OK = 0;
    static final int EXIT_CHANGED_OR_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private int reformatted;
    private int wouldReformat;
    private int unchanged;
    private int failed;
    /** Files rewritten on disk; a reformatted stdin does not count. */
    private int rewrittenOnDisk;

    public void record(FileOutcome outcome, boolean stdin) {
        switch (outcome) {
            case REFORMATTED:
                reformatted++;
                if (!stdin) {
                    rewrittenOnDisk++;
                }
                break;
            case WOULD_REFORMAT:
                wouldReformat++;
                break;
            case UNCHANGED:
                unchanged++;
                break;
            case FAILED:
                failed++;
                break;
            default:
                throw new IllegalArgumentException("Unknown outcome: " + outcome);
        }
    }

    public int getReformatted() {
        return reformatted;
    }

    public int getWouldReformat() {
        return wouldReformat;
    }

    public int getUnchanged() {
        return unchanged;
    }

    public int getFailed() {
        return failed;
    }

    public int exitCode() {
        if (rewrittenOnDisk > 0 || wouldReformat > 0 || failed > 0) {
            return EXIT_CHANGED_OR_FAILED;
        }
        return EXIT_OK;
    }

    /**
     * @return e.g. {@code "1 file reformatted, 2 files already formatted"}
     */
    public String message() {
        List<String> parts = new ArrayList<>();
        if (reformatted > 0) {
            parts.add(files(reformatted) + " reformatted");
        }
        if (wouldReformat > 0) {
            parts.add(files(wouldReformat) + " would be reformatted");
        }
        if (unchanged > 0) {
            parts.add(files(unchanged) + " already formatted");
        }
        if (failed > 0) {
            parts.add(files(failed) + " failed to format");
        }
        return String.join(", ", parts);
    }

    private static String files(int count) {
        return count + (count == 1 ? " file" : " files");
    }
}
