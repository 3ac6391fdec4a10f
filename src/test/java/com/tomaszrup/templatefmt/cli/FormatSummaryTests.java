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

import static org.junit.jupiter.api.Assertions.assertEquals;

class FormatSummaryTests {

    @Test
    void emptySummary() {
        FormatSummary summary = new FormatSummary();

        assertEquals("", summary.message());
        assertEquals(FormatSummary.EXIT_OK, summary.exitCode());
    }

    @Test
    void messageUsesSingularAndPlural() {
        FormatSummary summary = new FormatSummary();
        summary.record(FileOutcome.REFORMATTED, false);
        summary.record(FileOutcome.UNCHANGED, false);
        summary.record(FileOutcome.UNCHANGED, false);
        summary.record(FileOutcome.FAILED, false);

        assertEquals("1 file reformatted, 2 files already formatted, 1 file failed to format", summary.message());
    }

    @Test
    void checkModeMessage() {
        FormatSummary summary = new FormatSummary();
        summary.record(FileOutcome.WOULD_REFORMAT, false);
        summary.record(FileOutcome.WOULD_REFORMAT, true);

        assertEquals("2 files would be reformatted", summary.message());
        assertEquals(2, summary.getWouldReformat());
    }

    @Test
    void reformattedStdinAloneIsNotAnError() {
        FormatSummary summary = new FormatSummary();
        summary.record(FileOutcome.REFORMATTED, true);

        assertEquals(FormatSummary.EXIT_OK, summary.exitCode());
        assertEquals(1, summary.getReformatted());
    }

    @Test
    void changesOrFailuresExitWithOne() {
        FormatSummary rewritten = new FormatSummary();
        rewritten.record(FileOutcome.REFORMATTED, false);
        assertEquals(FormatSummary.EXIT_CHANGED_OR_FAILED, rewritten.exitCode());

        FormatSummary wouldChange = new FormatSummary();
        wouldChange.record(FileOutcome.WOULD_REFORMAT, true);
        assertEquals(FormatSummary.EXIT_CHANGED_OR_FAILED, wouldChange.exitCode());

        FormatSummary failed = new FormatSummary();
        failed.record(FileOutcome.UNCHANGED, false);
        failed.record(FileOutcome.FAILED, true);
        assertEquals(FormatSummary.EXIT_CHANGED_OR_FAILED, failed.exitCode());
        assertEquals(1, failed.getUnchanged());
        assertEquals(1, failed.getFailed());
    }
}
