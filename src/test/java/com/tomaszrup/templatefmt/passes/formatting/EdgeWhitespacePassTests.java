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
package com.tomaszrup.templatefmt.passes.formatting;

import static com.tomaszrup.templatefmt.passes.PassTestSupport.run;

import java.util.Optional;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.templatefmt.util.LineEndings;

class EdgeWhitespacePassTests {

	private final EdgeWhitespacePass pass = new EdgeWhitespacePass();

	// ------------------------------------------------------------------
	// Leading whitespace
	// ------------------------------------------------------------------

	@Test
	void testLeadingBlankLinesRemovedIndentKept() {
		Assertions.assertEquals("  hello\n", run(pass, "\n \n  hello\n"));
	}

	@Test
	void testLeadingBlankLinesBeforeTag() {
		Assertions.assertEquals("{% block a %}\n", run(pass, "\n\n{% block a %}"));
	}

	@Test
	void testFirstLineIndentWithoutBlankLinesKept() {
		Assertions.assertEquals("  {{ x }}\n", run(pass, "  {{ x }}\n"));
	}

	@Test
	void testLeadingTagIsNotTouched() {
		Assertions.assertEquals("{{ x }}\n", run(pass, "{{ x }}"));
	}

	// ------------------------------------------------------------------
	// Trailing whitespace
	// ------------------------------------------------------------------

	@Test
	void testTrailingWhitespaceCollapsed() {
		Assertions.assertEquals("hello\n", run(pass, "hello   \n\n\n"));
	}

	@Test
	void testEmptyDocument() {
		Assertions.assertEquals("\n", run(pass, ""));
	}

	@Test
	void testWhitespaceOnlyDocument() {
		Assertions.assertEquals("\n", run(pass, "   \n \n"));
		Assertions.assertEquals("\n", run(pass, "   "));
	}

	@Test
	void testCrlfWhitespaceOnlyDocumentUsesLf() {
		Assertions.assertEquals("\n", run(pass, "\r\n\r\n", LineEndings.CRLF, Optional.empty()));
		Assertions.assertEquals("\n", run(pass, "  \r\n  ", LineEndings.CRLF, Optional.empty()));
	}

	@Test
	void testNonBreakingSpaceCountsAsBlank() {
		Assertions.assertEquals("hello\n", run(pass, "hello\u00a0\u00a0\n"));
		Assertions.assertEquals("x\n", run(pass, "\u00a0\nx"));
	}

	@Test
	void testCrlfTrailingNewline() {
		Assertions.assertEquals("a\r\n", run(pass, "a\r\n\r\n", LineEndings.CRLF, Optional.empty()));
		Assertions.assertEquals("{{ a }}\r\n", run(pass, "{{ a }}", LineEndings.CRLF, Optional.empty()));
	}
}
