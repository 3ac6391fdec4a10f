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
package com.tomaszrup.templatefmt.lexer;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BitSplitterTests {

	@Test
	void testSplitsOnWhitespace() {
		Assertions.assertEquals(List.of("if", "a", "and", "b"), BitSplitter.split("if a  and\tb"));
	}

	@Test
	void testEmptyInterior() {
		Assertions.assertTrue(BitSplitter.split("").isEmpty());
	}

	@Test
	void testQuotedStringKeepsSpaces() {
		Assertions.assertEquals(List.of("url", "'some view'", "arg"), BitSplitter.split("url 'some view' arg"));
	}

	@Test
	void testQuotedStringGluedToText() {
		Assertions.assertEquals(List.of("with", "x=\"a b\"", "y"), BitSplitter.split("with x=\"a b\" y"));
	}

	@Test
	void testEscapedQuoteInsideString() {
		Assertions.assertEquals(List.of("x", "'it\\'s here'"), BitSplitter.split("x 'it\\'s here'"));
	}

	@Test
	void testUnterminatedQuoteFallsBackToWhitespaceSplit() {
		Assertions.assertEquals(List.of("x", "'abc", "def"), BitSplitter.split("x 'abc def"));
	}

	@Test
	void testTranslationWrapperIsOneBit() {
		Assertions.assertEquals(List.of("trans", "_(\"Hello world\")"), BitSplitter.split("trans _(\"Hello world\")"));
	}

	@Test
	void testTranslationWrapperCutByWhitespaceIsRejoined() {
		Assertions.assertEquals(List.of("trans", "_(\"Hello\" \"world\")", "noop"),
				BitSplitter.split("trans _(\"Hello\" \"world\") noop"));
	}

	@Test
	void testUnterminatedTranslationWrapperTakesTheRest() {
		Assertions.assertEquals(List.of("x", "_('a b c"), BitSplitter.split("x _('a b c"));
	}

	@Test
	void testSmartSplitDoesNotJoinWrappers() {
		Assertions.assertEquals(List.of("_(\"a\"", "\"b\")"), BitSplitter.smartSplit("_(\"a\" \"b\")"));
	}
}
