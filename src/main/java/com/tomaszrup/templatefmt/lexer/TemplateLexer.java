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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tomaszrup.templatefmt.expression.FilterExpressionParser;

/**
 * Splits template text into {@link Token}s.
 *
 * <p>Tags are found with a shortest-match scan for the three delimiter
 * pairs; a tag never spans a line break. Text between tags becomes
 * {@link TextToken}s. The only state carried across tags is the verbatim
 * terminator: while it is set, every tag except the matching
 * {@code endverbatim} is kept as raw text.</p>
 *
 * <p>Each call works on its own {@link LexState}, so the lexer is
 * re-entrant and can be started inside a verbatim section for testing.</p>
 */
public final class TemplateLexer {

	static final String BLOCK_TAG_START = "{%";
	static final String VARIABLE_TAG_START = "{{";
	static final String COMMENT_TAG_START = "{#";

	private static final Pattern TAG_PATTERN =
			Pattern.compile("\\{%[^\\n]*?%\\}|\\{\\{[^\\n]*?\\}\\}|\\{#[^\\n]*?#\\}");

	private static final String VERBATIM = "verbatim";

	/**
	 * Mutable lexer state for one lexing run.
	 */
	static final class LexState {
		/** Interior expected to close the current verbatim section, or null outside one. */
		private String verbatimTerminator;
		private int line = 1;

		LexState(String verbatimTerminator) {
			this.verbatimTerminator = verbatimTerminator;
		}

		String getVerbatimTerminator() {
			return verbatimTerminator;
		}

		int getLine() {
			return line;
		}
	}

	private TemplateLexer() {
	}

	public static List<Token> lex(String text) {
		return lex(text, (String) null);
	}

	/**
	 * Lex {@code text}, starting in verbatim mode when {@code verbatimTerminator}
	 * is not null (for example {@code "endverbatim"}).
	 */
	public static List<Token> lex(String text, String verbatimTerminator) {
		return lex(text, new LexState(verbatimTerminator));
	}

	static List<Token> lex(String text, LexState state) {
		List<Token> result = new ArrayList<>();
		Matcher m = TAG_PATTERN.matcher(text);
		int lastEnd = 0;

		while (m.find()) {
			if (m.start() > lastEnd) {
				addText(result, text.substring(lastEnd, m.start()), state);
			}
			String tag = m.group();
			result.add(createTagToken(tag, state));
			state.line += countNewlines(tag);
			lastEnd = m.end();
		}

		if (lastEnd < text.length()) {
			addText(result, text.substring(lastEnd), state);
		}
		return result;
	}

	private static void addText(List<Token> result, String text, LexState state) {
		result.add(new TextToken(text, state.line));
		state.line += countNewlines(text);
	}

	static Token createTagToken(String tag, LexState state) {
		String content = tag.substring(2, tag.length() - 2).strip();

		if (tag.startsWith(BLOCK_TAG_START)) {
			if (state.verbatimTerminator != null) {
				if (!content.equals(state.verbatimTerminator)) {
					return new TextToken(tag, state.line);
				}
				state.verbatimTerminator = null;
			} else if (content.startsWith(VERBATIM)) {
				state.verbatimTerminator = "end" + content;
			}
			return new BlockToken(BitSplitter.split(content), state.line);
		}

		if (state.verbatimTerminator != null) {
			return new TextToken(tag, state.line);
		}
		if (tag.startsWith(VARIABLE_TAG_START)) {
			return new VariableToken(FilterExpressionParser.parse(content), state.line);
		}
		return new CommentToken(content, state.line);
	}

	static int countNewlines(String text) {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}

	/**
	 * Recompute every token's line number from the current token contents.
	 * Passes that delete whitespace text call this before relying on lines.
	 */
	public static void renumberLines(List<Token> tokens) {
		int line = 1;
		for (Token token : tokens) {
			token.setLine(line);
			if (token.isText()) {
				line += countNewlines(((TextToken) token).getContents());
			}
		}
	}
}
