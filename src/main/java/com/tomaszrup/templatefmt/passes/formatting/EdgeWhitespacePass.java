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

import java.util.List;

import com.tomaszrup.templatefmt.lexer.TextToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.PassContext;
import com.tomaszrup.templatefmt.passes.TokenPass;
import com.tomaszrup.templatefmt.util.LineEndings;

/**
 * Removes blank lines at the start of the document and makes it end with
 * exactly one newline.
 *
 * <p>Leading whitespace is only removed up to the last line break before the
 * first visible character, so the first line keeps its indentation. A
 * document with nothing visible left becomes a single {@code \n} whatever
 * its line endings.</p>
 */
public class EdgeWhitespacePass implements TokenPass {

	@Override
	public String getName() {
		return "edge-whitespace";
	}

	@Override
	public void apply(List<Token> tokens, PassContext context) {
		stripLeadingBlankLines(tokens);
		ensureSingleTrailingNewline(tokens, context.getNewline());
	}

	private void stripLeadingBlankLines(List<Token> tokens) {
		if (tokens.isEmpty() || !tokens.get(0).isText()) {
			return;
		}
		TextToken first = (TextToken) tokens.get(0);
		String contents = first.getContents();
		int firstVisible = 0;
		while (firstVisible < contents.length() && isBlank(contents.charAt(firstVisible))) {
			firstVisible++;
		}
		int lastNewline = contents.lastIndexOf('\n', firstVisible - 1);
		if (lastNewline < 0) {
			return;
		}
		String stripped = contents.substring(lastNewline + 1);
		if (stripped.isEmpty()) {
			tokens.remove(0);
		} else {
			first.setContents(stripped);
		}
	}

	private void ensureSingleTrailingNewline(List<Token> tokens, String newline) {
		if (!hasVisibleContent(tokens)) {
			tokens.clear();
			tokens.add(new TextToken(LineEndings.LF, 1));
			return;
		}
		if (tokens.get(tokens.size() - 1).isText()) {
			TextToken last = (TextToken) tokens.get(tokens.size() - 1);
			last.setContents(stripTrailing(last.getContents()) + newline);
			return;
		}
		int line = tokens.get(tokens.size() - 1).getLine();
		tokens.add(new TextToken(newline, line));
	}

	private static String stripTrailing(String text) {
		int end = text.length();
		while (end > 0 && isBlank(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(0, end);
	}

	private static boolean hasVisibleContent(List<Token> tokens) {
		for (Token token : tokens) {
			if (!token.isText() || !stripTrailing(((TextToken) token).getContents()).isEmpty()) {
				return true;
			}
		}
		return false;
	}

	// Unicode spaces such as U+00A0 count as blank too.
	private static boolean isBlank(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}
}
