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

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.TextToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.PassContext;
import com.tomaszrup.templatefmt.passes.TokenPass;

/**
 * In a child template (one that uses {@code {% extends %}}), removes the
 * indentation in front of top-level {@code block} and {@code endblock} tags.
 * Nested blocks keep their indentation.
 */
public class TopLevelBlockUnindenter implements TokenPass {

	static final String EXTENDS = "extends";
	static final String BLOCK = "block";
	static final String ENDBLOCK = "endblock";

	@Override
	public String getName() {
		return "top-level-unindent";
	}

	@Override
	public void apply(List<Token> tokens, PassContext context) {
		boolean seenExtends = false;
		int depth = 0;

		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (!token.isBlock()) {
				continue;
			}
			String name = ((BlockToken) token).getName();
			if (EXTENDS.equals(name)) {
				seenExtends = true;
			} else if (BLOCK.equals(name)) {
				if (seenExtends && depth == 0) {
					stripIndent(tokens, i);
				}
				depth++;
			} else if (ENDBLOCK.equals(name)) {
				depth = Math.max(0, depth - 1);
				if (seenExtends && depth == 0) {
					stripIndent(tokens, i);
				}
			}
		}
	}

	private static void stripIndent(List<Token> tokens, int tagIndex) {
		if (tagIndex == 0 || !tokens.get(tagIndex - 1).isText()) {
			return;
		}
		TextToken previous = (TextToken) tokens.get(tagIndex - 1);
		String contents = previous.getContents();
		int end = contents.length();
		while (end > 0 && (contents.charAt(end - 1) == ' ' || contents.charAt(end - 1) == '\t')) {
			end--;
		}
		previous.setContents(contents.substring(0, end));
	}
}
