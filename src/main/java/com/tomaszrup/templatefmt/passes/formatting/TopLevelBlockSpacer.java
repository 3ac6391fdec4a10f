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
 * In a child template, puts exactly one blank line between consecutive
 * top-level tags ({@code extends} and top-level {@code block}/{@code endblock})
 * when only whitespace separates them.
 */
public class TopLevelBlockSpacer implements TokenPass {

	@Override
	public String getName() {
		return "top-level-spacing";
	}

	@Override
	public void apply(List<Token> tokens, PassContext context) {
		String blankLine = context.getNewline() + context.getNewline();
		int lastTopLevel = -1;
		int depth = 0;

		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (!token.isBlock()) {
				continue;
			}
			String name = ((BlockToken) token).getName();
			if (TopLevelBlockUnindenter.EXTENDS.equals(name)) {
				lastTopLevel = i;
			} else if (TopLevelBlockUnindenter.BLOCK.equals(name)) {
				if (lastTopLevel >= 0 && depth == 0) {
					if (i == lastTopLevel + 2 && tokens.get(i - 1).isWhitespaceText()) {
						((TextToken) tokens.get(i - 1)).setContents(blankLine);
					}
					lastTopLevel = i;
				}
				depth++;
			} else if (TopLevelBlockUnindenter.ENDBLOCK.equals(name)) {
				depth = Math.max(0, depth - 1);
				if (lastTopLevel >= 0 && depth == 0) {
					lastTopLevel = i;
				}
			}
		}
	}
}
