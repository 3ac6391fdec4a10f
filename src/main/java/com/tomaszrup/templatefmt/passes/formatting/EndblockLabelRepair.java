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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.TemplateLexer;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.PassContext;
import com.tomaszrup.templatefmt.passes.TokenPass;

/**
 * Normalizes {@code {% endblock %}} labels: a block opened and closed on the
 * same line gets a bare {@code endblock}, a multi-line block gets
 * {@code endblock name}. Mismatched labels and unbalanced tags are left as
 * written.
 */
public class EndblockLabelRepair implements TokenPass {

	private static final Logger logger = LoggerFactory.getLogger(EndblockLabelRepair.class);

	private static final String BLOCK = "block";
	private static final String ENDBLOCK = "endblock";

	/** An open {@code block} tag: its label (may be null) and line. */
	private static final class OpenBlock {
		private final String label;
		private final int line;

		private OpenBlock(String label, int line) {
			this.label = label;
			this.line = line;
		}
	}

	@Override
	public String getName() {
		return "endblock-labels";
	}

	@Override
	public void apply(List<Token> tokens, PassContext context) {
		// Earlier passes may have removed line breaks.
		TemplateLexer.renumberLines(tokens);

		Deque<OpenBlock> stack = new ArrayDeque<>();
		for (Token token : tokens) {
			if (!token.isBlock()) {
				continue;
			}
			BlockToken tag = (BlockToken) token;
			List<String> bits = tag.getBits();
			if (BLOCK.equals(tag.getName())) {
				stack.push(new OpenBlock(bits.size() > 1 ? bits.get(1) : null, tag.getLine()));
			} else if (ENDBLOCK.equals(tag.getName()) && bits.size() <= 2) {
				OpenBlock open = stack.poll();
				if (open == null) {
					logger.debug("endblock without block on line {}", tag.getLine());
					continue;
				}
				repair(tag, open);
			}
		}
	}

	private void repair(BlockToken close, OpenBlock open) {
		List<String> bits = close.getBits();
		if (bits.size() == 2 && !bits.get(1).equals(open.label)) {
			logger.debug("endblock {} on line {} does not match block {} on line {}",
					bits.get(1), close.getLine(), open.label, open.line);
			return;
		}
		List<String> repaired = new ArrayList<>();
		repaired.add(ENDBLOCK);
		if (open.line != close.getLine() && open.label != null) {
			repaired.add(open.label);
		}
		close.setBits(repaired);
	}
}
