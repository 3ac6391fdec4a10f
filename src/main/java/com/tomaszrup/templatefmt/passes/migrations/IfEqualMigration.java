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
package com.tomaszrup.templatefmt.passes.migrations;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.MigrationPass;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Rewrites {@code {% ifequal a b %}...{% endifequal %}} to
 * {@code {% if a == b %}...{% endif %}}, and {@code ifnotequal} to {@code !=}.
 *
 * <p>Opening and closing tags are paired with a stack first; only complete,
 * well-formed pairs are rewritten.</p>
 */
public class IfEqualMigration extends MigrationPass {

	private static final Logger logger = LoggerFactory.getLogger(IfEqualMigration.class);

	private static final String IFEQUAL = "ifequal";
	private static final String IFNOTEQUAL = "ifnotequal";
	private static final String END = "end";

	/** Token indexes of one matched opening/closing pair. */
	private static final class TagPair {
		private final int open;
		private final int close;

		private TagPair(int open, int close) {
			this.open = open;
			this.close = close;
		}
	}

	public IfEqualMigration() {
		super("ifequal", TargetVersion.of(3, 1));
	}

	@Override
	protected void migrate(List<Token> tokens) {
		List<TagPair> pairs = findPairs(tokens);
		for (int i = pairs.size() - 1; i >= 0; i--) {
			TagPair pair = pairs.get(i);
			BlockToken open = (BlockToken) tokens.get(pair.open);
			BlockToken close = (BlockToken) tokens.get(pair.close);
			List<String> bits = open.getBits();
			String operator = IFEQUAL.equals(open.getName()) ? "==" : "!=";
			open.setBits(Arrays.asList("if", bits.get(1), operator, bits.get(2)));
			close.setBits(List.of("endif"));
		}
	}

	private static List<TagPair> findPairs(List<Token> tokens) {
		List<TagPair> pairs = new ArrayList<>();
		Deque<Integer> stack = new ArrayDeque<>();

		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (!token.isBlock()) {
				continue;
			}
			BlockToken block = (BlockToken) token;
			String name = block.getName();
			if (isOpening(name) && block.size() == 3) {
				stack.push(i);
			} else if (isClosing(name) && block.size() == 1 && !stack.isEmpty()) {
				BlockToken open = (BlockToken) tokens.get(stack.peek());
				if (name.equals(END + open.getName())) {
					pairs.add(new TagPair(stack.pop(), i));
				} else {
					logger.debug("Unmatched {} on line {}", name, block.getLine());
				}
			}
		}
		return pairs;
	}

	private static boolean isOpening(String name) {
		return IFEQUAL.equals(name) || IFNOTEQUAL.equals(name);
	}

	private static boolean isClosing(String name) {
		return (END + IFEQUAL).equals(name) || (END + IFNOTEQUAL).equals(name);
	}
}
