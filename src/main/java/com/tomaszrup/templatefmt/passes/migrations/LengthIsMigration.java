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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.expression.Filter;
import com.tomaszrup.templatefmt.expression.FilterExpression;
import com.tomaszrup.templatefmt.expression.FilterExpressionParser;
import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.MigrationPass;
import com.tomaszrup.templatefmt.render.TokenRenderer;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Rewrites {@code {% if x|length_is:n %}} to {@code {% if x|length == n %}}.
 *
 * <p>Only a tag with exactly one argument bit, consisting of a value and a
 * single {@code length_is} filter with an argument, is rewritten. Compound
 * conditions such as {@code x|length_is:1 and y} are left alone.</p>
 */
public class LengthIsMigration extends MigrationPass {

	private static final Logger logger = LoggerFactory.getLogger(LengthIsMigration.class);

	private static final String LENGTH_IS = "length_is";

	public LengthIsMigration() {
		super("length-is", TargetVersion.of(4, 2));
	}

	@Override
	protected void migrate(List<Token> tokens) {
		for (Token token : tokens) {
			if (!token.isBlock()) {
				continue;
			}
			BlockToken block = (BlockToken) token;
			List<String> bits = block.getBits();
			if (bits.size() != 2) {
				continue;
			}
			FilterExpression expression = FilterExpressionParser.parse(bits.get(1));
			if (expression.isUnparsed() || expression.getFilters().size() != 1) {
				continue;
			}
			Filter filter = expression.getFilters().get(0);
			if (!LENGTH_IS.equals(filter.getName()) || !filter.hasArg()) {
				continue;
			}
			bits.set(1, TokenRenderer.render(expression.getBase()) + "|length");
			bits.add("==");
			bits.add(TokenRenderer.render(filter.getArg()));
			logger.debug("Migrated length_is on line {}", block.getLine());
		}
	}
}
