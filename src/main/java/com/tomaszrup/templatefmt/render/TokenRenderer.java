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
package com.tomaszrup.templatefmt.render;

import java.util.List;

import com.tomaszrup.templatefmt.expression.Expression;
import com.tomaszrup.templatefmt.expression.Filter;
import com.tomaszrup.templatefmt.expression.FilterExpression;
import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.CommentToken;
import com.tomaszrup.templatefmt.lexer.TextToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.lexer.VariableToken;

/**
 * Serializes tokens back to template text with canonical tag spacing:
 * one space inside each delimiter, bits joined by single spaces and no
 * spaces around filter separators.
 */
public final class TokenRenderer {

	private TokenRenderer() {
	}

	public static String render(List<Token> tokens) {
		StringBuilder sb = new StringBuilder();
		for (Token token : tokens) {
			appendToken(sb, token);
		}
		return sb.toString();
	}

	static void appendToken(StringBuilder sb, Token token) {
		switch (token.getType()) {
			case TEXT:
				sb.append(((TextToken) token).getContents());
				break;
			case VARIABLE:
				sb.append("{{ ").append(render(((VariableToken) token).getExpression())).append(" }}");
				break;
			case BLOCK:
				sb.append("{% ").append(String.join(" ", ((BlockToken) token).getBits())).append(" %}");
				break;
			case COMMENT:
				sb.append("{# ").append(((CommentToken) token).getContents()).append(" #}");
				break;
			default:
				throw new IllegalStateException("Unknown token type: " + token.getType());
		}
	}

	public static String render(FilterExpression expression) {
		StringBuilder sb = new StringBuilder(render(expression.getBase()));
		for (Filter filter : expression.getFilters()) {
			sb.append('|').append(filter.getName());
			if (filter.hasArg()) {
				sb.append(':').append(render(filter.getArg()));
			}
		}
		return sb.toString();
	}

	public static String render(Expression expression) {
		return expression.getValue();
	}
}
