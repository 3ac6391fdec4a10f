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

/**
 * A single lexed piece of a template document.
 *
 * <p>Tokens are owned by exactly one formatting run: the lexer creates them,
 * the passes mutate them in place and the renderer consumes them. The line
 * number is the 1-based line on which the token's source text starts.</p>
 */
public abstract class Token {

	private int line;

	protected Token(int line) {
		this.line = line;
	}

	public abstract TokenType getType();

	public int getLine() {
		return line;
	}

	void setLine(int line) {
		this.line = line;
	}

	public boolean isText() {
		return getType() == TokenType.TEXT;
	}

	public boolean isBlock() {
		return getType() == TokenType.BLOCK;
	}

	/**
	 * @return true if this is a {@link TextToken} made only of whitespace
	 *         (an empty text counts as whitespace)
	 */
	public boolean isWhitespaceText() {
		return isText() && ((TextToken) this).getContents().isBlank();
	}

	/**
	 * @return true if this is a {@link BlockToken} whose tag name equals {@code name}
	 */
	public boolean isBlockNamed(String name) {
		return isBlock() && ((BlockToken) this).getName().equals(name);
	}
}
