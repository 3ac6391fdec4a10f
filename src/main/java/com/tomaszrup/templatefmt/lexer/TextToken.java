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

import java.util.Objects;

/**
 * Literal document text. Also used for tag-like text inside a verbatim
 * section, which keeps its original, untrimmed spelling.
 */
public final class TextToken extends Token {

	private String contents;

	public TextToken(String contents, int line) {
		super(line);
		this.contents = Objects.requireNonNull(contents, "contents");
	}

	@Override
	public TokenType getType() {
		return TokenType.TEXT;
	}

	public String getContents() {
		return contents;
	}

	public void setContents(String contents) {
		this.contents = Objects.requireNonNull(contents, "contents");
	}

	@Override
	public String toString() {
		return "Text(" + contents + ")@" + getLine();
	}
}
