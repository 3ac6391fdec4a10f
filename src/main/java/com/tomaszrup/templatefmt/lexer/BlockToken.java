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

/**
 * A {@code {% ... %}} tag split into bits. {@code bits[0]} is the tag name.
 */
public final class BlockToken extends Token {

	private final List<String> bits;

	public BlockToken(List<String> bits, int line) {
		super(line);
		this.bits = new ArrayList<>(bits);
	}

	@Override
	public TokenType getType() {
		return TokenType.BLOCK;
	}

	/**
	 * Returns the live, mutable bit list. Passes edit it in place.
	 */
	public List<String> getBits() {
		return bits;
	}

	public void setBits(List<String> newBits) {
		List<String> copy = new ArrayList<>(newBits);
		bits.clear();
		bits.addAll(copy);
	}

	/**
	 * @return the tag name, or an empty string for an empty tag ({@code {% %}})
	 */
	public String getName() {
		return bits.isEmpty() ? "" : bits.get(0);
	}

	public int size() {
		return bits.size();
	}

	@Override
	public String toString() {
		return "Block" + bits + "@" + getLine();
	}
}
