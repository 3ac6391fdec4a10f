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
package com.tomaszrup.templatefmt.passes;

import java.util.List;

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.Token;

/**
 * Shape checks for {@code {% load %}} tags, shared by the migrations and
 * the load-merging pass.
 */
public final class LoadTags {

	public static final String LOAD = "load";
	public static final String FROM = "from";

	private LoadTags() {
	}

	public static boolean isLoad(Token token) {
		return token.isBlockNamed(LOAD);
	}

	/**
	 * @return true for {@code {% load name... from library %}}
	 */
	public static boolean isFromForm(BlockToken load) {
		List<String> bits = load.getBits();
		return bits.size() >= 4 && FROM.equals(bits.get(bits.size() - 2));
	}

	public static boolean isPlainLoad(Token token) {
		return isLoad(token) && !isFromForm((BlockToken) token);
	}
}
