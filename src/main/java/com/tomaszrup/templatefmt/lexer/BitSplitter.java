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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the interior of a block tag into bits.
 *
 * <p>Whitespace separates bits, except inside single- or double-quoted
 * strings (which may contain backslash-escaped quotes). A translated string
 * literal such as {@code _("Hello world")} is re-joined into one bit even
 * though the whitespace split cuts it apart.</p>
 */
public final class BitSplitter {

	// A run of non-quote characters glued to one or more quoted segments, or any other non-space run.
	private static final Pattern SMART_SPLIT = Pattern.compile(
			"((?:[^\\s'\"]*(?:(?:\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*')[^\\s'\"]*)+)|\\S+)",
			Pattern.UNICODE_CHARACTER_CLASS);

	private static final String TRANSLATION_DOUBLE = "_(\"";
	private static final String TRANSLATION_SINGLE = "_('";

	private BitSplitter() {
	}

	public static List<String> split(String interior) {
		List<String> rawBits = smartSplit(interior);
		List<String> bits = new ArrayList<>(rawBits.size());

		int i = 0;
		while (i < rawBits.size()) {
			String bit = rawBits.get(i++);
			if (bit.startsWith(TRANSLATION_DOUBLE) || bit.startsWith(TRANSLATION_SINGLE)) {
				String terminator = bit.charAt(2) + ")";
				StringBuilder joined = new StringBuilder(bit);
				String last = bit;
				while (!last.endsWith(terminator) && i < rawBits.size()) {
					last = rawBits.get(i++);
					joined.append(' ').append(last);
				}
				bit = joined.toString();
			}
			bits.add(bit);
		}
		return bits;
	}

	static List<String> smartSplit(String text) {
		List<String> out = new ArrayList<>();
		Matcher m = SMART_SPLIT.matcher(text);
		while (m.find()) {
			out.add(m.group());
		}
		return out;
	}
}
