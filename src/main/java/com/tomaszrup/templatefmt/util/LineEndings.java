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
package com.tomaszrup.templatefmt.util;

/**
 * Newline style detection. The style of the first line break wins.
 */
public final class LineEndings {

	public static final String LF = "\n";
	public static final String CRLF = "\r\n";

	private LineEndings() {
	}

	/**
	 * @return {@link #CRLF} if the first line break in {@code text} is
	 *         {@code \r\n}, otherwise {@link #LF}
	 */
	public static String detect(String text) {
		int newline = text.indexOf('\n');
		if (newline > 0 && text.charAt(newline - 1) == '\r') {
			return CRLF;
		}
		return LF;
	}
}
