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
import java.util.Map;

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.LoadTags;
import com.tomaszrup.templatefmt.passes.MigrationPass;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Renames {@code trans}/{@code blocktrans} to {@code translate}/{@code blocktranslate},
 * both as tag names and as names loaded with {@code {% load ... from i18n %}}.
 */
public class TranslationTagMigration extends MigrationPass {

	private static final Map<String, String> TAG_RENAMES = Map.of(
			"trans", "translate",
			"blocktrans", "blocktranslate",
			"endblocktrans", "endblocktranslate");

	private static final Map<String, String> LIBRARY_RENAMES = Map.of(
			"trans", "translate",
			"blocktrans", "blocktranslate");

	private static final String I18N = "i18n";

	public TranslationTagMigration() {
		super("translation-tags", TargetVersion.of(3, 1));
	}

	@Override
	protected void migrate(List<Token> tokens) {
		for (Token token : tokens) {
			if (!token.isBlock()) {
				continue;
			}
			BlockToken block = (BlockToken) token;
			List<String> bits = block.getBits();
			if (bits.isEmpty()) {
				continue;
			}
			String renamed = TAG_RENAMES.get(bits.get(0));
			if (renamed != null) {
				bits.set(0, renamed);
			} else if (isLoadFromI18n(block)) {
				for (int i = 1; i < bits.size() - 2; i++) {
					String library = LIBRARY_RENAMES.get(bits.get(i));
					if (library != null) {
						bits.set(i, library);
					}
				}
			}
		}
	}

	private static boolean isLoadFromI18n(BlockToken block) {
		List<String> bits = block.getBits();
		int size = bits.size();
		return LoadTags.LOAD.equals(block.getName()) && size >= 3
				&& LoadTags.FROM.equals(bits.get(size - 2)) && I18N.equals(bits.get(size - 1));
	}
}
