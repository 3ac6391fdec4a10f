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
import java.util.Set;

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.LoadTags;
import com.tomaszrup.templatefmt.passes.MigrationPass;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Replaces the removed {@code admin_static} and {@code staticfiles}
 * libraries with {@code static} in {@code {% load %}} tags.
 */
public class StaticLoaderMigration extends MigrationPass {

	private static final Set<String> OLD_LIBRARIES = Set.of("admin_static", "staticfiles");
	private static final String STATIC = "static";

	public StaticLoaderMigration() {
		super("static-loader", TargetVersion.of(2, 1));
	}

	@Override
	protected void migrate(List<Token> tokens) {
		for (Token token : tokens) {
			if (!LoadTags.isLoad(token)) {
				continue;
			}
			BlockToken load = (BlockToken) token;
			List<String> bits = load.getBits();
			if (LoadTags.isFromForm(load)) {
				int last = bits.size() - 1;
				if (OLD_LIBRARIES.contains(bits.get(last))) {
					bits.set(last, STATIC);
				}
			} else {
				for (int i = 1; i < bits.size(); i++) {
					if (OLD_LIBRARIES.contains(bits.get(i))) {
						bits.set(i, STATIC);
					}
				}
			}
		}
	}
}
