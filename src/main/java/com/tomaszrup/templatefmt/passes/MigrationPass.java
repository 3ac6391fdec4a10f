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
import java.util.Optional;

import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Base class for rewrites of deprecated syntax. A migration only runs when
 * a target version is known and is at least {@link #getMinimumVersion()}.
 */
public abstract class MigrationPass implements TokenPass {

	private final String name;
	private final TargetVersion minimumVersion;

	protected MigrationPass(String name, TargetVersion minimumVersion) {
		this.name = name;
		this.minimumVersion = minimumVersion;
	}

	@Override
	public String getName() {
		return name;
	}

	public TargetVersion getMinimumVersion() {
		return minimumVersion;
	}

	public boolean isEnabledFor(Optional<TargetVersion> targetVersion) {
		return targetVersion.map(v -> v.isAtLeast(minimumVersion)).orElse(false);
	}

	@Override
	public final void apply(List<Token> tokens, PassContext context) {
		if (isEnabledFor(context.getTargetVersion())) {
			migrate(tokens);
		}
	}

	protected abstract void migrate(List<Token> tokens);
}
