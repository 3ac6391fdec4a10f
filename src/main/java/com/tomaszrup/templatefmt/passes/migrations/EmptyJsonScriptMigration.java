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

import com.tomaszrup.templatefmt.expression.Filter;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.lexer.VariableToken;
import com.tomaszrup.templatefmt.passes.MigrationPass;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Drops the empty-string argument of {@code json_script}, which became
 * optional: {@code {{ x|json_script:"" }}} becomes {@code {{ x|json_script }}}.
 */
public class EmptyJsonScriptMigration extends MigrationPass {

	private static final String JSON_SCRIPT = "json_script";

	public EmptyJsonScriptMigration() {
		super("empty-json-script", TargetVersion.of(4, 1));
	}

	@Override
	protected void migrate(List<Token> tokens) {
		for (Token token : tokens) {
			if (!(token instanceof VariableToken)) {
				continue;
			}
			for (Filter filter : ((VariableToken) token).getExpression().getFilters()) {
				if (JSON_SCRIPT.equals(filter.getName()) && filter.hasArg()
						&& filter.getArg().isEmptyStringConstant()) {
					filter.setArg(null);
				}
			}
		}
	}
}
