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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.formatting.EdgeWhitespacePass;
import com.tomaszrup.templatefmt.passes.formatting.EndblockLabelRepair;
import com.tomaszrup.templatefmt.passes.formatting.LoadTagMerger;
import com.tomaszrup.templatefmt.passes.formatting.TopLevelBlockSpacer;
import com.tomaszrup.templatefmt.passes.formatting.TopLevelBlockUnindenter;
import com.tomaszrup.templatefmt.passes.migrations.EmptyJsonScriptMigration;
import com.tomaszrup.templatefmt.passes.migrations.IfEqualMigration;
import com.tomaszrup.templatefmt.passes.migrations.LengthIsMigration;
import com.tomaszrup.templatefmt.passes.migrations.StaticLoaderMigration;
import com.tomaszrup.templatefmt.passes.migrations.TranslationTagMigration;

/**
 * An ordered list of passes applied to one token sequence.
 *
 * <p>The order of {@link #standard()} matters: later passes expect the shapes
 * earlier ones produce (for example, label repair sees migrated tag names and
 * merged load tags).</p>
 */
public final class TokenPipeline {

	private static final Logger logger = LoggerFactory.getLogger(TokenPipeline.class);

	private final List<TokenPass> passes;

	public TokenPipeline(List<TokenPass> passes) {
		this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
	}

	/**
	 * Migrations first (newest first), then the formatting passes.
	 */
	public static TokenPipeline standard() {
		List<TokenPass> passes = new ArrayList<>();
		passes.add(new LengthIsMigration());
		passes.add(new EmptyJsonScriptMigration());
		passes.add(new TranslationTagMigration());
		passes.add(new IfEqualMigration());
		passes.add(new StaticLoaderMigration());

		passes.add(new EdgeWhitespacePass());
		passes.add(new LoadTagMerger());
		passes.add(new EndblockLabelRepair());
		passes.add(new TopLevelBlockUnindenter());
		passes.add(new TopLevelBlockSpacer());
		return new TokenPipeline(passes);
	}

	public List<TokenPass> getPasses() {
		return passes;
	}

	public void apply(List<Token> tokens, PassContext context) {
		for (TokenPass pass : passes) {
			pass.apply(tokens, context);
			if (logger.isTraceEnabled()) {
				logger.trace("After {}: {} tokens", pass.getName(), tokens.size());
			}
		}
	}
}
