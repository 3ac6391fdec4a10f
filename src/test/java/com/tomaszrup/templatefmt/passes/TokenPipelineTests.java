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
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.templatefmt.lexer.TextToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.util.LineEndings;
import com.tomaszrup.templatefmt.util.TargetVersion;

class TokenPipelineTests {

	@Test
	void testStandardOrder() {
		List<String> names = TokenPipeline.standard().getPasses().stream()
				.map(TokenPass::getName)
				.collect(Collectors.toList());

		Assertions.assertEquals(List.of(
				"length-is", "empty-json-script", "translation-tags", "ifequal", "static-loader",
				"edge-whitespace", "load-merge", "endblock-labels", "top-level-unindent", "top-level-spacing"),
				names);
	}

	@Test
	void testMigrationsRunBeforeFormatting() {
		List<TokenPass> passes = TokenPipeline.standard().getPasses();
		for (int i = 0; i < passes.size(); i++) {
			Assertions.assertEquals(i < 5, passes.get(i) instanceof MigrationPass, passes.get(i).getName());
		}
	}

	@Test
	void testMigrationThresholds() {
		List<String> thresholds = TokenPipeline.standard().getPasses().stream()
				.filter(pass -> pass instanceof MigrationPass)
				.map(pass -> pass.getName() + "@" + ((MigrationPass) pass).getMinimumVersion())
				.collect(Collectors.toList());

		Assertions.assertEquals(List.of(
				"length-is@4.2", "empty-json-script@4.1", "translation-tags@3.1", "ifequal@3.1", "static-loader@2.1"),
				thresholds);
	}

	@Test
	void testPassesAppliedInOrder() {
		List<String> seen = new ArrayList<>();
		TokenPipeline pipeline = new TokenPipeline(List.of(new RecordingPass("first", seen), new RecordingPass("second", seen)));

		List<Token> tokens = new ArrayList<>();
		tokens.add(new TextToken("", 1));
		pipeline.apply(tokens, new PassContext(LineEndings.LF, Optional.empty()));

		Assertions.assertEquals(List.of("first", "second"), seen);
		Assertions.assertEquals("first;second;", ((TextToken) tokens.get(0)).getContents());
	}

	@Test
	void testPassListIsImmutable() {
		Assertions.assertThrows(UnsupportedOperationException.class,
				() -> TokenPipeline.standard().getPasses().clear());
	}

	@Test
	void testMigrationGate() {
		MigrationPass pass = new MigrationPass("probe", TargetVersion.of(3, 1)) {
			@Override
			protected void migrate(List<Token> tokens) {
				tokens.clear();
			}
		};

		Assertions.assertFalse(pass.isEnabledFor(Optional.empty()));
		Assertions.assertFalse(pass.isEnabledFor(Optional.of(TargetVersion.of(3, 0))));
		Assertions.assertTrue(pass.isEnabledFor(Optional.of(TargetVersion.of(3, 1))));
		Assertions.assertTrue(pass.isEnabledFor(Optional.of(TargetVersion.of(4, 0))));

		List<Token> tokens = new ArrayList<>(List.of(new TextToken("x", 1)));
		pass.apply(tokens, new PassContext(LineEndings.LF, Optional.of(TargetVersion.of(2, 2))));
		Assertions.assertEquals(1, tokens.size());
		pass.apply(tokens, new PassContext(LineEndings.LF, Optional.of(TargetVersion.of(3, 2))));
		Assertions.assertTrue(tokens.isEmpty());
	}

	private static final class RecordingPass implements TokenPass {
		private final String name;
		private final List<String> seen;

		private RecordingPass(String name, List<String> seen) {
			this.name = name;
			this.seen = seen;
		}

		@Override
		public String getName() {
			return name;
		}

		@Override
		public void apply(List<Token> tokens, PassContext context) {
			seen.add(name);
			TextToken text = (TextToken) tokens.get(0);
			text.setContents(text.getContents() + name + ";");
		}
	}
}
