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
package com.tomaszrup.templatefmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.tomaszrup.templatefmt.lexer.TemplateLexer;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.PassContext;
import com.tomaszrup.templatefmt.passes.TokenPipeline;
import com.tomaszrup.templatefmt.render.TokenRenderer;
import com.tomaszrup.templatefmt.util.LineEndings;
import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Formats template documents.
 *
 * <p>The document is lexed into tokens, run through the migrations allowed by
 * the target version and the formatting passes, and rendered back to text.
 * Formatting is a pure function of its inputs; one instance may be shared
 * between threads because each call works on its own token list.</p>
 */
public class TemplateFormatter {

	private final TokenPipeline pipeline;

	public TemplateFormatter() {
		this(TokenPipeline.standard());
	}

	public TemplateFormatter(TokenPipeline pipeline) {
		this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
	}

	/**
	 * Format without migrations.
	 */
	public String format(String text) {
		return format(text, Optional.empty());
	}

	/**
	 * Format {@code text}, applying every migration whose minimum version is
	 * not newer than {@code targetVersion}.
	 */
	public String format(String text, Optional<TargetVersion> targetVersion) {
		Objects.requireNonNull(text, "text");
		Objects.requireNonNull(targetVersion, "targetVersion");

		List<Token> tokens = new ArrayList<>(TemplateLexer.lex(text));
		pipeline.apply(tokens, new PassContext(LineEndings.detect(text), targetVersion));
		return TokenRenderer.render(tokens);
	}
}
