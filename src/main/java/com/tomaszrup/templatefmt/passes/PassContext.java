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

import java.util.Objects;
import java.util.Optional;

import com.tomaszrup.templatefmt.util.TargetVersion;

/**
 * Read-only inputs shared by all passes of one formatting run.
 */
public final class PassContext {

	private final String newline;
	private final TargetVersion targetVersion;

	public PassContext(String newline, Optional<TargetVersion> targetVersion) {
		this.newline = Objects.requireNonNull(newline, "newline");
		this.targetVersion = Objects.requireNonNull(targetVersion, "targetVersion").orElse(null);
	}

	/**
	 * @return the detected newline style; passes that synthesize line breaks use it
	 */
	public String getNewline() {
		return newline;
	}

	public Optional<TargetVersion> getTargetVersion() {
		return Optional.ofNullable(targetVersion);
	}
}
