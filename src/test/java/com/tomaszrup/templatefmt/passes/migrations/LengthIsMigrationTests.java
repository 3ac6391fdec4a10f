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

import static com.tomaszrup.templatefmt.passes.PassTestSupport.run;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.templatefmt.util.TargetVersion;

class LengthIsMigrationTests {

	private static final TargetVersion V4_2 = TargetVersion.of(4, 2);

	private final LengthIsMigration migration = new LengthIsMigration();

	@Test
	void testRewritesSingleLengthIs() {
		Assertions.assertEquals("{% if eggs|length == 1 %}", run(migration, "{% if eggs|length_is:1 %}", V4_2));
	}

	@Test
	void testConstantArgument() {
		Assertions.assertEquals("{% if eggs|length == '3' %}", run(migration, "{% if eggs|length_is:'3' %}", V4_2));
	}

	@Test
	void testBelowMinimumVersion() {
		Assertions.assertEquals("{% if eggs|length_is:1 %}",
				run(migration, "{% if eggs|length_is:1 %}", TargetVersion.of(4, 1)));
	}

	@Test
	void testNoTargetVersion() {
		Assertions.assertEquals("{% if eggs|length_is:1 %}", run(migration, "{% if eggs|length_is:1 %}"));
	}

	@Test
	void testCompoundConditionIsLeftAlone() {
		Assertions.assertEquals("{% if eggs|length_is:1 and spam %}",
				run(migration, "{% if eggs|length_is:1 and spam %}", V4_2));
	}

	@Test
	void testVariableTagIsLeftAlone() {
		Assertions.assertEquals("{{ eggs|length_is:1 }}", run(migration, "{{ eggs|length_is:1 }}", V4_2));
	}

	@Test
	void testFilterWithoutArgumentIsLeftAlone() {
		Assertions.assertEquals("{% if eggs|length_is %}", run(migration, "{% if eggs|length_is %}", V4_2));
	}

	@Test
	void testChainedFiltersAreLeftAlone() {
		Assertions.assertEquals("{% if eggs|first|length_is:1 %}",
				run(migration, "{% if eggs|first|length_is:1 %}", V4_2));
	}
}
