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
package com.tomaszrup.templatefmt.expression;

import java.util.Objects;

/**
 * One {@code |name[:arg]} application in a filter expression.
 */
public final class Filter {

	private final String name;
	private Expression arg;

	public Filter(String name, Expression arg) {
		this.name = Objects.requireNonNull(name, "name");
		this.arg = arg;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the argument, or {@code null} when the filter takes none
	 */
	public Expression getArg() {
		return arg;
	}

	public void setArg(Expression arg) {
		this.arg = arg;
	}

	public boolean hasArg() {
		return arg != null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Filter)) {
			return false;
		}
		Filter other = (Filter) o;
		return name.equals(other.name) && Objects.equals(arg, other.arg);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arg);
	}

	@Override
	public String toString() {
		return arg == null ? "|" + name : "|" + name + ":" + arg;
	}
}
