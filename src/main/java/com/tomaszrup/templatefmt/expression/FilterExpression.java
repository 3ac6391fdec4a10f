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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed interior of a variable tag: a base value followed by an ordered
 * chain of filters.
 */
public final class FilterExpression {

	private final Expression base;
	private final List<Filter> filters;

	public FilterExpression(Expression base, List<Filter> filters) {
		this.base = Objects.requireNonNull(base, "base");
		this.filters = new ArrayList<>(filters);
	}

	public static FilterExpression unparsed(String text) {
		return new FilterExpression(Expression.unparsed(text), List.of());
	}

	public Expression getBase() {
		return base;
	}

	/**
	 * Returns the live, mutable filter list.
	 */
	public List<Filter> getFilters() {
		return filters;
	}

	public boolean isUnparsed() {
		return base.isUnparsed();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FilterExpression)) {
			return false;
		}
		FilterExpression other = (FilterExpression) o;
		return base.equals(other.base) && filters.equals(other.filters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(base, filters);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(base.toString());
		for (Filter filter : filters) {
			sb.append(filter);
		}
		return sb.toString();
	}
}
