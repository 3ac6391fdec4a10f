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
 * A single value inside a variable tag: the base of a filter expression or a
 * filter argument. The value is kept exactly as written in the template, so
 * a constant keeps its quotes (and translation wrapper, if any).
 */
public final class Expression {

	public enum Kind {
		CONSTANT,   // "text", 'text', _("text"), _('text')
		VARIABLE,   // dotted.path or a numeric literal
		UNPARSED    // verbatim fallback after a syntax error
	}

	private final Kind kind;
	private final String value;

	private Expression(Kind kind, String value) {
		this.kind = kind;
		this.value = Objects.requireNonNull(value, "value");
	}

	public static Expression constant(String literal) {
		return new Expression(Kind.CONSTANT, literal);
	}

	public static Expression variable(String name) {
		return new Expression(Kind.VARIABLE, name);
	}

	public static Expression unparsed(String text) {
		return new Expression(Kind.UNPARSED, text);
	}

	public Kind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	public boolean isConstant() {
		return kind == Kind.CONSTANT;
	}

	public boolean isUnparsed() {
		return kind == Kind.UNPARSED;
	}

	/**
	 * @return true for a plain empty string literal, {@code ''} or {@code ""}
	 */
	public boolean isEmptyStringConstant() {
		return kind == Kind.CONSTANT && ("''".equals(value) || "\"\"".equals(value));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Expression)) {
			return false;
		}
		Expression other = (Expression) o;
		return kind == other.kind && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, value);
	}

	@Override
	public String toString() {
		return kind + "(" + value + ")";
	}
}
