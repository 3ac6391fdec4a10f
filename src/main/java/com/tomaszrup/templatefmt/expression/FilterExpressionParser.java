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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the interior of a {@code {{ ... }}} tag into a {@link FilterExpression}.
 *
 * <p>The grammar is a leading constant or variable followed by any number of
 * {@code |filter} or {@code |filter:arg} applications. Whitespace is allowed
 * around the {@code |} separator only. Every match must start exactly where
 * the previous one ended, and the whole interior must be consumed.</p>
 *
 * <p>Parsing never fails from the caller's point of view: on a syntax error
 * the original text comes back as an {@link Expression.Kind#UNPARSED} base
 * with no filters, so it renders byte-for-byte as it was written.</p>
 */
public final class FilterExpressionParser {

	private static final Logger logger = LoggerFactory.getLogger(FilterExpressionParser.class);

	private static final String DOUBLE_QUOTED = "\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\"";
	private static final String SINGLE_QUOTED = "'[^'\\\\]*(?:\\\\.[^'\\\\]*)*'";
	private static final String CONSTANT =
			"_\\(" + DOUBLE_QUOTED + "\\)"
			+ "|_\\(" + SINGLE_QUOTED + "\\)"
			+ "|" + DOUBLE_QUOTED
			+ "|" + SINGLE_QUOTED;
	private static final String NUMBER = "[-+.]?\\d[\\d.e]*";
	private static final String VARIABLE = "[\\w.]+|" + NUMBER;

	private static final Pattern FILTER_PATTERN = Pattern.compile(
			"^(?<constant>" + CONSTANT + ")"
			+ "|^(?<var>" + VARIABLE + ")"
			+ "|(?:\\s*\\|\\s*(?<filterName>\\w+)"
			+ "(?::(?:(?<constantArg>" + CONSTANT + ")|(?<varArg>" + VARIABLE + ")))?)",
			Pattern.UNICODE_CHARACTER_CLASS);

	private FilterExpressionParser() {
	}

	public static FilterExpression parse(String interior) {
		try {
			return parseStrict(interior);
		} catch (FilterSyntaxException e) {
			logger.trace("Keeping variable tag as written: {} ({})", interior, e.getMessage());
			return FilterExpression.unparsed(interior);
		}
	}

	static FilterExpression parseStrict(String interior) throws FilterSyntaxException {
		Matcher m = FILTER_PATTERN.matcher(interior);
		Expression base = null;
		List<Filter> filters = new ArrayList<>();
		int upto = 0;

		while (m.find()) {
			if (m.start() != upto) {
				throw new FilterSyntaxException("Unexpected characters", upto);
			}
			if (base == null) {
				base = readBase(m);
			} else {
				filters.add(readFilter(m));
			}
			upto = m.end();
		}

		if (upto != interior.length()) {
			throw new FilterSyntaxException("Unexpected trailing characters", upto);
		}
		if (base == null) {
			throw new FilterSyntaxException("Missing variable", 0);
		}
		return new FilterExpression(base, filters);
	}

	private static Expression readBase(Matcher m) throws FilterSyntaxException {
		String constant = m.group("constant");
		if (constant != null) {
			return Expression.constant(constant);
		}
		String var = m.group("var");
		if (var != null) {
			return Expression.variable(var);
		}
		throw new FilterSyntaxException("Could not find variable", m.start());
	}

	private static Filter readFilter(Matcher m) throws FilterSyntaxException {
		String name = m.group("filterName");
		if (name == null) {
			throw new FilterSyntaxException("Expected filter", m.start());
		}
		String constantArg = m.group("constantArg");
		if (constantArg != null) {
			return new Filter(name, Expression.constant(constantArg));
		}
		String varArg = m.group("varArg");
		if (varArg != null) {
			return new Filter(name, Expression.variable(varArg));
		}
		return new Filter(name, null);
	}
}
