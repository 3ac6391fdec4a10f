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
package com.tomaszrup.templatefmt.passes.formatting;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.templatefmt.lexer.BlockToken;
import com.tomaszrup.templatefmt.lexer.Token;
import com.tomaszrup.templatefmt.passes.LoadTags;
import com.tomaszrup.templatefmt.passes.PassContext;
import com.tomaszrup.templatefmt.passes.TokenPass;

/**
 * Merges runs of adjacent {@code {% load a %}} tags into one tag with sorted,
 * de-duplicated names. Tags in the {@code load a b from lib} form are never
 * merged; only their names are sorted in place.
 */
public class LoadTagMerger implements TokenPass {

	private static final Logger logger = LoggerFactory.getLogger(LoadTagMerger.class);

	@Override
	public String getName() {
		return "load-merge";
	}

	@Override
	public void apply(List<Token> tokens, PassContext context) {
		int i = 0;
		while (i < tokens.size()) {
			Token token = tokens.get(i);
			if (LoadTags.isLoad(token)) {
				BlockToken load = (BlockToken) token;
				if (LoadTags.isFromForm(load)) {
					sortFromNames(load);
				} else {
					mergeRun(tokens, i);
				}
			}
			i++;
		}
	}

	/**
	 * Absorb the plain load tags (and the whitespace between them) that follow
	 * {@code tokens[start]}, then delete the absorbed tokens.
	 */
	private void mergeRun(List<Token> tokens, int start) {
		BlockToken first = (BlockToken) tokens.get(start);
		TreeSet<String> names = new TreeSet<>(first.getBits().subList(1, first.size()));

		int lastLoad = start;
		int j = start + 1;
		while (j < tokens.size()) {
			Token next = tokens.get(j);
			if (next.isWhitespaceText()) {
				j++;
			} else if (LoadTags.isPlainLoad(next)) {
				List<String> bits = ((BlockToken) next).getBits();
				names.addAll(bits.subList(1, bits.size()));
				lastLoad = j;
				j++;
			} else {
				break;
			}
		}

		List<String> merged = new ArrayList<>();
		merged.add(LoadTags.LOAD);
		merged.addAll(names);
		first.setBits(merged);

		if (lastLoad > start) {
			logger.debug("Merged {} load tags starting on line {}", countLoads(tokens, start, lastLoad), first.getLine());
			tokens.subList(start + 1, lastLoad + 1).clear();
		}
	}

	private static int countLoads(List<Token> tokens, int from, int to) {
		int count = 0;
		for (int k = from; k <= to; k++) {
			if (LoadTags.isLoad(tokens.get(k))) {
				count++;
			}
		}
		return count;
	}

	private void sortFromNames(BlockToken load) {
		List<String> bits = load.getBits();
		int fromIndex = bits.size() - 2;
		TreeSet<String> names = new TreeSet<>(bits.subList(1, fromIndex));

		List<String> sorted = new ArrayList<>();
		sorted.add(LoadTags.LOAD);
		sorted.addAll(names);
		sorted.addAll(bits.subList(fromIndex, bits.size()));
		load.setBits(sorted);
	}
}
