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
package com.tomaszrup.normalizer.classtokens;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a literal holds class tokens and, if so, reads them.
 *
 * <p>Prose that happens to contain one recognizable word stays below both
 * thresholds and is left alone; an inconclusive string is never treated as
 * a class string.
 */
public class ClassTokenClassifier {
	private final CategoryTable table;
	private final ClassTokenOptions options;

	public ClassTokenClassifier(CategoryTable table, ClassTokenOptions options) {
		this.table = table;
		this.options = options;
	}

	public static List<String> split(String value) {
		String trimmed = value.trim();
		if (trimmed.isEmpty()) {
			return Collections.emptyList();
		}
		return Arrays.asList(trimmed.split("\\s+"));
	}

	public boolean isClassRelatedName(String name) {
		return name != null
				&& name.toLowerCase(Locale.ROOT).contains(options.getNameKeyword().toLowerCase(Locale.ROOT));
	}

	public int countMatches(List<String> tokens) {
		int matches = 0;
		for (String token : tokens) {
			if (table.recognizes(token)) {
				matches++;
			}
		}
		return matches;
	}

	/**
	 * The dual threshold on token content alone.
	 */
	public boolean looksLikeClassTokens(List<String> tokens) {
		if (tokens.isEmpty()) {
			return false;
		}
		int matches = countMatches(tokens);
		return matches >= options.getMinMatchCount()
				|| (double) matches / tokens.size() > options.getMinMatchRatio();
	}

	public boolean accepts(String value, String nameHint) {
		List<String> tokens = split(value);
		if (tokens.isEmpty()) {
			return false;
		}
		return isClassRelatedName(nameHint) || looksLikeClassTokens(tokens);
	}

	/**
	 * @return the tokens of {@code value} when it is accepted as a class string
	 */
	public Optional<ClassString> classify(String value, String nameHint, ClassString.SourceKind sourceKind,
			boolean hasDynamicSegments) {
		if (!accepts(value, nameHint)) {
			return Optional.empty();
		}
		return Optional.of(read(value, sourceKind, hasDynamicSegments));
	}

	/**
	 * Read tokens without the acceptance test.
	 */
	public ClassString read(String value, ClassString.SourceKind sourceKind, boolean hasDynamicSegments) {
		List<String> raw = split(value);
		List<ClassToken> tokens = new ArrayList<>(raw.size());
		for (int i = 0; i < raw.size(); i++) {
			String token = raw.get(i);
			tokens.add(new ClassToken(token, table.categoryOf(token), table.rankOf(token), i));
		}
		return new ClassString(tokens, sourceKind, hasDynamicSegments);
	}
}
