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
package com.tomaszrup.normalizer.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.tomaszrup.normalizer.syntax.SourceSpan;

/**
 * Text helpers shared by the decision engine and the emitter.
 */
final class SourceText {
	private SourceText() {
	}

	/**
	 * Leading whitespace of the line holding {@code offset}.
	 */
	static String indentOf(String source, int offset) {
		int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
		int i = lineStart;
		while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
			i++;
		}
		return source.substring(lineStart, i);
	}

	/**
	 * Text of {@code span} with each replaced span inside it swapped for its
	 * name. A replaced span nested in another one is covered by the outer name.
	 */
	static String substitute(String source, SourceSpan span, Map<SourceSpan, String> replacements) {
		List<SourceSpan> inside = new ArrayList<>();
		for (SourceSpan replaced : replacements.keySet()) {
			if (span.contains(replaced)) {
				inside.add(replaced);
			}
		}
		if (inside.isEmpty()) {
			return span.text(source);
		}
		inside.sort((a, b) -> a.getStart() != b.getStart() ? a.getStart() - b.getStart() : b.getEnd() - a.getEnd());
		StringBuilder result = new StringBuilder();
		int cursor = span.getStart();
		for (SourceSpan replaced : inside) {
			if (replaced.getStart() < cursor) {
				continue;
			}
			result.append(source, cursor, replaced.getStart());
			result.append(replacements.get(replaced));
			cursor = replaced.getEnd();
		}
		result.append(source, cursor, span.getEnd());
		return result.toString();
	}

	/**
	 * Fold line breaks outside string and template literals. A whitespace run
	 * holding a line break is dropped after an opening or before a closing
	 * bracket and becomes one space elsewhere; other whitespace is untouched.
	 */
	static String fold(String text) {
		StringBuilder result = new StringBuilder(text.length());
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\'' || c == '"' || c == '`') {
				int end = skipLiteral(text, i);
				result.append(text, i, end);
				i = end;
				continue;
			}
			if (!Character.isWhitespace(c)) {
				result.append(c);
				i++;
				continue;
			}
			int runEnd = i;
			boolean lineBreak = false;
			while (runEnd < text.length() && Character.isWhitespace(text.charAt(runEnd))) {
				if (text.charAt(runEnd) == '\n') {
					lineBreak = true;
				}
				runEnd++;
			}
			if (!lineBreak) {
				result.append(text, i, runEnd);
			} else if (result.length() > 0 && runEnd < text.length()) {
				char before = result.charAt(result.length() - 1);
				char after = text.charAt(runEnd);
				if (before != '(' && before != '[' && after != ')' && after != ']') {
					result.append(' ');
				}
			}
			i = runEnd;
		}
		return result.toString();
	}

	private static int skipLiteral(String text, int start) {
		char quote = text.charAt(start);
		int i = start + 1;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			if (c == '\n' && quote != '`') {
				return i;
			}
			i++;
		}
		return text.length();
	}
}
