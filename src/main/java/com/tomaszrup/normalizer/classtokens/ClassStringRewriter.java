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
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.normalizer.edit.FragmentEdit;
import com.tomaszrup.normalizer.edit.FragmentEdits;
import com.tomaszrup.normalizer.syntax.SourceSpan;

/**
 * Entry point of the class engine: reorders the tokens of a class-bearing
 * literal in place.
 *
 * <p>A quoted literal keeps its quote character and is rewritten with single
 * spaces between tokens. A template literal is never turned into a plain
 * string: each static segment is sorted on its own, keeping the whitespace
 * around it, and {@code ${...}} expressions stay where they are. A token
 * glued to an expression ({@code text-${size}}) keeps its position.
 */
public class ClassStringRewriter {
	private static final Logger logger = LoggerFactory.getLogger(ClassStringRewriter.class);

	private final ClassTokenClassifier classifier;
	private final ClassTokenOrderer orderer = new ClassTokenOrderer();

	public ClassStringRewriter(ClassTokenOptions options) {
		this(CategoryTable.defaultTable(), options);
	}

	public ClassStringRewriter(CategoryTable table, ClassTokenOptions options) {
		this.classifier = new ClassTokenClassifier(table, options);
	}

	public ClassTokenClassifier getClassifier() {
		return classifier;
	}

	/**
	 * @return edits sorted by offset; empty when the literal is not a class
	 *         string or is already in canonical order
	 */
	public List<FragmentEdit> rewrite(ClassStringFragment fragment) {
		if (fragment.isTemplate()) {
			return rewriteTemplate(fragment);
		}
		return rewriteQuoted(fragment);
	}

	private List<FragmentEdit> rewriteQuoted(ClassStringFragment fragment) {
		String source = fragment.getSource();
		SourceSpan span = fragment.getLiteral().getSpan();
		String literal = span.text(source);
		if (literal.length() < 2 || literal.charAt(literal.length() - 1) != literal.charAt(0)) {
			logger.debug("Skipping unterminated literal {}", span);
			return new ArrayList<>();
		}
		char quote = literal.charAt(0);
		String content = literal.substring(1, literal.length() - 1);
		Optional<ClassString> classString = classifier.classify(content, fragment.getNameHint(),
				ClassString.SourceKind.QUOTED_LITERAL, false);
		if (!classString.isPresent()) {
			return new ArrayList<>();
		}
		ClassTokenOrderer.OrderResult result = orderer.order(classString.get());
		List<FragmentEdit> edits = new ArrayList<>();
		if (result.isChanged()) {
			String replacement = quote + result.getOrdered().toText() + quote;
			FragmentEdit edit = FragmentEdits.minimalEdit(span.getStart(), literal, replacement);
			if (edit != null) {
				edits.add(edit);
			}
		}
		return edits;
	}

	private List<FragmentEdit> rewriteTemplate(ClassStringFragment fragment) {
		String source = fragment.getSource();
		List<SourceSpan> quasis = fragment.getLiteral().getQuasis();
		StringBuilder staticText = new StringBuilder();
		for (SourceSpan quasi : quasis) {
			String text = quasi.text(source).trim();
			if (!text.isEmpty()) {
				if (staticText.length() > 0) {
					staticText.append(' ');
				}
				staticText.append(text);
			}
		}
		boolean dynamic = quasis.size() > 1;
		if (!classifier.classify(staticText.toString(), fragment.getNameHint(),
				ClassString.SourceKind.TEMPLATE_SEGMENT, dynamic).isPresent()) {
			return new ArrayList<>();
		}
		List<FragmentEdit> edits = new ArrayList<>();
		for (int i = 0; i < quasis.size(); i++) {
			SourceSpan quasi = quasis.get(i);
			String text = quasi.text(source);
			String rewritten = rewriteSegment(text, i > 0, i < quasis.size() - 1, dynamic);
			FragmentEdit edit = FragmentEdits.minimalEdit(quasi.getStart(), text, rewritten);
			if (edit != null) {
				edits.add(edit);
			}
		}
		return FragmentEdits.sortAndVerify(edits);
	}

	private String rewriteSegment(String text, boolean afterExpression, boolean beforeExpression, boolean dynamic) {
		if (text.trim().isEmpty()) {
			return text;
		}
		ClassString segment = classifier.read(text, ClassString.SourceKind.TEMPLATE_SEGMENT, dynamic);
		List<ClassToken> tokens = segment.getTokens();
		int from = afterExpression && !Character.isWhitespace(text.charAt(0)) ? 1 : 0;
		int to = beforeExpression && !Character.isWhitespace(text.charAt(text.length() - 1))
				? tokens.size() - 1
				: tokens.size();
		if (to - from < 2) {
			return text;
		}
		List<ClassToken> ordered = orderer.orderRange(tokens, from, to);
		if (sameOrder(tokens, ordered)) {
			return text;
		}

		String leading = text.substring(0, text.length() - text.replaceAll("^\\s+", "").length());
		String trailing = text.substring(text.replaceAll("\\s+$", "").length());
		String separator = " ";
		if (text.indexOf('\n') >= 0) {
			String indent = firstLineIndent(text);
			if (indent != null) {
				separator = "\n" + indent;
			}
		}
		StringBuilder result = new StringBuilder(leading);
		for (int i = 0; i < ordered.size(); i++) {
			if (i > 0) {
				result.append(separator);
			}
			result.append(ordered.get(i).getRaw());
		}
		result.append(trailing);
		return result.toString();
	}

	/**
	 * Indentation of the first non-empty line that starts after a line break.
	 */
	private static String firstLineIndent(String text) {
		int newline = text.indexOf('\n');
		while (newline >= 0) {
			int lineStart = newline + 1;
			int i = lineStart;
			while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
				i++;
			}
			if (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
				return text.substring(lineStart, i);
			}
			newline = text.indexOf('\n', lineStart);
		}
		return null;
	}

	private static boolean sameOrder(List<ClassToken> original, List<ClassToken> ordered) {
		for (int i = 0; i < original.size(); i++) {
			if (!original.get(i).getRaw().equals(ordered.get(i).getRaw())) {
				return false;
			}
		}
		return true;
	}
}
