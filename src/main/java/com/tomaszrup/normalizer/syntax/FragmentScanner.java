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
package com.tomaszrup.normalizer.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the fragments the normalizer engines work on inside a whole
 * document: conditions of {@code if}/{@code while}, initializers of
 * {@code const}/{@code let}/{@code var} declarations, {@code return}
 * arguments and object property values. Expressions are reported when they
 * are logical chains or conditionals; string and template literals are
 * reported together with the name they are assigned to.
 *
 * <p>A statement that is the braceless body of {@code if}, {@code else},
 * {@code for}, {@code while} or {@code do} is reported as non-hoistable, since
 * a declaration inserted before it would replace it as the body.
 *
 * <p>JSX is not supported: {@code className="..."} attributes are not
 * scanned, only class strings held in script literals are.
 *
 * <p>A fragment that does not parse is skipped and logged at DEBUG; the rest
 * of the document is still scanned.
 */
public class FragmentScanner {
	private static final Logger logger = LoggerFactory.getLogger(FragmentScanner.class);

	// tokens after which an opening brace starts an object literal
	private static final Set<String> OBJECT_CONTEXT = new HashSet<>(Arrays.asList(
			"=", "(", ",", ":", "[", "?", "return", "||", "&&", "??"));

	private static final Set<String> DECLARATION_KEYWORDS = new HashSet<>(Arrays.asList("const", "let", "var"));

	// keywords whose parenthesized header may be followed by a braceless body
	private static final Set<String> HEADER_KEYWORDS = new HashSet<>(Arrays.asList("if", "for", "while", "with"));

	private static final Set<String> CONTINUATION_WORDS = new HashSet<>(Arrays.asList("in", "instanceof"));

	private enum BraceKind {
		BLOCK,
		OBJECT
	}

	/**
	 * Fragments found in a document plus every identifier it mentions.
	 */
	public static final class ScanResult {
		private final List<ScannedFragment> fragments;
		private final Set<String> identifiers;

		ScanResult(List<ScannedFragment> fragments, Set<String> identifiers) {
			this.fragments = Collections.unmodifiableList(fragments);
			this.identifiers = Collections.unmodifiableSet(identifiers);
		}

		public List<ScannedFragment> getFragments() {
			return fragments;
		}

		public Set<String> getIdentifiers() {
			return identifiers;
		}
	}

	private final String source;
	private final ScriptExpressionParser parser;
	private List<ScriptToken> tokens;

	public FragmentScanner(String source) {
		this.source = source;
		this.parser = new ScriptExpressionParser(source);
	}

	/**
	 * @throws ScriptSyntaxException when the document cannot be tokenized
	 */
	public ScanResult scan() {
		tokens = new ArrayList<>();
		for (ScriptToken token : new ScriptLexer(source).tokenize()) {
			if (!token.isComment()) {
				tokens.add(token);
			}
		}
		List<ScannedFragment> fragments = new ArrayList<>();
		Set<String> identifiers = new LinkedHashSet<>();
		Deque<BraceKind> braces = new ArrayDeque<>();

		for (int i = 0; i < tokens.size(); i++) {
			ScriptToken token = tokens.get(i);
			ScriptToken previous = i > 0 ? tokens.get(i - 1) : null;
			if (token.getType() == ScriptToken.Type.IDENTIFIER) {
				identifiers.add(token.getText());
			} else if (token.getType() == ScriptToken.Type.TEMPLATE) {
				collectTemplateIdentifiers(token, identifiers);
			}

			if (token.getType() == ScriptToken.Type.PUNCTUATOR) {
				if (token.is("{")) {
					boolean object = previous != null && OBJECT_CONTEXT.contains(previous.getText())
							&& (previous.getType() == ScriptToken.Type.PUNCTUATOR || previous.is("return"));
					braces.push(object ? BraceKind.OBJECT : BraceKind.BLOCK);
				} else if (token.is("}") && !braces.isEmpty()) {
					braces.pop();
				}
				continue;
			}

			if (token.is("if") || token.is("while")) {
				scanCondition(i, previous, fragments);
			} else if (token.getType() == ScriptToken.Type.IDENTIFIER && DECLARATION_KEYWORDS.contains(token.getText())) {
				boolean exported = previous != null && previous.is("export");
				int statementIndex = exported ? i - 1 : i;
				scanDeclarators(i + 1, tokens.get(statementIndex).getStart(), !isBracelessBody(statementIndex),
						fragments);
			} else if (token.is("return")) {
				scanReturn(i, fragments);
			}

			if (!braces.isEmpty() && braces.peek() == BraceKind.OBJECT && isPropertyKey(i)) {
				scanPropertyValue(i, fragments);
			}
		}
		return new ScanResult(fragments, identifiers);
	}

	private void scanCondition(int index, ScriptToken previous, List<ScannedFragment> fragments) {
		ScriptToken keyword = tokens.get(index);
		if (index + 1 >= tokens.size() || !tokens.get(index + 1).is("(")) {
			return;
		}
		int close = findClosing(index + 1);
		if (close < 0) {
			return;
		}
		boolean elseIf = previous != null && previous.is("else");
		boolean hoistable = keyword.is("if") && !elseIf && !isBracelessBody(index);
		SyntaxNode node = parseRange(tokens.get(index + 1).getStart(), tokens.get(close).getEnd());
		if (node == null) {
			return;
		}
		SyntaxNode inner = node.unwrapParentheses();
		if (inner != null && inner.is(SyntaxKind.LOGICAL)) {
			fragments.add(new ScannedFragment(ScannedFragment.Kind.CONDITION, node, keyword.getStart(), hoistable, null));
		}
	}

	private void scanDeclarators(int index, int statementOffset, boolean hoistable, List<ScannedFragment> fragments) {
		int i = index;
		while (i + 1 < tokens.size()) {
			ScriptToken name = tokens.get(i);
			if (name.getType() != ScriptToken.Type.IDENTIFIER || !tokens.get(i + 1).is("=")) {
				return;
			}
			int start = i + 2;
			int end = findExpressionEnd(start);
			if (end <= start) {
				return;
			}
			addValueFragment(start, end, statementOffset, hoistable, name.getText(), fragments);
			if (end < tokens.size() && tokens.get(end).is(",")) {
				i = end + 1;
			} else {
				return;
			}
		}
	}

	private void scanReturn(int index, List<ScannedFragment> fragments) {
		ScriptToken keyword = tokens.get(index);
		int start = index + 1;
		if (start >= tokens.size() || startsOnNewLine(start)) {
			return;
		}
		int end = findExpressionEnd(start);
		if (end > start) {
			addValueFragment(start, end, keyword.getStart(), !isBracelessBody(index), null, fragments);
		}
	}

	private void scanPropertyValue(int index, List<ScannedFragment> fragments) {
		ScriptToken key = tokens.get(index);
		int start = index + 2;
		int end = findExpressionEnd(start);
		if (end > start) {
			addValueFragment(start, end, key.getStart(), false, propertyName(key), fragments);
		}
	}

	private void addValueFragment(int startToken, int endToken, int statementOffset, boolean hoistable,
			String nameHint, List<ScannedFragment> fragments) {
		SyntaxNode node = parseRange(tokens.get(startToken).getStart(), tokens.get(endToken - 1).getEnd());
		if (node == null) {
			return;
		}
		SyntaxNode inner = node.unwrapParentheses();
		if (inner == null) {
			return;
		}
		if (inner.is(SyntaxKind.LOGICAL) || inner.is(SyntaxKind.CONDITIONAL)) {
			fragments.add(new ScannedFragment(ScannedFragment.Kind.EXPRESSION, node, statementOffset, hoistable, nameHint));
		} else if (node.is(SyntaxKind.STRING_LITERAL) || node.is(SyntaxKind.TEMPLATE_LITERAL)) {
			fragments.add(new ScannedFragment(ScannedFragment.Kind.LITERAL, node, statementOffset, hoistable, nameHint));
		}
	}

	private SyntaxNode parseRange(int start, int end) {
		try {
			return parser.parse(start, end);
		} catch (ScriptSyntaxException e) {
			logger.debug("Skipping fragment [{}, {}): {}", start, end, e.getMessage());
			return null;
		}
	}

	private boolean isPropertyKey(int index) {
		ScriptToken key = tokens.get(index);
		if (key.getType() != ScriptToken.Type.IDENTIFIER && key.getType() != ScriptToken.Type.STRING) {
			return false;
		}
		if (index == 0 || index + 1 >= tokens.size()) {
			return false;
		}
		ScriptToken previous = tokens.get(index - 1);
		return (previous.is("{") || previous.is(",")) && tokens.get(index + 1).is(":");
	}

	/**
	 * @return index of the first token after the expression starting at
	 *         {@code start}
	 */
	private int findExpressionEnd(int start) {
		int depth = 0;
		int i = start;
		while (i < tokens.size()) {
			ScriptToken token = tokens.get(i);
			if (token.getType() == ScriptToken.Type.PUNCTUATOR) {
				if (token.is("(") || token.is("[") || token.is("{")) {
					depth++;
				} else if (token.is(")") || token.is("]") || token.is("}")) {
					if (depth == 0) {
						return i;
					}
					depth--;
				} else if (depth == 0 && (token.is(";") || token.is(","))) {
					return i;
				}
			} else if (depth == 0 && i > start && startsOnNewLine(i) && endsStatement(tokens.get(i - 1))
					&& !CONTINUATION_WORDS.contains(token.getText())) {
				return i;
			}
			i++;
		}
		return i;
	}

	private boolean endsStatement(ScriptToken token) {
		switch (token.getType()) {
			case IDENTIFIER:
			case NUMBER:
			case STRING:
			case TEMPLATE:
			case REGEX:
				return true;
			case PUNCTUATOR:
				return token.is(")") || token.is("]") || token.is("}");
			default:
				return false;
		}
	}

	private boolean startsOnNewLine(int index) {
		int from = tokens.get(index - 1).getEnd();
		int to = tokens.get(index).getStart();
		return source.substring(from, to).indexOf('\n') >= 0;
	}

	/**
	 * Whether the statement starting at {@code index} is the body of a
	 * control statement written without braces.
	 */
	private boolean isBracelessBody(int index) {
		if (index == 0) {
			return false;
		}
		ScriptToken previous = tokens.get(index - 1);
		if (previous.getType() == ScriptToken.Type.IDENTIFIER) {
			return previous.is("else") || previous.is("do");
		}
		if (previous.getType() != ScriptToken.Type.PUNCTUATOR || !previous.is(")")) {
			return false;
		}
		int open = findOpening(index - 1);
		return open > 0 && tokens.get(open - 1).getType() == ScriptToken.Type.IDENTIFIER
				&& HEADER_KEYWORDS.contains(tokens.get(open - 1).getText());
	}

	private int findOpening(int closeIndex) {
		int depth = 0;
		for (int i = closeIndex; i >= 0; i--) {
			ScriptToken token = tokens.get(i);
			if (token.is(")")) {
				depth++;
			} else if (token.is("(")) {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	private int findClosing(int openIndex) {
		int depth = 0;
		for (int i = openIndex; i < tokens.size(); i++) {
			ScriptToken token = tokens.get(i);
			if (token.is("(")) {
				depth++;
			} else if (token.is(")")) {
				depth--;
				if (depth == 0) {
					return i;
				}
			}
		}
		return -1;
	}

	private void collectTemplateIdentifiers(ScriptToken token, Set<String> identifiers) {
		for (SourceSpan expression : token.getExpressions()) {
			try {
				for (ScriptToken inner : new ScriptLexer(source).tokenize(expression.getStart(), expression.getEnd())) {
					if (inner.getType() == ScriptToken.Type.IDENTIFIER) {
						identifiers.add(inner.getText());
					}
				}
			} catch (ScriptSyntaxException e) {
				logger.debug("Could not tokenize template expression {}: {}", expression, e.getMessage());
			}
		}
	}

	private static String propertyName(ScriptToken key) {
		String text = key.getText();
		if (key.getType() == ScriptToken.Type.STRING && text.length() >= 2) {
			return text.substring(1, text.length() - 1);
		}
		return text;
	}
}
