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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for JavaScript/TypeScript-like source.
 *
 * <p>Works as a small state machine over the characters of the buffer. The
 * state decides how the next run of characters is consumed: as code
 * (identifiers, numbers, punctuators), as a quoted string, as a template
 * literal (whose {@code ${...}} expressions are skipped with brace matching),
 * as a regular expression literal, or as a comment. Comments are returned as
 * tokens so callers can refuse to rewrite text that carries them.
 *
 * <p>Unterminated single- and double-quoted strings end at the line break.
 * That keeps stray apostrophes in markup text from swallowing the rest of
 * the document.
 */
public class ScriptLexer {

	/**
	 * Lexer state for the character-level scanner.
	 */
	private enum LexState {
		CODE,
		SINGLE_QUOTED,   // 'text'
		DOUBLE_QUOTED,   // "text"
		TEMPLATE,        // `text ${expr}`
		REGEX,           // /pattern/flags
		LINE_COMMENT,    // // ...
		BLOCK_COMMENT    // /* ... */
	}

	// longest first, so the first hit wins
	private static final String[] PUNCTUATORS = {
			">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
			"=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=",
			"/=", "%=", "&=", "|=", "^=", "**", "<<", ">>",
			"{", "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&",
			"|", "^", "!", "~", "?", ":", "=", ".", "@"
	};

	private static final Set<String> KEYWORDS_BEFORE_EXPRESSION = new HashSet<>(Arrays.asList(
			"return", "typeof", "case", "do", "else", "in", "instanceof", "new", "delete",
			"void", "throw", "yield", "await", "of"));

	private final String source;

	public ScriptLexer(String source) {
		if (source == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		this.source = source;
	}

	public String getSource() {
		return source;
	}

	public List<ScriptToken> tokenize() {
		return tokenize(0, source.length());
	}

	/**
	 * Tokenize {@code [start, end)}. The range must begin at a token
	 * boundary; a token may not run past {@code end}.
	 */
	public List<ScriptToken> tokenize(int start, int end) {
		if (start < 0 || end > source.length() || start > end) {
			throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
		}
		List<ScriptToken> tokens = new ArrayList<>();
		ScriptToken previous = null;
		int i = start;
		while (i < end) {
			char c = source.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}
			LexState state = stateAt(i, previous);
			ScriptToken token = scanToken(state, i);
			if (token.getEnd() > end) {
				throw new ScriptSyntaxException("Token runs past the end of the range", token.getStart());
			}
			tokens.add(token);
			if (!token.isComment()) {
				previous = token;
			}
			i = token.getEnd();
		}
		return tokens;
	}

	private LexState stateAt(int index, ScriptToken previous) {
		char c = source.charAt(index);
		char next = charAt(index + 1);
		if (c == '/' && next == '/') {
			return LexState.LINE_COMMENT;
		}
		if (c == '/' && next == '*') {
			return LexState.BLOCK_COMMENT;
		}
		if (c == '\'') {
			return LexState.SINGLE_QUOTED;
		}
		if (c == '"') {
			return LexState.DOUBLE_QUOTED;
		}
		if (c == '`') {
			return LexState.TEMPLATE;
		}
		if (c == '/' && isRegexAllowedAfter(previous) && findRegexEnd(index) > 0) {
			return LexState.REGEX;
		}
		return LexState.CODE;
	}

	private ScriptToken scanToken(LexState state, int index) {
		switch (state) {
			case LINE_COMMENT:
				return token(ScriptToken.Type.LINE_COMMENT, index, skipLineComment(index));
			case BLOCK_COMMENT:
				return token(ScriptToken.Type.BLOCK_COMMENT, index, skipBlockComment(index));
			case SINGLE_QUOTED:
			case DOUBLE_QUOTED:
				return token(ScriptToken.Type.STRING, index, skipQuoted(index));
			case TEMPLATE:
				return scanTemplate(index);
			case REGEX:
				return token(ScriptToken.Type.REGEX, index, findRegexEnd(index));
			case CODE:
			default:
				return scanCode(index);
		}
	}

	private ScriptToken scanCode(int index) {
		char c = source.charAt(index);
		if (Character.isDigit(c) || (c == '.' && Character.isDigit(charAt(index + 1)))) {
			return token(ScriptToken.Type.NUMBER, index, skipNumber(index));
		}
		if (isIdentifierStart(c) || c == '#') {
			int i = index + 1;
			while (i < source.length() && isIdentifierPart(source.charAt(i))) {
				i++;
			}
			return token(ScriptToken.Type.IDENTIFIER, index, i);
		}
		for (String punctuator : PUNCTUATORS) {
			if (source.startsWith(punctuator, index)) {
				// `a?.5:b` is a conditional, not optional chaining
				if (punctuator.equals("?.") && Character.isDigit(charAt(index + 2))) {
					continue;
				}
				return token(ScriptToken.Type.PUNCTUATOR, index, index + punctuator.length());
			}
		}
		return token(ScriptToken.Type.PUNCTUATOR, index, index + 1);
	}

	private ScriptToken scanTemplate(int index) {
		List<SourceSpan> quasis = new ArrayList<>();
		List<SourceSpan> expressions = new ArrayList<>();
		int end = skipTemplate(index, quasis, expressions);
		return new ScriptToken(ScriptToken.Type.TEMPLATE, new SourceSpan(index, end),
				source.substring(index, end), quasis, expressions);
	}

	private ScriptToken token(ScriptToken.Type type, int start, int end) {
		return new ScriptToken(type, new SourceSpan(start, end), source.substring(start, end));
	}

	private int skipLineComment(int index) {
		int newline = source.indexOf('\n', index);
		return newline < 0 ? source.length() : newline;
	}

	private int skipBlockComment(int index) {
		int close = source.indexOf("*/", index + 2);
		return close < 0 ? source.length() : close + 2;
	}

	private int skipQuoted(int index) {
		char quote = source.charAt(index);
		int i = index + 1;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == quote) {
				return i + 1;
			}
			if (c == '\n') {
				return i;
			}
			i++;
		}
		return source.length();
	}

	/**
	 * Skip a template literal starting at the backtick, recording the spans of
	 * its static segments and embedded expressions when lists are given.
	 */
	private int skipTemplate(int index, List<SourceSpan> quasis, List<SourceSpan> expressions) {
		int i = index + 1;
		int quasiStart = i;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == '`') {
				addSpan(quasis, quasiStart, i);
				return i + 1;
			}
			if (c == '$' && charAt(i + 1) == '{') {
				addSpan(quasis, quasiStart, i);
				int expressionStart = i + 2;
				int close = skipToClosingBrace(expressionStart);
				addSpan(expressions, expressionStart, close);
				i = close + 1;
				quasiStart = i;
				continue;
			}
			i++;
		}
		throw new ScriptSyntaxException("Unterminated template literal", index);
	}

	private int skipToClosingBrace(int index) {
		int depth = 0;
		int i = index;
		while (i < source.length()) {
			char c = source.charAt(i);
			char next = charAt(i + 1);
			if (c == '\'' || c == '"') {
				i = skipQuoted(i);
			} else if (c == '`') {
				i = skipTemplate(i, null, null);
			} else if (c == '/' && next == '/') {
				i = skipLineComment(i);
			} else if (c == '/' && next == '*') {
				i = skipBlockComment(i);
			} else if (c == '{') {
				depth++;
				i++;
			} else if (c == '}') {
				if (depth == 0) {
					return i;
				}
				depth--;
				i++;
			} else {
				i++;
			}
		}
		throw new ScriptSyntaxException("Unterminated template expression", index);
	}

	private int skipNumber(int index) {
		int i = index;
		while (i < source.length()) {
			char c = source.charAt(i);
			if ((c == '+' || c == '-') && i > index && (source.charAt(i - 1) == 'e' || source.charAt(i - 1) == 'E')
					&& !source.startsWith("0x", index) && !source.startsWith("0X", index)) {
				i++;
				continue;
			}
			if (Character.isLetterOrDigit(c) || c == '.' || c == '_') {
				i++;
				continue;
			}
			break;
		}
		return i;
	}

	/**
	 * @return the end offset of a regular expression literal starting at
	 *         {@code index}, or {@code -1} when the slash cannot open one
	 */
	private int findRegexEnd(int index) {
		boolean inClass = false;
		int i = index + 1;
		while (i < source.length()) {
			char c = source.charAt(i);
			if (c == '\n') {
				return -1;
			}
			if (c == '\\') {
				i += 2;
				continue;
			}
			if (c == '[') {
				inClass = true;
			} else if (c == ']') {
				inClass = false;
			} else if (c == '/' && !inClass) {
				int end = i + 1;
				while (end < source.length() && isIdentifierPart(source.charAt(end))) {
					end++;
				}
				return end;
			}
			i++;
		}
		return -1;
	}

	private boolean isRegexAllowedAfter(ScriptToken previous) {
		if (previous == null) {
			return true;
		}
		switch (previous.getType()) {
			case IDENTIFIER:
				return KEYWORDS_BEFORE_EXPRESSION.contains(previous.getText());
			case PUNCTUATOR:
				String text = previous.getText();
				return !text.equals(")") && !text.equals("]") && !text.equals("}")
						&& !text.equals("++") && !text.equals("--");
			default:
				return false;
		}
	}

	private void addSpan(List<SourceSpan> spans, int start, int end) {
		if (spans != null) {
			spans.add(new SourceSpan(start, end));
		}
	}

	private char charAt(int index) {
		return index < source.length() ? source.charAt(index) : 0;
	}

	static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_' || c == '$';
	}

	static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}
}
