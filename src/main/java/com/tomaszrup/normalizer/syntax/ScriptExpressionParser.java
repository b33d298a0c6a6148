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
 * Recursive-descent parser for the expression subset the normalizer engines
 * work on. Statements, functions, assignments and type syntax are outside the
 * subset and make the parse fail with {@link ScriptSyntaxException}.
 *
 * <p>An instance keeps a cursor while parsing and is not meant to be shared
 * between threads; create one per document.
 */
public class ScriptExpressionParser {
	private static final Set<String> KEYWORD_LITERALS = new HashSet<>(Arrays.asList(
			"true", "false", "null", "undefined", "this", "super"));
	private static final Set<String> UNARY_KEYWORDS = new HashSet<>(Arrays.asList(
			"typeof", "void", "delete", "await", "new"));
	private static final Set<String> UNSUPPORTED_KEYWORDS = new HashSet<>(Arrays.asList(
			"function", "class", "async", "yield", "import", "let", "const", "var", "return", "if", "else"));

	private static final String[][] BINARY_LEVELS = {
			{"|", "^", "&"},
			{"===", "!==", "==", "!="},
			{"<=", ">=", "<", ">", "instanceof", "in"},
			{"<<", ">>>", ">>"},
			{"+", "-"},
			{"*", "/", "%", "**"}
	};

	private final String source;
	private final ScriptLexer lexer;
	private List<ScriptToken> tokens;
	private int position;
	private int rangeEnd;

	public ScriptExpressionParser(String source) {
		this.source = source;
		this.lexer = new ScriptLexer(source);
	}

	public SyntaxNode parse() {
		return parse(0, source.length());
	}

	/**
	 * Parse exactly one expression spanning the tokens of {@code [start, end)}.
	 */
	public SyntaxNode parse(int start, int end) {
		List<ScriptToken> all = lexer.tokenize(start, end);
		List<ScriptToken> significant = new ArrayList<>();
		for (ScriptToken token : all) {
			if (!token.isComment()) {
				significant.add(token);
			}
		}
		if (significant.isEmpty()) {
			throw new ScriptSyntaxException("Empty expression", start);
		}
		List<ScriptToken> savedTokens = tokens;
		int savedPosition = position;
		int savedEnd = rangeEnd;
		tokens = significant;
		position = 0;
		rangeEnd = end;
		try {
			SyntaxNode node = parseConditional();
			if (position < tokens.size()) {
				throw unexpected(peek());
			}
			return node;
		} finally {
			tokens = savedTokens;
			position = savedPosition;
			rangeEnd = savedEnd;
		}
	}

	private SyntaxNode parseConditional() {
		SyntaxNode test = parseNullish();
		if (!peekIs("?")) {
			return test;
		}
		advance();
		SyntaxNode consequent = parseConditional();
		expect(":");
		SyntaxNode alternate = parseConditional();
		return SyntaxNode.conditional(span(test, alternate), test, consequent, alternate);
	}

	private SyntaxNode parseNullish() {
		SyntaxNode left = parseOr();
		while (peekIs("??")) {
			advance();
			SyntaxNode right = parseOr();
			left = SyntaxNode.binary(span(left, right), "??", left, right);
		}
		return left;
	}

	private SyntaxNode parseOr() {
		SyntaxNode left = parseAnd();
		while (peekIs("||")) {
			advance();
			SyntaxNode right = parseAnd();
			left = SyntaxNode.logical(span(left, right), "||", left, right);
		}
		return left;
	}

	private SyntaxNode parseAnd() {
		SyntaxNode left = parseBinary(0);
		while (peekIs("&&")) {
			advance();
			SyntaxNode right = parseBinary(0);
			left = SyntaxNode.logical(span(left, right), "&&", left, right);
		}
		return left;
	}

	private SyntaxNode parseBinary(int level) {
		if (level >= BINARY_LEVELS.length) {
			return parseUnary();
		}
		SyntaxNode left = parseBinary(level + 1);
		String operator = matchOperator(BINARY_LEVELS[level]);
		while (operator != null) {
			advance();
			SyntaxNode right = parseBinary(level + 1);
			left = SyntaxNode.binary(span(left, right), operator, left, right);
			operator = matchOperator(BINARY_LEVELS[level]);
		}
		return left;
	}

	private SyntaxNode parseUnary() {
		ScriptToken token = peek();
		if (token == null) {
			throw new ScriptSyntaxException("Unexpected end of expression", rangeEnd);
		}
		boolean symbolic = token.getType() == ScriptToken.Type.PUNCTUATOR
				&& (token.is("!") || token.is("-") || token.is("+") || token.is("~")
						|| token.is("++") || token.is("--") || token.is("..."));
		boolean keyword = token.getType() == ScriptToken.Type.IDENTIFIER && UNARY_KEYWORDS.contains(token.getText());
		if (symbolic || keyword) {
			advance();
			SyntaxNode argument = parseUnary();
			return SyntaxNode.unary(new SourceSpan(token.getStart(), argument.getSpan().getEnd()),
					token.getText(), argument);
		}
		return parsePostfix();
	}

	private SyntaxNode parsePostfix() {
		SyntaxNode expression = parsePrimary();
		while (true) {
			ScriptToken token = peek();
			if (token == null || token.getType() != ScriptToken.Type.PUNCTUATOR) {
				return expression;
			}
			if (token.is(".") || token.is("?.")) {
				advance();
				ScriptToken next = peek();
				if (token.is("?.") && next != null && next.is("(")) {
					expression = parseCall(expression);
				} else if (token.is("?.") && next != null && next.is("[")) {
					expression = parseIndex(expression);
				} else {
					ScriptToken property = expectType(ScriptToken.Type.IDENTIFIER);
					expression = SyntaxNode.member(new SourceSpan(expression.getSpan().getStart(), property.getEnd()),
							expression, property.getText());
				}
			} else if (token.is("[")) {
				expression = parseIndex(expression);
			} else if (token.is("(")) {
				expression = parseCall(expression);
			} else if (token.is("++") || token.is("--")) {
				advance();
				expression = SyntaxNode.unary(new SourceSpan(expression.getSpan().getStart(), token.getEnd()),
						token.getText(), expression);
			} else {
				return expression;
			}
		}
	}

	private SyntaxNode parseCall(SyntaxNode callee) {
		expect("(");
		List<SyntaxNode> arguments = new ArrayList<>();
		while (!peekIs(")")) {
			arguments.add(parseConditional());
			if (!peekIs(")")) {
				expect(",");
			}
		}
		ScriptToken close = expect(")");
		return SyntaxNode.call(new SourceSpan(callee.getSpan().getStart(), close.getEnd()), callee, arguments);
	}

	private SyntaxNode parseIndex(SyntaxNode object) {
		expect("[");
		SyntaxNode index = parseConditional();
		ScriptToken close = expect("]");
		return SyntaxNode.index(new SourceSpan(object.getSpan().getStart(), close.getEnd()), object, index);
	}

	private SyntaxNode parsePrimary() {
		ScriptToken token = peek();
		if (token == null) {
			throw new ScriptSyntaxException("Unexpected end of expression", rangeEnd);
		}
		switch (token.getType()) {
			case IDENTIFIER:
				return parseIdentifier(token);
			case NUMBER:
				advance();
				return SyntaxNode.literal(SyntaxKind.NUMERIC_LITERAL, token.getSpan());
			case STRING:
				advance();
				return SyntaxNode.literal(SyntaxKind.STRING_LITERAL, token.getSpan());
			case REGEX:
				advance();
				return SyntaxNode.literal(SyntaxKind.REGEX_LITERAL, token.getSpan());
			case TEMPLATE:
				advance();
				return parseTemplate(token);
			case PUNCTUATOR:
				if (token.is("(")) {
					return parseParenthesized();
				}
				if (token.is("[")) {
					return parseArray();
				}
				if (token.is("{")) {
					return parseObject();
				}
				throw unexpected(token);
			default:
				throw unexpected(token);
		}
	}

	private SyntaxNode parseIdentifier(ScriptToken token) {
		String text = token.getText();
		if (UNSUPPORTED_KEYWORDS.contains(text)) {
			throw unexpected(token);
		}
		advance();
		if (KEYWORD_LITERALS.contains(text)) {
			return SyntaxNode.literal(SyntaxKind.KEYWORD_LITERAL, token.getSpan());
		}
		return SyntaxNode.identifier(token.getSpan(), text);
	}

	private SyntaxNode parseTemplate(ScriptToken token) {
		List<SyntaxNode> expressions = new ArrayList<>();
		for (SourceSpan expressionSpan : token.getExpressions()) {
			expressions.add(parse(expressionSpan.getStart(), expressionSpan.getEnd()));
		}
		return SyntaxNode.template(token.getSpan(), token.getQuasis(), expressions);
	}

	private SyntaxNode parseParenthesized() {
		ScriptToken open = expect("(");
		if (peekIs(")")) {
			ScriptToken close = advance();
			return SyntaxNode.parenthesized(new SourceSpan(open.getStart(), close.getEnd()), null);
		}
		SyntaxNode inner = parseConditional();
		ScriptToken close = expect(")");
		return SyntaxNode.parenthesized(new SourceSpan(open.getStart(), close.getEnd()), inner);
	}

	private SyntaxNode parseArray() {
		ScriptToken open = expect("[");
		List<SyntaxNode> elements = new ArrayList<>();
		while (!peekIs("]")) {
			if (peekIs(",")) {
				advance();
				continue;
			}
			elements.add(parseConditional());
			if (!peekIs("]")) {
				expect(",");
			}
		}
		ScriptToken close = expect("]");
		return SyntaxNode.collection(SyntaxKind.ARRAY_LITERAL, new SourceSpan(open.getStart(), close.getEnd()),
				elements);
	}

	private SyntaxNode parseObject() {
		ScriptToken open = expect("{");
		List<SyntaxNode> values = new ArrayList<>();
		while (!peekIs("}")) {
			values.add(parseProperty());
			if (!peekIs("}")) {
				expect(",");
			}
		}
		ScriptToken close = expect("}");
		return SyntaxNode.collection(SyntaxKind.OBJECT_LITERAL, new SourceSpan(open.getStart(), close.getEnd()),
				values);
	}

	private SyntaxNode parseProperty() {
		if (peekIs("...")) {
			return parseUnary();
		}
		ScriptToken key = peek();
		if (key == null) {
			throw new ScriptSyntaxException("Unterminated object literal", rangeEnd);
		}
		if (key.is("[")) {
			advance();
			SyntaxNode computed = parseConditional();
			expect("]");
			expect(":");
			SyntaxNode value = parseConditional();
			return SyntaxNode.computedProperty(new SourceSpan(key.getStart(), value.getSpan().getEnd()), computed,
					value);
		}
		if (key.getType() != ScriptToken.Type.IDENTIFIER && key.getType() != ScriptToken.Type.STRING
				&& key.getType() != ScriptToken.Type.NUMBER) {
			throw unexpected(key);
		}
		advance();
		if (peekIs(":")) {
			advance();
			return parseConditional();
		}
		if (key.getType() == ScriptToken.Type.IDENTIFIER && (peekIs(",") || peekIs("}"))) {
			return SyntaxNode.identifier(key.getSpan(), key.getText());
		}
		throw unexpected(peek() != null ? peek() : key);
	}

	private String matchOperator(String[] operators) {
		ScriptToken token = peek();
		if (token == null) {
			return null;
		}
		for (String operator : operators) {
			if (token.is(operator)) {
				return operator;
			}
		}
		return null;
	}

	private ScriptToken peek() {
		return position < tokens.size() ? tokens.get(position) : null;
	}

	private boolean peekIs(String text) {
		ScriptToken token = peek();
		return token != null && token.getType() == ScriptToken.Type.PUNCTUATOR && token.getText().equals(text);
	}

	private ScriptToken advance() {
		return tokens.get(position++);
	}

	private ScriptToken expect(String punctuator) {
		ScriptToken token = peek();
		if (token == null) {
			throw new ScriptSyntaxException("Expected '" + punctuator + "' but reached end of expression", rangeEnd);
		}
		if (!token.is(punctuator) || token.getType() != ScriptToken.Type.PUNCTUATOR) {
			throw new ScriptSyntaxException("Expected '" + punctuator + "' but found '" + token.getText() + "'",
					token.getStart());
		}
		return advance();
	}

	private ScriptToken expectType(ScriptToken.Type type) {
		ScriptToken token = peek();
		if (token == null || token.getType() != type) {
			int offset = token == null ? rangeEnd : token.getStart();
			throw new ScriptSyntaxException("Expected " + type, offset);
		}
		return advance();
	}

	private ScriptSyntaxException unexpected(ScriptToken token) {
		return new ScriptSyntaxException("Unexpected token '" + token.getText() + "'", token.getStart());
	}

	private static SourceSpan span(SyntaxNode first, SyntaxNode last) {
		return new SourceSpan(first.getSpan().getStart(), last.getSpan().getEnd());
	}
}
