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
import java.util.Collections;
import java.util.List;

/**
 * Immutable node of a parsed script expression. This is the host-side syntax
 * tree the normalizer engines read; it is deliberately small and only models
 * the shapes the engines distinguish.
 *
 * <p>Children depend on the kind:
 * <ul>
 *   <li>{@code LOGICAL}, {@code BINARY}: left, right</li>
 *   <li>{@code CONDITIONAL}: test, consequent, alternate</li>
 *   <li>{@code PARENTHESIZED}, {@code UNARY}: the single operand</li>
 *   <li>{@code CALL}: callee followed by the arguments</li>
 *   <li>{@code MEMBER}: object; {@code INDEX}: object, index</li>
 *   <li>{@code ARRAY_LITERAL}: the elements; {@code OBJECT_LITERAL}: the property values</li>
 *   <li>{@code COMPUTED_PROPERTY}: key, value</li>
 *   <li>{@code TEMPLATE_LITERAL}: the embedded expressions</li>
 * </ul>
 */
public final class SyntaxNode {
	private final SyntaxKind kind;
	private final SourceSpan span;
	private final String operator;
	private final String name;
	private final List<SyntaxNode> children;
	private final List<SourceSpan> quasis;

	private SyntaxNode(SyntaxKind kind, SourceSpan span, String operator, String name,
			List<SyntaxNode> children, List<SourceSpan> quasis) {
		if (kind == null || span == null) {
			throw new IllegalArgumentException("kind and span are required");
		}
		this.kind = kind;
		this.span = span;
		this.operator = operator;
		this.name = name;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
		this.quasis = Collections.unmodifiableList(new ArrayList<>(quasis));
	}

	public static SyntaxNode logical(SourceSpan span, String operator, SyntaxNode left, SyntaxNode right) {
		return new SyntaxNode(SyntaxKind.LOGICAL, span, operator, null, Arrays.asList(left, right),
				Collections.emptyList());
	}

	public static SyntaxNode binary(SourceSpan span, String operator, SyntaxNode left, SyntaxNode right) {
		return new SyntaxNode(SyntaxKind.BINARY, span, operator, null, Arrays.asList(left, right),
				Collections.emptyList());
	}

	public static SyntaxNode conditional(SourceSpan span, SyntaxNode test, SyntaxNode consequent,
			SyntaxNode alternate) {
		return new SyntaxNode(SyntaxKind.CONDITIONAL, span, null, null, Arrays.asList(test, consequent, alternate),
				Collections.emptyList());
	}

	/**
	 * @param expression the wrapped expression, or {@code null} for an empty
	 *                   pair of parentheses
	 */
	public static SyntaxNode parenthesized(SourceSpan span, SyntaxNode expression) {
		List<SyntaxNode> children = expression == null
				? Collections.<SyntaxNode>emptyList()
				: Collections.singletonList(expression);
		return new SyntaxNode(SyntaxKind.PARENTHESIZED, span, null, null, children, Collections.emptyList());
	}

	public static SyntaxNode unary(SourceSpan span, String operator, SyntaxNode argument) {
		return new SyntaxNode(SyntaxKind.UNARY, span, operator, null, Collections.singletonList(argument),
				Collections.emptyList());
	}

	public static SyntaxNode call(SourceSpan span, SyntaxNode callee, List<SyntaxNode> arguments) {
		List<SyntaxNode> children = new ArrayList<>();
		children.add(callee);
		children.addAll(arguments);
		return new SyntaxNode(SyntaxKind.CALL, span, null, null, children, Collections.emptyList());
	}

	public static SyntaxNode member(SourceSpan span, SyntaxNode object, String property) {
		return new SyntaxNode(SyntaxKind.MEMBER, span, null, property, Collections.singletonList(object),
				Collections.emptyList());
	}

	public static SyntaxNode index(SourceSpan span, SyntaxNode object, SyntaxNode index) {
		return new SyntaxNode(SyntaxKind.INDEX, span, null, null, Arrays.asList(object, index),
				Collections.emptyList());
	}

	public static SyntaxNode identifier(SourceSpan span, String name) {
		return new SyntaxNode(SyntaxKind.IDENTIFIER, span, null, name, Collections.emptyList(),
				Collections.emptyList());
	}

	public static SyntaxNode literal(SyntaxKind kind, SourceSpan span) {
		return new SyntaxNode(kind, span, null, null, Collections.emptyList(), Collections.emptyList());
	}

	public static SyntaxNode template(SourceSpan span, List<SourceSpan> quasis, List<SyntaxNode> expressions) {
		return new SyntaxNode(SyntaxKind.TEMPLATE_LITERAL, span, null, null, expressions, quasis);
	}

	public static SyntaxNode computedProperty(SourceSpan span, SyntaxNode key, SyntaxNode value) {
		return new SyntaxNode(SyntaxKind.COMPUTED_PROPERTY, span, null, null, Arrays.asList(key, value),
				Collections.emptyList());
	}

	public static SyntaxNode collection(SyntaxKind kind, SourceSpan span, List<SyntaxNode> elements) {
		return new SyntaxNode(kind, span, null, null, elements, Collections.emptyList());
	}

	public SyntaxKind getKind() {
		return kind;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public String getOperator() {
		return operator;
	}

	/**
	 * Identifier name for {@code IDENTIFIER}, property name for {@code MEMBER}.
	 */
	public String getName() {
		return name;
	}

	public List<SyntaxNode> getChildren() {
		return children;
	}

	public SyntaxNode getChild(int index) {
		return children.get(index);
	}

	/**
	 * Static segment spans of a template literal, excluding the backticks and
	 * the {@code ${}} delimiters. There is always one more quasi than there
	 * are expressions.
	 */
	public List<SourceSpan> getQuasis() {
		return quasis;
	}

	public boolean is(SyntaxKind candidate) {
		return kind == candidate;
	}

	/**
	 * Strip any number of enclosing parentheses.
	 *
	 * @return the innermost wrapped node, or {@code null} for {@code ()}
	 */
	public SyntaxNode unwrapParentheses() {
		SyntaxNode current = this;
		while (current != null && current.kind == SyntaxKind.PARENTHESIZED) {
			current = current.children.isEmpty() ? null : current.children.get(0);
		}
		return current;
	}

	public String text(String source) {
		return span.text(source);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(kind);
		if (operator != null) {
			sb.append('(').append(operator).append(')');
		}
		if (name != null) {
			sb.append('<').append(name).append('>');
		}
		sb.append(span);
		return sb.toString();
	}
}
