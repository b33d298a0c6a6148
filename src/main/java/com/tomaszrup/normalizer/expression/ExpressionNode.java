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
import java.util.Collections;
import java.util.List;

import com.tomaszrup.normalizer.syntax.SourceSpan;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * A flattened chain of operands joined by one logical operator.
 *
 * <p>A chain whose operators differ ({@code a || b && c}) is never merged:
 * the differing sub-chain becomes a <em>synthetic</em> group at the same
 * depth, so operator precedence is preserved on output.
 */
public final class ExpressionNode implements ModelNode {
	private final LogicalOperator operator;
	private final List<ChainOperand> operands;
	private final int nestingDepth;
	private final SourceSpan span;
	private final SourceSpan groupSpan;
	private final boolean parenthesized;
	private final boolean synthetic;
	private final SyntaxNode syntax;

	public ExpressionNode(LogicalOperator operator, List<ChainOperand> operands, int nestingDepth,
			SyntaxNode syntax, SourceSpan groupSpan, boolean parenthesized, boolean synthetic) {
		if (operands.size() < 2) {
			throw new IllegalArgumentException("A chain needs at least two operands");
		}
		this.operator = operator;
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
		this.nestingDepth = nestingDepth;
		this.syntax = syntax;
		this.span = syntax.getSpan();
		this.groupSpan = groupSpan;
		this.parenthesized = parenthesized;
		this.synthetic = synthetic;
	}

	public LogicalOperator getOperator() {
		return operator;
	}

	public List<ChainOperand> getOperands() {
		return operands;
	}

	public int getOperandCount() {
		return operands.size();
	}

	/**
	 * Number of parenthesized groups between this chain and the root of its
	 * enclosing expression. Conditional nesting is added by
	 * {@link ComplexityAnalyzer}.
	 */
	public int getNestingDepth() {
		return nestingDepth;
	}

	/**
	 * Span of the chain itself, without enclosing parentheses.
	 */
	@Override
	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * Span including the enclosing parentheses; equals {@link #getSpan()}
	 * for unparenthesized chains.
	 */
	public SourceSpan getGroupSpan() {
		return groupSpan;
	}

	public boolean isParenthesized() {
		return parenthesized;
	}

	public boolean isSynthetic() {
		return synthetic;
	}

	public SyntaxNode getSyntax() {
		return syntax;
	}

	@Override
	public String toString() {
		return "Chain(" + operator.getToken() + ", depth " + nestingDepth + ")" + groupSpan;
	}
}
