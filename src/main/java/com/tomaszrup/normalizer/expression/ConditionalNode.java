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

import com.tomaszrup.normalizer.syntax.SourceSpan;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * {@code condition ? consequent : alternate}.
 *
 * <p>The condition is an {@link ExpressionNode} when it is a logical chain
 * (parenthesized or not) and an {@link OperandNode} otherwise.
 */
public final class ConditionalNode implements ConditionalBranch {
	private final ModelNode condition;
	private final ConditionalBranch consequent;
	private final ConditionalBranch alternate;
	private final SyntaxNode syntax;
	private final SourceSpan outerSpan;
	private final boolean parenthesized;

	public ConditionalNode(ModelNode condition, ConditionalBranch consequent, ConditionalBranch alternate,
			SyntaxNode syntax, SourceSpan outerSpan, boolean parenthesized) {
		this.condition = condition;
		this.consequent = consequent;
		this.alternate = alternate;
		this.syntax = syntax;
		this.outerSpan = outerSpan;
		this.parenthesized = parenthesized;
	}

	public ModelNode getCondition() {
		return condition;
	}

	public ConditionalBranch getConsequent() {
		return consequent;
	}

	public ConditionalBranch getAlternate() {
		return alternate;
	}

	public SyntaxNode getSyntax() {
		return syntax;
	}

	/**
	 * Span of the conditional itself, without enclosing parentheses.
	 */
	@Override
	public SourceSpan getSpan() {
		return syntax.getSpan();
	}

	public SourceSpan getOuterSpan() {
		return outerSpan;
	}

	public boolean isParenthesized() {
		return parenthesized;
	}

	/**
	 * Operand count driving the layout: a parenthesized or non-logical
	 * condition counts as one operand.
	 */
	public int getConditionOperandCount() {
		if (condition instanceof ExpressionNode) {
			ExpressionNode chain = (ExpressionNode) condition;
			return chain.isParenthesized() ? 1 : chain.getOperandCount();
		}
		return 1;
	}

	@Override
	public String toString() {
		return "Conditional" + outerSpan;
	}
}
