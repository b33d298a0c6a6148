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

import com.tomaszrup.normalizer.syntax.ScriptLexer;
import com.tomaszrup.normalizer.syntax.ScriptSyntaxException;
import com.tomaszrup.normalizer.syntax.ScriptToken;
import com.tomaszrup.normalizer.syntax.SourceSpan;
import com.tomaszrup.normalizer.syntax.SyntaxKind;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Builds the expression model of a fragment from its syntax tree.
 *
 * <ul>
 *   <li>Same-operator children are flattened into one chain.</li>
 *   <li>A different-operator child becomes a synthetic group at the same depth.</li>
 *   <li>A parenthesized logical child becomes a group one level deeper.</li>
 *   <li>Anything else, including a parenthesized non-logical expression or a
 *       {@code ??} chain, is an operand whose text is kept as is.</li>
 * </ul>
 */
public class ExpressionTreeBuilder {

	public ExpressionTree build(ExpressionFragment fragment) throws UnsupportedFragmentException {
		String source = fragment.getSource();
		SyntaxNode root = fragment.getRoot();
		rejectComments(source, root.getSpan());
		SyntaxNode unwrapped = root.unwrapParentheses();
		if (unwrapped == null) {
			throw new UnsupportedFragmentException("Empty group " + root.getSpan());
		}
		if (unwrapped.is(SyntaxKind.LOGICAL)) {
			return new ExpressionTree(fragment, buildChain(unwrapped, source, 0, unwrapped.getSpan(), false, false));
		}
		if (unwrapped.is(SyntaxKind.CONDITIONAL)) {
			return new ExpressionTree(fragment, buildConditional(unwrapped, source, unwrapped.getSpan(), false));
		}
		throw new UnsupportedFragmentException("Fragment is neither a logical chain nor a conditional: "
				+ unwrapped.getKind());
	}

	private ExpressionNode buildChain(SyntaxNode node, String source, int depth, SourceSpan groupSpan,
			boolean parenthesized, boolean synthetic) throws UnsupportedFragmentException {
		LogicalOperator operator = LogicalOperator.fromToken(node.getOperator());
		List<ChainOperand> operands = new ArrayList<>();
		collectOperands(node, operator, source, depth, operands);
		return new ExpressionNode(operator, operands, depth, node, groupSpan, parenthesized, synthetic);
	}

	private void collectOperands(SyntaxNode node, LogicalOperator operator, String source, int depth,
			List<ChainOperand> operands) throws UnsupportedFragmentException {
		for (SyntaxNode child : node.getChildren()) {
			if (child.is(SyntaxKind.LOGICAL)) {
				if (LogicalOperator.fromToken(child.getOperator()) == operator) {
					collectOperands(child, operator, source, depth, operands);
				} else {
					operands.add(new GroupRef(buildChain(child, source, depth, child.getSpan(), false, true)));
				}
			} else if (child.is(SyntaxKind.PARENTHESIZED)) {
				operands.add(buildParenthesizedOperand(child, source, depth));
			} else {
				operands.add(new OperandNode(child, source));
			}
		}
	}

	private ChainOperand buildParenthesizedOperand(SyntaxNode group, String source, int depth)
			throws UnsupportedFragmentException {
		SyntaxNode inner = group.unwrapParentheses();
		if (inner == null) {
			throw new UnsupportedFragmentException("Empty group " + group.getSpan());
		}
		if (inner.is(SyntaxKind.LOGICAL)) {
			return new GroupRef(buildChain(inner, source, depth + 1, group.getSpan(), true, false));
		}
		return new OperandNode(group, source);
	}

	private ConditionalNode buildConditional(SyntaxNode node, String source, SourceSpan outerSpan,
			boolean parenthesized) throws UnsupportedFragmentException {
		SyntaxNode test = node.getChild(0);
		ModelNode condition;
		if (test.is(SyntaxKind.LOGICAL)) {
			condition = buildChain(test, source, 0, test.getSpan(), false, false);
		} else if (test.is(SyntaxKind.PARENTHESIZED)) {
			SyntaxNode inner = test.unwrapParentheses();
			if (inner == null) {
				throw new UnsupportedFragmentException("Empty group " + test.getSpan());
			}
			condition = inner.is(SyntaxKind.LOGICAL)
					? buildChain(inner, source, 1, test.getSpan(), true, false)
					: new OperandNode(test, source);
		} else {
			condition = new OperandNode(test, source);
		}
		return new ConditionalNode(condition, buildBranch(node.getChild(1), source),
				buildBranch(node.getChild(2), source), node, outerSpan, parenthesized);
	}

	private ConditionalBranch buildBranch(SyntaxNode branch, String source) throws UnsupportedFragmentException {
		if (branch.is(SyntaxKind.CONDITIONAL)) {
			return buildConditional(branch, source, branch.getSpan(), false);
		}
		if (branch.is(SyntaxKind.PARENTHESIZED)) {
			SyntaxNode inner = branch.unwrapParentheses();
			if (inner == null) {
				throw new UnsupportedFragmentException("Empty group " + branch.getSpan());
			}
			if (inner.is(SyntaxKind.CONDITIONAL)) {
				return buildConditional(inner, source, branch.getSpan(), true);
			}
		}
		return new OperandNode(branch, source);
	}

	private void rejectComments(String source, SourceSpan span) throws UnsupportedFragmentException {
		List<ScriptToken> tokens;
		try {
			tokens = new ScriptLexer(source).tokenize(span.getStart(), span.getEnd());
		} catch (ScriptSyntaxException e) {
			throw new UnsupportedFragmentException("Fragment does not tokenize", e);
		}
		for (ScriptToken token : tokens) {
			if (token.isComment()) {
				throw new UnsupportedFragmentException("Fragment contains a comment at offset " + token.getStart());
			}
		}
	}
}
