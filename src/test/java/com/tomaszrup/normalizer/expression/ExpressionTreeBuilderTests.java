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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.normalizer.syntax.ScriptExpressionParser;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

class ExpressionTreeBuilderTests {

	private static ExpressionNode rootChain(String source) throws UnsupportedFragmentException {
		ModelNode root = ExpressionFixtures.tree(source).getRoot();
		Assertions.assertTrue(root instanceof ExpressionNode, "expected a chain but got " + root);
		return (ExpressionNode) root;
	}

	private static ExpressionNode groupAt(ExpressionNode chain, int index) {
		ChainOperand operand = chain.getOperands().get(index);
		Assertions.assertTrue(operand instanceof GroupRef, "expected a group but got " + operand);
		return ((GroupRef) operand).getTarget();
	}

	// ------------------------------------------------------------------
	// Chains
	// ------------------------------------------------------------------

	@Test
	void testSameOperatorIsFlattened() throws Exception {
		ExpressionNode chain = rootChain("const x = a && b && c && d;");
		Assertions.assertEquals(LogicalOperator.AND, chain.getOperator());
		Assertions.assertEquals(4, chain.getOperandCount());
		Assertions.assertEquals(0, chain.getNestingDepth());
		Assertions.assertFalse(chain.isParenthesized());
	}

	@Test
	void testMixedOperatorsMakeSyntheticGroup() throws Exception {
		ExpressionNode chain = rootChain("const x = a && b && c || d;");
		Assertions.assertEquals(LogicalOperator.OR, chain.getOperator());
		Assertions.assertEquals(2, chain.getOperandCount());
		ExpressionNode synthetic = groupAt(chain, 0);
		Assertions.assertTrue(synthetic.isSynthetic());
		Assertions.assertEquals(0, synthetic.getNestingDepth());
		Assertions.assertEquals(3, synthetic.getOperandCount());
	}

	@Test
	void testParenthesizedGroupIsOneLevelDeeper() throws Exception {
		String source = "const x = (a || b) && c;";
		ExpressionNode chain = rootChain(source);
		ExpressionNode group = groupAt(chain, 0);
		Assertions.assertTrue(group.isParenthesized());
		Assertions.assertFalse(group.isSynthetic());
		Assertions.assertEquals(1, group.getNestingDepth());
		Assertions.assertEquals("(a || b)", group.getGroupSpan().text(source));
		Assertions.assertEquals("a || b", group.getSpan().text(source));
	}

	@Test
	void testEnclosingParenthesesOfRootAreUnwrapped() throws Exception {
		ExpressionNode chain = rootChain("const x = ((a && b));");
		Assertions.assertFalse(chain.isParenthesized());
		Assertions.assertEquals(0, chain.getNestingDepth());
	}

	@Test
	void testParenthesizedNonLogicalIsAnOperand() throws Exception {
		String source = "const x = (a + b) && (c ?? d) && e;";
		ExpressionNode chain = rootChain(source);
		Assertions.assertEquals(3, chain.getOperandCount());
		Assertions.assertTrue(chain.getOperands().get(0) instanceof OperandNode);
		Assertions.assertEquals("(c ?? d)", ((OperandNode) chain.getOperands().get(1)).getText());
	}

	@Test
	void testDeepNesting() throws Exception {
		ExpressionNode chain = rootChain("const r = (a && (b || (c && d))) || e;");
		ExpressionNode first = groupAt(chain, 0);
		ExpressionNode second = groupAt(first, 1);
		ExpressionNode third = groupAt(second, 1);
		Assertions.assertEquals(1, first.getNestingDepth());
		Assertions.assertEquals(2, second.getNestingDepth());
		Assertions.assertEquals(3, third.getNestingDepth());
	}

	// ------------------------------------------------------------------
	// Conditionals
	// ------------------------------------------------------------------

	@Test
	void testConditionalWithChainCondition() throws Exception {
		ExpressionTree tree = ExpressionFixtures.tree("const v = a && b && c ? x : y;");
		Assertions.assertTrue(tree.isConditional());
		ConditionalNode conditional = (ConditionalNode) tree.getRoot();
		Assertions.assertTrue(conditional.getCondition() instanceof ExpressionNode);
		Assertions.assertEquals(3, conditional.getConditionOperandCount());
		Assertions.assertTrue(conditional.getConsequent() instanceof OperandNode);
	}

	@Test
	void testParenthesizedConditionCountsAsOneOperand() throws Exception {
		ConditionalNode conditional = (ConditionalNode) ExpressionFixtures
				.tree("const v = (a && b && c && d) ? x : y;").getRoot();
		ExpressionNode condition = (ExpressionNode) conditional.getCondition();
		Assertions.assertTrue(condition.isParenthesized());
		Assertions.assertEquals(1, condition.getNestingDepth());
		Assertions.assertEquals(1, conditional.getConditionOperandCount());
	}

	@Test
	void testSimpleConditionIsAnOperand() throws Exception {
		ConditionalNode conditional = (ConditionalNode) ExpressionFixtures
				.tree("const v = ready ? x : y;").getRoot();
		Assertions.assertTrue(conditional.getCondition() instanceof OperandNode);
		Assertions.assertEquals(1, conditional.getConditionOperandCount());
	}

	@Test
	void testNestedConditionalBranches() throws Exception {
		String source = "const v = a ? b : (c ? d : e ? f : g);";
		ConditionalNode root = (ConditionalNode) ExpressionFixtures.tree(source).getRoot();
		Assertions.assertTrue(root.getAlternate() instanceof ConditionalNode);
		ConditionalNode nested = (ConditionalNode) root.getAlternate();
		Assertions.assertTrue(nested.isParenthesized());
		Assertions.assertEquals("(c ? d : e ? f : g)", nested.getOuterSpan().text(source));
		Assertions.assertEquals("c ? d : e ? f : g", nested.getSpan().text(source));
		ConditionalNode innermost = (ConditionalNode) nested.getAlternate();
		Assertions.assertFalse(innermost.isParenthesized());
	}

	// ------------------------------------------------------------------
	// Unsupported fragments
	// ------------------------------------------------------------------

	@Test
	void testCommentInsideFragmentIsRejected() {
		ExpressionFragment fragment = ExpressionFixtures.first("const x = a && /* keep */ b;");
		Assertions.assertThrows(UnsupportedFragmentException.class, () -> new ExpressionTreeBuilder().build(fragment));
	}

	@Test
	void testNonLogicalRootIsRejected() {
		String source = "a + b";
		SyntaxNode root = new ScriptExpressionParser(source).parse();
		ExpressionFragment fragment = ExpressionFragment.builder(source, root, FragmentKind.LOGICAL_EXPRESSION).build();
		Assertions.assertThrows(UnsupportedFragmentException.class, () -> new ExpressionTreeBuilder().build(fragment));
	}

	@Test
	void testEmptyGroupIsRejected() {
		String source = "()";
		SyntaxNode root = new ScriptExpressionParser(source).parse();
		ExpressionFragment fragment = ExpressionFragment.builder(source, root, FragmentKind.LOGICAL_EXPRESSION).build();
		Assertions.assertThrows(UnsupportedFragmentException.class, () -> new ExpressionTreeBuilder().build(fragment));
	}

	@Test
	void testStatementOffsetAfterFragmentIsRejected() {
		String source = "a && b";
		SyntaxNode root = new ScriptExpressionParser(source).parse();
		Assertions.assertThrows(IllegalArgumentException.class, () -> ExpressionFragment
				.builder(source, root, FragmentKind.LOGICAL_EXPRESSION).statementOffset(3).build());
	}
}
