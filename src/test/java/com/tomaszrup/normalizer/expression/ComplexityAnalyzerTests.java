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

class ComplexityAnalyzerTests {
	private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();

	private static ExpressionNode groupAt(ExpressionNode chain, int index) {
		return ((GroupRef) chain.getOperands().get(index)).getTarget();
	}

	@Test
	void testFlatChainHasDepthZero() throws Exception {
		ExpressionTree tree = ExpressionFixtures.tree("const x = a && b && c;");
		ComplexityReport report = analyzer.analyze(tree);
		Assertions.assertEquals(0, report.getMaxDepth());
		Assertions.assertEquals(1, report.getChains().size());
		Assertions.assertTrue(report.getGroups().isEmpty());
		Assertions.assertEquals(3, report.operandCount((ExpressionNode) tree.getRoot()));
	}

	@Test
	void testGroupDepths() throws Exception {
		ExpressionTree tree = ExpressionFixtures.tree("const r = (a && (b || (c && d))) || e;");
		ComplexityReport report = analyzer.analyze(tree);
		ExpressionNode root = (ExpressionNode) tree.getRoot();
		ExpressionNode first = groupAt(root, 0);
		ExpressionNode third = groupAt(groupAt(first, 1), 1);
		Assertions.assertEquals(0, report.depthOf(root));
		Assertions.assertEquals(1, report.depthOf(first));
		Assertions.assertEquals(3, report.depthOf(third));
		Assertions.assertEquals(3, report.getMaxDepth());
		Assertions.assertEquals(3, report.getGroups().size());
	}

	@Test
	void testSyntheticGroupsAreChainsButNotGroups() throws Exception {
		ComplexityReport report = analyzer.analyze(ExpressionFixtures.tree("const x = a && b || c && d;"));
		Assertions.assertEquals(3, report.getChains().size());
		Assertions.assertTrue(report.getGroups().isEmpty());
		Assertions.assertEquals(0, report.getMaxDepth());
	}

	@Test
	void testChainsAreInSourceOrder() throws Exception {
		ComplexityReport report = analyzer.analyze(ExpressionFixtures.tree("const x = a || (b && c) || (d && e);"));
		int previous = -1;
		for (ExpressionNode chain : report.getChains()) {
			Assertions.assertTrue(chain.getGroupSpan().getStart() >= previous);
			previous = chain.getGroupSpan().getStart();
		}
	}

	@Test
	void testConditionalLevels() throws Exception {
		ExpressionTree tree = ExpressionFixtures.tree("const v = a ? (b ? c : (d ? e : f)) : g;");
		ComplexityReport report = analyzer.analyze(tree);
		ConditionalNode root = (ConditionalNode) tree.getRoot();
		ConditionalNode nested = (ConditionalNode) root.getConsequent();
		ConditionalNode innermost = (ConditionalNode) nested.getAlternate();
		Assertions.assertEquals(0, report.levelOf(root));
		Assertions.assertEquals(1, report.levelOf(nested));
		Assertions.assertEquals(2, report.levelOf(innermost));
		Assertions.assertEquals(2, report.getMaxConditionalLevel());
		Assertions.assertEquals(3, report.getConditionals().size());
	}

	@Test
	void testConditionInsideBranchCountsBranchLevel() throws Exception {
		ExpressionTree tree = ExpressionFixtures.tree("const v = a ? ((b && (c || d)) ? e : f) : g;");
		ComplexityReport report = analyzer.analyze(tree);
		ConditionalNode nested = (ConditionalNode) ((ConditionalNode) tree.getRoot()).getConsequent();
		ExpressionNode condition = (ExpressionNode) nested.getCondition();
		Assertions.assertEquals(2, report.depthOf(condition));
		Assertions.assertEquals(3, report.depthOf(groupAt(condition, 1)));
		Assertions.assertEquals(3, report.getMaxDepth());
	}

	@Test
	void testForeignNodeIsRejected() throws Exception {
		ComplexityReport report = analyzer.analyze(ExpressionFixtures.tree("const x = a && b;"));
		ExpressionNode other = (ExpressionNode) ExpressionFixtures.tree("const y = c || d;").getRoot();
		Assertions.assertThrows(IllegalArgumentException.class, () -> report.depthOf(other));
	}
}
