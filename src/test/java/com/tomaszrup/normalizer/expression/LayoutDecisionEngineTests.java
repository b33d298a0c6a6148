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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LayoutDecisionEngineTests {
	private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();
	private final ExpressionTreeBuilder builder = new ExpressionTreeBuilder();

	private LayoutPlan plan(ExpressionFragment fragment) throws UnsupportedFragmentException {
		return plan(fragment, new DescriptiveBindingNameStrategy());
	}

	private LayoutPlan plan(ExpressionFragment fragment, BindingNameStrategy strategy)
			throws UnsupportedFragmentException {
		ExpressionTree tree = builder.build(fragment);
		return new LayoutDecisionEngine(ExpressionFixtures.LEADING, strategy).decide(tree, analyzer.analyze(tree));
	}

	private LayoutPlan plan(String source) throws UnsupportedFragmentException {
		return plan(ExpressionFixtures.first(source));
	}

	private static ExpressionNode rootChain(String source) throws UnsupportedFragmentException {
		return (ExpressionNode) new ExpressionTreeBuilder().build(ExpressionFixtures.first(source)).getRoot();
	}

	// ------------------------------------------------------------------
	// Collapse / expand
	// ------------------------------------------------------------------

	@Test
	void testChainAtThresholdCollapses() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures.first("const x = a && b && c;");
		ExpressionTree tree = builder.build(fragment);
		LayoutPlan plan = new LayoutDecisionEngine(ExpressionFixtures.LEADING, new DescriptiveBindingNameStrategy())
				.decide(tree, analyzer.analyze(tree));
		Assertions.assertEquals(Layout.COLLAPSE, plan.decisionFor((ExpressionNode) tree.getRoot()).getLayout());
	}

	@Test
	void testChainAboveThresholdExpands() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures.first("const x = a && b && c && d;");
		ExpressionTree tree = builder.build(fragment);
		LayoutPlan plan = new LayoutDecisionEngine(ExpressionFixtures.LEADING, new DescriptiveBindingNameStrategy())
				.decide(tree, analyzer.analyze(tree));
		Assertions.assertEquals(Layout.EXPAND, plan.decisionFor((ExpressionNode) tree.getRoot()).getLayout());
		Assertions.assertTrue(plan.getBindings().isEmpty());
		Assertions.assertTrue(plan.getViolations().isEmpty());
	}

	@Test
	void testSyntheticGroupNeverExpands() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures.first("const x = a && b && c && d || e;");
		ExpressionTree tree = builder.build(fragment);
		LayoutPlan plan = new LayoutDecisionEngine(ExpressionFixtures.LEADING, new DescriptiveBindingNameStrategy())
				.decide(tree, analyzer.analyze(tree));
		ExpressionNode synthetic = ((GroupRef) ((ExpressionNode) tree.getRoot()).getOperands().get(0)).getTarget();
		Assertions.assertEquals(Layout.COLLAPSE, plan.decisionFor(synthetic).getLayout());
	}

	@Test
	void testUnknownNodeHasNoDecision() throws Exception {
		LayoutPlan plan = plan("const x = a && b;");
		ExpressionNode other = rootChain("const y = c && d;");
		Assertions.assertThrows(IllegalArgumentException.class, () -> plan.decisionFor(other));
	}

	// ------------------------------------------------------------------
	// Extraction
	// ------------------------------------------------------------------

	@Test
	void testGroupDeeperThanBoundIsExtracted() throws Exception {
		String source = "const r = (a && (b || (c && d))) || e;";
		LayoutPlan plan = plan(source);
		Assertions.assertEquals(1, plan.getBindings().size());
		ExtractionBinding binding = plan.getBindings().get(0);
		Assertions.assertEquals("isCAndD", binding.getName());
		Assertions.assertEquals("c && d", binding.getExpressionText());
		Assertions.assertEquals("(c && d)", binding.getReplacedSpan().text(source));
		Assertions.assertEquals(0, binding.getInsertionOffset());
		Assertions.assertTrue(plan.getViolations().isEmpty());
	}

	@Test
	void testDeepestGroupIsExtractedFirstAndReferencedByName() throws Exception {
		LayoutPlan plan = plan("const r = a && (b || (c && (d || (e && f))));");
		List<ExtractionBinding> bindings = plan.getBindings();
		Assertions.assertEquals(2, bindings.size());
		Assertions.assertEquals("isEAndF", bindings.get(0).getName());
		Assertions.assertEquals("e && f", bindings.get(0).getExpressionText());
		Assertions.assertEquals("isDOrCond", bindings.get(1).getName());
		Assertions.assertEquals("d || isEAndF", bindings.get(1).getExpressionText());
	}

	@Test
	void testEqualDepthGroupsAreExtractedLeftToRight() throws Exception {
		LayoutPlan plan = plan("const r = a && (b || ((c && d) && (e || f)));");
		List<ExtractionBinding> bindings = plan.getBindings();
		Assertions.assertEquals(2, bindings.size());
		Assertions.assertEquals("isCAndD", bindings.get(0).getName());
		Assertions.assertEquals("isEOrF", bindings.get(1).getName());
	}

	@Test
	void testMultiLineGroupIsFoldedIntoBinding() throws Exception {
		LayoutPlan plan = plan("const r = (a && (b || (\n    c\n    && d\n))) || e;");
		Assertions.assertEquals("c && d", plan.getBindings().get(0).getExpressionText());
	}

	@Test
	void testReservedNameGetsNumericSuffix() throws Exception {
		Set<String> reserved = new HashSet<>(Collections.singletonList("isCAndD"));
		LayoutPlan plan = plan(ExpressionFixtures.first("const r = (a && (b || (c && d))) || e;", reserved));
		Assertions.assertEquals("isCAndD2", plan.getBindings().get(0).getName());
	}

	@Test
	void testDocumentIdentifiersAreReserved() throws Exception {
		String source = "const isCAndD = 1;\nconst r = (a && (b || (c && d))) || e;";
		List<ExpressionFragment> fragments = ExpressionFixtures.fragments(source);
		LayoutPlan plan = plan(fragments.get(0));
		Assertions.assertEquals("isCAndD2", plan.getBindings().get(0).getName());
	}

	@Test
	void testExhaustedNamesReportViolation() throws Exception {
		Set<String> reserved = new HashSet<>(Arrays.asList("isCAndD", "isCAndD2", "isCAndD3", "isCAndD4", "isCAndD5"));
		LayoutPlan plan = plan(ExpressionFixtures.first("const r = (a && (b || (c && d))) || e;", reserved));
		Assertions.assertTrue(plan.getBindings().isEmpty());
		Assertions.assertEquals(1, plan.getViolations().size());
		Assertions.assertTrue(plan.getViolations().get(0).getMessage().contains("cannot auto-fix"));
	}

	@Test
	void testNonHoistableFragmentReportsViolation() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures.firstBuilder("const r = (a && (b || (c && d))) || e;")
				.hoistable(false)
				.build();
		LayoutPlan plan = plan(fragment);
		Assertions.assertTrue(plan.getBindings().isEmpty());
		Assertions.assertEquals(1, plan.getViolations().size());
	}

	@Test
	void testIdentifierOutOfScopeReportsViolation() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures.firstBuilder("const r = (a && (b || (c && d))) || e;")
				.visibleIdentifiers(new HashSet<>(Arrays.asList("a", "b", "c", "e")))
				.build();
		LayoutPlan plan = plan(fragment);
		Assertions.assertTrue(plan.getBindings().isEmpty());
		Assertions.assertTrue(plan.getViolations().get(0).getMessage().contains("d"));
	}

	@Test
	void testComputedKeyIdentifierIsChecked() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures
				.firstBuilder("const r = (a && (b || (c && lookup({ [k]: 1 })))) || e;")
				.visibleIdentifiers(new HashSet<>(Arrays.asList("a", "b", "c", "e", "lookup")))
				.build();
		LayoutPlan plan = plan(fragment);
		Assertions.assertTrue(plan.getBindings().isEmpty());
		Assertions.assertTrue(plan.getViolations().get(0).getMessage().contains("[k]"));
	}

	@Test
	void testIdentifiersInScopeAllowExtraction() throws Exception {
		ExpressionFragment fragment = ExpressionFixtures.firstBuilder("const r = (a && (b || (c && d))) || e;")
				.visibleIdentifiers(new HashSet<>(Arrays.asList("a", "b", "c", "d", "e")))
				.build();
		Assertions.assertEquals(1, plan(fragment).getBindings().size());
	}

	@Test
	void testCustomNameStrategy() throws Exception {
		LayoutPlan plan = plan(ExpressionFixtures.first("const r = (a && (b || (c && d))) || e;"),
				(group, source) -> "nested");
		Assertions.assertEquals("nested", plan.getBindings().get(0).getName());
		Assertions.assertEquals("nested", plan.getReplacements().values().iterator().next());
	}

	// ------------------------------------------------------------------
	// Conditionals
	// ------------------------------------------------------------------

	@Test
	void testConditionalLayoutFollowsConditionOperandCount() throws Exception {
		Assertions.assertEquals(Layout.COLLAPSE, plan("const v = a && b && c ? x : y;").getConditionalLayout());
		Assertions.assertEquals(Layout.EXPAND, plan("const v = a && b && c && d ? x : y;").getConditionalLayout());
		Assertions.assertNull(plan("const v = a && b;").getConditionalLayout());
	}

	@Test
	void testConditionalNestedBeyondBoundIsReported() throws Exception {
		LayoutPlan plan = plan("const v = a ? b : (c ? d : (e ? f : (g ? h : i)));");
		Assertions.assertEquals(1, plan.getViolations().size());
		Assertions.assertTrue(plan.getViolations().get(0).getMessage().contains("cannot auto-fix"));
	}

	@Test
	void testConditionalWithinBoundIsNotReported() throws Exception {
		Assertions.assertTrue(plan("const v = a ? b : (c ? d : (e ? f : g));").getViolations().isEmpty());
	}

	@Test
	void testComplexBranchesBlockReflow() throws Exception {
		Assertions.assertTrue(plan("const v = a ? { x: 1, y: 2 } : null;").isConditionalBlocked());
		Assertions.assertTrue(plan("const v = a ? [1, 2, 3] : [];").isConditionalBlocked());
		Assertions.assertTrue(plan("const v = a ? b : c ? d : e;").isConditionalBlocked());
		Assertions.assertFalse(plan("const v = a ? { x: 1 } : [1, 2];").isConditionalBlocked());
		Assertions.assertFalse(plan("const v = a ? b : (c ? d : e);").isConditionalBlocked());
	}
}
