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
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.normalizer.syntax.SourceSpan;
import com.tomaszrup.normalizer.syntax.SyntaxKind;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Decides collapse or expand for every chain of a tree and which groups are
 * pulled out into bindings.
 *
 * <p>Groups deeper than {@code maxNestingDepth} are extracted deepest first,
 * leftmost first among groups of equal depth. A group nested inside another
 * extracted group is extracted before it, so the outer binding refers to the
 * inner one by name.
 */
public class LayoutDecisionEngine {
	private static final Logger logger = LoggerFactory.getLogger(LayoutDecisionEngine.class);

	static final int MAX_NAME_ATTEMPTS = 5;
	static final int MIN_BLOCKING_OBJECT_PROPERTIES = 2;
	static final int MIN_BLOCKING_ARRAY_ELEMENTS = 3;

	private final ExpressionFormatOptions options;
	private final BindingNameStrategy nameStrategy;

	public LayoutDecisionEngine(ExpressionFormatOptions options, BindingNameStrategy nameStrategy) {
		this.options = options;
		this.nameStrategy = nameStrategy;
	}

	public LayoutPlan decide(ExpressionTree tree, ComplexityReport report) {
		ExpressionFragment fragment = tree.getFragment();
		List<UnfixableViolation> violations = new ArrayList<>();
		List<ExtractionBinding> bindings = extract(fragment, report, violations);

		Set<SourceSpan> extractedSpans = new HashSet<>();
		for (ExtractionBinding binding : bindings) {
			extractedSpans.add(binding.getReplacedSpan());
		}
		Map<ExpressionNode, FormatDecision> decisions = new IdentityHashMap<>();
		for (ExpressionNode chain : report.getChains()) {
			Layout layout = !chain.isSynthetic() && chain.getOperandCount() > options.getMaxOperands()
					? Layout.EXPAND
					: Layout.COLLAPSE;
			List<GroupRef> extract = new ArrayList<>();
			for (ChainOperand operand : chain.getOperands()) {
				if (operand instanceof GroupRef && extractedSpans.contains(operand.getSpan())) {
					extract.add((GroupRef) operand);
				}
			}
			decisions.put(chain, new FormatDecision(layout, extract));
		}

		int maxLevel = report.getMaxConditionalLevel();
		if (maxLevel > options.getMaxNestingDepth()) {
			for (ConditionalNode conditional : report.getConditionals()) {
				if (report.levelOf(conditional) > options.getMaxNestingDepth()) {
					violations.add(new UnfixableViolation(conditional.getOuterSpan(),
							"Conditional nested " + report.levelOf(conditional) + " levels deep exceeds "
									+ options.getMaxNestingDepth() + "; cannot auto-fix"));
				}
			}
		}

		Layout conditionalLayout = null;
		boolean blocked = false;
		if (tree.isConditional()) {
			ConditionalNode root = (ConditionalNode) tree.getRoot();
			conditionalLayout = root.getConditionOperandCount() > options.getMaxOperands()
					? Layout.EXPAND
					: Layout.COLLAPSE;
			blocked = blocksReflow(root.getConsequent()) || blocksReflow(root.getAlternate());
		}
		return new LayoutPlan(decisions, bindings, violations, conditionalLayout, blocked);
	}

	private List<ExtractionBinding> extract(ExpressionFragment fragment, ComplexityReport report,
			List<UnfixableViolation> violations) {
		List<ExpressionNode> candidates = new ArrayList<>();
		for (ExpressionNode group : report.getGroups()) {
			if (report.depthOf(group) > options.getMaxNestingDepth()) {
				candidates.add(group);
			}
		}
		// stable: source order is kept among equal depths
		candidates.sort((a, b) -> report.depthOf(b) - report.depthOf(a));

		String source = fragment.getSource();
		Set<String> taken = new HashSet<>(fragment.getReservedNames());
		Map<SourceSpan, String> replacements = new LinkedHashMap<>();
		List<ExtractionBinding> bindings = new ArrayList<>();
		for (ExpressionNode group : candidates) {
			String reason = refusal(fragment, group);
			if (reason != null) {
				violations.add(new UnfixableViolation(group.getGroupSpan(), reason));
				continue;
			}
			String name = resolveName(nameStrategy.baseName(group, source), taken);
			if (name == null) {
				logger.debug("No free binding name for group {}", group.getGroupSpan());
				violations.add(new UnfixableViolation(group.getGroupSpan(),
						"Group nested " + report.depthOf(group) + " levels deep: no free binding name; cannot auto-fix"));
				continue;
			}
			taken.add(name);
			String text = SourceText.fold(SourceText.substitute(source, group.getSpan(), replacements));
			replacements.put(group.getGroupSpan(), name);
			bindings.add(new ExtractionBinding(name, text, fragment.getStatementOffset(), group.getGroupSpan()));
		}
		return bindings;
	}

	private String refusal(ExpressionFragment fragment, ExpressionNode group) {
		if (!fragment.isHoistable()) {
			return "Group nested deeper than " + options.getMaxNestingDepth()
					+ " levels cannot be moved out of this position; cannot auto-fix";
		}
		Set<String> visible = fragment.getVisibleIdentifiers();
		if (visible != null) {
			Set<String> free = new HashSet<>();
			collectIdentifiers(group.getSyntax(), free);
			free.removeAll(visible);
			if (!free.isEmpty()) {
				return "Group references " + free + " which are not in scope before the statement; cannot auto-fix";
			}
		}
		return null;
	}

	private String resolveName(String base, Set<String> taken) {
		for (int attempt = 1; attempt <= MAX_NAME_ATTEMPTS; attempt++) {
			String candidate = attempt == 1 ? base : base + attempt;
			if (!taken.contains(candidate)) {
				return candidate;
			}
		}
		return null;
	}

	private void collectIdentifiers(SyntaxNode node, Set<String> identifiers) {
		if (node.is(SyntaxKind.IDENTIFIER)) {
			identifiers.add(node.getName());
		}
		for (SyntaxNode child : node.getChildren()) {
			collectIdentifiers(child, identifiers);
		}
	}

	private boolean blocksReflow(ConditionalBranch branch) {
		if (branch instanceof ConditionalNode) {
			ConditionalNode nested = (ConditionalNode) branch;
			return !nested.isParenthesized() || nested.getConditionOperandCount() > options.getMaxOperands();
		}
		SyntaxNode syntax = ((OperandNode) branch).getSyntax().unwrapParentheses();
		if (syntax == null) {
			return false;
		}
		if (syntax.is(SyntaxKind.OBJECT_LITERAL)) {
			return syntax.getChildren().size() >= MIN_BLOCKING_OBJECT_PROPERTIES;
		}
		if (syntax.is(SyntaxKind.ARRAY_LITERAL)) {
			return syntax.getChildren().size() >= MIN_BLOCKING_ARRAY_ELEMENTS;
		}
		return false;
	}
}
