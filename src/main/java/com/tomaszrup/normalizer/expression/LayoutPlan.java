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
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.normalizer.syntax.SourceSpan;

/**
 * Everything the emitter needs to render one fragment: a decision per chain,
 * the bindings in extraction order, and the violations that could not be
 * fixed.
 */
public final class LayoutPlan {
	private final Map<ExpressionNode, FormatDecision> decisions;
	private final List<ExtractionBinding> bindings;
	private final List<UnfixableViolation> violations;
	private final Layout conditionalLayout;
	private final boolean conditionalBlocked;

	LayoutPlan(Map<ExpressionNode, FormatDecision> decisions, List<ExtractionBinding> bindings,
			List<UnfixableViolation> violations, Layout conditionalLayout, boolean conditionalBlocked) {
		this.decisions = new IdentityHashMap<>(decisions);
		this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
		this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
		this.conditionalLayout = conditionalLayout;
		this.conditionalBlocked = conditionalBlocked;
	}

	public FormatDecision decisionFor(ExpressionNode node) {
		FormatDecision decision = decisions.get(node);
		if (decision == null) {
			throw new IllegalArgumentException("No decision for " + node);
		}
		return decision;
	}

	public List<ExtractionBinding> getBindings() {
		return bindings;
	}

	public List<UnfixableViolation> getViolations() {
		return violations;
	}

	/**
	 * Layout of the root conditional, or {@code null} when the root is a chain.
	 */
	public Layout getConditionalLayout() {
		return conditionalLayout;
	}

	/**
	 * Whether a branch of the root conditional keeps it from being reflowed.
	 */
	public boolean isConditionalBlocked() {
		return conditionalBlocked;
	}

	/**
	 * Replaced group spans mapped to the binding names that stand in for them.
	 */
	public Map<SourceSpan, String> getReplacements() {
		Map<SourceSpan, String> replacements = new LinkedHashMap<>();
		for (ExtractionBinding binding : bindings) {
			replacements.put(binding.getReplacedSpan(), binding.getName());
		}
		return replacements;
	}

	public boolean isExtracted(ExpressionNode node) {
		for (ExtractionBinding binding : bindings) {
			if (binding.getReplacedSpan().equals(node.getGroupSpan())) {
				return true;
			}
		}
		return false;
	}
}
