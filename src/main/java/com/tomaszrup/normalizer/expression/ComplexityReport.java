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

/**
 * Per-node metrics of one expression tree.
 */
public final class ComplexityReport {
	private final Map<ExpressionNode, Integer> depths;
	private final Map<ConditionalNode, Integer> conditionalLevels;
	private final List<ExpressionNode> chains;
	private final List<ExpressionNode> groups;

	ComplexityReport(Map<ExpressionNode, Integer> depths, Map<ConditionalNode, Integer> conditionalLevels,
			List<ExpressionNode> chains) {
		this.depths = new IdentityHashMap<>(depths);
		this.conditionalLevels = new LinkedHashMap<>(conditionalLevels);
		this.chains = Collections.unmodifiableList(new ArrayList<>(chains));
		List<ExpressionNode> parenthesized = new ArrayList<>();
		for (ExpressionNode chain : chains) {
			if (chain.isParenthesized()) {
				parenthesized.add(chain);
			}
		}
		this.groups = Collections.unmodifiableList(parenthesized);
	}

	/**
	 * Depth of a chain counted from the fragment root, through parenthesized
	 * groups and nested conditional branches.
	 */
	public int depthOf(ExpressionNode node) {
		Integer depth = depths.get(node);
		if (depth == null) {
			throw new IllegalArgumentException("Node is not part of this tree: " + node);
		}
		return depth;
	}

	/**
	 * Number of conditional branches enclosing {@code node}; zero at the root.
	 */
	public int levelOf(ConditionalNode node) {
		Integer level = conditionalLevels.get(node);
		if (level == null) {
			throw new IllegalArgumentException("Node is not part of this tree: " + node);
		}
		return level;
	}

	public int operandCount(ExpressionNode node) {
		return node.getOperandCount();
	}

	/**
	 * Every chain of the tree, synthetic ones included, in source order.
	 */
	public List<ExpressionNode> getChains() {
		return chains;
	}

	/**
	 * Parenthesized groups in source order.
	 */
	public List<ExpressionNode> getGroups() {
		return groups;
	}

	public List<ConditionalNode> getConditionals() {
		return new ArrayList<>(conditionalLevels.keySet());
	}

	public int getMaxDepth() {
		int max = 0;
		for (Integer depth : depths.values()) {
			max = Math.max(max, depth);
		}
		return Math.max(max, getMaxConditionalLevel());
	}

	public int getMaxConditionalLevel() {
		int max = 0;
		for (Integer level : conditionalLevels.values()) {
			max = Math.max(max, level);
		}
		return max;
	}
}
