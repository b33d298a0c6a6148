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
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes operand counts and nesting depths of an {@link ExpressionTree}.
 * A nested conditional branch adds one level; the groups of its condition
 * count from there.
 */
public class ComplexityAnalyzer {

	public ComplexityReport analyze(ExpressionTree tree) {
		Map<ExpressionNode, Integer> depths = new IdentityHashMap<>();
		Map<ConditionalNode, Integer> levels = new LinkedHashMap<>();
		List<ExpressionNode> chains = new ArrayList<>();
		visit(tree.getRoot(), 0, depths, levels, chains);
		chains.sort((a, b) -> a.getGroupSpan().getStart() - b.getGroupSpan().getStart());
		return new ComplexityReport(depths, levels, chains);
	}

	private void visit(ModelNode node, int level, Map<ExpressionNode, Integer> depths,
			Map<ConditionalNode, Integer> levels, List<ExpressionNode> chains) {
		if (node instanceof ExpressionNode) {
			ExpressionNode chain = (ExpressionNode) node;
			depths.put(chain, level + chain.getNestingDepth());
			chains.add(chain);
			for (ChainOperand operand : chain.getOperands()) {
				visit(operand, level, depths, levels, chains);
			}
		} else if (node instanceof GroupRef) {
			visit(((GroupRef) node).getTarget(), level, depths, levels, chains);
		} else if (node instanceof ConditionalNode) {
			ConditionalNode conditional = (ConditionalNode) node;
			levels.put(conditional, level);
			visit(conditional.getCondition(), level, depths, levels, chains);
			visit(conditional.getConsequent(), level + 1, depths, levels, chains);
			visit(conditional.getAlternate(), level + 1, depths, levels, chains);
		}
	}
}
