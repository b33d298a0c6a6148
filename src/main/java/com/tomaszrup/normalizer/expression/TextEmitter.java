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
import java.util.Map;

import com.tomaszrup.normalizer.edit.FragmentEdit;
import com.tomaszrup.normalizer.edit.FragmentEdits;
import com.tomaszrup.normalizer.syntax.SourceSpan;
import com.tomaszrup.normalizer.syntax.SyntaxKind;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Renders a planned fragment and turns the result into edits against the
 * original buffer: at most one replacement, trimmed to the region that
 * actually changes, plus one insertion carrying every binding declaration.
 *
 * <p>Indentation starts from the line holding the enclosing statement and
 * grows by one unit per nesting step. Operand text is copied verbatim except
 * for folded line breaks.
 */
public class TextEmitter {
	private final ExpressionFormatOptions options;

	public TextEmitter(ExpressionFormatOptions options) {
		this.options = options;
	}

	public List<FragmentEdit> emit(ExpressionTree tree, LayoutPlan plan) {
		ExpressionFragment fragment = tree.getFragment();
		String source = fragment.getSource();
		String statementIndent = SourceText.indentOf(source, fragment.getStatementOffset());
		Rendering rendering = new Rendering(source, plan);

		SourceSpan region;
		String rendered;
		ModelNode root = tree.getRoot();
		if (root instanceof ConditionalNode) {
			region = root.getSpan();
			rendered = rendering.conditional((ConditionalNode) root, statementIndent);
		} else {
			ExpressionNode chain = (ExpressionNode) root;
			SyntaxNode fragmentRoot = fragment.getRoot();
			if (fragment.getKind() == FragmentKind.CONTROL_FLOW_CONDITION && fragmentRoot.is(SyntaxKind.PARENTHESIZED)) {
				region = fragmentRoot.getSpan();
				rendered = rendering.controlFlowCondition(chain, statementIndent);
			} else {
				region = chain.getSpan();
				rendered = rendering.standalone(chain, statementIndent);
			}
		}

		List<FragmentEdit> edits = new ArrayList<>();
		if (!plan.getBindings().isEmpty()) {
			edits.add(FragmentEdit.insertion(fragment.getStatementOffset(),
					declarations(plan.getBindings(), statementIndent)));
		}
		FragmentEdit replacement = FragmentEdits.minimalEdit(region.getStart(), region.text(source), rendered);
		if (replacement != null) {
			edits.add(replacement);
		}
		return FragmentEdits.sortAndVerify(edits);
	}

	private String declarations(List<ExtractionBinding> bindings, String statementIndent) {
		StringBuilder text = new StringBuilder();
		for (ExtractionBinding binding : bindings) {
			text.append(options.getBindingKeyword()).append(' ').append(binding.getName())
					.append(" = ").append(binding.getExpressionText()).append(";\n")
					.append(statementIndent);
		}
		return text.toString();
	}

	/**
	 * Rendering state of one fragment.
	 */
	private final class Rendering {
		private final String source;
		private final LayoutPlan plan;
		private final Map<SourceSpan, String> replacements;

		private Rendering(String source, LayoutPlan plan) {
			this.source = source;
			this.plan = plan;
			this.replacements = plan.getReplacements();
		}

		String controlFlowCondition(ExpressionNode chain, String indent) {
			if (plan.decisionFor(chain).getLayout() == Layout.COLLAPSE) {
				return "(" + collapsed(chain, indent) + ")";
			}
			String inner = indent + options.getIndentUnit();
			return "(\n" + inner + expanded(chain, inner) + "\n" + indent + ")";
		}

		String standalone(ExpressionNode chain, String indent) {
			if (plan.decisionFor(chain).getLayout() == Layout.COLLAPSE) {
				return collapsed(chain, indent);
			}
			return continued(chain, indent);
		}

		String conditional(ConditionalNode node, String indent) {
			if (plan.getConditionalLayout() == Layout.COLLAPSE && plan.isConditionalBlocked()) {
				return verbatim(node.getSpan());
			}
			String continuation = indent + options.getIndentUnit();
			String condition = condition(node.getCondition(), indent);
			String consequent = branch(node.getConsequent());
			String alternate = branch(node.getAlternate());
			if (plan.getConditionalLayout() == Layout.COLLAPSE) {
				return condition + " ? " + consequent + " : " + alternate;
			}
			return condition + "\n" + continuation + "? " + consequent + "\n" + continuation + ": " + alternate;
		}

		private String condition(ModelNode condition, String indent) {
			if (condition instanceof ExpressionNode) {
				ExpressionNode chain = (ExpressionNode) condition;
				if (chain.isParenthesized()) {
					return group(chain, indent);
				}
				return standalone(chain, indent);
			}
			return operand((OperandNode) condition);
		}

		private String branch(ConditionalBranch branch) {
			SourceSpan span = branch instanceof ConditionalNode
					? ((ConditionalNode) branch).getOuterSpan()
					: branch.getSpan();
			if (plan.isConditionalBlocked()) {
				return verbatim(span);
			}
			return SourceText.fold(verbatim(span));
		}

		/**
		 * First operand stays on the statement line, the rest go on
		 * continuation lines one unit deeper.
		 */
		private String continued(ExpressionNode chain, String indent) {
			String continuation = indent + options.getIndentUnit();
			List<ChainOperand> operands = chain.getOperands();
			StringBuilder text = new StringBuilder(render(operands.get(0), indent));
			for (int i = 1; i < operands.size(); i++) {
				appendSeparator(text, chain.getOperator(), continuation);
				text.append(render(operands.get(i), continuation));
			}
			return text.toString();
		}

		/**
		 * Every operand on its own line at {@code indent}.
		 */
		private String expanded(ExpressionNode chain, String indent) {
			List<ChainOperand> operands = chain.getOperands();
			StringBuilder text = new StringBuilder(render(operands.get(0), indent));
			for (int i = 1; i < operands.size(); i++) {
				appendSeparator(text, chain.getOperator(), indent);
				text.append(render(operands.get(i), indent));
			}
			return text.toString();
		}

		private String collapsed(ExpressionNode chain, String indent) {
			StringBuilder text = new StringBuilder();
			for (ChainOperand operand : chain.getOperands()) {
				if (text.length() > 0) {
					text.append(' ').append(chain.getOperator().getToken()).append(' ');
				}
				text.append(render(operand, indent));
			}
			return text.toString();
		}

		private void appendSeparator(StringBuilder text, LogicalOperator operator, String indent) {
			if (options.getLayoutStyle() == LayoutStyle.TRAILING_OPERATOR) {
				text.append(' ').append(operator.getToken()).append('\n').append(indent);
			} else {
				text.append('\n').append(indent).append(operator.getToken()).append(' ');
			}
		}

		private String render(ChainOperand operand, String indent) {
			if (operand instanceof GroupRef) {
				ExpressionNode target = ((GroupRef) operand).getTarget();
				String name = replacements.get(target.getGroupSpan());
				if (name != null) {
					return name;
				}
				return group(target, indent);
			}
			return operand((OperandNode) operand);
		}

		/**
		 * A nested group, rendered inline. An expanded group opens on the
		 * current line and closes on its own line at {@code indent}.
		 */
		private String group(ExpressionNode group, String indent) {
			if (group.isSynthetic()) {
				return collapsed(group, indent);
			}
			if (plan.decisionFor(group).getLayout() == Layout.COLLAPSE) {
				return "(" + collapsed(group, indent) + ")";
			}
			String inner = indent + options.getIndentUnit();
			return "(\n" + inner + expanded(group, inner) + "\n" + indent + ")";
		}

		private String operand(OperandNode operand) {
			return SourceText.fold(verbatim(operand.getSpan()));
		}

		private String verbatim(SourceSpan span) {
			return SourceText.substitute(source, span, replacements);
		}
	}
}
