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

import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Names a group after its operands: {@code (c && d)} becomes {@code isCAndD}.
 * Operands that are not plain identifiers contribute {@code Expr} (member
 * access, calls, comparisons) or {@code Cond}.
 */
public class DescriptiveBindingNameStrategy implements BindingNameStrategy {
	public static final int MAX_NAME_LENGTH = 30;
	public static final String FALLBACK_NAME = "isNestedCondition";

	@Override
	public String baseName(ExpressionNode group, String source) {
		StringBuilder name = new StringBuilder("is");
		boolean first = true;
		for (ChainOperand operand : group.getOperands()) {
			if (!first) {
				name.append(group.getOperator().getWord());
			}
			first = false;
			name.append(describe(operand));
		}
		if (name.length() > MAX_NAME_LENGTH) {
			return FALLBACK_NAME;
		}
		return name.toString();
	}

	private String describe(ChainOperand operand) {
		if (!(operand instanceof OperandNode)) {
			return "Cond";
		}
		SyntaxNode syntax = ((OperandNode) operand).getSyntax().unwrapParentheses();
		if (syntax == null) {
			return "Cond";
		}
		switch (syntax.getKind()) {
			case IDENTIFIER:
				return capitalize(syntax.getName().replace("$", "").replace("#", ""));
			case MEMBER:
			case CALL:
			case BINARY:
				return "Expr";
			default:
				return "Cond";
		}
	}

	private static String capitalize(String name) {
		if (name.isEmpty()) {
			return "Cond";
		}
		return Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}
}
