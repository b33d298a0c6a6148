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
package com.tomaszrup.normalizer.syntax;

/**
 * A candidate fragment located by {@link FragmentScanner}.
 */
public final class ScannedFragment {

	public enum Kind {
		/** Parenthesized condition of an {@code if}/{@code while}; the node includes the parentheses. */
		CONDITION,
		/** Logical chain or conditional expression in a declaration, return or property value. */
		EXPRESSION,
		/** String or template literal that may hold class tokens. */
		LITERAL
	}

	private final Kind kind;
	private final SyntaxNode node;
	private final int statementOffset;
	private final boolean hoistable;
	private final String nameHint;

	public ScannedFragment(Kind kind, SyntaxNode node, int statementOffset, boolean hoistable, String nameHint) {
		this.kind = kind;
		this.node = node;
		this.statementOffset = statementOffset;
		this.hoistable = hoistable;
		this.nameHint = nameHint;
	}

	public Kind getKind() {
		return kind;
	}

	public SyntaxNode getNode() {
		return node;
	}

	/**
	 * Offset of the first token of the enclosing statement.
	 */
	public int getStatementOffset() {
		return statementOffset;
	}

	/**
	 * Whether a declaration may be inserted before the enclosing statement.
	 */
	public boolean isHoistable() {
		return hoistable;
	}

	/**
	 * Variable or property name the literal is assigned to, or {@code null}.
	 */
	public String getNameHint() {
		return nameHint;
	}

	@Override
	public String toString() {
		return kind + "@" + node.getSpan();
	}
}
