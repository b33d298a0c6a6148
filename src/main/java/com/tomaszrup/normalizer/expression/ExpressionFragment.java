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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Input of {@link ExpressionReformatter}: one parsed fragment together with
 * the buffer it was parsed from and what the host knows about its context.
 */
public final class ExpressionFragment {
	private final String source;
	private final SyntaxNode root;
	private final FragmentKind kind;
	private final int statementOffset;
	private final boolean hoistable;
	private final Set<String> reservedNames;
	private final Set<String> visibleIdentifiers;

	private ExpressionFragment(Builder builder) {
		this.source = builder.source;
		this.root = builder.root;
		this.kind = builder.kind;
		this.statementOffset = builder.statementOffset;
		this.hoistable = builder.hoistable;
		this.reservedNames = Collections.unmodifiableSet(new HashSet<>(builder.reservedNames));
		this.visibleIdentifiers = builder.visibleIdentifiers == null ? null
				: Collections.unmodifiableSet(new HashSet<>(builder.visibleIdentifiers));
	}

	public static Builder builder(String source, SyntaxNode root, FragmentKind kind) {
		return new Builder(source, root, kind);
	}

	public String getSource() {
		return source;
	}

	public SyntaxNode getRoot() {
		return root;
	}

	public FragmentKind getKind() {
		return kind;
	}

	/**
	 * Offset of the first token of the enclosing statement. Binding
	 * declarations are inserted here, and indentation is taken from its line.
	 */
	public int getStatementOffset() {
		return statementOffset;
	}

	public boolean isHoistable() {
		return hoistable;
	}

	/**
	 * Names a generated binding must not use.
	 */
	public Set<String> getReservedNames() {
		return reservedNames;
	}

	/**
	 * Identifiers in scope at the statement, or {@code null} when the host
	 * does not track scopes.
	 */
	public Set<String> getVisibleIdentifiers() {
		return visibleIdentifiers;
	}

	public static final class Builder {
		private final String source;
		private final SyntaxNode root;
		private final FragmentKind kind;
		private int statementOffset = -1;
		private boolean hoistable = true;
		private Set<String> reservedNames = Collections.emptySet();
		private Set<String> visibleIdentifiers;

		private Builder(String source, SyntaxNode root, FragmentKind kind) {
			if (source == null || root == null || kind == null) {
				throw new IllegalArgumentException("source, root and kind are required");
			}
			this.source = source;
			this.root = root;
			this.kind = kind;
		}

		public Builder statementOffset(int offset) {
			this.statementOffset = offset;
			return this;
		}

		public Builder hoistable(boolean value) {
			this.hoistable = value;
			return this;
		}

		public Builder reservedNames(Set<String> names) {
			this.reservedNames = names;
			return this;
		}

		public Builder visibleIdentifiers(Set<String> identifiers) {
			this.visibleIdentifiers = identifiers;
			return this;
		}

		public ExpressionFragment build() {
			if (statementOffset < 0) {
				statementOffset = root.getSpan().getStart();
			}
			if (statementOffset > root.getSpan().getStart()) {
				throw new IllegalArgumentException("Statement offset " + statementOffset
						+ " lies after the fragment start " + root.getSpan().getStart());
			}
			return new ExpressionFragment(this);
		}
	}
}
