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

/**
 * Thresholds and layout mode of the expression engine. Values are checked
 * once here; the engine does not re-validate them per fragment.
 */
public final class ExpressionFormatOptions {
	public static final int DEFAULT_MAX_OPERANDS = 3;
	public static final int DEFAULT_MAX_NESTING_DEPTH = 2;
	public static final String DEFAULT_INDENT_UNIT = "    ";
	public static final String DEFAULT_BINDING_KEYWORD = "const";

	private final int maxOperands;
	private final int maxNestingDepth;
	private final LayoutStyle layoutStyle;
	private final String indentUnit;
	private final String bindingKeyword;

	private ExpressionFormatOptions(Builder builder) {
		this.maxOperands = builder.maxOperands;
		this.maxNestingDepth = builder.maxNestingDepth;
		this.layoutStyle = builder.layoutStyle;
		this.indentUnit = builder.indentUnit;
		this.bindingKeyword = builder.bindingKeyword;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ExpressionFormatOptions defaults() {
		return builder().build();
	}

	public int getMaxOperands() {
		return maxOperands;
	}

	public int getMaxNestingDepth() {
		return maxNestingDepth;
	}

	public LayoutStyle getLayoutStyle() {
		return layoutStyle;
	}

	public String getIndentUnit() {
		return indentUnit;
	}

	public String getBindingKeyword() {
		return bindingKeyword;
	}

	public Builder toBuilder() {
		return builder()
				.maxOperands(maxOperands)
				.maxNestingDepth(maxNestingDepth)
				.layoutStyle(layoutStyle)
				.indentUnit(indentUnit)
				.bindingKeyword(bindingKeyword);
	}

	@Override
	public String toString() {
		return "ExpressionFormatOptions{maxOperands=" + maxOperands + ", maxNestingDepth=" + maxNestingDepth
				+ ", layoutStyle=" + layoutStyle + "}";
	}

	public static final class Builder {
		private int maxOperands = DEFAULT_MAX_OPERANDS;
		private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
		private LayoutStyle layoutStyle = LayoutStyle.LEADING_OPERATOR;
		private String indentUnit = DEFAULT_INDENT_UNIT;
		private String bindingKeyword = DEFAULT_BINDING_KEYWORD;

		private Builder() {
		}

		public Builder maxOperands(int value) {
			this.maxOperands = value;
			return this;
		}

		public Builder maxNestingDepth(int value) {
			this.maxNestingDepth = value;
			return this;
		}

		public Builder layoutStyle(LayoutStyle value) {
			this.layoutStyle = value;
			return this;
		}

		public Builder indentUnit(String value) {
			this.indentUnit = value;
			return this;
		}

		public Builder bindingKeyword(String value) {
			this.bindingKeyword = value;
			return this;
		}

		/**
		 * @throws IllegalArgumentException when a value is out of range
		 */
		public ExpressionFormatOptions build() {
			if (maxOperands < 1) {
				throw new IllegalArgumentException("maxOperands must be at least 1, got " + maxOperands);
			}
			if (maxNestingDepth < 1) {
				throw new IllegalArgumentException("maxNestingDepth must be at least 1, got " + maxNestingDepth);
			}
			if (layoutStyle == null) {
				throw new IllegalArgumentException("layoutStyle is required");
			}
			if (indentUnit == null || indentUnit.isEmpty() || !indentUnit.trim().isEmpty()) {
				throw new IllegalArgumentException("indentUnit must be non-empty whitespace");
			}
			if (bindingKeyword == null || bindingKeyword.trim().isEmpty()) {
				throw new IllegalArgumentException("bindingKeyword is required");
			}
			return new ExpressionFormatOptions(this);
		}
	}
}
