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

import com.tomaszrup.normalizer.syntax.SourceSpan;

/**
 * A group moved into a declaration before the statement.
 */
public final class ExtractionBinding {
	private final String name;
	private final String expressionText;
	private final int insertionOffset;
	private final SourceSpan replacedSpan;

	public ExtractionBinding(String name, String expressionText, int insertionOffset, SourceSpan replacedSpan) {
		this.name = name;
		this.expressionText = expressionText;
		this.insertionOffset = insertionOffset;
		this.replacedSpan = replacedSpan;
	}

	public String getName() {
		return name;
	}

	/**
	 * Initializer of the declaration, without the group's parentheses.
	 */
	public String getExpressionText() {
		return expressionText;
	}

	public int getInsertionOffset() {
		return insertionOffset;
	}

	/**
	 * Span of the group (parentheses included) that the name replaces.
	 */
	public SourceSpan getReplacedSpan() {
		return replacedSpan;
	}

	@Override
	public String toString() {
		return name + " = " + expressionText;
	}
}
