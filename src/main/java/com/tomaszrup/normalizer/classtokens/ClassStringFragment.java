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
package com.tomaszrup.normalizer.classtokens;

import com.tomaszrup.normalizer.syntax.SyntaxKind;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Input of {@link ClassStringRewriter}: a string or template literal and the
 * name it is assigned to, if any.
 */
public final class ClassStringFragment {
	private final String source;
	private final SyntaxNode literal;
	private final String nameHint;

	public ClassStringFragment(String source, SyntaxNode literal, String nameHint) {
		if (!literal.is(SyntaxKind.STRING_LITERAL) && !literal.is(SyntaxKind.TEMPLATE_LITERAL)) {
			throw new IllegalArgumentException("Not a string or template literal: " + literal);
		}
		this.source = source;
		this.literal = literal;
		this.nameHint = nameHint;
	}

	public String getSource() {
		return source;
	}

	public SyntaxNode getLiteral() {
		return literal;
	}

	public String getNameHint() {
		return nameHint;
	}

	public boolean isTemplate() {
		return literal.is(SyntaxKind.TEMPLATE_LITERAL);
	}
}
