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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Whitespace-separated class tokens read from one literal, or from one static
 * segment of a template literal.
 */
public final class ClassString {

	public enum SourceKind {
		QUOTED_LITERAL,
		TEMPLATE_SEGMENT
	}

	private final List<ClassToken> tokens;
	private final SourceKind sourceKind;
	private final boolean hasDynamicSegments;

	public ClassString(List<ClassToken> tokens, SourceKind sourceKind, boolean hasDynamicSegments) {
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		this.sourceKind = sourceKind;
		this.hasDynamicSegments = hasDynamicSegments;
	}

	public List<ClassToken> getTokens() {
		return tokens;
	}

	public SourceKind getSourceKind() {
		return sourceKind;
	}

	public boolean hasDynamicSegments() {
		return hasDynamicSegments;
	}

	public List<String> getRawTokens() {
		List<String> raw = new ArrayList<>(tokens.size());
		for (ClassToken token : tokens) {
			raw.add(token.getRaw());
		}
		return raw;
	}

	/**
	 * Tokens joined by single spaces.
	 */
	public String toText() {
		return String.join(" ", getRawTokens());
	}

	@Override
	public String toString() {
		return sourceKind + "[" + toText() + "]";
	}
}
