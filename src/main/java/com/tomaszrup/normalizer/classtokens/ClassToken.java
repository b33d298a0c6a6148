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

import java.util.Comparator;

public final class ClassToken {

	/**
	 * Canonical order: by rank, then lexicographically by raw text.
	 */
	public static final Comparator<ClassToken> CANONICAL_ORDER = Comparator
			.comparingInt(ClassToken::getRank)
			.thenComparing(ClassToken::getRaw);

	private final String raw;
	private final TokenCategory category;
	private final int rank;
	private final int originalIndex;

	public ClassToken(String raw, TokenCategory category, int rank, int originalIndex) {
		this.raw = raw;
		this.category = category;
		this.rank = rank;
		this.originalIndex = originalIndex;
	}

	public String getRaw() {
		return raw;
	}

	public TokenCategory getCategory() {
		return category;
	}

	public int getRank() {
		return rank;
	}

	/**
	 * Position of the token in the string it was read from.
	 */
	public int getOriginalIndex() {
		return originalIndex;
	}

	@Override
	public String toString() {
		return raw + "(" + category + ", " + rank + ")";
	}
}
