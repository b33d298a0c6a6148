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
import java.util.List;

/**
 * Sorts class tokens into canonical order.
 */
public class ClassTokenOrderer {

	public static final class OrderResult {
		private final ClassString ordered;
		private final boolean changed;

		OrderResult(ClassString ordered, boolean changed) {
			this.ordered = ordered;
			this.changed = changed;
		}

		public ClassString getOrdered() {
			return ordered;
		}

		/**
		 * Whether the token sequence differs from the input, ignoring how the
		 * input was spaced.
		 */
		public boolean isChanged() {
			return changed;
		}
	}

	public OrderResult order(ClassString classString) {
		List<ClassToken> sorted = new ArrayList<>(classString.getTokens());
		sorted.sort(ClassToken.CANONICAL_ORDER);
		ClassString ordered = new ClassString(sorted, classString.getSourceKind(), classString.hasDynamicSegments());
		boolean changed = !ordered.toText().equals(classString.toText());
		return new OrderResult(ordered, changed);
	}

	/**
	 * Sort {@code tokens[from, to)} in place, leaving the others where they are.
	 */
	public List<ClassToken> orderRange(List<ClassToken> tokens, int from, int to) {
		List<ClassToken> result = new ArrayList<>(tokens);
		if (to - from > 1) {
			List<ClassToken> middle = new ArrayList<>(result.subList(from, to));
			middle.sort(ClassToken.CANONICAL_ORDER);
			for (int i = from; i < to; i++) {
				result.set(i, middle.get(i - from));
			}
		}
		return result;
	}
}
