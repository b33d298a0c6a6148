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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ClassTokenOrdererTests {
	private final ClassTokenClassifier classifier = new ClassTokenClassifier(CategoryTable.defaultTable(),
			ClassTokenOptions.defaults());
	private final ClassTokenOrderer orderer = new ClassTokenOrderer();

	private ClassTokenOrderer.OrderResult order(String value) {
		return orderer.order(classifier.read(value, ClassString.SourceKind.QUOTED_LITERAL, false));
	}

	@Test
	void testVariantsGoLast() {
		ClassTokenOrderer.OrderResult result = order("hover:bg-blue-600 bg-blue-500 flex items-center");
		Assertions.assertTrue(result.isChanged());
		Assertions.assertEquals("flex items-center bg-blue-500 hover:bg-blue-600", result.getOrdered().toText());
	}

	@Test
	void testEqualRanksSortLexicographically() {
		Assertions.assertEquals("p-4 pb-2", order("pb-2 p-4").getOrdered().toText());
		Assertions.assertEquals("mb-2 mt-4 mx-auto", order("mx-auto mt-4 mb-2").getOrdered().toText());
	}

	@Test
	void testUnknownTokensSitBetweenKnownAndVariants() {
		Assertions.assertEquals("flex foo md:flex", order("md:flex foo flex").getOrdered().toText());
	}

	@Test
	void testOrderedInputIsUnchanged() {
		ClassTokenOrderer.OrderResult result = order("flex p-4 text-lg");
		Assertions.assertFalse(result.isChanged());
		Assertions.assertEquals("flex p-4 text-lg", result.getOrdered().toText());
	}

	@Test
	void testSpacingAloneIsNotAChange() {
		Assertions.assertFalse(order("  flex   p-4 ").isChanged());
	}

	@Test
	void testDuplicatesAreKept() {
		Assertions.assertEquals("flex flex p-4", order("p-4 flex flex").getOrdered().toText());
	}

	@Test
	void testOrderingIsIdempotent() {
		String once = order("shadow-md rounded-lg md:p-8 p-4 bg-white text-sm").getOrdered().toText();
		Assertions.assertEquals(once, order(once).getOrdered().toText());
		Assertions.assertFalse(order(once).isChanged());
	}

	@Test
	void testOrderRangeLeavesOutsideTokensInPlace() {
		List<ClassToken> tokens = classifier.read("z-10 p-4 mt-2 flex", ClassString.SourceKind.TEMPLATE_SEGMENT, true)
				.getTokens();
		List<ClassToken> ordered = orderer.orderRange(tokens, 1, 3);
		Assertions.assertEquals(Arrays.asList("z-10", "mt-2", "p-4", "flex"), rawOf(ordered));
		Assertions.assertEquals(rawOf(tokens), rawOf(orderer.orderRange(tokens, 2, 3)));
	}

	private static List<String> rawOf(List<ClassToken> tokens) {
		return new ClassString(tokens, ClassString.SourceKind.TEMPLATE_SEGMENT, true).getRawTokens();
	}
}
