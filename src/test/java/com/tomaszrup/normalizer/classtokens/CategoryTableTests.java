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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CategoryTableTests {
	private final CategoryTable table = CategoryTable.defaultTable();

	// ------------------------------------------------------------------
	// rankOf()
	// ------------------------------------------------------------------

	@Test
	void testExactMatch() {
		Assertions.assertEquals(10, table.rankOf("flex"));
		Assertions.assertEquals(110, table.rankOf("border"));
		Assertions.assertEquals(170, table.rankOf("sr-only"));
	}

	@Test
	void testPrefixMatch() {
		Assertions.assertEquals(100, table.rankOf("bg-blue-500"));
		Assertions.assertEquals(70, table.rankOf("px-4"));
		Assertions.assertEquals(60, table.rankOf("-mx-2"));
		Assertions.assertEquals(110, table.rankOf("border-t-2"));
	}

	@Test
	void testLongestPrefixWins() {
		Assertions.assertEquals(30, table.rankOf("grid-cols-3"));
		Assertions.assertEquals(80, table.rankOf("max-w-md"));
		Assertions.assertEquals(130, table.rankOf("transition-colors"));
	}

	@Test
	void testVariantBands() {
		Assertions.assertEquals(CategoryTable.BREAKPOINT_RANK, table.rankOf("md:flex"));
		Assertions.assertEquals(CategoryTable.STATE_RANK, table.rankOf("hover:bg-blue-600"));
		Assertions.assertEquals(CategoryTable.STATE_RANK, table.rankOf("focus-visible:ring-2"));
		Assertions.assertEquals(CategoryTable.THEME_RANK, table.rankOf("dark:text-white"));
	}

	@Test
	void testUnknownToken() {
		Assertions.assertEquals(CategoryTable.UNKNOWN_RANK, table.rankOf("card-header"));
		Assertions.assertEquals(CategoryTable.UNKNOWN_RANK, table.rankOf("hello"));
	}

	@Test
	void testUnknownSortsBeforeVariants() {
		Assertions.assertTrue(table.rankOf("custom-widget") < table.rankOf("sm:p-2"));
		Assertions.assertTrue(table.rankOf("sr-only") < table.rankOf("custom-widget"));
	}

	// ------------------------------------------------------------------
	// categoryOf() / recognizes()
	// ------------------------------------------------------------------

	@Test
	void testCategoryFromPatternRules() {
		Assertions.assertEquals(TokenCategory.COLOR, table.categoryOf("bg-blue-500"));
		Assertions.assertEquals(TokenCategory.COLOR, table.categoryOf("text-white"));
		Assertions.assertEquals(TokenCategory.TYPOGRAPHY, table.categoryOf("text-lg"));
		Assertions.assertEquals(TokenCategory.SPACING, table.categoryOf("p-4"));
		Assertions.assertEquals(TokenCategory.BORDER, table.categoryOf("rounded-lg"));
		Assertions.assertEquals(TokenCategory.VARIANT, table.categoryOf("hover:underline"));
	}

	@Test
	void testCategoryFallsBackToRank() {
		Assertions.assertEquals(TokenCategory.POSITION, table.categoryOf("z-10"));
		Assertions.assertEquals(TokenCategory.INTERACTIVITY, table.categoryOf("sr-only"));
		Assertions.assertEquals(TokenCategory.UNKNOWN, table.categoryOf("card"));
	}

	@Test
	void testRecognizes() {
		Assertions.assertTrue(table.recognizes("flex"));
		Assertions.assertTrue(table.recognizes("w-1/2"));
		Assertions.assertTrue(table.recognizes("md:grid"));
		Assertions.assertFalse(table.recognizes("hello"));
		Assertions.assertFalse(table.recognizes("world"));
	}

	@Test
	void testTableIsImmutable() {
		Assertions.assertThrows(UnsupportedOperationException.class, () -> table.getRanks().put("x", 1));
		Assertions.assertFalse(table.getRules().isEmpty());
		Assertions.assertSame(table, CategoryTable.defaultTable());
	}
}
