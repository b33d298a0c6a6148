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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Positions}: ordering and conversion between
 * line/character positions and buffer offsets.
 */
class PositionsTests {

	// ------------------------------------------------------------------
	// COMPARATOR / valid()
	// ------------------------------------------------------------------

	@Test
	void testComparatorOrdersByLineThenCharacter() {
		Assertions.assertEquals(0, Positions.COMPARATOR.compare(new Position(5, 10), new Position(5, 10)));
		Assertions.assertTrue(Positions.COMPARATOR.compare(new Position(1, 9), new Position(2, 0)) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(new Position(3, 10), new Position(3, 2)) > 0);
	}

	@Test
	void testValidRejectsNegativeComponents() {
		Assertions.assertTrue(Positions.valid(new Position(0, 0)));
		Assertions.assertFalse(Positions.valid(new Position(1, -1)));
		Assertions.assertFalse(Positions.valid(new Position(-1, 1)));
	}

	// ------------------------------------------------------------------
	// getOffset()
	// ------------------------------------------------------------------

	@Test
	void testGetOffsetOnLaterLine() {
		Assertions.assertEquals(9, Positions.getOffset("hello\nworld", new Position(1, 3)));
	}

	@Test
	void testGetOffsetAtEndOfLine() {
		Assertions.assertEquals(5, Positions.getOffset("hello\nworld", new Position(0, 5)));
	}

	@Test
	void testGetOffsetBeyondLineLength() {
		Assertions.assertEquals(-1, Positions.getOffset("hi\nthere", new Position(0, 4)));
	}

	@Test
	void testGetOffsetLineBeyondContent() {
		Assertions.assertEquals(-1, Positions.getOffset("hello", new Position(5, 0)));
	}

	// ------------------------------------------------------------------
	// fromOffset()
	// ------------------------------------------------------------------

	@Test
	void testFromOffsetFirstLine() {
		Position position = Positions.fromOffset("if (a) {}", 4);
		Assertions.assertEquals(0, position.getLine());
		Assertions.assertEquals(4, position.getCharacter());
	}

	@Test
	void testFromOffsetAfterLineBreaks() {
		String text = "const a = 1;\n    if (a) {\n    }";
		Position position = Positions.fromOffset(text, text.indexOf("if"));
		Assertions.assertEquals(1, position.getLine());
		Assertions.assertEquals(4, position.getCharacter());
	}

	@Test
	void testFromOffsetAtEndOfText() {
		Position position = Positions.fromOffset("a\nbc", 4);
		Assertions.assertEquals(new Position(1, 2), position);
	}

	@Test
	void testFromOffsetInvertsGetOffset() {
		String text = "aaa\nbbb\nccc";
		Position position = new Position(2, 1);
		Assertions.assertEquals(position, Positions.fromOffset(text, Positions.getOffset(text, position)));
	}

	@Test
	void testFromOffsetOutsideText() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> Positions.fromOffset("abc", 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Positions.fromOffset("abc", -1));
	}
}
