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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DescriptiveBindingNameStrategyTests {
	private final BindingNameStrategy strategy = new DescriptiveBindingNameStrategy();

	private String nameOf(String source) throws UnsupportedFragmentException {
		ExpressionFragment fragment = ExpressionFixtures.first(source);
		ExpressionNode root = (ExpressionNode) new ExpressionTreeBuilder().build(fragment).getRoot();
		return strategy.baseName(root, source);
	}

	@Test
	void testIdentifiersAreCapitalizedAndJoined() throws Exception {
		Assertions.assertEquals("isCAndD", nameOf("const x = c && d;"));
		Assertions.assertEquals("isReadyOrDone", nameOf("const x = ready || done;"));
	}

	@Test
	void testComplexOperandsGetPlaceholders() throws Exception {
		Assertions.assertEquals("isExprAndExprAndCond", nameOf("const x = a.b && f() && !c;"));
		Assertions.assertEquals("isExprOrCond", nameOf("const x = n > 1 || (a && b);"));
	}

	@Test
	void testDollarSignIsDropped() throws Exception {
		Assertions.assertEquals("isElAndB", nameOf("const x = $el && b;"));
	}

	@Test
	void testLongNamesFallBack() throws Exception {
		String name = nameOf("const x = firstCondition && secondCondition && third;");
		Assertions.assertEquals(DescriptiveBindingNameStrategy.FALLBACK_NAME, name);
	}
}
