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

class ExpressionFormatOptionsTests {

	@Test
	void testDefaults() {
		ExpressionFormatOptions options = ExpressionFormatOptions.defaults();
		Assertions.assertEquals(3, options.getMaxOperands());
		Assertions.assertEquals(2, options.getMaxNestingDepth());
		Assertions.assertEquals(LayoutStyle.LEADING_OPERATOR, options.getLayoutStyle());
		Assertions.assertEquals("    ", options.getIndentUnit());
		Assertions.assertEquals("const", options.getBindingKeyword());
	}

	@Test
	void testToBuilderKeepsOtherValues() {
		ExpressionFormatOptions options = ExpressionFormatOptions.builder().maxOperands(5).build()
				.toBuilder().indentUnit("\t").build();
		Assertions.assertEquals(5, options.getMaxOperands());
		Assertions.assertEquals("\t", options.getIndentUnit());
	}

	@Test
	void testInvalidValuesRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ExpressionFormatOptions.builder().maxOperands(0).build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ExpressionFormatOptions.builder().maxNestingDepth(0).build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ExpressionFormatOptions.builder().indentUnit("ab").build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ExpressionFormatOptions.builder().indentUnit("").build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> ExpressionFormatOptions.builder().layoutStyle(null).build());
	}

	@Test
	void testLowerThresholdsChangeLayout() {
		ExpressionFormatOptions options = ExpressionFormatOptions.builder().maxOperands(2).maxNestingDepth(1).build();
		String formatted = ExpressionFixtures.reformat("const x = a && (b || (c && d));", options);
		Assertions.assertEquals("const isCAndD = c && d;\nconst x = a && (b || isCAndD);", formatted);

		String expanded = ExpressionFixtures.reformat("const y = a && b && c;", options);
		Assertions.assertEquals("const y = a\n    && b\n    && c;", expanded);
	}
}
