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
package com.tomaszrup.normalizer.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.tomaszrup.normalizer.expression.ExpressionFormatOptions;
import com.tomaszrup.normalizer.expression.FragmentKind;
import com.tomaszrup.normalizer.expression.LayoutStyle;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

class NormalizerOptionsParserTests {
	private Logger root;
	private Level previousLevel;

	@BeforeEach
	void setup() {
		root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		previousLevel = root.getLevel();
	}

	@AfterEach
	void tearDown() {
		root.setLevel(previousLevel);
	}

	// ------------------------------------------------------------------
	// Defaults
	// ------------------------------------------------------------------

	@Test
	void testNullObjectYieldsDefaults() {
		NormalizerOptions options = NormalizerOptionsParser.parse((JsonObject) null);
		Assertions.assertEquals(LayoutStyle.TRAILING_OPERATOR, options.getConditionOptions().getLayoutStyle());
		Assertions.assertEquals(LayoutStyle.LEADING_OPERATOR, options.getExpressionOptions().getLayoutStyle());
	}

	@Test
	void testEmptyObjectYieldsDefaults() {
		NormalizerOptions options = NormalizerOptionsParser.parse("{}");
		ExpressionFormatOptions expression = options.getExpressionOptions();
		Assertions.assertEquals(3, expression.getMaxOperands());
		Assertions.assertEquals(2, expression.getMaxNestingDepth());
		Assertions.assertEquals("    ", expression.getIndentUnit());
		Assertions.assertEquals(2, options.getClassTokenOptions().getMinMatchCount());
		Assertions.assertEquals(0.5, options.getClassTokenOptions().getMinMatchRatio());
	}

	// ------------------------------------------------------------------
	// Options
	// ------------------------------------------------------------------

	@Test
	void testThresholdsApplyToBothContexts() {
		NormalizerOptions options = NormalizerOptionsParser.parse("{\"maxOperands\": 5, \"maxNestingDepth\": 3}");
		Assertions.assertEquals(5, options.getConditionOptions().getMaxOperands());
		Assertions.assertEquals(5, options.getExpressionOptions().getMaxOperands());
		Assertions.assertEquals(3, options.getConditionOptions().getMaxNestingDepth());
		Assertions.assertEquals(3, options.getExpressionOptions().getMaxNestingDepth());
	}

	@Test
	void testLayoutStylesPerContext() {
		NormalizerOptions options = NormalizerOptionsParser.parse(
				"{\"conditionLayoutStyle\": \"Leading\", \"expressionLayoutStyle\": \"trailing\"}");
		Assertions.assertEquals(LayoutStyle.LEADING_OPERATOR, options.getConditionOptions().getLayoutStyle());
		Assertions.assertEquals(LayoutStyle.TRAILING_OPERATOR, options.getExpressionOptions().getLayoutStyle());
	}

	@Test
	void testIndentSize() {
		NormalizerOptions options = NormalizerOptionsParser.parse("{\"indentSize\": 2}");
		Assertions.assertEquals("  ", options.getConditionOptions().getIndentUnit());
		Assertions.assertEquals("  ", options.getExpressionOptions().getIndentUnit());
	}

	@Test
	void testClassTokenThresholds() {
		NormalizerOptions options = NormalizerOptionsParser.parse("{\"minMatchCount\": 4, \"minMatchRatio\": 0.75}");
		Assertions.assertEquals(4, options.getClassTokenOptions().getMinMatchCount());
		Assertions.assertEquals(0.75, options.getClassTokenOptions().getMinMatchRatio());
	}

	@Test
	void testNullValuesKeepDefaults() {
		NormalizerOptions options = NormalizerOptionsParser.parse("{\"maxOperands\": null}");
		Assertions.assertEquals(3, options.getExpressionOptions().getMaxOperands());
	}

	// ------------------------------------------------------------------
	// Invalid input
	// ------------------------------------------------------------------

	@Test
	void testInvalidValuesRejected() {
		assertRejected("{\"indentSize\": 0}");
		assertRejected("{\"indentSize\": 17}");
		assertRejected("{\"maxOperands\": \"three\"}");
		assertRejected("{\"maxOperands\": 2.5}");
		assertRejected("{\"maxOperands\": 1e10}");
		assertRejected("{\"indentSize\": 4294967298}");
		assertRejected("{\"maxOperands\": 0}");
		assertRejected("{\"maxNestingDepth\": -1}");
		assertRejected("{\"conditionLayoutStyle\": \"middle\"}");
		assertRejected("{\"minMatchRatio\": 1.5}");
	}

	@Test
	void testMalformedJsonRejected() {
		assertRejected("{\"maxOperands\": }");
		assertRejected("[1, 2]");
	}

	private static void assertRejected(String json) {
		Assertions.assertThrows(IllegalArgumentException.class, () -> NormalizerOptionsParser.parse(json), json);
	}

	// ------------------------------------------------------------------
	// Log level
	// ------------------------------------------------------------------

	@Test
	void testLogLevelOptionChangesRootLevel() {
		NormalizerOptionsParser.parse("{\"logLevel\": \"debug\"}");
		Assertions.assertEquals(Level.DEBUG, root.getLevel());
	}

	@Test
	void testUnknownLogLevelIsIgnored() {
		root.setLevel(Level.WARN);
		NormalizerOptionsParser.applyLogLevel("NOT_A_LEVEL");
		Assertions.assertEquals(Level.WARN, root.getLevel());
	}

	// ------------------------------------------------------------------
	// NormalizerOptions
	// ------------------------------------------------------------------

	@Test
	void testWithIndentUnit() {
		NormalizerOptions options = NormalizerOptions.defaults();
		NormalizerOptions tabs = options.withIndentUnit("\t");
		Assertions.assertEquals("\t", tabs.getConditionOptions().getIndentUnit());
		Assertions.assertEquals("\t", tabs.getExpressionOptions().getIndentUnit());
		Assertions.assertEquals(LayoutStyle.TRAILING_OPERATOR, tabs.getConditionOptions().getLayoutStyle());
		Assertions.assertSame(options, options.withIndentUnit("    "));
	}

	@Test
	void testExpressionOptionsForKind() {
		NormalizerOptions options = NormalizerOptions.defaults();
		Assertions.assertSame(options.getConditionOptions(),
				options.expressionOptionsFor(FragmentKind.CONTROL_FLOW_CONDITION));
		Assertions.assertSame(options.getExpressionOptions(), options.expressionOptionsFor(FragmentKind.CONDITIONAL));
		Assertions.assertSame(options.getExpressionOptions(),
				options.expressionOptionsFor(FragmentKind.LOGICAL_EXPRESSION));
	}
}
