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

import java.util.Locale;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.normalizer.classtokens.ClassTokenOptions;
import com.tomaszrup.normalizer.expression.ExpressionFormatOptions;
import com.tomaszrup.normalizer.expression.LayoutStyle;

/**
 * Reads {@link NormalizerOptions} from a JSON object such as
 * <pre>
 * { "maxOperands": 3, "maxNestingDepth": 2, "conditionLayoutStyle": "trailing",
 *   "expressionLayoutStyle": "leading", "indentSize": 4,
 *   "minMatchCount": 2, "minMatchRatio": 0.5, "logLevel": "DEBUG" }
 * </pre>
 * Missing keys keep their defaults. Out-of-range values are rejected with
 * {@link IllegalArgumentException} when the options are loaded.
 */
public final class NormalizerOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(NormalizerOptionsParser.class);

    static final String MAX_OPERANDS_OPTION = "maxOperands";
    static final String MAX_NESTING_DEPTH_OPTION = "maxNestingDepth";
    static final String CONDITION_LAYOUT_STYLE_OPTION = "conditionLayoutStyle";
    static final String EXPRESSION_LAYOUT_STYLE_OPTION = "expressionLayoutStyle";
    static final String INDENT_SIZE_OPTION = "indentSize";
    static final String MIN_MATCH_COUNT_OPTION = "minMatchCount";
    static final String MIN_MATCH_RATIO_OPTION = "minMatchRatio";
    static final String LOG_LEVEL_OPTION = "logLevel";

    static final int MAX_INDENT_SIZE = 16;

    /**
     * @throws IllegalArgumentException when {@code json} is not a JSON object
     *                                  or holds an invalid value
     */
    public static NormalizerOptions parse(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed options: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Options must be a JSON object");
        }
        return parse(element.getAsJsonObject());
    }

    /**
     * @param opts options object; {@code null} yields the defaults
     * @throws IllegalArgumentException when a value is invalid
     */
    public static NormalizerOptions parse(JsonObject opts) {
        if (opts == null) {
            return NormalizerOptions.defaults();
        }
        applyLogLevelOption(opts);

        ExpressionFormatOptions.Builder condition = ExpressionFormatOptions.builder()
                .layoutStyle(LayoutStyle.TRAILING_OPERATOR);
        ExpressionFormatOptions.Builder expression = ExpressionFormatOptions.builder()
                .layoutStyle(LayoutStyle.LEADING_OPERATOR);

        Integer maxOperands = intOption(opts, MAX_OPERANDS_OPTION);
        if (maxOperands != null) {
            condition.maxOperands(maxOperands);
            expression.maxOperands(maxOperands);
        }
        Integer maxNestingDepth = intOption(opts, MAX_NESTING_DEPTH_OPTION);
        if (maxNestingDepth != null) {
            condition.maxNestingDepth(maxNestingDepth);
            expression.maxNestingDepth(maxNestingDepth);
        }
        LayoutStyle conditionStyle = layoutStyleOption(opts, CONDITION_LAYOUT_STYLE_OPTION);
        if (conditionStyle != null) {
            condition.layoutStyle(conditionStyle);
        }
        LayoutStyle expressionStyle = layoutStyleOption(opts, EXPRESSION_LAYOUT_STYLE_OPTION);
        if (expressionStyle != null) {
            expression.layoutStyle(expressionStyle);
        }
        Integer indentSize = intOption(opts, INDENT_SIZE_OPTION);
        if (indentSize != null) {
            if (indentSize < 1 || indentSize > MAX_INDENT_SIZE) {
                throw new IllegalArgumentException(INDENT_SIZE_OPTION + " must be between 1 and "
                        + MAX_INDENT_SIZE + ", got " + indentSize);
            }
            String unit = spaces(indentSize);
            condition.indentUnit(unit);
            expression.indentUnit(unit);
        }

        ClassTokenOptions.Builder classTokens = ClassTokenOptions.builder();
        Integer minMatchCount = intOption(opts, MIN_MATCH_COUNT_OPTION);
        if (minMatchCount != null) {
            classTokens.minMatchCount(minMatchCount);
        }
        Double minMatchRatio = doubleOption(opts, MIN_MATCH_RATIO_OPTION);
        if (minMatchRatio != null) {
            classTokens.minMatchRatio(minMatchRatio);
        }

        NormalizerOptions options = new NormalizerOptions(condition.build(), expression.build(), classTokens.build());
        logger.info("Loaded {}", options);
        return options;
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Unknown values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logging backend is not Logback, ignoring log level '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
        ch.qos.logback.classic.Level previous = logbackRoot.getLevel();
        logbackRoot.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private static Integer intOption(JsonObject opts, String name) {
        if (!opts.has(name) || opts.get(name).isJsonNull()) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(name + " must be a number, got " + value);
        }
        double number = value.getAsDouble();
        if (number != Math.rint(number)) {
            throw new IllegalArgumentException(name + " must be an integer, got " + value);
        }
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " is out of range, got " + value);
        }
        return value.getAsInt();
    }

    private static Double doubleOption(JsonObject opts, String name) {
        if (!opts.has(name) || opts.get(name).isJsonNull()) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException(name + " must be a number, got " + value);
        }
        return value.getAsDouble();
    }

    private static LayoutStyle layoutStyleOption(JsonObject opts, String name) {
        if (!opts.has(name) || opts.get(name).isJsonNull()) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (!value.isJsonPrimitive()) {
            throw new IllegalArgumentException(name + " must be a string, got " + value);
        }
        String style = value.getAsString().trim().toLowerCase(Locale.ROOT);
        switch (style) {
            case "leading":
                return LayoutStyle.LEADING_OPERATOR;
            case "trailing":
                return LayoutStyle.TRAILING_OPERATOR;
            default:
                throw new IllegalArgumentException(name + " must be 'leading' or 'trailing', got '" + style + "'");
        }
    }

    private static String spaces(int count) {
        StringBuilder unit = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            unit.append(' ');
        }
        return unit.toString();
    }

    private NormalizerOptionsParser() {
        // utility class
    }
}
