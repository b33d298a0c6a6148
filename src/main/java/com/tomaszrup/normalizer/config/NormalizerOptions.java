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

import com.tomaszrup.normalizer.classtokens.ClassTokenOptions;
import com.tomaszrup.normalizer.expression.ExpressionFormatOptions;
import com.tomaszrup.normalizer.expression.FragmentKind;
import com.tomaszrup.normalizer.expression.LayoutStyle;

/**
 * Validated configuration of both engines. Control-flow conditions and
 * free-standing expressions carry their own layout style.
 */
public final class NormalizerOptions {

    private final ExpressionFormatOptions conditionOptions;
    private final ExpressionFormatOptions expressionOptions;
    private final ClassTokenOptions classTokenOptions;

    public NormalizerOptions(ExpressionFormatOptions conditionOptions,
                             ExpressionFormatOptions expressionOptions,
                             ClassTokenOptions classTokenOptions) {
        this.conditionOptions = conditionOptions;
        this.expressionOptions = expressionOptions;
        this.classTokenOptions = classTokenOptions;
    }

    /**
     * Defaults: at most 3 operands per line, nesting depth 2, trailing
     * operators in control-flow conditions and leading operators elsewhere.
     */
    public static NormalizerOptions defaults() {
        return new NormalizerOptions(
                ExpressionFormatOptions.builder().layoutStyle(LayoutStyle.TRAILING_OPERATOR).build(),
                ExpressionFormatOptions.builder().layoutStyle(LayoutStyle.LEADING_OPERATOR).build(),
                ClassTokenOptions.defaults());
    }

    public ExpressionFormatOptions getConditionOptions() {
        return conditionOptions;
    }

    public ExpressionFormatOptions getExpressionOptions() {
        return expressionOptions;
    }

    public ExpressionFormatOptions expressionOptionsFor(FragmentKind kind) {
        return kind == FragmentKind.CONTROL_FLOW_CONDITION ? conditionOptions : expressionOptions;
    }

    public ClassTokenOptions getClassTokenOptions() {
        return classTokenOptions;
    }

    /**
     * Copy with both expression contexts indenting by {@code indentUnit}.
     */
    public NormalizerOptions withIndentUnit(String indentUnit) {
        if (indentUnit.equals(conditionOptions.getIndentUnit())
                && indentUnit.equals(expressionOptions.getIndentUnit())) {
            return this;
        }
        return new NormalizerOptions(
                conditionOptions.toBuilder().indentUnit(indentUnit).build(),
                expressionOptions.toBuilder().indentUnit(indentUnit).build(),
                classTokenOptions);
    }

    @Override
    public String toString() {
        return "NormalizerOptions{condition=" + conditionOptions + ", expression=" + expressionOptions
                + ", classTokens=" + classTokenOptions + "}";
    }
}
