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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.normalizer.edit.FragmentEdit;

/**
 * Entry point of the expression engine: builds the model of a fragment,
 * analyzes it, plans its layout and emits the edits.
 *
 * <p>Instances hold only immutable configuration and may be shared between
 * threads; every call works on its own fragment.
 */
public class ExpressionReformatter {
	private static final Logger logger = LoggerFactory.getLogger(ExpressionReformatter.class);

	private final ExpressionFormatOptions options;
	private final ExpressionTreeBuilder builder = new ExpressionTreeBuilder();
	private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer();
	private final LayoutDecisionEngine decisionEngine;
	private final TextEmitter emitter;

	public ExpressionReformatter(ExpressionFormatOptions options) {
		this(options, new DescriptiveBindingNameStrategy());
	}

	public ExpressionReformatter(ExpressionFormatOptions options, BindingNameStrategy nameStrategy) {
		this.options = options;
		this.decisionEngine = new LayoutDecisionEngine(options, nameStrategy);
		this.emitter = new TextEmitter(options);
	}

	public ExpressionFormatOptions getOptions() {
		return options;
	}

	public ReformatResult reformat(ExpressionFragment fragment) {
		ExpressionTree tree;
		try {
			tree = builder.build(fragment);
		} catch (UnsupportedFragmentException e) {
			logger.debug("Skipping fragment {}: {}", fragment.getRoot().getSpan(), e.getMessage());
			return ReformatResult.skipped(e.getMessage());
		}
		ComplexityReport report = analyzer.analyze(tree);
		LayoutPlan plan = decisionEngine.decide(tree, report);
		List<FragmentEdit> edits = emitter.emit(tree, plan);
		if (logger.isDebugEnabled() && !edits.isEmpty()) {
			logger.debug("Fragment {} (depth {}): {} edit(s), {} binding(s)", fragment.getRoot().getSpan(),
					report.getMaxDepth(), edits.size(), plan.getBindings().size());
		}
		return new ReformatResult(edits, plan.getBindings(), plan.getViolations(), null);
	}
}
