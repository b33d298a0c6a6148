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
package com.tomaszrup.normalizer.providers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Ranges;
import com.tomaszrup.normalizer.classtokens.ClassStringFragment;
import com.tomaszrup.normalizer.classtokens.ClassStringRewriter;
import com.tomaszrup.normalizer.config.NormalizerOptions;
import com.tomaszrup.normalizer.edit.FragmentEdit;
import com.tomaszrup.normalizer.edit.FragmentEdits;
import com.tomaszrup.normalizer.expression.ExpressionFragment;
import com.tomaszrup.normalizer.expression.ExpressionReformatter;
import com.tomaszrup.normalizer.expression.ExtractionBinding;
import com.tomaszrup.normalizer.expression.FragmentKind;
import com.tomaszrup.normalizer.expression.ReformatResult;
import com.tomaszrup.normalizer.expression.UnfixableViolation;
import com.tomaszrup.normalizer.syntax.FragmentScanner;
import com.tomaszrup.normalizer.syntax.ScannedFragment;
import com.tomaszrup.normalizer.syntax.ScriptSyntaxException;
import com.tomaszrup.normalizer.syntax.SyntaxKind;
import com.tomaszrup.normalizer.syntax.SyntaxNode;

/**
 * Normalizes a whole JavaScript/TypeScript document.
 *
 * <p>The document is scanned for fragments, each fragment goes through the
 * matching engine, and the resulting edits are merged. When the edits of a
 * fragment collide with edits already accepted for an earlier fragment, the
 * later fragment is dropped whole; running the normalization again picks it
 * up once the first edits are applied.
 */
public class NormalizationProvider {
	private static final Logger logger = LoggerFactory.getLogger(NormalizationProvider.class);

	static final String DIAGNOSTIC_SOURCE = "fragment-normalizer";

	private final NormalizerOptions options;

	public NormalizationProvider(NormalizerOptions options) {
		this.options = options;
	}

	private static final class Outcome {
		private final List<FragmentEdit> edits = new ArrayList<>();
		private final List<UnfixableViolation> violations = new ArrayList<>();
	}

	public CompletableFuture<List<TextEdit>> provideNormalization(
			DocumentFormattingParams params, String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		String normalizedSource = normalizeLineEndings(sourceText);
		NormalizerOptions effective = optionsFor(params.getOptions());
		Outcome outcome = run(normalizedSource, effective, null);
		return CompletableFuture.completedFuture(toTextEdits(normalizedSource, outcome.edits));
	}

	/**
	 * Like {@link #provideNormalization} but only for fragments lying
	 * entirely within the requested range.
	 */
	public CompletableFuture<List<TextEdit>> provideRangeNormalization(
			DocumentRangeFormattingParams params, String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(new ArrayList<>());
		}
		String normalizedSource = normalizeLineEndings(sourceText);
		NormalizerOptions effective = optionsFor(params.getOptions());
		Outcome outcome = run(normalizedSource, effective, params.getRange());
		return CompletableFuture.completedFuture(toTextEdits(normalizedSource, outcome.edits));
	}

	/**
	 * Warnings for nesting problems that cannot be fixed automatically.
	 */
	public List<Diagnostic> provideDiagnostics(String sourceText) {
		List<Diagnostic> diagnostics = new ArrayList<>();
		if (sourceText == null || sourceText.isEmpty()) {
			return diagnostics;
		}
		String normalizedSource = normalizeLineEndings(sourceText);
		Outcome outcome = run(normalizedSource, options, null);
		for (UnfixableViolation violation : outcome.violations) {
			Diagnostic diagnostic = new Diagnostic();
			diagnostic.setRange(Ranges.fromOffsets(normalizedSource,
					violation.getSpan().getStart(), violation.getSpan().getEnd()));
			diagnostic.setSeverity(DiagnosticSeverity.Warning);
			diagnostic.setSource(DIAGNOSTIC_SOURCE);
			diagnostic.setMessage(violation.getMessage());
			diagnostics.add(diagnostic);
		}
		return diagnostics;
	}

	/**
	 * Edits for the whole document, sorted and non-overlapping, with offsets
	 * into {@code source}.
	 */
	public List<FragmentEdit> normalize(String source) {
		return run(source, options, null).edits;
	}

	private Outcome run(String source, NormalizerOptions effective, Range restriction) {
		Outcome outcome = new Outcome();
		FragmentScanner.ScanResult scan;
		try {
			scan = new FragmentScanner(source).scan();
		} catch (ScriptSyntaxException e) {
			logger.debug("Document could not be tokenized: {}", e.getMessage());
			return outcome;
		}

		ExpressionReformatter conditionReformatter = new ExpressionReformatter(effective.getConditionOptions());
		ExpressionReformatter expressionReformatter = new ExpressionReformatter(effective.getExpressionOptions());
		ClassStringRewriter classRewriter = new ClassStringRewriter(effective.getClassTokenOptions());
		// generated bindings must also avoid the names given to earlier fragments
		Set<String> reservedNames = new LinkedHashSet<>(scan.getIdentifiers());

		for (ScannedFragment scanned : scan.getFragments()) {
			if (restriction != null && !Ranges.contains(restriction, Ranges.fromOffsets(source,
					scanned.getNode().getSpan().getStart(), scanned.getNode().getSpan().getEnd()))) {
				continue;
			}
			List<FragmentEdit> edits;
			List<ExtractionBinding> bindings = Collections.emptyList();
			if (scanned.getKind() == ScannedFragment.Kind.LITERAL) {
				edits = classRewriter.rewrite(new ClassStringFragment(source, scanned.getNode(), scanned.getNameHint()));
			} else {
				FragmentKind kind = kindOf(scanned);
				ExpressionFragment fragment = ExpressionFragment.builder(source, scanned.getNode(), kind)
						.statementOffset(scanned.getStatementOffset())
						.hoistable(scanned.isHoistable())
						.reservedNames(reservedNames)
						.build();
				ExpressionReformatter reformatter = kind == FragmentKind.CONTROL_FLOW_CONDITION
						? conditionReformatter
						: expressionReformatter;
				ReformatResult result = reformatter.reformat(fragment);
				outcome.violations.addAll(result.getViolations());
				edits = result.getEdits();
				bindings = result.getBindings();
			}
			if (edits.isEmpty()) {
				continue;
			}
			if (FragmentEdits.conflicts(outcome.edits, edits)) {
				logger.debug("Dropping edits of {}: they collide with an earlier fragment", scanned);
				continue;
			}
			outcome.edits.addAll(edits);
			for (ExtractionBinding binding : bindings) {
				reservedNames.add(binding.getName());
			}
		}
		List<FragmentEdit> sorted = FragmentEdits.sortAndVerify(outcome.edits);
		outcome.edits.clear();
		outcome.edits.addAll(sorted);
		return outcome;
	}

	private static FragmentKind kindOf(ScannedFragment scanned) {
		if (scanned.getKind() == ScannedFragment.Kind.CONDITION) {
			return FragmentKind.CONTROL_FLOW_CONDITION;
		}
		SyntaxNode inner = scanned.getNode().unwrapParentheses();
		return inner != null && inner.is(SyntaxKind.CONDITIONAL)
				? FragmentKind.CONDITIONAL
				: FragmentKind.LOGICAL_EXPRESSION;
	}

	private NormalizerOptions optionsFor(FormattingOptions formatting) {
		if (formatting == null) {
			return options;
		}
		if (!formatting.isInsertSpaces()) {
			return options.withIndentUnit("\t");
		}
		int tabSize = formatting.getTabSize() > 0 ? formatting.getTabSize() : 4;
		StringBuilder unit = new StringBuilder();
		for (int i = 0; i < tabSize; i++) {
			unit.append(' ');
		}
		return options.withIndentUnit(unit.toString());
	}

	private static List<TextEdit> toTextEdits(String source, List<FragmentEdit> edits) {
		List<TextEdit> textEdits = new ArrayList<>(edits.size());
		for (FragmentEdit edit : edits) {
			textEdits.add(FragmentEdits.toTextEdit(source, edit));
		}
		return textEdits;
	}

	private static String normalizeLineEndings(String sourceText) {
		return sourceText.replace("\r\n", "\n").replace("\r", "\n");
	}
}
