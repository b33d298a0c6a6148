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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.normalizer.edit.FragmentEdit;

/**
 * Outcome of reformatting one fragment.
 */
public final class ReformatResult {
	private final List<FragmentEdit> edits;
	private final List<ExtractionBinding> bindings;
	private final List<UnfixableViolation> violations;
	private final String skipReason;

	ReformatResult(List<FragmentEdit> edits, List<ExtractionBinding> bindings, List<UnfixableViolation> violations,
			String skipReason) {
		this.edits = Collections.unmodifiableList(new ArrayList<>(edits));
		this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
		this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
		this.skipReason = skipReason;
	}

	static ReformatResult skipped(String reason) {
		return new ReformatResult(Collections.<FragmentEdit>emptyList(), Collections.<ExtractionBinding>emptyList(),
				Collections.<UnfixableViolation>emptyList(), reason);
	}

	/**
	 * Edits sorted by offset, non-overlapping. Empty when the fragment is
	 * already in canonical form or was skipped.
	 */
	public List<FragmentEdit> getEdits() {
		return edits;
	}

	public List<ExtractionBinding> getBindings() {
		return bindings;
	}

	public List<UnfixableViolation> getViolations() {
		return violations;
	}

	public boolean isSkipped() {
		return skipReason != null;
	}

	public String getSkipReason() {
		return skipReason;
	}

	public boolean hasEdits() {
		return !edits.isEmpty();
	}
}
