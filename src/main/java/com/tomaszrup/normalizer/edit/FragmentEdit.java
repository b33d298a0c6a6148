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
package com.tomaszrup.normalizer.edit;

import java.util.Comparator;
import java.util.Objects;

/**
 * Replacement of {@code [startOffset, endOffset)} in the original buffer with
 * {@code replacementText}. A zero-width edit is an insertion.
 */
public final class FragmentEdit {

	/**
	 * Orders by start offset; at equal starts insertions come first.
	 */
	public static final Comparator<FragmentEdit> BY_OFFSET = Comparator
			.comparingInt(FragmentEdit::getStartOffset)
			.thenComparingInt(FragmentEdit::getEndOffset);

	private final int startOffset;
	private final int endOffset;
	private final String replacementText;

	public FragmentEdit(int startOffset, int endOffset, String replacementText) {
		if (startOffset < 0 || endOffset < startOffset) {
			throw new IllegalArgumentException("Invalid edit span [" + startOffset + ", " + endOffset + ")");
		}
		if (replacementText == null) {
			throw new IllegalArgumentException("replacementText must not be null");
		}
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.replacementText = replacementText;
	}

	public static FragmentEdit insertion(int offset, String text) {
		return new FragmentEdit(offset, offset, text);
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public String getReplacementText() {
		return replacementText;
	}

	public boolean isInsertion() {
		return startOffset == endOffset;
	}

	/**
	 * Two edits collide when their spans share a character, or when both
	 * insert at the same offset.
	 */
	public boolean overlaps(FragmentEdit other) {
		if (isInsertion() && other.isInsertion()) {
			return startOffset == other.startOffset;
		}
		if (isInsertion()) {
			return startOffset > other.startOffset && startOffset < other.endOffset;
		}
		if (other.isInsertion()) {
			return other.startOffset > startOffset && other.startOffset < endOffset;
		}
		return startOffset < other.endOffset && other.startOffset < endOffset;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof FragmentEdit)) {
			return false;
		}
		FragmentEdit other = (FragmentEdit) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset
				&& replacementText.equals(other.replacementText);
	}

	@Override
	public int hashCode() {
		return Objects.hash(startOffset, endOffset, replacementText);
	}

	@Override
	public String toString() {
		return "[" + startOffset + ", " + endOffset + ") -> \"" + replacementText + "\"";
	}
}
