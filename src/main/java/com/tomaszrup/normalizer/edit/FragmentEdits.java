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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.lsp.utils.Ranges;

/**
 * Helpers for ordering, checking and applying {@link FragmentEdit}s.
 */
public final class FragmentEdits {
	private FragmentEdits() {
	}

	/**
	 * Sort edits by offset and verify that no two of them collide.
	 *
	 * @throws IllegalStateException when two edits overlap
	 */
	public static List<FragmentEdit> sortAndVerify(Collection<FragmentEdit> edits) {
		List<FragmentEdit> sorted = new ArrayList<>(edits);
		sorted.sort(FragmentEdit.BY_OFFSET);
		for (int i = 1; i < sorted.size(); i++) {
			FragmentEdit previous = sorted.get(i - 1);
			FragmentEdit current = sorted.get(i);
			if (previous.overlaps(current) || previous.getEndOffset() > current.getStartOffset()) {
				throw new IllegalStateException("Overlapping edits " + previous + " and " + current);
			}
		}
		return sorted;
	}

	/**
	 * Whether any edit of {@code candidate} collides with any of {@code accepted}.
	 */
	public static boolean conflicts(Collection<FragmentEdit> accepted, Collection<FragmentEdit> candidate) {
		for (FragmentEdit edit : candidate) {
			for (FragmentEdit other : accepted) {
				if (edit.overlaps(other)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Apply non-overlapping edits to {@code source}. Offsets refer to the
	 * original text.
	 */
	public static String apply(String source, Collection<FragmentEdit> edits) {
		List<FragmentEdit> sorted = sortAndVerify(edits);
		StringBuilder result = new StringBuilder(source);
		for (int i = sorted.size() - 1; i >= 0; i--) {
			FragmentEdit edit = sorted.get(i);
			if (edit.getEndOffset() > source.length()) {
				throw new IllegalArgumentException("Edit " + edit + " runs past the end of the text");
			}
			result.replace(edit.getStartOffset(), edit.getEndOffset(), edit.getReplacementText());
		}
		return result.toString();
	}

	/**
	 * Trim the common prefix and suffix of {@code original} and
	 * {@code replacement}, producing the smallest edit of the region starting
	 * at {@code offset}.
	 *
	 * @return the minimal edit, or {@code null} when the texts are equal
	 */
	public static FragmentEdit minimalEdit(int offset, String original, String replacement) {
		if (original.equals(replacement)) {
			return null;
		}
		int top = 0;
		int minLen = Math.min(original.length(), replacement.length());
		while (top < minLen && original.charAt(top) == replacement.charAt(top)) {
			top++;
		}
		int origBottom = original.length();
		int replBottom = replacement.length();
		while (origBottom > top && replBottom > top
				&& original.charAt(origBottom - 1) == replacement.charAt(replBottom - 1)) {
			origBottom--;
			replBottom--;
		}
		return new FragmentEdit(offset + top, offset + origBottom, replacement.substring(top, replBottom));
	}

	public static TextEdit toTextEdit(String source, FragmentEdit edit) {
		return new TextEdit(Ranges.fromOffsets(source, edit.getStartOffset(), edit.getEndOffset()),
				edit.getReplacementText());
	}
}
