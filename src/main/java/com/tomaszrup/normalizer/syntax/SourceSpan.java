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
package com.tomaszrup.normalizer.syntax;

/**
 * Half-open character range {@code [start, end)} into an immutable source
 * buffer.
 */
public final class SourceSpan {
	private final int start;
	private final int end;

	public SourceSpan(int start, int end) {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
		}
		this.start = start;
		this.end = end;
	}

	public static SourceSpan of(int start, int end) {
		return new SourceSpan(start, end);
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int length() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean contains(SourceSpan other) {
		return other.start >= start && other.end <= end;
	}

	public boolean contains(int offset) {
		return offset >= start && offset < end;
	}

	/**
	 * Two spans overlap when they share at least one character. Touching
	 * spans and zero-width spans sitting on a boundary do not overlap.
	 */
	public boolean overlaps(SourceSpan other) {
		return start < other.end && other.start < end;
	}

	public String text(String source) {
		if (end > source.length()) {
			throw new IllegalArgumentException("Span " + this + " exceeds source length " + source.length());
		}
		return source.substring(start, end);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SourceSpan)) {
			return false;
		}
		SourceSpan other = (SourceSpan) obj;
		return start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return 31 * start + end;
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}
}
