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
package com.tomaszrup.normalizer.classtokens;

/**
 * Thresholds of the class-string test. A string is accepted when its name
 * contains {@link #getNameKeyword()}, when at least {@code minMatchCount}
 * tokens are recognized, or when more than {@code minMatchRatio} of them are.
 */
public final class ClassTokenOptions {
	public static final int DEFAULT_MIN_MATCH_COUNT = 2;
	public static final double DEFAULT_MIN_MATCH_RATIO = 0.5;
	public static final String DEFAULT_NAME_KEYWORD = "class";

	private final int minMatchCount;
	private final double minMatchRatio;
	private final String nameKeyword;

	private ClassTokenOptions(Builder builder) {
		this.minMatchCount = builder.minMatchCount;
		this.minMatchRatio = builder.minMatchRatio;
		this.nameKeyword = builder.nameKeyword;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static ClassTokenOptions defaults() {
		return builder().build();
	}

	public int getMinMatchCount() {
		return minMatchCount;
	}

	public double getMinMatchRatio() {
		return minMatchRatio;
	}

	public String getNameKeyword() {
		return nameKeyword;
	}

	@Override
	public String toString() {
		return "ClassTokenOptions{minMatchCount=" + minMatchCount + ", minMatchRatio=" + minMatchRatio + "}";
	}

	public static final class Builder {
		private int minMatchCount = DEFAULT_MIN_MATCH_COUNT;
		private double minMatchRatio = DEFAULT_MIN_MATCH_RATIO;
		private String nameKeyword = DEFAULT_NAME_KEYWORD;

		private Builder() {
		}

		public Builder minMatchCount(int value) {
			this.minMatchCount = value;
			return this;
		}

		public Builder minMatchRatio(double value) {
			this.minMatchRatio = value;
			return this;
		}

		public Builder nameKeyword(String value) {
			this.nameKeyword = value;
			return this;
		}

		/**
		 * @throws IllegalArgumentException when a value is out of range
		 */
		public ClassTokenOptions build() {
			if (minMatchCount < 1) {
				throw new IllegalArgumentException("minMatchCount must be at least 1, got " + minMatchCount);
			}
			if (Double.isNaN(minMatchRatio) || minMatchRatio < 0 || minMatchRatio >= 1) {
				throw new IllegalArgumentException("minMatchRatio must be in [0, 1), got " + minMatchRatio);
			}
			if (nameKeyword == null || nameKeyword.isEmpty()) {
				throw new IllegalArgumentException("nameKeyword is required");
			}
			return new ClassTokenOptions(this);
		}
	}
}
