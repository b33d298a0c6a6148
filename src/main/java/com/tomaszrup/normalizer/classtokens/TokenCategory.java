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

public enum TokenCategory {
	LAYOUT,
	POSITION,
	SPACING,
	SIZING,
	TYPOGRAPHY,
	COLOR,
	BORDER,
	EFFECT,
	TRANSITION,
	TRANSFORM,
	INTERACTIVITY,
	/** Breakpoint, interaction-state or theme prefix such as {@code md:} or {@code hover:}. */
	VARIANT,
	UNKNOWN;

	/**
	 * Category of a rank from {@link CategoryTable}.
	 */
	static TokenCategory forRank(int rank) {
		if (rank >= CategoryTable.BREAKPOINT_RANK) {
			return VARIANT;
		}
		switch (rank) {
			case 10:
			case 30:
			case 40:
			case 45:
			case 50:
				return LAYOUT;
			case 20:
			case 25:
				return POSITION;
			case 60:
			case 70:
				return SPACING;
			case 80:
				return SIZING;
			case 90:
				return TYPOGRAPHY;
			case 100:
				return COLOR;
			case 110:
				return BORDER;
			case 120:
				return EFFECT;
			case 130:
				return TRANSITION;
			case 140:
				return TRANSFORM;
			case 150:
			case 160:
			case 170:
				return INTERACTIVITY;
			default:
				return UNKNOWN;
		}
	}
}
