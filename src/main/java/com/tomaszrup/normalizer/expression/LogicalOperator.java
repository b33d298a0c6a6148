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

public enum LogicalOperator {
	AND("&&", "And"),
	OR("||", "Or");

	private final String token;
	private final String word;

	LogicalOperator(String token, String word) {
		this.token = token;
		this.word = word;
	}

	public String getToken() {
		return token;
	}

	/**
	 * Capitalized word used when deriving binding names.
	 */
	public String getWord() {
		return word;
	}

	public static LogicalOperator fromToken(String token) {
		for (LogicalOperator operator : values()) {
			if (operator.token.equals(token)) {
				return operator;
			}
		}
		throw new IllegalArgumentException("Not a logical operator: " + token);
	}
}
