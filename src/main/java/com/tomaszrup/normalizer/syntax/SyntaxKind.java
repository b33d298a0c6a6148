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

public enum SyntaxKind {
	/** {@code a && b}, {@code a || b}; operator holds the token text. */
	LOGICAL,
	/** {@code test ? consequent : alternate}. */
	CONDITIONAL,
	/** Explicit parentheses around a single expression. */
	PARENTHESIZED,
	UNARY,
	/** Any other binary operator, including {@code ??}. */
	BINARY,
	CALL,
	MEMBER,
	INDEX,
	IDENTIFIER,
	/** {@code true}, {@code false}, {@code null}, {@code undefined}, {@code this}. */
	KEYWORD_LITERAL,
	NUMERIC_LITERAL,
	STRING_LITERAL,
	TEMPLATE_LITERAL,
	REGEX_LITERAL,
	ARRAY_LITERAL,
	OBJECT_LITERAL,
	/** {@code [key]: value} inside an object literal. */
	COMPUTED_PROPERTY
}
