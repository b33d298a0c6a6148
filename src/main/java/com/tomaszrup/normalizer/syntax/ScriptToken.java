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

import java.util.Collections;
import java.util.List;

/**
 * A lexical token of script source. Template tokens additionally carry the
 * spans of their static segments and of their {@code ${...}} expressions.
 */
public final class ScriptToken {

	public enum Type {
		IDENTIFIER,
		NUMBER,
		STRING,
		TEMPLATE,
		REGEX,
		PUNCTUATOR,
		LINE_COMMENT,
		BLOCK_COMMENT
	}

	private final Type type;
	private final SourceSpan span;
	private final String text;
	private final List<SourceSpan> quasis;
	private final List<SourceSpan> expressions;

	ScriptToken(Type type, SourceSpan span, String text) {
		this(type, span, text, Collections.emptyList(), Collections.emptyList());
	}

	ScriptToken(Type type, SourceSpan span, String text, List<SourceSpan> quasis, List<SourceSpan> expressions) {
		this.type = type;
		this.span = span;
		this.text = text;
		this.quasis = Collections.unmodifiableList(quasis);
		this.expressions = Collections.unmodifiableList(expressions);
	}

	public Type getType() {
		return type;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public int getStart() {
		return span.getStart();
	}

	public int getEnd() {
		return span.getEnd();
	}

	public String getText() {
		return text;
	}

	public List<SourceSpan> getQuasis() {
		return quasis;
	}

	public List<SourceSpan> getExpressions() {
		return expressions;
	}

	public boolean isComment() {
		return type == Type.LINE_COMMENT || type == Type.BLOCK_COMMENT;
	}

	public boolean is(String punctuatorOrWord) {
		return (type == Type.PUNCTUATOR || type == Type.IDENTIFIER) && text.equals(punctuatorOrWord);
	}

	@Override
	public String toString() {
		return type + "(" + text + ")" + span;
	}
}
