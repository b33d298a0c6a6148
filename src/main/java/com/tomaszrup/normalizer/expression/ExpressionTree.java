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

/**
 * Model of one fragment: its root is either a logical chain or a conditional.
 */
public final class ExpressionTree {
	private final ExpressionFragment fragment;
	private final ModelNode root;

	ExpressionTree(ExpressionFragment fragment, ModelNode root) {
		this.fragment = fragment;
		this.root = root;
	}

	public ExpressionFragment getFragment() {
		return fragment;
	}

	public ModelNode getRoot() {
		return root;
	}

	public boolean isConditional() {
		return root instanceof ConditionalNode;
	}
}
