////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.vyperfmt.cst;

import java.util.List;

/**
 * Common base of {@link Leaf} and {@link Node}.
 *
 * <p>Every element has at most one parent. Parent links are only used for
 * sibling and prefix lookups; the parent owns its children. Equality is
 * identity, so elements can key ordinary hash maps.</p>
 */
public abstract class TreeElement {

	Node parent;

	public Node getParent() {
		return parent;
	}

	public abstract boolean isLeaf();

	/** @return {@code true} if this is a leaf of the given type */
	public abstract boolean is(TokenType type);

	/** @return {@code true} if this is a node of the given type */
	public abstract boolean is(NodeType type);

	/** Whitespace preceding this element; for a node, the prefix of its first leaf. */
	public abstract String getPrefix();

	public abstract void setPrefix(String prefix);

	/** All leaves below (or equal to) this element, in source order. */
	public abstract List<Leaf> leaves();

	public abstract Leaf firstLeaf();

	public abstract Leaf lastLeaf();

	public TreeElement prevSibling() {
		return parent == null ? null : parent.siblingBefore(this);
	}

	public TreeElement nextSibling() {
		return parent == null ? null : parent.siblingAfter(this);
	}

	/**
	 * Detaches this element from its parent.
	 *
	 * @return the index it occupied, or -1 if it had no parent
	 */
	public int remove() {
		if (parent == null) {
			return -1;
		}
		Node oldParent = parent;
		int index = oldParent.indexOf(this);
		oldParent.removeChildAt(index);
		return index;
	}

	/** Structural rendering of the original text: prefixes plus values. */
	@Override
	public abstract String toString();
}
