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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * An interior element typed by grammar rule.
 *
 * <p>Sibling lookups go through two lazily built maps that are dropped on
 * every structural edit of the children list.</p>
 */
public class Node extends TreeElement {

	private NodeType type;
	private final List<TreeElement> children = new ArrayList<>();

	private Map<TreeElement, TreeElement> prevSiblings;
	private Map<TreeElement, TreeElement> nextSiblings;

	public Node(NodeType type) {
		this.type = type;
	}

	public Node(NodeType type, List<? extends TreeElement> children) {
		this.type = type;
		for (TreeElement child : children) {
			appendChild(child);
		}
	}

	public NodeType getType() {
		return type;
	}

	public void setType(NodeType type) {
		this.type = type;
	}

	public List<TreeElement> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public TreeElement getChild(int index) {
		return children.get(index);
	}

	public int childCount() {
		return children.size();
	}

	public int indexOf(TreeElement child) {
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	public void appendChild(TreeElement child) {
		adopt(child);
		children.add(child);
		invalidateSiblingMaps();
	}

	public void insertChild(int index, TreeElement child) {
		adopt(child);
		children.add(index, child);
		invalidateSiblingMaps();
	}

	public void setChild(int index, TreeElement child) {
		adopt(child);
		TreeElement old = children.set(index, child);
		old.parent = null;
		invalidateSiblingMaps();
	}

	/** Puts {@code replacement} where {@code old} was. */
	public void replaceChild(TreeElement old, TreeElement replacement) {
		int index = indexOf(old);
		if (index < 0) {
			throw new IllegalArgumentException("not a child of this node");
		}
		setChild(index, replacement);
	}

	void removeChildAt(int index) {
		TreeElement removed = children.remove(index);
		removed.parent = null;
		invalidateSiblingMaps();
	}

	private void adopt(TreeElement child) {
		if (child.parent != null) {
			child.remove();
		}
		child.parent = this;
	}

	private void invalidateSiblingMaps() {
		prevSiblings = null;
		nextSiblings = null;
	}

	private void buildSiblingMaps() {
		prevSiblings = new IdentityHashMap<>();
		nextSiblings = new IdentityHashMap<>();
		TreeElement previous = null;
		for (TreeElement child : children) {
			prevSiblings.put(child, previous);
			if (previous != null) {
				nextSiblings.put(previous, child);
			}
			previous = child;
		}
		if (previous != null) {
			nextSiblings.put(previous, null);
		}
	}

	TreeElement siblingBefore(TreeElement child) {
		if (prevSiblings == null) {
			buildSiblingMaps();
		}
		return prevSiblings.get(child);
	}

	TreeElement siblingAfter(TreeElement child) {
		if (nextSiblings == null) {
			buildSiblingMaps();
		}
		return nextSiblings.get(child);
	}

	@Override
	public boolean isLeaf() {
		return false;
	}

	@Override
	public boolean is(TokenType type) {
		return false;
	}

	@Override
	public boolean is(NodeType type) {
		return this.type == type;
	}

	@Override
	public String getPrefix() {
		Leaf first = firstLeaf();
		return first == null ? "" : first.getPrefix();
	}

	@Override
	public void setPrefix(String prefix) {
		Leaf first = firstLeaf();
		if (first != null) {
			first.setPrefix(prefix);
		}
	}

	@Override
	public List<Leaf> leaves() {
		List<Leaf> result = new ArrayList<>();
		collectLeaves(this, result);
		return result;
	}

	private static void collectLeaves(TreeElement element, List<Leaf> into) {
		if (element instanceof Leaf) {
			into.add((Leaf) element);
			return;
		}
		for (TreeElement child : ((Node) element).children) {
			collectLeaves(child, into);
		}
	}

	@Override
	public Leaf firstLeaf() {
		for (TreeElement child : children) {
			Leaf leaf = child.firstLeaf();
			if (leaf != null) {
				return leaf;
			}
		}
		return null;
	}

	@Override
	public Leaf lastLeaf() {
		for (int i = children.size() - 1; i >= 0; i--) {
			Leaf leaf = children.get(i).lastLeaf();
			if (leaf != null) {
				return leaf;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (TreeElement child : children) {
			builder.append(child);
		}
		return builder.toString();
	}
}
