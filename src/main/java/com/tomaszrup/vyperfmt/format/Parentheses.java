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
package com.tomaszrup.vyperfmt.format;

import java.util.List;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Tree edits around optional parentheses.
 */
final class Parentheses {

	private Parentheses() {
		// utility class
	}

	/**
	 * Replaces {@code child} with an atom holding it between parentheses,
	 * moving its prefix onto the opening one. Invisible parentheses have an
	 * empty value.
	 */
	static Node wrap(Node parent, TreeElement child, boolean visible) {
		Leaf lpar = new Leaf(TokenType.LPAR, visible ? "(" : "");
		Leaf rpar = new Leaf(TokenType.RPAR, visible ? ")" : "");
		String prefix = child.getPrefix();
		child.setPrefix("");
		int index = Math.max(child.remove(), 0);
		Node atom = new Node(NodeType.ATOM);
		atom.appendChild(lpar);
		atom.appendChild(child);
		atom.appendChild(rpar);
		lpar.setPrefix(prefix);
		parent.insertChild(index, atom);
		return atom;
	}

	static boolean isAtomWithInvisibleParens(TreeElement element) {
		if (!element.is(NodeType.ATOM)) {
			return false;
		}
		Node node = (Node) element;
		TreeElement first = node.getChild(0);
		TreeElement last = node.getChild(node.childCount() - 1);
		return first.is(TokenType.LPAR) && ((Leaf) first).getValue().isEmpty()
				&& last.is(TokenType.RPAR) && ((Leaf) last).getValue().isEmpty();
	}

	/**
	 * Makes visible parentheses of the atom {@code element} invisible,
	 * recursively, collapsing nested invisible pairs.
	 *
	 * @return whether the element should itself be wrapped in invisible parentheses
	 */
	static boolean maybeMakeInvisibleInAtom(TreeElement element) {
		if (!element.is(NodeType.ATOM)) {
			return true;
		}
		Node atom = (Node) element;
		TreeElement first = atom.getChild(0);
		TreeElement last = atom.getChild(atom.childCount() - 1);
		if (atom.childCount() == 3 && first.is(TokenType.LPAR) && ((Leaf) first).getValue().equals("(")
				&& last.is(TokenType.RPAR) && ((Leaf) last).getValue().equals(")")) {
			TreeElement middle = atom.getChild(1);
			((Leaf) first).setValue("");
			((Leaf) last).setValue("");
			maybeMakeInvisibleInAtom(middle);
			if (isAtomWithInvisibleParens(middle)) {
				Node inner = (Node) middle;
				atom.replaceChild(inner, inner.getChild(1));
			}
			return false;
		}
		return true;
	}

	static void ensureVisible(Leaf leaf) {
		if (leaf.getType() == TokenType.LPAR) {
			leaf.setValue("(");
		} else if (leaf.getType() == TokenType.RPAR) {
			leaf.setValue(")");
		}
	}

	/**
	 * Whether the content between a pair of parentheses is at most one
	 * element. A comma directly inside arguments or parameters always counts
	 * as a sequence.
	 */
	static boolean isOneSequenceBetween(Leaf opening, Leaf closing, List<Leaf> leaves) {
		if (opening.getType() != TokenType.LPAR || closing.getType() != TokenType.RPAR) {
			return false;
		}
		int depth = closing.getBracketDepth() + 1;
		int openingIndex = -1;
		for (int i = 0; i < leaves.size(); i++) {
			if (leaves.get(i) == opening) {
				openingIndex = i;
				break;
			}
		}
		if (openingIndex < 0) {
			throw new IllegalArgumentException("Opening paren not found in leaves");
		}

		int commas = 0;
		for (int i = openingIndex + 1; i < leaves.size(); i++) {
			Leaf leaf = leaves.get(i);
			if (leaf == closing) {
				break;
			}
			if (leaf.getBracketDepth() == depth && leaf.getType() == TokenType.COMMA) {
				commas++;
				Node parent = leaf.getParent();
				if (parent != null && (parent.getType() == NodeType.ARGUMENTS
						|| parent.getType() == NodeType.PARAMETERS)) {
					commas++;
					break;
				}
			}
		}
		return commas < 2;
	}

	/** Puts {@code replacement} where {@code old} is in the tree; no-op for detached leaves. */
	static void replaceChild(TreeElement old, TreeElement replacement) {
		Node parent = old.getParent();
		if (parent == null) {
			return;
		}
		int index = old.remove();
		parent.insertChild(index, replacement);
	}
}
