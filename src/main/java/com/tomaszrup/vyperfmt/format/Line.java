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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.Syntax;
import com.tomaszrup.vyperfmt.cst.TokenType;

/**
 * A logical line: leaves at one indentation depth plus the trailing
 * comments attached to them. Rendered with {@link #toString()}.
 */
public class Line {

	private static final Set<String> FLOW_CONTROL = Set.of("return", "break", "continue");

	private int depth;
	private final List<Leaf> leaves = new ArrayList<>();
	/** Keyed by the leaf the comments follow, in the order of {@link #leaves}. */
	private final Map<Leaf, List<Leaf>> comments = new LinkedHashMap<>();
	private final BracketTracker bracketTracker = new BracketTracker();
	private boolean insideBrackets;
	private boolean shouldSplitRhs;
	private Leaf magicTrailingComma;

	public Line() {
		this(0, false);
	}

	public Line(int depth, boolean insideBrackets) {
		this.depth = depth;
		this.insideBrackets = insideBrackets;
	}

	public int getDepth() {
		return depth;
	}

	public void setDepth(int depth) {
		this.depth = depth;
	}

	public List<Leaf> getLeaves() {
		return Collections.unmodifiableList(leaves);
	}

	public BracketTracker getBracketTracker() {
		return bracketTracker;
	}

	public boolean isInsideBrackets() {
		return insideBrackets;
	}

	public void setInsideBrackets(boolean insideBrackets) {
		this.insideBrackets = insideBrackets;
	}

	public boolean shouldSplitRhs() {
		return shouldSplitRhs;
	}

	public void setShouldSplitRhs(boolean shouldSplitRhs) {
		this.shouldSplitRhs = shouldSplitRhs;
	}

	public Leaf getMagicTrailingComma() {
		return magicTrailingComma;
	}

	public void append(Leaf leaf) {
		append(leaf, false);
	}

	/**
	 * Adds {@code leaf} to the end of the line. Unless {@code preformatted},
	 * the leaf gets its whitespace prefix computed and is marked by the
	 * bracket tracker. Trailing comments are put aside.
	 */
	public void append(Leaf leaf, boolean preformatted) {
		boolean hasValue = Syntax.BRACKETS.contains(leaf.getType()) || !leaf.getValue().isBlank();
		if (!hasValue) {
			return;
		}

		if (!leaves.isEmpty() && !preformatted) {
			leaf.setPrefix(leaf.getPrefix() + Whitespace.before(leaf));
		}
		if (insideBrackets || !preformatted) {
			bracketTracker.mark(leaf);
			if (hasMagicTrailingComma(leaf)) {
				magicTrailingComma = leaf;
			}
		}
		if (!appendComment(leaf)) {
			leaves.add(leaf);
		}
	}

	/**
	 * Like {@link #append(Leaf, boolean)} but refuses to put anything after a
	 * standalone comment, or a standalone comment after other leaves, outside
	 * brackets.
	 *
	 * @return {@code false} if the leaf was not appended
	 */
	public boolean appendSafe(Leaf leaf, boolean preformatted) {
		if (bracketTracker.getDepth() == 0) {
			if (isComment()) {
				return false;
			}
			if (!leaves.isEmpty() && leaf.getType() == TokenType.STANDALONE_COMMENT) {
				return false;
			}
		}
		append(leaf, preformatted);
		return true;
	}

	/** A standalone comment or docstring alone on its line. */
	public boolean isComment() {
		return leaves.size() == 1 && (leaves.get(0).getType() == TokenType.STANDALONE_COMMENT
				|| leaves.get(0).getType() == TokenType.DOCSTRING);
	}

	public boolean isDecorator() {
		return !leaves.isEmpty() && leaves.get(0).getType() == TokenType.AT;
	}

	public boolean isImport() {
		return !leaves.isEmpty() && isImport(leaves.get(0));
	}

	public boolean isFlowControl() {
		return !leaves.isEmpty() && leaves.get(0).getType() == TokenType.NAME
				&& FLOW_CONTROL.contains(leaves.get(0).getValue());
	}

	public boolean isPragma() {
		return !leaves.isEmpty() && leaves.get(0).getType() == TokenType.PRAGMA;
	}

	/** Header of a function, event, struct, enum or interface; interface members excluded. */
	public boolean isDef() {
		if (leaves.isEmpty()) {
			return false;
		}
		Leaf first = leaves.get(0);
		Node parent = first.getParent();
		boolean interfaceMember = parent != null && parent.getParent() != null
				&& parent.getParent().getType() == NodeType.INTERFACE_FUNCTION;
		return Syntax.DECLARATIONS.contains(first.getType()) && !interfaceMember;
	}

	public boolean containsStandaloneComments() {
		return containsStandaloneComments(Integer.MAX_VALUE);
	}

	public boolean containsStandaloneComments(int depthLimit) {
		for (Leaf leaf : leaves) {
			if (leaf.getType() == TokenType.STANDALONE_COMMENT && leaf.getBracketDepth() <= depthLimit) {
				return true;
			}
		}
		return false;
	}

	/**
	 * A closing bracket preceded by a comma the user wrote to keep the
	 * collection exploded. One-element tuples and single-argument calls do
	 * not count.
	 */
	boolean hasMagicTrailingComma(Leaf closing) {
		if (!(Syntax.CLOSING_BRACKETS.contains(closing.getType()) && !leaves.isEmpty()
				&& leaves.get(leaves.size() - 1).getType() == TokenType.COMMA)) {
			return false;
		}
		if (closing.getType() == TokenType.RBRACE || closing.getType() == TokenType.RSQB) {
			return true;
		}
		if (isImport()) {
			return true;
		}
		return closing.getOpeningBracket() != null
				&& !Parentheses.isOneSequenceBetween(closing.getOpeningBracket(), closing, leaves);
	}

	/** @return {@code true} if {@code comment} was stored as a trailing comment */
	boolean appendComment(Leaf comment) {
		if (comment.getType() == TokenType.STANDALONE_COMMENT && bracketTracker.anyOpenBrackets()) {
			comment.setPrefix("");
			return false;
		}
		if (comment.getType() != TokenType.COMMENT) {
			return false;
		}
		if (leaves.isEmpty()) {
			comment.setType(TokenType.STANDALONE_COMMENT);
			comment.setPrefix("");
			return false;
		}

		Leaf last = leaves.get(leaves.size() - 1);
		if (last.getType() == TokenType.RPAR && last.getValue().isEmpty() && last.getParent() != null
				&& last.getParent().leaves().size() <= 3) {
			// keep the comment on the wrapped leaf so it does not migrate between runs
			if (leaves.size() < 2) {
				comment.setType(TokenType.STANDALONE_COMMENT);
				comment.setPrefix("");
				return false;
			}
			last = leaves.get(leaves.size() - 2);
		}
		comments.computeIfAbsent(last, key -> new ArrayList<>()).add(comment);
		return true;
	}

	public List<Leaf> commentsAfter(Leaf leaf) {
		List<Leaf> after = comments.get(leaf);
		return after == null ? Collections.emptyList() : after;
	}

	/** Rendered width of {@code leaf} together with the comments that follow it. */
	int lengthWithComments(Leaf leaf) {
		int length = leaf.getPrefix().length() + leaf.getValue().length();
		for (Leaf comment : commentsAfter(leaf)) {
			length += comment.getValue().length();
		}
		return length;
	}

	/** A new empty line with the same depth and split markers. */
	public Line emptyCopy() {
		Line copy = new Line(depth, insideBrackets);
		copy.shouldSplitRhs = shouldSplitRhs;
		copy.magicTrailingComma = magicTrailingComma;
		return copy;
	}

	public boolean isEmpty() {
		return leaves.isEmpty() && comments.isEmpty();
	}

	static boolean isImport(Leaf leaf) {
		Node parent = leaf.getParent();
		return (leaf.getType() == TokenType.IMPORT || leaf.getType() == TokenType.FROM)
				&& parent != null && parent.getType() == NodeType.IMPORT;
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "\n";
		}
		StringBuilder builder = new StringBuilder();
		String indent = "    ".repeat(depth);
		if (!leaves.isEmpty()) {
			Leaf first = leaves.get(0);
			builder.append(first.getPrefix()).append(indent).append(first.getValue());
			for (int i = 1; i < leaves.size(); i++) {
				builder.append(leaves.get(i));
			}
		}
		for (List<Leaf> after : comments.values()) {
			for (Leaf comment : after) {
				builder.append(comment);
			}
		}
		return builder.append('\n').toString();
	}
}
