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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.Syntax;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Tracks bracket depth and split points while the leaves of one line are
 * appended.
 *
 * <p>Every marked leaf receives its depth relative to the line; closing
 * brackets also receive their opening bracket. Leaves at depth 0 that the
 * line may be split at are recorded as delimiters with a priority: higher
 * priorities are split first.</p>
 */
public class BracketTracker {

	public static final int COMPREHENSION_PRIORITY = 20;
	public static final int COMMA_PRIORITY = 18;
	public static final int TERNARY_PRIORITY = 16;
	public static final int LOGIC_PRIORITY = 14;
	public static final int STRING_PRIORITY = 12;
	public static final int COMPARATOR_PRIORITY = 10;
	public static final int DOT_PRIORITY = 1;

	private static final Map<TokenType, Integer> MATH_PRIORITIES = new EnumMap<>(TokenType.class);

	static {
		MATH_PRIORITIES.put(TokenType.VBAR, 9);
		MATH_PRIORITIES.put(TokenType.CIRCUMFLEX, 8);
		MATH_PRIORITIES.put(TokenType.AMPERSAND, 7);
		MATH_PRIORITIES.put(TokenType.LEFTSHIFT, 6);
		MATH_PRIORITIES.put(TokenType.RIGHTSHIFT, 6);
		MATH_PRIORITIES.put(TokenType.PLUS, 5);
		MATH_PRIORITIES.put(TokenType.MINUS, 5);
		MATH_PRIORITIES.put(TokenType.STAR, 4);
		MATH_PRIORITIES.put(TokenType.SLASH, 4);
		MATH_PRIORITIES.put(TokenType.DOUBLESLASH, 4);
		MATH_PRIORITIES.put(TokenType.PERCENT, 4);
		MATH_PRIORITIES.put(TokenType.TILDE, 4);
		MATH_PRIORITIES.put(TokenType.DOUBLESTAR, 2);
	}

	private int depth;
	private final Map<String, Leaf> bracketMatch = new HashMap<>();
	private final Map<Leaf, Integer> delimiters = new HashMap<>();
	private Leaf previous;
	private final Deque<Integer> forLoopDepths = new ArrayDeque<>();
	private final List<Leaf> invisible = new ArrayList<>();

	public void mark(Leaf leaf) {
		if (leaf.getType() == TokenType.COMMENT) {
			return;
		}

		maybeDecrementAfterForLoopVariable(leaf);
		if (Syntax.CLOSING_BRACKETS.contains(leaf.getType())) {
			depth--;
			Leaf opening = bracketMatch.remove(key(depth, leaf.getType()));
			if (opening == null) {
				throw new BracketMatchException(
						"Unable to match a closing bracket to the following opening bracket: " + leaf.getValue());
			}
			leaf.setOpeningBracket(opening);
			if (leaf.getValue().isEmpty()) {
				invisible.add(leaf);
			}
		}
		leaf.setBracketDepth(depth);
		if (depth == 0) {
			int priority = splitBeforePriority(leaf, previous);
			if (priority > 0 && previous != null) {
				delimiters.put(previous, priority);
			} else {
				priority = splitAfterPriority(leaf);
				if (priority > 0) {
					delimiters.put(leaf, priority);
				}
			}
		}
		if (Syntax.OPENING_BRACKETS.contains(leaf.getType())) {
			bracketMatch.put(key(depth, Syntax.BRACKET_PAIRS.get(leaf.getType())), leaf);
			depth++;
			if (leaf.getValue().isEmpty()) {
				invisible.add(leaf);
			}
		}
		previous = leaf;
		maybeIncrementForLoopVariable(leaf);
	}

	public int getDepth() {
		return depth;
	}

	public boolean anyOpenBrackets() {
		return !bracketMatch.isEmpty();
	}

	public boolean hasDelimiters() {
		return !delimiters.isEmpty();
	}

	/** Whether a delimiter other than those in {@code exclude} was recorded. */
	public boolean hasDelimitersOutside(Set<Leaf> exclude) {
		for (Leaf delimiter : delimiters.keySet()) {
			if (!exclude.contains(delimiter)) {
				return true;
			}
		}
		return false;
	}

	/** Priority recorded for {@code leaf}, or 0 when it is not a delimiter. */
	public int delimiterPriority(Leaf leaf) {
		Integer priority = delimiters.get(leaf);
		return priority == null ? 0 : priority;
	}

	public int maxDelimiterPriority() {
		return maxDelimiterPriority(Collections.emptySet());
	}

	/**
	 * @throws NoSuchElementException if no delimiter outside {@code exclude} was recorded
	 */
	public int maxDelimiterPriority(Set<Leaf> exclude) {
		int max = 0;
		boolean found = false;
		for (Map.Entry<Leaf, Integer> entry : delimiters.entrySet()) {
			if (!exclude.contains(entry.getKey())) {
				max = found ? Math.max(max, entry.getValue()) : entry.getValue();
				found = true;
			}
		}
		if (!found) {
			throw new NoSuchElementException("No delimiters on the line");
		}
		return max;
	}

	public int delimiterCountWithPriority(int priority) {
		if (delimiters.isEmpty()) {
			return 0;
		}
		int count = 0;
		for (int value : delimiters.values()) {
			if (value == priority) {
				count++;
			}
		}
		return count;
	}

	/** Brackets with an empty value that were marked on this line. */
	public List<Leaf> getInvisible() {
		return Collections.unmodifiableList(invisible);
	}

	/** Commas between {@code for} and {@code in} are unpacking, not split points. */
	private void maybeIncrementForLoopVariable(Leaf leaf) {
		if (leaf.getType() == TokenType.FOR) {
			depth++;
			forLoopDepths.push(depth);
		}
	}

	private void maybeDecrementAfterForLoopVariable(Leaf leaf) {
		if (!forLoopDepths.isEmpty() && forLoopDepths.peek() == depth && leaf.getType() == TokenType.IN) {
			depth--;
			forLoopDepths.pop();
		}
	}

	private static String key(int depth, TokenType closing) {
		return depth + ":" + closing;
	}

	static int splitAfterPriority(Leaf leaf) {
		return leaf.getType() == TokenType.COMMA ? COMMA_PRIORITY : 0;
	}

	static int splitBeforePriority(Leaf leaf, Leaf previous) {
		Node parent = leaf.getParent();
		TokenType type = leaf.getType();

		if (type == TokenType.DOT && parent != null && parent.getType() != NodeType.IMPORT
				&& (previous == null || Syntax.CLOSING_BRACKETS.contains(previous.getType()))) {
			return DOT_PRIORITY;
		}

		if (Syntax.MATH_OPERATORS.contains(type) && parent != null && !Syntax.UNARY.contains(parent.getType())) {
			return MATH_PRIORITIES.get(type);
		}

		if (Syntax.COMPARATORS.contains(type)) {
			return COMPARATOR_PRIORITY;
		}

		if (type == TokenType.STRING && previous != null && previous.getType() == TokenType.STRING) {
			return STRING_PRIORITY;
		}

		if (type == TokenType.FOR && parent != null && parent.getType() == NodeType.FOR_STMT) {
			TreeElement before = leaf.prevSibling();
			if (!(before instanceof Leaf)) {
				return COMPREHENSION_PRIORITY;
			}
		}

		if (type == TokenType.IF && parent != null
				&& (parent.getType() == NodeType.IF_STMT || parent.getType() == NodeType.COND_EXEC)) {
			return COMPREHENSION_PRIORITY;
		}

		if ((type == TokenType.IF || type == TokenType.ELSE) && parent != null
				&& parent.getType() == NodeType.TERNARY) {
			return TERNARY_PRIORITY;
		}

		if (type == TokenType.NAME && (leaf.getValue().equals("or") || leaf.getValue().equals("and"))
				&& parent != null) {
			return LOGIC_PRIORITY;
		}

		return 0;
	}
}
