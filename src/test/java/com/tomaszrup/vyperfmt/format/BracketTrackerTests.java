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

import java.util.Arrays;
import java.util.Collections;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.TokenType;

class BracketTrackerTests {

	private BracketTracker tracker;

	@BeforeEach
	void setup() {
		tracker = new BracketTracker();
	}

	private void markAll(Leaf... leaves) {
		for (Leaf leaf : leaves) {
			tracker.mark(leaf);
		}
	}

	// --- depth ---

	@Test
	void testDepthFollowsBrackets() {
		Leaf name = new Leaf(TokenType.NAME, "f");
		Leaf lpar = new Leaf(TokenType.LPAR, "(");
		Leaf argument = new Leaf(TokenType.NAME, "a");
		Leaf rpar = new Leaf(TokenType.RPAR, ")");

		tracker.mark(name);
		tracker.mark(lpar);
		Assertions.assertEquals(1, tracker.getDepth());
		Assertions.assertTrue(tracker.anyOpenBrackets());
		tracker.mark(argument);
		tracker.mark(rpar);

		Assertions.assertEquals(0, tracker.getDepth());
		Assertions.assertFalse(tracker.anyOpenBrackets());
		Assertions.assertEquals(0, lpar.getBracketDepth());
		Assertions.assertEquals(1, argument.getBracketDepth());
		Assertions.assertEquals(0, rpar.getBracketDepth());
		Assertions.assertSame(lpar, rpar.getOpeningBracket());
	}

	@Test
	void testUnmatchedClosingBracketThrows() {
		Assertions.assertThrows(BracketMatchException.class,
				() -> tracker.mark(new Leaf(TokenType.RSQB, "]")));
	}

	@Test
	void testMismatchedBracketKindThrows() {
		tracker.mark(new Leaf(TokenType.LSQB, "["));
		Assertions.assertThrows(BracketMatchException.class,
				() -> tracker.mark(new Leaf(TokenType.RPAR, ")")));
	}

	@Test
	void testInvisibleBracketsAreCollected() {
		Leaf lpar = new Leaf(TokenType.LPAR, "");
		Leaf rpar = new Leaf(TokenType.RPAR, "");
		markAll(lpar, new Leaf(TokenType.NAME, "x"), rpar);
		Assertions.assertEquals(Arrays.asList(lpar, rpar), tracker.getInvisible());
	}

	@Test
	void testTrailingCommentIsNotMarked() {
		Leaf comment = new Leaf(TokenType.COMMENT, "# c");
		markAll(new Leaf(TokenType.LPAR, "("), comment);
		Assertions.assertEquals(0, comment.getBracketDepth());
	}

	// --- delimiters ---

	@Test
	void testCommaAtDepthZeroIsDelimiter() {
		Leaf comma = new Leaf(TokenType.COMMA, ",");
		markAll(new Leaf(TokenType.NAME, "a"), comma, new Leaf(TokenType.NAME, "b"));
		Assertions.assertTrue(tracker.hasDelimiters());
		Assertions.assertEquals(BracketTracker.COMMA_PRIORITY, tracker.delimiterPriority(comma));
		Assertions.assertEquals(BracketTracker.COMMA_PRIORITY, tracker.maxDelimiterPriority());
		Assertions.assertEquals(1, tracker.delimiterCountWithPriority(BracketTracker.COMMA_PRIORITY));
	}

	@Test
	void testCommaInsideBracketsIsNotDelimiter() {
		markAll(new Leaf(TokenType.LSQB, "["), new Leaf(TokenType.NUMBER, "1"), new Leaf(TokenType.COMMA, ","),
				new Leaf(TokenType.NUMBER, "2"), new Leaf(TokenType.RSQB, "]"));
		Assertions.assertFalse(tracker.hasDelimiters());
		Assertions.assertThrows(NoSuchElementException.class, () -> tracker.maxDelimiterPriority());
	}

	@Test
	void testComparatorSplitsBefore() {
		Leaf left = new Leaf(TokenType.NAME, "a");
		markAll(left, new Leaf(TokenType.LESS, "<"), new Leaf(TokenType.NAME, "b"));
		Assertions.assertEquals(BracketTracker.COMPARATOR_PRIORITY, tracker.delimiterPriority(left));
	}

	@Test
	void testArithmeticPriority() {
		Leaf left = new Leaf(TokenType.NAME, "a");
		Leaf plus = new Leaf(TokenType.PLUS, "+");
		Leaf right = new Leaf(TokenType.NAME, "b");
		new Node(NodeType.ADD, Arrays.asList(left, plus, right));
		markAll(left, plus, right);
		Assertions.assertEquals(5, tracker.delimiterPriority(left));
	}

	@Test
	void testUnaryMinusIsNotDelimiter() {
		Leaf minus = new Leaf(TokenType.MINUS, "-");
		Leaf operand = new Leaf(TokenType.NAME, "x");
		new Node(NodeType.USUB, Arrays.asList(minus, operand));
		markAll(new Leaf(TokenType.EQUAL, "="), minus, operand);
		Assertions.assertFalse(tracker.hasDelimiters());
	}

	@Test
	void testLogicOperatorsOutrankComparators() {
		Leaf a = new Leaf(TokenType.NAME, "a");
		Leaf less = new Leaf(TokenType.LESS, "<");
		Leaf b = new Leaf(TokenType.NAME, "b");
		Leaf and = new Leaf(TokenType.NAME, "and");
		Leaf c = new Leaf(TokenType.NAME, "c");
		new Node(NodeType.AND, Arrays.asList(new Node(NodeType.LT, Arrays.asList(a, less, b)), and, c));
		markAll(a, less, b, and, c);
		Assertions.assertEquals(BracketTracker.LOGIC_PRIORITY, tracker.delimiterPriority(b));
		Assertions.assertEquals(BracketTracker.LOGIC_PRIORITY, tracker.maxDelimiterPriority());
		Assertions.assertEquals(BracketTracker.COMPARATOR_PRIORITY,
				tracker.maxDelimiterPriority(Collections.singleton(b)));
	}

	@Test
	void testDelimiterOutsideExclusion() {
		Leaf comma = new Leaf(TokenType.COMMA, ",");
		markAll(new Leaf(TokenType.NAME, "a"), comma, new Leaf(TokenType.NAME, "b"));
		Assertions.assertFalse(tracker.hasDelimitersOutside(Collections.singleton(comma)));
		Assertions.assertTrue(tracker.hasDelimitersOutside(Collections.emptySet()));
	}
}
