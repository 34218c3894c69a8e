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
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.Syntax;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Splits a logical line that does not fit into several physical lines.
 *
 * <p>Transformations are tried in order and the first that applies wins.
 * Every line it produces is split again recursively, so the result is
 * always a list of lines that are either short enough or cannot be split
 * any further.</p>
 */
public class LineSplitter {
	private static final Logger logger = LoggerFactory.getLogger(LineSplitter.class);

	private enum Transform {
		LEFT_HAND_SPLIT,
		RIGHT_HAND_SPLIT,
		DELIMITER_SPLIT,
		HUG_POWER_OPERATOR
	}

	private static final Set<NodeType> ATOMS = Collections.unmodifiableSet(
			EnumSet.of(NodeType.ATOM, NodeType.TUPLE, NodeType.LIST, NodeType.DICT));

	private final int lineLength;

	public LineSplitter(int lineLength) {
		this.lineLength = lineLength;
	}

	public List<Line> split(Line line) {
		return splitLine(line, false);
	}

	private List<Line> splitLine(Line line, boolean forceOptionalParentheses) {
		if (line.isComment()) {
			return Collections.singletonList(line);
		}

		String lineString = lineToString(line);
		List<Transform> transformers = new ArrayList<>();
		if (!line.shouldSplitRhs() && line.getMagicTrailingComma() == null
				&& isLineShortEnough(line, lineString)
				&& !(line.isInsideBrackets() && line.containsStandaloneComments())) {
			// fits already, only the power operator gets hugged
		} else if (line.isDef()) {
			transformers.add(Transform.LEFT_HAND_SPLIT);
		} else if (line.isInsideBrackets()) {
			transformers.add(Transform.DELIMITER_SPLIT);
			transformers.add(Transform.RIGHT_HAND_SPLIT);
		} else {
			transformers.add(Transform.RIGHT_HAND_SPLIT);
		}
		transformers.add(Transform.HUG_POWER_OPERATOR);

		for (Transform transform : transformers) {
			SplitResult result = runTransformer(line, transform, lineString, forceOptionalParentheses);
			if (result.isSuccess()) {
				return result.getLines();
			}
			if (logger.isTraceEnabled()) {
				logger.trace("{} did not apply to '{}': {}", transform, lineString, result.getFailure());
			}
		}
		return Collections.singletonList(line);
	}

	private SplitResult apply(Transform transform, Line line, boolean forceOptionalParentheses) {
		switch (transform) {
			case LEFT_HAND_SPLIT:
				return leftHandSplit(line);
			case RIGHT_HAND_SPLIT:
				return rightHandSplitWithOmits(line, forceOptionalParentheses);
			case DELIMITER_SPLIT:
				return delimiterSplit(line);
			case HUG_POWER_OPERATOR:
				return hugPowerOperator(line);
			default:
				throw new IllegalStateException("Unknown transform " + transform);
		}
	}

	private SplitResult runTransformer(Line line, Transform transform, String lineString,
			boolean forceOptionalParentheses) {
		SplitResult transformed = apply(transform, line, forceOptionalParentheses);
		if (!transformed.isSuccess()) {
			return transformed;
		}
		List<Line> result = new ArrayList<>();
		for (Line transformedLine : transformed.getLines()) {
			if (lineToString(transformedLine).equals(lineString)) {
				return SplitResult.cannotSplit("Line transformer returned an unchanged result");
			}
			result.addAll(splitLine(transformedLine, forceOptionalParentheses));
		}

		if (transform != Transform.RIGHT_HAND_SPLIT
				|| line.getBracketTracker().getInvisible().isEmpty()
				|| anyVisible(line.getBracketTracker().getInvisible())
				|| result.isEmpty()
				|| isLineShortEnough(result.get(0))
				|| anyDetached(line.getLeaves())) {
			return SplitResult.of(result);
		}

		// retry with the optional parentheses made visible
		Line lineCopy = line.emptyCopy();
		appendLeaves(lineCopy, line, line.getLeaves(), false);
		SplitResult secondOpinion = runTransformer(lineCopy, transform, lineString, true);
		if (secondOpinion.isSuccess() && allShortEnough(secondOpinion.getLines())) {
			return secondOpinion;
		}
		return SplitResult.of(result);
	}

	// --- right hand split ---

	/**
	 * Splits at the last opening bracket, first trying to keep trailers such
	 * as call arguments or subscripts on the head line.
	 */
	private SplitResult rightHandSplitWithOmits(Line line, boolean forceOptionalParentheses) {
		Iterator<Set<Leaf>> omits = new TrailersToOmit(line);
		while (omits.hasNext()) {
			Set<Leaf> omit = omits.next();
			SplitResult lines = rightHandSplit(line, omit, forceOptionalParentheses);
			if (!lines.isSuccess()) {
				return lines;
			}
			if (isLineShortEnough(lines.getLines().get(0))) {
				return lines;
			}
		}
		return rightHandSplit(line, Collections.emptySet(), forceOptionalParentheses);
	}

	private SplitResult rightHandSplit(Line line, Set<Leaf> omit, boolean forceOptionalParentheses) {
		List<Leaf> tail = new ArrayList<>();
		List<Leaf> body = new ArrayList<>();
		List<Leaf> head = new ArrayList<>();
		List<Leaf> current = tail;
		Leaf opening = null;
		Leaf closing = null;
		List<Leaf> leaves = line.getLeaves();
		for (int i = leaves.size() - 1; i >= 0; i--) {
			Leaf leaf = leaves.get(i);
			if (current == body && leaf == opening) {
				current = body.isEmpty() ? tail : head;
			}
			current.add(leaf);
			if (current == tail && isClosingBracket(leaf) && !omit.contains(leaf)) {
				opening = leaf.getOpeningBracket();
				closing = leaf;
				current = body;
			}
		}
		if (opening == null || closing == null || head.isEmpty()) {
			return SplitResult.cannotSplit("No brackets found");
		}
		Collections.reverse(tail);
		Collections.reverse(body);
		Collections.reverse(head);

		Line headLine = bracketSplitBuildLine(head, line, opening, false);
		Line bodyLine = bracketSplitBuildLine(body, line, opening, true);
		Line tailLine = bracketSplitBuildLine(tail, line, opening, false);
		SplitResult check = bracketSplitSucceeded(bodyLine, tailLine);
		if (check != null) {
			return check;
		}

		if (!forceOptionalParentheses
				&& opening.getType() == TokenType.LPAR && opening.getValue().isEmpty()
				&& closing.getType() == TokenType.RPAR && closing.getValue().isEmpty()
				&& !line.isImport()
				&& !bodyLine.containsStandaloneComments(0)
				&& canOmitInvisibleParens(bodyLine)) {
			Set<Leaf> widerOmit = new HashSet<>(omit);
			widerOmit.add(closing);
			SplitResult withoutParens = rightHandSplit(line, widerOmit, false);
			if (withoutParens.isSuccess()) {
				return withoutParens;
			}
			if (!isLineShortEnough(bodyLine)) {
				return SplitResult.cannotSplit("Splitting failed, body is still too long and can't be split.");
			}
		}

		Parentheses.ensureVisible(opening);
		Parentheses.ensureVisible(closing);
		return SplitResult.of(nonEmpty(headLine, bodyLine, tailLine));
	}

	/**
	 * Whether a line wrapped in invisible parentheses can do without them,
	 * because a trailer bracket already offers a reasonable split.
	 */
	private boolean canOmitInvisibleParens(Line line) {
		BracketTracker tracker = line.getBracketTracker();
		if (!tracker.hasDelimiters()) {
			return true;
		}
		int maxPriority = tracker.maxDelimiterPriority();
		if (tracker.delimiterCountWithPriority(maxPriority) > 1) {
			return false;
		}
		if (maxPriority == BracketTracker.DOT_PRIORITY) {
			return true;
		}

		List<Leaf> leaves = line.getLeaves();
		if (leaves.size() < 2) {
			return false;
		}
		Leaf first = leaves.get(0);
		Leaf second = leaves.get(1);
		if (isOpeningBracket(first) && !isClosingBracket(second) && canOmitOpeningParen(line, first)) {
			return true;
		}

		Leaf penultimate = leaves.get(leaves.size() - 2);
		Leaf last = leaves.get(leaves.size() - 1);
		if (last.getType() == TokenType.RPAR || last.getType() == TokenType.RBRACE) {
			if (isOpeningBracket(penultimate)) {
				return false;
			}
			return canOmitClosingParen(line, last);
		}
		return false;
	}

	/** The content after the matching closing bracket fits in the line. */
	private boolean canOmitOpeningParen(Line line, Leaf first) {
		boolean remainder = false;
		int length = 4 * line.getDepth();
		for (Leaf leaf : line.getLeaves()) {
			if (isClosingBracket(leaf) && leaf.getOpeningBracket() == first) {
				remainder = true;
			}
			if (remainder) {
				length += line.lengthWithComments(leaf);
				if (length > lineLength) {
					return false;
				}
				if (isOpeningBracket(leaf)) {
					remainder = false;
				}
			}
		}
		return true;
	}

	/** The content before the last opening bracket fits in the line. */
	private boolean canOmitClosingParen(Line line, Leaf last) {
		int length = 4 * line.getDepth();
		boolean seenOtherBrackets = false;
		for (Leaf leaf : line.getLeaves()) {
			length += line.lengthWithComments(leaf);
			if (leaf == last.getOpeningBracket()) {
				if (seenOtherBrackets || length <= lineLength) {
					return true;
				}
			} else if (isOpeningBracket(leaf)) {
				seenOtherBrackets = true;
			}
		}
		return false;
	}

	// --- left hand split ---

	/** Splits at the first opening bracket; used for declaration headers. */
	private SplitResult leftHandSplit(Line line) {
		List<Leaf> tail = new ArrayList<>();
		List<Leaf> body = new ArrayList<>();
		List<Leaf> head = new ArrayList<>();
		List<Leaf> current = head;
		Leaf matching = null;
		for (Leaf leaf : line.getLeaves()) {
			if (current == body && matching != null && isClosingBracket(leaf)
					&& leaf.getOpeningBracket() == matching) {
				Parentheses.ensureVisible(leaf);
				Parentheses.ensureVisible(matching);
				current = body.isEmpty() ? head : tail;
			}
			current.add(leaf);
			if (current == head && isOpeningBracket(leaf)) {
				matching = leaf;
				current = body;
			}
		}
		if (matching == null) {
			return SplitResult.cannotSplit("No brackets found");
		}

		Line headLine = bracketSplitBuildLine(head, line, matching, false);
		Line bodyLine = bracketSplitBuildLine(body, line, matching, true);
		Line tailLine = bracketSplitBuildLine(tail, line, matching, false);
		SplitResult check = bracketSplitSucceeded(bodyLine, tailLine);
		if (check != null) {
			return check;
		}
		return SplitResult.of(nonEmpty(headLine, bodyLine, tailLine));
	}

	// --- delimiter split ---

	/** Splits a line inside brackets at each delimiter of the highest priority. */
	private SplitResult delimiterSplit(Line line) {
		List<Leaf> leaves = line.getLeaves();
		if (leaves.isEmpty()) {
			return SplitResult.cannotSplit("Line empty");
		}
		Leaf lastLeaf = leaves.get(leaves.size() - 1);
		BracketTracker tracker = line.getBracketTracker();
		Set<Leaf> exclude = Collections.singleton(lastLeaf);
		if (!tracker.hasDelimitersOutside(exclude)) {
			return SplitResult.cannotSplit("No delimiters found");
		}
		int priority = tracker.maxDelimiterPriority(exclude);
		if (priority == BracketTracker.DOT_PRIORITY && tracker.delimiterCountWithPriority(priority) == 1) {
			return SplitResult.cannotSplit("Splitting a single attribute from its parent looks wrong");
		}

		List<Line> result = new ArrayList<>();
		Line current = new Line(line.getDepth(), line.isInsideBrackets());
		for (Leaf leaf : leaves) {
			current = appendOrStartLine(current, leaf, line, result);
			for (Leaf comment : line.commentsAfter(leaf)) {
				current = appendOrStartLine(current, comment, line, result);
			}
			if (tracker.delimiterPriority(leaf) == priority) {
				result.add(current);
				current = new Line(line.getDepth(), line.isInsideBrackets());
			}
		}
		if (!current.isEmpty()) {
			List<Leaf> currentLeaves = current.getLeaves();
			if (priority == BracketTracker.COMMA_PRIORITY && !currentLeaves.isEmpty()) {
				TokenType lastType = currentLeaves.get(currentLeaves.size() - 1).getType();
				if (lastType != TokenType.COMMA && lastType != TokenType.STANDALONE_COMMENT) {
					current.append(new Leaf(TokenType.COMMA, ","));
				}
			}
			result.add(current);
		}

		for (Line produced : result) {
			if (!produced.getLeaves().isEmpty()) {
				produced.getLeaves().get(0).setPrefix("");
			}
		}
		return SplitResult.of(result);
	}

	private static Line appendOrStartLine(Line current, Leaf leaf, Line original, List<Line> result) {
		if (current.appendSafe(leaf, true)) {
			return current;
		}
		result.add(current);
		Line next = new Line(original.getDepth(), original.isInsideBrackets());
		next.append(leaf);
		return next;
	}

	// --- power operator ---

	/** Removes the spaces around {@code **} unless it is part of an augmented assignment. */
	private SplitResult hugPowerOperator(Line line) {
		List<Leaf> leaves = line.getLeaves();
		boolean hasPowerOperator = false;
		for (Leaf leaf : leaves) {
			if (leaf.getType() == TokenType.DOUBLESTAR) {
				hasPowerOperator = true;
				break;
			}
		}
		if (!hasPowerOperator) {
			return SplitResult.cannotSplit("No doublestar token was found in the line.");
		}

		Line newLine = line.emptyCopy();
		boolean shouldHug = false;
		for (int index = 0; index < leaves.size(); index++) {
			Leaf leaf = leaves.get(index);
			Leaf newLeaf = leaf.copy();
			if (shouldHug) {
				newLeaf.setPrefix("");
			}
			shouldHug = index > 0 && index < leaves.size() - 1 && isHuggablePowerOperator(leaf);
			if (shouldHug) {
				newLeaf.setPrefix("");
			}
			newLine.append(newLeaf, true);
			for (Leaf comment : line.commentsAfter(leaf)) {
				newLine.append(comment, true);
			}
		}
		return SplitResult.of(Collections.singletonList(newLine));
	}

	private static boolean isHuggablePowerOperator(Leaf leaf) {
		if (leaf.getType() != TokenType.DOUBLESTAR) {
			return false;
		}
		Node parent = leaf.getParent();
		return parent != null && parent.getParent() != null
				&& parent.getParent().getType() != NodeType.AUG_ASSIGN;
	}

	// --- shared helpers ---

	/**
	 * Builds one of the head, body or tail lines of a bracket split. The body
	 * is indented one level and may get a trailing comma.
	 */
	private Line bracketSplitBuildLine(List<Leaf> leaves, Line original, Leaf opening, boolean isBody) {
		Line result = new Line(original.getDepth(), false);
		if (isBody) {
			result.setInsideBrackets(true);
			result.setDepth(result.getDepth() + 1);
			if (!leaves.isEmpty()) {
				boolean noCommas = original.isDef() && opening.getValue().equals("(")
						&& leaves.stream().noneMatch(leaf -> leaf.getType() == TokenType.COMMA)
						&& !isInReturnAnnotation(leaves.get(0));
				if (original.isImport() || noCommas) {
					for (int i = leaves.size() - 1; i >= 0; i--) {
						if (leaves.get(i).getType() == TokenType.STANDALONE_COMMENT) {
							continue;
						}
						if (leaves.get(i).getType() != TokenType.COMMA) {
							leaves.add(i + 1, new Leaf(TokenType.COMMA, ","));
						}
						break;
					}
				}
			}
		}
		for (Leaf leaf : leaves) {
			result.append(leaf, true);
			for (Leaf comment : original.commentsAfter(leaf)) {
				result.append(comment, true);
			}
		}
		if (isBody && shouldSplitLine(result, opening)) {
			result.setShouldSplitRhs(true);
		}
		return result;
	}

	private static boolean isInReturnAnnotation(Leaf leaf) {
		Node parent = leaf.getParent();
		Node[] candidates = {parent, parent == null ? null : parent.getParent()};
		for (Node candidate : candidates) {
			if (candidate == null) {
				continue;
			}
			TreeElement prev = candidate.prevSibling();
			if (prev != null && prev.is(TokenType.RETURN_TYPE)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * A body holding a comma separated collection is exploded one element
	 * per line when it ends in a comma or is a literal collection.
	 */
	private static boolean shouldSplitLine(Line line, Leaf opening) {
		if (opening.getParent() == null || !"[{(".contains(opening.getValue())) {
			return false;
		}
		List<Leaf> leaves = line.getLeaves();
		if (leaves.isEmpty()) {
			return false;
		}
		boolean trailingComma = false;
		Set<Leaf> exclude = new HashSet<>();
		Leaf last = leaves.get(leaves.size() - 1);
		if (last.getType() == TokenType.COMMA) {
			trailingComma = true;
			exclude.add(last);
		}
		BracketTracker tracker = line.getBracketTracker();
		if (!tracker.hasDelimitersOutside(exclude)) {
			return false;
		}
		int maxPriority = tracker.maxDelimiterPriority(exclude);
		return maxPriority == BracketTracker.COMMA_PRIORITY
				&& (trailingComma || ATOMS.contains(opening.getParent().getType()));
	}

	/** @return a failure when the split would not improve anything, otherwise {@code null} */
	static SplitResult bracketSplitSucceeded(Line body, Line tail) {
		int tailLength = tail.toString().strip().length();
		if (body.isEmpty()) {
			if (tailLength == 0) {
				return SplitResult.cannotSplit("Splitting brackets produced the same line");
			}
			if (tailLength < 3) {
				return SplitResult.cannotSplit("Splitting brackets on an empty body to save "
						+ tailLength + " characters is not worth it");
			}
		}
		return null;
	}

	private static List<Line> nonEmpty(Line... lines) {
		List<Line> result = new ArrayList<>();
		for (Line line : lines) {
			if (!line.isEmpty()) {
				result.add(line);
			}
		}
		return result;
	}

	/** Copies leaves into {@code newLine}, swapping the copies into the tree. */
	private static void appendLeaves(Line newLine, Line oldLine, List<Leaf> leaves, boolean preformatted) {
		for (Leaf oldLeaf : leaves) {
			Leaf newLeaf = oldLeaf.copyToken();
			Parentheses.replaceChild(oldLeaf, newLeaf);
			newLine.append(newLeaf, preformatted);
			for (Leaf comment : oldLine.commentsAfter(oldLeaf)) {
				newLine.append(comment, true);
			}
		}
	}

	boolean isLineShortEnough(Line line) {
		return isLineShortEnough(line, lineToString(line));
	}

	private boolean isLineShortEnough(Line line, String lineString) {
		return lineString.length() <= lineLength && lineString.indexOf('\n') < 0
				&& !line.containsStandaloneComments();
	}

	private boolean allShortEnough(List<Line> lines) {
		for (Line line : lines) {
			if (!isLineShortEnough(line)) {
				return false;
			}
		}
		return true;
	}

	static String lineToString(Line line) {
		String rendered = line.toString();
		int start = 0;
		int end = rendered.length();
		while (start < end && rendered.charAt(start) == '\n') {
			start++;
		}
		while (end > start && rendered.charAt(end - 1) == '\n') {
			end--;
		}
		return rendered.substring(start, end);
	}

	private static boolean anyVisible(List<Leaf> brackets) {
		for (Leaf bracket : brackets) {
			if (!bracket.getValue().isEmpty()) {
				return true;
			}
		}
		return false;
	}

	private static boolean anyDetached(List<Leaf> leaves) {
		for (Leaf leaf : leaves) {
			if (leaf.getParent() == null) {
				return true;
			}
		}
		return false;
	}

	private static boolean isOpeningBracket(Leaf leaf) {
		return Syntax.OPENING_BRACKETS.contains(leaf.getType());
	}

	private static boolean isClosingBracket(Leaf leaf) {
		return Syntax.CLOSING_BRACKETS.contains(leaf.getType());
	}

	/**
	 * Sets of trailing brackets the right hand split may skip, from none up
	 * to as many trailers as fit in the line. Computed lazily so that each
	 * set sees the brackets made visible by the previous attempt.
	 */
	private final class TrailersToOmit implements Iterator<Set<Leaf>> {
		private final Line line;
		private final List<Leaf> leaves;
		private final Set<Leaf> omit = new HashSet<>();
		private final Set<Leaf> innerBrackets = new HashSet<>();
		private int length;
		private int index;
		private Leaf openingBracket;
		private Leaf closingBracket;
		private boolean started;
		private boolean finished;
		private int resumeAt = -1;
		private Set<Leaf> nextOmit;

		TrailersToOmit(Line line) {
			this.line = line;
			this.leaves = line.getLeaves();
			this.length = 4 * line.getDepth();
			this.index = leaves.size() - 1;
		}

		@Override
		public boolean hasNext() {
			if (nextOmit == null && !finished) {
				nextOmit = advance();
			}
			return nextOmit != null;
		}

		@Override
		public Set<Leaf> next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Set<Leaf> result = nextOmit;
			nextOmit = null;
			return result;
		}

		private Set<Leaf> advance() {
			if (!started) {
				started = true;
				if (line.getMagicTrailingComma() == null) {
					return new HashSet<>(omit);
				}
			}
			if (resumeAt >= 0) {
				int resumed = resumeAt;
				resumeAt = -1;
				if (!takeClosingBracket(resumed)) {
					finished = true;
					return null;
				}
				index = resumed - 1;
			}
			while (index >= 0) {
				int i = index;
				Leaf leaf = leaves.get(i);
				int leafLength = line.lengthWithComments(leaf);
				length += leafLength;
				if (length > lineLength) {
					break;
				}
				boolean hasInlineComment = leafLength > leaf.getValue().length() + leaf.getPrefix().length();
				if (leaf.getType() == TokenType.STANDALONE_COMMENT || hasInlineComment) {
					break;
				}

				Leaf prev = i > 0 ? leaves.get(i - 1) : null;
				if (openingBracket != null) {
					if (leaf == openingBracket) {
						openingBracket = null;
					} else if (isClosingBracket(leaf)) {
						if (prev != null && prev.getType() == TokenType.COMMA && !isOneSequence(leaf)) {
							// magic trailing comma inside a trailer
							break;
						}
						innerBrackets.add(leaf);
					}
				} else if (isClosingBracket(leaf)) {
					if (prev != null && isOpeningBracket(prev)) {
						innerBrackets.add(leaf);
						index--;
						continue;
					}
					if (closingBracket != null) {
						omit.add(closingBracket);
						omit.addAll(innerBrackets);
						innerBrackets.clear();
						resumeAt = i;
						return new HashSet<>(omit);
					}
					if (!takeClosingBracket(i)) {
						break;
					}
				}
				index--;
			}
			finished = true;
			return null;
		}

		/** @return {@code false} when a magic trailing comma stops the search */
		private boolean takeClosingBracket(int i) {
			Leaf leaf = leaves.get(i);
			Leaf prev = i > 0 ? leaves.get(i - 1) : null;
			if (prev != null && prev.getType() == TokenType.COMMA && leaf.getOpeningBracket() != null
					&& !isOneSequence(leaf)) {
				return false;
			}
			if (!leaf.getValue().isEmpty()) {
				openingBracket = leaf.getOpeningBracket();
				closingBracket = leaf;
			}
			return true;
		}

		/** A pair opened on another line never counts as a single element. */
		private boolean isOneSequence(Leaf closing) {
			Leaf opening = closing.getOpeningBracket();
			return opening != null && leaves.contains(opening)
					&& Parentheses.isOneSequenceBetween(opening, closing, leaves);
		}
	}
}
