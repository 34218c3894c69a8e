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
import java.util.Deque;

import com.tomaszrup.vyperfmt.cst.Leaf;

/**
 * Decides how many blank lines go before and after each logical line.
 * Works on lines before they are split, and must see every line in order.
 */
public class EmptyLineTracker {

	static final int MAX_BLANK_LINES = 2;

	/** Blank lines to emit before and after a line. */
	public static final class EmptyLines {
		private final int before;
		private final int after;

		EmptyLines(int before, int after) {
			this.before = before;
			this.after = after;
		}

		public int getBefore() {
			return before;
		}

		public int getAfter() {
			return after;
		}

		@Override
		public String toString() {
			return "(" + before + ", " + after + ")";
		}
	}

	private Line previousLine;
	private int previousAfter;
	/** Depths of the declarations that are still open. */
	private final Deque<Integer> previousDefs = new ArrayDeque<>();

	/**
	 * Consumes the blank-line count carried by the first leaf's prefix and
	 * returns the blank lines for {@code currentLine}. The before count is
	 * net of what the previous line already requested after itself.
	 */
	public EmptyLines maybeEmptyLines(Line currentLine) {
		EmptyLines computed = computeEmptyLines(currentLine);
		int before = previousLine == null ? 0 : Math.max(0, computed.before - previousAfter);
		previousAfter = computed.after;
		previousLine = currentLine;
		return new EmptyLines(before, computed.after);
	}

	private EmptyLines computeEmptyLines(Line currentLine) {
		int before = 0;
		if (!currentLine.getLeaves().isEmpty()) {
			Leaf first = currentLine.getLeaves().get(0);
			before = Math.min(countNewlines(first.getPrefix()), MAX_BLANK_LINES);
			first.setPrefix("");
		}
		int depth = currentLine.getDepth();
		while (!previousDefs.isEmpty() && previousDefs.peek() >= depth) {
			previousDefs.pop();
			before = (depth > 0 ? 1 : 2) - previousAfter;
		}

		if (currentLine.isDecorator() || currentLine.isDef()) {
			return emptyLinesForDeclaration(currentLine, before);
		}
		if (currentLine.isFlowControl()) {
			return new EmptyLines(before, 1);
		}
		if (currentLine.isPragma()) {
			return new EmptyLines(0, 1);
		}
		if (previousLine != null && previousLine.isImport() && !currentLine.isImport()
				&& depth == previousLine.getDepth()) {
			return new EmptyLines(before > 0 ? before : 1, 0);
		}
		return new EmptyLines(before, 0);
	}

	private EmptyLines emptyLinesForDeclaration(Line currentLine, int before) {
		if (!currentLine.isDecorator()) {
			previousDefs.push(currentLine.getDepth());
		}
		if (previousLine == null) {
			return new EmptyLines(0, 0);
		}
		if (previousLine.isDecorator()) {
			return new EmptyLines(0, 0);
		}
		if (previousLine.getDepth() < currentLine.getDepth() && previousLine.isDef()) {
			return new EmptyLines(0, 0);
		}
		if (previousLine.isComment() && previousLine.getDepth() == currentLine.getDepth() && before == 0) {
			// a comment directly above documents the declaration
			return new EmptyLines(0, 0);
		}
		return new EmptyLines(currentLine.getDepth() > 0 ? 1 : 2, 0);
	}

	private static int countNewlines(String prefix) {
		int count = 0;
		for (int i = 0; i < prefix.length(); i++) {
			if (prefix.charAt(i) == '\n') {
				count++;
			}
		}
		return count;
	}
}
