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
package com.tomaszrup.vyperfmt.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-based unified diff between the original and the formatted text.
 *
 * <p>Lines common to both ends are trimmed first; the remaining window is
 * aligned on a longest common subsequence found in linear space.</p>
 */
final class UnifiedDiff {

	static final int CONTEXT_LINES = 3;

	private enum Kind {
		KEEP(' '),
		DELETE('-'),
		INSERT('+');

		private final char marker;

		Kind(char marker) {
			this.marker = marker;
		}
	}

	private static final class Edit {
		private final Kind kind;
		/** Index into the original lines; for insertions, the position before which they go. */
		private final int oldIndex;
		/** Index into the new lines; for deletions, the position before which they go. */
		private final int newIndex;

		private Edit(Kind kind, int oldIndex, int newIndex) {
			this.kind = kind;
			this.oldIndex = oldIndex;
			this.newIndex = newIndex;
		}
	}

	private UnifiedDiff() {
		// utility class
	}

	/** @return the diff, or an empty string when the texts are equal */
	static String diff(String original, String formatted, String originalName, String formattedName) {
		if (original.equals(formatted)) {
			return "";
		}
		List<String> oldLines = splitKeepingTerminators(original);
		List<String> newLines = splitKeepingTerminators(formatted);
		List<Edit> edits = computeEdits(oldLines, newLines);

		StringBuilder out = new StringBuilder();
		out.append("--- ").append(originalName).append('\n');
		out.append("+++ ").append(formattedName).append('\n');
		int i = 0;
		while (i < edits.size()) {
			if (edits.get(i).kind == Kind.KEEP) {
				i++;
				continue;
			}
			int start = Math.max(0, i - CONTEXT_LINES);
			int end = hunkEnd(edits, i);
			appendHunk(out, edits.subList(start, end), oldLines, newLines);
			i = end;
		}
		return out.toString();
	}

	/** Extends a hunk over changes separated by at most twice the context. */
	private static int hunkEnd(List<Edit> edits, int firstChange) {
		int lastChange = firstChange;
		int i = firstChange;
		while (i < edits.size()) {
			if (edits.get(i).kind != Kind.KEEP) {
				lastChange = i;
			} else if (i - lastChange > 2 * CONTEXT_LINES) {
				break;
			}
			i++;
		}
		return Math.min(edits.size(), lastChange + CONTEXT_LINES + 1);
	}

	private static void appendHunk(StringBuilder out, List<Edit> hunk, List<String> oldLines,
			List<String> newLines) {
		Edit first = hunk.get(0);
		int oldCount = 0;
		int newCount = 0;
		for (Edit edit : hunk) {
			if (edit.kind != Kind.INSERT) {
				oldCount++;
			}
			if (edit.kind != Kind.DELETE) {
				newCount++;
			}
		}
		out.append("@@ -").append(range(first.oldIndex, oldCount))
				.append(" +").append(range(first.newIndex, newCount)).append(" @@\n");
		for (Edit edit : hunk) {
			String line = edit.kind == Kind.INSERT ? newLines.get(edit.newIndex) : oldLines.get(edit.oldIndex);
			out.append(edit.kind.marker).append(line);
			if (!line.endsWith("\n")) {
				out.append("\n\\ No newline at end of file\n");
			}
		}
	}

	private static String range(int start, int length) {
		int beginning = start + 1;
		if (length == 1) {
			return Integer.toString(beginning);
		}
		if (length == 0) {
			beginning--;
		}
		return beginning + "," + length;
	}

	private static List<Edit> computeEdits(List<String> oldLines, List<String> newLines) {
		int oldLength = oldLines.size();
		int newLength = newLines.size();
		int top = 0;
		while (top < oldLength && top < newLength && oldLines.get(top).equals(newLines.get(top))) {
			top++;
		}
		int oldBottom = oldLength;
		int newBottom = newLength;
		while (oldBottom > top && newBottom > top && oldLines.get(oldBottom - 1).equals(newLines.get(newBottom - 1))) {
			oldBottom--;
			newBottom--;
		}

		List<Edit> edits = new ArrayList<>();
		for (int i = 0; i < top; i++) {
			edits.add(new Edit(Kind.KEEP, i, i));
		}
		alignMiddle(edits, oldLines, newLines, top, oldBottom, top, newBottom);
		for (int i = 0; i < oldLength - oldBottom; i++) {
			edits.add(new Edit(Kind.KEEP, oldBottom + i, newBottom + i));
		}
		return edits;
	}

	/**
	 * Hirschberg's divide and conquer alignment: the old window is halved and
	 * the new window cut where the two halves' common subsequence lengths add
	 * up to the most. Memory stays linear in the width of the new window.
	 */
	private static void alignMiddle(List<Edit> edits, List<String> oldLines, List<String> newLines,
			int oldStart, int oldEnd, int newStart, int newEnd) {
		int rows = oldEnd - oldStart;
		int columns = newEnd - newStart;
		if (rows == 0) {
			for (int j = newStart; j < newEnd; j++) {
				edits.add(new Edit(Kind.INSERT, oldStart, j));
			}
			return;
		}
		if (columns == 0) {
			for (int i = oldStart; i < oldEnd; i++) {
				edits.add(new Edit(Kind.DELETE, i, newStart));
			}
			return;
		}
		if (rows == 1) {
			alignSingleLine(edits, oldLines.get(oldStart), newLines, oldStart, newStart, newEnd);
			return;
		}

		int oldMiddle = oldStart + rows / 2;
		int[] upper = forwardLengths(oldLines, oldStart, oldMiddle, newLines, newStart, newEnd);
		int[] lower = backwardLengths(oldLines, oldMiddle, oldEnd, newLines, newStart, newEnd);
		int cut = 0;
		int best = -1;
		for (int k = 0; k <= columns; k++) {
			int length = upper[k] + lower[columns - k];
			if (length > best) {
				best = length;
				cut = k;
			}
		}
		alignMiddle(edits, oldLines, newLines, oldStart, oldMiddle, newStart, newStart + cut);
		alignMiddle(edits, oldLines, newLines, oldMiddle, oldEnd, newStart + cut, newEnd);
	}

	private static void alignSingleLine(List<Edit> edits, String oldLine, List<String> newLines,
			int oldIndex, int newStart, int newEnd) {
		int match = -1;
		for (int j = newStart; j < newEnd; j++) {
			if (oldLine.equals(newLines.get(j))) {
				match = j;
				break;
			}
		}
		if (match < 0) {
			edits.add(new Edit(Kind.DELETE, oldIndex, newStart));
			for (int j = newStart; j < newEnd; j++) {
				edits.add(new Edit(Kind.INSERT, oldIndex + 1, j));
			}
			return;
		}
		for (int j = newStart; j < match; j++) {
			edits.add(new Edit(Kind.INSERT, oldIndex, j));
		}
		edits.add(new Edit(Kind.KEEP, oldIndex, match));
		for (int j = match + 1; j < newEnd; j++) {
			edits.add(new Edit(Kind.INSERT, oldIndex + 1, j));
		}
	}

	/** @return for each {@code k}, the common subsequence length of the old window and the first {@code k} new lines */
	private static int[] forwardLengths(List<String> oldLines, int oldStart, int oldEnd, List<String> newLines,
			int newStart, int newEnd) {
		int columns = newEnd - newStart;
		int[] previous = new int[columns + 1];
		int[] current = new int[columns + 1];
		for (int i = oldStart; i < oldEnd; i++) {
			current[0] = 0;
			for (int j = 1; j <= columns; j++) {
				if (oldLines.get(i).equals(newLines.get(newStart + j - 1))) {
					current[j] = previous[j - 1] + 1;
				} else {
					current[j] = Math.max(previous[j], current[j - 1]);
				}
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous;
	}

	/** @return for each {@code k}, the common subsequence length of the old window and the last {@code k} new lines */
	private static int[] backwardLengths(List<String> oldLines, int oldStart, int oldEnd, List<String> newLines,
			int newStart, int newEnd) {
		int columns = newEnd - newStart;
		int[] previous = new int[columns + 1];
		int[] current = new int[columns + 1];
		for (int i = oldEnd - 1; i >= oldStart; i--) {
			current[0] = 0;
			for (int j = 1; j <= columns; j++) {
				if (oldLines.get(i).equals(newLines.get(newEnd - j))) {
					current[j] = previous[j - 1] + 1;
				} else {
					current[j] = Math.max(previous[j], current[j - 1]);
				}
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous;
	}

	private static List<String> splitKeepingTerminators(String text) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lines.add(text.substring(start, i + 1));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
		}
		return lines;
	}
}
