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
package com.tomaszrup.vyperfmt;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.format.FormatOptions;
import com.tomaszrup.vyperfmt.format.UnsafeFormattingException;
import com.tomaszrup.vyperfmt.format.VyperFormatter;
import com.tomaszrup.vyperfmt.parser.ParseException;
import com.tomaszrup.vyperfmt.util.FileContentsTracker;
import com.tomaszrup.vyperfmt.util.Positions;

/**
 * Handles LSP document and range formatting requests. Documents that do not
 * parse, or whose formatting is rejected, get no edits.
 */
class FormattingHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingHandler.class);

	private final FileContentsTracker fileContentsTracker;
	private final VyperFormatter formatter;
	private final Supplier<FormatOptions> options;

	FormattingHandler(FileContentsTracker fileContentsTracker, VyperFormatter formatter,
			Supplier<FormatOptions> options) {
		this.fileContentsTracker = fileContentsTracker;
		this.formatter = formatter;
		this.options = options;
	}

	/** One edit replacing the whole document, or none when it is already formatted. */
	List<TextEdit> formatDocument(URI uri) {
		String sourceText = fileContentsTracker.getContents(uri);
		String formatted = formatOrNull(uri, sourceText);
		if (formatted == null || formatted.equals(sourceText)) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new TextEdit(
				new Range(new Position(0, 0), Positions.end(sourceText)), formatted));
	}

	/**
	 * Formats the whole document; the edit covers only the lines that
	 * changed. The requested range does not narrow what gets formatted.
	 */
	List<TextEdit> formatRange(URI uri, Range range) {
		String sourceText = fileContentsTracker.getContents(uri);
		String formatted = formatOrNull(uri, sourceText);
		if (formatted == null) {
			return Collections.emptyList();
		}
		logger.debug("Range formatting {} at {}", uri, range);
		return computeMinimalEdits(normalizeLineEndings(sourceText), formatted);
	}

	private String formatOrNull(URI uri, String sourceText) {
		if (sourceText == null || sourceText.isEmpty()) {
			return null;
		}
		try {
			return formatter.formatSource(sourceText, options.get());
		} catch (ParseException e) {
			logger.warn("Not formatting {}: {}", uri, e.getMessage());
		} catch (UnsafeFormattingException e) {
			logger.warn("Not formatting {}: {}", uri, e.getMessage());
		}
		return null;
	}

	static String normalizeLineEndings(String text) {
		return text.replace("\r\n", "\n").replace("\r", "\n");
	}

	/**
	 * A single edit replacing the smallest run of lines that differs between
	 * {@code original} and {@code formatted}; empty when they are equal.
	 */
	static List<TextEdit> computeMinimalEdits(String original, String formatted) {
		String[] origLines = original.split("\\n", -1);
		String[] fmtLines = formatted.split("\\n", -1);
		List<TextEdit> edits = new ArrayList<>();

		int top = 0;
		int minLen = Math.min(origLines.length, fmtLines.length);
		while (top < minLen && origLines[top].equals(fmtLines[top])) {
			top++;
		}
		if (top == origLines.length && top == fmtLines.length) {
			return edits;
		}

		int origBottom = origLines.length - 1;
		int fmtBottom = fmtLines.length - 1;
		while (origBottom >= top && fmtBottom >= top && origLines[origBottom].equals(fmtLines[fmtBottom])) {
			origBottom--;
			fmtBottom--;
		}

		StringBuilder replacement = new StringBuilder();
		for (int j = top; j <= fmtBottom; j++) {
			if (j > top) {
				replacement.append('\n');
			}
			replacement.append(fmtLines[j]);
		}
		edits.add(createEdit(origLines, top, origBottom, fmtBottom, replacement.toString()));
		return edits;
	}

	private static TextEdit createEdit(String[] origLines, int top, int origBottom, int fmtBottom,
			String replacement) {
		if (top > origBottom) {
			// pure insertion
			if (top == 0) {
				return new TextEdit(new Range(new Position(0, 0), new Position(0, 0)), replacement + "\n");
			}
			Position at = new Position(top - 1, origLines[top - 1].length());
			String text = fmtBottom >= top ? "\n" + replacement : replacement;
			return new TextEdit(new Range(at, at), text);
		}
		if (fmtBottom < top) {
			// pure deletion, including the line break before the next kept line
			Position start = top == 0
					? new Position(0, 0)
					: new Position(top - 1, origLines[top - 1].length());
			Position end = top == 0
					? new Position(origBottom + 1, 0)
					: new Position(origBottom, origLines[origBottom].length());
			return new TextEdit(new Range(start, end), "");
		}
		return new TextEdit(new Range(new Position(top, 0),
				new Position(origBottom, origLines[origBottom].length())), replacement);
	}
}
