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

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.parser.FormatOffRegion;
import com.tomaszrup.vyperfmt.parser.ParseException;
import com.tomaszrup.vyperfmt.parser.ParseResult;
import com.tomaszrup.vyperfmt.parser.TreeComparator;
import com.tomaszrup.vyperfmt.parser.VyperParser;

/**
 * Entry point of the formatter: turns a tree, or source text, into the
 * canonical text.
 *
 * <p>The tree passed to {@link #formatTree(Node, int)} is consumed; leaves
 * are re-typed, re-prefixed and wrapped while lines are produced.</p>
 */
public class VyperFormatter {
	private static final Logger logger = LoggerFactory.getLogger(VyperFormatter.class);

	static final String AST_CHANGED = "Formatting changed the AST, aborting";
	static final String NOT_STABLE = "Formatting is not stable, a second pass changed the output";

	private final VyperParser parser;
	private final TreeComparator comparator;

	public VyperFormatter() {
		this(new VyperParser());
	}

	public VyperFormatter(VyperParser parser) {
		this.parser = parser;
		this.comparator = new TreeComparator(parser);
	}

	/** Formats a parsed module. */
	public static String formatTree(Node root, int maxLineLength) {
		return render(root, maxLineLength, Collections.emptyList(), Collections.emptyList());
	}

	/**
	 * Parses and formats {@code source}. Regions between {@code # fmt: off}
	 * and {@code # fmt: on} are copied verbatim.
	 *
	 * @throws ParseException if the source is not valid Vyper
	 * @throws UnsafeFormattingException in safe mode, if the result is not
	 *         equivalent to the source or not stable
	 */
	public String formatSource(String source, FormatOptions options)
			throws ParseException, UnsafeFormattingException {
		String formatted = format(parser.parse(source), options.getLineLength());
		if (!options.isSafe() || formatted.equals(source)) {
			return formatted;
		}
		try {
			if (!comparator.equivalent(source, formatted)) {
				throw new UnsafeFormattingException(AST_CHANGED);
			}
			String second = format(parser.parse(formatted), options.getLineLength());
			if (!second.equals(formatted)) {
				logger.debug("Second pass differs from the first one");
				throw new UnsafeFormattingException(NOT_STABLE);
			}
		} catch (ParseException e) {
			throw new UnsafeFormattingException(AST_CHANGED, e);
		}
		return formatted;
	}

	private static String format(ParseResult result, int lineLength) {
		return render(result.getRoot(), lineLength, result.getFormatOffRegions(), result.getSourceLines());
	}

	private static String render(Node root, int lineLength, List<FormatOffRegion> regions,
			List<String> sourceLines) {
		Renderer renderer = new Renderer(lineLength, regions, sourceLines);
		new LineGenerator(lineLength, renderer).generate(root);
		return renderer.output.toString();
	}

	/**
	 * Receives logical lines in order, asks the tracker for blank lines and
	 * writes the split result.
	 */
	private static final class Renderer implements Consumer<Line> {
		private final StringBuilder output = new StringBuilder();
		private final EmptyLineTracker emptyLineTracker = new EmptyLineTracker();
		private final LineSplitter splitter;
		private final List<FormatOffRegion> regions;
		private final List<String> sourceLines;
		private FormatOffRegion lastRegion;
		private int after;

		Renderer(int lineLength, List<FormatOffRegion> regions, List<String> sourceLines) {
			this.splitter = new LineSplitter(lineLength);
			this.regions = regions;
			this.sourceLines = sourceLines;
		}

		@Override
		public void accept(Line line) {
			FormatOffRegion region = regionOf(line);
			if (region != null && region == lastRegion) {
				// already copied
				emptyLineTracker.maybeEmptyLines(line);
				return;
			}
			appendNewlines(after);
			EmptyLineTracker.EmptyLines emptyLines = emptyLineTracker.maybeEmptyLines(line);
			appendNewlines(emptyLines.getBefore());
			after = emptyLines.getAfter();
			if (region != null) {
				lastRegion = region;
				copyVerbatim(region);
				return;
			}
			for (Line split : splitter.split(line)) {
				output.append(split);
			}
		}

		private void copyVerbatim(FormatOffRegion region) {
			int end = Math.min(region.getEndLine(), sourceLines.size());
			for (int lineNumber = region.getStartLine(); lineNumber <= end; lineNumber++) {
				output.append(sourceLines.get(lineNumber - 1)).append('\n');
			}
		}

		private FormatOffRegion regionOf(Line line) {
			if (regions.isEmpty()) {
				return null;
			}
			int lineNumber = firstSourceLine(line);
			if (lineNumber <= 0) {
				return null;
			}
			for (FormatOffRegion region : regions) {
				if (region.contains(lineNumber)) {
					return region;
				}
			}
			return null;
		}

		private static int firstSourceLine(Line line) {
			for (Leaf leaf : line.getLeaves()) {
				if (leaf.getLine() > 0) {
					return leaf.getLine();
				}
			}
			return 0;
		}

		private void appendNewlines(int count) {
			for (int i = 0; i < count; i++) {
				output.append('\n');
			}
		}
	}
}
