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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tomaszrup.vyperfmt.cst.Leaf;

/**
 * String literal and comment text normalization.
 */
final class Strings {

	private static final Pattern FIRST_NON_WHITESPACE = Pattern.compile("\\s*\\t+\\s*(\\S)");
	private static final Pattern PRAGMA = Pattern.compile("#\\s*(@version|pragma)\\b.*");
	private static final Pattern HASH_WITHOUT_SPACE = Pattern.compile("^#(\\w)");
	private static final String STRING_PREFIX_CHARS = "bBxXrR";

	private Strings() {
		// utility class
	}

	static boolean hasTripleQuotes(String string) {
		return string.startsWith("\"\"\"") || string.startsWith("'''");
	}

	static boolean isMultilineString(Leaf leaf) {
		String body = stripPrefix(leaf.getValue());
		return hasTripleQuotes(body) && body.contains("\n");
	}

	static boolean isPragma(String comment) {
		return PRAGMA.matcher(comment.trim()).matches();
	}

	static String addLeadingSpaceAfterHash(String comment) {
		return HASH_WITHOUT_SPACE.matcher(comment).replaceFirst("# $1");
	}

	static String stripPrefix(String literal) {
		int i = 0;
		while (i < literal.length() && STRING_PREFIX_CHARS.indexOf(literal.charAt(i)) >= 0) {
			i++;
		}
		return literal.substring(i);
	}

	/**
	 * Prefers double quotes unless that needs more escaping. Triple-quoted
	 * strings only switch from {@code '''} to {@code """}.
	 */
	static String normalizeStringQuotes(String literal) {
		String prefix = literal.substring(0, literal.length() - stripPrefix(literal).length());
		String s = literal.substring(prefix.length());
		String origQuote;
		String newQuote;
		if (s.startsWith("\"\"\"")) {
			return literal;
		} else if (s.startsWith("'''")) {
			origQuote = "'''";
			newQuote = "\"\"\"";
		} else if (s.startsWith("\"")) {
			origQuote = "\"";
			newQuote = "'";
		} else {
			origQuote = "'";
			newQuote = "\"";
		}
		if (s.length() < 2 * origQuote.length()) {
			return literal;
		}

		Pattern unescapedNewQuote = Pattern.compile("(([^\\\\]|^)(\\\\\\\\)*)" + Pattern.quote(newQuote));
		Pattern escapedNewQuote = Pattern.compile("([^\\\\]|^)\\\\((?:\\\\\\\\)*)" + Pattern.quote(newQuote));
		Pattern escapedOrigQuote = Pattern.compile("([^\\\\]|^)\\\\((?:\\\\\\\\)*)" + Pattern.quote(origQuote));
		String body = s.substring(origQuote.length(), s.length() - origQuote.length());

		String newBody = subTwice(escapedNewQuote, "$1$2" + Matcher.quoteReplacement(newQuote), body);
		String original = literal;
		if (!body.equals(newBody)) {
			body = newBody;
			original = prefix + origQuote + body + origQuote;
		}
		newBody = subTwice(escapedOrigQuote, "$1$2" + Matcher.quoteReplacement(origQuote), newBody);
		newBody = subTwice(unescapedNewQuote, "$1" + Matcher.quoteReplacement("\\" + newQuote), newBody);

		if (newQuote.equals("\"\"\"") && newBody.endsWith("\"")) {
			newBody = newBody.substring(0, newBody.length() - 1) + "\\\"";
		}
		int origEscapeCount = count(body, '\\');
		int newEscapeCount = count(newBody, '\\');
		if (newEscapeCount > origEscapeCount) {
			return original;
		}
		if (newEscapeCount == origEscapeCount && origQuote.equals("\"")) {
			return original;
		}
		return prefix + newQuote + newBody + newQuote;
	}

	/**
	 * Re-indents the body of a multi-line docstring: the first line is
	 * stripped, the common indentation of the others is replaced by
	 * {@code indent}, trailing whitespace goes and inner blank lines are
	 * emptied.
	 */
	static String fixDocstring(String docstring, String indent) {
		if (docstring.isEmpty()) {
			return "";
		}
		List<String> lines = linesWithLeadingTabsExpanded(docstring);
		int common = Integer.MAX_VALUE;
		for (int i = 1; i < lines.size(); i++) {
			String line = lines.get(i);
			String stripped = line.stripLeading();
			if (!stripped.isEmpty()) {
				common = Math.min(common, line.length() - stripped.length());
			}
		}
		List<String> trimmed = new ArrayList<>();
		trimmed.add(lines.get(0).strip());
		if (common < Integer.MAX_VALUE) {
			int lastLineIndex = lines.size() - 2;
			for (int i = 0; i < lines.size() - 1; i++) {
				String line = lines.get(i + 1);
				String strippedLine = line.length() > common ? line.substring(common).stripTrailing() : "";
				if (!strippedLine.isEmpty() || i == lastLineIndex) {
					trimmed.add(indent + strippedLine);
				} else {
					trimmed.add("");
				}
			}
		}
		return String.join("\n", trimmed);
	}

	static List<String> splitLines(String text) {
		List<String> lines = new ArrayList<>();
		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lines.add(text.substring(start, i));
				start = i + 1;
			}
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
		}
		return lines;
	}

	private static List<String> linesWithLeadingTabsExpanded(String text) {
		List<String> lines = new ArrayList<>();
		for (String line : splitLines(text)) {
			Matcher matcher = FIRST_NON_WHITESPACE.matcher(line);
			if (matcher.lookingAt()) {
				int firstNonWhitespace = matcher.start(1);
				lines.add(expandTabs(line.substring(0, firstNonWhitespace)) + line.substring(firstNonWhitespace));
			} else {
				lines.add(line);
			}
		}
		return lines;
	}

	private static String expandTabs(String text) {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\t') {
				do {
					builder.append(' ');
				} while (builder.length() % 8 != 0);
			} else {
				builder.append(c);
			}
		}
		return builder.toString();
	}

	private static String subTwice(Pattern pattern, String replacement, String original) {
		return pattern.matcher(pattern.matcher(original).replaceAll(replacement)).replaceAll(replacement);
	}

	private static int count(String text, char c) {
		int count = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == c) {
				count++;
			}
		}
		return count;
	}
}
