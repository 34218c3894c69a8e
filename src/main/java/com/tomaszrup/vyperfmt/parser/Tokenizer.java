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
package com.tomaszrup.vyperfmt.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.tomaszrup.vyperfmt.cst.TokenType;

/**
 * Character-level scanner that turns Vyper source into tokens, synthesizing
 * NEWLINE, INDENT and DEDENT the way an off-side rule language needs.
 *
 * <p>Comment handling:</p>
 * <ul>
 *   <li>a comment after code on the same line is a {@code COMMENT};</li>
 *   <li>a comment alone on its line is a {@code STANDALONE_COMMENT};</li>
 *   <li>standalone comments between statements are emitted at the deepest
 *       open block whose indentation does not exceed the comment's column,
 *       interleaved with the DEDENTs of the following code line.</li>
 * </ul>
 */
final class Tokenizer {

	private static final Pattern FMT_OFF = Pattern.compile("#\\s*fmt:\\s*off\\s*");
	private static final Pattern FMT_ON = Pattern.compile("#\\s*fmt:\\s*on\\s*");

	/** Longest first, so that a prefix never shadows a longer operator. */
	private static final String[] OPERATORS = {
			"**=", "//=", "<<=", ">>=", "...",
			"->", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
			"+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
			"(", ")", "[", "]", "{", "}", ",", ".", ":", "@", "=",
			"+", "-", "*", "/", "%", "&", "|", "^", "~", "<", ">"
	};

	private static final Map<String, TokenType> OPERATOR_TYPES = new HashMap<>();
	private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
	private static final Map<String, TokenType> DECLARATION_KEYWORDS = new HashMap<>();

	static {
		OPERATOR_TYPES.put("...", TokenType.ELLIPSIS);
		OPERATOR_TYPES.put("->", TokenType.RETURN_TYPE);
		OPERATOR_TYPES.put("**", TokenType.DOUBLESTAR);
		OPERATOR_TYPES.put("//", TokenType.DOUBLESLASH);
		OPERATOR_TYPES.put("<<", TokenType.LEFTSHIFT);
		OPERATOR_TYPES.put(">>", TokenType.RIGHTSHIFT);
		OPERATOR_TYPES.put("<=", TokenType.LESSEQUAL);
		OPERATOR_TYPES.put(">=", TokenType.GREATEREQUAL);
		OPERATOR_TYPES.put("==", TokenType.EQEQUAL);
		OPERATOR_TYPES.put("!=", TokenType.NOTEQUAL);
		OPERATOR_TYPES.put("(", TokenType.LPAR);
		OPERATOR_TYPES.put(")", TokenType.RPAR);
		OPERATOR_TYPES.put("[", TokenType.LSQB);
		OPERATOR_TYPES.put("]", TokenType.RSQB);
		OPERATOR_TYPES.put("{", TokenType.LBRACE);
		OPERATOR_TYPES.put("}", TokenType.RBRACE);
		OPERATOR_TYPES.put(",", TokenType.COMMA);
		OPERATOR_TYPES.put(".", TokenType.DOT);
		OPERATOR_TYPES.put(":", TokenType.COLON);
		OPERATOR_TYPES.put("@", TokenType.AT);
		OPERATOR_TYPES.put("=", TokenType.EQUAL);
		OPERATOR_TYPES.put("+", TokenType.PLUS);
		OPERATOR_TYPES.put("-", TokenType.MINUS);
		OPERATOR_TYPES.put("*", TokenType.STAR);
		OPERATOR_TYPES.put("/", TokenType.SLASH);
		OPERATOR_TYPES.put("%", TokenType.PERCENT);
		OPERATOR_TYPES.put("&", TokenType.AMPERSAND);
		OPERATOR_TYPES.put("|", TokenType.VBAR);
		OPERATOR_TYPES.put("^", TokenType.CIRCUMFLEX);
		OPERATOR_TYPES.put("~", TokenType.TILDE);
		OPERATOR_TYPES.put("<", TokenType.LESS);
		OPERATOR_TYPES.put(">", TokenType.GREATER);
		for (String augmented : new String[] {
				"**=", "//=", "<<=", ">>=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=" }) {
			OPERATOR_TYPES.put(augmented, TokenType.AUG_ASSIGN);
		}

		KEYWORDS.put("def", TokenType.DEF);
		KEYWORDS.put("import", TokenType.IMPORT);
		KEYWORDS.put("from", TokenType.FROM);
		KEYWORDS.put("for", TokenType.FOR);
		KEYWORDS.put("in", TokenType.IN);
		KEYWORDS.put("if", TokenType.IF);
		KEYWORDS.put("elif", TokenType.ELIF);
		KEYWORDS.put("else", TokenType.ELSE);
		KEYWORDS.put("assert", TokenType.ASSERT);

		DECLARATION_KEYWORDS.put("event", TokenType.EVENT);
		DECLARATION_KEYWORDS.put("struct", TokenType.STRUCT);
		DECLARATION_KEYWORDS.put("enum", TokenType.ENUM);
		DECLARATION_KEYWORDS.put("flag", TokenType.ENUM);
		DECLARATION_KEYWORDS.put("interface", TokenType.INTERFACE);
	}

	/** A comment alone on its line, waiting for the next code line to place it. */
	private static final class PendingComment {
		private final String text;
		private final int indentColumn;
		private final int blankLinesBefore;
		private final int line;

		private PendingComment(String text, int indentColumn, int blankLinesBefore, int line) {
			this.text = text;
			this.indentColumn = indentColumn;
			this.blankLinesBefore = blankLinesBefore;
			this.line = line;
		}
	}

	private final String text;
	private final List<Token> tokens = new ArrayList<>();
	private final Deque<Integer> indents = new ArrayDeque<>();
	private final List<PendingComment> pendingComments = new ArrayList<>();
	private final List<FormatOffRegion> formatOffRegions = new ArrayList<>();

	private int pos;
	private int line = 1;
	private int lineStart;
	private int parenDepth;
	private int blankLines;
	private boolean atLineStart = true;
	private boolean logicalLineStart;
	private boolean physicalLineHasToken;
	private int formatOffStart = -1;

	Tokenizer(String text) {
		this.text = text;
		this.indents.push(0);
	}

	List<FormatOffRegion> getFormatOffRegions() {
		return Collections.unmodifiableList(formatOffRegions);
	}

	List<Token> tokenize() throws ParseException {
		while (pos < text.length()) {
			if (atLineStart && parenDepth == 0) {
				scanLineStart();
				continue;
			}
			char c = text.charAt(pos);
			if (c == ' ' || c == '\t' || c == '\f') {
				pos++;
			} else if (c == '\\' && pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
				pos += 2;
				newLine();
			} else if (c == '\n') {
				scanNewline();
			} else if (c == '#') {
				scanTrailingComment();
			} else if (c == '"' || c == '\'') {
				scanString(pos);
			} else if (Character.isDigit(c) || (c == '.' && isDigitAt(pos + 1))) {
				scanNumber();
			} else if (Character.isLetter(c) || c == '_') {
				scanName();
			} else {
				scanOperator();
			}
		}
		finish();
		return tokens;
	}

	private void finish() throws ParseException {
		if (parenDepth > 0) {
			throw new ParseException("Unexpected end of file inside brackets", line, pos - lineStart);
		}
		if (!atLineStart) {
			addToken(TokenType.NEWLINE, "\n", line, pos - lineStart);
		}
		applyIndentation(0);
		if (formatOffStart > 0) {
			int lastLine = text.endsWith("\n") ? line - 1 : line;
			formatOffRegions.add(new FormatOffRegion(formatOffStart, Math.max(formatOffStart, lastLine)));
			formatOffStart = -1;
		}
		tokens.add(new Token(TokenType.ENDMARKER, "", "", line, 0));
	}

	private void newLine() {
		line++;
		lineStart = pos;
		physicalLineHasToken = false;
	}

	private boolean isDigitAt(int index) {
		return index < text.length() && Character.isDigit(text.charAt(index));
	}

	/**
	 * Handles the start of a physical line outside brackets: blank lines and
	 * comment-only lines are recorded, a code line settles indentation.
	 */
	private void scanLineStart() throws ParseException {
		int column = 0;
		int p = pos;
		while (p < text.length()) {
			char c = text.charAt(p);
			if (c == ' ') {
				column++;
			} else if (c == '\t') {
				column = (column / 8 + 1) * 8;
			} else if (c == '\f') {
				column = 0;
			} else {
				break;
			}
			p++;
		}
		pos = p;
		if (p >= text.length()) {
			return;
		}
		char c = text.charAt(p);
		if (c == '\n') {
			blankLines++;
			pos++;
			newLine();
			return;
		}
		if (c == '#') {
			int end = lineEnd(p);
			String comment = stripTrailing(text.substring(p, end));
			pendingComments.add(new PendingComment(comment, column, blankLines, line));
			blankLines = 0;
			trackFormatOff(comment);
			pos = end;
			if (pos < text.length()) {
				pos++;
				newLine();
			}
			return;
		}
		applyIndentation(column);
		atLineStart = false;
		logicalLineStart = true;
	}

	private void trackFormatOff(String comment) {
		if (formatOffStart < 0 && FMT_OFF.matcher(comment).matches()) {
			formatOffStart = line;
		} else if (formatOffStart > 0 && FMT_ON.matcher(comment).matches()) {
			formatOffRegions.add(new FormatOffRegion(formatOffStart, line));
			formatOffStart = -1;
		}
	}

	private void applyIndentation(int column) throws ParseException {
		if (column > indents.peek()) {
			indents.push(column);
			tokens.add(new Token(TokenType.INDENT, "", "", line, 0));
			for (PendingComment comment : pendingComments) {
				addComment(comment);
			}
			pendingComments.clear();
			return;
		}
		for (PendingComment comment : pendingComments) {
			while (indents.peek() > column && indents.peek() > comment.indentColumn) {
				indents.pop();
				tokens.add(new Token(TokenType.DEDENT, "", "", comment.line, 0));
			}
			addComment(comment);
		}
		pendingComments.clear();
		while (indents.peek() > column) {
			indents.pop();
			tokens.add(new Token(TokenType.DEDENT, "", "", line, 0));
		}
		if (indents.peek() != column) {
			throw new ParseException("Unindent does not match any outer indentation level", line, column);
		}
	}

	private void addComment(PendingComment comment) {
		tokens.add(new Token(TokenType.STANDALONE_COMMENT, comment.text,
				"\n".repeat(comment.blankLinesBefore), comment.line, comment.indentColumn));
	}

	private void scanNewline() {
		if (parenDepth > 0) {
			pos++;
			newLine();
			return;
		}
		addToken(TokenType.NEWLINE, "\n", line, pos - lineStart);
		pos++;
		newLine();
		atLineStart = true;
	}

	private void scanTrailingComment() {
		int end = lineEnd(pos);
		String comment = stripTrailing(text.substring(pos, end));
		TokenType type = parenDepth > 0 && !physicalLineHasToken
				? TokenType.STANDALONE_COMMENT
				: TokenType.COMMENT;
		tokens.add(new Token(type, comment, "", line, pos - lineStart));
		physicalLineHasToken = true;
		pos = end;
	}

	private void scanString(int start) throws ParseException {
		int startLine = line;
		int startColumn = start - lineStart;
		int quotePos = pos;
		char quote = text.charAt(quotePos);
		boolean triple = text.startsWith(String.valueOf(quote).repeat(3), quotePos);
		int p = quotePos + (triple ? 3 : 1);
		while (true) {
			if (p >= text.length()) {
				throw new ParseException("Unterminated string literal", startLine, startColumn);
			}
			char c = text.charAt(p);
			if (c == '\\') {
				if (p + 1 < text.length() && text.charAt(p + 1) == '\n') {
					line++;
					lineStart = p + 2;
				}
				p += 2;
				continue;
			}
			if (c == '\n') {
				if (!triple) {
					throw new ParseException("Unterminated string literal", startLine, startColumn);
				}
				line++;
				lineStart = p + 1;
			}
			if (c == quote) {
				if (!triple) {
					p++;
					break;
				}
				if (text.startsWith(String.valueOf(quote).repeat(3), p)) {
					p += 3;
					break;
				}
			}
			p++;
		}
		pos = p;
		addToken(TokenType.STRING, text.substring(start, p), startLine, startColumn);
	}

	private void scanNumber() {
		int start = pos;
		int p = pos;
		if (text.charAt(p) == '0' && p + 1 < text.length()
				&& "xXoObB".indexOf(text.charAt(p + 1)) >= 0) {
			p += 2;
			while (p < text.length() && (Character.isLetterOrDigit(text.charAt(p)) || text.charAt(p) == '_')) {
				p++;
			}
		} else {
			while (p < text.length() && (Character.isDigit(text.charAt(p)) || text.charAt(p) == '_')) {
				p++;
			}
			if (p < text.length() && text.charAt(p) == '.' && !text.startsWith("...", p)) {
				p++;
				while (p < text.length() && (Character.isDigit(text.charAt(p)) || text.charAt(p) == '_')) {
					p++;
				}
			}
			if (p < text.length() && (text.charAt(p) == 'e' || text.charAt(p) == 'E')) {
				int q = p + 1;
				if (q < text.length() && (text.charAt(q) == '+' || text.charAt(q) == '-')) {
					q++;
				}
				if (isDigitAt(q)) {
					p = q;
					while (isDigitAt(p)) {
						p++;
					}
				}
			}
		}
		pos = p;
		addToken(TokenType.NUMBER, text.substring(start, p), line, start - lineStart);
	}

	private void scanName() throws ParseException {
		int start = pos;
		int p = pos;
		while (p < text.length() && (Character.isLetterOrDigit(text.charAt(p)) || text.charAt(p) == '_')) {
			p++;
		}
		String name = text.substring(start, p);
		if (p < text.length() && (text.charAt(p) == '"' || text.charAt(p) == '\'') && isStringPrefix(name)) {
			pos = p;
			scanString(start);
			return;
		}
		pos = p;
		TokenType type = KEYWORDS.get(name);
		if (type == null && logicalLineStart && DECLARATION_KEYWORDS.containsKey(name) && nameFollows(p)) {
			type = DECLARATION_KEYWORDS.get(name);
		}
		addToken(type != null ? type : TokenType.NAME, name, line, start - lineStart);
	}

	private boolean nameFollows(int index) {
		int p = index;
		while (p < text.length() && (text.charAt(p) == ' ' || text.charAt(p) == '\t')) {
			p++;
		}
		return p > index && p < text.length()
				&& (Character.isLetter(text.charAt(p)) || text.charAt(p) == '_');
	}

	private static boolean isStringPrefix(String name) {
		if (name.length() > 2) {
			return false;
		}
		for (char c : name.toCharArray()) {
			if ("bBxXrR".indexOf(c) < 0) {
				return false;
			}
		}
		return true;
	}

	private void scanOperator() throws ParseException {
		for (String operator : OPERATORS) {
			if (!text.startsWith(operator, pos)) {
				continue;
			}
			TokenType type = OPERATOR_TYPES.get(operator);
			int column = pos - lineStart;
			if (type == TokenType.LPAR || type == TokenType.LSQB || type == TokenType.LBRACE) {
				parenDepth++;
			} else if (type == TokenType.RPAR || type == TokenType.RSQB || type == TokenType.RBRACE) {
				if (parenDepth == 0) {
					throw new ParseException("Unmatched '" + operator + "'", line, column);
				}
				parenDepth--;
			}
			pos += operator.length();
			addToken(type, operator, line, column);
			return;
		}
		throw new ParseException("Unexpected character '" + text.charAt(pos) + "'", line, pos - lineStart);
	}

	private void addToken(TokenType type, String value, int tokenLine, int column) {
		String prefix = "";
		if (logicalLineStart) {
			prefix = "\n".repeat(blankLines);
			blankLines = 0;
			logicalLineStart = false;
		}
		tokens.add(new Token(type, value, prefix, tokenLine, column));
		physicalLineHasToken = true;
	}

	private int lineEnd(int from) {
		int end = text.indexOf('\n', from);
		return end < 0 ? text.length() : end;
	}

	private static String stripTrailing(String value) {
		int end = value.length();
		while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
			end--;
		}
		return value.substring(0, end);
	}
}
