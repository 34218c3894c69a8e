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

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Decides whether two sources have the same abstract syntax.
 *
 * <p>Both sides are reparsed and reduced to a canonical string in which
 * comments, layout tokens, punctuation and redundant parentheses are gone
 * and string literals are blanked.</p>
 */
public class TreeComparator {
	private static final Logger logger = LoggerFactory.getLogger(TreeComparator.class);

	private static final Set<TokenType> IGNORED = EnumSet.of(
			TokenType.COMMENT, TokenType.STANDALONE_COMMENT, TokenType.PRAGMA,
			TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT, TokenType.ENDMARKER,
			TokenType.LPAR, TokenType.RPAR, TokenType.LSQB, TokenType.RSQB,
			TokenType.LBRACE, TokenType.RBRACE, TokenType.COMMA, TokenType.COLON);

	private final VyperParser parser;

	public TreeComparator(VyperParser parser) {
		this.parser = parser;
	}

	public boolean equivalent(String source, String formatted) throws ParseException {
		String expected = canonical(parser.parse(source).getRoot());
		String actual = canonical(parser.parse(formatted).getRoot());
		boolean same = expected.equals(actual);
		if (!same && logger.isDebugEnabled()) {
			int at = firstDifference(expected, actual);
			logger.debug("Trees differ at offset {}: expected ...{} but was ...{}", at,
					excerpt(expected, at), excerpt(actual, at));
		}
		return same;
	}

	static String canonical(TreeElement root) {
		StringBuilder builder = new StringBuilder();
		append(root, builder);
		return builder.toString();
	}

	private static void append(TreeElement element, StringBuilder builder) {
		if (element instanceof Leaf) {
			Leaf leaf = (Leaf) element;
			if (IGNORED.contains(leaf.getType())) {
				return;
			}
			builder.append(leaf.getType()).append('(');
			if (leaf.getType() != TokenType.STRING && leaf.getType() != TokenType.DOCSTRING) {
				builder.append(leaf.getValue());
			}
			builder.append(')');
			return;
		}
		Node node = (Node) element;
		TreeElement parenthesized = parenthesizedExpression(node);
		if (parenthesized != null) {
			append(parenthesized, builder);
			return;
		}
		builder.append(node.getType().ruleName()).append('[');
		for (TreeElement child : node.getChildren()) {
			append(child, builder);
		}
		builder.append(']');
	}

	/** The expression inside a redundant pair of parentheses, comments aside; otherwise {@code null}. */
	private static TreeElement parenthesizedExpression(Node node) {
		if (node.getType() != NodeType.ATOM) {
			return null;
		}
		List<TreeElement> significant = new ArrayList<>();
		for (TreeElement child : node.getChildren()) {
			if (!child.is(TokenType.COMMENT) && !child.is(TokenType.STANDALONE_COMMENT)) {
				significant.add(child);
			}
		}
		if (significant.size() == 3 && significant.get(0).is(TokenType.LPAR)
				&& significant.get(2).is(TokenType.RPAR)) {
			return significant.get(1);
		}
		return null;
	}

	private static int firstDifference(String left, String right) {
		int limit = Math.min(left.length(), right.length());
		for (int i = 0; i < limit; i++) {
			if (left.charAt(i) != right.charAt(i)) {
				return i;
			}
		}
		return limit;
	}

	private static String excerpt(String text, int at) {
		return text.substring(at, Math.min(text.length(), at + 60));
	}
}
