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

import java.util.EnumSet;
import java.util.Set;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.Syntax;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Computes the whitespace that goes in front of a leaf appended to a
 * non-empty line. The result depends only on the leaf type, its parent's
 * rule and the element that precedes it.
 */
final class Whitespace {

	static final String NO = "";
	static final String SPACE = " ";
	static final String DOUBLESPACE = "  ";

	private static final Set<TokenType> ALWAYS_NO_SPACE = EnumSet.of(
			TokenType.RPAR, TokenType.RSQB, TokenType.RBRACE,
			TokenType.COMMA, TokenType.COLON, TokenType.STANDALONE_COMMENT, TokenType.DOCSTRING);

	/** Rules whose opening parenthesis or square bracket hugs the preceding name. */
	private static final Set<NodeType> CALL_LIKE = EnumSet.of(
			NodeType.FUNCTION_SIG, NodeType.CALL, NodeType.EXTERNAL_CALL, NodeType.SUBSCRIPT,
			NodeType.INDEXED_EVENT_ARG, NodeType.LOG_STMT, NodeType.CONSTANT, NodeType.IMMUTABLE,
			NodeType.IMPLEMENTS_DEF, NodeType.USES_DEF);

	private Whitespace() {
		// utility class
	}

	static String before(Leaf leaf) {
		TokenType type = leaf.getType();
		Node parent = leaf.getParent();

		if (ALWAYS_NO_SPACE.contains(type)) {
			return NO;
		}
		if (type == TokenType.COMMENT) {
			return DOUBLESPACE;
		}
		if (parent == null) {
			return SPACE;
		}
		if (parent.getType() == NodeType.DECORATOR) {
			return NO;
		}

		TreeElement prev = previousCode(leaf.prevSibling());
		if (prev == null) {
			Leaf prevLeaf = precedingCodeLeaf(parent);
			if (prevLeaf == null || Syntax.OPENING_BRACKETS.contains(prevLeaf.getType())) {
				return NO;
			}
			if (prevLeaf.getType() == TokenType.TILDE) {
				return NO;
			}
			Node prevParent = prevLeaf.getParent();
			if (prevLeaf.getType() == TokenType.EQUAL && prevParent != null
					&& prevParent.getType() == NodeType.KWARG) {
				return NO;
			}
			if (prevParent != null && Syntax.UNARY.contains(prevParent.getType())
					&& Syntax.MATH_OPERATORS.contains(prevLeaf.getType())) {
				return NO;
			}
			if (prevParent != null && prevParent.getParent() != null
					&& prevParent.getParent().getType() == NodeType.INITIALIZES_STMT) {
				return NO;
			}
		} else if (parent.getType() == NodeType.KWARG) {
			if (!prev.is(TokenType.COMMA)) {
				return NO;
			}
		} else if (Syntax.isOpeningBracket(prev)) {
			return NO;
		} else if (parent.getType() == NodeType.IMPORT) {
			if ((!prev.is(TokenType.FROM) && type == TokenType.DOT)
					|| (prev.is(TokenType.DOT) && type != TokenType.IMPORT)) {
				return NO;
			}
		} else if (parent.getType() == NodeType.ATTRIBUTE) {
			if (type == TokenType.DOT || prev.is(TokenType.DOT)) {
				return NO;
			}
		} else if (isCallLike(parent.getType())) {
			if (type == TokenType.LPAR && !prev.is(TokenType.RETURN_TYPE)) {
				return NO;
			}
			if (type == TokenType.LSQB) {
				return NO;
			}
		}

		if (Syntax.UNARY.contains(parent.getType()) && prev != null) {
			// signed operand
			return NO;
		}
		return SPACE;
	}

	/** Skips comments the parser put between bracket and content. */
	private static TreeElement previousCode(TreeElement element) {
		TreeElement current = element;
		while (current != null && isComment(current)) {
			current = current.prevSibling();
		}
		return current;
	}

	private static Leaf precedingCodeLeaf(TreeElement element) {
		Leaf leaf = Syntax.precedingLeaf(element);
		while (leaf != null && isComment(leaf)) {
			leaf = Syntax.precedingLeaf(leaf);
		}
		return leaf;
	}

	private static boolean isComment(TreeElement element) {
		return element.is(TokenType.COMMENT) || element.is(TokenType.STANDALONE_COMMENT);
	}

	private static boolean isCallLike(NodeType type) {
		String rule = type.ruleName();
		return rule.endsWith("_def") || rule.endsWith("_with_getter") || CALL_LIKE.contains(type);
	}
}
