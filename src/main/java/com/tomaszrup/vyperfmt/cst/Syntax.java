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
package com.tomaszrup.vyperfmt.cst;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Token and rule groupings shared by the parser and the formatter.
 */
public final class Syntax {

	public static final Set<TokenType> OPENING_BRACKETS = Collections.unmodifiableSet(
			EnumSet.of(TokenType.LPAR, TokenType.LSQB, TokenType.LBRACE));

	public static final Set<TokenType> CLOSING_BRACKETS = Collections.unmodifiableSet(
			EnumSet.of(TokenType.RPAR, TokenType.RSQB, TokenType.RBRACE));

	public static final Set<TokenType> BRACKETS;

	/** Opening bracket type to its closing type. */
	public static final Map<TokenType, TokenType> BRACKET_PAIRS;

	/** Synthesized layout tokens; never rendered. */
	public static final Set<TokenType> WHITESPACE = Collections.unmodifiableSet(
			EnumSet.of(TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT, TokenType.ENDMARKER));

	public static final Set<TokenType> COMPARATORS = Collections.unmodifiableSet(EnumSet.of(
			TokenType.LESS, TokenType.GREATER, TokenType.EQEQUAL,
			TokenType.NOTEQUAL, TokenType.LESSEQUAL, TokenType.GREATEREQUAL));

	public static final Set<TokenType> MATH_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
			TokenType.VBAR, TokenType.CIRCUMFLEX, TokenType.AMPERSAND,
			TokenType.LEFTSHIFT, TokenType.RIGHTSHIFT,
			TokenType.PLUS, TokenType.MINUS,
			TokenType.STAR, TokenType.SLASH, TokenType.DOUBLESLASH, TokenType.PERCENT,
			TokenType.TILDE, TokenType.DOUBLESTAR));

	/** Keywords that open a declaration header line. */
	public static final Set<TokenType> DECLARATIONS = Collections.unmodifiableSet(EnumSet.of(
			TokenType.DEF, TokenType.EVENT, TokenType.STRUCT, TokenType.ENUM, TokenType.INTERFACE));

	/** Statement keywords that carry their own token type. */
	public static final Set<TokenType> STATEMENT_KEYWORDS = Collections.unmodifiableSet(EnumSet.of(
			TokenType.FOR, TokenType.IF, TokenType.ELSE, TokenType.ELIF, TokenType.ASSERT));

	/** Containers whose children are whole statements. */
	public static final Set<NodeType> BODIES = Collections.unmodifiableSet(EnumSet.of(
			NodeType.BODY, NodeType.EVENT_BODY, NodeType.ENUM_BODY, NodeType.MODULE, NodeType.STRUCT_DEF));

	public static final Set<NodeType> ASSERTS = Collections.unmodifiableSet(EnumSet.of(
			NodeType.ASSERT, NodeType.ASSERT_WITH_REASON, NodeType.ASSERT_UNREACHABLE));

	public static final Set<NodeType> ASSIGNMENTS = Collections.unmodifiableSet(EnumSet.of(
			NodeType.DECLARATION, NodeType.CONSTANT_DEF, NodeType.ASSIGN, NodeType.AUG_ASSIGN));

	public static final Set<NodeType> SIMPLE_STATEMENTS;

	public static final Set<NodeType> UNARY = Collections.unmodifiableSet(EnumSet.of(
			NodeType.USUB, NodeType.UADD, NodeType.INVERT));

	public static final Set<String> ASSIGNMENT_SIGNS = Set.of(
			"=", "+=", "-=", "*=", "/=", "//=", "%=", "**=", "&=", "|=", "^=", "<<=", ">>=");

	static {
		EnumSet<TokenType> brackets = EnumSet.copyOf(OPENING_BRACKETS);
		brackets.addAll(CLOSING_BRACKETS);
		BRACKETS = Collections.unmodifiableSet(brackets);

		Map<TokenType, TokenType> pairs = new EnumMap<>(TokenType.class);
		pairs.put(TokenType.LPAR, TokenType.RPAR);
		pairs.put(TokenType.LSQB, TokenType.RSQB);
		pairs.put(TokenType.LBRACE, TokenType.RBRACE);
		BRACKET_PAIRS = Collections.unmodifiableMap(pairs);

		EnumSet<NodeType> simple = EnumSet.of(
				NodeType.VARIABLE_DEF, NodeType.RETURN_STMT, NodeType.PASS_STMT,
				NodeType.BREAK_STMT, NodeType.CONTINUE_STMT, NodeType.RAISE,
				NodeType.RAISE_WITH_REASON, NodeType.LOG_STMT, NodeType.INITIALIZES_STMT,
				NodeType.IMPLEMENTS_DEF, NodeType.USES_DEF, NodeType.EXPORT,
				NodeType.IMMUTABLE_DEF, NodeType.INTERFACE_DEF, NodeType.STRUCT_DEF,
				NodeType.ENUM_DEF, NodeType.EVENT_DEF, NodeType.INDEXED_EVENT_ARG,
				NodeType.EVENT_MEMBER, NodeType.ENUM_MEMBER, NodeType.STRUCT_MEMBER);
		simple.addAll(ASSERTS);
		simple.addAll(ASSIGNMENTS);
		SIMPLE_STATEMENTS = Collections.unmodifiableSet(simple);
	}

	public static boolean isOpeningBracket(TreeElement element) {
		return element instanceof Leaf && OPENING_BRACKETS.contains(((Leaf) element).getType());
	}

	public static boolean isClosingBracket(TreeElement element) {
		return element instanceof Leaf && CLOSING_BRACKETS.contains(((Leaf) element).getType());
	}

	/**
	 * The leaf that precedes {@code element} in source order, or {@code null}
	 * at the start of the tree.
	 */
	public static Leaf precedingLeaf(TreeElement element) {
		TreeElement current = element;
		while (current != null) {
			TreeElement sibling = current.prevSibling();
			while (sibling != null) {
				Leaf last = sibling.lastLeaf();
				if (last != null) {
					return last;
				}
				sibling = sibling.prevSibling();
			}
			current = current.getParent();
		}
		return null;
	}

	private Syntax() {
		// utility class
	}
}
