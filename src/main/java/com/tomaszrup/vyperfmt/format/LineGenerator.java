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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.Syntax;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Walks the concrete tree and cuts it into logical {@link Line}s, which are
 * handed to a sink in source order.
 *
 * <p>Statement visitors also normalize optional parentheses: the parts of a
 * statement that may be split get wrapped in invisible parentheses, and
 * redundant visible ones around conditions are made invisible.</p>
 */
public class LineGenerator {

	private static final Set<String> IF_KEYWORDS = Set.of("if", "else", "elif");
	private static final Set<String> IF_PARENS = Set.of("if", "elif");
	private static final Set<String> FOR_KEYWORDS = Set.of("for", "else");
	private static final Set<String> DEF_KEYWORDS = Set.of("def");
	private static final Set<String> ASSERT_PARENS = Set.of("assert", ",");
	private static final Set<String> RETURN_PARENS = Set.of("return");

	private final int lineLength;
	private final Consumer<Line> sink;
	private final Map<NodeType, Consumer<Node>> nodeVisitors = new EnumMap<>(NodeType.class);
	private final Map<TokenType, Consumer<Leaf>> leafVisitors = new EnumMap<>(TokenType.class);
	private Line currentLine = new Line();

	public LineGenerator(int lineLength, Consumer<Line> sink) {
		this.lineLength = lineLength;
		this.sink = sink;

		leafVisitors.put(TokenType.DOCSTRING, this::visitDocstring);
		leafVisitors.put(TokenType.COMMENT, this::visitComment);
		leafVisitors.put(TokenType.STANDALONE_COMMENT, this::visitStandaloneComment);
		leafVisitors.put(TokenType.NEWLINE, leaf -> line(0));
		leafVisitors.put(TokenType.INDENT, this::visitIndent);
		leafVisitors.put(TokenType.DEDENT, this::visitDedent);

		nodeVisitors.put(NodeType.CALL, this::visitCall);
		nodeVisitors.put(NodeType.EXTERNAL_CALL, this::visitCall);
		nodeVisitors.put(NodeType.IMPORT, this::visitImport);
		nodeVisitors.put(NodeType.DECORATORS, this::visitDecorators);
		nodeVisitors.put(NodeType.IF_STMT, node -> visitStatement(node, IF_KEYWORDS, IF_PARENS));
		nodeVisitors.put(NodeType.FOR_STMT, node -> visitStatement(node, FOR_KEYWORDS, Collections.emptySet()));
		nodeVisitors.put(NodeType.FUNCTION_SIG, node -> visitStatement(node, DEF_KEYWORDS, Collections.emptySet()));
		for (NodeType type : Syntax.SIMPLE_STATEMENTS) {
			nodeVisitors.put(type, this::visitSimpleStatement);
		}
	}

	/** Emits every line of the tree rooted at {@code root}, including the last one. */
	public void generate(Node root) {
		visit(root);
		line(0);
	}

	private void visit(TreeElement element) {
		if (element.isLeaf()) {
			Leaf leaf = (Leaf) element;
			leafVisitors.getOrDefault(leaf.getType(), this::visitDefault).accept(leaf);
		} else {
			Node node = (Node) element;
			nodeVisitors.getOrDefault(node.getType(), this::visitDefault).accept(node);
		}
	}

	private void visitDefault(Leaf leaf) {
		boolean anyOpenBrackets = currentLine.getBracketTracker().anyOpenBrackets();
		if (leaf.getType() == TokenType.STRING) {
			leaf.setValue(Strings.normalizeStringQuotes(leaf.getValue()));
		}
		if (!Syntax.WHITESPACE.contains(leaf.getType())) {
			currentLine.append(leaf);
		}
		if (leaf.getType() == TokenType.STANDALONE_COMMENT && !anyOpenBrackets) {
			line(0);
		}
	}

	private void visitDefault(Node node) {
		// children may be re-wrapped while they are visited
		for (TreeElement child : new ArrayList<>(node.getChildren())) {
			visit(child);
		}
	}

	/**
	 * Finishes the current line and starts a new one whose depth is shifted
	 * by {@code indent}. Nothing is emitted for an empty line.
	 */
	private void line(int indent) {
		if (currentLine.isEmpty()) {
			currentLine.setDepth(currentLine.getDepth() + indent);
			return;
		}
		Line complete = currentLine;
		currentLine = new Line(complete.getDepth() + indent, false);
		sink.accept(complete);
	}

	private void visitIndent(Leaf leaf) {
		line(1);
	}

	private void visitDedent(Leaf leaf) {
		line(0);
		line(-1);
	}

	private void visitComment(Leaf leaf) {
		boolean anyOpenBrackets = currentLine.getBracketTracker().anyOpenBrackets();
		leaf.setValue(Strings.addLeadingSpaceAfterHash(leaf.getValue()));
		currentLine.append(leaf);
		if (!anyOpenBrackets) {
			line(0);
		}
	}

	private void visitStandaloneComment(Leaf leaf) {
		boolean anyOpenBrackets = currentLine.getBracketTracker().anyOpenBrackets();
		leaf.setValue(Strings.addLeadingSpaceAfterHash(leaf.getValue()));
		if (anyOpenBrackets) {
			visitDefault(leaf);
			return;
		}
		line(0);
		if (currentLine.getDepth() == 0 && Strings.isPragma(leaf.getValue())) {
			leaf.setType(TokenType.PRAGMA);
			currentLine.append(leaf);
			line(0);
			return;
		}
		visitDefault(leaf);
	}

	private void visitDocstring(Leaf leaf) {
		String docstring = Strings.normalizeStringQuotes(leaf.getValue());
		Node parent = leaf.getParent();
		if (parent != null && parent.getType() != NodeType.MODULE && isQuote(docstring)) {
			docstring = formatDocstring(leaf, docstring);
		}
		leaf.setValue(docstring);
		visitDefault(leaf);
	}

	private String formatDocstring(Leaf leaf, String docstring) {
		String indent = "    ".repeat(currentLine.getDepth());
		char quoteChar = docstring.charAt(0);
		int quoteLength = Strings.hasTripleQuotes(docstring) ? 3 : 1;
		String quote = docstring.substring(0, quoteLength);
		String body = docstring.substring(quoteLength, docstring.length() - quoteLength);
		boolean hadText = !body.isEmpty();

		if (Strings.isMultilineString(leaf)) {
			body = Strings.fixDocstring(body, indent);
		} else {
			body = body.strip();
		}
		if (!body.isEmpty()) {
			if (body.charAt(0) == quoteChar) {
				body = " " + body;
			}
			if (body.charAt(body.length() - 1) == quoteChar) {
				body = body + " ";
			}
			if (body.charAt(body.length() - 1) == '\\' && trailingBackslashes(body) % 2 == 1) {
				body = body + " ";
			}
		} else if (hadText) {
			body = " ";
		}

		if (quoteLength == 3) {
			List<String> lines = Strings.splitLines(body);
			int lastLineLength = lines.isEmpty() ? 0 : lines.get(lines.size() - 1).length();
			if (lines.size() == 1) {
				lastLineLength += indent.length() + quoteLength;
			}
			if (lastLineLength + quoteLength > lineLength) {
				return quote + body + "\n" + indent + quote;
			}
		}
		return quote + body + quote;
	}

	private void visitCall(Node node) {
		Node parent = node.getParent();
		if (parent == null || parent.getType() == NodeType.BODY) {
			if (parent != null && node.prevSibling() == null) {
				// inline body: `if x: foo()`
				line(1);
				visitDefault(node);
				line(-1);
				return;
			}
			line(0);
		}
		visitDefault(node);
	}

	private void visitImport(Node node) {
		for (TreeElement child : new ArrayList<>(node.getChildren())) {
			if ((child.is(TokenType.IMPORT) || child.is(TokenType.FROM)) && child.prevSibling() == null) {
				line(0);
			}
			visit(child);
		}
	}

	private void visitDecorators(Node node) {
		for (TreeElement child : new ArrayList<>(node.getChildren())) {
			line(0);
			visit(child);
		}
	}

	/** Compound statement: a new line starts before each of {@code keywords}. */
	private void visitStatement(Node node, Set<String> keywords, Set<String> parens) {
		normalizeInvisibleParens(node, parens);
		for (TreeElement child : new ArrayList<>(node.getChildren())) {
			if (child.isLeaf() && isKeyword((Leaf) child) && keywords.contains(((Leaf) child).getValue())) {
				line(0);
			}
			visit(child);
		}
	}

	private void visitSimpleStatement(Node node) {
		if (Syntax.ASSIGNMENTS.contains(node.getType())) {
			normalizeInvisibleParens(node, Syntax.ASSIGNMENT_SIGNS);
		} else if (Syntax.ASSERTS.contains(node.getType())) {
			normalizeInvisibleParens(node, ASSERT_PARENS);
		} else if (node.getType() == NodeType.RETURN_STMT) {
			normalizeInvisibleParens(node, RETURN_PARENS);
		}

		Node parent = node.getParent();
		boolean bodyLike = parent != null && (!Syntax.BODIES.contains(parent.getType())
				|| (parent.getType() == NodeType.BODY && node.prevSibling() == null));
		if (bodyLike) {
			line(1);
			visitDefault(node);
			line(-1);
		} else {
			line(0);
			visitDefault(node);
		}
	}

	/**
	 * Wraps the children that follow a leaf whose value is in
	 * {@code parensAfter} in invisible parentheses. A visible pair around a
	 * condition becomes invisible instead.
	 */
	static void normalizeInvisibleParens(Node node, Set<String> parensAfter) {
		boolean checkLpar = false;
		List<TreeElement> children = new ArrayList<>(node.getChildren());
		for (int index = 0; index < children.size(); index++) {
			TreeElement child = children.get(index);
			if (index == 0 && child.is(NodeType.MULTIPLE_ASSIGN)) {
				checkLpar = true;
			}
			if (checkLpar) {
				if (child.is(NodeType.COND_EXEC)) {
					Node condition = (Node) child;
					TreeElement first = condition.getChild(0);
					if (!first.isLeaf() && Parentheses.maybeMakeInvisibleInAtom(first)) {
						Parentheses.wrap(condition, first, false);
					}
				} else if (!child.isLeaf()) {
					Parentheses.wrap(node, child, false);
				}
			}
			checkLpar = child.isLeaf() && parensAfter.contains(((Leaf) child).getValue());
		}
	}

	private static boolean isKeyword(Leaf leaf) {
		TokenType type = leaf.getType();
		return type == TokenType.NAME || Syntax.DECLARATIONS.contains(type)
				|| Syntax.STATEMENT_KEYWORDS.contains(type);
	}

	private static boolean isQuote(String docstring) {
		return !docstring.isEmpty() && (docstring.charAt(0) == '"' || docstring.charAt(0) == '\'');
	}

	private static int trailingBackslashes(String text) {
		int count = 0;
		for (int i = text.length() - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
			count++;
		}
		return count;
	}
}
