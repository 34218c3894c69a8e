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
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.Node;
import com.tomaszrup.vyperfmt.cst.NodeType;
import com.tomaszrup.vyperfmt.cst.TokenType;
import com.tomaszrup.vyperfmt.cst.TreeElement;

/**
 * Recursive-descent construction of the concrete tree for one token list.
 *
 * <p>Standalone comments between statements become children of the
 * enclosing block. Any other comment is recorded against the next leaf
 * consumed and inserted right before it once the tree is complete, so a
 * trailing comment ends up just before the NEWLINE that closes its line.</p>
 */
final class TreeBuilder {

	@FunctionalInterface
	private interface OperandParser {
		TreeElement parse() throws ParseException;
	}

	private static final Map<TokenType, NodeType> COMPARISONS = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> BITOR = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> BITXOR = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> BITAND = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> SHIFTS = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> SUMS = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> PRODUCTS = new EnumMap<>(TokenType.class);
	private static final Map<TokenType, NodeType> UNARY = new EnumMap<>(TokenType.class);

	static {
		COMPARISONS.put(TokenType.EQEQUAL, NodeType.EQ);
		COMPARISONS.put(TokenType.NOTEQUAL, NodeType.NE);
		COMPARISONS.put(TokenType.LESS, NodeType.LT);
		COMPARISONS.put(TokenType.LESSEQUAL, NodeType.LE);
		COMPARISONS.put(TokenType.GREATER, NodeType.GT);
		COMPARISONS.put(TokenType.GREATEREQUAL, NodeType.GE);
		COMPARISONS.put(TokenType.IN, NodeType.IN);
		BITOR.put(TokenType.VBAR, NodeType.BITOR);
		BITXOR.put(TokenType.CIRCUMFLEX, NodeType.BITXOR);
		BITAND.put(TokenType.AMPERSAND, NodeType.BITAND);
		SHIFTS.put(TokenType.LEFTSHIFT, NodeType.SHL);
		SHIFTS.put(TokenType.RIGHTSHIFT, NodeType.SHR);
		SUMS.put(TokenType.PLUS, NodeType.ADD);
		SUMS.put(TokenType.MINUS, NodeType.SUB);
		PRODUCTS.put(TokenType.STAR, NodeType.MUL);
		PRODUCTS.put(TokenType.SLASH, NodeType.DIV);
		PRODUCTS.put(TokenType.DOUBLESLASH, NodeType.FLOORDIV);
		PRODUCTS.put(TokenType.PERCENT, NodeType.MOD);
		UNARY.put(TokenType.PLUS, NodeType.UADD);
		UNARY.put(TokenType.MINUS, NodeType.USUB);
		UNARY.put(TokenType.TILDE, NodeType.INVERT);
	}

	private final List<Token> tokens;
	private int pos;
	private final Map<Leaf, List<Leaf>> leadingComments = new IdentityHashMap<>();

	TreeBuilder(List<Token> tokens) {
		this.tokens = tokens;
	}

	Node parseModule() throws ParseException {
		Node module = new Node(NodeType.MODULE);
		boolean first = true;
		while (true) {
			drainComments(module);
			Token token = tokens.get(pos);
			if (token.type == TokenType.ENDMARKER) {
				break;
			}
			if (first && isDocstringAhead()) {
				parseDocstring(module);
			} else {
				parseModuleItem(module);
			}
			first = false;
		}
		attachComments();
		return module;
	}

	// --- Token cursor ---

	private Token peek() {
		return peek(0);
	}

	/** The {@code ahead}-th significant token, skipping comments. */
	private Token peek(int ahead) {
		int remaining = ahead;
		for (int i = pos; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (token.isComment()) {
				continue;
			}
			if (remaining == 0) {
				return token;
			}
			remaining--;
		}
		return tokens.get(tokens.size() - 1);
	}

	private boolean at(TokenType type) {
		return peek().type == type;
	}

	private boolean atName(String name) {
		return peek().isName(name);
	}

	private Leaf next() {
		List<Leaf> comments = null;
		while (tokens.get(pos).isComment()) {
			if (comments == null) {
				comments = new ArrayList<>();
			}
			comments.add(tokens.get(pos++).toLeaf());
		}
		Leaf leaf = tokens.get(pos).toLeaf();
		if (pos < tokens.size() - 1) {
			pos++;
		}
		if (comments != null) {
			leadingComments.put(leaf, comments);
		}
		return leaf;
	}

	private Leaf expect(TokenType type) throws ParseException {
		Token token = peek();
		if (token.type != type) {
			throw unexpected(token, type.name());
		}
		return next();
	}

	/** A name, accepting keywords used as attribute or member names. */
	private Leaf expectIdentifier() throws ParseException {
		Token token = peek();
		if (token.value.isEmpty() || !Character.isJavaIdentifierStart(token.value.charAt(0))
				|| token.type == TokenType.STRING) {
			throw unexpected(token, "identifier");
		}
		Leaf leaf = next();
		leaf.setType(TokenType.NAME);
		return leaf;
	}

	private void drainComments(Node container) {
		while (tokens.get(pos).isComment()) {
			container.appendChild(tokens.get(pos++).toLeaf());
		}
	}

	private static ParseException unexpected(Token token, String expected) {
		String found = token.type == TokenType.NEWLINE ? "end of line"
				: token.type == TokenType.ENDMARKER ? "end of file"
				: token.type == TokenType.INDENT ? "indent"
				: token.type == TokenType.DEDENT ? "dedent"
				: "'" + token.value + "'";
		return new ParseException("Expected " + expected + " but found " + found, token.line, token.column + 1);
	}

	private void attachComments() {
		for (Map.Entry<Leaf, List<Leaf>> entry : leadingComments.entrySet()) {
			Leaf anchor = entry.getKey();
			Node parent = anchor.getParent();
			if (parent == null) {
				throw new IllegalStateException("Comment anchor " + anchor.getValue() + " is not part of the tree");
			}
			int index = parent.indexOf(anchor);
			for (Leaf comment : entry.getValue()) {
				parent.insertChild(index++, comment);
			}
		}
	}

	private static Node node(NodeType type, TreeElement... children) {
		Node node = new Node(type);
		for (TreeElement child : children) {
			node.appendChild(child);
		}
		return node;
	}

	// --- Module level ---

	private boolean isDocstringAhead() {
		return peek().type == TokenType.STRING && peek(1).type == TokenType.NEWLINE;
	}

	private void parseDocstring(Node container) throws ParseException {
		Leaf docstring = next();
		docstring.setType(TokenType.DOCSTRING);
		container.appendChild(docstring);
		container.appendChild(expect(TokenType.NEWLINE));
	}

	private void parseModuleItem(Node module) throws ParseException {
		Token token = peek();
		switch (token.type) {
			case IMPORT:
			case FROM:
				module.appendChild(parseImport());
				module.appendChild(expect(TokenType.NEWLINE));
				return;
			case EVENT:
				module.appendChild(parseEventDef());
				return;
			case STRUCT:
				module.appendChild(parseStructDef());
				return;
			case ENUM:
				module.appendChild(parseEnumDef());
				return;
			case INTERFACE:
				module.appendChild(parseInterfaceDef());
				return;
			case NAME:
				if (peek(1).type == TokenType.COLON) {
					module.appendChild(parseModuleDeclaration());
					module.appendChild(expect(TokenType.NEWLINE));
					return;
				}
				break;
			default:
				break;
		}
		parseStatement(module);
	}

	private TreeElement parseModuleDeclaration() throws ParseException {
		switch (peek().value) {
			case "implements":
				return node(NodeType.IMPLEMENTS_DEF, next(), expect(TokenType.COLON), parseType());
			case "uses":
				return node(NodeType.USES_DEF, next(), expect(TokenType.COLON), parseType());
			case "initializes":
				return node(NodeType.INITIALIZES_STMT, next(), expect(TokenType.COLON), parseType());
			case "exports":
				return node(NodeType.EXPORT, next(), expect(TokenType.COLON), parseType());
			default:
				return parseVariableDeclaration();
		}
	}

	private TreeElement parseVariableDeclaration() throws ParseException {
		Leaf name = next();
		Leaf colon = expect(TokenType.COLON);
		if (atWrapper("constant")) {
			Node constant = node(NodeType.CONSTANT_PRIVATE, name, colon, parseWrapped(NodeType.CONSTANT));
			return node(NodeType.CONSTANT_DEF, constant, expect(TokenType.EQUAL), parseExpressionList());
		}
		if (atWrapper("immutable")) {
			return node(NodeType.IMMUTABLE_DEF, name, colon, parseWrapped(NodeType.IMMUTABLE));
		}
		if (atWrapper("public")) {
			Leaf getter = next();
			Leaf lpar = expect(TokenType.LPAR);
			if (atWrapper("constant")) {
				Node inner = parseWrapped(NodeType.CONSTANT);
				Node constant = node(NodeType.CONSTANT_WITH_GETTER, name, colon, getter, lpar, inner,
						expect(TokenType.RPAR));
				return node(NodeType.CONSTANT_DEF, constant, expect(TokenType.EQUAL), parseExpressionList());
			}
			if (atWrapper("immutable")) {
				Node inner = parseWrapped(NodeType.IMMUTABLE);
				return node(NodeType.IMMUTABLE_DEF, name, colon, getter, lpar, inner, expect(TokenType.RPAR));
			}
			TreeElement type = parseType();
			return node(NodeType.VARIABLE_DEF,
					node(NodeType.VARIABLE_WITH_GETTER, name, colon, getter, lpar, type, expect(TokenType.RPAR)));
		}
		Node variable = node(NodeType.VARIABLE, name, colon, parseType());
		if (at(TokenType.EQUAL)) {
			return node(NodeType.DECLARATION, variable, next(), parseExpressionList());
		}
		return node(NodeType.VARIABLE_DEF, variable);
	}

	private boolean atWrapper(String name) {
		return atName(name) && peek(1).type == TokenType.LPAR;
	}

	private Node parseWrapped(NodeType type) throws ParseException {
		return node(type, next(), expect(TokenType.LPAR), parseType(), expect(TokenType.RPAR));
	}

	private Node parseImport() throws ParseException {
		Node importNode = new Node(NodeType.IMPORT);
		if (at(TokenType.IMPORT)) {
			importNode.appendChild(next());
			parseDottedName(importNode);
			if (atName("as")) {
				importNode.appendChild(next());
				importNode.appendChild(expectIdentifier());
			}
			return importNode;
		}
		importNode.appendChild(expect(TokenType.FROM));
		boolean relative = false;
		while (at(TokenType.DOT)) {
			importNode.appendChild(next());
			relative = true;
		}
		if (!relative || !at(TokenType.IMPORT)) {
			parseDottedName(importNode);
		}
		importNode.appendChild(expect(TokenType.IMPORT));
		if (at(TokenType.STAR)) {
			importNode.appendChild(next());
		} else if (at(TokenType.LPAR)) {
			importNode.appendChild(next());
			parseImportNames(importNode);
			importNode.appendChild(expect(TokenType.RPAR));
		} else {
			parseImportNames(importNode);
		}
		return importNode;
	}

	private void parseDottedName(Node into) throws ParseException {
		into.appendChild(expectIdentifier());
		while (at(TokenType.DOT)) {
			into.appendChild(next());
			into.appendChild(expectIdentifier());
		}
	}

	private void parseImportNames(Node into) throws ParseException {
		while (true) {
			into.appendChild(expectIdentifier());
			if (atName("as")) {
				into.appendChild(next());
				into.appendChild(expectIdentifier());
			}
			if (!at(TokenType.COMMA)) {
				return;
			}
			into.appendChild(next());
			if (peek().type != TokenType.NAME) {
				return;
			}
		}
	}

	private Node parseEventDef() throws ParseException {
		Node event = node(NodeType.EVENT_DEF, next(), expectIdentifier(), expect(TokenType.COLON));
		if (atName("pass")) {
			event.appendChild(next());
			event.appendChild(expect(TokenType.NEWLINE));
			return event;
		}
		Node body = node(NodeType.EVENT_BODY, expect(TokenType.NEWLINE), expect(TokenType.INDENT));
		while (true) {
			drainComments(body);
			if (tokens.get(pos).type == TokenType.DEDENT) {
				body.appendChild(next());
				break;
			}
			if (atName("pass")) {
				body.appendChild(node(NodeType.PASS_STMT, next()));
			} else {
				Leaf name = expectIdentifier();
				Leaf colon = expect(TokenType.COLON);
				if (atWrapper("indexed")) {
					body.appendChild(node(NodeType.INDEXED_EVENT_ARG, name, colon, next(),
							expect(TokenType.LPAR), parseType(), expect(TokenType.RPAR)));
				} else {
					body.appendChild(node(NodeType.EVENT_MEMBER, name, colon, parseType()));
				}
			}
			body.appendChild(expect(TokenType.NEWLINE));
		}
		event.appendChild(body);
		return event;
	}

	private Node parseStructDef() throws ParseException {
		Node struct = node(NodeType.STRUCT_DEF, next(), expectIdentifier(), expect(TokenType.COLON),
				expect(TokenType.NEWLINE), expect(TokenType.INDENT));
		while (true) {
			drainComments(struct);
			if (tokens.get(pos).type == TokenType.DEDENT) {
				struct.appendChild(next());
				return struct;
			}
			struct.appendChild(node(NodeType.STRUCT_MEMBER, expectIdentifier(), expect(TokenType.COLON), parseType()));
			struct.appendChild(expect(TokenType.NEWLINE));
		}
	}

	private Node parseEnumDef() throws ParseException {
		Node enumDef = node(NodeType.ENUM_DEF, next(), expectIdentifier(), expect(TokenType.COLON));
		Node body = node(NodeType.ENUM_BODY, expect(TokenType.NEWLINE), expect(TokenType.INDENT));
		while (true) {
			drainComments(body);
			if (tokens.get(pos).type == TokenType.DEDENT) {
				body.appendChild(next());
				break;
			}
			body.appendChild(node(NodeType.ENUM_MEMBER, expectIdentifier()));
			body.appendChild(expect(TokenType.NEWLINE));
		}
		enumDef.appendChild(body);
		return enumDef;
	}

	private Node parseInterfaceDef() throws ParseException {
		Node iface = node(NodeType.INTERFACE_DEF, next(), expectIdentifier(), expect(TokenType.COLON),
				expect(TokenType.NEWLINE), expect(TokenType.INDENT));
		while (true) {
			drainComments(iface);
			if (tokens.get(pos).type == TokenType.DEDENT) {
				iface.appendChild(next());
				return iface;
			}
			iface.appendChild(node(NodeType.INTERFACE_FUNCTION, parseFunctionSig(), expect(TokenType.COLON),
					expectIdentifier()));
			iface.appendChild(expect(TokenType.NEWLINE));
		}
	}

	// --- Functions ---

	private Node parseFunctionDef() throws ParseException {
		Node function = new Node(NodeType.FUNCTION_DEF);
		if (at(TokenType.AT)) {
			Node decorators = new Node(NodeType.DECORATORS);
			while (at(TokenType.AT)) {
				decorators.appendChild(parseDecorator());
			}
			function.appendChild(decorators);
		}
		function.appendChild(parseFunctionSig());
		function.appendChild(expect(TokenType.COLON));
		function.appendChild(parseBody());
		return function;
	}

	private Node parseDecorator() throws ParseException {
		Node decorator = node(NodeType.DECORATOR, next(), expectIdentifier());
		if (at(TokenType.LPAR)) {
			decorator.appendChild(next());
			if (!at(TokenType.RPAR)) {
				decorator.appendChild(parseArguments());
			}
			decorator.appendChild(expect(TokenType.RPAR));
		}
		decorator.appendChild(expect(TokenType.NEWLINE));
		return decorator;
	}

	private Node parseFunctionSig() throws ParseException {
		Node sig = node(NodeType.FUNCTION_SIG, expect(TokenType.DEF), expectIdentifier(), expect(TokenType.LPAR));
		if (!at(TokenType.RPAR)) {
			Node parameters = new Node(NodeType.PARAMETERS);
			while (!at(TokenType.RPAR)) {
				Node parameter = node(NodeType.PARAMETER, expectIdentifier(), expect(TokenType.COLON), parseType());
				if (at(TokenType.EQUAL)) {
					parameter.appendChild(next());
					parameter.appendChild(parseExpression());
				}
				parameters.appendChild(parameter);
				if (!at(TokenType.COMMA)) {
					break;
				}
				parameters.appendChild(next());
			}
			sig.appendChild(parameters);
		}
		sig.appendChild(expect(TokenType.RPAR));
		if (at(TokenType.RETURN_TYPE)) {
			sig.appendChild(node(NodeType.RETURNS, next(), parseType()));
		}
		return sig;
	}

	// --- Statements ---

	private Node parseBody() throws ParseException {
		Node body = new Node(NodeType.BODY);
		if (!at(TokenType.NEWLINE)) {
			body.appendChild(parseSimpleStatement());
			body.appendChild(expect(TokenType.NEWLINE));
			return body;
		}
		body.appendChild(next());
		body.appendChild(expect(TokenType.INDENT));
		boolean first = true;
		while (true) {
			drainComments(body);
			if (tokens.get(pos).type == TokenType.DEDENT) {
				body.appendChild(next());
				return body;
			}
			if (first && isDocstringAhead()) {
				parseDocstring(body);
			} else {
				parseStatement(body);
			}
			first = false;
		}
	}

	private void parseStatement(Node container) throws ParseException {
		Token token = peek();
		switch (token.type) {
			case IF:
				container.appendChild(parseIf());
				return;
			case FOR:
				container.appendChild(parseFor());
				return;
			case AT:
			case DEF:
				container.appendChild(parseFunctionDef());
				return;
			case INDENT:
			case DEDENT:
			case ENDMARKER:
				throw unexpected(token, "statement");
			default:
				container.appendChild(parseSimpleStatement());
				container.appendChild(expect(TokenType.NEWLINE));
		}
	}

	private Node parseIf() throws ParseException {
		Node ifStmt = node(NodeType.IF_STMT, next(), parseCondExec());
		while (at(TokenType.ELIF)) {
			ifStmt.appendChild(next());
			ifStmt.appendChild(parseCondExec());
		}
		if (at(TokenType.ELSE)) {
			ifStmt.appendChild(next());
			ifStmt.appendChild(expect(TokenType.COLON));
			ifStmt.appendChild(parseBody());
		}
		return ifStmt;
	}

	private Node parseCondExec() throws ParseException {
		return node(NodeType.COND_EXEC, parseExpression(), expect(TokenType.COLON), parseBody());
	}

	private Node parseFor() throws ParseException {
		Node forStmt = node(NodeType.FOR_STMT, next());
		Leaf variable = expectIdentifier();
		if (at(TokenType.COLON)) {
			forStmt.appendChild(node(NodeType.LOOP_VARIABLE, variable, next(), parseType()));
		} else {
			forStmt.appendChild(variable);
		}
		forStmt.appendChild(expect(TokenType.IN));
		forStmt.appendChild(parseExpression());
		forStmt.appendChild(expect(TokenType.COLON));
		forStmt.appendChild(parseBody());
		return forStmt;
	}

	private TreeElement parseSimpleStatement() throws ParseException {
		Token token = peek();
		if (token.type == TokenType.ASSERT) {
			return parseAssert();
		}
		if (token.type == TokenType.NAME) {
			switch (token.value) {
				case "pass":
					return node(NodeType.PASS_STMT, next());
				case "break":
					return node(NodeType.BREAK_STMT, next());
				case "continue":
					return node(NodeType.CONTINUE_STMT, next());
				case "return":
					Node returnStmt = node(NodeType.RETURN_STMT, next());
					if (!at(TokenType.NEWLINE)) {
						returnStmt.appendChild(parseExpressionList());
					}
					return returnStmt;
				case "raise":
					Leaf raise = next();
					if (at(TokenType.NEWLINE)) {
						return node(NodeType.RAISE, raise);
					}
					return node(NodeType.RAISE_WITH_REASON, raise,
							atName("UNREACHABLE") ? next() : parseExpression());
				case "log":
					if (peek(1).type == TokenType.NAME) {
						return parseLog();
					}
					break;
				default:
					break;
			}
		}
		TreeElement target = parseExpressionList();
		if (at(TokenType.COLON) && target instanceof Leaf && ((Leaf) target).getType() == TokenType.NAME) {
			Node variable = node(NodeType.VARIABLE, target, next(), parseType());
			if (at(TokenType.EQUAL)) {
				return node(NodeType.DECLARATION, variable, next(), parseExpressionList());
			}
			return node(NodeType.DECLARATION, variable);
		}
		if (at(TokenType.EQUAL)) {
			Node assign = new Node(NodeType.ASSIGN);
			appendAssignTarget(assign, target);
			assign.appendChild(next());
			assign.appendChild(parseExpressionList());
			return assign;
		}
		if (at(TokenType.AUG_ASSIGN)) {
			return node(NodeType.AUG_ASSIGN, target, next(), parseExpressionList());
		}
		return target;
	}

	/** Tuple targets become {@code multiple_assign}, keeping any parentheses outside it. */
	private static void appendAssignTarget(Node assign, TreeElement target) {
		if (!target.is(NodeType.TUPLE)) {
			assign.appendChild(target);
			return;
		}
		Node tuple = (Node) target;
		boolean parenthesized = tuple.getChild(0).is(TokenType.LPAR);
		if (!parenthesized) {
			tuple.setType(NodeType.MULTIPLE_ASSIGN);
			assign.appendChild(tuple);
			return;
		}
		List<TreeElement> children = new ArrayList<>(tuple.getChildren());
		Node multiple = new Node(NodeType.MULTIPLE_ASSIGN, children.subList(1, children.size() - 1));
		assign.appendChild(children.get(0));
		assign.appendChild(multiple);
		assign.appendChild(children.get(children.size() - 1));
	}

	private Node parseAssert() throws ParseException {
		Leaf keyword = next();
		TreeElement condition = parseExpression();
		if (!at(TokenType.COMMA)) {
			return node(NodeType.ASSERT, keyword, condition);
		}
		Leaf comma = next();
		if (atName("UNREACHABLE")) {
			return node(NodeType.ASSERT_UNREACHABLE, keyword, condition, comma, next());
		}
		return node(NodeType.ASSERT_WITH_REASON, keyword, condition, comma, parseExpression());
	}

	private Node parseLog() throws ParseException {
		Node log = node(NodeType.LOG_STMT, next());
		TreeElement event = expectIdentifier();
		while (at(TokenType.DOT)) {
			event = node(NodeType.ATTRIBUTE, event, next(), expectIdentifier());
		}
		log.appendChild(event);
		log.appendChild(expect(TokenType.LPAR));
		if (!at(TokenType.RPAR)) {
			log.appendChild(parseArguments());
		}
		log.appendChild(expect(TokenType.RPAR));
		return log;
	}

	// --- Expressions ---

	private TreeElement parseExpressionList() throws ParseException {
		TreeElement first = parseExpression();
		if (!at(TokenType.COMMA)) {
			return first;
		}
		Node tuple = node(NodeType.TUPLE, first);
		while (at(TokenType.COMMA)) {
			tuple.appendChild(next());
			if (!canStartExpression(peek())) {
				break;
			}
			tuple.appendChild(parseExpression());
		}
		return tuple;
	}

	private static boolean canStartExpression(Token token) {
		switch (token.type) {
			case NAME:
			case NUMBER:
			case STRING:
			case LPAR:
			case LSQB:
			case LBRACE:
			case PLUS:
			case MINUS:
			case TILDE:
			case ELLIPSIS:
				return true;
			default:
				return false;
		}
	}

	private TreeElement parseExpression() throws ParseException {
		TreeElement body = parseOr();
		if (!at(TokenType.IF)) {
			return body;
		}
		return node(NodeType.TERNARY, body, next(), parseOr(), expect(TokenType.ELSE), parseExpression());
	}

	private TreeElement parseOr() throws ParseException {
		TreeElement left = parseAnd();
		while (atName("or")) {
			left = node(NodeType.OR, left, next(), parseAnd());
		}
		return left;
	}

	private TreeElement parseAnd() throws ParseException {
		TreeElement left = parseNot();
		while (atName("and")) {
			left = node(NodeType.AND, left, next(), parseNot());
		}
		return left;
	}

	private TreeElement parseNot() throws ParseException {
		if (atName("not")) {
			return node(NodeType.NOT, next(), parseNot());
		}
		return parseComparison();
	}

	private TreeElement parseComparison() throws ParseException {
		TreeElement left = parseBinary(this::parseBitXor, BITOR);
		while (true) {
			Token token = peek();
			if (COMPARISONS.containsKey(token.type)) {
				left = node(COMPARISONS.get(token.type), left, next(), parseBinary(this::parseBitXor, BITOR));
			} else if (token.isName("not") && peek(1).type == TokenType.IN) {
				left = node(NodeType.NOT_IN, left, next(), next(), parseBinary(this::parseBitXor, BITOR));
			} else {
				return left;
			}
		}
	}

	private TreeElement parseBitXor() throws ParseException {
		return parseBinary(this::parseBitAnd, BITXOR);
	}

	private TreeElement parseBitAnd() throws ParseException {
		return parseBinary(this::parseShift, BITAND);
	}

	private TreeElement parseShift() throws ParseException {
		return parseBinary(this::parseSum, SHIFTS);
	}

	private TreeElement parseSum() throws ParseException {
		return parseBinary(this::parseProduct, SUMS);
	}

	private TreeElement parseProduct() throws ParseException {
		return parseBinary(this::parseFactor, PRODUCTS);
	}

	private TreeElement parseBinary(OperandParser operand, Map<TokenType, NodeType> operators)
			throws ParseException {
		TreeElement left = operand.parse();
		while (operators.containsKey(peek().type)) {
			NodeType type = operators.get(peek().type);
			left = node(type, left, next(), operand.parse());
		}
		return left;
	}

	private TreeElement parseFactor() throws ParseException {
		NodeType unary = UNARY.get(peek().type);
		if (unary != null) {
			return node(unary, next(), parseFactor());
		}
		TreeElement base = parsePostfix();
		if (at(TokenType.DOUBLESTAR)) {
			return node(NodeType.POW, base, next(), parseFactor());
		}
		return base;
	}

	/** Types are postfix expressions: names, subscripts, calls and parenthesized tuples. */
	private TreeElement parseType() throws ParseException {
		return parsePostfix();
	}

	private TreeElement parsePostfix() throws ParseException {
		TreeElement expression = parseAtom();
		while (true) {
			if (at(TokenType.DOT)) {
				expression = node(NodeType.ATTRIBUTE, expression, next(), expectIdentifier());
			} else if (at(TokenType.LPAR)) {
				Node call = node(NodeType.CALL, expression, next());
				if (!at(TokenType.RPAR)) {
					call.appendChild(parseArguments());
				}
				call.appendChild(expect(TokenType.RPAR));
				expression = call;
			} else if (at(TokenType.LSQB)) {
				expression = node(NodeType.SUBSCRIPT, expression, next(), parseExpressionList(),
						expect(TokenType.RSQB));
			} else {
				return expression;
			}
		}
	}

	private Node parseArguments() throws ParseException {
		Node arguments = new Node(NodeType.ARGUMENTS);
		while (!at(TokenType.RPAR)) {
			if (at(TokenType.NAME) && peek(1).type == TokenType.EQUAL) {
				arguments.appendChild(node(NodeType.KWARG, next(), next(), parseExpression()));
			} else {
				arguments.appendChild(parseExpression());
			}
			if (!at(TokenType.COMMA)) {
				break;
			}
			arguments.appendChild(next());
		}
		return arguments;
	}

	private TreeElement parseAtom() throws ParseException {
		Token token = peek();
		switch (token.type) {
			case NAME:
				if ((token.value.equals("extcall") || token.value.equals("staticcall"))
						&& peek(1).type == TokenType.NAME) {
					return node(NodeType.EXTERNAL_CALL, next(), parsePostfix());
				}
				return next();
			case NUMBER:
			case ELLIPSIS:
				return next();
			case STRING:
				Leaf string = next();
				if (!at(TokenType.STRING)) {
					return string;
				}
				Node concat = node(NodeType.STRING_CONCAT, string);
				while (at(TokenType.STRING)) {
					concat.appendChild(next());
				}
				return concat;
			case LPAR:
				return parseParenthesized();
			case LSQB:
				return parseSequence(NodeType.LIST, TokenType.RSQB);
			case LBRACE:
				return parseDict();
			default:
				throw unexpected(token, "expression");
		}
	}

	private Node parseParenthesized() throws ParseException {
		Leaf lpar = next();
		if (at(TokenType.RPAR)) {
			return node(NodeType.TUPLE, lpar, next());
		}
		TreeElement first = parseExpression();
		if (!at(TokenType.COMMA)) {
			return node(NodeType.ATOM, lpar, first, expect(TokenType.RPAR));
		}
		Node tuple = node(NodeType.TUPLE, lpar, first);
		while (at(TokenType.COMMA)) {
			tuple.appendChild(next());
			if (at(TokenType.RPAR)) {
				break;
			}
			tuple.appendChild(parseExpression());
		}
		tuple.appendChild(expect(TokenType.RPAR));
		return tuple;
	}

	private Node parseSequence(NodeType type, TokenType closing) throws ParseException {
		Node sequence = node(type, next());
		while (!at(closing)) {
			sequence.appendChild(parseExpression());
			if (!at(TokenType.COMMA)) {
				break;
			}
			sequence.appendChild(next());
		}
		sequence.appendChild(expect(closing));
		return sequence;
	}

	private Node parseDict() throws ParseException {
		Node dict = node(NodeType.DICT, next());
		while (!at(TokenType.RBRACE)) {
			dict.appendChild(parseExpression());
			dict.appendChild(expect(TokenType.COLON));
			dict.appendChild(parseExpression());
			if (!at(TokenType.COMMA)) {
				break;
			}
			dict.appendChild(next());
		}
		dict.appendChild(expect(TokenType.RBRACE));
		return dict;
	}
}
