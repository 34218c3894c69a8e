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
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.vyperfmt.cst.TokenType;

class TokenizerTests {

	private static List<TokenType> types(String source) throws ParseException {
		List<TokenType> types = new ArrayList<>();
		for (Token token : new Tokenizer(source).tokenize()) {
			types.add(token.type);
		}
		return types;
	}

	private static List<Token> tokens(String source) throws ParseException {
		return new Tokenizer(source).tokenize();
	}

	@Test
	void testSimpleDeclaration() throws Exception {
		Assertions.assertEquals(Arrays.asList(TokenType.NAME, TokenType.COLON, TokenType.NAME,
				TokenType.NEWLINE, TokenType.ENDMARKER), types("x: uint256\n"));
	}

	@Test
	void testMissingFinalNewlineIsSynthesized() throws Exception {
		Assertions.assertEquals(Arrays.asList(TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER,
				TokenType.NEWLINE, TokenType.ENDMARKER), types("x = 1"));
	}

	@Test
	void testIndentAndDedent() throws Exception {
		Assertions.assertEquals(Arrays.asList(
				TokenType.IF, TokenType.NAME, TokenType.COLON, TokenType.NEWLINE,
				TokenType.INDENT, TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER, TokenType.NEWLINE,
				TokenType.DEDENT, TokenType.ENDMARKER), types("if x:\n    y = 1\n"));
	}

	@Test
	void testUnindentMismatchFails() {
		ParseException e = Assertions.assertThrows(ParseException.class,
				() -> types("if x:\n    y = 1\n  z = 2\n"));
		Assertions.assertEquals(3, e.getLine());
	}

	@Test
	void testTrailingAndStandaloneComments() throws Exception {
		Assertions.assertEquals(Arrays.asList(
				TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER, TokenType.COMMENT, TokenType.NEWLINE,
				TokenType.STANDALONE_COMMENT,
				TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER, TokenType.NEWLINE,
				TokenType.ENDMARKER), types("x = 1  # hi\n# alone\ny = 2\n"));
	}

	@Test
	void testCommentOnItsOwnLineInsideBracketsIsStandalone() throws Exception {
		Assertions.assertEquals(Arrays.asList(
				TokenType.NAME, TokenType.LPAR, TokenType.STANDALONE_COMMENT, TokenType.NAME,
				TokenType.COMMA, TokenType.RPAR, TokenType.NEWLINE, TokenType.ENDMARKER),
				types("f(\n    # c\n    a,\n)\n"));
	}

	@Test
	void testBlankLinesBecomeStatementPrefix() throws Exception {
		List<Token> tokens = tokens("x = 1\n\n\ny = 2\n");
		Token y = tokens.get(4);
		Assertions.assertEquals("y", y.value);
		Assertions.assertEquals("\n\n", y.prefix);
		Assertions.assertEquals(4, y.line);
	}

	@Test
	void testOperatorsAreMatchedLongestFirst() throws Exception {
		Assertions.assertEquals(Arrays.asList(
				TokenType.NAME, TokenType.AUG_ASSIGN, TokenType.NAME, TokenType.DOUBLESTAR, TokenType.NUMBER,
				TokenType.NEWLINE, TokenType.ENDMARKER), types("x **= y ** 2\n"));
		Assertions.assertEquals(TokenType.RETURN_TYPE, tokens("def f() -> uint256: pass\n").get(4).type);
	}

	@Test
	void testDeclarationKeywordsOnlyAtStatementStart() throws Exception {
		Assertions.assertEquals(TokenType.EVENT, tokens("event Transfer:\n    pass\n").get(0).type);
		Assertions.assertEquals(TokenType.ENUM, tokens("flag Roles:\n    ADMIN\n").get(0).type);
		Assertions.assertEquals(TokenType.NAME, tokens("event = 1\n").get(0).type);
	}

	@Test
	void testStringPrefixesAndTripleQuotes() throws Exception {
		List<Token> tokens = tokens("x = b\"\\x01\"\ny = \"\"\"a\nb\"\"\"\n");
		Assertions.assertEquals(TokenType.STRING, tokens.get(2).type);
		Assertions.assertEquals("b\"\\x01\"", tokens.get(2).value);
		Assertions.assertEquals("\"\"\"a\nb\"\"\"", tokens.get(6).value);
	}

	@Test
	void testUnterminatedStringFails() {
		Assertions.assertThrows(ParseException.class, () -> types("x = 'abc\n"));
	}

	@Test
	void testUnclosedBracketFails() {
		ParseException e = Assertions.assertThrows(ParseException.class, () -> types("f(a,\n"));
		Assertions.assertTrue(e.getMessage().contains("inside brackets"));
	}

	@Test
	void testUnmatchedClosingBracketFails() {
		Assertions.assertThrows(ParseException.class, () -> types("x = 1)\n"));
	}

	@Test
	void testFormatOffRegions() throws Exception {
		Tokenizer tokenizer = new Tokenizer("# fmt: off\nx  =  1\n# fmt: on\ny = 2\n");
		tokenizer.tokenize();
		List<FormatOffRegion> regions = tokenizer.getFormatOffRegions();
		Assertions.assertEquals(1, regions.size());
		Assertions.assertEquals(1, regions.get(0).getStartLine());
		Assertions.assertEquals(3, regions.get(0).getEndLine());
		Assertions.assertTrue(regions.get(0).contains(2));
		Assertions.assertFalse(regions.get(0).contains(4));
	}

	@Test
	void testUnclosedFormatOffRunsToEndOfFile() throws Exception {
		Tokenizer tokenizer = new Tokenizer("x = 1\n# fmt: off\ny  =  2\n");
		tokenizer.tokenize();
		List<FormatOffRegion> regions = tokenizer.getFormatOffRegions();
		Assertions.assertEquals(1, regions.size());
		Assertions.assertEquals(2, regions.get(0).getStartLine());
		Assertions.assertEquals(3, regions.get(0).getEndLine());
	}
}
