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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TreeComparatorTests {

	private VyperParser parser;
	private TreeComparator comparator;

	@BeforeEach
	void setup() {
		parser = new VyperParser();
		comparator = new TreeComparator(parser);
	}

	@Test
	void testLayoutIsIgnored() throws Exception {
		Assertions.assertTrue(comparator.equivalent("x   =   1\n", "x = 1\n"));
		Assertions.assertTrue(comparator.equivalent(
				"@external\ndef foo(a:uint256,b:address)->uint256:\n    return a\n",
				"@external\ndef foo(a: uint256, b: address) -> uint256:\n    return a\n"));
	}

	@Test
	void testCommentsAndBlankLinesAreIgnored() throws Exception {
		Assertions.assertTrue(comparator.equivalent("x = 1 #note\n\n\n\ny = 2\n", "x = 1  # note\n\n\ny = 2\n"));
	}

	@Test
	void testRedundantParenthesesAreIgnored() throws Exception {
		Assertions.assertTrue(comparator.equivalent("x = (1 + 2)\n", "x = 1 + 2\n"));
	}

	@Test
	void testCommentInsideParenthesesIsIgnored() throws Exception {
		Assertions.assertTrue(comparator.equivalent("x: uint256 = (  # c\n    1\n)\n", "x: uint256 = (1)  # c\n"));
		Assertions.assertTrue(comparator.equivalent(
				"@external\ndef foo() -> uint256:\n    return (  # c\n        1)\n",
				"@external\ndef foo() -> uint256:\n    return 1  # c\n"));
	}

	@Test
	void testTrailingCommaIsIgnored() throws Exception {
		Assertions.assertTrue(comparator.equivalent("x = [1, 2, 3,]\n", "x = [\n    1,\n    2,\n    3,\n]\n"));
	}

	@Test
	void testQuoteStyleIsIgnored() throws Exception {
		Assertions.assertTrue(comparator.equivalent("x = 'hello'\n", "x = \"hello\"\n"));
	}

	@Test
	void testChangedNameIsDetected() throws Exception {
		Assertions.assertFalse(comparator.equivalent("x = a\n", "x = b\n"));
	}

	@Test
	void testChangedOperatorIsDetected() throws Exception {
		Assertions.assertFalse(comparator.equivalent("x = a + b\n", "x = a - b\n"));
	}

	@Test
	void testChangedStructureIsDetected() throws Exception {
		Assertions.assertFalse(comparator.equivalent("x = a * (b + c)\n", "x = a * b + c\n"));
	}

	@Test
	void testUnparsableOutputFails() {
		Assertions.assertThrows(ParseException.class, () -> comparator.equivalent("x = 1\n", "x = (1\n"));
	}

	@Test
	void testCanonicalFormOmitsPunctuation() throws Exception {
		String canonical = TreeComparator.canonical(parser.parse("x = [1, 2]\n").getRoot());
		Assertions.assertEquals("module[assign[NAME(x)EQUAL(=)list[NUMBER(1)NUMBER(2)]]]", canonical);
	}
}
