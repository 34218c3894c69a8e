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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.vyperfmt.parser.ParseException;
import com.tomaszrup.vyperfmt.parser.VyperParser;

class VyperFormatterTests {

	private VyperFormatter formatter;

	@BeforeEach
	void setup() {
		formatter = new VyperFormatter();
	}

	private String format(String source) throws Exception {
		return formatter.formatSource(source, FormatOptions.defaults());
	}

	private void assertFormatsTo(String expected, String source) throws Exception {
		String formatted = format(source);
		Assertions.assertEquals(expected, formatted);
		Assertions.assertEquals(formatted, format(formatted));
	}

	// --- declarations ---

	@Test
	void testSpaceAfterColonInDeclaration() throws Exception {
		assertFormatsTo("x: uint256\n", "x:uint256\n");
	}

	@Test
	void testPublicVariableIsUnchanged() throws Exception {
		assertFormatsTo("x: public(uint256)\n", "x: public(uint256)\n");
	}

	@Test
	void testConstantStringGetsDoubleQuotes() throws Exception {
		assertFormatsTo("x: constant(String[5]) = \"hello\"\n", "x: constant(String[5]) = 'hello'\n");
	}

	@Test
	void testSingleQuotesKeptAroundDoubleQuotes() throws Exception {
		assertFormatsTo("x: constant(String[8]) = 'say \"hi\"'\n", "x: constant(String[8]) = 'say \"hi\"'\n");
	}

	@Test
	void testEventIsUnchanged() throws Exception {
		String source = "event Transfer:\n    sender: indexed(address)\n    value: uint256\n";
		assertFormatsTo(source, source);
	}

	// --- functions ---

	@Test
	void testFunctionSignatureSpacing() throws Exception {
		assertFormatsTo("@external\ndef foo(a: uint256, b: address) -> uint256:\n    return a\n",
				"@external\ndef foo(a:uint256,b:address)->uint256:\n    return a\n");
	}

	@Test
	void testTwoBlankLinesBetweenFunctions() throws Exception {
		assertFormatsTo("@external\ndef a():\n    pass\n\n\n@external\ndef b():\n    pass\n",
				"@external\ndef a():\n    pass\n@external\ndef b():\n    pass\n");
	}

	@Test
	void testBlankLineAfterReturn() throws Exception {
		assertFormatsTo("@external\ndef foo(a: uint256, b: uint256) -> uint256:\n"
				+ "    if a > b:\n        return a\n\n    else:\n        return b\n",
				"@external\ndef foo(a: uint256, b: uint256) -> uint256:\n"
				+ "    if a>b:\n        return a\n    else:\n        return b\n");
	}

	@Test
	void testLongCallIsSplitInsideBrackets() throws Exception {
		assertFormatsTo("@external\ndef foo():\n"
				+ "    self.some_function_name(\n"
				+ "        argument_number_one, argument_number_two, argument_number_three\n"
				+ "    )\n",
				"@external\ndef foo():\n"
				+ "    self.some_function_name(argument_number_one, argument_number_two, argument_number_three)\n");
	}

	// --- blank lines ---

	@Test
	void testBlankLinesAreCapped() throws Exception {
		assertFormatsTo("x: uint256\n\n\ny: uint256\n", "x: uint256\n\n\n\n\ny: uint256\n");
	}

	@Test
	void testLeadingBlankLinesAreRemoved() throws Exception {
		assertFormatsTo("x: uint256\n", "\n\nx: uint256\n");
	}

	@Test
	void testBlankLineAfterVersionPragma() throws Exception {
		assertFormatsTo("# @version ^0.3.9\n\nx: uint256\n", "# @version ^0.3.9\nx: uint256\n");
		assertFormatsTo("# @version ^0.3.9\n\nx: uint256\n", "# @version ^0.3.9\n\nx: uint256\n");
	}

	// --- expressions ---

	@Test
	void testTrailingCommentSpacing() throws Exception {
		assertFormatsTo("x: uint256  # note\n", "x: uint256 #note\n");
	}

	@Test
	void testPowerOperatorHugsSimpleOperands() throws Exception {
		assertFormatsTo("x: uint256 = 2**8\n", "x: uint256 = 2 ** 8\n");
	}

	@Test
	void testMagicTrailingCommaExplodesList() throws Exception {
		assertFormatsTo("x: DynArray[uint256, 3] = [\n    1,\n    2,\n    3,\n]\n",
				"x: DynArray[uint256, 3] = [1, 2, 3,]\n");
	}

	@Test
	void testLongListIsExplodedOnePerLine() throws Exception {
		assertFormatsTo("x: DynArray[uint256, 20] = [\n"
				+ "    1000000000,\n    2000000000,\n    3000000000,\n"
				+ "    4000000000,\n    5000000000,\n    6000000000,\n]\n",
				"x: DynArray[uint256, 20] = [1000000000, 2000000000, 3000000000, 4000000000, 5000000000, 6000000000]\n");
	}

	// --- comments in brackets ---

	@Test
	void testTrailingCommentAfterOpeningBracket() throws Exception {
		assertFormatsTo("x: uint256 = foo(1, 2)  # why\n", "x: uint256 = foo(  # why\n    1, 2)\n");
	}

	@Test
	void testTrailingCommentInsideParentheses() throws Exception {
		assertFormatsTo("x: uint256 = (1)  # c\n", "x: uint256 = (  # c\n    1\n)\n");
	}

	@Test
	void testStandaloneCommentKeepsBracketsOpen() throws Exception {
		String source = "x: DynArray[uint256, 3] = [\n    1,\n    # two\n    2,\n]\n";
		assertFormatsTo(source, source);
	}

	// --- line length ---

	@Test
	void testNarrowLineSplitsBeforeOperator() throws Exception {
		FormatOptions narrow = new FormatOptions(20, true);
		String formatted = formatter.formatSource("a: constant(uint256) = 10000000000 + 10000000000\n", narrow);
		for (String line : formatted.split("\n")) {
			Assertions.assertTrue(line.length() <= 20, line);
		}
		Assertions.assertTrue(formatted.contains("\n    10000000000\n    + 10000000000\n)\n"), formatted);
		Assertions.assertEquals(formatted, formatter.formatSource(formatted, narrow));
	}

	// --- fmt: off ---

	@Test
	void testFormatOffRegionIsCopiedVerbatim() throws Exception {
		assertFormatsTo("# fmt: off\nx   =   [1,2,\n  3]\n# fmt: on\ny = 1\n",
				"# fmt: off\nx   =   [1,2,\n  3]\n# fmt: on\ny   =   1\n");
	}

	// --- formatTree ---

	@Test
	void testFormatTreeExplodesMagicTrailingComma() throws Exception {
		String formatted = VyperFormatter.formatTree(
				new VyperParser().parse("x: DynArray[uint256, 3] = [1, 2, 3,]\n").getRoot(), 80);
		Assertions.assertEquals("x: DynArray[uint256, 3] = [\n    1,\n    2,\n    3,\n]\n", formatted);
	}

	@Test
	void testFormatTreeLeavesShortLineAlone() throws Exception {
		Assertions.assertEquals("x: uint256\n",
				VyperFormatter.formatTree(new VyperParser().parse("x:uint256\n").getRoot(), 80));
	}

	// --- failures ---

	@Test
	void testParseFailureIsPropagated() {
		Assertions.assertThrows(ParseException.class, () -> format("def foo(:\n"));
		Assertions.assertThrows(ParseException.class, () -> format("x = )\n"));
		Assertions.assertThrows(ParseException.class, () -> format("if x:\n  y = 1\n z = 2\n"));
	}

	@Test
	void testAlreadyFormattedSourceIsReturnedAsIs() throws Exception {
		String source = "x: uint256\n";
		Assertions.assertEquals(source, formatter.formatSource(source, new FormatOptions(80, false)));
	}

	@Test
	void testNonPositiveLineLengthIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new FormatOptions(0, true));
		Assertions.assertThrows(IllegalArgumentException.class, () -> FormatOptions.defaults().withLineLength(-1));
	}

	@Test
	void testDefaults() {
		FormatOptions options = FormatOptions.defaults();
		Assertions.assertEquals(80, options.getLineLength());
		Assertions.assertTrue(options.isSafe());
		Assertions.assertEquals(100, options.withLineLength(100).getLineLength());
	}
}
