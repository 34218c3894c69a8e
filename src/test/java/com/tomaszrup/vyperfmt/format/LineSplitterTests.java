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
import org.junit.jupiter.api.Test;

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.TokenType;

class LineSplitterTests {

	private static Line line(Leaf... leaves) {
		Line line = new Line(0, false);
		for (Leaf leaf : leaves) {
			line.append(leaf, true);
		}
		return line;
	}

	// --- empty body ---

	@Test
	void testEmptyBodyAndTailIsTheSameLine() {
		SplitResult result = LineSplitter.bracketSplitSucceeded(line(), line());
		Assertions.assertFalse(result.isSuccess());
		Assertions.assertTrue(result.getFailure().contains("same line"), result.getFailure());
	}

	@Test
	void testEmptyBodyWithShortTailIsNotWorthIt() {
		Line tail = line(new Leaf(TokenType.RPAR, ")"), new Leaf(TokenType.COLON, ":"));
		SplitResult result = LineSplitter.bracketSplitSucceeded(line(), tail);
		Assertions.assertFalse(result.isSuccess());
		Assertions.assertTrue(result.getFailure().contains("not worth it"), result.getFailure());
	}

	@Test
	void testEmptyBodyWithLongerTailIsAccepted() {
		Line tail = line(new Leaf(TokenType.RPAR, ")"), new Leaf(TokenType.RETURN_TYPE, "->", " ", 1, 0),
				new Leaf(TokenType.NAME, "uint256", " ", 1, 0), new Leaf(TokenType.COLON, ":"));
		Assertions.assertNull(LineSplitter.bracketSplitSucceeded(line(), tail));
	}

	@Test
	void testNonEmptyBodyIsAccepted() {
		Line body = line(new Leaf(TokenType.NAME, "x"));
		Assertions.assertNull(LineSplitter.bracketSplitSucceeded(body, line(new Leaf(TokenType.RPAR, ")"))));
	}
}
