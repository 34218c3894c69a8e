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
package com.tomaszrup.vyperfmt.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class UnifiedDiffTests {

	@Test
	void testEqualTextsGiveEmptyDiff() {
		Assertions.assertEquals("", UnifiedDiff.diff("x = 1\n", "x = 1\n", "a", "b"));
	}

	@Test
	void testSingleLineChange() {
		Assertions.assertEquals("--- a\n+++ b\n@@ -1 +1 @@\n-x:uint256\n+x: uint256\n",
				UnifiedDiff.diff("x:uint256\n", "x: uint256\n", "a", "b"));
	}

	@Test
	void testChangeWithContext() {
		Assertions.assertEquals("--- a\n+++ b\n@@ -1,5 +1,5 @@\n a\n b\n-c\n+C\n d\n e\n",
				UnifiedDiff.diff("a\nb\nc\nd\ne\n", "a\nb\nC\nd\ne\n", "a", "b"));
	}

	@Test
	void testInsertionAtEnd() {
		Assertions.assertEquals("--- a\n+++ b\n@@ -1 +1,2 @@\n a\n+b\n",
				UnifiedDiff.diff("a\n", "a\nb\n", "a", "b"));
	}

	@Test
	void testMissingFinalNewlineIsMarked() {
		Assertions.assertEquals("--- a\n+++ b\n@@ -1 +1 @@\n-x\n\\ No newline at end of file\n+x\n",
				UnifiedDiff.diff("x", "x\n", "a", "b"));
	}

	@Test
	void testDistantChangesGetSeparateHunks() {
		StringBuilder original = new StringBuilder();
		for (int i = 0; i < 20; i++) {
			original.append("line").append(i).append('\n');
		}
		String formatted = original.toString().replace("line1\n", "LINE1\n").replace("line18\n", "LINE18\n");
		String diff = UnifiedDiff.diff(original.toString(), formatted, "a", "b");
		Assertions.assertTrue(diff.contains("@@ -1,5 +1,5 @@\n"));
		Assertions.assertTrue(diff.contains("@@ -16,5 +16,5 @@\n"));
	}

	@Test
	void testCommonLineInsideChangedWindowIsKept() {
		Assertions.assertEquals("--- a\n+++ b\n@@ -1,4 +1,4 @@\n-a\n+x\n b\n-c\n+y\n d\n",
				UnifiedDiff.diff("a\nb\nc\nd\n", "x\nb\ny\nd\n", "a", "b"));
	}

	@Test
	void testLargeRewriteIsDiffed() {
		int count = 20000;
		StringBuilder original = new StringBuilder();
		StringBuilder formatted = new StringBuilder();
		for (int i = 0; i < count; i++) {
			original.append("old").append(i).append('\n');
			formatted.append("new").append(i).append('\n');
		}
		String diff = UnifiedDiff.diff(original.toString(), formatted.toString(), "a", "b");
		Assertions.assertTrue(diff.startsWith("--- a\n+++ b\n@@ -1,20000 +1,20000 @@\n-old0\n-old1\n"));
		Assertions.assertTrue(diff.endsWith("+new19998\n+new19999\n"));
	}
}
