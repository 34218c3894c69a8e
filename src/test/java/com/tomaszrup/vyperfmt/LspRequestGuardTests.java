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
package com.tomaszrup.vyperfmt;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LspRequestGuardTests {
	private static final URI URI_TOKEN = URI.create("file:///contracts/Token.vy");

	private final LspRequestGuard guard = new LspRequestGuard();

	@Test
	void testEditsPassThrough() throws Exception {
		TextEdit edit = new TextEdit(new Range(new Position(0, 0), new Position(1, 0)), "x: uint256\n");
		CompletableFuture<List<? extends TextEdit>> result = guard.formatOrKeep("formatting", URI_TOKEN,
				() -> Collections.singletonList(edit));
		Assertions.assertEquals(Collections.singletonList(edit), result.get());
	}

	@Test
	void testFailureGivesNoEdits() throws Exception {
		CompletableFuture<List<? extends TextEdit>> result = guard.formatOrKeep("formatting", URI_TOKEN,
				() -> {
					throw new IllegalStateException("boom");
				});
		Assertions.assertEquals(Collections.emptyList(), result.get());
	}

	@Test
	void testFatalErrorIsNotMasked() {
		CompletableFuture<List<? extends TextEdit>> result = guard.formatOrKeep("rangeFormatting", URI_TOKEN,
				() -> {
					throw new OutOfMemoryError("simulated");
				});
		ExecutionException thrown = Assertions.assertThrows(ExecutionException.class, result::get);
		Assertions.assertTrue(thrown.getCause() instanceof OutOfMemoryError);
	}
}
