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

import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

/**
 * Tests for {@link VyperLanguageServer}: initialize(), shutdown() and the
 * services it exposes.
 */
class VyperLanguageServerTests {

	private VyperLanguageServer server;

	@BeforeEach
	void setup() {
		server = new VyperLanguageServer();
		server.connect(new TestLanguageClient());
	}

	@AfterEach
	void tearDown() throws Exception {
		if (server != null) {
			server.shutdown().get();
		}
		server = null;
	}

	private VyperServices services() {
		return (VyperServices) server.getTextDocumentService();
	}

	// --- initialize() ---

	@Test
	void testInitializeReturnsServerCapabilities() throws Exception {
		InitializeResult result = server.initialize(new InitializeParams()).get();

		Assertions.assertNotNull(result);
		ServerCapabilities caps = result.getCapabilities();
		Assertions.assertEquals(TextDocumentSyncKind.Incremental, caps.getTextDocumentSync().getLeft());
		Assertions.assertTrue(caps.getDocumentFormattingProvider().getLeft());
		Assertions.assertTrue(caps.getDocumentRangeFormattingProvider().getLeft());
		Assertions.assertNull(caps.getCompletionProvider());
		Assertions.assertEquals("vyperfmt", result.getServerInfo().getName());
	}

	@Test
	void testInitializeParsesInitializationOptions() throws Exception {
		InitializeParams params = new InitializeParams();
		JsonObject opts = new JsonObject();
		opts.addProperty("lineLength", 100);
		opts.addProperty("safe", false);
		params.setInitializationOptions(opts);

		server.initialize(params).get();

		Assertions.assertEquals(100, services().getFormatOptions().getLineLength());
		Assertions.assertFalse(services().getFormatOptions().isSafe());
	}

	@Test
	void testInitializeWithoutOptionsKeepsDefaults() throws Exception {
		server.initialize(new InitializeParams()).get();

		Assertions.assertEquals(80, services().getFormatOptions().getLineLength());
		Assertions.assertTrue(services().getFormatOptions().isSafe());
	}

	// --- shutdown() ---

	@Test
	void testShutdownReturnsNonNull() throws Exception {
		server.initialize(new InitializeParams()).get();
		Assertions.assertNotNull(server.shutdown().get());
	}

	@Test
	void testShutdownWithoutInitialize() throws Exception {
		Assertions.assertNotNull(server.shutdown().get());
	}

	// --- getTextDocumentService / getWorkspaceService ---

	@Test
	void testServicesAreShared() {
		Assertions.assertNotNull(server.getTextDocumentService());
		Assertions.assertSame(server.getTextDocumentService(), server.getWorkspaceService());
	}
}
