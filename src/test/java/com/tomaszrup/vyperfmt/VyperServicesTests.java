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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;

class VyperServicesTests {
	private static final String LANGUAGE_VYPER = "vyper";

	private VyperServices services;

	@TempDir
	Path tempDir;

	@BeforeEach
	void setup() {
		services = new VyperServices();
		services.connect(new TestLanguageClient());
	}

	@AfterEach
	void tearDown() {
		services = null;
	}

	private String open(String fileName, String contents) {
		String uri = tempDir.resolve(fileName).toUri().toString();
		services.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(uri, LANGUAGE_VYPER, 1, contents)));
		return uri;
	}

	private static TextDocumentContentChangeEvent rangeChange(Range range, String text) {
		TextDocumentContentChangeEvent event = new TextDocumentContentChangeEvent();
		event.setRange(range);
		event.setText(text);
		return event;
	}

	private List<? extends TextEdit> format(String uri) throws Exception {
		DocumentFormattingParams params = new DocumentFormattingParams(new TextDocumentIdentifier(uri),
				new FormattingOptions(4, true));
		return services.formatting(params).get(10, TimeUnit.SECONDS);
	}

	// --- formatting ---

	@Test
	void testFormattingReturnsWholeDocumentEdit() throws Exception {
		String uri = open("Token.vy", "@external\ndef foo(a:uint256)->uint256:\n    return a\n");
		List<? extends TextEdit> edits = format(uri);
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(new Range(new Position(0, 0), new Position(3, 0)), edits.get(0).getRange());
		Assertions.assertEquals("@external\ndef foo(a: uint256) -> uint256:\n    return a\n", edits.get(0).getNewText());
	}

	@Test
	void testFormattingParseErrorGivesNoEdits() throws Exception {
		String uri = open("Broken.vy", "def foo(:\n");
		Assertions.assertTrue(format(uri).isEmpty());
	}

	@Test
	void testFormattingReadsClosedDocumentFromDisk() throws Exception {
		Path file = Files.writeString(tempDir.resolve("OnDisk.vy"), "x:uint256\n");
		List<? extends TextEdit> edits = format(file.toUri().toString());
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals("x: uint256\n", edits.get(0).getNewText());
	}

	@Test
	void testFormattingFollowsIncrementalChanges() throws Exception {
		String uri = open("Token.vy", "x: uint256\n");
		Assertions.assertTrue(format(uri).isEmpty());

		TextDocumentContentChangeEvent change = rangeChange(new Range(new Position(0, 1), new Position(0, 2)), ":");
		services.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(uri, 2),
				Collections.singletonList(change)));
		Assertions.assertTrue(format(uri).isEmpty());

		change = rangeChange(new Range(new Position(0, 2), new Position(0, 3)), "");
		services.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(uri, 3),
				Collections.singletonList(change)));
		Assertions.assertEquals("x: uint256\n", format(uri).get(0).getNewText());
	}

	@Test
	void testDidSaveWithTextUpdatesContents() throws Exception {
		String uri = open("Token.vy", "x: uint256\n");
		services.didSave(new DidSaveTextDocumentParams(new TextDocumentIdentifier(uri), "y:address\n"));
		Assertions.assertEquals("y: address\n", format(uri).get(0).getNewText());
	}

	@Test
	void testDidCloseForgetsDocument() throws Exception {
		String uri = open("Closed.vy", "x:uint256\n");
		services.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(uri)));
		Assertions.assertNull(services.getFileContentsTracker().getContents(URI.create(uri)));
		Assertions.assertTrue(format(uri).isEmpty());
	}

	// --- rangeFormatting ---

	@Test
	void testRangeFormattingEditsChangedLinesOnly() throws Exception {
		String uri = open("Token.vy", "x: uint256\ny:address\n");
		DocumentRangeFormattingParams params = new DocumentRangeFormattingParams(new TextDocumentIdentifier(uri),
				new FormattingOptions(4, true), new Range(new Position(1, 0), new Position(1, 9)));
		List<? extends TextEdit> edits = services.rangeFormatting(params).get(10, TimeUnit.SECONDS);
		Assertions.assertEquals(1, edits.size());
		Assertions.assertEquals(new Range(new Position(1, 0), new Position(1, 9)), edits.get(0).getRange());
		Assertions.assertEquals("y: address", edits.get(0).getNewText());
	}

	// --- configuration ---

	@Test
	void testSetLineLength() {
		services.setLineLength(100);
		Assertions.assertEquals(100, services.getFormatOptions().getLineLength());
		services.setLineLength(0);
		Assertions.assertEquals(100, services.getFormatOptions().getLineLength());
	}

	@Test
	void testSetSafe() {
		Assertions.assertTrue(services.getFormatOptions().isSafe());
		services.setSafe(false);
		Assertions.assertFalse(services.getFormatOptions().isSafe());
	}

	@Test
	void testDidChangeConfigurationUpdatesLineLength() throws Exception {
		JsonObject format = new JsonObject();
		format.addProperty("lineLength", 120);
		JsonObject vyper = new JsonObject();
		vyper.add("format", format);
		JsonObject settings = new JsonObject();
		settings.add("vyper", vyper);

		services.didChangeConfiguration(new DidChangeConfigurationParams(settings));

		Assertions.assertEquals(120, services.getFormatOptions().getLineLength());
		String uri = open("Wide.vy",
				"x: DynArray[uint256, 20] = [1000000000, 2000000000, 3000000000, 4000000000, 5000000000, 6000000000]\n");
		Assertions.assertTrue(format(uri).isEmpty());
	}
}
