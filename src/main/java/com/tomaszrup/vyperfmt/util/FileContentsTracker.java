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
package com.tomaszrup.vyperfmt.util;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe tracker for the text of documents open in the editor.
 *
 * <p>Closed documents are read from disk on demand.</p>
 */
public class FileContentsTracker {
	private static final Logger logger = LoggerFactory.getLogger(FileContentsTracker.class);

	private final ConcurrentHashMap<URI, String> openFiles = new ConcurrentHashMap<>();

	public void didOpen(DidOpenTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.put(uri, params.getTextDocument().getText());
	}

	/**
	 * Applies incremental or full-content changes atomically, in the order
	 * they were sent.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.compute(uri, (key, currentText) -> {
			String text = currentText;
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				text = applyChange(text, change);
			}
			return text;
		});
	}

	public void didClose(DidCloseTextDocumentParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		openFiles.remove(uri);
	}

	/**
	 * Returns the in-memory text of an open document, or the file contents
	 * on disk; {@code null} when neither is available.
	 */
	public String getContents(URI uri) {
		String contents = openFiles.get(uri);
		if (contents != null) {
			return contents;
		}
		try {
			return Files.readString(Paths.get(uri));
		} catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
			logger.debug("Cannot read {}: {}", uri, e.toString());
			return null;
		}
	}

	public void setContents(URI uri, String contents) {
		openFiles.put(uri, contents);
	}

	static String applyChange(String currentText, TextDocumentContentChangeEvent change) {
		Range range = change.getRange();
		if (currentText == null || range == null) {
			return change.getText();
		}
		int offsetStart = Positions.getOffset(currentText, range.getStart());
		int offsetEnd = Positions.getOffset(currentText, range.getEnd());
		if (offsetStart < 0 || offsetEnd < 0 || offsetStart > offsetEnd) {
			// invalid range, treat as a full replacement
			return change.getText();
		}
		return currentText.substring(0, offsetStart) + change.getText() + currentText.substring(offsetEnd);
	}
}
