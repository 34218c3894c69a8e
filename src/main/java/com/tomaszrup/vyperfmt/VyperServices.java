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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.format.FormatOptions;
import com.tomaszrup.vyperfmt.format.VyperFormatter;
import com.tomaszrup.vyperfmt.util.FileContentsTracker;

/**
 * Text document and workspace services of the language server. Only
 * formatting is offered; document notifications keep the in-memory copy of
 * open files current.
 */
public class VyperServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(VyperServices.class);

	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();
	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final FormattingHandler formattingHandler;
	private final LspRequestGuard requestGuard = new LspRequestGuard();
	private final ConfigurationChangeHandler configChangeHandler;

	private volatile int lineLength = FormatOptions.DEFAULT_LINE_LENGTH;
	private volatile boolean safe = true;

	public VyperServices() {
		this(new VyperFormatter());
	}

	public VyperServices(VyperFormatter formatter) {
		this.formattingHandler = new FormattingHandler(fileContentsTracker, formatter, this::getFormatOptions);
		this.configChangeHandler = new ConfigurationChangeHandler(this::setLineLength);
	}

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	FileContentsTracker getFileContentsTracker() {
		return fileContentsTracker;
	}

	public FormatOptions getFormatOptions() {
		return new FormatOptions(lineLength, safe);
	}

	public void setLineLength(int lineLength) {
		if (lineLength <= 0) {
			logger.warn("Ignoring non-positive line length {}", lineLength);
			return;
		}
		if (this.lineLength != lineLength) {
			logger.info("Line length set to {}", lineLength);
		}
		this.lineLength = lineLength;
	}

	public void setSafe(boolean safe) {
		this.safe = safe;
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		fileContentsTracker.didOpen(params);
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		fileContentsTracker.didChange(params);
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		fileContentsTracker.didClose(params);
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		if (params.getText() != null) {
			fileContentsTracker.setContents(URI.create(params.getTextDocument().getUri()), params.getText());
		}
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		// documents are read from disk on demand
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		configChangeHandler.handleConfigurationChange(params.getSettings());
	}

	// --- Requests ---

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return requestGuard.formatOrKeep("formatting", uri, () -> formattingHandler.formatDocument(uri));
	}

	@Override
	public CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return requestGuard.formatOrKeep("rangeFormatting", uri,
				() -> formattingHandler.formatRange(uri, params.getRange()));
	}
}
