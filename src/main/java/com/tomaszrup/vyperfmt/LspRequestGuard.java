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
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs formatting requests off the message thread. A request that fails is
 * logged and answered with no edits, so the client keeps its text.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	CompletableFuture<List<? extends TextEdit>> formatOrKeep(String requestName, URI uri,
			Supplier<List<? extends TextEdit>> formatting) {
		return CompletableFuture.supplyAsync(formatting).exceptionally(throwable -> {
			Throwable cause = throwable;
			if (cause instanceof CompletionException && cause.getCause() != null) {
				cause = cause.getCause();
			}
			if (cause instanceof VirtualMachineError) {
				throw (VirtualMachineError) cause;
			}
			logger.warn("{} request failed, uri={}, error={}", requestName, uri, cause.toString());
			logger.debug("{} request failure details", requestName, cause);
			return Collections.emptyList();
		});
	}
}
