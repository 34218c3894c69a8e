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

import java.util.function.IntConsumer;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Handles {@code workspace/didChangeConfiguration}, reading
 * {@code vyper.format.lineLength} and {@code vyper.logLevel}.
 */
final class ConfigurationChangeHandler {

	private final IntConsumer lineLengthListener;

	ConfigurationChangeHandler(IntConsumer lineLengthListener) {
		this.lineLengthListener = lineLengthListener;
	}

	/**
	 * Processes a didChangeConfiguration notification.
	 *
	 * @param rawSettings the raw settings object from the LSP params
	 */
	void handleConfigurationChange(Object rawSettings) {
		if (!(rawSettings instanceof JsonObject)) {
			return;
		}
		JsonObject vyper = child((JsonObject) rawSettings, "vyper");
		if (vyper == null) {
			return;
		}
		JsonElement logLevel = vyper.get(InitializationOptionsParser.LOG_LEVEL_OPTION);
		if (logLevel != null && logLevel.isJsonPrimitive()) {
			InitializationOptionsParser.applyLogLevel(logLevel.getAsString());
		}
		JsonObject format = child(vyper, "format");
		if (format == null) {
			return;
		}
		Integer lineLength = InitializationOptionsParser.parseLineLength(
				format.get(InitializationOptionsParser.LINE_LENGTH_OPTION));
		if (lineLength != null) {
			lineLengthListener.accept(lineLength);
		}
	}

	private static JsonObject child(JsonObject parent, String name) {
		JsonElement element = parent.get(name);
		return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
	}
}
