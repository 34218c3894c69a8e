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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Parses the {@code initializationOptions} object sent by the client with
 * the {@code initialize} request.
 */
final class InitializationOptionsParser {

	private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

	static final String LINE_LENGTH_OPTION = "lineLength";
	static final String SAFE_OPTION = "safe";
	static final String LOG_LEVEL_OPTION = "logLevel";

	/** Options found in the payload; {@code null} fields were absent or invalid. */
	static final class ParsedOptions {
		final Integer lineLength;
		final Boolean safe;

		ParsedOptions(Integer lineLength, Boolean safe) {
			this.lineLength = lineLength;
			this.safe = safe;
		}
	}

	/**
	 * Parses the options and applies the log level right away.
	 *
	 * @return parsed options, or {@code null} if the input is not a {@link JsonObject}
	 */
	static ParsedOptions parse(Object initOptions) {
		if (!(initOptions instanceof JsonObject)) {
			return null;
		}
		JsonObject opts = (JsonObject) initOptions;
		if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
			applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
		}
		Integer lineLength = parseLineLength(opts.get(LINE_LENGTH_OPTION));
		Boolean safe = null;
		if (opts.has(SAFE_OPTION) && opts.get(SAFE_OPTION).isJsonPrimitive()
				&& opts.getAsJsonPrimitive(SAFE_OPTION).isBoolean()) {
			safe = opts.get(SAFE_OPTION).getAsBoolean();
			logger.info("Safe formatting: {}", safe);
		}
		return new ParsedOptions(lineLength, safe);
	}

	/** @return a positive line length, or {@code null} */
	static Integer parseLineLength(JsonElement element) {
		if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
			return null;
		}
		int value = element.getAsInt();
		if (value <= 0) {
			logger.warn("Ignoring non-positive line length {}", value);
			return null;
		}
		return value;
	}

	/**
	 * Sets the Logback root logger level. Accepted values (case-insensitive):
	 * ERROR, WARN, INFO, DEBUG, TRACE. Unknown values are ignored.
	 */
	static void applyLogLevel(String levelName) {
		ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
		if (level == null) {
			logger.warn("Unknown log level '{}', keeping current level", levelName);
			return;
		}
		org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		if (!(root instanceof ch.qos.logback.classic.Logger)) {
			logger.warn("Logging backend is not Logback, cannot set level '{}'", levelName);
			return;
		}
		ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
		ch.qos.logback.classic.Level previous = logbackRoot.getLevel();
		logbackRoot.setLevel(level);
		logger.info("Log level changed from {} to {}", previous, level);
	}

	private InitializationOptionsParser() {
		// utility class
	}
}
