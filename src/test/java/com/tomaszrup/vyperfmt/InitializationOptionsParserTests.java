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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

class InitializationOptionsParserTests {

	private Logger rootLogger;
	private Level previousLevel;

	@BeforeEach
	void setup() {
		rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		previousLevel = rootLogger.getLevel();
	}

	@AfterEach
	void tearDown() {
		rootLogger.setLevel(previousLevel);
	}

	@Test
	void testNonObjectGivesNull() {
		Assertions.assertNull(InitializationOptionsParser.parse(null));
		Assertions.assertNull(InitializationOptionsParser.parse("lineLength=100"));
	}

	@Test
	void testEmptyObject() {
		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(new JsonObject());
		Assertions.assertNotNull(options);
		Assertions.assertNull(options.lineLength);
		Assertions.assertNull(options.safe);
	}

	@Test
	void testLineLengthAndSafe() {
		JsonObject opts = new JsonObject();
		opts.addProperty("lineLength", 100);
		opts.addProperty("safe", false);
		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(opts);
		Assertions.assertEquals(Integer.valueOf(100), options.lineLength);
		Assertions.assertEquals(Boolean.FALSE, options.safe);
	}

	@Test
	void testInvalidValuesAreIgnored() {
		JsonObject opts = new JsonObject();
		opts.addProperty("lineLength", "wide");
		opts.addProperty("safe", "yes");
		InitializationOptionsParser.ParsedOptions options = InitializationOptionsParser.parse(opts);
		Assertions.assertNull(options.lineLength);
		Assertions.assertNull(options.safe);
	}

	@Test
	void testParseLineLength() {
		Assertions.assertEquals(Integer.valueOf(88), InitializationOptionsParser.parseLineLength(new JsonPrimitive(88)));
		Assertions.assertNull(InitializationOptionsParser.parseLineLength(new JsonPrimitive(0)));
		Assertions.assertNull(InitializationOptionsParser.parseLineLength(new JsonPrimitive(-5)));
		Assertions.assertNull(InitializationOptionsParser.parseLineLength(JsonNull.INSTANCE));
		Assertions.assertNull(InitializationOptionsParser.parseLineLength(null));
	}

	@Test
	void testLogLevelIsApplied() {
		JsonObject opts = new JsonObject();
		opts.addProperty("logLevel", "debug");
		InitializationOptionsParser.parse(opts);
		Assertions.assertEquals(Level.DEBUG, rootLogger.getLevel());
	}

	@Test
	void testUnknownLogLevelKeepsCurrentLevel() {
		rootLogger.setLevel(Level.WARN);
		InitializationOptionsParser.applyLogLevel("NOT_A_LEVEL");
		Assertions.assertEquals(Level.WARN, rootLogger.getLevel());
	}
}
