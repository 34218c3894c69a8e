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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

class ConfigurationChangeHandlerTests {

	private final List<Integer> lineLengths = new ArrayList<>();
	private ConfigurationChangeHandler handler;
	private Logger rootLogger;
	private Level previousLevel;

	@BeforeEach
	void setup() {
		handler = new ConfigurationChangeHandler(lineLengths::add);
		rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		previousLevel = rootLogger.getLevel();
	}

	@AfterEach
	void tearDown() {
		rootLogger.setLevel(previousLevel);
	}

	private static JsonObject settings(JsonObject vyper) {
		JsonObject settings = new JsonObject();
		settings.add("vyper", vyper);
		return settings;
	}

	@Test
	void testLineLengthIsForwarded() {
		JsonObject format = new JsonObject();
		format.addProperty("lineLength", 100);
		JsonObject vyper = new JsonObject();
		vyper.add("format", format);

		handler.handleConfigurationChange(settings(vyper));

		Assertions.assertEquals(List.of(100), lineLengths);
	}

	@Test
	void testNonPositiveLineLengthIsIgnored() {
		JsonObject format = new JsonObject();
		format.addProperty("lineLength", 0);
		JsonObject vyper = new JsonObject();
		vyper.add("format", format);

		handler.handleConfigurationChange(settings(vyper));

		Assertions.assertTrue(lineLengths.isEmpty());
	}

	@Test
	void testLogLevelIsApplied() {
		JsonObject vyper = new JsonObject();
		vyper.addProperty("logLevel", "ERROR");

		handler.handleConfigurationChange(settings(vyper));

		Assertions.assertEquals(Level.ERROR, rootLogger.getLevel());
		Assertions.assertTrue(lineLengths.isEmpty());
	}

	@Test
	void testUnrelatedSettingsAreIgnored() {
		JsonObject other = new JsonObject();
		other.addProperty("lineLength", 100);
		JsonObject settings = new JsonObject();
		settings.add("python", other);

		handler.handleConfigurationChange(settings);
		handler.handleConfigurationChange(null);
		handler.handleConfigurationChange("not json");

		Assertions.assertTrue(lineLengths.isEmpty());
	}
}
