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
package com.tomaszrup.vyperfmt.parser;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.cst.Node;

/**
 * Parses Vyper source into a lossless concrete tree.
 *
 * <p>Instances hold no per-parse state and may be shared between threads.
 * Line endings are normalized to {@code \n} before scanning.</p>
 */
public class VyperParser {
	private static final Logger logger = LoggerFactory.getLogger(VyperParser.class);

	public ParseResult parse(String source) throws ParseException {
		String text = normalizeLineEndings(source);
		Tokenizer tokenizer = new Tokenizer(text);
		List<Token> tokens = tokenizer.tokenize();
		Node root = new TreeBuilder(tokens).parseModule();
		List<FormatOffRegion> regions = tokenizer.getFormatOffRegions();
		if (logger.isDebugEnabled()) {
			logger.debug("Parsed {} tokens into {} top-level elements ({} fmt: off regions)",
					tokens.size(), root.childCount(), regions.size());
		}
		return new ParseResult(root, regions, splitLines(text));
	}

	static String normalizeLineEndings(String text) {
		if (text.indexOf('\r') < 0) {
			return text;
		}
		return text.replace("\r\n", "\n").replace('\r', '\n');
	}

	private static List<String> splitLines(String text) {
		return Arrays.asList(text.split("\n", -1));
	}
}
