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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.vyperfmt.cst.Node;

/**
 * Output of {@link VyperParser#parse(String)}: the tree plus what is needed
 * to pass {@code fmt: off} regions through verbatim.
 */
public final class ParseResult {
	private final Node root;
	private final List<FormatOffRegion> formatOffRegions;
	private final List<String> sourceLines;

	ParseResult(Node root, List<FormatOffRegion> formatOffRegions, List<String> sourceLines) {
		this.root = root;
		this.formatOffRegions = Collections.unmodifiableList(formatOffRegions);
		this.sourceLines = Collections.unmodifiableList(sourceLines);
	}

	public Node getRoot() {
		return root;
	}

	public List<FormatOffRegion> getFormatOffRegions() {
		return formatOffRegions;
	}

	/** Source lines without terminators; index 0 is line 1. */
	public List<String> getSourceLines() {
		return sourceLines;
	}
}
