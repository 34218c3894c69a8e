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

/**
 * Inclusive, 1-based range of source lines between a {@code # fmt: off}
 * comment and its matching {@code # fmt: on} (or the end of the file).
 */
public final class FormatOffRegion {
	private final int startLine;
	private final int endLine;

	public FormatOffRegion(int startLine, int endLine) {
		this.startLine = startLine;
		this.endLine = endLine;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public boolean contains(int line) {
		return line >= startLine && line <= endLine;
	}

	@Override
	public String toString() {
		return "fmt:off[" + startLine + ".." + endLine + "]";
	}
}
