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

import org.eclipse.lsp4j.Position;

/**
 * Conversions between LSP positions and offsets in {@code \n}-separated text.
 */
public final class Positions {
	private Positions() {
	}

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/** @return the offset of {@code position}, or -1 if it is outside the text */
	public static int getOffset(String text, Position position) {
		if (text == null || position == null || !valid(position)) {
			return -1;
		}
		int lineStart = findLineStartOffset(text, position.getLine());
		if (lineStart < 0) {
			return -1;
		}
		int lineEnd = text.indexOf('\n', lineStart);
		if (lineEnd < 0) {
			lineEnd = text.length();
		}
		if (position.getCharacter() > lineEnd - lineStart) {
			return -1;
		}
		return lineStart + position.getCharacter();
	}

	/** The position just past the last character. */
	public static Position end(String text) {
		int line = 0;
		int lineStart = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		return new Position(line, text.length() - lineStart);
	}

	private static int findLineStartOffset(String text, int line) {
		if (line == 0) {
			return 0;
		}
		int currentLine = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				currentLine++;
				if (currentLine == line) {
					return i + 1;
				}
			}
		}
		return -1;
	}
}
