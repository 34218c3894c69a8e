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
package com.tomaszrup.vyperfmt.format;

/**
 * Settings for {@link VyperFormatter#formatSource(String, FormatOptions)}.
 */
public final class FormatOptions {
	public static final int DEFAULT_LINE_LENGTH = 80;

	private final int lineLength;
	private final boolean safe;

	public FormatOptions(int lineLength, boolean safe) {
		if (lineLength <= 0) {
			throw new IllegalArgumentException("Line length must be positive: " + lineLength);
		}
		this.lineLength = lineLength;
		this.safe = safe;
	}

	public static FormatOptions defaults() {
		return new FormatOptions(DEFAULT_LINE_LENGTH, true);
	}

	public int getLineLength() {
		return lineLength;
	}

	/** Whether the output is checked for equivalence with the input and for stability. */
	public boolean isSafe() {
		return safe;
	}

	public FormatOptions withLineLength(int newLineLength) {
		return new FormatOptions(newLineLength, safe);
	}

	@Override
	public String toString() {
		return "FormatOptions[lineLength=" + lineLength + ", safe=" + safe + "]";
	}
}
