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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one line transformation: either the replacement lines or the
 * reason the transformation does not apply.
 */
final class SplitResult {
	private final List<Line> lines;
	private final String failure;

	private SplitResult(List<Line> lines, String failure) {
		this.lines = lines;
		this.failure = failure;
	}

	static SplitResult of(List<Line> lines) {
		return new SplitResult(Collections.unmodifiableList(lines), null);
	}

	static SplitResult cannotSplit(String reason) {
		return new SplitResult(Collections.emptyList(), reason);
	}

	boolean isSuccess() {
		return failure == null;
	}

	List<Line> getLines() {
		return lines;
	}

	String getFailure() {
		return failure;
	}

	@Override
	public String toString() {
		return isSuccess() ? "split into " + lines.size() + " lines" : "cannot split: " + failure;
	}
}
