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
package com.tomaszrup.vyperfmt.cli;

import java.io.PrintWriter;

/**
 * Collects the per-file outcomes of a run, prints them as they happen and
 * derives the exit code.
 */
class Report {
	static final int EXIT_OK = 0;
	static final int EXIT_WOULD_CHANGE = 1;
	static final int EXIT_FAILURE = 123;

	private final boolean check;
	private final boolean diff;
	private final boolean quiet;
	private final boolean verbose;
	private final PrintWriter err;

	private int changeCount;
	private int sameCount;
	private int failureCount;

	Report(boolean check, boolean diff, boolean quiet, boolean verbose, PrintWriter err) {
		this.check = check;
		this.diff = diff;
		this.quiet = quiet;
		this.verbose = verbose;
		this.err = err;
	}

	void done(String source, boolean changed) {
		if (changed) {
			String verb = check || diff ? "would reformat" : "reformatted";
			if (verbose || !quiet) {
				err.println(verb + " " + source);
			}
			changeCount++;
		} else {
			if (verbose) {
				err.println(source + " already well formatted, good job.");
			}
			sameCount++;
		}
	}

	void failed(String source, String message) {
		err.println("error: cannot format " + source + ": " + message);
		failureCount++;
	}

	int getReturnCode() {
		if (failureCount > 0) {
			return EXIT_FAILURE;
		}
		if (changeCount > 0 && check) {
			return EXIT_WOULD_CHANGE;
		}
		return EXIT_OK;
	}

	int getChangeCount() {
		return changeCount;
	}

	int getSameCount() {
		return sameCount;
	}

	int getFailureCount() {
		return failureCount;
	}

	/** Summary such as {@code 1 file reformatted, 2 files left unchanged.} */
	@Override
	public String toString() {
		StringBuilder report = new StringBuilder();
		String reformatted = check || diff ? "would be reformatted" : "reformatted";
		String unchanged = check || diff ? "would be left unchanged" : "left unchanged";
		String failed = check || diff ? "would fail to reformat" : "failed to reformat";
		if (changeCount > 0) {
			append(report, files(changeCount) + " " + reformatted);
		}
		if (sameCount > 0) {
			append(report, files(sameCount) + " " + unchanged);
		}
		if (failureCount > 0) {
			append(report, files(failureCount) + " " + failed);
		}
		if (report.length() == 0) {
			report.append("No Vyper files are present to be formatted. Nothing to do");
		}
		return report.append('.').toString();
	}

	private static void append(StringBuilder report, String part) {
		if (report.length() > 0) {
			report.append(", ");
		}
		report.append(part);
	}

	private static String files(int count) {
		return count + (count == 1 ? " file" : " files");
	}
}
