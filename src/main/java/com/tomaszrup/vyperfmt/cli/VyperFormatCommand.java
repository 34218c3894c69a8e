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

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.vyperfmt.format.FormatOptions;
import com.tomaszrup.vyperfmt.format.UnsafeFormattingException;
import com.tomaszrup.vyperfmt.format.VyperFormatter;
import com.tomaszrup.vyperfmt.parser.ParseException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command line front end: formats files and directories, checks them or
 * prints diffs.
 */
@Command(name = "vyperfmt", mixinStandardHelpOptions = true, version = "vyperfmt 0.1.0",
		description = "The uncompromising Vyper code formatter.")
public class VyperFormatCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger(VyperFormatCommand.class);

	static final String STDIN = "-";
	static final String PARSE_FAILURE = "Unable to parse input file, are you sure the Vyper code is valid?";

	@Spec
	private CommandSpec spec;

	@Option(names = {"-l", "--line-length"}, defaultValue = "80", paramLabel = "N",
			description = "Max line length (default: ${DEFAULT-VALUE}).")
	private int lineLength;

	@Option(names = "--in-place", negatable = true, defaultValue = "true", fallbackValue = "true",
			description = "Overwrite files in place; with --no-in-place formatted files go to stdout "
					+ "(default: ${DEFAULT-VALUE}).")
	private boolean inPlace;

	@Option(names = "--safe", negatable = true, defaultValue = "true", fallbackValue = "true",
			description = "Compare input and output trees to ensure they are equivalent (default: ${DEFAULT-VALUE}).")
	private boolean safe;

	@Option(names = "--check", description = "Don't write the files back, just return the status. "
			+ "Return code 0 means nothing would change. Return code 1 means some files would be reformatted. "
			+ "Return code 123 means there was an internal error.")
	private boolean check;

	@Option(names = "--diff", description = "Don't write the files back, just output a diff for each file on stdout.")
	private boolean diff;

	@Option(names = {"-q", "--quiet"}, description = "Don't emit non-error messages to stderr.")
	private boolean quiet;

	@Option(names = {"-v", "--verbose"}, description = "Also emit messages to stderr about files that were not changed.")
	private boolean verbose;

	@Parameters(paramLabel = "SRC", arity = "0..*",
			description = "Files or directories to format; '-' reads standard input.")
	private List<String> sources = new ArrayList<>();

	private final InputStream stdin;
	private final VyperFormatter formatter = new VyperFormatter();

	public VyperFormatCommand() {
		this(System.in);
	}

	VyperFormatCommand(InputStream stdin) {
		this.stdin = stdin;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new VyperFormatCommand()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() {
		PrintWriter out = spec.commandLine().getOut();
		PrintWriter err = spec.commandLine().getErr();
		if (lineLength <= 0) {
			throw new CommandLine.ParameterException(spec.commandLine(),
					"Line length must be positive, got " + lineLength);
		}
		FormatOptions options = new FormatOptions(lineLength, safe);
		Report report = new Report(check, diff, quiet, verbose, err);

		List<String> requested = sources.isEmpty()
				? List.of(Paths.get("").toAbsolutePath().toString())
				: sources;
		for (String source : requested) {
			if (STDIN.equals(source)) {
				formatStdin(options, report, out);
				continue;
			}
			for (Path file : expand(source, report)) {
				formatFile(file, options, report, out);
			}
		}

		if (verbose || !quiet) {
			err.println(report.getReturnCode() != Report.EXIT_OK ? "Oh no!" : "All done!");
			if (inPlace) {
				err.println(report);
			}
		}
		out.flush();
		err.flush();
		return report.getReturnCode();
	}

	private List<Path> expand(String source, Report report) {
		Path path = Paths.get(source);
		if (Files.isDirectory(path)) {
			try {
				return SourceDiscovery.vyperFilesIn(path);
			} catch (IOException e) {
				logger.warn("Could not list {}: {}", path, e.getMessage());
				report.failed(source, "cannot list directory: " + e.getMessage());
				return List.of();
			}
		}
		if (Files.isRegularFile(path)) {
			// an explicitly named file is formatted whatever its extension
			return List.of(path);
		}
		report.failed(source, "invalid path");
		return List.of();
	}

	private void formatFile(Path file, FormatOptions options, Report report, PrintWriter out) {
		String name = file.toString();
		String contents;
		try {
			contents = Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			report.failed(name, "cannot read file: " + e.getMessage());
			return;
		}
		String formatted = format(name, contents, options, report);
		if (formatted == null || check) {
			return;
		}
		if (diff) {
			out.print(UnifiedDiff.diff(contents, formatted, name + "\t(original)", name + "\t(formatted)"));
			return;
		}
		if (!inPlace) {
			out.print(formatted);
			return;
		}
		if (!formatted.equals(contents)) {
			try {
				Files.writeString(file, formatted, StandardCharsets.UTF_8);
			} catch (IOException e) {
				report.failed(name, "cannot write file: " + e.getMessage());
			}
		}
	}

	private void formatStdin(FormatOptions options, Report report, PrintWriter out) {
		String contents;
		try {
			contents = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			report.failed("STDIN", "cannot read standard input: " + e.getMessage());
			return;
		}
		String formatted = format("STDIN", contents, options, report);
		if (formatted == null || check) {
			return;
		}
		if (diff) {
			String now = Instant.now().toString();
			out.print(UnifiedDiff.diff(contents, formatted, "STDIN\t" + now, "STDOUT\t" + now));
		} else {
			out.print(formatted);
		}
	}

	/** @return the formatted text, or {@code null} after reporting a failure */
	private String format(String name, String contents, FormatOptions options, Report report) {
		String formatted;
		try {
			formatted = formatter.formatSource(contents, options);
		} catch (ParseException e) {
			logger.debug("Parse failure in {}", name, e);
			if (verbose) {
				spec.commandLine().getErr().println(e.getMessage());
			}
			report.failed(name, PARSE_FAILURE);
			return null;
		} catch (UnsafeFormattingException e) {
			logger.debug("Unsafe formatting of {}", name, e);
			report.failed(name, e.getMessage());
			return null;
		} catch (RuntimeException e) {
			logger.warn("Internal error while formatting {}", name, e);
			report.failed(name, "internal error: " + e);
			return null;
		}
		report.done(name, !formatted.equals(contents));
		return formatted;
	}
}
