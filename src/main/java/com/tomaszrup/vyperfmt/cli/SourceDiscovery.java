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
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Finds the Vyper sources below a directory.
 */
final class SourceDiscovery {

	static final Set<String> VYPER_EXTENSIONS = Set.of(".vy", ".vyi");

	/** Directory names that are never descended into. */
	static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
			"build", "buck-out", ".nox", "venv", ".direnv", ".eggs", "__pypackages__",
			".ipynb_checkpoints", "dist", "_build", ".git", ".hg", ".mypy_cache",
			".tox", ".venv", ".idea");

	private SourceDiscovery() {
		// utility class
	}

	/** Vyper files below {@code root}, sorted by path. */
	static List<Path> vyperFilesIn(Path root) throws IOException {
		List<Path> found = new ArrayList<>();
		Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
			@Override
			public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
				if (!dir.equals(root) && EXCLUDED_DIRECTORIES.contains(fileName(dir))) {
					return FileVisitResult.SKIP_SUBTREE;
				}
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
				if (attrs.isRegularFile() && isVyperFile(file)) {
					found.add(file);
				}
				return FileVisitResult.CONTINUE;
			}
		});
		Collections.sort(found);
		return found;
	}

	static boolean isVyperFile(Path file) {
		String name = fileName(file);
		int dot = name.lastIndexOf('.');
		return dot > 0 && VYPER_EXTENSIONS.contains(name.substring(dot));
	}

	private static String fileName(Path path) {
		Path name = path.getFileName();
		return name == null ? "" : name.toString();
	}
}
