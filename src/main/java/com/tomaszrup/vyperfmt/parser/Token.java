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

import com.tomaszrup.vyperfmt.cst.Leaf;
import com.tomaszrup.vyperfmt.cst.TokenType;

/**
 * A scanned token. {@code prefix} holds one {@code \n} per blank source line
 * preceding a statement's first token or a standalone comment, and is empty
 * everywhere else.
 */
final class Token {
	final TokenType type;
	final String value;
	final String prefix;
	final int line;
	final int column;

	Token(TokenType type, String value, String prefix, int line, int column) {
		this.type = type;
		this.value = value;
		this.prefix = prefix;
		this.line = line;
		this.column = column;
	}

	boolean isComment() {
		return type == TokenType.COMMENT || type == TokenType.STANDALONE_COMMENT;
	}

	boolean isName(String name) {
		return type == TokenType.NAME && value.equals(name);
	}

	Leaf toLeaf() {
		return new Leaf(type, value, prefix, line, column);
	}

	@Override
	public String toString() {
		return type + "(" + value + ")@" + line + ":" + column;
	}
}
