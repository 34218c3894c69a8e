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
package com.tomaszrup.vyperfmt.cst;

/**
 * Terminal tags carried by {@link Leaf}. Keywords that the formatter reasons
 * about structurally get their own tag; every other keyword is a {@link #NAME}.
 */
public enum TokenType {
	NAME,
	NUMBER,
	STRING,
	DOCSTRING,
	COMMENT,
	STANDALONE_COMMENT,
	PRAGMA,

	NEWLINE,
	INDENT,
	DEDENT,
	ENDMARKER,

	LPAR,
	RPAR,
	LSQB,
	RSQB,
	LBRACE,
	RBRACE,

	COMMA,
	DOT,
	COLON,
	AT,
	EQUAL,
	RETURN_TYPE,
	ELLIPSIS,
	AUG_ASSIGN,

	PLUS,
	MINUS,
	STAR,
	SLASH,
	DOUBLESLASH,
	PERCENT,
	DOUBLESTAR,
	LEFTSHIFT,
	RIGHTSHIFT,
	AMPERSAND,
	VBAR,
	CIRCUMFLEX,
	TILDE,

	LESS,
	GREATER,
	EQEQUAL,
	NOTEQUAL,
	LESSEQUAL,
	GREATEREQUAL,

	DEF,
	EVENT,
	STRUCT,
	ENUM,
	INTERFACE,
	IMPORT,
	FROM,
	FOR,
	IN,
	IF,
	ELIF,
	ELSE,
	ASSERT
}
