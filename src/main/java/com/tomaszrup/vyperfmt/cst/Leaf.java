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

import java.util.Collections;
import java.util.List;

/**
 * A terminal element. {@code bracketDepth} and {@code openingBracket} are
 * assigned by the bracket tracker when the leaf is placed on a line.
 */
public class Leaf extends TreeElement {

	private TokenType type;
	private String value;
	private String prefix;
	private final int line;
	private final int column;

	private int bracketDepth;
	private Leaf openingBracket;

	public Leaf(TokenType type, String value) {
		this(type, value, "", 0, 0);
	}

	public Leaf(TokenType type, String value, String prefix, int line, int column) {
		this.type = type;
		this.value = value;
		this.prefix = prefix;
		this.line = line;
		this.column = column;
	}

	public TokenType getType() {
		return type;
	}

	public void setType(TokenType type) {
		this.type = type;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	@Override
	public String getPrefix() {
		return prefix;
	}

	@Override
	public void setPrefix(String prefix) {
		this.prefix = prefix;
	}

	/** 1-based source line, or 0 for synthesized leaves. */
	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public int getBracketDepth() {
		return bracketDepth;
	}

	public void setBracketDepth(int bracketDepth) {
		this.bracketDepth = bracketDepth;
	}

	public Leaf getOpeningBracket() {
		return openingBracket;
	}

	public void setOpeningBracket(Leaf openingBracket) {
		this.openingBracket = openingBracket;
	}

	/** Copy of type and value only; prefix, position and tree links are not carried. */
	public Leaf copyToken() {
		return new Leaf(type, value);
	}

	/** Detached copy keeping the prefix and position but no bracket metadata. */
	public Leaf copy() {
		return new Leaf(type, value, prefix, line, column);
	}

	@Override
	public boolean isLeaf() {
		return true;
	}

	@Override
	public boolean is(TokenType type) {
		return this.type == type;
	}

	@Override
	public boolean is(NodeType type) {
		return false;
	}

	@Override
	public List<Leaf> leaves() {
		return Collections.singletonList(this);
	}

	@Override
	public Leaf firstLeaf() {
		return this;
	}

	@Override
	public Leaf lastLeaf() {
		return this;
	}

	@Override
	public String toString() {
		return prefix + value;
	}
}
