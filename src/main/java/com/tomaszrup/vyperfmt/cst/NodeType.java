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

import java.util.Locale;

/**
 * Grammar rules that produce interior {@link Node}s.
 */
public enum NodeType {
	MODULE,
	BODY,
	IMPORT,
	DECORATORS,
	DECORATOR,
	FUNCTION_DEF,
	FUNCTION_SIG,
	PARAMETERS,
	PARAMETER,
	RETURNS,
	INTERFACE_DEF,
	INTERFACE_FUNCTION,
	EVENT_DEF,
	EVENT_BODY,
	EVENT_MEMBER,
	INDEXED_EVENT_ARG,
	STRUCT_DEF,
	STRUCT_MEMBER,
	ENUM_DEF,
	ENUM_BODY,
	ENUM_MEMBER,
	CONSTANT_DEF,
	CONSTANT_PRIVATE,
	CONSTANT_WITH_GETTER,
	CONSTANT,
	IMMUTABLE_DEF,
	IMMUTABLE,
	VARIABLE_DEF,
	VARIABLE,
	VARIABLE_WITH_GETTER,
	IMPLEMENTS_DEF,
	USES_DEF,
	INITIALIZES_STMT,
	EXPORT,

	IF_STMT,
	COND_EXEC,
	FOR_STMT,
	LOOP_VARIABLE,
	DECLARATION,
	ASSIGN,
	MULTIPLE_ASSIGN,
	AUG_ASSIGN,
	PASS_STMT,
	BREAK_STMT,
	CONTINUE_STMT,
	LOG_STMT,
	RETURN_STMT,
	RAISE,
	RAISE_WITH_REASON,
	ASSERT,
	ASSERT_WITH_REASON,
	ASSERT_UNREACHABLE,

	EXTERNAL_CALL,
	CALL,
	ARGUMENTS,
	KWARG,
	ATTRIBUTE,
	SUBSCRIPT,
	ATOM,
	TUPLE,
	LIST,
	DICT,
	STRING_CONCAT,
	TERNARY,
	OR,
	AND,
	NOT,
	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,
	IN,
	NOT_IN,
	BITOR,
	BITXOR,
	BITAND,
	SHL,
	SHR,
	ADD,
	SUB,
	MUL,
	DIV,
	FLOORDIV,
	MOD,
	POW,
	USUB,
	UADD,
	INVERT;

	/** Lower-case rule name as it appears in tree dumps, e.g. {@code function_sig}. */
	public String ruleName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
