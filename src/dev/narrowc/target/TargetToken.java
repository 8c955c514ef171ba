/*
 * Copyright 2026 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.narrowc.target;

/** Node kinds of the lowered target syntax tree. */
public enum TargetToken {
  // Statements
  BLOCK,
  LOCAL_DECLARATION,
  EXPRESSION_STATEMENT,
  IF,
  WHILE,
  FOR,
  FOREACH,
  SWITCH,
  SWITCH_SECTION,
  CASE_LABEL,
  DEFAULT_LABEL,
  TRY,
  CATCH_CLAUSE,
  FINALLY_CLAUSE,
  THROW,
  RETURN,
  BREAK,
  CONTINUE,
  EMPTY,

  // Expressions
  IDENTIFIER,
  LITERAL,
  MEMBER_ACCESS,
  ELEMENT_ACCESS,
  INVOCATION,
  OBJECT_CREATION,
  ARRAY_CREATION,
  PARENTHESIZED,
  PREFIX_UNARY,
  POSTFIX_UNARY,
  BINARY,
  CONDITIONAL,
  ASSIGNMENT,
  IS_PATTERN,
  AWAIT,
  DEFAULT,

  TYPE;
}
