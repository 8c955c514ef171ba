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

package dev.narrowc.ir;

/** An enumeration of the IR node kinds. */
public enum Token {
  BLOCK,
  EXPR_RESULT,
  VAR,
  LET,
  CONST,
  IF,
  WHILE,
  FOR,
  FOR_IN,
  FOR_OF,
  FOR_AWAIT_OF,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  TRY,
  CATCH,
  THROW,
  RETURN,
  BREAK,
  CONTINUE,
  EMPTY,

  FUNCTION,
  PARAM_LIST,
  CLASS,
  INTERFACE,
  ENUM,
  TYPE_ALIAS,
  YIELD,

  ARRAY_PATTERN,
  OBJECT_PATTERN,

  NAME,
  THIS,
  SUPER,
  STRING,
  NUMBER,
  TRUE,
  FALSE,
  NULL,

  GETPROP,
  GETELEM,
  CALL,
  NEW,

  NOT,
  NEG,
  POS,
  BITNOT,
  TYPEOF,
  VOID,
  INC,
  DEC,

  EQ,
  NE,
  SHEQ,
  SHNE,
  LT,
  LE,
  GT,
  GE,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  BITAND,
  BITOR,
  BITXOR,
  LSH,
  RSH,
  URSH,
  IN,
  INSTANCEOF,

  AND,
  OR,
  COALESCE,
  HOOK,

  ASSIGN,
  ASSIGN_ADD,
  ASSIGN_SUB,
  ASSIGN_MUL,
  ASSIGN_DIV,
  ASSIGN_MOD,

  ARRAYLIT,
  OBJECTLIT,
  SPREAD,
  AWAIT;
}
