/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.controlflow.ast;

/** The kinds of AST nodes the control flow builder understands. */
public enum Token {
  // Callables
  METHOD,
  CONSTRUCTOR,
  LAMBDA,
  PARAM_LIST,

  // Statements
  BLOCK,
  EXPR_RESULT,
  VAR,
  EMPTY,
  IF,
  WHILE,
  DO,
  FOR,
  FOREACH,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  TRY,
  CATCH,
  LABEL,
  LABEL_NAME,
  BREAK,
  CONTINUE,
  RETURN,
  THROW,
  GOTO,
  GOTO_CASE,
  GOTO_DEFAULT,

  // Short-circuit and conditional operators
  AND,
  OR,
  COALESCE,
  HOOK,

  // Unary operators
  NOT,
  NEG,
  INC,
  DEC,

  // Binary operators
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  LT,
  LE,
  GT,
  GE,
  EQ,
  NE,
  BITAND,
  BITOR,

  // Assignments
  ASSIGN,
  ASSIGN_OP,
  ASSIGN_COALESCE,

  // Accesses, calls and creation
  GETPROP,
  GETELEM,
  CALL,
  NEW,
  NEW_ARRAY,
  ARRAY_LIT,

  // Type tests and conversions
  IS,
  AS,
  CAST,

  THROW_EXPR,
  SWITCH_EXPR,
  SWITCH_ARM,

  // Patterns
  TYPE_PATTERN,
  VAR_PATTERN,
  DISCARD,

  // Leaves
  NAME,
  NUMBER,
  STRING,
  TRUE,
  FALSE,
  NULL,
  THIS,
  TYPE_REF,

  /** An expression form the builder has no special knowledge of. */
  UNKNOWN;

  /** Whether this token is a binary arithmetic, comparison or bitwise operator. */
  public boolean isBinaryOperator() {
    return switch (this) {
      case ADD, SUB, MUL, DIV, MOD, LT, LE, GT, GE, EQ, NE, BITAND, BITOR -> true;
      default -> false;
    };
  }

  /** Whether this token is a pattern, which is matched but never evaluated. */
  public boolean isPattern() {
    return this == TYPE_PATTERN || this == VAR_PATTERN || this == DISCARD;
  }
}
