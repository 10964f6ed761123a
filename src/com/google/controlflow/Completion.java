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

package com.google.controlflow;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.controlflow.ControlFlowGraph.Branch;
import org.jspecify.annotations.Nullable;

/**
 * The way the evaluation of an element ends.
 *
 * <p>A completion is either normal, possibly refined by the outcome of a test, or an abrupt
 * transfer of control. Abrupt completions carry the label, case constant or exception type that
 * determines where control goes next.
 */
@AutoValue
public abstract class Completion {

  /** The kinds of completions. */
  public enum Kind {
    /** Evaluation finished with no outcome of interest. */
    NORMAL,
    /** A boolean-valued expression evaluated to {@link #getValue()}. */
    BOOLEAN,
    /** A nullable expression evaluated to null iff {@link #getValue()}. */
    NULLNESS,
    /** A pattern or case test matched iff {@link #getValue()}. */
    MATCHING,
    /** A {@code foreach} test found the collection exhausted iff {@link #getValue()}. */
    EMPTINESS,
    RETURN,
    BREAK,
    CONTINUE,
    GOTO_LABEL,
    GOTO_CASE,
    GOTO_DEFAULT,
    THROW,
    /** A call that never returns, such as a process exit. */
    EXIT;

    boolean isNormal() {
      return switch (this) {
        case NORMAL, BOOLEAN, NULLNESS, MATCHING, EMPTINESS -> true;
        default -> false;
      };
    }
  }

  private static final Completion NORMAL = of(Kind.NORMAL, false, null);
  private static final Completion RETURN = of(Kind.RETURN, false, null);
  private static final Completion GOTO_DEFAULT = of(Kind.GOTO_DEFAULT, false, null);
  private static final Completion EXIT = of(Kind.EXIT, false, null);

  public abstract Kind getKind();

  /** The outcome of a test; false for completions that are not test outcomes. */
  public abstract boolean getValue();

  /**
   * The target label of a break, continue or goto, the constant of a {@code goto case}, or the
   * exception type of a throw. Null for unlabeled breaks and continues and for other kinds.
   */
  public abstract @Nullable String getTarget();

  private static Completion of(Kind kind, boolean value, @Nullable String target) {
    return new AutoValue_Completion(kind, value, target);
  }

  public static Completion normal() {
    return NORMAL;
  }

  public static Completion ofBoolean(boolean value) {
    return of(Kind.BOOLEAN, value, null);
  }

  public static Completion nullness(boolean isNull) {
    return of(Kind.NULLNESS, isNull, null);
  }

  public static Completion matching(boolean matched) {
    return of(Kind.MATCHING, matched, null);
  }

  public static Completion emptiness(boolean isEmpty) {
    return of(Kind.EMPTINESS, isEmpty, null);
  }

  public static Completion returnCompletion() {
    return RETURN;
  }

  public static Completion breakCompletion(@Nullable String label) {
    return of(Kind.BREAK, false, label);
  }

  public static Completion continueCompletion(@Nullable String label) {
    return of(Kind.CONTINUE, false, label);
  }

  public static Completion gotoLabel(String label) {
    return of(Kind.GOTO_LABEL, false, checkNotNull(label));
  }

  /** A jump to the case labelled by a constant, keyed by its kind and value ({@code NUMBER 2}). */
  public static Completion gotoCase(String constantKey) {
    return of(Kind.GOTO_CASE, false, checkNotNull(constantKey));
  }

  public static Completion gotoDefault() {
    return GOTO_DEFAULT;
  }

  public static Completion throwCompletion(String exceptionType) {
    return of(Kind.THROW, false, checkNotNull(exceptionType));
  }

  public static Completion exit() {
    return EXIT;
  }

  /**
   * Whether this completion lets control continue with whatever follows the element, as opposed
   * to an abrupt transfer of control.
   */
  public final boolean isNormal() {
    return getKind().isNormal();
  }

  public final boolean isAbrupt() {
    return !isNormal();
  }

  public final boolean is(Kind kind) {
    return getKind() == kind;
  }

  public final boolean is(Kind kind, boolean value) {
    return getKind() == kind && getValue() == value;
  }

  /** Returns the thrown exception type. Only valid for {@link Kind#THROW}. */
  public final String getExceptionType() {
    checkState(is(Kind.THROW), this);
    return checkNotNull(getTarget());
  }

  /** Returns the completion of the same kind with the opposite outcome. */
  public final Completion negate() {
    return switch (getKind()) {
      case BOOLEAN -> ofBoolean(!getValue());
      case NULLNESS -> nullness(!getValue());
      case MATCHING -> matching(!getValue());
      case EMPTINESS -> emptiness(!getValue());
      default -> throw new IllegalArgumentException("Completion has no outcome: " + this);
    };
  }

  /** Returns the type of the edges that leave an element completing this way. */
  public final SuccessorType getSuccessorType() {
    return switch (getKind()) {
      case NORMAL -> SuccessorType.of(Branch.NORMAL);
      case BOOLEAN -> SuccessorType.of(getValue() ? Branch.TRUE : Branch.FALSE);
      case NULLNESS -> SuccessorType.of(getValue() ? Branch.NULL : Branch.NON_NULL);
      case MATCHING -> SuccessorType.of(getValue() ? Branch.MATCH : Branch.NO_MATCH);
      case EMPTINESS -> SuccessorType.of(getValue() ? Branch.EMPTY : Branch.NON_EMPTY);
      case RETURN -> SuccessorType.of(Branch.RETURN);
      case BREAK -> SuccessorType.of(Branch.BREAK);
      case CONTINUE -> SuccessorType.of(Branch.CONTINUE);
      case GOTO_LABEL -> SuccessorType.of(Branch.GOTO_LABEL);
      case GOTO_CASE -> SuccessorType.of(Branch.GOTO_CASE);
      case GOTO_DEFAULT -> SuccessorType.of(Branch.GOTO_DEFAULT);
      case THROW -> SuccessorType.exception(getExceptionType());
      case EXIT -> SuccessorType.of(Branch.EXIT);
    };
  }

  @Override
  public final String toString() {
    return switch (getKind()) {
      case BOOLEAN, NULLNESS, MATCHING, EMPTINESS -> getKind() + "(" + getValue() + ")";
      default -> getTarget() == null ? getKind().toString() : getKind() + "(" + getTarget() + ")";
    };
  }
}
