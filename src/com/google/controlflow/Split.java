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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.controlflow.ast.Node;

/**
 * A tag that distinguishes several control flow nodes for the same AST element.
 *
 * <p>Each split is anchored at an AST node and is only carried by control flow nodes whose element
 * lies inside the split's region.
 */
public abstract class Split {

  /** The kinds of splits, in the order they appear in a {@link SplitSet}. */
  public enum Kind {
    FINALLY,
    EXCEPTION_HANDLER,
    BOOLEAN
  }

  Split() {}

  public abstract Kind getKind();

  /** The AST node the split is anchored at: a try statement or a condition. */
  public abstract Node getAnchor();

  public static FinallySplit finallySplit(Node tryStatement, Completion suspended) {
    checkArgument(tryStatement.isTry(), tryStatement);
    checkArgument(suspended.isAbrupt(), "normal completions do not suspend: %s", suspended);
    return new AutoValue_Split_FinallySplit(tryStatement, suspended);
  }

  public static ExceptionHandlerSplit exceptionHandlerSplit(
      Node tryStatement, String exceptionType) {
    checkArgument(tryStatement.isTry(), tryStatement);
    return new AutoValue_Split_ExceptionHandlerSplit(tryStatement, exceptionType);
  }

  public static BooleanSplit booleanSplit(Node condition, boolean value) {
    return new AutoValue_Split_BooleanSplit(condition, value);
  }

  /**
   * Marks execution of a {@code finally} block that was entered with an abrupt completion. The
   * completion resumes when the block completes normally.
   */
  @AutoValue
  public abstract static class FinallySplit extends Split {

    public abstract Node getTryStatement();

    public abstract Completion getCompletion();

    @Override
    public final Kind getKind() {
      return Kind.FINALLY;
    }

    @Override
    public final Node getAnchor() {
      return getTryStatement();
    }

    @Override
    public final String toString() {
      return "finally:" + getCompletion();
    }
  }

  /** Marks the search for a catch clause able to handle an exception of the given type. */
  @AutoValue
  public abstract static class ExceptionHandlerSplit extends Split {

    public abstract Node getTryStatement();

    public abstract String getExceptionType();

    @Override
    public final Kind getKind() {
      return Kind.EXCEPTION_HANDLER;
    }

    @Override
    public final Node getAnchor() {
      return getTryStatement();
    }

    @Override
    public final String toString() {
      return "exception:" + getExceptionType();
    }
  }

  /** Records the value a condition had, for a later test of the same variable. */
  @AutoValue
  public abstract static class BooleanSplit extends Split {

    public abstract Node getCondition();

    public abstract boolean getValue();

    @Override
    public final Kind getKind() {
      return Kind.BOOLEAN;
    }

    @Override
    public final Node getAnchor() {
      return getCondition();
    }

    @Override
    public final String toString() {
      return getCondition().getString() + ":" + getValue();
    }
  }
}
