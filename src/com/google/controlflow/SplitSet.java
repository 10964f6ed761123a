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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.controlflow.Split.BooleanSplit;
import com.google.controlflow.Split.ExceptionHandlerSplit;
import com.google.controlflow.Split.FinallySplit;
import com.google.controlflow.ast.Node;
import java.util.Collection;
import java.util.Comparator;
import org.jspecify.annotations.Nullable;

/**
 * An immutable set of splits in canonical order, so that two nodes reached in the same context
 * compare equal.
 */
@AutoValue
public abstract class SplitSet {

  private static final SplitSet EMPTY = new AutoValue_SplitSet(ImmutableList.of());

  public abstract ImmutableList<Split> getSplits();

  public static SplitSet empty() {
    return EMPTY;
  }

  /** Creates a split set, sorting the splits with the given canonical order. */
  static SplitSet of(Collection<? extends Split> splits, Comparator<Split> canonicalOrder) {
    if (splits.isEmpty()) {
      return EMPTY;
    }
    return new AutoValue_SplitSet(
        splits.stream().sorted(canonicalOrder).distinct().collect(toImmutableList()));
  }

  public final boolean isEmpty() {
    return getSplits().isEmpty();
  }

  public final @Nullable FinallySplit getFinallySplit(Node tryStatement) {
    for (Split split : getSplits()) {
      if (split instanceof FinallySplit && split.getAnchor() == tryStatement) {
        return (FinallySplit) split;
      }
    }
    return null;
  }

  public final @Nullable ExceptionHandlerSplit getExceptionHandlerSplit(Node tryStatement) {
    for (Split split : getSplits()) {
      if (split instanceof ExceptionHandlerSplit && split.getAnchor() == tryStatement) {
        return (ExceptionHandlerSplit) split;
      }
    }
    return null;
  }

  public final @Nullable BooleanSplit getBooleanSplit(Node condition) {
    for (Split split : getSplits()) {
      if (split instanceof BooleanSplit && split.getAnchor() == condition) {
        return (BooleanSplit) split;
      }
    }
    return null;
  }

  @Override
  public final String toString() {
    return getSplits().toString();
  }
}
