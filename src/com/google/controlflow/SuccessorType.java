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
import com.google.common.collect.Maps;
import com.google.controlflow.ControlFlowGraph.Branch;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The value of a control flow edge: the kind of branch taken, plus the exception type for {@link
 * Branch#EXCEPTION} edges.
 */
@AutoValue
public abstract class SuccessorType {

  private static final Map<Branch, SuccessorType> SIMPLE = createSimpleTypes();

  private static Map<Branch, SuccessorType> createSimpleTypes() {
    EnumMap<Branch, SuccessorType> types = Maps.newEnumMap(Branch.class);
    for (Branch branch : Branch.values()) {
      if (branch != Branch.EXCEPTION) {
        types.put(branch, new AutoValue_SuccessorType(branch, null));
      }
    }
    return types;
  }

  public abstract Branch getBranch();

  /** The type of the exception, for {@link Branch#EXCEPTION} edges only. */
  public abstract @Nullable String getExceptionType();

  public static SuccessorType of(Branch branch) {
    checkArgument(branch != Branch.EXCEPTION, "exception edges need a type");
    return SIMPLE.get(branch);
  }

  public static SuccessorType exception(String exceptionType) {
    return new AutoValue_SuccessorType(Branch.EXCEPTION, exceptionType);
  }

  public final boolean isConditional() {
    return getBranch().isConditional();
  }

  @Override
  public final String toString() {
    String exceptionType = getExceptionType();
    return exceptionType == null ? getBranch().toString() : getBranch() + "(" + exceptionType + ")";
  }
}
