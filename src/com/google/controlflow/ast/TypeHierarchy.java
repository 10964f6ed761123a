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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers subtype questions about exception types. The control flow builder only needs this to
 * decide whether a thrown exception can be caught by a catch clause.
 *
 * <p>Types are identified by their fully qualified names. Every type is a subtype of itself and of
 * {@link #ROOT_EXCEPTION}.
 */
public final class TypeHierarchy {

  public static final String ROOT_EXCEPTION = "System.Exception";

  private static final TypeHierarchy STANDARD =
      builder()
          .addSupertype("System.SystemException", ROOT_EXCEPTION)
          .addSupertype("System.ArithmeticException", "System.SystemException")
          .addSupertype("System.DivideByZeroException", "System.ArithmeticException")
          .addSupertype("System.OverflowException", "System.ArithmeticException")
          .addSupertype("System.InvalidCastException", "System.SystemException")
          .addSupertype("System.NullReferenceException", "System.SystemException")
          .addSupertype("System.IndexOutOfRangeException", "System.SystemException")
          .addSupertype("System.InvalidOperationException", "System.SystemException")
          .addSupertype("System.ArgumentException", "System.SystemException")
          .addSupertype("System.ArgumentNullException", "System.ArgumentException")
          .addSupertype("System.IO.IOException", "System.SystemException")
          .build();

  private final ImmutableMap<String, String> supertypes;

  private TypeHierarchy(Map<String, String> supertypes) {
    this.supertypes = ImmutableMap.copyOf(supertypes);
  }

  /** Returns a hierarchy of the exceptions raised implicitly by the evaluation of expressions. */
  public static TypeHierarchy standard() {
    return STANDARD;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder seeded with the types of this hierarchy. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.supertypes.putAll(supertypes);
    return builder;
  }

  /** Whether {@code subtype} is {@code supertype} or inherits from it. */
  public boolean isSubtype(String subtype, String supertype) {
    if (supertype.equals(ROOT_EXCEPTION)) {
      return true;
    }
    // Bounded: declarations may be cyclic.
    int steps = supertypes.size() + 1;
    for (String t = subtype; t != null && steps >= 0; t = supertypes.get(t), steps--) {
      if (t.equals(supertype)) {
        return true;
      }
    }
    return false;
  }

  /** Configures a {@link TypeHierarchy}. */
  public static final class Builder {
    private final Map<String, String> supertypes = new LinkedHashMap<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addSupertype(String type, String supertype) {
      checkArgument(!type.equals(ROOT_EXCEPTION), "%s has no supertype", type);
      checkArgument(!type.equals(supertype), "%s cannot extend itself", type);
      supertypes.put(type, supertype);
      return this;
    }

    public TypeHierarchy build() {
      return new TypeHierarchy(supertypes);
    }
  }
}
