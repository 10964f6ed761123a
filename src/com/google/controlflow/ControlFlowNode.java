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
import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.controlflow.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * A node of a {@link ControlFlowGraph}: the entry or exit of a callable, or the execution of an
 * AST element in a given split context.
 */
@AutoValue
public abstract class ControlFlowNode {

  /** The kinds of control flow nodes. */
  public enum Kind {
    ENTRY,
    EXIT,
    ELEMENT
  }

  public abstract Kind getKind();

  /** The method, constructor or lambda this node belongs to. */
  public abstract Node getCallable();

  abstract @Nullable Node getElementOrNull();

  public abstract SplitSet getSplits();

  public static ControlFlowNode entry(Node callable) {
    checkArgument(callable.isCallable(), callable);
    return new AutoValue_ControlFlowNode(Kind.ENTRY, callable, null, SplitSet.empty());
  }

  public static ControlFlowNode exit(Node callable) {
    checkArgument(callable.isCallable(), callable);
    return new AutoValue_ControlFlowNode(Kind.EXIT, callable, null, SplitSet.empty());
  }

  public static ControlFlowNode element(Node callable, Node element, SplitSet splits) {
    return new AutoValue_ControlFlowNode(Kind.ELEMENT, callable, element, splits);
  }

  public final boolean isEntry() {
    return getKind() == Kind.ENTRY;
  }

  public final boolean isExit() {
    return getKind() == Kind.EXIT;
  }

  public final boolean isElement() {
    return getKind() == Kind.ELEMENT;
  }

  /** Returns the AST element of an element node. */
  public final Node getElement() {
    Node element = getElementOrNull();
    checkState(element != null, "%s has no element", this);
    return element;
  }

  private String callableName() {
    Node callable = getCallable();
    return callable.isLambda() ? "lambda" : callable.getFirstChild().getString();
  }

  @Override
  public final String toString() {
    return switch (getKind()) {
      case ENTRY -> "entry " + callableName();
      case EXIT -> "exit " + callableName();
      case ELEMENT ->
          getSplits().isEmpty() ? getElement().toString() : getElement() + " " + getSplits();
    };
  }
}
