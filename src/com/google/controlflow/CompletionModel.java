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
import static com.google.controlflow.ElementUtil.getCaughtType;
import static com.google.controlflow.ElementUtil.getConstantKey;
import static com.google.controlflow.ElementUtil.getContext;
import static com.google.controlflow.ElementUtil.getJumpLabel;
import static com.google.controlflow.ElementUtil.getThrownType;

import com.google.common.collect.ImmutableList;
import com.google.controlflow.ElementUtil.EvaluationContext;
import com.google.controlflow.Split.BooleanSplit;
import com.google.controlflow.Split.ExceptionHandlerSplit;
import com.google.controlflow.ast.Node;
import com.google.controlflow.ast.Token;
import com.google.controlflow.ast.TypeHierarchy;
import org.jspecify.annotations.Nullable;

/**
 * Enumerates the completions an element can have.
 *
 * <p>A completion that cannot occur for an element never produces an edge, so this model decides
 * which control flow nodes exist at all.
 */
public final class CompletionModel {

  private final TypeHierarchy typeHierarchy;
  private final @Nullable SplitTagger splitTagger;

  CompletionModel(TypeHierarchy typeHierarchy, @Nullable SplitTagger splitTagger) {
    this.typeHierarchy = typeHierarchy;
    this.splitTagger = splitTagger;
  }

  /** Creates a model that ignores boolean splitting. */
  public static CompletionModel create(TypeHierarchy typeHierarchy) {
    return new CompletionModel(typeHierarchy, null);
  }

  /** Whether {@code completion} is a possible completion of {@code element} in some context. */
  public boolean isValidFor(Completion completion, Node element) {
    return getCompletions(element, SplitSet.empty()).contains(completion);
  }

  /**
   * Returns every completion {@code element} can have when executed with the given splits. The
   * result is empty for nodes that are never control flow elements.
   */
  public ImmutableList<Completion> getCompletions(Node element, SplitSet splits) {
    if (!ElementUtil.isEvaluated(element) || ElementUtil.isTransparent(element)) {
      return ImmutableList.of();
    }
    switch (element.getToken()) {
      case CASE, SWITCH_ARM -> {
        return ElementUtil.isIrrefutable(element.getFirstChild())
            ? ImmutableList.of(Completion.matching(true))
            : ImmutableList.of(Completion.matching(true), Completion.matching(false));
      }
      case CATCH -> {
        return getCatchCompletions(element, splits);
      }
      case FOREACH -> {
        return ImmutableList.of(Completion.emptiness(true), Completion.emptiness(false));
      }
      case RETURN -> {
        return ImmutableList.of(Completion.returnCompletion());
      }
      case BREAK -> {
        return ImmutableList.of(Completion.breakCompletion(getJumpLabel(element)));
      }
      case CONTINUE -> {
        return ImmutableList.of(Completion.continueCompletion(getJumpLabel(element)));
      }
      case GOTO -> {
        return ImmutableList.of(Completion.gotoLabel(element.getString()));
      }
      case GOTO_CASE -> {
        return ImmutableList.of(
            Completion.gotoCase(checkNotNull(getConstantKey(element.getFirstChild()))));
      }
      case GOTO_DEFAULT -> {
        return ImmutableList.of(Completion.gotoDefault());
      }
      case THROW, THROW_EXPR -> {
        return ImmutableList.of(Completion.throwCompletion(getThrownType(element)));
      }
      case CALL -> {
        if (element.isNonReturning()) {
          return ImmutableList.of(Completion.exit());
        }
      }
      default -> {}
    }
    if (ElementUtil.isPreOrder(element)) {
      return ImmutableList.of(Completion.normal());
    }

    ImmutableList.Builder<Completion> completions = ImmutableList.builder();
    addValueCompletions(element, splits, completions);
    if (ElementUtil.isTried(element)) {
      String implicitThrow = getImplicitThrow(element);
      if (implicitThrow != null) {
        completions.add(Completion.throwCompletion(implicitThrow));
      }
    }
    return completions.build();
  }

  private void addValueCompletions(
      Node element, SplitSet splits, ImmutableList.Builder<Completion> completions) {
    EvaluationContext context = getContext(element);
    switch (context) {
      case BOOLEAN -> {
        Boolean known = getKnownValue(element, splits);
        if (known != null) {
          completions.add(Completion.ofBoolean(known));
        } else {
          completions.add(Completion.ofBoolean(true), Completion.ofBoolean(false));
        }
      }
      case NULLNESS -> {
        if (element.getToken() == Token.NULL) {
          completions.add(Completion.nullness(true));
        } else if (ElementUtil.isNeverNull(element)) {
          completions.add(Completion.nullness(false));
        } else {
          completions.add(Completion.nullness(true), Completion.nullness(false));
        }
      }
      case PLAIN -> completions.add(Completion.normal());
    }
  }

  /** Returns the value of a condition when it is fixed by a literal or a boolean split. */
  private @Nullable Boolean getKnownValue(Node condition, SplitSet splits) {
    if (condition.isTrue()) {
      return true;
    }
    if (condition.isFalse()) {
      return false;
    }
    if (splitTagger != null) {
      Node source = splitTagger.getBooleanSplitSource(condition);
      BooleanSplit split = source == null ? null : splits.getBooleanSplit(source);
      if (split != null) {
        return split.getValue();
      }
    }
    return null;
  }

  /**
   * Returns the type of the exception the runtime may raise while evaluating the element, or null
   * if it raises none.
   */
  static @Nullable String getImplicitThrow(Node element) {
    switch (element.getToken()) {
      case CALL, NEW -> {
        return TypeHierarchy.ROOT_EXCEPTION;
      }
      case CAST -> {
        return "System.InvalidCastException";
      }
      case DIV, MOD -> {
        return "System.DivideByZeroException";
      }
      case ASSIGN_OP -> {
        String op = element.getString();
        return "/=".equals(op) || "%=".equals(op) ? "System.DivideByZeroException" : null;
      }
      case GETELEM -> {
        return "System.IndexOutOfRangeException";
      }
      case GETPROP -> {
        Node qualifier = element.getQualifier();
        boolean mayBeNull =
            !element.isConditionalAccess()
                && qualifier != null
                && !qualifier.isTypeRef()
                && qualifier.getToken() != Token.THIS;
        return mayBeNull ? "System.NullReferenceException" : null;
      }
      case NEW_ARRAY -> {
        return ElementUtil.hasArrayLengths(element) ? "System.OverflowException" : null;
      }
      default -> {
        return null;
      }
    }
  }

  private ImmutableList<Completion> getCatchCompletions(Node catchNode, SplitSet splits) {
    String caught = getCaughtType(catchNode);
    if (caught == null || caught.equals(TypeHierarchy.ROOT_EXCEPTION)) {
      return ImmutableList.of(Completion.matching(true));
    }
    ExceptionHandlerSplit split = splits.getExceptionHandlerSplit(catchNode.getParent());
    if (split == null) {
      return ImmutableList.of(Completion.matching(true), Completion.matching(false));
    }
    String thrown = split.getExceptionType();
    if (typeHierarchy.isSubtype(thrown, caught)) {
      return ImmutableList.of(Completion.matching(true));
    }
    if (typeHierarchy.isSubtype(caught, thrown)) {
      // The runtime type of the exception may be the more specific caught type.
      return ImmutableList.of(Completion.matching(true), Completion.matching(false));
    }
    return ImmutableList.of(Completion.matching(false));
  }
}
