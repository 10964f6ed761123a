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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.controlflow.ElementUtil.findCase;
import static com.google.controlflow.ElementUtil.findLabel;
import static com.google.controlflow.ElementUtil.getCallableBody;
import static com.google.controlflow.ElementUtil.getCatchBody;
import static com.google.controlflow.ElementUtil.getCatchFilter;
import static com.google.controlflow.ElementUtil.getConstructorInitializer;
import static com.google.controlflow.ElementUtil.getDefaultCase;
import static com.google.controlflow.ElementUtil.getFinallyBlock;
import static com.google.controlflow.ElementUtil.getFirstCatch;
import static com.google.controlflow.ElementUtil.getGuard;
import static com.google.controlflow.ElementUtil.getNextCase;
import static com.google.controlflow.ElementUtil.getNextCatch;
import static com.google.controlflow.ElementUtil.getSectionBody;
import static com.google.controlflow.ElementUtil.matchLabel;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.controlflow.Completion.Kind;
import com.google.controlflow.ControlFlowGraph.Branch;
import com.google.controlflow.ElementUtil.EvaluationContext;
import com.google.controlflow.Split.ExceptionHandlerSplit;
import com.google.controlflow.Split.FinallySplit;
import com.google.controlflow.ast.Node;
import com.google.controlflow.ast.Token;
import com.google.controlflow.ast.TypeHierarchy;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Computes the control flow graph of a method, constructor or lambda.
 *
 * <p>Each AST element that can be evaluated becomes a node once for every split context it is
 * reached in. Control enters an element at {@link #first}, the element completes in one of the
 * ways the {@link CompletionModel} allows, and {@link #succ} routes each completion to the nodes
 * executed next. The routing walks up the tree from the completing element, so the innermost
 * enclosing construct that handles a completion decides where it goes. Only nodes reachable from
 * the entry are ever created.
 */
public final class ControlFlowAnalysis {

  private static final Logger logger = Logger.getLogger(ControlFlowAnalysis.class.getName());

  /** Thrown when a switch expression has no matching arm. */
  static final String NO_MATCHING_ARM = "System.InvalidOperationException";

  private final Node callable;
  private final boolean continueAfterErrors;
  private final SplitTagger splitTagger;
  private final CompletionModel completionModel;

  /**
   * Constructor. Should only be called from within the {@link Builder}
   *
   * @param callable The method, constructor or lambda to analyze.
   * @param typeHierarchy Decides which catch clauses handle a thrown type.
   * @param booleanSplitting Whether repeated tests of a variable are correlated.
   * @param continueAfterErrors Whether unroutable completions are logged instead of thrown.
   */
  private ControlFlowAnalysis(
      Node callable,
      TypeHierarchy typeHierarchy,
      boolean booleanSplitting,
      boolean continueAfterErrors) {
    this.callable = callable;
    this.continueAfterErrors = continueAfterErrors;
    this.splitTagger = new SplitTagger(callable, booleanSplitting);
    this.completionModel = new CompletionModel(typeHierarchy, splitTagger);
  }

  /**
   * Configures a {@link ControlFlowAnalysis} instance then computes the {@link ControlFlowGraph}
   */
  public static final class Builder {
    private Node cfgRoot;
    private TypeHierarchy typeHierarchy = TypeHierarchy.standard();
    private boolean booleanSplitting = true;
    private boolean continueAfterErrors = false;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCfgRoot(Node cfgRoot) {
      this.cfgRoot = cfgRoot;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTypeHierarchy(TypeHierarchy typeHierarchy) {
      this.typeHierarchy = checkNotNull(typeHierarchy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBooleanSplitting(boolean booleanSplitting) {
      this.booleanSplitting = booleanSplitting;
      return this;
    }

    /**
     * When set, a completion that no enclosing construct can route is logged and dropped instead
     * of failing the analysis.
     */
    @CanIgnoreReturnValue
    public Builder setContinueAfterErrors(boolean continueAfterErrors) {
      this.continueAfterErrors = continueAfterErrors;
      return this;
    }

    /** Creates the analysis without computing the graph, for element level queries. */
    public ControlFlowAnalysis build() {
      checkNotNull(cfgRoot, "Need to call setCfgRoot()");
      checkArgument(cfgRoot.isCallable(), "Unexpected control flow graph root %s", cfgRoot);
      return new ControlFlowAnalysis(
          cfgRoot, typeHierarchy, booleanSplitting, continueAfterErrors);
    }

    public ControlFlowGraph computeCfg() {
      return build().computeCfg();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public Node getCallable() {
    return callable;
  }

  public CompletionModel getCompletionModel() {
    return completionModel;
  }

  /** A node reached from a completion, with the type of the edge leading to it. */
  @AutoValue
  public abstract static class Successor {
    public abstract ControlFlowNode getNode();

    public abstract SuccessorType getType();

    static Successor create(ControlFlowNode node, SuccessorType type) {
      return new AutoValue_ControlFlowAnalysis_Successor(node, type);
    }

    @Override
    public final String toString() {
      return getType() + " -> " + getNode();
    }
  }

  /** Builds the graph of every node reachable from the entry. */
  public ControlFlowGraph computeCfg() {
    ControlFlowGraph cfg = new ControlFlowGraph(callable);
    Deque<ControlFlowNode> worklist = new ArrayDeque<>();
    ControlFlowNode start = succEntry();
    cfg.createNode(start);
    cfg.connect(cfg.getEntry(), SuccessorType.of(Branch.NORMAL), start);
    worklist.add(start);
    int edgeCount = 1;
    while (!worklist.isEmpty()) {
      ControlFlowNode node = worklist.remove();
      for (Completion completion :
          completionModel.getCompletions(node.getElement(), node.getSplits())) {
        for (Successor successor : route(node, completion, null).getSuccessors()) {
          ControlFlowNode target = successor.getNode();
          if (!cfg.hasNode(target)) {
            cfg.createNode(target);
            if (target.isElement()) {
              worklist.add(target);
            }
          }
          if (cfg.connectIfNotFound(node, successor.getType(), target)) {
            edgeCount++;
          }
        }
      }
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Computed control flow graph of "
              + cfg.getEntry()
              + " with "
              + cfg.getNodeCount()
              + " nodes and "
              + edgeCount
              + " edges");
    }
    return cfg;
  }

  /** Returns the first node executed after the entry of the callable. */
  public ControlFlowNode succEntry() {
    Node initializer = getConstructorInitializer(callable);
    Node start = initializer != null ? initializer : getCallableBody(callable);
    return ControlFlowNode.element(callable, computeFallThrough(start), SplitSet.empty());
  }

  /**
   * Returns the type of the edge from {@code element} to the exit of the callable when the body
   * of the callable completes with {@code completion} at {@code element}, or null if it cannot.
   */
  public @Nullable SuccessorType succExit(Node element, Completion completion) {
    if (!last(getCallableBody(callable)).containsEntry(element, completion)) {
      return null;
    }
    switch (completion.getKind()) {
      case BREAK, CONTINUE, GOTO_LABEL, GOTO_CASE, GOTO_DEFAULT -> {
        reportInternalError(completion + " at " + element + " leaves " + callable);
        return null;
      }
      default -> {
        return completion.getSuccessorType();
      }
    }
  }

  /** Returns the successors of {@code node} when its element completes with {@code completion}. */
  public ImmutableList<Successor> succ(ControlFlowNode node, Completion completion) {
    checkArgument(node.isElement(), "%s has no successors of its own", node);
    checkArgument(
        completionModel.getCompletions(node.getElement(), node.getSplits()).contains(completion),
        "%s cannot complete with %s",
        node,
        completion);
    return route(node, completion, null).getSuccessors();
  }

  /** Returns the node that is executed first when control enters {@code element}. */
  public Node first(Node element) {
    checkArgument(ElementUtil.isEvaluated(element), "%s is never evaluated", element);
    return computeFallThrough(element);
  }

  /**
   * Returns the ways control leaves {@code element}: the inner element that completes last,
   * mapped to the completion of {@code element} it causes.
   */
  public ImmutableSetMultimap<Node, Completion> last(Node element) {
    checkArgument(element != callable && isInCallable(element), "%s is not an element", element);
    ImmutableSetMultimap.Builder<Node, Completion> result = ImmutableSetMultimap.builder();
    if (!ElementUtil.isEvaluated(element)) {
      return result.build();
    }
    ControlFlowNode start =
        ControlFlowNode.element(callable, computeFallThrough(element), SplitSet.empty());
    Set<ControlFlowNode> seen = new HashSet<>();
    Deque<ControlFlowNode> worklist = new ArrayDeque<>();
    seen.add(start);
    worklist.add(start);
    while (!worklist.isEmpty()) {
      ControlFlowNode node = worklist.remove();
      for (Completion completion :
          completionModel.getCompletions(node.getElement(), node.getSplits())) {
        Walk walk = route(node, completion, element);
        for (Completion escaped : walk.escapes) {
          result.put(node.getElement(), escaped);
        }
        for (Successor successor : walk.getSuccessors()) {
          ControlFlowNode target = successor.getNode();
          if (target.isElement() && seen.add(target)) {
            worklist.add(target);
          }
        }
      }
    }
    return result.build();
  }

  private boolean isInCallable(Node element) {
    for (Node n = element.getParent(); n != null; n = n.getParent()) {
      if (n.isCallable()) {
        return n == callable;
      }
    }
    return false;
  }

  private Walk route(ControlFlowNode node, Completion completion, @Nullable Node boundary) {
    Node element = node.getElement();
    List<Split> created = new ArrayList<>();
    if (completion.is(Kind.BOOLEAN) && splitTagger.isBooleanSplitSource(element)) {
      created.add(Split.booleanSplit(element, completion.getValue()));
    }
    Walk walk = new Walk(node.getSplits(), created, boundary);
    walk.complete(element, new Route(completion, completion.getSuccessorType()));
    return walk;
  }

  /**
   * Computes the node that control enters first when it enters {@code n}. Pre-order elements and
   * tests are entered themselves; post-order elements are entered through their first evaluated
   * operand.
   */
  static Node computeFallThrough(Node n) {
    if (ElementUtil.isPreOrder(n) || ElementUtil.isMatchingTest(n)) {
      return n;
    }
    switch (n.getToken()) {
      case FOREACH:
        return computeFallThrough(n.getSecondChild());
      case AND:
      case OR:
      case COALESCE:
      case HOOK:
      case NOT:
      case SWITCH_EXPR:
      case ASSIGN_COALESCE:
        return computeFallThrough(n.getFirstChild());
      default:
        ImmutableList<Node> children = ElementUtil.getEvaluatedChildren(n);
        return children.isEmpty() ? n : computeFallThrough(children.get(0));
    }
  }

  private void reportInternalError(String message) {
    if (!continueAfterErrors) {
      throw new IllegalStateException(message);
    }
    logger.warning("Dropping unroutable completion: " + message);
  }

  /** A completion being routed, and the type of the edge it will produce. */
  private record Route(Completion completion, SuccessorType edgeType) {
    Route asNormal() {
      return completion.is(Kind.NORMAL) ? this : new Route(Completion.normal(), edgeType);
    }

    Route with(Completion other) {
      return new Route(other, edgeType);
    }

    boolean isNormal() {
      return completion.isNormal();
    }

    boolean isTrue() {
      return completion.is(Kind.BOOLEAN, true);
    }

    boolean is(Kind kind) {
      return completion.is(kind);
    }
  }

  /**
   * Routes one completion of one node. When a boundary is given, completions that leave the
   * boundary element are recorded as escapes instead of being routed further.
   */
  private final class Walk {
    private final SplitSet splits;
    private final List<Split> created;
    private final @Nullable Node boundary;
    private final ImmutableSet.Builder<Successor> successors = ImmutableSet.builder();
    private final List<Completion> escapes = new ArrayList<>();

    Walk(SplitSet splits, List<Split> created, @Nullable Node boundary) {
      this.splits = splits;
      this.created = created;
      this.boundary = boundary;
    }

    ImmutableList<Successor> getSuccessors() {
      return successors.build().asList();
    }

    private void emit(Node target, SuccessorType type, List<Split> added) {
      List<Split> all = added;
      if (!created.isEmpty()) {
        all = new ArrayList<>(created);
        all.addAll(added);
      }
      SplitSet targetSplits = splitTagger.getSuccessorSplits(splits, target, all);
      successors.add(
          Successor.create(ControlFlowNode.element(callable, target, targetSplits), type));
    }

    private void emit(Node target, Route r) {
      emit(target, r.edgeType(), ImmutableList.of());
    }

    private void enter(Node n, Route r) {
      emit(computeFallThrough(n), r.edgeType(), ImmutableList.of());
    }

    private void enter(Node n, Route r, Split added) {
      emit(computeFallThrough(n), r.edgeType(), ImmutableList.of(added));
    }

    private void toExit(Route r) {
      successors.add(Successor.create(ControlFlowNode.exit(callable), r.edgeType()));
    }

    /** Routes a completion of the element's own node. */
    void complete(Node element, Route r) {
      switch (element.getToken()) {
        case FOREACH -> {
          if (r.completion().is(Kind.EMPTINESS, true)) {
            leave(element, r.asNormal());
          } else {
            enter(element.getFirstChild(), r);
          }
          return;
        }
        case CASE -> {
          if (r.completion().is(Kind.MATCHING, true)) {
            Node guard = getGuard(element);
            enter(guard != null ? guard : getSectionBody(element), r);
          } else {
            caseNoMatch(element, r);
          }
          return;
        }
        case SWITCH_ARM -> {
          if (r.completion().is(Kind.MATCHING, true)) {
            Node guard = getGuard(element);
            enter(guard != null ? guard : element.getLastChild(), r);
          } else {
            armNoMatch(element, r);
          }
          return;
        }
        case CATCH -> {
          if (r.completion().is(Kind.MATCHING, true)) {
            Node filter = getCatchFilter(element);
            enter(filter != null ? filter : getCatchBody(element), r);
          } else {
            catchNoMatch(element, r);
          }
          return;
        }
        default -> {}
      }
      if (ElementUtil.isPreOrder(element) && r.isNormal()) {
        enterChildren(element, r);
      } else {
        leave(element, r);
      }
    }

    /** Control passes from a pre-order element into its first part. */
    private void enterChildren(Node n, Route r) {
      switch (n.getToken()) {
        case BLOCK -> {
          if (n.hasChildren()) {
            enter(n.getFirstChild(), r);
          } else {
            leave(n, r);
          }
        }
        case EMPTY -> leave(n, r);
        case EXPR_RESULT, VAR, IF, WHILE, DO, SWITCH, TRY -> enter(n.getFirstChild(), r);
        case LABEL, DEFAULT_CASE -> enter(n.getLastChild(), r);
        case FOR -> enter(getForStart(n), r);
        case NEW_ARRAY -> {
          Node initializer = n.getLastChild();
          if (initializer.getToken() == Token.ARRAY_LIT) {
            enter(initializer, r);
          } else {
            leave(n, r);
          }
        }
        default -> throw new IllegalStateException("Unexpected pre-order element " + n);
      }
    }

    /** The part of a for loop that runs first: the initializer, else the loop test. */
    private Node getForStart(Node forNode) {
      Node init = forNode.getFirstChild();
      return ElementUtil.isEvaluated(init) ? init : getForTest(forNode);
    }

    /** The part that decides another iteration: the condition, else the body. */
    private Node getForTest(Node forNode) {
      Node cond = forNode.getSecondChild();
      return ElementUtil.isEvaluated(cond) ? cond : forNode.getLastChild();
    }

    /** The part that runs after an iteration of the body: the update, else the loop test. */
    private Node getForIterationEnd(Node forNode) {
      Node update = forNode.getSecondChild().getNext();
      return ElementUtil.isEvaluated(update) ? update : getForTest(forNode);
    }

    /** Control leaves {@code n}; its parent decides what runs next. */
    private void leave(Node n, Route r) {
      if (r.is(Kind.EXIT)) {
        if (boundary != null) {
          escapes.add(r.completion());
        } else {
          toExit(r);
        }
        return;
      }
      if (n == boundary) {
        escapes.add(r.completion());
        return;
      }
      Node parent = n.getParent();
      if (parent == null) {
        reportInternalError(r.completion() + " leaves the root " + n);
        return;
      }
      if (parent == callable) {
        leaveCallable(n, r);
        return;
      }
      switch (parent.getToken()) {
        case BLOCK -> leaveBlockStatement(parent, n, r);
        case EXPR_RESULT -> leave(parent, r.isNormal() ? r.asNormal() : r);
        case VAR -> leaveSequence(parent, n, r);
        case LABEL -> leaveLabel(parent, r);
        case IF -> leaveIf(parent, n, r);
        case WHILE -> leaveWhile(parent, n, r);
        case DO -> leaveDo(parent, n, r);
        case FOR -> leaveFor(parent, n, r);
        case FOREACH -> leaveForEach(parent, n, r);
        case SWITCH -> leaveSwitch(parent, n, r);
        case CASE, DEFAULT_CASE -> leaveSection(parent, n, r);
        case TRY -> leaveTry(parent, n, r);
        case CATCH -> leaveCatch(parent, n, r);
        case SWITCH_EXPR -> leaveSwitchExpression(parent, n, r);
        case SWITCH_ARM -> leaveArm(parent, n, r);
        case AND, OR -> leaveShortCircuit(parent, n, r);
        case COALESCE -> leaveCoalesce(parent, n, r);
        case HOOK -> leaveHook(parent, n, r);
        case ASSIGN_COALESCE -> leaveAssignCoalesce(parent, n, r);
        case NEW_ARRAY -> {
          if (ElementUtil.isPreOrder(parent)) {
            // The initializer of an array creation without lengths.
            leave(parent, r);
          } else {
            leaveOperand(parent, n, r);
          }
        }
        case NOT -> {
          if (ElementUtil.isTransparent(parent) && r.is(Kind.BOOLEAN)) {
            leave(parent, r.with(r.completion().negate()));
          } else {
            leaveOperand(parent, n, r);
          }
        }
        default -> leaveOperand(parent, n, r);
      }
    }

    private void leaveCallable(Node n, Route r) {
      if (n == getConstructorInitializer(callable) && r.isNormal()) {
        enter(getCallableBody(callable), r);
        return;
      }
      switch (r.completion().getKind()) {
        case BREAK, CONTINUE, GOTO_LABEL, GOTO_CASE, GOTO_DEFAULT ->
            reportInternalError(r.completion() + " has no target in " + callable);
        default -> toExit(r);
      }
    }

    private void leaveBlockStatement(Node block, Node n, Route r) {
      if (r.isNormal()) {
        Node next = n.getNext();
        if (next != null) {
          enter(next, r.asNormal());
        } else {
          leave(block, r.asNormal());
        }
      } else if (r.is(Kind.GOTO_LABEL)) {
        Node label = findLabel(block, r.completion().getTarget());
        if (label != null) {
          enter(label, r);
        } else {
          leave(block, r);
        }
      } else {
        leave(block, r);
      }
    }

    /** Declarators of a VAR run in order. */
    private void leaveSequence(Node parent, Node n, Route r) {
      if (r.isNormal() && n.getNext() != null) {
        enter(n.getNext(), r.asNormal());
      } else {
        leave(parent, r.isNormal() ? r.asNormal() : r);
      }
    }

    private void leaveLabel(Node label, Route r) {
      if (r.isNormal()) {
        leave(label, r.asNormal());
      } else if (r.is(Kind.BREAK)
          && label.getFirstChild().getString().equals(r.completion().getTarget())) {
        leave(label, r.asNormal());
      } else {
        leave(label, r);
      }
    }

    private void leaveIf(Node ifNode, Node n, Route r) {
      if (!r.isNormal()) {
        leave(ifNode, r);
      } else if (n == ifNode.getFirstChild()) {
        if (r.isTrue()) {
          enter(n.getNext(), r);
        } else if (n.getNext().getNext() != null) {
          enter(n.getNext().getNext(), r);
        } else {
          leave(ifNode, r.asNormal());
        }
      } else {
        leave(ifNode, r.asNormal());
      }
    }

    /**
     * Whether a completion of a loop body runs the loop again. Other completions are routed out
     * of the loop.
     */
    private boolean continuesLoop(Node loop, Route r) {
      Completion c = r.completion();
      if (r.isNormal() || (c.is(Kind.CONTINUE) && matchLabel(loop, c.getTarget()))) {
        return true;
      }
      if (c.is(Kind.BREAK) && matchLabel(loop, c.getTarget())) {
        leave(loop, r.asNormal());
      } else {
        leave(loop, r);
      }
      return false;
    }

    /** Routes the outcome of a loop condition. */
    private void leaveLoopCondition(Node loop, Node body, Route r) {
      if (!r.isNormal()) {
        leave(loop, r);
      } else if (r.isTrue()) {
        enter(body, r);
      } else {
        leave(loop, r.asNormal());
      }
    }

    private void leaveWhile(Node whileNode, Node n, Route r) {
      if (n == whileNode.getFirstChild()) {
        leaveLoopCondition(whileNode, whileNode.getLastChild(), r);
      } else if (continuesLoop(whileNode, r)) {
        enter(whileNode.getFirstChild(), r);
      }
    }

    private void leaveDo(Node doNode, Node n, Route r) {
      if (n == doNode.getLastChild()) {
        leaveLoopCondition(doNode, doNode.getFirstChild(), r);
      } else if (continuesLoop(doNode, r)) {
        enter(doNode.getLastChild(), r);
      }
    }

    private void leaveFor(Node forNode, Node n, Route r) {
      Node cond = forNode.getSecondChild();
      Node body = forNode.getLastChild();
      if (n == body) {
        if (continuesLoop(forNode, r)) {
          enter(getForIterationEnd(forNode), r);
        }
      } else if (!r.isNormal()) {
        leave(forNode, r);
      } else if (n == cond) {
        leaveLoopCondition(forNode, body, r);
      } else {
        // The initializer or the update.
        enter(getForTest(forNode), r);
      }
    }

    private void leaveForEach(Node forEach, Node n, Route r) {
      if (n == forEach.getLastChild()) {
        if (continuesLoop(forEach, r)) {
          emit(forEach, r);
        }
      } else if (!r.isNormal()) {
        leave(forEach, r);
      } else if (n == forEach.getFirstChild()) {
        enter(forEach.getLastChild(), r);
      } else {
        emit(forEach, r);
      }
    }

    private void leaveSwitch(Node switchNode, Node n, Route r) {
      Completion c = r.completion();
      if (n == switchNode.getFirstChild()) {
        if (!r.isNormal()) {
          leave(switchNode, r);
          return;
        }
        Node firstCase = getNextCase(n.getNext());
        Node defaultCase = getDefaultCase(switchNode);
        if (firstCase != null) {
          emit(firstCase, r);
        } else if (defaultCase != null) {
          enter(defaultCase, r);
        } else {
          leave(switchNode, r.asNormal());
        }
        return;
      }
      switch (c.getKind()) {
        case BREAK -> {
          if (matchLabel(switchNode, c.getTarget())) {
            leave(switchNode, r.asNormal());
          } else {
            leave(switchNode, r);
          }
        }
        case GOTO_CASE -> {
          Node target = findCase(switchNode, c.getTarget());
          if (target != null) {
            enter(getSectionBody(target), r);
          } else {
            leave(switchNode, r);
          }
        }
        case GOTO_DEFAULT -> {
          Node target = getDefaultCase(switchNode);
          if (target != null) {
            enter(getSectionBody(target), r);
          } else {
            leave(switchNode, r);
          }
        }
        default -> leave(switchNode, r.isNormal() ? r.asNormal() : r);
      }
    }

    private void leaveSection(Node section, Node n, Route r) {
      if (section.isCase() && n == section.getSecondChild()) {
        if (!r.isNormal()) {
          leave(section, r);
        } else if (r.isTrue()) {
          enter(getSectionBody(section), r);
        } else {
          caseNoMatch(section, r);
        }
      } else if (r.isNormal()) {
        Node next = section.getNext();
        if (next != null) {
          enter(getSectionBody(next), r.asNormal());
        } else {
          leave(section.getParent(), r.asNormal());
        }
      } else {
        leave(section, r);
      }
    }

    /** The case did not match: try the next case, then the default section. */
    private void caseNoMatch(Node caseNode, Route r) {
      Node switchNode = caseNode.getParent();
      Node next = getNextCase(caseNode.getNext());
      Node defaultCase = getDefaultCase(switchNode);
      if (next != null) {
        emit(next, r);
      } else if (defaultCase != null) {
        enter(defaultCase, r);
      } else {
        leave(switchNode, r.asNormal());
      }
    }

    private void leaveSwitchExpression(Node switchExpr, Node n, Route r) {
      if (n == switchExpr.getFirstChild() && r.isNormal()) {
        emit(n.getNext(), r);
      } else {
        leave(switchExpr, r);
      }
    }

    private void leaveArm(Node arm, Node n, Route r) {
      if (!r.isNormal()) {
        leave(arm, r);
      } else if (n == arm.getLastChild()) {
        emit(arm.getParent(), r);
      } else if (r.isTrue()) {
        enter(arm.getLastChild(), r);
      } else {
        armNoMatch(arm, r);
      }
    }

    /** The arm did not match: try the next arm, or fail the switch expression. */
    private void armNoMatch(Node arm, Route r) {
      Node next = arm.getNext();
      if (next != null) {
        emit(next, r);
      } else {
        leave(arm.getParent(), r.with(Completion.throwCompletion(NO_MATCHING_ARM)));
      }
    }

    private void leaveTry(Node tryNode, Node n, Route r) {
      Node finallyBlock = getFinallyBlock(tryNode);
      if (n == finallyBlock) {
        if (!r.isNormal()) {
          leave(tryNode, r);
          return;
        }
        FinallySplit split = splits.getFinallySplit(tryNode);
        if (split == null) {
          leave(tryNode, r.asNormal());
        } else {
          Completion resumed = split.getCompletion();
          leave(tryNode, new Route(resumed, resumed.getSuccessorType()));
        }
        return;
      }
      Node firstCatch = getFirstCatch(tryNode);
      if (n == tryNode.getFirstChild() && r.is(Kind.THROW) && firstCatch != null) {
        emit(
            firstCatch,
            r.edgeType(),
            ImmutableList.of(
                Split.exceptionHandlerSplit(tryNode, r.completion().getExceptionType())));
        return;
      }
      leaveProtectedRegion(tryNode, r);
    }

    /** The try block or a catch clause completed: run the finally block, if any. */
    private void leaveProtectedRegion(Node tryNode, Route r) {
      Node finallyBlock = getFinallyBlock(tryNode);
      if (finallyBlock == null) {
        leave(tryNode, r.isNormal() ? r.asNormal() : r);
      } else if (r.isNormal()) {
        enter(finallyBlock, r);
      } else {
        enter(finallyBlock, r, Split.finallySplit(tryNode, r.completion()));
      }
    }

    private void leaveCatch(Node catchNode, Node n, Route r) {
      if (n != getCatchFilter(catchNode)) {
        leave(catchNode, r);
      } else if (r.isTrue()) {
        enter(getCatchBody(catchNode), r);
      } else if (r.isNormal() || r.is(Kind.THROW)) {
        catchNoMatch(catchNode, r);
      } else {
        leave(catchNode, r);
      }
    }

    /** No handler so far: try the next catch clause, or rethrow the exception. */
    private void catchNoMatch(Node catchNode, Route r) {
      Node next = getNextCatch(catchNode);
      if (next != null) {
        emit(next, r);
        return;
      }
      Node tryNode = catchNode.getParent();
      ExceptionHandlerSplit split = splits.getExceptionHandlerSplit(tryNode);
      String type = split != null ? split.getExceptionType() : TypeHierarchy.ROOT_EXCEPTION;
      leaveProtectedRegion(tryNode, r.with(Completion.throwCompletion(type)));
    }

    private void leaveShortCircuit(Node op, Node n, Route r) {
      if (!r.isNormal() || n != op.getFirstChild()) {
        leave(op, r);
        return;
      }
      boolean shortCircuitValue = op.getToken() == Token.OR;
      if (r.completion().is(Kind.BOOLEAN, shortCircuitValue)) {
        leave(op, adaptBoolean(op, r));
      } else {
        enter(n.getNext(), r);
      }
    }

    private void leaveHook(Node hook, Node n, Route r) {
      if (!r.isNormal() || n != hook.getFirstChild()) {
        leave(hook, r);
      } else if (r.isTrue()) {
        enter(n.getNext(), r);
      } else {
        enter(hook.getLastChild(), r);
      }
    }

    private void leaveCoalesce(Node coalesce, Node n, Route r) {
      if (!r.isNormal() || n != coalesce.getFirstChild()) {
        leave(coalesce, r);
      } else if (r.completion().is(Kind.NULLNESS, true)) {
        enter(n.getNext(), r);
      } else {
        leaveNonNull(coalesce, r);
      }
    }

    private void leaveAssignCoalesce(Node assign, Node n, Route r) {
      if (!r.isNormal()) {
        leave(assign, r);
      } else if (n == assign.getFirstChild()) {
        if (r.completion().is(Kind.NULLNESS, true)) {
          enter(n.getNext(), r);
        } else {
          leaveNonNull(assign, r);
        }
      } else {
        emit(assign, r);
      }
    }

    /** {@code n} completes with a non-null value that it did not compute itself. */
    private void leaveNonNull(Node n, Route r) {
      switch (ElementUtil.getContext(n)) {
        case NULLNESS -> leave(n, r.with(Completion.nullness(false)));
        case BOOLEAN -> {
          leave(n, r.with(Completion.ofBoolean(true)));
          leave(n, r.with(Completion.ofBoolean(false)));
        }
        case PLAIN -> leave(n, r.asNormal());
      }
    }

    private Route adaptBoolean(Node n, Route r) {
      return ElementUtil.getContext(n) == EvaluationContext.BOOLEAN ? r : r.asNormal();
    }

    /** Operands of a post-order element run in order, then the element itself. */
    private void leaveOperand(Node parent, Node n, Route r) {
      if (!r.isNormal()) {
        leave(parent, r);
        return;
      }
      if (parent.isConditionalAccess()
          && n == parent.getQualifier()
          && r.completion().is(Kind.NULLNESS, true)) {
        Node root = ElementUtil.getConditionalChainRoot(parent);
        Completion skipped =
            switch (ElementUtil.getContext(root)) {
              case NULLNESS -> Completion.nullness(true);
              case BOOLEAN -> Completion.ofBoolean(false);
              case PLAIN -> Completion.normal();
            };
        leave(root, r.with(skipped));
        return;
      }
      ImmutableList<Node> children = ElementUtil.getEvaluatedChildren(parent);
      int index = children.indexOf(n);
      if (index >= 0 && index + 1 < children.size()) {
        enter(children.get(index + 1), r);
      } else {
        emit(parent, r);
      }
    }
  }
}
