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
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  // Callables

  public static Node method(String name, Node body, String... params) {
    checkState(body.isBlock(), body);
    return new Node(Token.METHOD, name(name), paramList(params), body);
  }

  /**
   * Creates a constructor. The initializer, if any, is the call to another constructor that runs
   * before the body.
   */
  public static Node constructor(
      String name, @Nullable Node initializer, Node body, String... params) {
    checkState(initializer == null || initializer.getToken() == Token.CALL, initializer);
    checkState(body.isBlock(), body);
    return new Node(
        Token.CONSTRUCTOR,
        name(name),
        paramList(params),
        initializer == null ? empty() : initializer,
        body);
  }

  public static Node lambda(Node body, String... params) {
    checkState(body.isBlock() || mayBeExpression(body), body);
    return new Node(Token.LAMBDA, paramList(params), body);
  }

  public static Node paramList(String... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (String param : params) {
      paramList.addChildToBack(name(param));
    }
    return paramList;
  }

  // Statements

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node var(String name) {
    return new Node(Token.VAR, name(name));
  }

  public static Node var(String name, Node value) {
    return new Node(Token.VAR, declarator(name, value));
  }

  public static Node var(Node... declarators) {
    checkArgument(declarators.length > 0);
    for (Node declarator : declarators) {
      checkState(declarator.isName(), declarator);
    }
    return new Node(Token.VAR, declarators);
  }

  /** Creates a declarator {@code name = value} for use in a {@link Token#VAR}. */
  public static Node declarator(String name, Node value) {
    checkState(mayBeExpression(value), value);
    Node declarator = name(name);
    declarator.addChildToBack(value);
    return declarator;
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node ifStmt(Node cond, Node then) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeStatement(then), then);
    return new Node(Token.IF, cond, then);
  }

  public static Node ifStmt(Node cond, Node then, Node elseStmt) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeStatement(then), then);
    checkState(mayBeStatement(elseStmt), elseStmt);
    return new Node(Token.IF, cond, then, elseStmt);
  }

  public static Node whileLoop(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeStatement(body), body);
    return new Node(Token.WHILE, cond, body);
  }

  public static Node doLoop(Node body, Node cond) {
    checkState(mayBeStatement(body), body);
    checkState(mayBeExpression(cond), cond);
    return new Node(Token.DO, body, cond);
  }

  /** Creates {@code for (init; cond; update) body}. Absent parts may be null. */
  public static Node forLoop(
      @Nullable Node init, @Nullable Node cond, @Nullable Node update, Node body) {
    checkState(init == null || init.getToken() == Token.VAR || mayBeExpression(init), init);
    checkState(cond == null || mayBeExpression(cond), cond);
    checkState(update == null || mayBeExpression(update), update);
    checkState(mayBeStatement(body), body);
    return new Node(
        Token.FOR,
        init == null ? empty() : init,
        cond == null ? empty() : cond,
        update == null ? empty() : update,
        body);
  }

  public static Node forEach(String variable, Node iterable, Node body) {
    checkState(mayBeExpression(iterable), iterable);
    checkState(mayBeStatement(body), body);
    return new Node(Token.FOREACH, name(variable), iterable, body);
  }

  public static Node switchStmt(Node expr, Node... sections) {
    checkState(mayBeExpression(expr), expr);
    Node switchNode = new Node(Token.SWITCH, expr);
    boolean seenDefault = false;
    for (Node section : sections) {
      checkState(section.isCase() || section.isDefaultCase(), section);
      if (section.isDefaultCase()) {
        checkState(!seenDefault, "duplicate default section");
        seenDefault = true;
      }
      switchNode.addChildToBack(section);
    }
    return switchNode;
  }

  public static Node caseClause(Node pattern, Node body) {
    return caseClause(pattern, null, body);
  }

  public static Node caseClause(Node pattern, @Nullable Node guard, Node body) {
    checkState(isPatternOrConstant(pattern), pattern);
    checkState(guard == null || mayBeExpression(guard), guard);
    checkState(body.isBlock(), body);
    return new Node(Token.CASE, pattern, guard == null ? empty() : guard, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock(), body);
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node tryCatch(Node body, Node... catches) {
    checkArgument(catches.length > 0, "try without catch needs a finally block");
    return tryStatement(body, null, catches);
  }

  public static Node tryFinally(Node body, Node finallyBlock) {
    return tryStatement(body, finallyBlock);
  }

  /** Creates {@code try body catches... finally finallyBlock}. The finally block may be null. */
  public static Node tryStatement(Node body, @Nullable Node finallyBlock, Node... catches) {
    checkState(body.isBlock(), body);
    checkState(finallyBlock == null || finallyBlock.isBlock(), finallyBlock);
    checkArgument(finallyBlock != null || catches.length > 0, "try needs a catch or finally");
    Node tryNode = new Node(Token.TRY, body);
    for (Node catchNode : catches) {
      checkState(catchNode.isCatch(), catchNode);
      tryNode.addChildToBack(catchNode);
    }
    if (finallyBlock != null) {
      tryNode.addChildToBack(finallyBlock);
    }
    return tryNode;
  }

  /**
   * Creates a catch clause. A null type catches every exception; the variable and the filter
   * ({@code when} clause) may be null.
   */
  public static Node catchClause(
      @Nullable String type, @Nullable String variable, @Nullable Node filter, Node body) {
    checkState(filter == null || mayBeExpression(filter), filter);
    checkState(body.isBlock(), body);
    return new Node(
        Token.CATCH,
        type == null ? empty() : typeRef(type),
        variable == null ? empty() : name(variable),
        filter == null ? empty() : filter,
        body);
  }

  public static Node catchClause(String type, Node body) {
    return catchClause(type, null, null, body);
  }

  public static Node generalCatch(Node body) {
    return catchClause(null, null, null, body);
  }

  public static Node label(String name, Node stmt) {
    checkState(mayBeStatement(stmt), stmt);
    return new Node(Token.LABEL, labelName(name), stmt);
  }

  public static Node breakStmt() {
    return new Node(Token.BREAK);
  }

  public static Node breakStmt(String label) {
    return new Node(Token.BREAK, labelName(label));
  }

  public static Node continueStmt() {
    return new Node(Token.CONTINUE);
  }

  public static Node continueStmt(String label) {
    return new Node(Token.CONTINUE, labelName(label));
  }

  public static Node returnStmt() {
    return new Node(Token.RETURN);
  }

  public static Node returnStmt(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node throwStmt(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.THROW, expr);
  }

  /** Creates a bare {@code throw;} that rethrows the exception being handled. */
  public static Node rethrow() {
    return new Node(Token.THROW);
  }

  public static Node gotoLabel(String label) {
    return Node.newString(Token.GOTO, label);
  }

  public static Node gotoCase(Node constant) {
    checkState(isConstant(constant), constant);
    return new Node(Token.GOTO_CASE, constant);
  }

  public static Node gotoDefault() {
    return new Node(Token.GOTO_DEFAULT);
  }

  // Expressions

  public static Node and(Node left, Node right) {
    return binaryExpression(Token.AND, left, right);
  }

  public static Node or(Node left, Node right) {
    return binaryExpression(Token.OR, left, right);
  }

  public static Node coalesce(Node left, Node right) {
    return binaryExpression(Token.COALESCE, left, right);
  }

  public static Node hook(Node cond, Node then, Node elseExpr) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeExpression(then), then);
    checkState(mayBeExpression(elseExpr), elseExpr);
    return new Node(Token.HOOK, cond, then, elseExpr);
  }

  public static Node not(Node operand) {
    return unaryExpression(Token.NOT, operand);
  }

  public static Node neg(Node operand) {
    return unaryExpression(Token.NEG, operand);
  }

  public static Node inc(Node operand) {
    return unaryExpression(Token.INC, operand);
  }

  public static Node dec(Node operand) {
    return unaryExpression(Token.DEC, operand);
  }

  public static Node binaryOp(Token token, Node left, Node right) {
    checkArgument(token.isBinaryOperator(), token);
    return binaryExpression(token, left, right);
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Token.ADD, left, right);
  }

  public static Node div(Node left, Node right) {
    return binaryOp(Token.DIV, left, right);
  }

  public static Node lt(Node left, Node right) {
    return binaryOp(Token.LT, left, right);
  }

  public static Node eq(Node left, Node right) {
    return binaryOp(Token.EQ, left, right);
  }

  public static Node assign(Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN, target, value);
  }

  /** Creates a compound assignment such as {@code target += value}. */
  public static Node assignOp(String operator, Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    Node n = new Node(Token.ASSIGN_OP, target, value);
    n.setString(operator);
    return n;
  }

  public static Node assignCoalesce(Node target, Node value) {
    checkState(isAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN_COALESCE, target, value);
  }

  public static Node getprop(Node qualifier, String member) {
    checkState(mayBeExpression(qualifier) || qualifier.isTypeRef(), qualifier);
    Node n = new Node(Token.GETPROP, qualifier);
    n.setString(member);
    return n;
  }

  /** Creates {@code qualifier?.member}. */
  public static Node conditionalGetprop(Node qualifier, String member) {
    return getprop(qualifier, member).setConditionalAccess(true);
  }

  public static Node getelem(Node qualifier, Node... indices) {
    checkState(mayBeExpression(qualifier), qualifier);
    checkArgument(indices.length > 0);
    Node n = new Node(Token.GETELEM, qualifier);
    for (Node index : indices) {
      checkState(mayBeExpression(index), index);
      n.addChildToBack(index);
    }
    return n;
  }

  /** Creates an unqualified call {@code method(args)}. */
  public static Node call(String method, Node... args) {
    Node n = Node.newString(Token.CALL, method);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      n.addChildToBack(arg);
    }
    return n;
  }

  /** Creates a call {@code qualifier.method(args)}. A type qualifier is not evaluated. */
  public static Node callOn(Node qualifier, String method, Node... args) {
    checkState(mayBeExpression(qualifier) || qualifier.isTypeRef(), qualifier);
    Node n = Node.newString(Token.CALL, method);
    n.setQualified(true);
    n.addChildToBack(qualifier);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      n.addChildToBack(arg);
    }
    return n;
  }

  /** Creates {@code qualifier?.method(args)}. */
  public static Node conditionalCallOn(Node qualifier, String method, Node... args) {
    return callOn(qualifier, method, args).setConditionalAccess(true);
  }

  /** Creates a call that never returns, such as a process exit. */
  public static Node nonReturningCall(Node qualifier, String method, Node... args) {
    return callOn(qualifier, method, args).setNonReturning(true);
  }

  public static Node newObject(String type, Node... args) {
    Node n = new Node(Token.NEW, typeRef(type));
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      n.addChildToBack(arg);
    }
    return n;
  }

  /** Creates an array creation. Either the lengths or the initializer may be absent. */
  public static Node newArray(String elementType, List<Node> lengths, @Nullable Node initializer) {
    checkArgument(!lengths.isEmpty() || initializer != null, "array creation without size");
    checkState(initializer == null || initializer.getToken() == Token.ARRAY_LIT, initializer);
    Node n = new Node(Token.NEW_ARRAY, typeRef(elementType));
    for (Node length : lengths) {
      checkState(mayBeExpression(length), length);
      n.addChildToBack(length);
    }
    if (initializer != null) {
      n.addChildToBack(initializer);
    }
    return n;
  }

  public static Node arrayLit(Node... elements) {
    Node n = new Node(Token.ARRAY_LIT);
    for (Node element : elements) {
      checkState(mayBeExpression(element), element);
      n.addChildToBack(element);
    }
    return n;
  }

  /** Creates {@code expr is pattern}; the pattern may also be a bare {@link Token#TYPE_REF}. */
  public static Node is(Node expr, Node pattern) {
    checkState(mayBeExpression(expr), expr);
    checkState(pattern.isTypeRef() || isPatternOrConstant(pattern), pattern);
    return new Node(Token.IS, expr, pattern);
  }

  public static Node as(Node expr, String type) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.AS, expr, typeRef(type));
  }

  public static Node cast(String type, Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.CAST, typeRef(type), expr);
  }

  public static Node throwExpr(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.THROW_EXPR, expr);
  }

  public static Node switchExpr(Node expr, Node... arms) {
    checkState(mayBeExpression(expr), expr);
    checkArgument(arms.length > 0, "switch expression without arms");
    Node n = new Node(Token.SWITCH_EXPR, expr);
    for (Node arm : arms) {
      checkState(arm.getToken() == Token.SWITCH_ARM, arm);
      n.addChildToBack(arm);
    }
    return n;
  }

  public static Node switchArm(Node pattern, @Nullable Node guard, Node value) {
    checkState(isPatternOrConstant(pattern), pattern);
    checkState(guard == null || mayBeExpression(guard), guard);
    checkState(mayBeExpression(value), value);
    return new Node(Token.SWITCH_ARM, pattern, guard == null ? empty() : guard, value);
  }

  // Patterns

  public static Node typePattern(String type, @Nullable String variable) {
    Node n = new Node(Token.TYPE_PATTERN, typeRef(type));
    if (variable != null) {
      n.addChildToBack(name(variable));
    }
    return n;
  }

  public static Node varPattern(String variable) {
    return new Node(Token.VAR_PATTERN, name(variable));
  }

  public static Node discard() {
    return new Node(Token.DISCARD);
  }

  // Leaves

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node number(long value) {
    return Node.newString(Token.NUMBER, Long.toString(value));
  }

  public static Node string(String value) {
    return Node.newString(Token.STRING, value);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node typeRef(String type) {
    return Node.newString(Token.TYPE_REF, type);
  }

  public static Node labelName(String name) {
    return Node.newString(Token.LABEL_NAME, name);
  }

  /** Creates an expression the builder has no special knowledge of. */
  public static Node unknown(Node... children) {
    return new Node(Token.UNKNOWN, children);
  }

  private static Node binaryExpression(Token token, Node left, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(token, left, right);
  }

  private static Node unaryExpression(Token token, Node operand) {
    checkState(mayBeExpression(operand), operand);
    return new Node(token, operand);
  }

  private static boolean isAssignmentTarget(Node n) {
    return switch (n.getToken()) {
      case NAME, GETPROP, GETELEM -> true;
      default -> false;
    };
  }

  private static boolean isConstant(Node n) {
    return switch (n.getToken()) {
      case NUMBER, STRING, TRUE, FALSE, NULL -> true;
      default -> false;
    };
  }

  private static boolean isPatternOrConstant(Node n) {
    return n.getToken().isPattern() || isConstant(n);
  }

  static boolean mayBeStatement(Node n) {
    return switch (n.getToken()) {
      case BLOCK,
          EXPR_RESULT,
          VAR,
          EMPTY,
          IF,
          WHILE,
          DO,
          FOR,
          FOREACH,
          SWITCH,
          TRY,
          LABEL,
          BREAK,
          CONTINUE,
          RETURN,
          THROW,
          GOTO,
          GOTO_CASE,
          GOTO_DEFAULT -> true;
      default -> false;
    };
  }

  static boolean mayBeExpression(Node n) {
    return switch (n.getToken()) {
      case METHOD,
          CONSTRUCTOR,
          PARAM_LIST,
          CASE,
          DEFAULT_CASE,
          CATCH,
          LABEL_NAME,
          SWITCH_ARM,
          TYPE_REF,
          TYPE_PATTERN,
          VAR_PATTERN,
          DISCARD -> false;
      default -> !mayBeStatement(n);
    };
  }
}
