/*
 * Copyright 2026 Google Inc.
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

package dev.narrowc.lowering;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.NodeUtil;
import dev.narrowc.ir.Token;
import dev.narrowc.ir.types.DictionaryType;
import dev.narrowc.ir.types.IrType;
import dev.narrowc.target.TargetIR;
import dev.narrowc.target.TargetNode;
import dev.narrowc.target.TargetToken;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lowers IR statements to target statements.
 *
 * <p>Each step takes the context in effect before the statement and returns the one in effect
 * after it. Block-like constructs restore the enclosing name map and narrowing on exit; only the
 * temp id counter and the set of used local names flow outward. {@code if} statements are lowered
 * by {@link IfStatementLowering}, which may leave a narrowing in effect after the statement.
 */
public final class StatementLowering {

  private StatementLowering() {}

  /** Lowers one statement to zero or more target statements. */
  public static LoweredStatements lowerStatement(Node n, EmitterContext context) {
    switch (n.getToken()) {
      case BLOCK:
        return single(lowerBlock(n, context));
      case EMPTY:
        return new LoweredStatements(ImmutableList.of(), context);
      case EXPR_RESULT:
        return new LoweredStatements(
            ImmutableList.of(lowerExpressionStatement(n.getFirstChild(), context)), context);
      case VAR:
      case LET:
      case CONST:
        return lowerDeclaration(n, context);
      case IF:
        return single(IfStatementLowering.lowerIf(n, context));
      case WHILE:
        return single(lowerWhile(n, context));
      case FOR:
        return single(lowerFor(n, context));
      case FOR_OF:
      case FOR_AWAIT_OF:
        return single(lowerForOf(n, context));
      case FOR_IN:
        return single(lowerForIn(n, context));
      case SWITCH:
        return single(lowerSwitch(n, context));
      case TRY:
        return single(lowerTry(n, context));
      case THROW:
        return new LoweredStatements(
            ImmutableList.of(
                TargetIR.throwStatement(ExpressionLowering.lower(n.getFirstChild(), context))),
            context);
      case RETURN:
        return new LoweredStatements(lowerReturn(n, context), context);
      case BREAK:
        return new LoweredStatements(ImmutableList.of(TargetIR.breakStatement()), context);
      case CONTINUE:
        return new LoweredStatements(ImmutableList.of(TargetIR.continueStatement()), context);
      case FUNCTION:
        throw InternalCompilerError.unsupported(n, "nested function declaration");
      case CLASS:
      case INTERFACE:
      case ENUM:
      case TYPE_ALIAS:
        throw InternalCompilerError.unsupported(n, "type declaration inside a function body");
      case YIELD:
        throw InternalCompilerError.unsupported(n, "generator statement");
      default:
        throw InternalCompilerError.unsupported(n, "statement " + n.getToken());
    }
  }

  /** Lowers a statement list in order, threading the context from one statement to the next. */
  public static LoweredStatements lowerStatements(
      Iterable<Node> statements, EmitterContext context) {
    ImmutableList.Builder<TargetNode> out = ImmutableList.builder();
    EmitterContext current = context;
    for (Node statement : statements) {
      LoweredStatements lowered = lowerStatement(statement, current);
      out.addAll(lowered.statements());
      current = lowered.context();
    }
    return new LoweredStatements(out.build(), current);
  }

  /**
   * Lowers a BLOCK. Names declared and narrowings established inside the block are dropped on
   * exit.
   */
  public static Lowered lowerBlock(Node block, EmitterContext context) {
    LoweredStatements body = lowerStatements(block.children(), context);
    return new Lowered(TargetIR.block(body.statements()), body.context().restoreScope(context));
  }

  /**
   * Lowers a statement in a position that takes exactly one statement, such as a loop body or an
   * if branch. The returned context is not restored; callers decide what survives.
   */
  static Lowered lowerEmbedded(Node n, EmitterContext context) {
    if (n.isBlock()) {
      LoweredStatements body = lowerStatements(n.children(), context);
      return new Lowered(TargetIR.block(body.statements()), body.context());
    }
    LoweredStatements lowered = lowerStatement(n, context);
    ImmutableList<TargetNode> statements = lowered.statements();
    if (statements.size() == 1
        && statements.get(0).getToken() != TargetToken.LOCAL_DECLARATION) {
      return new Lowered(statements.get(0), lowered.context());
    }
    return new Lowered(TargetIR.block(statements), lowered.context());
  }

  private static LoweredStatements single(Lowered lowered) {
    return new LoweredStatements(ImmutableList.of(lowered.node()), lowered.context());
  }

  private static TargetNode lowerExpressionStatement(Node expression, EmitterContext context) {
    if (expression.isVoid()) {
      return discardOrEvaluate(expression.getFirstChild(), context);
    }
    return discardOrEvaluate(expression, context);
  }

  /**
   * {@code e;} when {@code e} may stand alone as a target statement, otherwise {@code _ = e;}.
   */
  private static TargetNode discardOrEvaluate(Node expression, EmitterContext context) {
    TargetNode lowered = ExpressionLowering.lower(expression, context);
    if (NodeUtil.isStatementExpressionShape(expression)) {
      return TargetIR.expressionStatement(lowered);
    }
    return TargetIR.expressionStatement(
        TargetIR.assignment("=", TargetIR.identifier("_"), lowered));
  }

  private static LoweredStatements lowerDeclaration(Node declaration, EmitterContext context) {
    ImmutableList.Builder<TargetNode> out = ImmutableList.builder();
    EmitterContext current = context;
    for (Node declarator : declaration.children()) {
      Lowered lowered = lowerDeclarator(declarator, null, current);
      out.add(lowered.node());
      current = lowered.context();
    }
    return new LoweredStatements(out.build(), current);
  }

  /**
   * {@code T name = init;}. The initializer is lowered before the name is allocated, so it still
   * reads any outer variable of the same name.
   */
  private static Lowered lowerDeclarator(
      Node declarator, @Nullable TargetNode forcedType, EmitterContext context) {
    if (declarator.isDestructuringPattern()) {
      throw InternalCompilerError.unsupported(declarator, "destructuring declaration");
    }
    Node value = declarator.getFirstChild();
    TargetNode type = forcedType != null ? forcedType : declarationType(declarator, context);
    TargetNode initializer =
        value != null
            ? ExpressionLowering.lower(value, context)
            : TargetIR.defaultExpression();
    LocalNames.Allocation allocation = LocalNames.allocate(declarator.getString(), context);
    return new Lowered(
        TargetIR.localDeclaration(type, allocation.emittedName(), initializer),
        allocation.context());
  }

  private static TargetNode declarationType(Node declarator, EmitterContext context) {
    IrType declared = declarator.getDeclaredType();
    if (declared != null) {
      return TargetTypes.toTargetType(declared, declarator, context);
    }
    Node value = declarator.getFirstChild();
    if (value != null && !NodeUtil.isNullOrUndefined(value)) {
      return TargetIR.varType();
    }
    IrType inferred = declarator.getInferredType();
    if (inferred != null && !inferred.isUnknownOrAny()) {
      return TargetTypes.toTargetType(inferred, declarator, context);
    }
    throw new InternalCompilerError(
        declarator.getToken(),
        "cannot declare '" + declarator.getString() + "' without a type or an initializer");
  }

  private static Lowered lowerWhile(Node n, EmitterContext context) {
    TargetNode condition = BooleanConditions.lowerCondition(n.getFirstChild(), context);
    Lowered body = lowerEmbedded(n.getLastChild(), context);
    return new Lowered(
        TargetIR.whileStatement(condition, body.node()), body.context().restoreScope(context));
  }

  private static Lowered lowerFor(Node n, EmitterContext context) {
    Node init = n.getFirstChild();
    Node condition = n.getSecondChild();
    Node update = n.getChildAtIndex(2);
    Node body = n.getLastChild();

    EmitterContext loopContext = context;
    TargetNode initializer = null;
    if (init.isNameDeclaration()) {
      if (!init.hasOneChild()) {
        throw InternalCompilerError.unsupported(init, "multi-declarator for initializer");
      }
      boolean intLoop = isCanonicalIntLoop(n);
      Lowered declaration =
          lowerDeclarator(init.getFirstChild(), intLoop ? TargetIR.type("int") : null, context);
      initializer = declaration.node();
      loopContext = declaration.context();
      if (intLoop) {
        loopContext =
            loopContext.withIntLoopVars(
                ImmutableSet.<String>builder()
                    .addAll(loopContext.getIntLoopVars())
                    .add(declaration.node().getText())
                    .build());
      }
    } else if (!init.isEmpty()) {
      initializer = discardOrEvaluate(init, context);
    }
    TargetNode test =
        condition.isEmpty() ? null : BooleanConditions.lowerCondition(condition, loopContext);
    ImmutableList<TargetNode> iterators =
        update.isEmpty()
            ? ImmutableList.of()
            : ImmutableList.of(discardOrEvaluate(update, loopContext).getFirstChild());
    Lowered loweredBody = lowerEmbedded(body, loopContext);
    EmitterContext after =
        loweredBody.context().restoreScope(context).withIntLoopVars(context.getIntLoopVars());
    return new Lowered(
        TargetIR.forStatement(initializer, test, iterators, loweredBody.node()), after);
  }

  /**
   * {@code for (let i = <integer>; ...; i++)}, with the update also written {@code i += 1},
   * {@code i = i + 1} or {@code i = 1 + i}. Such a counter is declared {@code int}.
   */
  static boolean isCanonicalIntLoop(Node forNode) {
    Node init = forNode.getFirstChild();
    if (!init.isLet() || !init.hasOneChild() || !init.getFirstChild().isName()) {
      return false;
    }
    Node declarator = init.getFirstChild();
    Node value = declarator.getFirstChild();
    if (value == null || !isIntegerLiteral(value)) {
      return false;
    }
    IrType declared = declarator.getDeclaredType();
    if (declared != null && !declared.isPrimitive("number") && !declared.isPrimitive("int")) {
      return false;
    }
    String name = declarator.getString();
    Node update = forNode.getChildAtIndex(2);
    switch (update.getToken()) {
      case INC:
        return isNamed(update.getFirstChild(), name);
      case ASSIGN_ADD:
        return isNamed(update.getFirstChild(), name) && isOne(update.getLastChild());
      case ASSIGN:
        Node sum = update.getLastChild();
        return isNamed(update.getFirstChild(), name)
            && sum.getToken() == Token.ADD
            && ((isNamed(sum.getFirstChild(), name) && isOne(sum.getLastChild()))
                || (isOne(sum.getFirstChild()) && isNamed(sum.getLastChild(), name)));
      default:
        return false;
    }
  }

  private static boolean isIntegerLiteral(Node n) {
    return n.isNumber()
        && n.getDouble() == Math.rint(n.getDouble())
        && Math.abs(n.getDouble()) <= Integer.MAX_VALUE;
  }

  private static boolean isNamed(Node n, String name) {
    return n.isName() && n.getString().equals(name);
  }

  private static boolean isOne(Node n) {
    return n.isNumber() && n.getDouble() == 1;
  }

  private static Lowered lowerForOf(Node n, EmitterContext context) {
    if (n.getToken() == Token.FOR_AWAIT_OF && !context.isAsyncFunction()) {
      throw InternalCompilerError.unsupported(n, "await iteration outside an async function");
    }
    Node target = n.getFirstChild();
    TargetNode iterable = ExpressionLowering.lower(n.getSecondChild(), context);
    LocalNames.Allocation variable = allocateLoopVariable(target, context);
    Lowered body = lowerEmbedded(n.getLastChild(), variable.context());
    return new Lowered(
        TargetIR.foreach(
            TargetIR.varType(),
            variable.emittedName(),
            iterable,
            body.node(),
            n.getToken() == Token.FOR_AWAIT_OF),
        body.context().restoreScope(context));
  }

  /** {@code for (k in dict)} over a string-keyed dictionary iterates its keys. */
  private static Lowered lowerForIn(Node n, EmitterContext context) {
    Node target = n.getFirstChild();
    Node subject = n.getSecondChild();
    IrType subjectType = subject.getInferredType();
    DictionaryType dictionary =
        subjectType == null
            ? null
            : TypeResolution.resolveTypeAlias(TypeResolution.stripNullish(subjectType), context)
                .toMaybeDictionaryType();
    if (dictionary == null || !dictionary.getKeyType().isPrimitive("string")) {
      throw InternalCompilerError.unsupported(
          n, "for-in over anything but a string-keyed dictionary");
    }
    TargetNode keys =
        TargetIR.memberAccess(
            TargetIR.parenthesized(ExpressionLowering.lower(subject, context)), "Keys");
    LocalNames.Allocation variable = allocateLoopVariable(target, context);
    Lowered body = lowerEmbedded(n.getLastChild(), variable.context());
    return new Lowered(
        TargetIR.foreach(TargetIR.varType(), variable.emittedName(), keys, body.node(), false),
        body.context().restoreScope(context));
  }

  private static LocalNames.Allocation allocateLoopVariable(Node target, EmitterContext context) {
    if (!target.isNameDeclaration()) {
      throw InternalCompilerError.unsupported(
          target, "loop over an existing variable or pattern");
    }
    Node declarator = target.getOnlyChild();
    if (declarator.isDestructuringPattern()) {
      throw InternalCompilerError.unsupported(declarator, "destructuring loop variable");
    }
    return LocalNames.allocate(declarator.getString(), context);
  }

  /**
   * A switch. Empty cases share the section of the case that follows them, and a section whose
   * statements can complete normally gets a trailing {@code break;}. Each section starts from the
   * narrowing in effect before the switch.
   */
  private static Lowered lowerSwitch(Node n, EmitterContext context) {
    TargetNode subject = ExpressionLowering.lower(n.getFirstChild(), context);
    List<TargetNode> sections = new ArrayList<>();
    List<TargetNode> labels = new ArrayList<>();
    EmitterContext current = context;
    for (Node caseNode = n.getSecondChild(); caseNode != null; caseNode = caseNode.getNext()) {
      Node body = caseNode.getLastChild();
      if (caseNode.isCase()) {
        labels.add(TargetIR.caseLabel(ExpressionLowering.lower(caseNode.getFirstChild(), context)));
      } else {
        labels.add(TargetIR.defaultLabel());
      }
      if (!body.hasChildren() && caseNode.getNext() != null) {
        continue;
      }
      LoweredStatements statements = lowerStatements(body.children(), current);
      List<TargetNode> sectionStatements = new ArrayList<>(statements.statements());
      if (!endsControlFlow(sectionStatements)) {
        sectionStatements.add(TargetIR.breakStatement());
      }
      sections.add(TargetIR.switchSection(labels, sectionStatements));
      labels = new ArrayList<>();
      current = statements.context().restoreScope(context);
    }
    return new Lowered(TargetIR.switchStatement(subject, sections), current);
  }

  private static boolean endsControlFlow(List<TargetNode> statements) {
    if (statements.isEmpty()) {
      return false;
    }
    TargetNode last = statements.get(statements.size() - 1);
    switch (last.getToken()) {
      case BREAK:
      case CONTINUE:
      case RETURN:
      case THROW:
        return true;
      case BLOCK:
        return endsControlFlow(last.getChildren());
      default:
        return false;
    }
  }

  /** TRY(block, BLOCK(catch?), finally?). Catch parameters are allocated like locals. */
  private static Lowered lowerTry(Node n, EmitterContext context) {
    Lowered block = lowerBlock(n.getFirstChild(), context);
    EmitterContext current = block.context();
    List<TargetNode> catches = new ArrayList<>();
    Node catchNode = n.getSecondChild().getFirstChild();
    if (catchNode != null) {
      Node param = catchNode.getFirstChild();
      Node body = catchNode.getLastChild();
      if (param.isDestructuringPattern()) {
        throw InternalCompilerError.unsupported(param, "destructuring catch parameter");
      }
      if (param.isName()) {
        LocalNames.Allocation exception = LocalNames.allocate(param.getString(), current);
        Lowered handler = lowerBlock(body, exception.context());
        catches.add(
            TargetIR.catchClause(
                TargetIR.type(TargetTypes.EXCEPTION_TYPE),
                exception.emittedName(),
                handler.node()));
        current = handler.context().restoreScope(current);
      } else {
        Lowered handler = lowerBlock(body, current);
        catches.add(TargetIR.catchClause(null, null, handler.node()));
        current = handler.context();
      }
    }
    TargetNode finallyBlock = null;
    if (n.getChildCount() > 2) {
      Lowered lowered = lowerBlock(n.getLastChild(), current);
      finallyBlock = lowered.node();
      current = lowered.context();
    }
    return new Lowered(TargetIR.tryStatement(block.node(), catches, finallyBlock), current);
  }

  /**
   * A return. In a function returning {@code void} or {@code never}, {@code return undefined},
   * {@code return null} and {@code return void e} become a bare {@code return;}, evaluating
   * {@code e} first.
   */
  private static ImmutableList<TargetNode> lowerReturn(Node n, EmitterContext context) {
    Node value = n.getFirstChild();
    if (value == null) {
      return ImmutableList.of(TargetIR.returnStatement(null));
    }
    IrType returnType = context.getReturnType();
    boolean voidFunction =
        returnType != null && (returnType.isVoidType() || returnType.isNeverType());
    if (!voidFunction) {
      return ImmutableList.of(TargetIR.returnStatement(ExpressionLowering.lower(value, context)));
    }
    if (NodeUtil.isNullOrUndefined(value)) {
      return ImmutableList.of(TargetIR.returnStatement(null));
    }
    Node evaluated = value.isVoid() ? value.getFirstChild() : value;
    if (NodeUtil.isNullOrUndefined(evaluated)) {
      return ImmutableList.of(TargetIR.returnStatement(null));
    }
    return ImmutableList.of(
        discardOrEvaluate(evaluated, context), TargetIR.returnStatement(null));
  }
}
