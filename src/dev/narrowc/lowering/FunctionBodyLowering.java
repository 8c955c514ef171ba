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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import dev.narrowc.ir.Node;
import dev.narrowc.ir.types.IrType;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/** Entry point for lowering the body of one function. */
public final class FunctionBodyLowering {
  private static final Logger logger = Logger.getLogger(FunctionBodyLowering.class.getName());

  private FunctionBodyLowering() {}

  /**
   * Lowers the body of a FUNCTION node. The declared type of the function node, if set, is its
   * return type.
   */
  public static Lowered lowerFunction(Node function, boolean isStatic, EmitterContext context) {
    checkArgument(function.isFunction(), function);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Lowering function " + function.getFirstChild().getString());
    }
    return lowerBody(
        function.getSecondChild(),
        function.getLastChild(),
        function.getDeclaredType(),
        function.isAsyncFunction(),
        isStatic,
        context);
  }

  /**
   * Lowers {@code body} as the block of a function with the given parameters. Parameters keep
   * their names and are registered without collision checks; locals of the body are allocated
   * around them.
   *
   * <p>The returned context is {@code context} with only the temp id counter advanced, so ids
   * stay unique across the functions of a compilation unit.
   */
  public static Lowered lowerBody(
      Node paramList,
      Node body,
      @Nullable IrType returnType,
      boolean isAsync,
      boolean isStatic,
      EmitterContext context) {
    checkArgument(paramList.isParamList(), paramList);
    checkArgument(body.isBlock(), body);
    EmitterContext functionContext =
        context.toBuilder()
            .setNarrowedBindings(ImmutableMap.of())
            .setUsedLocalNames(ImmutableSet.of())
            .setIntLoopVars(ImmutableSet.of())
            .setReturnType(returnType)
            .setAsyncFunction(isAsync)
            .setStaticContext(isStatic)
            .build();
    for (Node param : paramList.children()) {
      functionContext =
          LocalNames.register(
              param.getString(), Identifiers.escape(param.getString()), functionContext);
    }
    Lowered lowered = StatementLowering.lowerBlock(body, functionContext);
    return new Lowered(
        lowered.node(),
        context.toBuilder().setTempVarId(lowered.context().getTempVarId()).build());
  }
}
