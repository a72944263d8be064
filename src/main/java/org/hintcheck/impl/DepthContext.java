/*
 * Copyright 2026 The Hintcheck Authors
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

package org.hintcheck.impl;

import com.google.common.base.Preconditions;

/**
 * Tracks where the generator is in the hint tree: the depth of the hint being compiled, the
 * indentation of its code, and the variable that holds its pith once bound.
 *
 * <p>DepthContexts are immutable; {@link #child} returns the context for the next level down.
 */
final class DepthContext {
  final int depth;
  final String indent;

  private DepthContext(int depth) {
    this.depth = depth;
    this.indent = PithNames.indent(depth);
  }

  /** The context of a root hint. */
  static final DepthContext ROOT = new DepthContext(0);

  /** Returns the context of this hint's children. */
  DepthContext child() {
    return new DepthContext(depth + 1);
  }

  /** The variable this hint binds its pith to. */
  String pithVar() {
    return PithNames.pithVar(depth);
  }

  /**
   * Returns an expression that binds {@code pithExpr} to this depth's variable and evaluates to it.
   * The root pith is bound before any generated code runs, so at the root this just returns the
   * variable.
   */
  String assignExpr(String pithExpr) {
    Preconditions.checkArgument(!pithExpr.isEmpty());
    if (depth == 0) {
      assert pithExpr.equals(PithNames.ROOT_PITH_VAR);
      return pithExpr;
    }
    return "(" + pithVar() + " = " + pithExpr + ")";
  }

  @Override
  public String toString() {
    return "depth " + depth;
  }
}
