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

package org.hintcheck.hint;

/**
 * The kinds of HintNode. Each kind determines how a node's {@link HintNode#origin}, {@link
 * HintNode#children}, literals and validators are interpreted.
 */
public enum HintKind {
  /** A plain class; the pith must be an instance of the node's origin. */
  INSTANCE(false),

  /** The pith must satisfy at least one of the node's children. */
  UNION(true),

  /** The pith must equal one of the node's literals. */
  LITERAL(false),

  /**
   * The pith must be an instance of the node's origin and satisfy each of the node's children
   * (the generic's unerased pseudo-superclasses).
   */
  GENERIC(true),

  /**
   * The pith must be a List or array of the node's origin type, and its items should satisfy the
   * node's only child. Only one pseudo-randomly chosen item is checked.
   */
  SEQUENCE(true),

  /**
   * The pith must be a List or array of the node's origin type with exactly one item for each of
   * the node's children, each satisfying the corresponding child. A FIXED_TUPLE with no children
   * only matches empty piths.
   */
  FIXED_TUPLE(true),

  /** The pith must be a class that is the same as or a subclass of the node's origin. */
  SUBCLASS(false),

  /** The pith must satisfy the node's only child and each of the node's validators. */
  ANNOTATED(true),

  /** The pith must be an instance of the class named by the node, resolved at check time. */
  FORWARD_REF(false);

  private final boolean subscripted;

  HintKind(boolean subscripted) {
    this.subscripted = subscripted;
  }

  /** Returns true if nodes of this kind may have children. */
  public boolean isSubscripted() {
    return subscripted;
  }
}
