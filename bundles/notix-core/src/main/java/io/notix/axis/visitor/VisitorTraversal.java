/*
 * Copyright (c) 2023, Notix Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.notix.axis.visitor;

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.api.visitor.VisitResultType;
import io.notix.node.Node;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.List;
import java.util.ListIterator;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Depth-first traversal of the subtree rooted at a given node, guided by a {@link NodeVisitor} or a
 * {@link ReadOnlyNodeVisitor}. Each node is handed to the visitor twice: once before its children
 * ({@code accept}) and once after them ({@code acceptEnd}). The node decides which handler of the
 * visitor runs.
 * </p>
 * <p>
 * A mutating traversal iterates over a copy of each child list, so handlers may move or remove the
 * children of the node they are visiting. A read-only traversal walks the live lists; a handler that
 * modifies them fails with a {@link java.util.ConcurrentModificationException}.
 * </p>
 */
public final class VisitorTraversal {

  /** Denotes a traversal without depth limit. */
  public static final int UNLIMITED_DEPTH = -1;

  /** The start node. */
  private final Node root;

  /** Pre-order dispatch. */
  private final Function<Node, VisitResult> enter;

  /** Post-order dispatch. */
  private final Function<Node, VisitResult> exit;

  /** Determines if child lists are copied before they are iterated. */
  private final boolean snapshotChildren;

  /** Maximum depth relative to the start node, or {@link #UNLIMITED_DEPTH}. */
  private final int maxDepth;

  /** Determines if children are visited last to first. */
  private final boolean backward;

  /**
   * Get a new builder instance.
   *
   * @param root the node to start from (it is visited too)
   * @return {@link Builder} instance
   */
  public static Builder newBuilder(final Node root) {
    return new Builder(root);
  }

  /** The builder. */
  public static final class Builder {

    /** The start node. */
    private final Node root;

    /** Mutating visitor. */
    private NodeVisitor visitor;

    /** Read-only visitor. */
    private ReadOnlyNodeVisitor readOnlyVisitor;

    /** Maximum depth. */
    private int maxDepth = UNLIMITED_DEPTH;

    /** Direction. */
    private boolean backward;

    /**
     * Constructor.
     *
     * @param root the node to start from
     */
    public Builder(final Node root) {
      this.root = requireNonNull(root);
    }

    /**
     * Set a mutating visitor.
     *
     * @param visitor the visitor
     * @return this builder instance
     */
    public Builder visitor(final NodeVisitor visitor) {
      this.visitor = requireNonNull(visitor);
      return this;
    }

    /**
     * Set a read-only visitor.
     *
     * @param visitor the visitor
     * @return this builder instance
     */
    public Builder visitor(final ReadOnlyNodeVisitor visitor) {
      this.readOnlyVisitor = requireNonNull(visitor);
      return this;
    }

    /**
     * Limit the traversal depth. {@code 0} only visits the start node, {@code 1} its children too.
     *
     * @param maxDepth the maximum depth
     * @return this builder instance
     */
    public Builder maxDepth(final @NonNegative int maxDepth) {
      checkArgument(maxDepth >= 0, "maxDepth must be >= 0!");
      this.maxDepth = maxDepth;
      return this;
    }

    /**
     * Visit children from last to first.
     *
     * @return this builder instance
     */
    public Builder backward() {
      backward = true;
      return this;
    }

    /**
     * Build a new instance.
     *
     * @return new {@link VisitorTraversal} instance
     */
    public VisitorTraversal build() {
      checkState((visitor == null) != (readOnlyVisitor == null), "Exactly one visitor must be set.");
      return new VisitorTraversal(this);
    }
  }

  /**
   * Private constructor.
   *
   * @param builder the builder to construct a new instance
   */
  private VisitorTraversal(final Builder builder) {
    root = builder.root;
    maxDepth = builder.maxDepth;
    backward = builder.backward;
    if (builder.visitor != null) {
      final NodeVisitor visitor = builder.visitor;
      enter = node -> node.accept(visitor);
      exit = node -> node.acceptEnd(visitor);
      snapshotChildren = true;
    } else {
      final ReadOnlyNodeVisitor visitor = builder.readOnlyVisitor;
      enter = node -> node.accept(visitor);
      exit = node -> node.acceptEnd(visitor);
      snapshotChildren = false;
    }
  }

  /**
   * Run the traversal.
   *
   * @return {@link VisitResultType#TERMINATE} if a handler stopped the traversal,
   *         {@link VisitResultType#CONTINUE} otherwise
   */
  public VisitResult traverse() {
    return process(root, 0) == VisitResultType.TERMINATE
        ? VisitResultType.TERMINATE
        : VisitResultType.CONTINUE;
  }

  private VisitResult process(final Node node, final int depth) {
    final VisitResult result = enter.apply(node);

    if (result == VisitResultType.TERMINATE) {
      return VisitResultType.TERMINATE;
    }

    if (result == VisitResultType.SKIPSUBTREE) {
      return VisitResultType.CONTINUE;
    }

    if (maxDepth == UNLIMITED_DEPTH || depth < maxDepth) {
      final List<Node> children = snapshotChildren ? List.copyOf(node.getChildren()) : node.getChildren();
      final ListIterator<Node> iterator = children.listIterator(backward ? children.size() : 0);
      while (backward ? iterator.hasPrevious() : iterator.hasNext()) {
        final Node child = backward ? iterator.previous() : iterator.next();
        final VisitResult childResult = process(child, depth + 1);
        if (childResult == VisitResultType.TERMINATE) {
          return VisitResultType.TERMINATE;
        }
        if (childResult == VisitResultType.SKIPSIBLINGS) {
          break;
        }
      }
    }

    final VisitResult endResult = exit.apply(node);

    if (endResult == VisitResultType.TERMINATE) {
      return VisitResultType.TERMINATE;
    }

    if (result == VisitResultType.SKIPSIBLINGS || endResult == VisitResultType.SKIPSIBLINGS) {
      return VisitResultType.SKIPSIBLINGS;
    }

    return VisitResultType.CONTINUE;
  }
}
