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

package io.notix.node;

import com.google.common.base.MoreObjects;
import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.axis.visitor.FindByIdVisitor;
import io.notix.axis.visitor.VisitorTraversal;
import io.notix.exception.NotixUsageException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.util.Objects.requireNonNull;

/**
 * Base class of every element of the document tree.
 *
 * <p>
 * A node exclusively owns its children and holds a non-owning reference to its parent. The parent
 * reference is always the node whose child list currently contains this node: adding a node to a
 * new parent removes it from the previous one. Ancestors are therefore never stored redundantly but
 * searched along the parent chain.
 * </p>
 *
 * <p>
 * Which kinds of children a node accepts is a static rule per node kind, implemented by
 * {@link #isSupportedChild(Node)}.
 * </p>
 */
public abstract class Node implements Cloneable {

  /** Counter for generated identifiers. */
  private static final AtomicLong ID_COUNTER = new AtomicLong();

  /** The kind of the node. */
  private final NodeKind kind;

  /** Stable identifier. */
  private String id;

  /** Owned children in document order. */
  private List<Node> children = new ArrayList<>();

  /** Non-owning back reference, {@code null} for a root. */
  private @Nullable Node parent;

  /** Cached drawing x coordinate. */
  private OptionalInt cachedDrawingX = OptionalInt.empty();

  /** Cached drawing y coordinate. */
  private OptionalInt cachedDrawingY = OptionalInt.empty();

  /**
   * Constructor.
   *
   * @param kind the kind of the node
   */
  protected Node(final NodeKind kind) {
    this.kind = requireNonNull(kind);
    this.id = generateId(kind);
  }

  private static String generateId(final NodeKind kind) {
    return kind.getIdPrefix() + String.format("%010d", ID_COUNTER.incrementAndGet());
  }

  public NodeKind getKind() {
    return kind;
  }

  /**
   * Determines if this node is of the given kind.
   *
   * @param kind the kind to check
   * @return {@code true} if it is, {@code false} otherwise
   */
  public boolean is(final NodeKind kind) {
    return this.kind == kind;
  }

  public String getId() {
    return id;
  }

  /**
   * Set the identifier, for instance the one read from an encoding.
   *
   * @param id the new identifier
   */
  public void setId(final String id) {
    checkArgument(!requireNonNull(id).isEmpty(), "id must not be empty!");
    this.id = id;
  }

  /**
   * Exchange the identifiers of this node and {@code other}.
   *
   * @param other the node to swap identifiers with
   */
  public void swapId(final Node other) {
    final String otherId = other.id;
    other.id = id;
    id = otherId;
  }

  /**
   * Give this node a freshly generated identifier.
   */
  public void resetId() {
    id = generateId(kind);
  }

  // ------------------------------------------------------------------------
  // Tree structure
  // ------------------------------------------------------------------------

  public @Nullable Node getParent() {
    return parent;
  }

  /**
   * Get the children of this node.
   *
   * @return an unmodifiable view of the children in document order
   */
  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public int getChildCount() {
    return children.size();
  }

  /**
   * Count the direct children of a given kind.
   *
   * @param kind the kind to count
   * @return the number of direct children of that kind
   */
  public int getChildCount(final NodeKind kind) {
    int count = 0;
    for (final Node child : children) {
      if (child.is(kind)) {
        count++;
      }
    }
    return count;
  }

  public Node getChild(final @NonNegative int index) {
    return children.get(index);
  }

  /**
   * Get the position of this node in the child list of its parent.
   *
   * @return the index, or {@code -1} for a root
   */
  public int getIndexInParent() {
    return parent == null ? -1 : parent.children.indexOf(this);
  }

  /**
   * Determines if a child may be added to this node. The rule depends on the node kinds only.
   *
   * @param child the prospective child
   * @return {@code true} if the child kind is supported
   */
  protected boolean isSupportedChild(final Node child) {
    return false;
  }

  /**
   * Append a child. Ownership is transferred: a child that already has a parent is removed from it
   * first.
   *
   * @param child the child to add
   * @throws NotixUsageException if the child kind is not supported by this node
   */
  public void addChild(final Node child) {
    insertChild(child, children.size() - (child.parent == this ? 1 : 0));
  }

  /**
   * Insert a child at the given position. Ownership is transferred as with {@link #addChild(Node)}.
   *
   * @param child the child to add
   * @param index the position, between 0 and the number of children (after detaching the child)
   * @throws NotixUsageException if the child kind is not supported by this node
   */
  public void insertChild(final Node child, final @NonNegative int index) {
    requireNonNull(child);
    checkArgument(child != this && !isDescendantOf(child), "A node can not become its own descendant.");
    if (!isSupportedChild(child)) {
      throw new NotixUsageException("'%s' is not supported as child of '%s'", child.kind, kind);
    }
    child.detachFromParent();
    checkPositionIndex(index, children.size());
    children.add(index, child);
    child.parent = this;
  }

  /**
   * Remove a direct child. The removed node becomes a root.
   *
   * @param child the child to remove
   * @return {@code true} if the node was a child of this node
   */
  public boolean removeChild(final Node child) {
    if (child.parent != this) {
      return false;
    }
    children.remove(child);
    child.parent = null;
    return true;
  }

  /**
   * Remove this node from its parent, if any.
   */
  public void detachFromParent() {
    if (parent != null) {
      parent.removeChild(this);
    }
  }

  /**
   * Remove all children. The removed nodes become roots.
   */
  public void clearChildren() {
    for (final Node child : children) {
      child.parent = null;
    }
    children.clear();
  }

  /**
   * Determines if this node is below {@code ancestor} in the current parent chain.
   *
   * @param ancestor the potential ancestor
   * @return {@code true} if it is
   */
  public boolean isDescendantOf(final Node ancestor) {
    for (Node current = parent; current != null; current = current.parent) {
      if (current == ancestor) {
        return true;
      }
    }
    return false;
  }

  /**
   * Find the nearest ancestor of the given kind by walking up the current parent chain.
   *
   * @param kind the kind to look for
   * @return the nearest ancestor of that kind, or {@code null}
   */
  public @Nullable Node getFirstAncestor(final NodeKind kind) {
    return getFirstAncestor(kind, Integer.MAX_VALUE);
  }

  /**
   * Find the nearest ancestor of the given kind, looking at most {@code maxDepth} levels up.
   *
   * @param kind the kind to look for
   * @param maxDepth the number of levels to look at
   * @return the nearest ancestor of that kind, or {@code null}
   */
  public @Nullable Node getFirstAncestor(final NodeKind kind, final @NonNegative int maxDepth) {
    int depth = 0;
    for (Node current = parent; current != null && depth < maxDepth; current = current.parent, depth++) {
      if (current.kind == kind) {
        return current;
      }
    }
    return null;
  }

  /**
   * Find the nearest ancestor of the given type.
   *
   * @param type the node class to look for
   * @param <T> the node type
   * @return the nearest ancestor of that type, or {@code null}
   */
  public <T extends Node> @Nullable T getFirstAncestor(final Class<T> type) {
    for (Node current = parent; current != null; current = current.parent) {
      if (type.isInstance(current)) {
        return type.cast(current);
      }
    }
    return null;
  }

  /**
   * Find the nearest ancestor of the given type, which must exist by construction of the tree.
   *
   * @param type the node class to look for
   * @param <T> the node type
   * @return the nearest ancestor of that type
   * @throws NotixUsageException if there is no such ancestor
   */
  public <T extends Node> T requireAncestor(final Class<T> type) {
    final T ancestor = getFirstAncestor(type);
    if (ancestor == null) {
      throw new NotixUsageException("'%s' (%s) has no %s ancestor", id, kind, type.getSimpleName());
    }
    return ancestor;
  }

  /**
   * Collect all descendants of the given kind in document order.
   *
   * @param kind the kind to look for
   * @return the matching descendants, not including this node
   */
  public List<Node> findDescendantsByKind(final NodeKind kind) {
    final List<Node> result = new ArrayList<>();
    collectDescendants(kind, result);
    return result;
  }

  private void collectDescendants(final NodeKind kind, final List<Node> result) {
    for (final Node child : children) {
      if (child.kind == kind) {
        result.add(child);
      }
      child.collectDescendants(kind, result);
    }
  }

  /**
   * Collect all descendants of the given type in document order.
   *
   * @param type the node class to look for
   * @param <T> the node type
   * @return the matching descendants, not including this node
   */
  public <T extends Node> List<T> findDescendants(final Class<T> type) {
    final List<T> result = new ArrayList<>();
    collectDescendants(type, result);
    return result;
  }

  private <T extends Node> void collectDescendants(final Class<T> type, final List<T> result) {
    for (final Node child : children) {
      if (type.isInstance(child)) {
        result.add(type.cast(child));
      }
      child.collectDescendants(type, result);
    }
  }

  /**
   * Find the first descendant of the given kind in document order.
   *
   * @param kind the kind to look for
   * @return the first match, or {@code null}
   */
  public @Nullable Node findFirstDescendant(final NodeKind kind) {
    for (final Node child : children) {
      if (child.kind == kind) {
        return child;
      }
      final Node match = child.findFirstDescendant(kind);
      if (match != null) {
        return match;
      }
    }
    return null;
  }

  /**
   * Find a node of this subtree (this node included) by identifier.
   *
   * @param id the identifier
   * @return the node, or {@code null}
   */
  public @Nullable Node findDescendantById(final String id) {
    final FindByIdVisitor visitor = new FindByIdVisitor(id);
    process(visitor);
    return visitor.getElement();
  }

  // ------------------------------------------------------------------------
  // Visitor dispatch
  // ------------------------------------------------------------------------

  /**
   * Dispatch to the pre-order handler of a mutating visitor.
   *
   * @param visitor the visitor
   * @return the visit result
   */
  public VisitResult accept(final NodeVisitor visitor) {
    return visitor.visitObject(this);
  }

  /**
   * Dispatch to the pre-order handler of a read-only visitor.
   *
   * @param visitor the visitor
   * @return the visit result
   */
  public VisitResult accept(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitObject(this);
  }

  /**
   * Dispatch to the post-order handler of a mutating visitor.
   *
   * @param visitor the visitor
   * @return the visit result
   */
  public VisitResult acceptEnd(final NodeVisitor visitor) {
    return visitor.visitObjectEnd(this);
  }

  /**
   * Dispatch to the post-order handler of a read-only visitor.
   *
   * @param visitor the visitor
   * @return the visit result
   */
  public VisitResult acceptEnd(final ReadOnlyNodeVisitor visitor) {
    return visitor.visitObjectEnd(this);
  }

  /**
   * Run a mutating visitor over this subtree.
   *
   * @param visitor the visitor
   * @return the result of the traversal
   */
  public VisitResult process(final NodeVisitor visitor) {
    return VisitorTraversal.newBuilder(this).visitor(visitor).build().traverse();
  }

  /**
   * Run a mutating visitor over this subtree, down to the given depth.
   *
   * @param visitor the visitor
   * @param maxDepth the maximum depth, {@code 0} for this node only
   * @return the result of the traversal
   */
  public VisitResult process(final NodeVisitor visitor, final @NonNegative int maxDepth) {
    return VisitorTraversal.newBuilder(this).visitor(visitor).maxDepth(maxDepth).build().traverse();
  }

  /**
   * Run a read-only visitor over this subtree.
   *
   * @param visitor the visitor
   * @return the result of the traversal
   */
  public VisitResult process(final ReadOnlyNodeVisitor visitor) {
    return VisitorTraversal.newBuilder(this).visitor(visitor).build().traverse();
  }

  // ------------------------------------------------------------------------
  // Drawing
  // ------------------------------------------------------------------------

  /**
   * Get the drawing x coordinate. By default a node is drawn where its parent is.
   *
   * @return the x coordinate
   */
  public int getDrawingX() {
    return parent == null ? 0 : parent.getDrawingX();
  }

  /**
   * Get the drawing y coordinate. By default a node is drawn where its parent is.
   *
   * @return the y coordinate
   */
  public int getDrawingY() {
    return parent == null ? 0 : parent.getDrawingY();
  }

  /**
   * Get the drawing rotation in degrees.
   *
   * @return the rotation
   */
  public double getDrawingRotation() {
    return 0;
  }

  protected OptionalInt getCachedDrawingX() {
    return cachedDrawingX;
  }

  protected void setCachedDrawingX(final int x) {
    cachedDrawingX = OptionalInt.of(x);
  }

  protected OptionalInt getCachedDrawingY() {
    return cachedDrawingY;
  }

  protected void setCachedDrawingY(final int y) {
    cachedDrawingY = OptionalInt.of(y);
  }

  /**
   * Invalidate the cached drawing coordinates of this node.
   */
  public void resetDrawingCaches() {
    cachedDrawingX = OptionalInt.empty();
    cachedDrawingY = OptionalInt.empty();
  }

  // ------------------------------------------------------------------------
  // Cloning
  // ------------------------------------------------------------------------

  /**
   * Deep copy of this subtree. The copies get new identifiers, no parent, and all cached or derived
   * state is reset.
   *
   * @return the copy
   */
  @Override
  public Node clone() {
    final Node copy = cloneWithoutChildren();
    for (final Node child : children) {
      copy.addChild(child.clone());
    }
    return copy;
  }

  /**
   * Copy of this node without its children. The copy gets a new identifier, no parent, and all
   * cached or derived state is reset.
   *
   * @return the copy
   */
  public Node cloneWithoutChildren() {
    final Node copy;
    try {
      copy = (Node) super.clone();
    } catch (final CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
    copy.id = generateId(kind);
    copy.parent = null;
    copy.children = new ArrayList<>();
    copy.cloneReset();
    return copy;
  }

  /**
   * Reset the cached and derived state of a fresh copy. Subclasses holding mutable state must
   * replace it here, so that a copy never shares it with the original.
   */
  protected void cloneReset() {
    resetDrawingCaches();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("id", id).add("children", children.size()).toString();
  }
}
