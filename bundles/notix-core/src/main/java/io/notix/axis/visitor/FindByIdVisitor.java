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

import io.notix.api.visitor.ReadOnlyNodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.api.visitor.VisitResultType;
import io.notix.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Looks up a node by identifier and stops the traversal at the first match.
 */
public final class FindByIdVisitor implements ReadOnlyNodeVisitor {

  /** The identifier to look for. */
  private final String id;

  /** The match. */
  private @Nullable Node element;

  /**
   * Constructor.
   *
   * @param id the identifier to look for
   */
  public FindByIdVisitor(final String id) {
    this.id = requireNonNull(id);
  }

  @Override
  public VisitResult visitObject(final Node node) {
    if (id.equals(node.getId())) {
      element = node;
      return VisitResultType.TERMINATE;
    }
    return VisitResultType.CONTINUE;
  }

  /**
   * Get the match.
   *
   * @return the node with the identifier, or {@code null} if none was found
   */
  public @Nullable Node getElement() {
    return element;
  }
}
