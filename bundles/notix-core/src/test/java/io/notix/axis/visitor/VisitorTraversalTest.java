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
import io.notix.mensural.Duration;
import io.notix.node.Node;
import io.notix.node.data.PitchName;
import io.notix.node.layer.LayerElement;
import io.notix.node.layer.Note;
import io.notix.node.layer.Rest;
import io.notix.node.score.Layer;
import io.notix.node.score.Measure;
import io.notix.node.score.Staff;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests the traversal order and the control codes of {@link VisitorTraversal}.
 */
@DisplayName("VisitorTraversal")
class VisitorTraversalTest {

  private Measure measure;

  private Staff staff1;

  private Layer layer1;

  private Note note1;

  private Rest rest1;

  private Staff staff2;

  private Layer layer2;

  private Note note2;

  /**
   * Records enter and exit events as {@code +id} and {@code -id}.
   */
  private static final class RecordingVisitor implements ReadOnlyNodeVisitor {
    private final List<String> events = new ArrayList<>();

    private final Function<Node, VisitResult> onEnter;

    RecordingVisitor(final Function<Node, VisitResult> onEnter) {
      this.onEnter = onEnter;
    }

    @Override
    public VisitResult visitObject(final Node node) {
      events.add("+" + node.getId());
      return onEnter.apply(node);
    }

    @Override
    public VisitResult visitObjectEnd(final Node node) {
      events.add("-" + node.getId());
      return VisitResultType.CONTINUE;
    }
  }

  @BeforeEach
  void setUp() {
    measure = new Measure(true, 1);
    staff1 = new Staff(1);
    layer1 = new Layer();
    note1 = new Note(PitchName.C, 4, Duration.MINIMA);
    rest1 = new Rest(Duration.MINIMA);
    layer1.addChild(note1);
    layer1.addChild(rest1);
    staff1.addChild(layer1);
    staff2 = new Staff(2);
    layer2 = new Layer();
    note2 = new Note(PitchName.D, 4, Duration.MINIMA);
    layer2.addChild(note2);
    staff2.addChild(layer2);
    measure.addChild(staff1);
    measure.addChild(staff2);
    measure.setId("m");
    staff1.setId("s1");
    layer1.setId("l1");
    note1.setId("n1");
    rest1.setId("r1");
    staff2.setId("s2");
    layer2.setId("l2");
    note2.setId("n2");
  }

  @Test
  @DisplayName("nodes are entered before and left after their children")
  void testPreAndPostOrder() {
    final RecordingVisitor visitor = new RecordingVisitor(node -> VisitResultType.CONTINUE);
    final VisitResult result = measure.process(visitor);

    assertEquals(VisitResultType.CONTINUE, result);
    assertEquals(List.of("+m", "+s1", "+l1", "+n1", "-n1", "+r1", "-r1", "-l1", "-s1", "+s2", "+l2", "+n2", "-n2",
        "-l2", "-s2", "-m"), visitor.events);
  }

  @Test
  @DisplayName("skipping a subtree skips its children and its end hook")
  void testSkipSubtree() {
    final RecordingVisitor visitor =
        new RecordingVisitor(node -> node == staff1 ? VisitResultType.SKIPSUBTREE : VisitResultType.CONTINUE);
    measure.process(visitor);

    assertEquals(List.of("+m", "+s1", "+s2", "+l2", "+n2", "-n2", "-l2", "-s2", "-m"), visitor.events);
  }

  @Test
  @DisplayName("skipping siblings finishes the node and leaves its parent")
  void testSkipSiblings() {
    final RecordingVisitor visitor =
        new RecordingVisitor(node -> node == note1 ? VisitResultType.SKIPSIBLINGS : VisitResultType.CONTINUE);
    measure.process(visitor);

    assertEquals(List.of("+m", "+s1", "+l1", "+n1", "-n1", "-l1", "-s1", "+s2", "+l2", "+n2", "-n2", "-l2", "-s2",
        "-m"), visitor.events);
  }

  @Test
  @DisplayName("terminating stops at once")
  void testTerminate() {
    final RecordingVisitor visitor =
        new RecordingVisitor(node -> node == rest1 ? VisitResultType.TERMINATE : VisitResultType.CONTINUE);
    final VisitResult result = measure.process(visitor);

    assertEquals(VisitResultType.TERMINATE, result);
    assertEquals(List.of("+m", "+s1", "+l1", "+n1", "-n1", "+r1"), visitor.events);
  }

  @Test
  @DisplayName("children can be visited backwards and down to a depth")
  void testBackwardAndMaxDepth() {
    final RecordingVisitor visitor = new RecordingVisitor(node -> VisitResultType.CONTINUE);
    VisitorTraversal.newBuilder(measure).visitor(visitor).backward().maxDepth(1).build().traverse();

    assertEquals(List.of("+m", "+s2", "-s2", "+s1", "-s1", "-m"), visitor.events);
  }

  @Test
  @DisplayName("exactly one visitor must be given")
  void testBuilderRequiresOneVisitor() {
    assertThrows(IllegalStateException.class, () -> VisitorTraversal.newBuilder(measure).build());
    assertThrows(IllegalArgumentException.class, () -> VisitorTraversal.newBuilder(measure).maxDepth(-2));
  }

  @Test
  @DisplayName("a mutating visitor may move the children it visits")
  void testMutatingVisitorMovesNodes() {
    final List<String> visited = new ArrayList<>();
    measure.process(new NodeVisitor() {
      @Override
      public VisitResult visitLayerElement(final LayerElement element) {
        visited.add(element.getId());
        if (element == note1) {
          layer2.addChild(element);
        }
        return VisitResultType.CONTINUE;
      }
    });

    assertEquals(List.of("n1", "r1", "n2", "n1"), visited);
    assertEquals(List.of(note2, note1), layer2.getChildren());
  }

  @Test
  @DisplayName("a read-only visitor must not restructure the tree")
  void testReadOnlyVisitorFailsOnModification() {
    assertThrows(ConcurrentModificationException.class, () -> measure.process(new ReadOnlyNodeVisitor() {
      @Override
      public VisitResult visitNote(final Note note) {
        if (note == note1) {
          layer1.addChild(new Rest(Duration.FUSA));
        }
        return VisitResultType.CONTINUE;
      }
    }));
  }

  @Test
  @DisplayName("the node type selects the handler")
  void testDispatch() {
    final NodeVisitor visitor = mock(NodeVisitor.class, CALLS_REAL_METHODS);
    measure.process(visitor);

    final InOrder inOrder = inOrder(visitor);
    inOrder.verify(visitor).visitMeasure(measure);
    inOrder.verify(visitor).visitStaff(staff1);
    inOrder.verify(visitor).visitLayer(layer1);
    inOrder.verify(visitor).visitNote(note1);
    inOrder.verify(visitor).visitLayerElement(note1);
    inOrder.verify(visitor).visitRest(rest1);
    inOrder.verify(visitor).visitStaffEnd(staff1);
    inOrder.verify(visitor).visitMeasureEnd(measure);
    verify(visitor, never()).visitSyl(any());
  }
}
