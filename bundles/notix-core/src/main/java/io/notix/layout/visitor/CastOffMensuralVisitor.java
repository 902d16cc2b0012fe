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

package io.notix.layout.visitor;

import io.notix.api.visitor.NodeVisitor;
import io.notix.api.visitor.VisitResult;
import io.notix.api.visitor.VisitResultType;
import io.notix.node.Node;
import io.notix.node.layer.BarLine;
import io.notix.node.score.Layer;
import io.notix.node.score.Measure;
import io.notix.node.score.Staff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Splits every unmeasured measure at the bar lines of its layers, a bar line closing its segment.
 * Segment {@code k} of all staves and layers goes to the {@code k}-th new measure.
 * </p>
 * <p>
 * Measures, staves and layers are copied without children and without derived state; the layer
 * elements are moved. The first fragment takes over the identifier of the original, the following
 * ones keep fresh identifiers. Every new measure gets a fragment of every staff and layer, empty if
 * the staff has fewer segments. Editorial children of a staff go to its first fragment.
 * </p>
 */
public final class CastOffMensuralVisitor implements NodeVisitor {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CastOffMensuralVisitor.class);

  @Override
  public VisitResult visitMeasure(final Measure measure) {
    if (measure.isMeasured()) {
      return VisitResultType.SKIPSUBTREE;
    }

    int segmentCount = 1;
    for (final Layer layer : measure.findDescendants(Layer.class)) {
      segmentCount = Math.max(segmentCount, segmentsOf(layer).size());
    }
    if (segmentCount < 2) {
      return VisitResultType.SKIPSUBTREE;
    }

    final Node parent = requireNonNull(measure.getParent());
    final int index = measure.getIndexInParent();

    final List<Measure> targetMeasures = new ArrayList<>(segmentCount);
    for (int k = 0; k < segmentCount; k++) {
      final Measure targetMeasure = (Measure) measure.cloneWithoutChildren();
      if (k == 0) {
        targetMeasure.swapId(measure);
      }
      targetMeasures.add(targetMeasure);
    }

    for (final Node child : List.copyOf(measure.getChildren())) {
      castOffStaff((Staff) child, targetMeasures);
    }

    measure.detachFromParent();
    for (int k = 0; k < segmentCount; k++) {
      parent.insertChild(targetMeasures.get(k), index + k);
    }

    LOGGER.debug("Split measure '{}' into {} measures", targetMeasures.get(0).getId(), segmentCount);

    return VisitResultType.SKIPSUBTREE;
  }

  private static void castOffStaff(final Staff staff, final List<Measure> targetMeasures) {
    final List<Staff> targetStaves = new ArrayList<>(targetMeasures.size());
    for (int k = 0; k < targetMeasures.size(); k++) {
      final Staff targetStaff = staff.cloneWithoutChildren();
      if (k == 0) {
        targetStaff.swapId(staff);
      }
      targetMeasures.get(k).addChild(targetStaff);
      targetStaves.add(targetStaff);
    }

    for (final Node child : List.copyOf(staff.getChildren())) {
      if (child instanceof Layer) {
        castOffLayer((Layer) child, targetStaves);
      } else {
        targetStaves.get(0).addChild(child);
      }
    }
  }

  private static void castOffLayer(final Layer layer, final List<Staff> targetStaves) {
    final List<List<Node>> segments = segmentsOf(layer);
    for (int k = 0; k < targetStaves.size(); k++) {
      final Layer targetLayer = (Layer) layer.cloneWithoutChildren();
      if (k == 0) {
        targetLayer.swapId(layer);
      }
      targetStaves.get(k).addChild(targetLayer);
      if (k < segments.size()) {
        for (final Node element : segments.get(k)) {
          targetLayer.addChild(element);
        }
      }
    }
  }

  /**
   * Group the children of a layer into segments, each closed by a bar line.
   *
   * @param layer the layer
   * @return the segments, none for an empty layer
   */
  static List<List<Node>> segmentsOf(final Layer layer) {
    final List<List<Node>> segments = new ArrayList<>();
    List<Node> current = new ArrayList<>();
    for (final Node child : layer.getChildren()) {
      current.add(child);
      if (child instanceof BarLine) {
        segments.add(current);
        current = new ArrayList<>();
      }
    }
    if (!current.isEmpty()) {
      segments.add(current);
    }
    return segments;
  }
}
