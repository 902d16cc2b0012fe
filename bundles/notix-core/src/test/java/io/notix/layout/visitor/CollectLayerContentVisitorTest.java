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

import com.google.common.collect.ImmutableListMultimap;
import io.notix.NotixTestHelper;
import io.notix.mensural.Duration;
import io.notix.node.layer.Clef;
import io.notix.node.layer.LayerElement;
import io.notix.node.layer.Note;
import io.notix.node.layer.Rest;
import io.notix.node.data.ClefShape;
import io.notix.node.score.Doc;
import io.notix.node.score.Layer;
import io.notix.settings.LayoutOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link CollectLayerContentVisitor}.
 */
@DisplayName("CollectLayerContentVisitor")
class CollectLayerContentVisitorTest {

  @Test
  @DisplayName("notes and rests are collected per staff in document order")
  void testGetContent() {
    final Doc doc = NotixTestHelper.createDoc(LayoutOptions.defaults(), 2, 2);
    final Layer layer = doc.findDescendants(Layer.class).get(0);
    layer.insertChild(new Clef(ClefShape.C, 1), 0);
    final Rest rest = new Rest(Duration.SEMIBREVIS);
    layer.addChild(rest);

    final CollectLayerContentVisitor visitor = new CollectLayerContentVisitor();
    doc.process(visitor);

    final ImmutableListMultimap<Integer, LayerElement> content = visitor.getContent();
    assertEquals(2, content.keySet().size());
    assertEquals(3, content.get(1).size());
    assertTrue(content.get(1).get(0) instanceof Note);
    assertEquals(rest, content.get(1).get(1));
    assertEquals(2, content.get(2).size());
  }
}
