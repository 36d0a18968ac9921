/*
 * Copyright 2024 the miniscriptj developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.miniscriptj.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.miniscriptj.script.ExpressionParser;
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.taproot.TaprootTreeParser;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TreeLayoutTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final TreeLayout layout = new TreeLayout();

    @Test
    public void testConjunction() {
        PositionedNode root = layout.layout(parser.parseNode("and(pk(A),pk(B))"));
        assertEquals("and", root.getText());
        assertEquals(0, root.getDepth());
        assertEquals(4, root.getPosition());
        assertEquals(14, root.getRightmostExtent());

        List<PositionedNode> children = root.getChildren();
        assertEquals(2, children.size());
        assertEquals("pk(A)", children.get(0).getText());
        assertEquals(0, children.get(0).getPosition());
        assertEquals("pk(B)", children.get(1).getText());
        assertEquals(9, children.get(1).getPosition());
        for (PositionedNode child : children)
            assertEquals(1, child.getDepth());
    }

    @Test
    public void testCountedFragment() {
        PositionedNode root = layout.layout(parser.parseNode("thresh(2,pk(A),pk(B),pk(C))"));
        assertEquals("thresh(2 of 3)", root.getText());
        assertEquals(3, root.getChildren().size());
        assertEquals(9, root.getPosition());
        assertEquals(18, root.getChildren().get(2).getPosition());
    }

    @Test
    public void testMultisigIsCounted() {
        PositionedNode root = layout.layout(parser.parseNode("multi(2,A,B,C)"));
        assertEquals("multi(2 of 3)", root.getText());
        assertEquals(3, root.getChildren().size());
        assertEquals("A", root.getChildren().get(0).getText());
    }

    @Test
    public void testCountWithoutChildrenIsPlainFragment() {
        PositionedNode root = layout.layout(parser.parseNode("thresh(2)"));
        assertEquals("thresh(2)", root.getText());
        assertTrue(root.getChildren().isEmpty());
    }

    @Test
    public void testWrapperHasNoLevelOfItsOwn() {
        PositionedNode root = layout.layout(parser.parseNode("and_v(v:pk(A),pk(B))"));
        assertEquals("v:pk(A)", root.getChildren().get(0).getText());
        assertEquals(1, root.getMaxDepth());

        PositionedNode wrapped = layout.layout(parser.parseNode("v:or_i(pk(A),pk(B))"));
        assertEquals("v:or_i", wrapped.getText());
        assertEquals(2, wrapped.getChildren().size());
        assertEquals(1, wrapped.getChildren().get(0).getDepth());
    }

    @Test
    public void testSiblingsNeverOverlap() {
        PositionedNode root = layout.layout(parser.parseNode(
                "andor(pk(A),or_i(and_v(v:pkh(B),older(1000)),pk(C)),thresh(1,pk(D),s:pk(E)))"));
        assertSiblingsSeparated(root, DiagramParams.get().getSiblingGap());
    }

    @Test
    public void testCustomGap() {
        TreeLayout wide = new TreeLayout(new DiagramParams(6, 0));
        PositionedNode root = wide.layout(parser.parseNode("and(pk(A),pk(B))"));
        assertEquals(11, root.getChildren().get(1).getPosition());
        assertSiblingsSeparated(root, 6);
    }

    @Test
    public void testTaprootTree() {
        ExpressionNode tree = new TaprootTreeParser().parseTaprootDescriptor("tr(NUMS,{{pk(A),pk(B)},pk(C)})");
        PositionedNode root = layout.layout(tree);
        assertEquals("tr(NUMS)", root.getText());
        PositionedNode branch = root.getChildren().get(0);
        assertEquals(NodeLabeler.BRANCH_LABEL, branch.getText());
        assertEquals(2, branch.getChildren().size());
        assertEquals(3, root.getMaxDepth());
    }

    @Test
    public void testSubstitutions() {
        PositionedNode root = layout.layout(parser.parseNode("and(pk(A),pk(B))"),
                ImmutableMap.of("A", "Alice"));
        assertEquals("pk(Alice)", root.getChildren().get(0).getText());
        assertEquals(13, root.getChildren().get(1).getPosition());
    }

    @Test
    public void testCenter() {
        assertEquals(7, new PositionedNode("and_v", 0, 5, 10, ImmutableList.<PositionedNode>of()).getCenter());
        assertEquals(3, new PositionedNode("x", 0, 3, 4, ImmutableList.<PositionedNode>of()).getCenter());
    }

    private static void assertSiblingsSeparated(PositionedNode node, int gap) {
        List<PositionedNode> children = node.getChildren();
        for (int i = 1; i < children.size(); i++) {
            PositionedNode previous = children.get(i - 1);
            PositionedNode current = children.get(i);
            assertTrue(current + " overlaps " + previous,
                    current.getPosition() >= previous.getRightmostExtent() + gap);
            assertTrue(current.getPosition() > previous.getPosition());
        }
        for (PositionedNode child : children) {
            assertEquals(node.getDepth() + 1, child.getDepth());
            assertSiblingsSeparated(child, gap);
        }
    }
}
