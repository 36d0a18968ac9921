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

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.miniscriptj.script.ExpressionParser;
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.script.ast.TaprootBranch;
import org.miniscriptj.script.ast.TaprootLeaf;
import org.miniscriptj.script.ast.TaprootRoot;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class NodeLabelerTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final NodeLabeler labeler = new NodeLabeler();

    @Test
    public void testFragmentOfTerminalsIsOneBox() {
        ExpressionNode node = parser.parseNode("pk(A)");
        assertEquals("pk(A)", labeler.label(node));
        assertTrue(labeler.displayedChildren(node).isEmpty());
        assertEquals("after(500000)", labeler.label(parser.parseNode("after(500000)")));
    }

    @Test
    public void testCountedFragment() {
        ExpressionNode node = parser.parseNode("sortedmulti_a(1,A,B)");
        assertEquals("sortedmulti_a(1 of 2)", labeler.label(node));
        assertEquals(2, labeler.displayedChildren(node).size());
    }

    @Test
    public void testCountThatIsNotAValue() {
        ExpressionNode node = parser.parseNode("thresh(pk(A),pk(B))");
        assertEquals("thresh", labeler.label(node));
        assertEquals(2, labeler.displayedChildren(node).size());
    }

    @Test
    public void testPolicyWeightIsPrefixed() {
        ExpressionNode node = parser.parseNode("or(9@pk(A),2@and(pk(B),pk(C)))");
        List<ExpressionNode> children = labeler.displayedChildren(node);
        assertEquals("9@pk(A)", labeler.label(children.get(0)));
        assertEquals("2@and", labeler.label(children.get(1)));
        assertEquals("1@thresh(1 of 2)", labeler.label(parser.parseNode("1@thresh(1,pk(A),pk(B))")));
    }

    @Test
    public void testWrapperTagsArePrefixed() {
        ExpressionNode node = parser.parseNode("snl:or_i(pk(A),pk(B))");
        assertEquals("snl:or_i", labeler.label(node));
        assertEquals(2, labeler.displayedChildren(node).size());
        assertEquals("d:s:pk(A)", labeler.label(parser.parseNode("d:s:pk(A)")));
    }

    @Test
    public void testTaprootLabels() {
        TaprootRoot root = new TaprootRoot("NUMS",
                new TaprootBranch(new TaprootLeaf("pk(A)"), new TaprootLeaf("multi_a(1,A,B)")));
        assertEquals("tr(NUMS)", labeler.label(root));
        assertEquals(NodeLabeler.BRANCH_LABEL, labeler.label(root.getTree()));
        assertEquals("multi_a(1,A,B)", labeler.label(new TaprootLeaf("multi_a(1,A,B)")));
    }

    @Test
    public void testSubstitutions() {
        NodeLabeler named = new NodeLabeler(ImmutableMap.of("A", "Alice", "K", "Key"));
        assertEquals("pk(Alice)", named.label(parser.parseNode("pk(A)")));
        assertEquals("multi_a(1,Alice,B)", named.label(new TaprootLeaf("multi_a(1,A,B)")));
        assertEquals("tr(Key)", named.label(new TaprootRoot("K", null)));
        assertEquals("thresh(1 of 2)", named.label(parser.parseNode("thresh(1,pk(A),pk(B))")));
    }
}
