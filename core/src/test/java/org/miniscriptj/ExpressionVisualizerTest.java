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

package org.miniscriptj;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;
import org.miniscriptj.core.ExpressionError;
import org.miniscriptj.script.Dialect;
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.script.ast.TaprootRoot;
import org.miniscriptj.taproot.TaprootLeafInfo;
import org.miniscriptj.tree.DiagramParams;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class ExpressionVisualizerTest {

    private ExpressionVisualizer visualizer;

    @Before
    public void setUp() {
        visualizer = ExpressionVisualizer.create();
    }

    @Test
    public void testParse() {
        ParseResult<ExpressionNode> result = visualizer.parse("and(pk(A),pk(B))");
        assertTrue(result.isOk());
        assertEquals(2, result.getValue().getChildren().size());
    }

    @Test
    public void testWhitespaceIsIgnored() {
        ParseResult<ExpressionNode> spaced = visualizer.parse("  and( pk(A),\n   pk(B) )  ");
        assertEquals(visualizer.parse("and(pk(A),pk(B))").getValue(), spaced.getValue());
    }

    @Test
    public void testBlankInputIsEmpty() {
        assertTrue(visualizer.parse("").isEmpty());
        assertTrue(visualizer.parse(" \n\t").isEmpty());
        assertTrue(visualizer.parse(null).isEmpty());
        assertTrue(visualizer.parseTaproot("").isEmpty());
        assertTrue(visualizer.renderExpression("  ").isEmpty());
        assertTrue(visualizer.taprootLeaves(null).isEmpty());
    }

    @Test
    public void testErrorsAreValues() {
        ParseResult<ExpressionNode> result = visualizer.parse("pk(A");
        assertTrue(result.isError());
        assertEquals(ExpressionError.UNBALANCED_BRACKETS, result.getError());
        assertNotNull(result.getMessage());

        ParseResult<String> diagram = visualizer.renderExpression("and_v(v:,pk(A))");
        assertTrue(diagram.isError());
        assertEquals(ExpressionError.DANGLING_WRAPPER, diagram.getError());
    }

    @Test
    public void testMalformedInputNeverThrows() {
        String[] inputs = {"(", ")", ",", ":", "v:", "{", "}", "tr(", "tr(,)", "a:b:c", "((((", "{{}}", "pk(A)x",
                "#qpzry9x8", "tr(K,{pk(A),pk(B),pk(C)})"};
        for (String input : inputs) {
            assertNotNull(input, visualizer.parse(input).getStatus());
            assertNotNull(input, visualizer.renderExpression(input).getStatus());
            assertNotNull(input, visualizer.renderTaproot(input).getStatus());
            assertNotNull(input, visualizer.taprootLeaves(input).getStatus());
            assertEquals(input, visualizer.compact(visualizer.format(input)));
        }
    }

    @Test
    public void testRenderExpression() {
        ParseResult<String> diagram = visualizer.renderExpression("and(pk(A),pk(B))");
        assertEquals("    and\n  ┌──┴─────┐\npk(A)    pk(B)", diagram.getValue());
    }

    @Test
    public void testRenderWithSubstitutions() {
        Map<String, String> names = ImmutableMap.of("A", "Alice", "B", "Bob");
        String diagram = visualizer.renderExpression("or(pk(A),pk(B))", names).getValue();
        assertTrue(diagram.contains("pk(Alice)"));
        assertTrue(diagram.contains("pk(Bob)"));
        assertFalse(visualizer.parse("or(pk(A),pk(B))").getValue().contains("alice"));
    }

    @Test
    public void testTaproot() {
        ParseResult<TaprootRoot> root = visualizer.parseTaproot("tr(NUMS,{pk(A),pk(B)})");
        assertEquals("NUMS", root.getValue().getInternalKey());

        String diagram = visualizer.renderTaproot("tr(NUMS, {pk(A), pk(B)})", ImmutableMap.of("NUMS", "H")).getValue();
        assertTrue(diagram.startsWith("    tr(H)"));

        List<TaprootLeafInfo> leaves = visualizer.taprootLeaves("tr(NUMS,{{pk(A),pk(B)},pk(C)})").getValue();
        assertEquals(3, leaves.size());
        assertEquals(65, leaves.get(2).getControlBlockSize());
    }

    @Test
    public void testTaprootErrors() {
        assertEquals(ExpressionError.MISSING_INTERNAL_KEY, visualizer.renderTaproot("tr(,pk(A))").getError());
        assertEquals(ExpressionError.MALFORMED_TREE, visualizer.taprootLeaves("tr(K,{a,b,c})").getError());
    }

    @Test
    public void testFormatAndCompact() {
        String formatted = visualizer.format("or_d(pk(A),pk(B))");
        assertEquals("or_d(\n  pk(A),\n  pk(B)\n)", formatted);
        assertEquals("or_d(pk(A),pk(B))", visualizer.compact(formatted));
        assertEquals("", visualizer.compact(null));
        assertEquals("", visualizer.format(null));
    }

    @Test
    public void testPolicyVisualizer() {
        ExpressionVisualizer policy = new ExpressionVisualizer(Dialect.POLICY, new DiagramParams(2, 0), 16);
        assertEquals(Dialect.POLICY, policy.getDialect());
        assertEquals("or_d(pk(A),\n  pk(B)\n)", policy.format("or_d(pk(A),pk(B))"));
        assertEquals("   or\n  ┌┴─────┐\npk(A)  pk(B)", policy.renderExpression("or(pk(A),pk(B))").getValue());
    }

    @Test
    public void testWeightedPolicy() {
        ExpressionVisualizer policy = new ExpressionVisualizer(Dialect.POLICY, new DiagramParams(2, 0), 16);
        ParseResult<String> diagram = policy.renderExpression("or(9@pk(A),pk(B))");
        assertTrue(diagram.toString(), diagram.isOk());
        assertEquals("    or\n   ┌┴──────┐\n9@pk(A)  pk(B)", diagram.getValue());
        assertEquals("or(\n  9@pk(A),\n  pk(B)\n)", policy.format("or(9@pk(A),pk(B))"));
    }

    @Test
    public void testUnbalancedBracesRejected() {
        assertEquals(ExpressionError.UNBALANCED_BRACKETS, visualizer.parse("and(pk({A),B})").getError());
        assertEquals(ExpressionError.UNBALANCED_BRACKETS, visualizer.renderTaproot("tr(K,{pk({A)},pk(B)})").getError());
    }

    @Test
    public void testAnnotations() {
        ParseResult<Map<String, String>> result = visualizer.annotations("or_i(and_v(v:pk(A),older(10)),pk(B))");
        assertTrue(result.isOk());
        Map<String, String> annotations = result.getValue();
        assertEquals(ImmutableList.of("or_i", "and_v", "pk", "older"), ImmutableList.copyOf(annotations.keySet()));
        assertEquals("uses a conditional branch (OP_IF)", annotations.get("or_i"));
        assertEquals("uses a signature check (OP_CHECKSIG)", annotations.get("pk"));

        assertTrue(visualizer.annotations("foo(A)").getValue().isEmpty());
        assertTrue(visualizer.annotations("  ").isEmpty());
        assertEquals(ExpressionError.UNBALANCED_BRACKETS, visualizer.annotations("pk(A").getError());
    }
}
