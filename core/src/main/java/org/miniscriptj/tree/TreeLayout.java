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
import org.miniscriptj.script.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Assigns a row and a column to every node of a parsed expression or Taproot tree.</p>
 *
 * <p>The tree is walked once, bottom up. Leaves are placed at the next free column, each subtree starting at least
 * {@link DiagramParams#getSiblingGap()} columns after the previous sibling's subtree ends. A parent starts at the
 * midpoint, rounded down, of its first and last child's start columns. Labels and displayed children come from a
 * {@link NodeLabeler}.</p>
 */
public class TreeLayout {

    private final DiagramParams params;

    public TreeLayout() {
        this(DiagramParams.get());
    }

    public TreeLayout(DiagramParams params) {
        this.params = checkNotNull(params);
    }

    public PositionedNode layout(ExpressionNode root) {
        return layout(root, ImmutableMap.<String, String>of());
    }

    /**
     * Lays out {@code root} with labels rewritten through {@code substitutions}. The table is only read.
     */
    public PositionedNode layout(ExpressionNode root, Map<String, String> substitutions) {
        checkNotNull(root);
        return place(root, new NodeLabeler(substitutions), 0, 0);
    }

    private PositionedNode place(ExpressionNode node, NodeLabeler labeler, int depth, int start) {
        String text = labeler.label(node);
        List<ExpressionNode> children = labeler.displayedChildren(node);
        if (children.isEmpty())
            return new PositionedNode(text, depth, start, start + text.length(), ImmutableList.<PositionedNode>of());

        List<PositionedNode> placed = new ArrayList<PositionedNode>(children.size());
        int cursor = start;
        for (ExpressionNode child : children) {
            PositionedNode positioned = place(child, labeler, depth + 1, cursor);
            placed.add(positioned);
            cursor = positioned.getRightmostExtent() + params.getSiblingGap();
        }

        PositionedNode first = placed.get(0);
        PositionedNode last = placed.get(placed.size() - 1);
        int position = (first.getPosition() + last.getPosition()) / 2;
        int extent = Math.max(position + text.length(), last.getRightmostExtent());
        return new PositionedNode(text, depth, position, extent, placed);
    }
}
