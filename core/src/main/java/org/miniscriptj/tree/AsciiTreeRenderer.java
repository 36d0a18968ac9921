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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Draws a {@link PositionedNode} tree as text.</p>
 *
 * <p>Even rows hold node labels, odd rows the connectors between a level and the next:</p>
 * <pre>
 *     and
 *   ┌──┴─────┐
 * pk(A)    pk(B)
 * </pre>
 *
 * <p>A single child is joined by {@code │} halfway between the two centres. Several children are joined by a
 * horizontal bar from the first to the last child's centre, with {@code ┬} over the inner children and {@code ┴}
 * under the parent. A parent whose centre lies outside that span, which happens when its label is wider than the
 * children below it, has the bar extended to it and ends in {@code └} or {@code ┘}. The diagram is drawn into a character grid and joined into lines at the end; trailing blanks
 * are trimmed from every line.</p>
 */
public class AsciiTreeRenderer {

    static final char VERTICAL = '│';
    static final char HORIZONTAL = '─';
    static final char LEFT_CORNER = '┌';
    static final char RIGHT_CORNER = '┐';
    static final char TEE = '┬';
    static final char PARENT = '┴';
    static final char CROSS = '┼';
    static final char PARENT_AT_LEFT = '├';
    static final char PARENT_AT_RIGHT = '┤';
    static final char PARENT_BEFORE_LEFT = '└';
    static final char PARENT_PAST_RIGHT = '┘';

    private final DiagramParams params;

    public AsciiTreeRenderer() {
        this(DiagramParams.get());
    }

    public AsciiTreeRenderer(DiagramParams params) {
        this.params = checkNotNull(params);
    }

    public String render(PositionedNode root) {
        checkNotNull(root);
        int rows = 2 * root.getMaxDepth() + 1;
        int width = maxExtent(root) + params.getMargin();
        char[][] grid = new char[rows][width];
        for (char[] row : grid)
            Arrays.fill(row, ' ');

        Deque<PositionedNode> pending = new ArrayDeque<PositionedNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            PositionedNode node = pending.pop();
            stamp(grid[node.getDepth() * 2], node);
            if (!node.getChildren().isEmpty())
                connect(grid[node.getDepth() * 2 + 1], node);
            for (PositionedNode child : node.getChildren())
                pending.push(child);
        }

        List<String> lines = new ArrayList<String>(rows);
        for (char[] row : grid)
            lines.add(CharMatcher.whitespace().trimTrailingFrom(new String(row)));
        return Joiner.on('\n').join(lines);
    }

    private static void stamp(char[] row, PositionedNode node) {
        String text = node.getText();
        text.getChars(0, text.length(), row, node.getPosition());
    }

    private static void connect(char[] row, PositionedNode parent) {
        List<PositionedNode> children = parent.getChildren();
        int parentCenter = parent.getCenter();
        if (children.size() == 1) {
            row[(parentCenter + children.get(0).getCenter()) / 2] = VERTICAL;
            return;
        }

        int left = children.get(0).getCenter();
        int right = children.get(children.size() - 1).getCenter();
        for (int col = Math.min(left, parentCenter); col <= Math.max(right, parentCenter); col++)
            row[col] = HORIZONTAL;
        for (int i = 1; i < children.size() - 1; i++)
            row[children.get(i).getCenter()] = TEE;
        row[left] = parentCenter < left ? TEE : LEFT_CORNER;
        row[right] = parentCenter > right ? TEE : RIGHT_CORNER;

        if (parentCenter < left)
            row[parentCenter] = PARENT_BEFORE_LEFT;
        else if (parentCenter > right)
            row[parentCenter] = PARENT_PAST_RIGHT;
        else if (parentCenter == left)
            row[parentCenter] = PARENT_AT_LEFT;
        else if (parentCenter == right)
            row[parentCenter] = PARENT_AT_RIGHT;
        else if (row[parentCenter] == TEE)
            row[parentCenter] = CROSS;
        else
            row[parentCenter] = PARENT;
    }

    private static int maxExtent(PositionedNode root) {
        int max = root.getRightmostExtent();
        for (PositionedNode child : root.getChildren())
            max = Math.max(max, maxExtent(child));
        return max;
    }
}
