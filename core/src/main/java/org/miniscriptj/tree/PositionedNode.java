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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A node of a laid out tree: the text to print, the row ({@code depth}) and the column its text starts at
 * ({@code position}). {@code rightmostExtent} is the first free column to the right of this node's whole subtree.
 */
public final class PositionedNode {

    private final String text;
    private final int depth;
    private final int position;
    private final int rightmostExtent;
    private final ImmutableList<PositionedNode> children;

    public PositionedNode(String text, int depth, int position, int rightmostExtent, List<PositionedNode> children) {
        checkArgument(depth >= 0 && position >= 0, "Negative depth or position");
        this.text = checkNotNull(text);
        this.depth = depth;
        this.position = position;
        this.rightmostExtent = rightmostExtent;
        this.children = ImmutableList.copyOf(children);
    }

    public String getText() {
        return text;
    }

    public int getDepth() {
        return depth;
    }

    public int getPosition() {
        return position;
    }

    public int getRightmostExtent() {
        return rightmostExtent;
    }

    public List<PositionedNode> getChildren() {
        return children;
    }

    /** The column connectors attach to: the middle of the text, rounding to the left. */
    public int getCenter() {
        return position + Math.max(text.length() - 1, 0) / 2;
    }

    /** Depth of the deepest node in this subtree. */
    public int getMaxDepth() {
        int max = depth;
        for (PositionedNode child : children)
            max = Math.max(max, child.getMaxDepth());
        return max;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("text", text)
                .add("depth", depth)
                .add("position", position)
                .add("rightmostExtent", rightmostExtent)
                .add("children", children.size())
                .toString();
    }
}
