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

package org.miniscriptj.script.ast;

import java.util.List;

/**
 * <p>A node of the tree produced by {@link org.miniscriptj.script.ExpressionParser} and
 * {@link org.miniscriptj.taproot.TaprootTreeParser}.</p>
 *
 * <p>Both grammars share this model: function-call expressions produce {@link Terminal}, {@link Wrapper} and
 * {@link Fragment} nodes, bracket trees produce {@link TaprootRoot}, {@link TaprootBranch} and
 * {@link TaprootLeaf} nodes. Nodes are immutable and are discarded once a call has returned its result.</p>
 */
public abstract class ExpressionNode {

    /** Discriminates the concrete node classes. */
    public enum Type {
        TERMINAL,
        WRAPPER,
        FRAGMENT,
        TAPROOT_ROOT,
        TAPROOT_BRANCH,
        TAPROOT_LEAF
    }

    ExpressionNode() {
    }

    public abstract Type getType();

    /** The nodes directly below this one, in source order. Never null. */
    public abstract List<ExpressionNode> getChildren();

    public abstract <T> T accept(NodeVisitor<T> visitor);

    public boolean isLeaf() {
        return getChildren().isEmpty();
    }

    /**
     * Returns true if this node or any node below it mentions the given text, ignoring case. Fragment names,
     * wrapper tags, terminal values, leaf scripts and internal keys are all searched.
     */
    public boolean contains(String pattern) {
        String lower = pattern.toLowerCase();
        if (describe().toLowerCase().contains(lower))
            return true;
        for (ExpressionNode child : getChildren()) {
            if (child.contains(pattern))
                return true;
        }
        return false;
    }

    /** Short text of this node alone, without its children. Used for searching. */
    abstract String describe();
}
