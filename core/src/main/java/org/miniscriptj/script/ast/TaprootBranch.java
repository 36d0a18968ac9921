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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@code {left,right}} pair in a bracket tree. Always has exactly two children.
 */
public final class TaprootBranch extends ExpressionNode {

    private final ImmutableList<ExpressionNode> children;

    public TaprootBranch(ExpressionNode left, ExpressionNode right) {
        this.children = ImmutableList.of(checkNotNull(left), checkNotNull(right));
    }

    public ExpressionNode getLeft() {
        return children.get(0);
    }

    public ExpressionNode getRight() {
        return children.get(1);
    }

    @Override
    public Type getType() {
        return Type.TAPROOT_BRANCH;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return children;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitTaprootBranch(this);
    }

    @Override
    String describe() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return children.equals(((TaprootBranch) o).children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("left", getLeft()).add("right", getRight()).toString();
    }
}
