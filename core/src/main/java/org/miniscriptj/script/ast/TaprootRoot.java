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
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Top of a {@code tr(KEY,TREE)} descriptor: the internal key and, optionally, the script tree.
 */
public final class TaprootRoot extends ExpressionNode {

    private final String internalKey;
    private final ImmutableList<ExpressionNode> children;

    public TaprootRoot(String internalKey, @Nullable ExpressionNode tree) {
        checkNotNull(internalKey);
        checkArgument(!internalKey.isEmpty(), "Internal key must not be empty");
        this.internalKey = internalKey;
        this.children = tree == null ? ImmutableList.<ExpressionNode>of() : ImmutableList.of(tree);
    }

    public String getInternalKey() {
        return internalKey;
    }

    /** The script tree, or null for a key-path only descriptor. */
    @Nullable
    public ExpressionNode getTree() {
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public Type getType() {
        return Type.TAPROOT_ROOT;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return children;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitTaprootRoot(this);
    }

    @Override
    String describe() {
        return internalKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaprootRoot other = (TaprootRoot) o;
        return internalKey.equals(other.internalKey) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(internalKey, children);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("internalKey", internalKey).add("tree", getTree()).toString();
    }
}
