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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A script leaf of a bracket tree. The script is kept as raw text; parse it with
 * {@link org.miniscriptj.script.ExpressionParser} if its structure is needed.
 */
public final class TaprootLeaf extends ExpressionNode {

    private final String script;

    public TaprootLeaf(String script) {
        checkNotNull(script);
        checkArgument(!script.isEmpty(), "Leaf script must not be empty");
        this.script = script;
    }

    public String getScript() {
        return script;
    }

    @Override
    public Type getType() {
        return Type.TAPROOT_LEAF;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return ImmutableList.of();
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitTaprootLeaf(this);
    }

    @Override
    String describe() {
        return script;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return script.equals(((TaprootLeaf) o).script);
    }

    @Override
    public int hashCode() {
        return script.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).addValue(script).toString();
    }
}
