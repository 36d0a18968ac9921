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
 * A named operation with zero or more ordered arguments, e.g. {@code and_v(v:pk(A),older(10))}.
 * Argument order is meaningful: for counted fragments such as {@code thresh} and {@code multi} the first
 * argument is the required count.
 *
 * <p>In the policy language a fragment may carry a relative weight, {@code 9@pk(A)}; the weight is kept as parsed
 * and has no meaning to this library beyond display.</p>
 */
public final class Fragment extends ExpressionNode {

    private final String name;
    private final ImmutableList<ExpressionNode> args;
    @Nullable private final Integer weight;

    public Fragment(String name, List<? extends ExpressionNode> args) {
        this(name, args, null);
    }

    public Fragment(String name, List<? extends ExpressionNode> args, @Nullable Integer weight) {
        checkNotNull(name);
        checkArgument(!name.isEmpty(), "Fragment name must not be empty");
        checkArgument(weight == null || weight >= 0, "Negative weight: %s", weight);
        this.name = name;
        this.args = ImmutableList.copyOf(args);
        this.weight = weight;
    }

    public String getName() {
        return name;
    }

    public List<ExpressionNode> getArgs() {
        return args;
    }

    /** The policy weight written before the name, or null if there is none. */
    @Nullable
    public Integer getWeight() {
        return weight;
    }

    public boolean hasWeight() {
        return weight != null;
    }

    /** True if every argument is a {@link Terminal}, as in {@code pk(A)} or {@code older(144)}. */
    public boolean hasOnlyTerminalArgs() {
        for (ExpressionNode arg : args) {
            if (arg.getType() != Type.TERMINAL)
                return false;
        }
        return true;
    }

    @Override
    public Type getType() {
        return Type.FRAGMENT;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return args;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitFragment(this);
    }

    @Override
    String describe() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fragment other = (Fragment) o;
        return name.equals(other.name) && args.equals(other.args) && Objects.equal(weight, other.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name, args, weight);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("weight", weight)
                .add("name", name)
                .add("args", args)
                .toString();
    }
}
