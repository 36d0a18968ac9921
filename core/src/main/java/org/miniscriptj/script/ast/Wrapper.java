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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One or more wrapper tags, such as the {@code sv} in {@code sv:older(144)}, applied to a single child. A wrapper
 * never introduces branching.
 */
public final class Wrapper extends ExpressionNode {

    private final ImmutableList<Character> tags;
    private final ExpressionNode child;

    public Wrapper(List<Character> tags, ExpressionNode child) {
        checkArgument(!tags.isEmpty(), "A wrapper needs at least one tag");
        this.tags = ImmutableList.copyOf(tags);
        this.child = checkNotNull(child);
    }

    /** The tags in source order; the first tag is the outermost one. */
    public List<Character> getTags() {
        return tags;
    }

    /** The tags as they appear before the colon, e.g. {@code "sv"}. */
    public String getTagString() {
        StringBuilder sb = new StringBuilder(tags.size());
        for (Character tag : tags)
            sb.append(tag.charValue());
        return sb.toString();
    }

    public ExpressionNode getChild() {
        return child;
    }

    @Override
    public Type getType() {
        return Type.WRAPPER;
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return ImmutableList.of(child);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visitWrapper(this);
    }

    @Override
    String describe() {
        return getTagString() + ":";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Wrapper other = (Wrapper) o;
        return tags.equals(other.tags) && child.equals(other.child);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(tags, child);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("tags", getTagString()).add("child", child).toString();
    }
}
