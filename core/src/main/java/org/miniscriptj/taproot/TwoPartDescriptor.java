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

package org.miniscriptj.taproot;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The two halves of a {@code tr(KEY,TREE)} descriptor as text: the internal key and, if present, the unparsed
 * script tree.
 */
public final class TwoPartDescriptor {

    /**
     * The standard "nothing up my sleeve" x-only point. Using it as the internal key disables key-path spending.
     */
    public static final String NUMS_POINT = "50929b74c1a04954b78b4b6035e97a5e078a5a0f28ec96d547bfee9ace803ac0";

    private final String internalKey;
    @Nullable private final String tree;

    public TwoPartDescriptor(String internalKey, @Nullable String tree) {
        this.internalKey = checkNotNull(internalKey);
        this.tree = tree;
    }

    public String getInternalKey() {
        return internalKey;
    }

    /** The tree text, or null for a key-path only descriptor. */
    @Nullable
    public String getTree() {
        return tree;
    }

    public boolean hasTree() {
        return tree != null;
    }

    /** True if the internal key is the NUMS point, i.e. the output can only be spent through the script tree. */
    public boolean hasUnspendableKey() {
        return NUMS_POINT.equalsIgnoreCase(internalKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TwoPartDescriptor other = (TwoPartDescriptor) o;
        return internalKey.equals(other.internalKey) && Objects.equal(tree, other.tree);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(internalKey, tree);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("internalKey", internalKey).add("tree", tree).toString();
    }
}
