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

/**
 * Position of one script leaf in a Taproot tree, in left to right order.
 */
public final class TaprootLeafInfo {

    /** Size of the control block for a leaf at the root: one leaf version byte plus the 32 byte internal key. */
    public static final int CONTROL_BLOCK_BASE_SIZE = 33;
    /** Each level of the tree above a leaf adds one 32 byte hash to its control block. */
    public static final int CONTROL_BLOCK_NODE_SIZE = 32;

    private final int index;
    private final int depth;
    private final String script;

    TaprootLeafInfo(int index, int depth, String script) {
        this.index = index;
        this.depth = depth;
        this.script = script;
    }

    public int getIndex() {
        return index;
    }

    /** Number of branches between the root and this leaf. */
    public int getDepth() {
        return depth;
    }

    public String getScript() {
        return script;
    }

    /** Bytes of control block needed to spend this leaf through the script path. */
    public int getControlBlockSize() {
        return CONTROL_BLOCK_BASE_SIZE + CONTROL_BLOCK_NODE_SIZE * depth;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("index", index)
                .add("depth", depth)
                .add("script", script)
                .toString();
    }
}
