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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Spacing used by {@link TreeLayout} and {@link AsciiTreeRenderer}. Use {@link #get()} for the defaults.
 */
public class DiagramParams {

    /** Minimum number of blank columns between neighbouring subtrees. */
    public static final int DEFAULT_SIBLING_GAP = 4;
    /** Extra columns allocated to the right of the widest row. */
    public static final int DEFAULT_MARGIN = 2;

    private final int siblingGap;
    private final int margin;

    public DiagramParams(int siblingGap, int margin) {
        checkArgument(siblingGap >= 1, "siblingGap must be at least 1: %s", siblingGap);
        checkArgument(margin >= 0, "margin must not be negative: %s", margin);
        this.siblingGap = siblingGap;
        this.margin = margin;
    }

    private static DiagramParams instance;
    public static synchronized DiagramParams get() {
        if (instance == null) {
            instance = new DiagramParams(DEFAULT_SIBLING_GAP, DEFAULT_MARGIN);
        }
        return instance;
    }

    public int getSiblingGap() {
        return siblingGap;
    }

    public int getMargin() {
        return margin;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("siblingGap", siblingGap).add("margin", margin).toString();
    }
}
