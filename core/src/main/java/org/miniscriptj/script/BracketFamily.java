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

package org.miniscriptj.script;

/**
 * Which brackets a {@link BalancedSplitter} tracks when deciding whether it is at the top level.
 */
public enum BracketFamily {
    /** Only {@code (} and {@code )}: function-call arguments and the key/tree split of a descriptor. */
    PARENS(false),
    /** Parentheses and {@code {}} braces: the left/right split inside a bracket tree. */
    PARENS_AND_BRACES(true);

    private final boolean tracksBraces;

    BracketFamily(boolean tracksBraces) {
        this.tracksBraces = tracksBraces;
    }

    public boolean tracksBraces() {
        return tracksBraces;
    }
}
