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

package org.miniscriptj.core;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown by the parsers when an expression is structurally malformed. The
 * {@link org.miniscriptj.ExpressionVisualizer} converts these into result values, so they never escape the
 * library boundary.
 */
public class ExpressionException extends RuntimeException {

    private final ExpressionError err;
    private final int position;

    public ExpressionException(ExpressionError err, String msg) {
        this(err, msg, -1);
    }

    public ExpressionException(ExpressionError err, String msg, int position) {
        super(msg);
        this.err = checkNotNull(err);
        this.position = position;
    }

    public ExpressionError getError() {
        return err;
    }

    /** Offset of the offending character within the string being scanned, or -1 if not known. */
    public int getPosition() {
        return position;
    }
}
