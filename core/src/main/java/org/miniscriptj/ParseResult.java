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

package org.miniscriptj;

import com.google.common.base.MoreObjects;
import org.miniscriptj.core.ExpressionError;
import org.miniscriptj.core.ExpressionException;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Outcome of a call into {@link ExpressionVisualizer}: a value, the empty sentinel for blank input, or a structural
 * error. Errors are values here so that callers redrawing on every keystroke can simply ignore them.
 */
public final class ParseResult<T> {

    public enum Status {
        OK,
        EMPTY,
        ERROR
    }

    private static final ParseResult<?> EMPTY = new ParseResult<Object>(Status.EMPTY, null, null, null);

    private final Status status;
    @Nullable private final T value;
    @Nullable private final ExpressionError error;
    @Nullable private final String message;

    private ParseResult(Status status, @Nullable T value, @Nullable ExpressionError error, @Nullable String message) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<T>(Status.OK, checkNotNull(value), null, null);
    }

    @SuppressWarnings("unchecked")
    public static <T> ParseResult<T> empty() {
        return (ParseResult<T>) EMPTY;
    }

    public static <T> ParseResult<T> error(ExpressionException e) {
        return new ParseResult<T>(Status.ERROR, null, e.getError(), e.getMessage());
    }

    /** Carries an empty or error result over to a different value type. */
    public static <T> ParseResult<T> propagate(ParseResult<?> failed) {
        checkArgument(!failed.isOk(), "Only empty or error results can be propagated");
        if (failed.isEmpty())
            return empty();
        return new ParseResult<T>(Status.ERROR, null, failed.error, failed.message);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isEmpty() {
        return status == Status.EMPTY;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * @throws IllegalStateException if this result holds no value
     */
    public T getValue() {
        checkState(status == Status.OK, "No value in a %s result", status);
        return value;
    }

    /** The kind of structural error, or null unless {@link #isError()}. */
    @Nullable
    public ExpressionError getError() {
        return error;
    }

    /** A human readable description of the error, or null unless {@link #isError()}. */
    @Nullable
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("status", status)
                .add("value", value)
                .add("error", error)
                .add("message", message)
                .toString();
    }
}
