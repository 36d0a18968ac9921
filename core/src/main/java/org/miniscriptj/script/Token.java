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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An atomic piece of an expression as produced by {@link ExpressionTokenizer}.
 */
public final class Token {

    public enum Type {
        /** A run of characters other than brackets and commas, e.g. {@code and_v} or {@code v:pk}. */
        NAME,
        OPEN,
        CLOSE,
        COMMA
    }

    static final Token OPEN = new Token(Type.OPEN, "(");
    static final Token CLOSE = new Token(Type.CLOSE, ")");
    static final Token COMMA = new Token(Type.COMMA, ",");

    private final Type type;
    private final String value;

    private Token(Type type, String value) {
        this.type = type;
        this.value = value;
    }

    public static Token name(String value) {
        return new Token(Type.NAME, checkNotNull(value));
    }

    public Type getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public boolean is(Type type) {
        return this.type == type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Token other = (Token) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(type, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("type", type).add("value", value).toString();
    }
}
