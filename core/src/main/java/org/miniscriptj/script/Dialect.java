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

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * The two function-call notations handled by {@link ExpressionFormatter}. They share one tokenizer and one set of
 * layout rules and differ only in which operators are spread over several lines.
 */
public enum Dialect {
    MINISCRIPT(ImmutableSet.of("and", "or", "thresh", "and_v", "or_c", "or_d", "or_i", "andor")),
    POLICY(ImmutableSet.of("and", "or", "thresh", "threshold"));

    private final ImmutableSet<String> multiLineOperators;

    Dialect(ImmutableSet<String> multiLineOperators) {
        this.multiLineOperators = multiLineOperators;
    }

    public Set<String> getMultiLineOperators() {
        return multiLineOperators;
    }

    /**
     * True if the arguments of a call to {@code name} go on separate lines. Wrapped, weighted and suffixed forms
     * count as well, so {@code v:and_v} and {@code and_v} both match {@code and_v}, {@code 9@and} matches
     * {@code and}, and anything containing {@code _or} matches {@code or}.
     */
    public boolean isMultiLineOperator(String name) {
        for (String op : multiLineOperators) {
            if (name.equals(op) || name.endsWith(":" + op) || name.endsWith("@" + op) || name.contains("_" + op))
                return true;
        }
        return false;
    }
}
