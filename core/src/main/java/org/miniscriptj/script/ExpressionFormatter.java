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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Pretty-prints expressions for display and compacts them back.</p>
 *
 * <p>Formatting works on the token stream rather than on a parsed tree, so half-typed input formats as well as it
 * can instead of failing. The rules, with two spaces per indentation level:</p>
 * <ul>
 *     <li>after the {@code (} of a multi-line operator (see {@link Dialect}) a line break is inserted, unless the
 *     argument list is empty;</li>
 *     <li>every {@code ,} inside brackets is followed by a line break;</li>
 *     <li>a {@code )} directly following another {@code )} goes on its own line, one level out.</li>
 * </ul>
 *
 * <p>{@link #compact(String)} undoes {@link #format(String)} exactly for any input without whitespace, and both
 * are idempotent.</p>
 */
public class ExpressionFormatter {

    private static final String INDENT = "  ";
    private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

    private final Dialect dialect;
    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

    public ExpressionFormatter(Dialect dialect) {
        this.dialect = checkNotNull(dialect);
    }

    public Dialect getDialect() {
        return dialect;
    }

    public String format(String expression) {
        return format(expression, ImmutableMap.<String, String>of());
    }

    /**
     * Formats {@code expression}, replacing every name token that is a key of {@code substitutions} with its value.
     * The table is only read.
     */
    public String format(String expression, Map<String, String> substitutions) {
        checkNotNull(substitutions);
        String clean = compact(expression);
        if (clean.isEmpty())
            return clean;
        return formatTokens(tokenizer.tokenize(clean), substitutions);
    }

    /** Removes all whitespace, including the line breaks and indentation added by {@link #format}. */
    public static String compact(String expression) {
        return WHITESPACE.removeFrom(checkNotNull(expression));
    }

    private String formatTokens(List<Token> tokens, Map<String, String> substitutions) {
        StringBuilder result = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token prev = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            switch (token.getType()) {
                case NAME:
                    String value = substitutions.get(token.getValue());
                    result.append(value != null ? value : token.getValue());
                    break;
                case OPEN:
                    result.append('(');
                    depth++;
                    boolean multiLine = prev != null && prev.is(Token.Type.NAME)
                            && dialect.isMultiLineOperator(prev.getValue());
                    if (multiLine && next != null && !next.is(Token.Type.CLOSE))
                        newLine(result, depth);
                    break;
                case CLOSE:
                    depth--;
                    if (prev != null && prev.is(Token.Type.CLOSE))
                        newLine(result, depth);
                    result.append(')');
                    break;
                case COMMA:
                    result.append(',');
                    if (depth > 0 && next != null)
                        newLine(result, depth);
                    break;
                default:
                    throw new IllegalStateException("Unknown token type: " + token.getType());
            }
        }
        return result.toString();
    }

    private static void newLine(StringBuilder result, int depth) {
        result.append('\n').append(Strings.repeat(INDENT, Math.max(depth, 0)));
    }
}
