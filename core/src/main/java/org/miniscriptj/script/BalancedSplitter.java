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

import org.miniscriptj.core.ExpressionError;
import org.miniscriptj.core.ExpressionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

/**
 * <p>Finds delimiters that sit at nesting depth zero.</p>
 *
 * <p>The function-call parser, the {@code KEY,TREE} splitter and the {@code {left,right}} splitter all need
 * the same scan with a different set of brackets, so the bracket set is chosen with a {@link BracketFamily}.
 * A delimiter counts as top level only when no tracked bracket is open. Open brackets are kept on a stack, so a
 * closing bracket must match the most recent open one: {@code ({)}} does not balance. A closing bracket with no
 * matching partner is reported as {@link ExpressionError#UNBALANCED_BRACKETS} as soon as it is seen.</p>
 *
 * <p>Instances are immutable and may be shared.</p>
 */
public final class BalancedSplitter {

    private static final BalancedSplitter PARENS = new BalancedSplitter(BracketFamily.PARENS);
    private static final BalancedSplitter PARENS_AND_BRACES = new BalancedSplitter(BracketFamily.PARENS_AND_BRACES);

    private final BracketFamily family;

    private BalancedSplitter(BracketFamily family) {
        this.family = family;
    }

    public static BalancedSplitter forFamily(BracketFamily family) {
        checkNotNull(family);
        return family == BracketFamily.PARENS ? PARENS : PARENS_AND_BRACES;
    }

    public BracketFamily getFamily() {
        return family;
    }

    /**
     * Returns the index of the first {@code delimiter} at or after {@code fromIndex} that is outside every
     * tracked bracket pair, or -1 if there is none.
     *
     * @throws ExpressionException if a closing bracket is found before its opening partner
     */
    public int indexOfTopLevel(String s, char delimiter, int fromIndex) {
        checkPositionIndex(fromIndex, s.length());
        Depth depth = new Depth();
        for (int i = fromIndex; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == delimiter && depth.isZero())
                return i;
            depth.update(c, i);
        }
        return -1;
    }

    public int indexOfTopLevel(String s, char delimiter) {
        return indexOfTopLevel(s, delimiter, 0);
    }

    /**
     * Splits {@code s} at every top level {@code delimiter}. The result always has at least one element;
     * {@code "a,(b,c),d"} gives {@code ["a", "(b,c)", "d"]}.
     *
     * @throws ExpressionException if the brackets of {@code s} do not balance
     */
    public List<String> split(String s, char delimiter) {
        checkBalanced(s);
        List<String> parts = new ArrayList<String>();
        int start = 0;
        int index;
        while ((index = indexOfTopLevel(s, delimiter, start)) >= 0) {
            parts.add(s.substring(start, index));
            start = index + 1;
        }
        parts.add(s.substring(start));
        return parts;
    }

    /**
     * Returns the index of the bracket that closes the one at {@code openIndex}, or -1 if the string ends
     * first.
     *
     * @throws ExpressionException if a mismatched closing bracket is found on the way
     */
    public int indexOfMatchingClose(String s, int openIndex) {
        checkArgument(openIndex >= 0 && openIndex < s.length(), "Index out of range: %s", openIndex);
        char open = s.charAt(openIndex);
        checkArgument(open == '(' || (open == '{' && family.tracksBraces()),
                "Not an opening bracket of this family: %s", open);
        Depth depth = new Depth();
        for (int i = openIndex; i < s.length(); i++) {
            depth.update(s.charAt(i), i);
            if (depth.isZero())
                return i;
        }
        return -1;
    }

    /** True if every tracked bracket in {@code s} is matched. */
    public boolean isBalanced(String s) {
        Depth depth = new Depth();
        for (int i = 0; i < s.length(); i++) {
            if (!depth.tryUpdate(s.charAt(i)))
                return false;
        }
        return depth.isZero();
    }

    /**
     * @throws ExpressionException with {@link ExpressionError#UNBALANCED_BRACKETS} if {@code s} does not balance
     */
    public void checkBalanced(String s) {
        Depth depth = new Depth();
        for (int i = 0; i < s.length(); i++)
            depth.update(s.charAt(i), i);
        if (!depth.isZero())
            throw new ExpressionException(ExpressionError.UNBALANCED_BRACKETS,
                    "Missing closing bracket in: " + s, s.length());
    }

    private final class Depth {
        private final Deque<Character> open = new ArrayDeque<Character>();

        void update(char c, int index) {
            if (!tryUpdate(c))
                throw new ExpressionException(ExpressionError.UNBALANCED_BRACKETS,
                        "Unexpected '" + c + "' at position " + index, index);
        }

        /** Returns false if {@code c} closes a bracket other than the innermost open one. */
        boolean tryUpdate(char c) {
            switch (c) {
                case '(':
                    open.push(c);
                    return true;
                case ')':
                    return closes('(');
                case '{':
                    if (family.tracksBraces())
                        open.push(c);
                    return true;
                case '}':
                    return !family.tracksBraces() || closes('{');
                default:
                    return true;
            }
        }

        private boolean closes(char opening) {
            if (open.isEmpty() || open.peek() != opening)
                return false;
            open.pop();
            return true;
        }

        boolean isZero() {
            return open.isEmpty();
        }
    }
}
