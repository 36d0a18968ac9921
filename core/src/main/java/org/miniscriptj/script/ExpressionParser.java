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
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.script.ast.Fragment;
import org.miniscriptj.script.ast.Terminal;
import org.miniscriptj.script.ast.Wrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Recursive descent parser for the function-call notation shared by miniscript and the policy language, e.g.
 * {@code and_v(v:pk(A),or_d(pk(B),older(144)))}.</p>
 *
 * <p>The parser is permissive: it knows the shape of the notation (wrapper prefixes, calls, terminals)
 * but not which fragments exist or how many arguments they take. What it does insist on is structure: unbalanced
 * brackets, a wrapper with nothing after it, empty arguments and text after a call's closing bracket are reported
 * as an {@link ExpressionException}, never turned into a partial tree. Parentheses and braces must nest
 * properly across the whole input, so {@code and(pk({A),B})} is rejected even though each kind on its own
 * balances.</p>
 *
 * <p>A call may be prefixed by a policy weight, {@code 9@pk(A)}. The weight is stored on the {@link Fragment}.</p>
 *
 * <p>The input is used literally. Callers that accept user typed text should strip whitespace first, see
 * {@link ExpressionFormatter#compact(String)}.</p>
 */
public class ExpressionParser {
    private static final Logger log = LoggerFactory.getLogger(ExpressionParser.class);

    /** Default limit on nested calls and wrappers. */
    public static final int DEFAULT_MAX_DEPTH = 256;

    /** Every single-letter wrapper that may appear before a colon. */
    public static final String WRAPPER_ALPHABET = "acstdvjlnu";

    private static final Pattern WRAPPER_PREFIX = Pattern.compile("^([a-z]+):");
    private static final Pattern FRAGMENT_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final Pattern WEIGHT_PREFIX = Pattern.compile("^([0-9]{1,9})@(?=[a-z_][a-z0-9_]*\\()");

    private final BalancedSplitter splitter = BalancedSplitter.forFamily(BracketFamily.PARENS_AND_BRACES);
    private final int maxDepth;

    public ExpressionParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ExpressionParser(int maxDepth) {
        checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Parses a whole expression.
     *
     * @throws ExpressionException if the expression is empty or structurally malformed
     */
    public ExpressionNode parseNode(String expression) {
        splitter.checkBalanced(checkNotNull(expression));
        return parseNode(expression, 0);
    }

    /**
     * Parses the text between a call's brackets into its arguments, in source order. An empty string yields no
     * arguments.
     *
     * @throws ExpressionException if an argument is empty or malformed
     */
    public List<ExpressionNode> parseArguments(String args) {
        splitter.checkBalanced(checkNotNull(args));
        return parseArguments(args, 1);
    }

    private ExpressionNode parseNode(String expr, int depth) {
        if (depth > maxDepth)
            throw new ExpressionException(ExpressionError.NESTING_TOO_DEEP,
                    "Expression is nested deeper than " + maxDepth + " levels");
        if (expr.isEmpty())
            throw new ExpressionException(ExpressionError.EMPTY_ARGUMENT, "Empty expression");

        Matcher wrapper = WRAPPER_PREFIX.matcher(expr);
        if (wrapper.lookingAt())
            return parseWrapper(expr, wrapper, depth);

        Matcher weight = WEIGHT_PREFIX.matcher(expr);
        if (weight.lookingAt()) {
            String call = expr.substring(weight.end());
            return parseFragment(call, call.indexOf('('), depth, Integer.valueOf(weight.group(1)));
        }

        int open = expr.indexOf('(');
        if (open >= 0)
            return parseFragment(expr, open, depth, null);

        int comma = expr.indexOf(',');
        if (comma >= 0)
            throw new ExpressionException(ExpressionError.TRAILING_CHARACTERS,
                    "Unexpected ',' outside of an argument list in: " + expr, comma);
        return new Terminal(expr);
    }

    private ExpressionNode parseWrapper(String expr, Matcher wrapper, int depth) {
        String tagRun = wrapper.group(1);
        List<Character> tags = new ArrayList<Character>(tagRun.length());
        for (int i = 0; i < tagRun.length(); i++) {
            char tag = tagRun.charAt(i);
            if (WRAPPER_ALPHABET.indexOf(tag) < 0)
                throw new ExpressionException(ExpressionError.UNKNOWN_WRAPPER_TAG,
                        "Unknown wrapper '" + tag + "' in: " + expr, i);
            tags.add(tag);
        }
        String rest = expr.substring(wrapper.end());
        if (rest.isEmpty())
            throw new ExpressionException(ExpressionError.DANGLING_WRAPPER,
                    "Wrapper '" + tagRun + ":' is not followed by an expression", wrapper.end());
        return new Wrapper(tags, parseNode(rest, depth + 1));
    }

    // Callers have checked that the whole input balances, so every substring handed down here does too.
    private Fragment parseFragment(String expr, int open, int depth, @Nullable Integer weight) {
        String name = expr.substring(0, open);
        if (!FRAGMENT_NAME.matcher(name).matches())
            throw new ExpressionException(ExpressionError.INVALID_FRAGMENT_NAME,
                    "Not a fragment name: '" + name + "'", 0);

        int close = splitter.indexOfMatchingClose(expr, open);
        if (close < 0)
            throw new ExpressionException(ExpressionError.UNBALANCED_BRACKETS,
                    "Missing ')' for " + name + "(", expr.length());
        if (close != expr.length() - 1)
            throw new ExpressionException(ExpressionError.TRAILING_CHARACTERS,
                    "Unexpected text after " + name + "(...): " + expr.substring(close + 1), close + 1);

        List<ExpressionNode> args = parseArguments(expr.substring(open + 1, close), depth + 1);
        if (log.isDebugEnabled()) {
            Integer arity = FragmentAnnotations.expectedArity(name);
            if (arity != null && arity != FragmentAnnotations.VARIADIC && arity != args.size())
                log.debug("{} usually takes {} arguments, got {}", name, arity, args.size());
        }
        return new Fragment(name, args, weight);
    }

    private List<ExpressionNode> parseArguments(String args, int depth) {
        List<ExpressionNode> nodes = new ArrayList<ExpressionNode>();
        if (args.isEmpty())
            return nodes;
        for (String segment : splitter.split(args, ',')) {
            if (segment.isEmpty())
                throw new ExpressionException(ExpressionError.EMPTY_ARGUMENT, "Empty argument in: " + args);
            nodes.add(parseNode(segment, depth));
        }
        return nodes;
    }
}
