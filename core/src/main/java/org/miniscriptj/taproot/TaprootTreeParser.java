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

import org.miniscriptj.core.ExpressionError;
import org.miniscriptj.core.ExpressionException;
import org.miniscriptj.script.BalancedSplitter;
import org.miniscriptj.script.BracketFamily;
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.script.ast.TaprootBranch;
import org.miniscriptj.script.ast.TaprootLeaf;
import org.miniscriptj.script.ast.TaprootRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Parses Taproot descriptors such as {@code tr(NUMS,{{pk(A),pk(B)},pk(C)})}.</p>
 *
 * <p>The descriptor is first cut into its internal key and tree text by {@link #parseTwoPart(String)}; the tree
 * text is then parsed by {@link #parseBracketTree(String)} into {@link TaprootBranch}es and {@link TaprootLeaf}s.
 * Leaf scripts are kept as text.</p>
 */
public class TaprootTreeParser {
    private static final Logger log = LoggerFactory.getLogger(TaprootTreeParser.class);

    /** Deepest leaf a Taproot control block can commit to. */
    public static final int MAX_TREE_DEPTH = 128;

    private static final String DESCRIPTOR_PREFIX = "tr(";
    private static final Pattern CHECKSUM_SUFFIX = Pattern.compile("#[qpzry9x8gf2tvdw0s3jn54khce6mua7l]{8}$");
    private static final String[] OR_BRANCH_PREFIXES = {"or_d(", "or_c(", "or_i("};

    private final BalancedSplitter parens = BalancedSplitter.forFamily(BracketFamily.PARENS);
    private final BalancedSplitter parensAndBraces = BalancedSplitter.forFamily(BracketFamily.PARENS_AND_BRACES);

    /**
     * Splits a descriptor into internal key and tree text. A trailing {@code #checksum} and the {@code tr(...)}
     * wrapper are removed if present, so {@code tr(K,{A,B})#abcdefgh}, {@code tr(K,{A,B})} and {@code K,{A,B}}
     * all give key {@code K} and tree {@code {A,B}}.
     *
     * @throws ExpressionException if the key is missing, the tree is missing after a comma or the
     * {@code tr(...)} wrapper is not closed
     */
    public TwoPartDescriptor parseTwoPart(String descriptor) {
        checkNotNull(descriptor);
        String content = CHECKSUM_SUFFIX.matcher(descriptor).replaceFirst("");
        if (content.startsWith(DESCRIPTOR_PREFIX)) {
            int close = parens.indexOfMatchingClose(content, DESCRIPTOR_PREFIX.length() - 1);
            if (close < 0)
                throw new ExpressionException(ExpressionError.UNBALANCED_BRACKETS,
                        "Missing ')' for tr(", content.length());
            if (close != content.length() - 1)
                throw new ExpressionException(ExpressionError.TRAILING_CHARACTERS,
                        "Unexpected text after tr(...): " + content.substring(close + 1), close + 1);
            content = content.substring(DESCRIPTOR_PREFIX.length(), close);
        }

        int comma = parens.indexOfTopLevel(content, ',');
        String key = comma < 0 ? content : content.substring(0, comma);
        if (key.isEmpty())
            throw new ExpressionException(ExpressionError.MISSING_INTERNAL_KEY,
                    "Descriptor has no internal key: " + descriptor, 0);
        if (comma < 0)
            return new TwoPartDescriptor(key, null);

        String tree = content.substring(comma + 1);
        if (tree.isEmpty())
            throw new ExpressionException(ExpressionError.UNTERMINATED_SPLIT,
                    "Nothing follows the ',' after the internal key in: " + descriptor, comma);
        return new TwoPartDescriptor(key, tree);
    }

    /**
     * Parses a bracket tree. {@code {L,R}} becomes a {@link TaprootBranch} of its two sides, anything else a
     * single {@link TaprootLeaf}.
     *
     * @throws ExpressionException if a bracket is unmatched, a side is empty, a pair has more than two elements
     * or the tree is deeper than {@link #MAX_TREE_DEPTH}
     */
    public ExpressionNode parseBracketTree(String tree) {
        checkNotNull(tree);
        return parseTree(tree, 0);
    }

    /** Parses a full descriptor into a {@link TaprootRoot} with the internal key and, if present, the tree. */
    public TaprootRoot parseTaprootDescriptor(String descriptor) {
        TwoPartDescriptor parts = parseTwoPart(descriptor);
        ExpressionNode tree = parts.hasTree() ? parseBracketTree(parts.getTree()) : null;
        return new TaprootRoot(parts.getInternalKey(), tree);
    }

    /**
     * Lists the script leaves below {@code node} from left to right together with their depth. A lone leaf has
     * depth zero.
     */
    public static List<TaprootLeafInfo> leaves(ExpressionNode node) {
        List<TaprootLeafInfo> leaves = new ArrayList<TaprootLeafInfo>();
        collectLeaves(checkNotNull(node), node.getType() == ExpressionNode.Type.TAPROOT_ROOT ? -1 : 0, leaves);
        return leaves;
    }

    /**
     * Rewrites a top level {@code or_d}, {@code or_c} or {@code or_i} into a two leaf bracket tree, so
     * {@code or_d(pk(A),pk(B))} becomes {@code {pk(A),pk(B)}}. Anything else, including unbalanced text, is
     * returned unchanged.
     */
    public String transformOrToTree(String miniscript) {
        String trimmed = miniscript.trim();
        if (!startsWithOrBranch(trimmed) || !parens.isBalanced(trimmed))
            return miniscript;

        int open = trimmed.indexOf('(');
        int close = parens.indexOfMatchingClose(trimmed, open);
        if (close != trimmed.length() - 1)
            return miniscript;
        String body = trimmed.substring(open + 1, close);
        int comma = parens.indexOfTopLevel(body, ',');
        if (comma < 0) {
            log.debug("No top level ',' in {}", trimmed);
            return miniscript;
        }
        return "{" + body.substring(0, comma).trim() + "," + body.substring(comma + 1).trim() + "}";
    }

    private ExpressionNode parseTree(String tree, int depth) {
        if (!isBraceWrapped(tree))
            return parseSide(tree, depth);

        String inner = tree.substring(1, tree.length() - 1);
        if (inner.isEmpty())
            throw new ExpressionException(ExpressionError.EMPTY_ARGUMENT, "Empty braces in tree", 1);
        int comma = parensAndBraces.indexOfTopLevel(inner, ',');
        if (comma < 0)
            return parseSide(inner, depth + 1);
        return new TaprootBranch(
                parseSide(inner.substring(0, comma), depth + 1),
                parseSide(inner.substring(comma + 1), depth + 1));
    }

    private ExpressionNode parseSide(String side, int depth) {
        if (depth > MAX_TREE_DEPTH)
            throw new ExpressionException(ExpressionError.NESTING_TOO_DEEP,
                    "Tree is deeper than " + MAX_TREE_DEPTH + " levels");
        if (side.isEmpty())
            throw new ExpressionException(ExpressionError.EMPTY_ARGUMENT, "Empty side in tree");
        if (isBraceWrapped(side))
            return parseTree(side, depth);

        parensAndBraces.checkBalanced(side);
        if (side.charAt(0) == '{' || parensAndBraces.indexOfTopLevel(side, ',') >= 0)
            throw new ExpressionException(ExpressionError.MALFORMED_TREE,
                    "Expected a single script or a {left,right} pair: " + side);
        return new TaprootLeaf(side);
    }

    private boolean isBraceWrapped(String s) {
        return s.length() >= 2 && s.charAt(0) == '{' && s.charAt(s.length() - 1) == '}'
                && parensAndBraces.indexOfMatchingClose(s, 0) == s.length() - 1;
    }

    private static void collectLeaves(ExpressionNode node, int depth, List<TaprootLeafInfo> leaves) {
        if (node.getType() == ExpressionNode.Type.TAPROOT_LEAF) {
            leaves.add(new TaprootLeafInfo(leaves.size(), Math.max(depth, 0), ((TaprootLeaf) node).getScript()));
            return;
        }
        for (ExpressionNode child : node.getChildren())
            collectLeaves(child, depth + 1, leaves);
    }

    private static boolean startsWithOrBranch(String s) {
        for (String prefix : OR_BRANCH_PREFIXES) {
            if (s.startsWith(prefix))
                return true;
        }
        return false;
    }
}
