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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.miniscriptj.script.ExpressionTokenizer;
import org.miniscriptj.script.FragmentAnnotations;
import org.miniscriptj.script.Token;
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.script.ast.Fragment;
import org.miniscriptj.script.ast.NodeVisitor;
import org.miniscriptj.script.ast.TaprootBranch;
import org.miniscriptj.script.ast.TaprootLeaf;
import org.miniscriptj.script.ast.TaprootRoot;
import org.miniscriptj.script.ast.Terminal;
import org.miniscriptj.script.ast.Wrapper;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Decides what a node looks like in a diagram: its label and which nodes are drawn below it.</p>
 *
 * <ul>
 *     <li>a fragment whose arguments are all terminals is drawn as one box, {@code pk(A)};</li>
 *     <li>a counted fragment is labelled with its count, {@code thresh(2 of 3)}, and its remaining arguments are
 *     drawn below it;</li>
 *     <li>wrapper tags are prefixed to the label of the wrapped node, {@code v:pk(A)}, without a level of their
 *     own;</li>
 *     <li>a policy weight stays in front of the label, {@code 9@pk(A)};</li>
 *     <li>a Taproot root is labelled {@code tr(KEY)} and a branch {@code {}}.</li>
 * </ul>
 *
 * <p>Names found in the substitution table are replaced by their value in every label.</p>
 */
public class NodeLabeler implements NodeVisitor<String> {

    static final String BRANCH_LABEL = "{}";

    private final Map<String, String> substitutions;
    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

    public NodeLabeler() {
        this(ImmutableMap.<String, String>of());
    }

    public NodeLabeler(Map<String, String> substitutions) {
        this.substitutions = checkNotNull(substitutions);
    }

    public String label(ExpressionNode node) {
        return node.accept(this);
    }

    /** The nodes drawn one level below {@code node}, left to right. */
    public List<ExpressionNode> displayedChildren(ExpressionNode node) {
        switch (node.getType()) {
            case WRAPPER:
                return displayedChildren(((Wrapper) node).getChild());
            case FRAGMENT:
                Fragment fragment = (Fragment) node;
                if (isDrawnAsCounted(fragment))
                    return fragment.getArgs().subList(1, fragment.getArgs().size());
                if (fragment.hasOnlyTerminalArgs())
                    return ImmutableList.of();
                return fragment.getArgs();
            default:
                return node.getChildren();
        }
    }

    @Override
    public String visitTerminal(Terminal node) {
        return substitute(node.getValue());
    }

    @Override
    public String visitWrapper(Wrapper node) {
        return node.getTagString() + ":" + label(node.getChild());
    }

    @Override
    public String visitFragment(Fragment node) {
        String label = fragmentLabel(node);
        return node.hasWeight() ? node.getWeight() + "@" + label : label;
    }

    private String fragmentLabel(Fragment node) {
        List<ExpressionNode> args = node.getArgs();
        if (isDrawnAsCounted(node))
            return node.getName() + "(" + label(args.get(0)) + " of " + (args.size() - 1) + ")";
        if (node.hasOnlyTerminalArgs()) {
            StringBuilder sb = new StringBuilder(node.getName()).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0)
                    sb.append(',');
                sb.append(label(args.get(i)));
            }
            return sb.append(')').toString();
        }
        return node.getName();
    }

    @Override
    public String visitTaprootRoot(TaprootRoot node) {
        return "tr(" + substitute(node.getInternalKey()) + ")";
    }

    @Override
    public String visitTaprootBranch(TaprootBranch node) {
        return BRANCH_LABEL;
    }

    @Override
    public String visitTaprootLeaf(TaprootLeaf node) {
        if (substitutions.isEmpty())
            return node.getScript();
        StringBuilder sb = new StringBuilder();
        for (Token token : tokenizer.tokenize(node.getScript())) {
            if (token.is(Token.Type.NAME))
                sb.append(substitute(token.getValue()));
            else
                sb.append(token.getValue());
        }
        return sb.toString();
    }

    // A count with fewer than one child, or a count that is not a plain value, is drawn like any other fragment.
    private static boolean isDrawnAsCounted(Fragment fragment) {
        List<ExpressionNode> args = fragment.getArgs();
        return FragmentAnnotations.isCounted(fragment.getName())
                && args.size() >= 2
                && args.get(0).getType() == ExpressionNode.Type.TERMINAL;
    }

    private String substitute(String name) {
        String value = substitutions.get(name);
        return value != null ? value : name;
    }
}
