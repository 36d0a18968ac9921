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

import com.google.common.collect.ImmutableMap;
import org.miniscriptj.core.ExpressionException;
import org.miniscriptj.script.Dialect;
import org.miniscriptj.script.ExpressionFormatter;
import org.miniscriptj.script.ExpressionParser;
import org.miniscriptj.script.FragmentAnnotations;
import org.miniscriptj.script.ast.ExpressionNode;
import org.miniscriptj.script.ast.Fragment;
import org.miniscriptj.script.ast.TaprootRoot;
import org.miniscriptj.taproot.TaprootLeafInfo;
import org.miniscriptj.taproot.TaprootTreeParser;
import org.miniscriptj.tree.AsciiTreeRenderer;
import org.miniscriptj.tree.DiagramParams;
import org.miniscriptj.tree.TreeLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Entry point for editors: parses, formats and draws miniscript, policy and Taproot descriptor expressions.</p>
 *
 * <p>Every method takes the complete current text and returns a fresh result; no state is kept between calls, so
 * one instance can serve every keystroke of an editor. Whitespace in the input is ignored. Malformed input never
 * throws: it comes back as a {@link ParseResult} with status {@link ParseResult.Status#ERROR}, and blank input as
 * {@link ParseResult.Status#EMPTY}.</p>
 *
 * <p>Substitution tables map names such as {@code Alice} to the text shown in their place. They are only read and
 * only affect formatted and drawn output, never the parsed tree.</p>
 */
public class ExpressionVisualizer {
    private static final Logger log = LoggerFactory.getLogger(ExpressionVisualizer.class);

    private final ExpressionParser parser;
    private final TaprootTreeParser taprootParser = new TaprootTreeParser();
    private final ExpressionFormatter formatter;
    private final TreeLayout layout;
    private final AsciiTreeRenderer renderer;

    public static void main(String[] args) {
        ExpressionVisualizer visualizer = ExpressionVisualizer.create();
        String expression = args.length > 0 ? args[0] : "and_v(v:pk(Alice),or_d(pk(Bob),older(144)))";

        System.out.println(visualizer.format(expression));
        System.out.println();
        ParseResult<String> diagram = expression.trim().startsWith("tr(")
                ? visualizer.renderTaproot(expression)
                : visualizer.renderExpression(expression);
        System.out.println(diagram.isOk() ? diagram.getValue() : String.valueOf(diagram));
    }

    public static ExpressionVisualizer create() {
        return new ExpressionVisualizer(Dialect.MINISCRIPT, DiagramParams.get(), ExpressionParser.DEFAULT_MAX_DEPTH);
    }

    public ExpressionVisualizer(Dialect dialect, DiagramParams params, int maxDepth) {
        this.parser = new ExpressionParser(maxDepth);
        this.formatter = new ExpressionFormatter(dialect);
        this.layout = new TreeLayout(params);
        this.renderer = new AsciiTreeRenderer(params);
    }

    public Dialect getDialect() {
        return formatter.getDialect();
    }

    public ParseResult<ExpressionNode> parse(@Nullable String expression) {
        String clean = clean(expression);
        if (clean.isEmpty())
            return ParseResult.empty();
        try {
            return ParseResult.ok(parser.parseNode(clean));
        } catch (ExpressionException e) {
            return rejected(clean, e);
        }
    }

    public ParseResult<TaprootRoot> parseTaproot(@Nullable String descriptor) {
        String clean = clean(descriptor);
        if (clean.isEmpty())
            return ParseResult.empty();
        try {
            return ParseResult.ok(taprootParser.parseTaprootDescriptor(clean));
        } catch (ExpressionException e) {
            return rejected(clean, e);
        }
    }

    public String format(@Nullable String expression) {
        return format(expression, ImmutableMap.<String, String>of());
    }

    /** Pretty-prints {@code expression} in this visualizer's dialect. Works on any text, balanced or not. */
    public String format(@Nullable String expression, Map<String, String> substitutions) {
        return formatter.format(clean(expression), substitutions);
    }

    public String compact(@Nullable String expression) {
        return clean(expression);
    }

    public ParseResult<String> renderExpression(@Nullable String expression) {
        return renderExpression(expression, ImmutableMap.<String, String>of());
    }

    public ParseResult<String> renderExpression(@Nullable String expression, Map<String, String> substitutions) {
        checkNotNull(substitutions);
        ParseResult<ExpressionNode> parsed = parse(expression);
        if (!parsed.isOk())
            return ParseResult.propagate(parsed);
        return ParseResult.ok(renderer.render(layout.layout(parsed.getValue(), substitutions)));
    }

    public ParseResult<String> renderTaproot(@Nullable String descriptor) {
        return renderTaproot(descriptor, ImmutableMap.<String, String>of());
    }

    public ParseResult<String> renderTaproot(@Nullable String descriptor, Map<String, String> substitutions) {
        checkNotNull(substitutions);
        ParseResult<TaprootRoot> parsed = parseTaproot(descriptor);
        if (!parsed.isOk())
            return ParseResult.propagate(parsed);
        return ParseResult.ok(renderer.render(layout.layout(parsed.getValue(), substitutions)));
    }

    /** The script leaves of a Taproot descriptor with their depth and control block size. */
    public ParseResult<List<TaprootLeafInfo>> taprootLeaves(@Nullable String descriptor) {
        ParseResult<TaprootRoot> parsed = parseTaproot(descriptor);
        if (!parsed.isOk())
            return ParseResult.propagate(parsed);
        return ParseResult.ok(TaprootTreeParser.leaves(parsed.getValue()));
    }

    /**
     * Describes the known fragments of an expression, keyed by fragment name in order of first appearance. Names
     * without an entry in {@link FragmentAnnotations} are left out.
     */
    public ParseResult<Map<String, String>> annotations(@Nullable String expression) {
        ParseResult<ExpressionNode> parsed = parse(expression);
        if (!parsed.isOk())
            return ParseResult.propagate(parsed);
        Map<String, String> found = new LinkedHashMap<String, String>();
        collectAnnotations(parsed.getValue(), found);
        return ParseResult.<Map<String, String>>ok(ImmutableMap.copyOf(found));
    }

    private static void collectAnnotations(ExpressionNode node, Map<String, String> found) {
        if (node instanceof Fragment) {
            String name = ((Fragment) node).getName();
            String annotation = FragmentAnnotations.annotationFor(name);
            if (annotation != null && !found.containsKey(name))
                found.put(name, annotation);
        }
        for (ExpressionNode child : node.getChildren())
            collectAnnotations(child, found);
    }

    private static String clean(@Nullable String text) {
        return text == null ? "" : ExpressionFormatter.compact(text);
    }

    private static <T> ParseResult<T> rejected(String input, ExpressionException e) {
        log.debug("Rejected {}: {} ({})", input, e.getMessage(), e.getError().getMnemonic());
        return ParseResult.error(e);
    }
}
