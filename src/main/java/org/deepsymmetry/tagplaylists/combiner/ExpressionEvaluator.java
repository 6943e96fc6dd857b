package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.TagIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * <p>Evaluates a Combiner expression in a single left-to-right pass over its characters. Each opening parenthesis
 * starts a new {@link BooleanNode}; each closing parenthesis reduces the current node and hands its result to the
 * enclosing one as an operand. Characters that are neither parentheses nor operators accumulate into the text of
 * the next selector.</p>
 *
 * <p>There is no precedence between operators at the same level: they are applied in the order they appear, so
 * {@code Techno & Dark | House} means {@code (Techno & Dark) | House}. Expressions that need a different order
 * must use parentheses. A parenthesized group always supplies the left operand of the first operator of its
 * level that is still waiting for one.</p>
 *
 * <p>Evaluators hold no state between calls.</p>
 */
@API(status = API.Status.STABLE)
public class ExpressionEvaluator {

    /**
     * The tracks carrying each tag, with pre-resolved playlist and numeric selectors.
     */
    private final TagIndex tags;

    /**
     * Create an evaluator which resolves selectors against the given index.
     *
     * @param tags the tracks carrying each tag, with pre-resolved playlist and numeric selectors
     */
    @API(status = API.Status.STABLE)
    public ExpressionEvaluator(TagIndex tags) {
        if (tags == null) {
            throw new NullPointerException("tags must not be null");
        }
        this.tags = tags;
    }

    /**
     * Turn accumulated selector text into a selector on the current node, if it is not blank.
     *
     * @param token the accumulated text
     * @param node the node being scanned
     */
    private static void flush(StringBuilder token, BooleanNode node) {
        final String text = token.toString().trim();
        if (!text.isEmpty()) {
            node.addSelector(Selector.parse(text));
        }
        token.setLength(0);
    }

    /**
     * Evaluate an expression.
     *
     * @param expression the text of the expression
     *
     * @return the identifiers of the selected tracks
     *
     * @throws IllegalArgumentException if the expression is malformed: unbalanced parentheses, or a level where
     *                                  the number of operands is not one more than the number of operators
     */
    @API(status = API.Status.STABLE)
    public Set<String> evaluate(String expression) {
        final List<BooleanNode> nodes = new ArrayList<>();
        nodes.add(new BooleanNode(BooleanNode.NO_PARENT));
        int current = 0;
        final StringBuilder token = new StringBuilder();

        for (int i = 0; i < expression.length(); i++) {
            final char c = expression.charAt(i);
            final SetOperator operator = SetOperator.forSymbol(c);
            if (c == '(') {
                nodes.add(new BooleanNode(current));
                current = nodes.size() - 1;
            } else if (operator != null) {
                flush(token, nodes.get(current));
                nodes.get(current).addOperator(operator);
            } else if (c == ')') {
                final BooleanNode node = nodes.get(current);
                if (node.parent == BooleanNode.NO_PARENT) {
                    throw new IllegalArgumentException("Invalid boolean expression: unbalanced ')' at position " +
                            i + " of \"" + expression + "\"");
                }
                flush(token, node);
                final Set<String> tracks = node.evaluate(tags);
                current = node.parent;
                nodes.get(current).addTracks(tracks);
            } else {
                token.append(c);
            }
        }

        final BooleanNode node = nodes.get(current);
        if (node.parent != BooleanNode.NO_PARENT) {
            throw new IllegalArgumentException("Invalid boolean expression: unclosed '(' in \"" + expression + "\"");
        }
        flush(token, node);
        return node.evaluate(tags);
    }
}
