package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;
import org.deepsymmetry.tagplaylists.TagIndex;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/**
 * Holds what has been scanned for one level of parentheses in a Combiner expression: the operators in the order
 * they were found, the selectors waiting to be resolved, and the track sets already produced by nested levels.
 * The enclosing level is identified by its index in the evaluator's list of nodes.
 */
@API(status = API.Status.STABLE)
public class BooleanNode {

    /**
     * The index of the enclosing node, or {@link #NO_PARENT} for the outermost level.
     */
    @API(status = API.Status.STABLE)
    public final int parent;

    /**
     * Value of {@link #parent} for the outermost level.
     */
    @API(status = API.Status.STABLE)
    public static final int NO_PARENT = -1;

    private final LinkedList<SetOperator> operators = new LinkedList<>();
    private final LinkedList<Selector> selectors = new LinkedList<>();
    private final LinkedList<Set<String>> trackSets = new LinkedList<>();

    /**
     * Create an empty node.
     *
     * @param parent the index of the enclosing node, or {@link #NO_PARENT}
     */
    @API(status = API.Status.STABLE)
    public BooleanNode(int parent) {
        this.parent = parent;
    }

    /**
     * Record an operator.
     *
     * @param operator the operator found
     */
    @API(status = API.Status.STABLE)
    public void addOperator(SetOperator operator) {
        operators.add(operator);
    }

    /**
     * Record a selector waiting to be resolved.
     *
     * @param selector the operand found
     */
    @API(status = API.Status.STABLE)
    public void addSelector(Selector selector) {
        selectors.add(selector);
    }

    /**
     * Record the result of a nested level.
     *
     * @param tracks the reduced set of track identifiers
     */
    @API(status = API.Status.STABLE)
    public void addTracks(Set<String> tracks) {
        trackSets.add(tracks);
    }

    /**
     * Take the next operand: the first reduced track set if there is one, otherwise the first pending selector,
     * resolved.
     *
     * @param tags the tracks carrying each tag
     *
     * @return the operand's tracks
     */
    private Set<String> nextOperand(TagIndex tags) {
        if (!trackSets.isEmpty()) {
            return trackSets.removeFirst();
        }
        return selectors.removeFirst().resolve(tags);
    }

    /**
     * Reduce this level to a single set of tracks. Operators are applied strictly in the order they were found,
     * with no precedence between them, so {@code A & B | C} means {@code (A & B) | C}. Each result goes to the
     * front of the reduced track sets, where it becomes the left operand of the next operator.
     *
     * @param tags the tracks carrying each tag, with pre-resolved selectors
     *
     * @return the tracks selected by this level
     *
     * @throws IllegalArgumentException if the number of operands is not one more than the number of operators
     */
    @API(status = API.Status.STABLE)
    public Set<String> evaluate(TagIndex tags) {
        final int operands = selectors.size() + trackSets.size();
        if (operators.size() + 1 != operands) {
            throw new IllegalArgumentException("Invalid boolean expression: track sets: " + trackSets.size() +
                    ", tags: " + selectorTexts() + ", operators: " + operators);
        }
        while (!operators.isEmpty()) {
            final SetOperator operator = operators.removeFirst();
            final Set<String> left = nextOperand(tags);
            final Set<String> right = nextOperand(tags);
            trackSets.addFirst(operator.apply(left, right));
        }
        if (trackSets.isEmpty()) {  // A lone selector with no operator.
            return selectors.removeFirst().resolve(tags);
        }
        return trackSets.getFirst();
    }

    /**
     * Gather the text of the pending selectors, for error messages.
     *
     * @return the selector texts
     */
    private List<String> selectorTexts() {
        final List<String> result = new ArrayList<>();
        for (Selector selector : selectors) {
            result.add(selector.text);
        }
        return result;
    }

    @Override
    public String toString() {
        return "BooleanNode[parent:" + parent + ", operators:" + operators + ", tags:" + selectorTexts() +
                ", trackSets:" + trackSets.size() + "]";
    }
}
