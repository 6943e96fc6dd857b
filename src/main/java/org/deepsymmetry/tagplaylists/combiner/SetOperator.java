package org.deepsymmetry.tagplaylists.combiner;

import org.apiguardian.api.API;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The operators that can join selectors in a Combiner expression. Each produces a new set and leaves its
 * operands unchanged.
 */
@API(status = API.Status.STABLE)
public enum SetOperator {

    /**
     * Tracks found in both operands.
     */
    INTERSECTION('&') {
        @Override
        public Set<String> apply(Set<String> left, Set<String> right) {
            final Set<String> result = new LinkedHashSet<>(left);
            result.retainAll(right);
            return result;
        }
    },

    /**
     * Tracks found in either operand.
     */
    UNION('|') {
        @Override
        public Set<String> apply(Set<String> left, Set<String> right) {
            final Set<String> result = new LinkedHashSet<>(left);
            result.addAll(right);
            return result;
        }
    },

    /**
     * Tracks found in the left operand but not the right one.
     */
    DIFFERENCE('~') {
        @Override
        public Set<String> apply(Set<String> left, Set<String> right) {
            final Set<String> result = new LinkedHashSet<>(left);
            result.removeAll(right);
            return result;
        }
    };

    /**
     * The character that represents this operator in an expression.
     */
    @API(status = API.Status.STABLE)
    public final char symbol;

    SetOperator(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Combine two sets of track identifiers.
     *
     * @param left the left-hand operand
     * @param right the right-hand operand
     *
     * @return a new set holding the result
     */
    @API(status = API.Status.STABLE)
    public abstract Set<String> apply(Set<String> left, Set<String> right);

    /**
     * Find the operator represented by a character.
     *
     * @param c a character from an expression
     *
     * @return the operator, or {@code null} if the character is not an operator
     */
    @API(status = API.Status.STABLE)
    public static SetOperator forSymbol(char c) {
        for (SetOperator operator : values()) {
            if (operator.symbol == c) {
                return operator;
            }
        }
        return null;
    }
}
