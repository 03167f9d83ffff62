/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * An input symbol of a {@link FiniteAutomaton}, identified by its label.
 * <p>
 * {@link #EPSILON} labels transitions on the empty string. It is never equal
 * to a labeled symbol, not even one spelled <code>"ε"</code>, and it is never
 * part of an automaton's alphabet.
 */
public final class Symbol {

    public static final Symbol EPSILON = new Symbol("ε", true);

    private final String label;
    private final boolean epsilon;

    public Symbol(String label) {
        this(label, false);
    }

    private Symbol(String label, boolean epsilon) {
        if (label == null) {
            throw new IllegalArgumentException("null symbol label");
        }
        this.label = label;
        this.epsilon = epsilon;
    }

    public String label() {
        return label;
    }

    public boolean isEpsilon() {
        return epsilon;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + (epsilon ? 1231 : 1237);
        result = prime * result + label.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Symbol))
            return false;
        final Symbol other = (Symbol) o;
        return epsilon == other.epsilon && label.equals(other.label);
    }

    @Override
    public String toString() {
        return label;
    }
}
