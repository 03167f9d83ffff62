/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * A state of a {@link FiniteAutomaton}. States are values: two states with
 * the same label are the same state, in any automaton.
 */
public final class State {

    private final String label;

    public State(String label) {
        if (label == null) {
            throw new IllegalArgumentException("null state label");
        }
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof State))
            return false;
        return label.equals(((State) o).label);
    }

    @Override
    public String toString() {
        return label;
    }
}
