/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * The usage mode of a {@link FiniteAutomaton}. The mode is fixed when the
 * automaton is {@linkplain FiniteAutomaton.Builder#build(Mode) built} and is
 * checked by every operation that depends on it; converting between modes is
 * always an explicit call.
 */
public enum Mode {

    /**
     * Any number of start states; a (state, symbol) pair may lead to any
     * number of states. No epsilon transitions.
     */
    NONDETERMINISTIC("NFA"),

    /**
     * As {@link #NONDETERMINISTIC}, plus transitions on
     * {@link Symbol#EPSILON}.
     */
    EPSILON("ε-NFA"),

    /**
     * Exactly one start state, at most one target per (state, symbol) pair,
     * no epsilon transitions. The transition function may be partial.
     */
    DETERMINISTIC("DFA");

    final String abbreviation;

    Mode(String abbreviation) {
        this.abbreviation = abbreviation;
    }
}
