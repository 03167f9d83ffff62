/*
 * @LICENSE@
 */

package org.formlang.automaton;

import static org.formlang.LanguageAssert.assertAccepts;
import static org.formlang.LanguageAssert.assertRejects;
import static org.formlang.LanguageAssert.assertSameLanguage;
import static org.formlang.LanguageAssert.words;

import java.util.Collections;

import org.formlang.AbstractFormLangTestCase;

public class ConversionTestCase extends AbstractFormLangTestCase {

    public ConversionTestCase(String name) {
        super(name);
    }

    private static FiniteAutomaton endsWithAb() {
        return new FiniteAutomaton.Builder()
            .addStartState("q0")
            .addTransition("q0", "a", "q0")
            .addTransition("q0", "b", "q0")
            .addTransition("q0", "a", "q1")
            .addTransition("q1", "b", "q2")
            .addFinalState("q2")
            .build(Mode.NONDETERMINISTIC);
    }

    /*
     * (ab)* with epsilon links, start p
     */
    private static FiniteAutomaton abStar() {
        return new FiniteAutomaton.Builder()
            .addStartState("p")
            .addFinalState("p")
            .addEpsilonTransition("p", "q")
            .addTransition("q", "a", "r")
            .addEpsilonTransition("r", "s")
            .addTransition("s", "b", "t")
            .addEpsilonTransition("t", "p")
            .build(Mode.EPSILON);
    }

    public void testDeterministicIsIdentity() {
        FiniteAutomaton dfa = exampleDfa();
        assertSame(dfa, dfa.toDeterministic());
    }

    public void testSubsetConstruction() {
        FiniteAutomaton nfa = endsWithAb();
        FiniteAutomaton dfa = nfa.toDeterministic();
        assertEquals(Mode.DETERMINISTIC, dfa.mode());
        assertEquals(3, dfa.size());
        assertEquals(new State("{q0}"), dfa.startState());
        assertEquals(Collections.singleton(new State("{q0, q2}")), dfa.finalStates());
        assertEquals(new State("{q0, q1}"),
            dfa.nextState(new State("{q0}"), new Symbol("a")));
        assertTrue(dfa.isComplete());
        assertSameLanguage(nfa, dfa, words(6, "a", "b"));
        assertSameLanguage(exampleDfa(), dfa, words(6, "a", "b"));
    }

    public void testSubsetConstructionWithEpsilon() {
        FiniteAutomaton enfa = abStar();
        FiniteAutomaton dfa = enfa.toDeterministic();
        assertEquals(Mode.DETERMINISTIC, dfa.mode());
        assertFalse(dfa.hasEpsilonTransitions());
        assertEquals(new State("{p, q}"), dfa.startState());
        assertSameLanguage(enfa, dfa, words(6, "a", "b"));
        assertAccepts(dfa);
        assertAccepts(dfa, "a", "b", "a", "b");
        assertRejects(dfa, "a", "b", "a");
        // the empty set of states is left out, so the result is partial
        assertFalse(dfa.isComplete());
    }

    public void testEmptyStartSubset() {
        FiniteAutomaton noStart = new FiniteAutomaton.Builder()
            .addTransition("p", "a", "p")
            .addFinalState("p")
            .build(Mode.NONDETERMINISTIC);
        FiniteAutomaton dfa = noStart.toDeterministic();
        assertEquals(1, dfa.size());
        assertEquals(new State("{}"), dfa.startState());
        assertEquals(0, dfa.transitionCount());
        assertTrue(dfa.isEmpty());
        assertRejects(dfa);
        assertRejects(dfa, "a");
    }

    public void testSubsetLabels() {
        FiniteAutomaton nfa = new FiniteAutomaton.Builder()
            .addStartState("{q}")
            .addTransition("{q}", "a", "q")
            .addFinalState("q")
            .build(Mode.NONDETERMINISTIC);
        FiniteAutomaton dfa = nfa.toDeterministic();
        assertEquals(2, dfa.size());
        assertEquals(new State("{{q}}"), dfa.startState());
        assertEquals(Collections.singleton(new State("{q}")), dfa.finalStates());
        assertSameLanguage(nfa, dfa, words(3, "a"));
    }

    public void testEpsilonRemoval() {
        FiniteAutomaton enfa = abStar();
        FiniteAutomaton nfa = enfa.toNondeterministic();
        assertEquals(Mode.NONDETERMINISTIC, nfa.mode());
        assertFalse(nfa.hasEpsilonTransitions());
        assertEquals(enfa.size(), nfa.size());
        assertEquals(enfa.startStates(), nfa.startStates());
        assertTrue(nfa.finalStates().contains(new State("t")));
        assertSameLanguage(enfa, nfa, words(6, "a", "b"));
    }

    public void testToNondeterministicOfOtherModes() {
        FiniteAutomaton nfa = endsWithAb();
        assertSame(nfa, nfa.toNondeterministic());
        FiniteAutomaton relabeled = exampleDfa().toNondeterministic();
        assertEquals(Mode.NONDETERMINISTIC, relabeled.mode());
        assertSameLanguage(exampleDfa(), relabeled, words(5, "a", "b"));
    }
}
