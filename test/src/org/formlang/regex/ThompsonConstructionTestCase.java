/*
 * @LICENSE@
 */

package org.formlang.regex;

import org.formlang.AbstractFormLangTestCase;
import org.formlang.Misc;
import org.formlang.automaton.FiniteAutomaton;
import org.formlang.automaton.Mode;
import org.formlang.automaton.State;
import org.formlang.automaton.Symbol;

public class ThompsonConstructionTestCase extends AbstractFormLangTestCase {

    public ThompsonConstructionTestCase(String name) {
        super(name);
    }

    private static FiniteAutomaton translate(String regex) {
        return new ThompsonConstruction().translate(new RegexParser().parse(regex, 0));
    }

    public void testSymbol() {
        final FiniteAutomaton fa = translate("a");
        assertEquals(Mode.EPSILON, fa.mode());
        assertEquals(2, fa.size());
        assertEquals(1, fa.transitionCount());
        assertEquals("{q0}", Misc.setString(fa.startStates()));
        assertEquals("{q1}", Misc.setString(fa.finalStates()));
        assertTrue(fa.nextStates(new State("q0"), new Symbol("a")).contains(new State("q1")));
    }

    public void testConcatenation() {
        final FiniteAutomaton fa = translate("ab");
        assertEquals(4, fa.size());
        assertEquals(3, fa.transitionCount());
        assertTrue(fa.hasEpsilonTransitions());
        assertTrue(fa.nextStates(new State("q1"), Symbol.EPSILON).contains(new State("q2")));
        assertEquals("{q3}", Misc.setString(fa.finalStates()));
    }

    public void testUnion() {
        final FiniteAutomaton fa = translate("a+b");
        assertEquals(5, fa.size());
        assertEquals("{q4}", Misc.setString(fa.startStates()));
        assertEquals("{q1, q3}", Misc.setString(fa.finalStates()));
        assertEquals(4, fa.transitionCount());
    }

    public void testStar() {
        final FiniteAutomaton fa = translate("a*");
        assertEquals(3, fa.size());
        assertEquals("{q2}", Misc.setString(fa.startStates()));
        assertEquals("{q2}", Misc.setString(fa.finalStates()));
        assertTrue(fa.acceptsEpsilon());
        assertTrue(fa.accepts("a", "a", "a"));
    }

    public void testEmptySet() {
        final FiniteAutomaton fa = translate("#");
        assertEquals(2, fa.size());
        assertEquals(0, fa.transitionCount());
        assertTrue(fa.isEmpty());
    }

    public void testEpsilon() {
        final FiniteAutomaton fa = translate("$");
        assertEquals(2, fa.size());
        assertTrue(fa.acceptsEpsilon());
        assertTrue(fa.symbols().isEmpty());
    }

    public void testNestedStars() {
        final FiniteAutomaton fa = translate("(a*b*)*");
        assertTrue(fa.acceptsEpsilon());
        assertTrue(fa.accepts("b", "a", "b", "b", "a"));
    }
}
