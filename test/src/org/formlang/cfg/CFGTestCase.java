/*
 * @LICENSE@
 */

package org.formlang.cfg;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import org.formlang.AbstractFormLangTestCase;

public class CFGTestCase extends AbstractFormLangTestCase {

    public CFGTestCase(String name) {
        super(name);
    }

    static final Variable S = new Variable("S");
    static final Variable A = new Variable("A");
    static final Variable B = new Variable("B");
    static final Variable C = new Variable("C");
    static final Terminal a = new Terminal("a");
    static final Terminal b = new Terminal("b");
    static final Terminal c = new Terminal("c");

    static Set<Production> productions(Production... ps) {
        return new LinkedHashSet<Production>(Arrays.asList(ps));
    }

    static <T> Set<T> set(T... ts) {
        return new HashSet<T>(Arrays.asList(ts));
    }

    public void testObjects() {
        assertEquals(new Variable("S"), S);
        assertFalse(new Variable("a").equals(a));
        assertFalse(new Terminal("ε").equals(Epsilon.INSTANCE));
        assertEquals(new Epsilon(), Epsilon.INSTANCE);
        assertEquals(new Epsilon().hashCode(), Epsilon.INSTANCE.hashCode());
        try {
            new Terminal(null);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testProduction() {
        Production p = new Production(S, Arrays.<CFGObject> asList(Epsilon.INSTANCE));
        assertTrue(p.body().isEmpty());
        assertTrue(p.isEpsilon());
        assertEquals(new Production(S), p);
        assertEquals("S -> ε", p.toString());

        Production unfiltered = new Production(S, Arrays.<CFGObject> asList(Epsilon.INSTANCE), false);
        assertEquals(1, unfiltered.body().size());
        assertTrue(unfiltered.isEpsilon());
        assertFalse(unfiltered.equals(p));

        assertTrue(new Production(S, A).isUnit());
        assertFalse(new Production(S, a).isUnit());
        assertFalse(new Production(S, A, B).isUnit());
        assertEquals("S -> A B", new Production(S, A, B).toString());
        try {
            new Production(null, a);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        try {
            new Production(S, a, null);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testConstruction() {
        CFG g = new CFG(S, productions(new Production(A, a)));
        assertEquals(set(S, A), g.variables());
        assertEquals(set(a), g.terminals());
        assertEquals(S, g.start());
        try {
            new CFG(null, productions(new Production(A, a)));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testValueEquality() {
        CFG g = exampleGrammar();
        assertEquals(g, exampleGrammar());
        assertEquals(g.hashCode(), exampleGrammar().hashCode());
        assertEquals(g, new CFG(S, g.productions()));
        assertFalse(g.equals(new CFG(A, g.productions())));
        Set<Production> more = new LinkedHashSet<Production>(g.productions());
        more.add(new Production(S));
        assertFalse(g.equals(new CFG(S, more)));
    }

    public void testConcreteGrammar() {
        CFG g = exampleGrammar();
        assertTrue(g.contains("a", "a", "b", "b"));
        assertFalse(g.contains("a", "b", "a"));
        assertFalse(g.contains());
        assertTrue(g.contains(w("a", "b")));
        assertTrue(g.contains("a", "b", "b", "b"));
        assertFalse(g.contains("a"));
        assertFalse(g.contains("b", "a"));
        assertFalse(g.contains("a", "c"));
        assertFalse(g.isEmpty());
        assertFalse(g.generatesEpsilon());
    }

    public void testNullableSymbols() {
        // S -> A B, A -> a | ε, B -> b | ε, C -> c
        CFG g = new CFG(S, productions(
            new Production(S, A, B),
            new Production(A, a), new Production(A),
            new Production(B, b), new Production(B),
            new Production(C, c)));
        assertEquals(set(S, A, B), g.nullableSymbols());
        assertTrue(g.generatesEpsilon());
        assertTrue(g.contains());
        assertTrue(g.contains("a"));
        assertTrue(g.contains("a", "b"));
        assertFalse(g.contains("b", "a"));
    }

    public void testNullableThroughChains() {
        // S -> A A, A -> B, B -> C, C -> ε
        CFG g = new CFG(S, productions(
            new Production(S, A, A),
            new Production(A, B),
            new Production(B, C),
            new Production(C)));
        assertEquals(set(S, A, B, C), g.nullableSymbols());
    }

    /*
     * S -> A B | a, A -> a A, B -> b
     */
    private static CFG withUselessSymbols() {
        return new CFG(S, productions(
            new Production(S, A, B), new Production(S, a),
            new Production(A, a, A),
            new Production(B, b)));
    }

    public void testGeneratingSymbols() {
        CFG g = withUselessSymbols();
        assertEquals(set(S, B, a, b), g.generatingSymbols());
        assertEquals(set(S, A, B, a, b), g.reachableSymbols());
        assertTrue(new CFG(S, productions(new Production(S, S, a))).isEmpty());
    }

    public void testRemoveUselessSymbols() {
        CFG g = withUselessSymbols().removeUselessSymbols();
        assertEquals(set(S), g.variables());
        assertEquals(set(a), g.terminals());
        assertEquals(productions(new Production(S, a)), g.productions());
    }

    public void testRemoveUselessKeepsStart() {
        CFG g = new CFG(S, productions(new Production(S, S, a), new Production(A, a)));
        CFG trimmed = g.removeUselessSymbols();
        assertEquals(set(S), trimmed.variables());
        assertTrue(trimmed.productions().isEmpty());
        assertTrue(trimmed.isEmpty());
        assertFalse(g.contains("a"));
    }

    public void testRemoveEpsilon() {
        CFG g = new CFG(S, productions(
            new Production(S, A, B),
            new Production(A, a), new Production(A),
            new Production(B, b), new Production(B)));
        CFG e = g.removeEpsilon();
        assertEquals(productions(
            new Production(S, A, B), new Production(S, A), new Production(S, B),
            new Production(A, a), new Production(B, b),
            new Production(S)), e.productions());
    }

    public void testRemoveEpsilonWithoutEmptyWord() {
        // S -> a A, A -> b | ε
        CFG g = new CFG(S, productions(
            new Production(S, a, A), new Production(A, b), new Production(A)));
        CFG e = g.removeEpsilon();
        assertEquals(productions(
            new Production(S, a), new Production(S, a, A), new Production(A, b)),
            e.productions());
        assertFalse(e.generatesEpsilon());
    }

    public void testUnitPairs() {
        // S -> A | a, A -> B, B -> b
        CFG g = new CFG(S, productions(
            new Production(S, A), new Production(S, a),
            new Production(A, B),
            new Production(B, b)));
        assertEquals(set(
            new UnitPair(S, S), new UnitPair(A, A), new UnitPair(B, B),
            new UnitPair(S, A), new UnitPair(A, B), new UnitPair(S, B)),
            g.unitPairs());

        CFG u = g.eliminateUnitProductions();
        assertEquals(set(
            new Production(S, a), new Production(S, b),
            new Production(A, b), new Production(B, b)),
            u.productions());
        for (Production p : u.productions()) {
            assertFalse(p.toString(), p.isUnit());
        }
    }

    public void testUnitCycle() {
        // S -> A, A -> S | a
        CFG g = new CFG(S, productions(
            new Production(S, A), new Production(A, S), new Production(A, a)));
        assertTrue(g.unitPairs().contains(new UnitPair(S, A)));
        assertTrue(g.unitPairs().contains(new UnitPair(A, S)));
        assertEquals(set(new Production(S, a), new Production(A, a)),
            g.eliminateUnitProductions().productions());
    }

    public void testToString() {
        String s = exampleGrammar().toString();
        assertTrue(s, s.contains("start: S"));
        assertTrue(s, s.contains("A -> a A"));
        assertTrue(s, s.contains("terminals: {a, b}"));
        assertEquals(Collections.singleton(S), new CFG(S, productions()).variables());
    }
}
