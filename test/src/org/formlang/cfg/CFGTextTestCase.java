/*
 * @LICENSE@
 */

package org.formlang.cfg;

import static org.formlang.Misc.LS;
import static org.formlang.cfg.CFGTestCase.S;

import org.formlang.AbstractFormLangTestCase;

public class CFGTextTestCase extends AbstractFormLangTestCase {

    public CFGTextTestCase(String name) {
        super(name);
    }

    private static void assertNotParsable(String text, int line) {
        try {
            CFG.fromText(text);
            fail("should throw");
        } catch (NotParsableException e) {
            assertEquals(e.getMessage(), line, e.line());
        }
    }

    public void testFromText() {
        CFG g = CFG.fromText("S -> A B\nA -> a A | a\nB -> b B | b\n");
        assertEquals(exampleGrammar(), g);
        assertTrue(g.contains("a", "b", "b"));
    }

    public void testEpsilonSpellings() {
        for (String eps : new String[] {"$", "ε", "epsilon", ""}) {
            CFG g = CFG.fromText("S -> a S | " + eps);
            assertTrue(eps, g.productions().contains(new Production(S)));
            assertTrue(eps, g.contains());
            assertTrue(eps, g.contains("a", "a"));
        }
    }

    public void testForcedKinds() {
        CFG g = CFG.fromText("S -> TER:A VAR:x\nVAR:x -> b");
        assertTrue(g.terminals().contains(new Terminal("A")));
        assertTrue(g.variables().contains(new Variable("x")));
        assertTrue(g.contains("A", "b"));
    }

    public void testStartSymbol() {
        CFG g = CFG.fromText("A -> a\nB -> b", new Variable("B"));
        assertEquals(new Variable("B"), g.start());
        assertTrue(g.contains("b"));
        assertFalse(g.contains("a"));
        assertEquals(new Variable("A"), CFG.fromText("A -> a\nB -> b").start());
    }

    public void testErrors() {
        assertNotParsable("S A B", 1);
        assertNotParsable("\nS -> a\na -> b", 3);
        assertNotParsable("S -> a\n -> b", 2);
        assertNotParsable("S T -> a", 1);
        assertNotParsable("", 1);
    }

    public void testToText() {
        assertEquals("S -> A B" + LS + "A -> a A | a" + LS + "B -> b B | b" + LS,
            exampleGrammar().toText());
        CFG odd = CFG.fromText("VAR:x -> TER:A VAR:x | $ | TER:epsilon");
        assertEquals(odd, CFG.fromText(odd.toText()));
        assertEquals(exampleGrammar(), CFG.fromText(exampleGrammar().toText()));
    }
}
