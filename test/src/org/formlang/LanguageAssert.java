/*
 * @LICENSE@
 */

package org.formlang;

import static junit.framework.Assert.assertEquals;
import static junit.framework.Assert.assertFalse;
import static junit.framework.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.formlang.automaton.FiniteAutomaton;
import org.formlang.cfg.CFG;
import org.formlang.cfg.CYKParser;

/**
 * Assertions comparing languages on every word up to a length bound.
 */
public final class LanguageAssert {

    private LanguageAssert() {}   // not instantiable.

    public interface Predicate {
        boolean holds(List<String> word);
    }

    /**
     * @return every word over <code>alphabet</code> of length at most
     *         <code>maxLength</code>, shortest first.
     */
    public static List<List<String>> words(List<String> alphabet, int maxLength) {
        final List<List<String>> ret = new ArrayList<List<String>>();
        List<List<String>> layer = new ArrayList<List<String>>();
        layer.add(Collections.<String> emptyList());
        ret.addAll(layer);
        for (int len = 1; len <= maxLength; ++len) {
            final List<List<String>> next = new ArrayList<List<String>>();
            for (List<String> word : layer) {
                for (String symbol : alphabet) {
                    final List<String> longer = new ArrayList<String>(word);
                    longer.add(symbol);
                    next.add(longer);
                }
            }
            ret.addAll(next);
            layer = next;
        }
        return ret;
    }

    public static List<List<String>> words(int maxLength, String... alphabet) {
        return words(Arrays.asList(alphabet), maxLength);
    }

    public static void assertSameLanguage(FiniteAutomaton expected,
            FiniteAutomaton actual, List<List<String>> words) {
        for (List<String> word : words) {
            assertEquals("word " + word, expected.accepts(word), actual.accepts(word));
        }
    }

    public static void assertLanguage(Predicate expected, FiniteAutomaton actual,
            List<List<String>> words) {
        for (List<String> word : words) {
            assertEquals("word " + word, expected.holds(word), actual.accepts(word));
        }
    }

    public static void assertLanguage(Predicate expected, CFG actual,
            List<List<String>> words) {
        final CYKParser parser = new CYKParser(actual);
        for (List<String> word : words) {
            assertEquals("word " + word, expected.holds(word), parser.contains(word));
        }
    }

    public static void assertAccepts(FiniteAutomaton fa, String... word) {
        assertTrue(Arrays.toString(word), fa.accepts(word));
    }

    public static void assertRejects(FiniteAutomaton fa, String... word) {
        assertFalse(Arrays.toString(word), fa.accepts(word));
    }
}
