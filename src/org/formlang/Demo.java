/*
 * @LICENSE@
 */

package org.formlang;

import static org.formlang.Misc.LS;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.formlang.automaton.FiniteAutomaton;
import org.formlang.automaton.Mode;
import org.formlang.cfg.CFG;
import org.formlang.cfg.CYKParser;
import org.formlang.cfg.Production;
import org.formlang.cfg.Terminal;
import org.formlang.cfg.Variable;
import org.formlang.regex.Regex;

/**
 * Builds a small grammar, automaton and regex and prints them along with a
 * few membership results.
 */
public final class Demo {

    private Demo() {
    }

    private static final List<List<String>> WORDS = Arrays.asList(
        Arrays.<String> asList(),
        Arrays.asList("a"),
        Arrays.asList("b"),
        Arrays.asList("a", "b"),
        Arrays.asList("b", "a", "b"),
        Arrays.asList("a", "a", "b", "b"),
        Arrays.asList("a", "b", "a"));

    static CFG grammar() {
        final Variable S = new Variable("S");
        final Variable A = new Variable("A");
        final Variable B = new Variable("B");
        final Terminal a = new Terminal("a");
        final Terminal b = new Terminal("b");

        final Set<Production> ps = new LinkedHashSet<Production>();
        ps.add(new Production(S, A, B));
        ps.add(new Production(A, a, A));
        ps.add(new Production(A, a));
        ps.add(new Production(B, b, B));
        ps.add(new Production(B, b));
        return new CFG(new LinkedHashSet<Variable>(Arrays.asList(S, A, B)),
            new LinkedHashSet<Terminal>(Arrays.asList(a, b)), S, ps);
    }

    static FiniteAutomaton dfa() {
        return new FiniteAutomaton.Builder()
            .setStartState("q0")
            .addFinalState("q2")
            .addTransition("q0", "a", "q1")
            .addTransition("q0", "b", "q0")
            .addTransition("q1", "a", "q1")
            .addTransition("q1", "b", "q2")
            .addTransition("q2", "a", "q1")
            .addTransition("q2", "b", "q0")
            .build(Mode.DETERMINISTIC);
    }

    private static String word(List<String> word) {
        return "[" + Misc.join(word, ", ") + "]";
    }

    public static void main(String[] args) {
        System.out.println("=== Context-Free Grammar ===");
        final CFG grammar = grammar();
        System.out.println(grammar);
        final CYKParser parser = new CYKParser(grammar);
        System.out.println("normal form:" + LS + parser.normalForm());
        for (List<String> w : WORDS) {
            System.out.println("contains " + word(w) + ": " + parser.contains(w));
        }
        System.out.println();

        System.out.println("=== Deterministic Finite Automaton ===");
        final FiniteAutomaton dfa = dfa();
        System.out.println(dfa);
        for (List<String> w : WORDS) {
            System.out.println("accepts " + word(w) + ": " + dfa.accepts(w));
        }
        System.out.println("minimized:" + LS + dfa.minimize());

        System.out.println("=== Regular Expression ===");
        final Regex regex = new Regex(args.length > 0 ? args[0] : "(a+b)*ab");
        System.out.println(regex.regex() + " = " + regex);
        System.out.print(regex.toTreeString());
        for (List<String> w : WORDS) {
            System.out.println("accepts " + word(w) + ": " + regex.accepts(w));
        }
        System.out.println("minimal dfa:" + LS + regex.toDeterministic());
    }
}
