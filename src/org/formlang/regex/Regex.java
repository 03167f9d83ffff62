/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.LS;
import static org.formlang.regex.AST.alt;
import static org.formlang.regex.AST.cat;
import static org.formlang.regex.AST.star;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.formlang.Misc.FlagMgr;
import org.formlang.automaton.FiniteAutomaton;
import org.formlang.regex.AST.Node;

/**
 * A regular expression over symbols, translated once, at construction, into
 * an epsilon automaton that answers membership queries.
 * <p>
 * The surface syntax: any character other than an operator is a symbol;
 * <code>&lt;label&gt;</code> writes a symbol with a longer label and
 * <code>\x</code> escapes an operator character. Juxtaposition, or an
 * explicit <code>.</code>, concatenates; <code>+</code> (or <code>|</code>)
 * is union and postfix <code>*</code> is Kleene star; parentheses group.
 * <code>$</code> or <code>ε</code> stands for the empty string,
 * <code>#</code> or <code>∅</code> for the empty language. Star binds
 * tighter than concatenation, which binds tighter than union. White space is
 * ignored, and the empty string denotes epsilon.
 */
public final class Regex {

    private static final Logger logger = Logger.getLogger("org.formlang.regex");
    private static final Level level = Level.FINER;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Symbols are white space separated tokens, so that <code>ab cd</code> is
     * the concatenation of the two symbols <code>ab</code> and
     * <code>cd</code>.
     */
    public static final int TOKENIZED = flagMgr.next("TOKENIZED");

    /**
     * The input is a plain word: every character (every token, with
     * {@link #TOKENIZED}) is a symbol, operators included.
     */
    public static final int LITERAL = flagMgr.next("LITERAL");

    static final int FLAG_COUNT =
            flagMgr.setImplemented(TOKENIZED | LITERAL).freezeAndCount();

    static void checkFlags(int flags) {
        flagMgr.check(flags);
    }

    private final String regex;
    private final int flags;
    private final Node root;
    private final FiniteAutomaton enfa;

    /**
     * @throws java.util.regex.PatternSyntaxException
     *             if <code>regex</code> is malformed.
     */
    public Regex(String regex) {
        this(regex, 0);
    }

    /**
     * @throws java.util.regex.PatternSyntaxException
     *             if <code>regex</code> is malformed.
     * @throws IllegalArgumentException
     *             for unknown flags.
     */
    public Regex(String regex, int flags) {
        this(regex, flags, new RegexParser().parse(regex, flags));
    }

    public Regex(Node root) {
        this(null, 0, root);
    }

    private Regex(String regex, int flags, Node root) {
        if (root == null) {
            throw new IllegalArgumentException("null regex tree");
        }
        this.root = root;
        this.regex = regex != null ? regex : root.toString();
        this.flags = flags;
        this.enfa = new ThompsonConstruction().translate(root);

        if (logger.isLoggable(level)) {
            logger.log(level, "regex: " + this.regex + " flags: " + flagMgr.stringFrom(flags)
                + " -> " + enfa.size() + " states");
        }
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "tree: " + LS + root.toTreeString());
        }
    }

    /**
     * @return the text this regex was parsed from, or the infix form of its
     *         tree.
     */
    public String regex() {
        return regex;
    }

    public int flags() {
        return flags;
    }

    public Node root() {
        return root;
    }

    public boolean accepts(String... word) {
        return enfa.accepts(word);
    }

    /**
     * @param word
     *            symbol labels; a label the regex never mentions makes the
     *            word rejected.
     */
    public boolean accepts(List<String> word) {
        return enfa.accepts(word);
    }

    /**
     * @return the epsilon automaton computed at construction.
     */
    public FiniteAutomaton toEpsilonNFA() {
        return enfa;
    }

    /**
     * @return the minimal deterministic automaton for the language.
     */
    public FiniteAutomaton toDeterministic() {
        return enfa.toDeterministic().minimize();
    }

    public Regex union(Regex other) {
        return new Regex(alt(root.copy(), other.root.copy()));
    }

    public Regex concatenate(Regex other) {
        return new Regex(cat(root.copy(), other.root.copy()));
    }

    public Regex kleeneStar() {
        return new Regex(star(root.copy()));
    }

    public String toTreeString() {
        return root.toTreeString();
    }

    /**
     * Fully parenthesized infix form, e.g. <code>(((a + b)* · a) · b)</code>.
     */
    @Override
    public String toString() {
        return root.toString();
    }
}
