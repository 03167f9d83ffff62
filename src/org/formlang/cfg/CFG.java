/*
 * @LICENSE@
 */

package org.formlang.cfg;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.appendSet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A context free grammar.
 * <p>
 * Grammars are immutable values: every transformation returns a new grammar,
 * and two grammars with the same variables, terminals, start variable and
 * productions are equal. Analyses such as {@link #nullableSymbols()} are
 * recomputed on every call; callers that need them repeatedly can key their
 * own cache on the grammar. {@link CYKParser} is such a cache for membership
 * queries.
 */
public final class CFG {

    private static final Logger logger = Logger.getLogger("org.formlang.cfg");
    private static final Level level = Level.FINER;

    private static final String INDENT = "    ";
    private static final String CNF = "#CNF";

    private final Set<Variable> variables;
    private final Set<Terminal> terminals;
    private final Variable start;
    private final Set<Production> productions;

    /**
     * The start variable, and the variables and terminals the productions
     * mention, are added to the given sets.
     *
     * @throws IllegalArgumentException
     *             if <code>start</code> is null.
     */
    public CFG(Set<Variable> variables, Set<Terminal> terminals, Variable start,
            Set<Production> productions) {
        if (start == null) {
            throw new IllegalArgumentException("null start variable");
        }
        final Set<Variable> vs = new LinkedHashSet<Variable>();
        final Set<Terminal> ts = new LinkedHashSet<Terminal>();
        vs.add(start);
        vs.addAll(variables);
        ts.addAll(terminals);
        for (Production p : productions) {
            vs.add(p.head());
            for (CFGObject o : p.body()) {
                if (o instanceof Variable) {
                    vs.add((Variable) o);
                } else if (o instanceof Terminal) {
                    ts.add((Terminal) o);
                }
            }
        }
        this.variables = Collections.unmodifiableSet(vs);
        this.terminals = Collections.unmodifiableSet(ts);
        this.start = start;
        this.productions = Collections.unmodifiableSet(
            new LinkedHashSet<Production>(productions));
    }

    /**
     * A grammar whose variables and terminals are those its productions
     * mention.
     */
    public CFG(Variable start, Set<Production> productions) {
        this(Collections.<Variable> emptySet(), Collections.<Terminal> emptySet(),
            start, productions);
    }

    public Set<Variable> variables() {
        return variables;
    }

    public Set<Terminal> terminals() {
        return terminals;
    }

    public Variable start() {
        return start;
    }

    public Set<Production> productions() {
        return productions;
    }

    private CFG derive(Set<Variable> vs, Set<Terminal> ts, Set<Production> ps) {
        return new CFG(vs, ts, start, ps);
    }

    /*
     * analyses
     */

    /*
     * Least set containing <seed> and every head of a production whose body
     * lies in the set. Each production counts the body symbols still missing;
     * adding a symbol decrements the counts of exactly the productions that
     * mention it.
     */
    private Set<CFGObject> closure(Set<CFGObject> seed) {
        final Set<CFGObject> black = new LinkedHashSet<CFGObject>(seed);
        final LinkedList<CFGObject> gray = new LinkedList<CFGObject>();
        final Map<CFGObject, List<Production>> impacts =
            new HashMap<CFGObject, List<Production>>();
        final Map<Production, Integer> remaining = new HashMap<Production, Integer>();

        for (Production p : productions) {
            int count = 0;
            for (CFGObject o : p.body()) {
                if (black.contains(o)) continue;
                ++count;
                List<Production> ps = impacts.get(o);
                if (ps == null) {
                    impacts.put(o, ps = new ArrayList<Production>());
                }
                ps.add(p);
            }
            remaining.put(p, count);
            if (count == 0 && black.add(p.head())) {
                gray.add(p.head());
            }
        }
        while (!gray.isEmpty()) {
            final List<Production> ps = impacts.get(gray.removeFirst());
            if (ps == null) continue;
            for (Production p : ps) {
                final int count = remaining.get(p) - 1;
                remaining.put(p, count);
                if (count == 0 && black.add(p.head())) {
                    gray.add(p.head());
                }
            }
        }
        black.remove(Epsilon.INSTANCE);
        return black;
    }

    /**
     * @return the variables that derive the empty string.
     */
    public Set<Variable> nullableSymbols() {
        final Set<Variable> ret = new LinkedHashSet<Variable>();
        for (CFGObject o : closure(Collections.<CFGObject> singleton(Epsilon.INSTANCE))) {
            ret.add((Variable) o);
        }
        return Collections.unmodifiableSet(ret);
    }

    /**
     * @return the terminals, and the variables that derive some string of
     *         terminals.
     */
    public Set<CFGObject> generatingSymbols() {
        final Set<CFGObject> seed = new LinkedHashSet<CFGObject>(terminals);
        seed.add(Epsilon.INSTANCE);
        return Collections.unmodifiableSet(closure(seed));
    }

    /**
     * @return the variables and terminals occurring in some sentential form
     *         derived from the start variable, the start variable included.
     */
    public Set<CFGObject> reachableSymbols() {
        final Map<Variable, List<Production>> byHead = productionsByHead();
        final Set<CFGObject> black = new LinkedHashSet<CFGObject>();
        final LinkedList<Variable> gray = new LinkedList<Variable>();
        black.add(start);
        gray.add(start);
        while (!gray.isEmpty()) {
            final List<Production> ps = byHead.get(gray.removeFirst());
            if (ps == null) continue;
            for (Production p : ps) {
                for (CFGObject o : p.body()) {
                    if (o instanceof Epsilon || !black.add(o)) continue;
                    if (o instanceof Variable) gray.add((Variable) o);
                }
            }
        }
        return Collections.unmodifiableSet(black);
    }

    public boolean generatesEpsilon() {
        return nullableSymbols().contains(start);
    }

    /**
     * @return true if the grammar generates no word at all.
     */
    public boolean isEmpty() {
        return !generatingSymbols().contains(start);
    }

    private Map<Variable, List<Production>> productionsByHead() {
        final Map<Variable, List<Production>> ret =
            new LinkedHashMap<Variable, List<Production>>();
        for (Production p : productions) {
            List<Production> ps = ret.get(p.head());
            if (ps == null) {
                ret.put(p.head(), ps = new ArrayList<Production>());
            }
            ps.add(p);
        }
        return ret;
    }

    /*
     * transformations
     */

    /**
     * Removes the variables that generate no terminal string, then the
     * symbols unreachable from the start variable, along with the productions
     * that mention them. The start variable is always kept.
     */
    public CFG removeUselessSymbols() {
        final Set<CFGObject> generating = generatingSymbols();
        final Set<Production> ps = new LinkedHashSet<Production>();
        for (Production p : productions) {
            if (!generating.contains(p.head())) continue;
            boolean keep = true;
            for (CFGObject o : p.body()) {
                if (!(o instanceof Epsilon) && !generating.contains(o)) {
                    keep = false;
                    break;
                }
            }
            if (keep) ps.add(p);
        }
        final CFG g = derive(Collections.<Variable> emptySet(), terminals, ps);
        final Set<CFGObject> reachable = g.reachableSymbols();

        final Set<Variable> vs = new LinkedHashSet<Variable>();
        final Set<Terminal> ts = new LinkedHashSet<Terminal>();
        for (CFGObject o : reachable) {
            if (o instanceof Variable) {
                vs.add((Variable) o);
            } else if (o instanceof Terminal) {
                ts.add((Terminal) o);
            }
        }
        final Set<Production> kept = new LinkedHashSet<Production>();
        for (Production p : ps) {
            if (reachable.contains(p.head())) kept.add(p);
        }
        return derive(vs, ts, kept);
    }

    /**
     * Replaces every production by the variants obtained by keeping or
     * dropping each nullable body symbol, leaving out empty bodies. If the
     * grammar generates the empty string, <code>start -> ε</code> is the one
     * epsilon production of the result.
     */
    public CFG removeEpsilon() {
        final Set<Variable> nullable = nullableSymbols();
        final Set<Production> ps = new LinkedHashSet<Production>();
        for (Production p : productions) {
            List<List<CFGObject>> bodies = new ArrayList<List<CFGObject>>();
            bodies.add(new ArrayList<CFGObject>());
            for (CFGObject o : p.body()) {
                if (o instanceof Epsilon) continue;
                final List<List<CFGObject>> next = new ArrayList<List<CFGObject>>();
                for (List<CFGObject> body : bodies) {
                    if (nullable.contains(o)) {
                        next.add(body);
                    }
                    final List<CFGObject> with = new ArrayList<CFGObject>(body);
                    with.add(o);
                    next.add(with);
                }
                bodies = next;
            }
            for (List<CFGObject> body : bodies) {
                if (!body.isEmpty()) ps.add(new Production(p.head(), body));
            }
        }
        if (nullable.contains(start)) {
            ps.add(new Production(start));
        }
        return derive(variables, terminals, ps);
    }

    /**
     * @return every pair (A, B) such that A derives B through unit
     *         productions, including (A, A) for every variable A.
     */
    public Set<UnitPair> unitPairs() {
        final Map<Variable, List<Variable>> units = new HashMap<Variable, List<Variable>>();
        for (Production p : productions) {
            if (!p.isUnit()) continue;
            List<Variable> targets = units.get(p.head());
            if (targets == null) {
                units.put(p.head(), targets = new ArrayList<Variable>());
            }
            targets.add((Variable) p.body().get(0));
        }
        final Set<UnitPair> black = new LinkedHashSet<UnitPair>();
        final LinkedList<UnitPair> gray = new LinkedList<UnitPair>();
        for (Variable v : variables) {
            final UnitPair pair = new UnitPair(v, v);
            black.add(pair);
            gray.add(pair);
        }
        while (!gray.isEmpty()) {
            final UnitPair pair = gray.removeFirst();
            final List<Variable> targets = units.get(pair.to());
            if (targets == null) continue;
            for (Variable target : targets) {
                final UnitPair next = new UnitPair(pair.from(), target);
                if (black.add(next)) gray.add(next);
            }
        }
        return Collections.unmodifiableSet(black);
    }

    /**
     * For every unit pair (A, B), copies the non unit productions of B to A;
     * the unit productions are dropped.
     */
    public CFG eliminateUnitProductions() {
        final Map<Variable, List<Production>> byHead = productionsByHead();
        final Set<Production> ps = new LinkedHashSet<Production>();
        for (UnitPair pair : unitPairs()) {
            final List<Production> bs = byHead.get(pair.to());
            if (bs == null) continue;
            for (Production p : bs) {
                if (!p.isUnit()) ps.add(new Production(pair.from(), p.body()));
            }
        }
        return derive(variables, terminals, ps);
    }

    /**
     * @return true if every body is a single terminal or two variables, the
     *         only exception being <code>start -> ε</code>.
     */
    public boolean isNormalForm() {
        for (Production p : productions) {
            final List<CFGObject> body = p.body();
            if (body.isEmpty() && p.head().equals(start)) continue;
            if (body.size() == 1 && body.get(0) instanceof Terminal) continue;
            if (body.size() == 2 && body.get(0) instanceof Variable
                && body.get(1) instanceof Variable) continue;
            return false;
        }
        return true;
    }

    /**
     * Chomsky normal form: useless symbols, epsilon productions and unit
     * productions are removed, then terminals in long bodies are moved to
     * productions of their own (<code>a#CNF -> a</code>) and long bodies are
     * split from the right (<code>S#CNF#1</code>, ...). Introduced names never
     * collide with existing variables.
     */
    public CFG toNormalForm() {
        final CFG g = removeUselessSymbols().removeEpsilon()
            .eliminateUnitProductions().withoutNonStartEpsilon().removeUselessSymbols();

        final Set<Variable> used = new LinkedHashSet<Variable>(g.variables);
        final Set<Production> ps = new LinkedHashSet<Production>();
        final Map<Terminal, Variable> terminalVariables = new HashMap<Terminal, Variable>();

        for (Production p : g.productions) {
            if (p.body().size() < 2) {
                ps.add(p);
                continue;
            }
            final List<Variable> body = new ArrayList<Variable>(p.body().size());
            for (CFGObject o : p.body()) {
                if (o instanceof Variable) {
                    body.add((Variable) o);
                    continue;
                }
                final Terminal t = (Terminal) o;
                Variable v = terminalVariables.get(t);
                if (v == null) {
                    v = fresh(used, t.label() + CNF);
                    terminalVariables.put(t, v);
                    ps.add(new Production(v, t));
                }
                body.add(v);
            }
            Variable head = p.head();
            int n = 0;
            while (body.size() > 2) {
                final Variable rest = fresh(used, p.head().label() + CNF + "#" + ++n);
                ps.add(new Production(head, body.remove(0), rest));
                head = rest;
            }
            ps.add(new Production(head, body.get(0), body.get(1)));
        }
        final CFG cnf = derive(used, g.terminals, ps);
        assert cnf.isNormalForm();

        logger.log(level, "normal form: " + productions.size() + " productions -> "
            + cnf.productions.size() + " productions");
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "normal form: " + LS + cnf);
        }
        return cnf;
    }

    /*
     * Unit elimination copies start -> ε to every A with A =>* start; after
     * epsilon removal no body needs such an A to vanish.
     */
    private CFG withoutNonStartEpsilon() {
        final Set<Production> ps = new LinkedHashSet<Production>();
        for (Production p : productions) {
            if (!p.body().isEmpty() || p.head().equals(start)) ps.add(p);
        }
        return derive(variables, terminals, ps);
    }

    private static Variable fresh(Set<Variable> used, String base) {
        String label = base;
        while (used.contains(new Variable(label))) {
            label += '\'';
        }
        final Variable v = new Variable(label);
        used.add(v);
        return v;
    }

    /*
     * membership
     */

    /**
     * Decides membership with CYK. The normal form is computed on every call;
     * build a {@link CYKParser} once for repeated queries.
     */
    public boolean contains(List<String> word) {
        return new CYKParser(this).contains(word);
    }

    public boolean contains(String... word) {
        return contains(Arrays.asList(word));
    }

    /*
     * text form
     */

    private static final String ARROW = "->";
    private static final String VAR = "VAR:";
    private static final String TER = "TER:";
    private static final List<String> EPSILONS = Arrays.asList("ε", "$", "epsilon");

    /**
     * Reads a grammar, one group of productions per line:
     *
     * <pre>
     * S -> A B | $
     * A -> a A | a
     * </pre>
     *
     * Tokens are separated by white space. A token starting with an upper
     * case letter is a variable, any other a terminal; <code>ε</code>,
     * <code>$</code> and <code>epsilon</code> stand for the empty string, as
     * does an empty alternative. The prefixes <code>VAR:</code> and
     * <code>TER:</code> force the kind. The first head is the start variable.
     *
     * @throws NotParsableException
     *             if a line lacks an arrow or its head is not a variable.
     */
    public static CFG fromText(String text) {
        return fromText(text, null);
    }

    /**
     * @param start
     *            the start variable, or null for the first head.
     */
    public static CFG fromText(String text, Variable start) {
        final Set<Production> ps = new LinkedHashSet<Production>();
        final String[] lines = text.split("\r?\n");
        for (int i = 0; i < lines.length; ++i) {
            final String line = lines[i].trim();
            if (line.length() == 0) continue;
            final int arrow = line.indexOf(ARROW);
            if (arrow < 0) {
                throw new NotParsableException("missing '" + ARROW + "' in \"" + line + "\"", i + 1);
            }
            final String headToken = line.substring(0, arrow).trim();
            if (headToken.length() == 0 || headToken.split("\\s+").length != 1) {
                throw new NotParsableException("head must be one symbol in \"" + line + "\"", i + 1);
            }
            final CFGObject head = symbolFrom(headToken);
            if (!(head instanceof Variable)) {
                throw new NotParsableException("head " + headToken + " is not a variable", i + 1);
            }
            if (start == null) start = (Variable) head;
            for (String alternative : line.substring(arrow + ARROW.length()).split("\\|", -1)) {
                final List<CFGObject> body = new ArrayList<CFGObject>();
                for (String token : alternative.trim().split("\\s+")) {
                    if (token.length() > 0) body.add(symbolFrom(token));
                }
                ps.add(new Production((Variable) head, body));
            }
        }
        if (start == null) {
            throw new NotParsableException("no productions", lines.length);
        }
        return new CFG(start, ps);
    }

    private static CFGObject symbolFrom(String token) {
        if (token.startsWith(VAR)) {
            return new Variable(token.substring(VAR.length()));
        } else if (token.startsWith(TER)) {
            return new Terminal(token.substring(TER.length()));
        } else if (EPSILONS.contains(token)) {
            return Epsilon.INSTANCE;
        } else if (Character.isUpperCase(token.charAt(0))) {
            return new Variable(token);
        }
        return new Terminal(token);
    }

    private static String tokenFrom(CFGObject o) {
        final String label = o.label();
        if (o instanceof Variable) {
            final boolean plain = label.length() > 0 && Character.isUpperCase(label.charAt(0))
                && !label.startsWith(VAR) && !label.startsWith(TER);
            return plain ? label : VAR + label;
        } else if (o instanceof Terminal) {
            final boolean plain = label.length() > 0 && !Character.isUpperCase(label.charAt(0))
                && !EPSILONS.contains(label) && !label.startsWith(VAR) && !label.startsWith(TER);
            return plain ? label : TER + label;
        }
        return "$";
    }

    /**
     * The text form read by {@link #fromText(String)}, start variable first.
     * Variables and terminals no production mentions are not represented.
     */
    public String toText() {
        final Map<Variable, List<Production>> byHead = productionsByHead();
        final List<Variable> heads = new ArrayList<Variable>(byHead.keySet());
        if (heads.remove(start)) heads.add(0, start);
        final StringBuilder sb = new StringBuilder();
        for (Variable head : heads) {
            sb.append(tokenFrom(head)).append(' ').append(ARROW);
            String separator = " ";
            for (Production p : byHead.get(head)) {
                sb.append(separator);
                separator = " | ";
                if (p.body().isEmpty()) sb.append(tokenFrom(Epsilon.INSTANCE));
                for (int i = 0; i < p.body().size(); ++i) {
                    sb.append(i == 0 ? "" : " ").append(tokenFrom(p.body().get(i)));
                }
            }
            sb.append(LS);
        }
        return sb.toString();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + variables.hashCode();
        result = prime * result + terminals.hashCode();
        result = prime * result + start.hashCode();
        result = prime * result + productions.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CFG))
            return false;
        final CFG other = (CFG) o;
        return start.equals(other.start) && variables.equals(other.variables)
            && terminals.equals(other.terminals) && productions.equals(other.productions);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("variables: ");
        appendSet(sb, variables).append(LS);
        sb.append("terminals: ");
        appendSet(sb, terminals).append(LS);
        sb.append("start: ").append(start).append(LS);
        sb.append("productions:").append(LS);
        for (Production p : productions) {
            sb.append(INDENT).append(p).append(LS);
        }
        return sb.toString();
    }
}
