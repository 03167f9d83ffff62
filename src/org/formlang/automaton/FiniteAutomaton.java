/*
 * @LICENSE@
 */

package org.formlang.automaton;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.appendSet;
import static org.formlang.Misc.setString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
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
 * A finite automaton in one of three {@linkplain Mode modes}: nondeterministic,
 * epsilon extended nondeterministic, or deterministic.
 * <p>
 * Instances are immutable and may be shared between threads. They are
 * assembled with a {@link Builder}, which validates the relation against the
 * requested mode. Every transformation returns a new automaton; conversions
 * between modes ({@link #toDeterministic()}, {@link #toNondeterministic()})
 * are always explicit, and operations that only make sense for one mode
 * (such as {@link #minimize()}) reject the others with an
 * {@link UnsupportedOperationException}.
 * <p>
 * Internally states and symbols are interned into compact integer handles;
 * the transition relation is a table of {@link BitSet}s indexed by state and
 * symbol handle, plus one epsilon row per state.
 */
public final class FiniteAutomaton {

    private static final Logger logger = Logger.getLogger("org.formlang.automaton");
    private static final Level level = Level.FINER;

    private static final String INDENT = "    ";

    /**
     * Mutable assembly area for a {@link FiniteAutomaton}. A builder is used
     * by one thread while the automaton is put together; {@link #build(Mode)}
     * validates and copies, so a builder may keep growing after a build
     * without affecting automata already built from it.
     */
    public static final class Builder {

        private final Index<State> states;
        private final Index<Symbol> symbols;
        private final List<Map<Integer, BitSet>> rows;
        private final List<BitSet> epsilonRows;
        private final BitSet starts;
        private final BitSet finals;

        public Builder() {
            this.states = new Index<State>();
            this.symbols = new Index<Symbol>();
            this.rows = new ArrayList<Map<Integer, BitSet>>();
            this.epsilonRows = new ArrayList<BitSet>();
            this.starts = new BitSet();
            this.finals = new BitSet();
        }

        private int state(State state) {
            if (state == null) {
                throw new ConstructionException("null state");
            }
            final int h = states.intern(state);
            while (rows.size() <= h) {
                rows.add(new HashMap<Integer, BitSet>());
                epsilonRows.add(new BitSet());
            }
            return h;
        }

        private int symbol(Symbol symbol) {
            if (symbol == null) {
                throw new ConstructionException("null symbol");
            }
            if (symbol.isEpsilon()) {
                throw new ConstructionException(
                    "epsilon is not an alphabet symbol");
            }
            return symbols.intern(symbol);
        }

        public Builder addState(State state) {
            state(state);
            return this;
        }

        public Builder addSymbol(Symbol symbol) {
            symbol(symbol);
            return this;
        }

        /**
         * Adds a transition; a transition on {@link Symbol#EPSILON} is an
         * {@linkplain #addEpsilonTransition(State, State) epsilon transition}.
         */
        public Builder addTransition(State from, Symbol symbol, State to) {
            if (symbol != null && symbol.isEpsilon()) {
                return addEpsilonTransition(from, to);
            }
            final int f = state(from);
            final int a = symbol(symbol);
            final int t = state(to);
            BitSet targets = rows.get(f).get(a);
            if (targets == null) {
                rows.get(f).put(a, targets = new BitSet());
            }
            targets.set(t);
            return this;
        }

        public Builder addTransition(String from, String symbol, String to) {
            return addTransition(
                new State(from), new Symbol(symbol), new State(to));
        }

        public Builder addEpsilonTransition(State from, State to) {
            final int f = state(from);
            final int t = state(to);
            epsilonRows.get(f).set(t);
            return this;
        }

        public Builder addEpsilonTransition(String from, String to) {
            return addEpsilonTransition(new State(from), new State(to));
        }

        public Builder addStartState(State state) {
            starts.set(state(state));
            return this;
        }

        public Builder addStartState(String state) {
            return addStartState(new State(state));
        }

        /**
         * Makes <code>state</code> the only start state.
         */
        public Builder setStartState(State state) {
            final int h = state(state);
            starts.clear();
            starts.set(h);
            return this;
        }

        public Builder setStartState(String state) {
            return setStartState(new State(state));
        }

        public Builder addFinalState(State state) {
            finals.set(state(state));
            return this;
        }

        public Builder addFinalState(String state) {
            return addFinalState(new State(state));
        }

        public boolean containsState(State state) {
            return states.contains(state);
        }

        /**
         * @return a state labeled <code>base</code>, primed as often as
         *         needed to differ from every state added so far. The state is
         *         not added.
         */
        public State freshState(String base) {
            String label = base;
            while (states.contains(new State(label))) {
                label += '\'';
            }
            return new State(label);
        }

        /**
         * Validates the assembled relation against <code>mode</code> and
         * freezes a copy of it.
         *
         * @throws ConstructionException
         *             if the relation has epsilon transitions and
         *             <code>mode</code> is not {@link Mode#EPSILON}, or if
         *             <code>mode</code> is {@link Mode#DETERMINISTIC} and
         *             there is not exactly one start state or some (state,
         *             symbol) pair has more than one target.
         */
        public FiniteAutomaton build(Mode mode) {
            if (mode == null) {
                throw new ConstructionException("null mode");
            }
            final int n = states.size();
            final int k = symbols.size();
            if (mode != Mode.EPSILON) {
                for (int s = 0; s < n; ++s) {
                    if (!epsilonRows.get(s).isEmpty()) {
                        throw new ConstructionException(
                            mode + " automaton cannot have epsilon transitions: "
                            + states.get(s) + " --ε--> "
                            + setString(states.valuesOf(epsilonRows.get(s))));
                    }
                }
            }
            if (mode == Mode.DETERMINISTIC) {
                if (starts.cardinality() != 1) {
                    throw new ConstructionException(
                        "a deterministic automaton needs exactly one start state, found "
                        + setString(states.valuesOf(starts)));
                }
                for (int s = 0; s < n; ++s) {
                    for (Map.Entry<Integer, BitSet> e : rows.get(s).entrySet()) {
                        if (e.getValue().cardinality() > 1) {
                            throw new ConstructionException(
                                "nondeterministic transition: " + states.get(s)
                                + " --" + symbols.get(e.getKey()) + "--> "
                                + setString(states.valuesOf(e.getValue())));
                        }
                    }
                }
            }
            final BitSet[][] delta = new BitSet[n][k];
            final BitSet[] epsilon = new BitSet[n];
            for (int s = 0; s < n; ++s) {
                for (Map.Entry<Integer, BitSet> e : rows.get(s).entrySet()) {
                    delta[s][e.getKey()] = (BitSet) e.getValue().clone();
                }
                if (!epsilonRows.get(s).isEmpty()) {
                    epsilon[s] = (BitSet) epsilonRows.get(s).clone();
                }
            }
            return new FiniteAutomaton(mode,
                new Index<State>(states), new Index<Symbol>(symbols),
                delta, epsilon, (BitSet) starts.clone(), (BitSet) finals.clone());
        }
    }

    private final Mode mode;
    private final Index<State> states;
    private final Index<Symbol> symbols;
    private final BitSet[][] delta;     // [state][symbol] -> targets, null if none
    private final BitSet[] epsilon;     // [state] -> targets, null if none
    private final BitSet starts;
    private final BitSet finals;

    /*
     * Arrays and sets are never handed out, so automata derived from this one
     * (e.g. the complement) may share them.
     */
    private FiniteAutomaton(Mode mode, Index<State> states, Index<Symbol> symbols,
            BitSet[][] delta, BitSet[] epsilon, BitSet starts, BitSet finals) {
        this.mode = mode;
        this.states = states;
        this.symbols = symbols;
        this.delta = delta;
        this.epsilon = epsilon;
        this.starts = starts;
        this.finals = finals;
    }

    /*
     * accessors
     */

    public Mode mode() {
        return mode;
    }

    public boolean isDeterministic() {
        return mode == Mode.DETERMINISTIC;
    }

    public Set<State> states() {
        return states.asSet();
    }

    /**
     * @return the alphabet; never contains {@link Symbol#EPSILON}.
     */
    public Set<Symbol> symbols() {
        return symbols.asSet();
    }

    public Set<State> startStates() {
        return states.valuesOf(starts);
    }

    /**
     * @return the start state of a deterministic automaton.
     */
    public State startState() {
        requireDeterministic("startState");
        return states.get(starts.nextSetBit(0));
    }

    public Set<State> finalStates() {
        return states.valuesOf(finals);
    }

    public int size() {
        return states.size();
    }

    public int transitionCount() {
        int count = 0;
        for (int s = 0; s < delta.length; ++s) {
            for (BitSet targets : delta[s]) {
                if (targets != null) count += targets.cardinality();
            }
            if (epsilon[s] != null) count += epsilon[s].cardinality();
        }
        return count;
    }

    public boolean hasEpsilonTransitions() {
        for (BitSet targets : epsilon) {
            if (targets != null) return true;
        }
        return false;
    }

    /**
     * @return the states reached from <code>from</code> in one transition on
     *         <code>symbol</code>; epsilon transitions if <code>symbol</code>
     *         is {@link Symbol#EPSILON}. Empty for an unknown symbol.
     */
    public Set<State> nextStates(State from, Symbol symbol) {
        final int s = stateHandle(from);
        BitSet targets;
        if (symbol.isEpsilon()) {
            targets = epsilon[s];
        } else {
            final int a = symbols.handleOf(symbol);
            targets = a < 0 ? null : delta[s][a];
        }
        return states.valuesOf(targets == null ? new BitSet() : targets);
    }

    /**
     * @return the target of the transition on <code>symbol</code> from
     *         <code>from</code> in a deterministic automaton, or
     *         <code>null</code> if there is none.
     */
    public State nextState(State from, Symbol symbol) {
        requireDeterministic("nextState");
        final int a = symbols.handleOf(symbol);
        final int t = a < 0 ? -1 : step(stateHandle(from), a);
        return t < 0 ? null : states.get(t);
    }

    public Builder toBuilder() {
        final Builder b = new Builder();
        copyInto(b, this, "", true);
        for (int s = starts.nextSetBit(0); s >= 0; s = starts.nextSetBit(s + 1)) {
            b.addStartState(states.get(s));
        }
        return b;
    }

    private int stateHandle(State state) {
        final int h = states.handleOf(state);
        if (h < 0) {
            throw new IllegalArgumentException(
                "not a state of this automaton: " + state);
        }
        return h;
    }

    private void requireDeterministic(String operation) {
        if (mode != Mode.DETERMINISTIC) {
            throw new UnsupportedOperationException(
                operation + "() requires a deterministic automaton, this one is "
                + mode + "; call toDeterministic() first");
        }
    }

    /*
     * handle level primitives
     */

    private int step(int s, int a) {
        final BitSet targets = delta[s][a];
        return targets == null ? -1 : targets.nextSetBit(0);
    }

    private BitSet step(BitSet from, int a) {
        final BitSet ret = new BitSet();
        for (int s = from.nextSetBit(0); s >= 0; s = from.nextSetBit(s + 1)) {
            if (delta[s][a] != null) ret.or(delta[s][a]);
        }
        return ret;
    }

    private BitSet closure(BitSet set) {
        final BitSet ret = (BitSet) set.clone();
        if (mode != Mode.EPSILON) return ret;
        final LinkedList<Integer> gray = new LinkedList<Integer>();
        for (int s = set.nextSetBit(0); s >= 0; s = set.nextSetBit(s + 1)) {
            gray.add(s);
        }
        while (!gray.isEmpty()) {
            final BitSet targets = epsilon[gray.removeFirst()];
            if (targets == null) continue;
            for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                if (!ret.get(t)) {
                    ret.set(t);
                    gray.add(t);
                }
            }
        }
        return ret;
    }

    /*
     * states reachable from the start states via any symbol or epsilon
     */
    private BitSet reachable() {
        final BitSet black = new BitSet();
        final LinkedList<Integer> gray = new LinkedList<Integer>();
        for (int s = starts.nextSetBit(0); s >= 0; s = starts.nextSetBit(s + 1)) {
            black.set(s);
            gray.add(s);
        }
        while (!gray.isEmpty()) {
            final int s = gray.removeFirst();
            final BitSet next = new BitSet();
            for (BitSet targets : delta[s]) {
                if (targets != null) next.or(targets);
            }
            if (epsilon[s] != null) next.or(epsilon[s]);
            next.andNot(black);
            black.or(next);
            for (int t = next.nextSetBit(0); t >= 0; t = next.nextSetBit(t + 1)) {
                gray.add(t);
            }
        }
        return black;
    }

    /*
     * membership
     */

    public boolean accepts(String... word) {
        return accepts(Arrays.asList(word));
    }

    /**
     * Decides whether the automaton accepts <code>word</code>, a sequence of
     * symbol labels. A label outside the alphabet makes the word rejected.
     */
    public boolean accepts(List<String> word) {
        if (mode == Mode.DETERMINISTIC) {
            int s = starts.nextSetBit(0);
            for (String label : word) {
                final int a = symbols.handleOf(new Symbol(label));
                if (a < 0 || (s = step(s, a)) < 0) return false;
            }
            return finals.get(s);
        }
        BitSet current = closure(starts);
        for (String label : word) {
            final int a = symbols.handleOf(new Symbol(label));
            if (a < 0) return false;
            current = closure(step(current, a));
            if (current.isEmpty()) return false;
        }
        return current.intersects(finals);
    }

    public boolean acceptsEpsilon() {
        return closure(starts).intersects(finals);
    }

    /**
     * @return true iff no final state is reachable from a start state.
     */
    public boolean isEmpty() {
        return !reachable().intersects(finals);
    }

    public Set<State> epsilonClosure(State state) {
        final BitSet set = new BitSet();
        set.set(stateHandle(state));
        return states.valuesOf(closure(set));
    }

    /**
     * @return <code>from</code> plus every state reachable from it through
     *         epsilon transitions only.
     */
    public Set<State> epsilonClosure(Collection<State> from) {
        final BitSet set = new BitSet();
        for (State state : from) {
            set.set(stateHandle(state));
        }
        return states.valuesOf(closure(set));
    }

    /*
     * conversions
     */

    /**
     * Subset construction. Each state of the result stands for the epsilon
     * closed set of states of this automaton that are active together, and
     * is labeled with that set. The result is partial: the empty set is only
     * materialized when it is the start set.
     */
    public FiniteAutomaton toDeterministic() {
        if (mode == Mode.DETERMINISTIC) return this;

        final Builder builder = new Builder();
        for (Symbol symbol : symbols) {
            builder.addSymbol(symbol);
        }

        final class SubsetFactory {

            private final Map<BitSet, State> map = new LinkedHashMap<BitSet, State>();
            private final LinkedList<BitSet> gray = new LinkedList<BitSet>();

            private State stateFrom(BitSet subset) {
                State state = map.get(subset);
                if (state == null) {
                    state = builder.freshState(setString(states.valuesOf(subset)));
                    builder.addState(state);
                    map.put(subset, state);
                    gray.add(subset);
                }
                return state;
            }
        }
        final SubsetFactory factory = new SubsetFactory();

        /*
         * Subset construction as breadth first search
         */
        builder.setStartState(factory.stateFrom(closure(starts)));
        while (!factory.gray.isEmpty()) {
            final BitSet subset = factory.gray.removeFirst();
            final State from = factory.map.get(subset);
            if (subset.intersects(finals)) {
                builder.addFinalState(from);
            }
            for (int a = 0; a < symbols.size(); ++a) {
                final BitSet next = closure(step(subset, a));
                if (!next.isEmpty()) {
                    builder.addTransition(from, symbols.get(a), factory.stateFrom(next));
                }
            }
        }
        final FiniteAutomaton dfa = builder.build(Mode.DETERMINISTIC);

        logger.log(level, "subset construction: " + size() + " states -> "
            + dfa.size() + " states");
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "dfa: " + LS + dfa);
        }
        return dfa;
    }

    /**
     * Removes epsilon transitions: a state gets the transitions of its
     * epsilon closure, with epsilon closed targets, and is final iff its
     * closure contains a final state. A deterministic automaton is relabeled
     * {@link Mode#NONDETERMINISTIC} unchanged.
     */
    public FiniteAutomaton toNondeterministic() {
        if (mode == Mode.NONDETERMINISTIC) return this;
        if (mode == Mode.DETERMINISTIC) {
            return new FiniteAutomaton(Mode.NONDETERMINISTIC, states, symbols,
                delta, epsilon, starts, finals);
        }
        final int n = states.size();
        final int k = symbols.size();
        final BitSet[][] newDelta = new BitSet[n][k];
        final BitSet newFinals = new BitSet();
        for (int s = 0; s < n; ++s) {
            final BitSet single = new BitSet();
            single.set(s);
            final BitSet c = closure(single);
            if (c.intersects(finals)) newFinals.set(s);
            for (int a = 0; a < k; ++a) {
                final BitSet targets = closure(step(c, a));
                if (!targets.isEmpty()) newDelta[s][a] = targets;
            }
        }
        return new FiniteAutomaton(Mode.NONDETERMINISTIC, states, symbols,
            newDelta, new BitSet[n], starts, newFinals);
    }

    /*
     * deterministic only
     */

    public boolean isComplete() {
        requireDeterministic("isComplete");
        for (BitSet[] row : delta) {
            for (BitSet targets : row) {
                if (targets == null) return false;
            }
        }
        return true;
    }

    /**
     * Adds a sink state with self loops on every symbol and sends every
     * missing transition to it. Returns this automaton if it is already
     * complete.
     */
    public FiniteAutomaton makeComplete() {
        if (isComplete()) return this;
        final Builder b = toBuilder();
        final State sink = b.freshState("sink");
        for (int s = 0; s < delta.length; ++s) {
            for (int a = 0; a < symbols.size(); ++a) {
                if (delta[s][a] == null) {
                    b.addTransition(states.get(s), symbols.get(a), sink);
                }
            }
        }
        for (Symbol symbol : symbols) {
            b.addTransition(sink, symbol, sink);
        }
        return b.build(Mode.DETERMINISTIC);
    }

    /**
     * The complement with respect to the alphabet of this automaton. The
     * automaton is {@linkplain #makeComplete() completed} first if needed;
     * the final states of the result are the non final states of the
     * complete automaton.
     */
    public FiniteAutomaton complement() {
        final FiniteAutomaton complete = makeComplete();
        final BitSet flipped = new BitSet();
        flipped.set(0, complete.size());
        flipped.andNot(complete.finals);
        return new FiniteAutomaton(Mode.DETERMINISTIC, complete.states,
            complete.symbols, complete.delta, complete.epsilon,
            complete.starts, flipped);
    }

    /**
     * Partition refinement. Unreachable states are dropped and the automaton
     * completed; the partition {finals, non finals} is then split, one symbol
     * at a time, until no block has two members whose transitions land in
     * different blocks. The block that cannot reach a final state is left out
     * of the result (unless it holds the start state), so the result is the
     * unique minimal, trim, deterministic automaton for the language.
     */
    public FiniteAutomaton minimize() {
        requireDeterministic("minimize");
        final FiniteAutomaton dfa = trim().makeComplete();
        final int n = dfa.size();
        final int k = dfa.symbols.size();

        int[] block = new int[n];
        int nBlocks = dfa.initialPartition(block);
        int passes = 0;
        for (boolean split = true; split;) {
            split = false;
            ++passes;
            for (int a = 0; a < k; ++a) {
                final int[] next = new int[n];
                final int count = dfa.refine(block, a, next);
                assert count >= nBlocks;
                if (count > nBlocks) {
                    block = next;
                    nBlocks = count;
                    split = true;
                }
            }
        }

        final List<List<State>> members = new ArrayList<List<State>>(nBlocks);
        for (int b = 0; b < nBlocks; ++b) {
            members.add(new ArrayList<State>());
        }
        final int[] representative = new int[nBlocks];
        for (int s = n - 1; s >= 0; --s) {
            members.get(block[s]).add(0, dfa.states.get(s));
            representative[block[s]] = s;
        }

        /*
         * live blocks: those from which a final block can be reached
         */
        final boolean[] live = new boolean[nBlocks];
        for (int s = dfa.finals.nextSetBit(0); s >= 0; s = dfa.finals.nextSetBit(s + 1)) {
            live[block[s]] = true;
        }
        for (boolean changed = true; changed;) {
            changed = false;
            for (int s = 0; s < n; ++s) {
                if (live[block[s]]) continue;
                for (int a = 0; a < k; ++a) {
                    if (live[block[dfa.step(s, a)]]) {
                        live[block[s]] = changed = true;
                        break;
                    }
                }
            }
        }

        final int startBlock = block[dfa.starts.nextSetBit(0)];
        final Builder b = new Builder();
        for (Symbol symbol : dfa.symbols) {
            b.addSymbol(symbol);
        }
        final State[] blockStates = new State[nBlocks];
        for (int i = 0; i < nBlocks; ++i) {
            if (live[i] || i == startBlock) {
                blockStates[i] = b.freshState(setString(members.get(i)));
                b.addState(blockStates[i]);
            }
        }
        b.setStartState(blockStates[startBlock]);
        for (int i = 0; i < nBlocks; ++i) {
            if (blockStates[i] == null) continue;
            final int s = representative[i];
            if (dfa.finals.get(s)) {
                b.addFinalState(blockStates[i]);
            }
            for (int a = 0; a < k; ++a) {
                final int target = block[dfa.step(s, a)];
                if (live[target]) {
                    b.addTransition(blockStates[i], dfa.symbols.get(a), blockStates[target]);
                }
            }
        }
        final FiniteAutomaton min = b.build(Mode.DETERMINISTIC);

        logger.log(level, "minimization: " + size() + " states -> " + min.size()
            + " states in " + passes + " refinement passes");
        return min;
    }

    /*
     * blocks numbered in order of first appearance: returns the block count
     */
    private int initialPartition(int[] block) {
        int finalBlock = -1;
        int otherBlock = -1;
        int count = 0;
        for (int s = 0; s < block.length; ++s) {
            if (finals.get(s)) {
                if (finalBlock < 0) finalBlock = count++;
                block[s] = finalBlock;
            } else {
                if (otherBlock < 0) otherBlock = count++;
                block[s] = otherBlock;
            }
        }
        return count;
    }

    /*
     * splits every block of <block> by the block its members reach on <a>;
     * requires a complete automaton.
     */
    private int refine(int[] block, int a, int[] next) {
        final Map<Long, Integer> ids = new HashMap<Long, Integer>();
        for (int s = 0; s < block.length; ++s) {
            final long key = ((long) block[s] << 32) | block[step(s, a)];
            Integer id = ids.get(key);
            if (id == null) {
                ids.put(key, id = ids.size());
            }
            next[s] = id;
        }
        return ids.size();
    }

    private FiniteAutomaton trim() {
        final BitSet reachable = reachable();
        if (reachable.cardinality() == states.size()) return this;
        final Builder b = new Builder();
        for (Symbol symbol : symbols) {
            b.addSymbol(symbol);
        }
        for (int s = reachable.nextSetBit(0); s >= 0; s = reachable.nextSetBit(s + 1)) {
            final State from = states.get(s);
            b.addState(from);
            if (starts.get(s)) b.addStartState(from);
            if (finals.get(s)) b.addFinalState(from);
            for (int a = 0; a < symbols.size(); ++a) {
                final BitSet targets = delta[s][a];
                if (targets == null) continue;
                for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                    b.addTransition(from, symbols.get(a), states.get(t));
                }
            }
            if (epsilon[s] != null) {
                for (int t = epsilon[s].nextSetBit(0); t >= 0; t = epsilon[s].nextSetBit(t + 1)) {
                    b.addEpsilonTransition(from, states.get(t));
                }
            }
        }
        return b.build(mode);
    }

    /*
     * combinators
     */

    private static final String LEFT = "0:";
    private static final String RIGHT = "1:";

    /*
     * Copies states, alphabet, transitions and (optionally) final states of
     * <fa> into <b>, prefixing every state label. Start states are left to
     * the caller.
     */
    private static void copyInto(Builder b, FiniteAutomaton fa, String prefix,
            boolean withFinals) {
        for (Symbol symbol : fa.symbols) {
            b.addSymbol(symbol);
        }
        final State[] renamed = new State[fa.size()];
        for (int s = 0; s < renamed.length; ++s) {
            renamed[s] = prefix.length() == 0
                ? fa.states.get(s)
                : new State(prefix + fa.states.get(s).label());
            b.addState(renamed[s]);
        }
        for (int s = 0; s < renamed.length; ++s) {
            for (int a = 0; a < fa.symbols.size(); ++a) {
                final BitSet targets = fa.delta[s][a];
                if (targets == null) continue;
                for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                    b.addTransition(renamed[s], fa.symbols.get(a), renamed[t]);
                }
            }
            final BitSet targets = fa.epsilon[s];
            if (targets == null) continue;
            for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                b.addEpsilonTransition(renamed[s], renamed[t]);
            }
        }
        if (withFinals) {
            for (int f = fa.finals.nextSetBit(0); f >= 0; f = fa.finals.nextSetBit(f + 1)) {
                b.addFinalState(renamed[f]);
            }
        }
    }

    private static State renamed(String prefix, FiniteAutomaton fa, int s) {
        return new State(prefix + fa.states.get(s).label());
    }

    /**
     * A fresh start state with epsilon transitions to the start states of
     * both operands; the final states of both operands are final.
     */
    public FiniteAutomaton union(FiniteAutomaton other) {
        final Builder b = new Builder();
        copyInto(b, this, LEFT, true);
        copyInto(b, other, RIGHT, true);
        final State init = b.freshState("init");
        b.addStartState(init);
        for (int s = starts.nextSetBit(0); s >= 0; s = starts.nextSetBit(s + 1)) {
            b.addEpsilonTransition(init, renamed(LEFT, this, s));
        }
        for (int s = other.starts.nextSetBit(0); s >= 0; s = other.starts.nextSetBit(s + 1)) {
            b.addEpsilonTransition(init, renamed(RIGHT, other, s));
        }
        return b.build(Mode.EPSILON);
    }

    /**
     * Epsilon transitions from every final state of this automaton to every
     * start state of <code>other</code>; the start states are those of this
     * automaton, the final states those of <code>other</code>.
     */
    public FiniteAutomaton concatenate(FiniteAutomaton other) {
        final Builder b = new Builder();
        copyInto(b, this, LEFT, false);
        copyInto(b, other, RIGHT, true);
        for (int s = starts.nextSetBit(0); s >= 0; s = starts.nextSetBit(s + 1)) {
            b.addStartState(renamed(LEFT, this, s));
        }
        for (int f = finals.nextSetBit(0); f >= 0; f = finals.nextSetBit(f + 1)) {
            for (int s = other.starts.nextSetBit(0); s >= 0; s = other.starts.nextSetBit(s + 1)) {
                b.addEpsilonTransition(renamed(LEFT, this, f), renamed(RIGHT, other, s));
            }
        }
        return b.build(Mode.EPSILON);
    }

    /**
     * A fresh state, both start and final, with an epsilon transition to
     * every start state and an epsilon transition back from every final
     * state.
     */
    public FiniteAutomaton kleeneStar() {
        final Builder b = new Builder();
        copyInto(b, this, LEFT, false);
        final State init = b.freshState("init");
        b.addStartState(init).addFinalState(init);
        for (int s = starts.nextSetBit(0); s >= 0; s = starts.nextSetBit(s + 1)) {
            b.addEpsilonTransition(init, renamed(LEFT, this, s));
        }
        for (int f = finals.nextSetBit(0); f >= 0; f = finals.nextSetBit(f + 1)) {
            b.addEpsilonTransition(renamed(LEFT, this, f), init);
        }
        return b.build(Mode.EPSILON);
    }

    /**
     * Product construction over the pairs reachable from the start pairs.
     * The alphabet of the result is the union of both alphabets. The result
     * is deterministic when both operands are.
     *
     * @throws UnsupportedOperationException
     *             if either operand has epsilon transitions.
     */
    public FiniteAutomaton intersection(final FiniteAutomaton other) {
        if (hasEpsilonTransitions() || other.hasEpsilonTransitions()) {
            throw new UnsupportedOperationException(
                "intersection() requires automata without epsilon transitions;"
                + " call toNondeterministic() first");
        }
        final Builder b = new Builder();
        for (Symbol symbol : symbols) {
            b.addSymbol(symbol);
        }
        for (Symbol symbol : other.symbols) {
            b.addSymbol(symbol);
        }
        final int n2 = other.size();

        final class PairFactory {

            private final Map<Long, State> map = new LinkedHashMap<Long, State>();
            private final LinkedList<Long> gray = new LinkedList<Long>();

            private State stateFrom(int s1, int s2) {
                final long key = (long) s1 * n2 + s2;
                State state = map.get(key);
                if (state == null) {
                    state = b.freshState("(" + states.get(s1) + ", "
                        + other.states.get(s2) + ")");
                    b.addState(state);
                    map.put(key, state);
                    gray.add(key);
                }
                return state;
            }
        }
        final PairFactory factory = new PairFactory();

        for (int s1 = starts.nextSetBit(0); s1 >= 0; s1 = starts.nextSetBit(s1 + 1)) {
            for (int s2 = other.starts.nextSetBit(0); s2 >= 0; s2 = other.starts.nextSetBit(s2 + 1)) {
                b.addStartState(factory.stateFrom(s1, s2));
            }
        }
        while (!factory.gray.isEmpty()) {
            final long key = factory.gray.removeFirst();
            final int s1 = (int) (key / n2);
            final int s2 = (int) (key % n2);
            final State from = factory.map.get(key);
            if (finals.get(s1) && other.finals.get(s2)) {
                b.addFinalState(from);
            }
            for (int a1 = 0; a1 < symbols.size(); ++a1) {
                final int a2 = other.symbols.handleOf(symbols.get(a1));
                if (a2 < 0) continue;
                final BitSet t1s = delta[s1][a1];
                final BitSet t2s = other.delta[s2][a2];
                if (t1s == null || t2s == null) continue;
                for (int t1 = t1s.nextSetBit(0); t1 >= 0; t1 = t1s.nextSetBit(t1 + 1)) {
                    for (int t2 = t2s.nextSetBit(0); t2 >= 0; t2 = t2s.nextSetBit(t2 + 1)) {
                        b.addTransition(from, symbols.get(a1), factory.stateFrom(t1, t2));
                    }
                }
            }
        }
        return b.build(isDeterministic() && other.isDeterministic()
            ? Mode.DETERMINISTIC : Mode.NONDETERMINISTIC);
    }

    /**
     * Decides whether both automata accept the same words. Both are
     * determinized and walked in lock step over the union of their
     * alphabets, a missing transition leading to a shared implicit sink.
     */
    public boolean isEquivalentTo(FiniteAutomaton other) {
        final FiniteAutomaton d1 = toDeterministic();
        final FiniteAutomaton d2 = other.toDeterministic();
        final Set<Symbol> sigma = new LinkedHashSet<Symbol>(d1.symbols.asSet());
        sigma.addAll(d2.symbols.asSet());

        final Set<Long> black = new LinkedHashSet<Long>();
        final LinkedList<int[]> gray = new LinkedList<int[]>();
        gray.add(new int[] {d1.starts.nextSetBit(0), d2.starts.nextSetBit(0)});
        while (!gray.isEmpty()) {
            final int[] pair = gray.removeFirst();
            if (!black.add(((long) (pair[0] + 1) << 32) | (pair[1] + 1))) continue;
            final boolean f1 = pair[0] >= 0 && d1.finals.get(pair[0]);
            final boolean f2 = pair[1] >= 0 && d2.finals.get(pair[1]);
            if (f1 != f2) return false;
            if (pair[0] < 0 && pair[1] < 0) continue;
            for (Symbol symbol : sigma) {
                final int a1 = d1.symbols.handleOf(symbol);
                final int a2 = d2.symbols.handleOf(symbol);
                gray.add(new int[] {
                    pair[0] < 0 || a1 < 0 ? -1 : d1.step(pair[0], a1),
                    pair[1] < 0 || a2 < 0 ? -1 : d2.step(pair[1], a2)});
            }
        }
        return true;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(mode.abbreviation).append(':').append(LS);
        sb.append("states: ");
        appendSet(sb, states).append(LS);
        sb.append("symbols: ");
        appendSet(sb, symbols).append(LS);
        sb.append("start states: ");
        appendSet(sb, startStates()).append(LS);
        sb.append("final states: ");
        appendSet(sb, finalStates()).append(LS);
        sb.append("transitions:").append(LS);
        for (int s = 0; s < delta.length; ++s) {
            for (int a = 0; a < symbols.size(); ++a) {
                final BitSet targets = delta[s][a];
                if (targets == null) continue;
                for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                    sb.append(INDENT).append(states.get(s))
                        .append(" --").append(symbols.get(a)).append("--> ")
                        .append(states.get(t)).append(LS);
                }
            }
            final BitSet targets = epsilon[s];
            if (targets == null) continue;
            for (int t = targets.nextSetBit(0); t >= 0; t = targets.nextSetBit(t + 1)) {
                sb.append(INDENT).append(states.get(s))
                    .append(" --").append(Symbol.EPSILON).append("--> ")
                    .append(states.get(t)).append(LS);
            }
        }
        return sb.toString();
    }
}
