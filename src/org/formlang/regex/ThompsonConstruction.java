/*
 * @LICENSE@
 */

package org.formlang.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;

import org.formlang.automaton.FiniteAutomaton;
import org.formlang.automaton.Mode;
import org.formlang.automaton.State;
import org.formlang.automaton.Symbol;
import org.formlang.regex.AST.Alt;
import org.formlang.regex.AST.Cat;
import org.formlang.regex.AST.Empty;
import org.formlang.regex.AST.Epsilon;
import org.formlang.regex.AST.Node;
import org.formlang.regex.AST.Star;
import org.formlang.regex.AST.Sym;
import org.formlang.regex.AST.Visitor;

/**
 * Translates a regex tree into an epsilon automaton, bottom up. Every node
 * yields a fragment with one start state and a set of end states: leaves get
 * two fresh states, concatenation links the ends of the left fragment to the
 * start of the right one by epsilon transitions, and union and star add a
 * fresh start state the way {@link FiniteAutomaton#union(FiniteAutomaton)}
 * and {@link FiniteAutomaton#kleeneStar()} do.
 */
final class ThompsonConstruction extends Visitor {

    private static final class Fragment {

        final State start;
        final List<State> ends;

        Fragment(State start, List<State> ends) {
            this.start = start;
            this.ends = ends;
        }

        Fragment(State start, State end) {
            this(start, Collections.singletonList(end));
        }
    }

    private final FiniteAutomaton.Builder builder = new FiniteAutomaton.Builder();
    private final Stack<Fragment> kids = new Stack<Fragment>();
    private int next = 0;

    ThompsonConstruction() {
        super(TraversalOrder.BOTTOM_UP);
    }

    /**
     * @return an {@link Mode#EPSILON} automaton with states <code>q0</code>,
     *         <code>q1</code>, ... accepting the language of <code>root</code>.
     */
    FiniteAutomaton translate(Node root) {
        assert next == 0 : "translate() called twice";
        visit(root);
        assert kids.size() == 1;
        final Fragment f = kids.pop();
        builder.setStartState(f.start);
        for (State end : f.ends) {
            builder.addFinalState(end);
        }
        return builder.build(Mode.EPSILON);
    }

    private State fresh() {
        final State state = new State("q" + next++);
        builder.addState(state);
        return state;
    }

    @Override
    protected void visit(Sym node) {
        final State start = fresh();
        final State end = fresh();
        builder.addTransition(start, new Symbol(node.label), end);
        kids.push(new Fragment(start, end));
    }

    @Override
    protected void visit(Epsilon node) {
        final State start = fresh();
        final State end = fresh();
        builder.addEpsilonTransition(start, end);
        kids.push(new Fragment(start, end));
    }

    @Override
    protected void visit(Empty node) {
        kids.push(new Fragment(fresh(), fresh()));
    }

    @Override
    protected void visit(Cat node) {
        final Fragment second = kids.pop();
        final Fragment first = kids.pop();
        for (State end : first.ends) {
            builder.addEpsilonTransition(end, second.start);
        }
        kids.push(new Fragment(first.start, second.ends));
    }

    @Override
    protected void visit(Alt node) {
        final Fragment second = kids.pop();
        final Fragment first = kids.pop();
        final State start = fresh();
        builder.addEpsilonTransition(start, first.start);
        builder.addEpsilonTransition(start, second.start);
        final List<State> ends = new ArrayList<State>(first.ends);
        ends.addAll(second.ends);
        kids.push(new Fragment(start, ends));
    }

    @Override
    protected void visit(Star node) {
        final Fragment child = kids.pop();
        final State start = fresh();
        builder.addEpsilonTransition(start, child.start);
        for (State end : child.ends) {
            builder.addEpsilonTransition(end, start);
        }
        kids.push(new Fragment(start, start));
    }
}
