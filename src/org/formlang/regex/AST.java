/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.LS;
import static org.formlang.Misc.clear;

import java.io.Flushable;
import java.io.IOException;
import java.util.Stack;

import org.formlang.regex.AST.Visitor.TraversalOrder;

/**
 * Uninstantiable class which serves as a source container for the static
 * classes and static methods used in the construction of regular expression
 * trees.
 */
public final class AST {

    public static abstract class Node {

        final Node copy() {
            return new CopyVisitor().copy(this);
        }

        /**
         * @return one line per node, children indented under their parent.
         *         Symbols are numbered in order of appearance.
         */
        public final String toTreeString() {
            final StringBuilder sb = new StringBuilder();
            new AbstractTreePrinter(sb) {
                @Override
                protected Formatter newFormatter() {
                    return new Formatter() {
                        private int nspace = 0;
                        private void indent() throws IOException {
                            for (int i = 0; i < nspace; ++i) {
                                a.append(' ');
                            }
                        }
                        @Override
                        void push() {
                            nspace += 4;
                        }
                        @Override
                        void pop() {
                            nspace -= 4;
                        }
                        @Override
                        void appendNonTerminal(String label) {
                            try {
                                indent();
                                a.append(label).append(LS);
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        }
                        @Override
                        void appendTerminal(int position, String label) {
                            try {
                                indent();
                                a.append(label).append(' ')
                                    .append('{')
                                        .append(Integer.toString(position))
                                    .append('}')
                                    .append(LS);
                            } catch (IOException e) {
                                throw new RuntimeException(e);
                            }
                        }
                    };
                }
            }.print(Node.this);
            return sb.toString();
        }

        /**
         * The equals relation is always the identity relation for all Node
         * subclasses.
         */
        @Override
        public final boolean equals(Object o) {
            return super.equals(o);
        }
        @Override
        public final int hashCode() {
            return super.hashCode();
        }

        /**
         * Fully parenthesized infix form, e.g. <code>((a + b)* · (a · b))</code>.
         */
        @Override
        public final String toString() {

            return new Visitor(TraversalOrder.SUBCLASS_DEFINED) {

                private final StringBuilder sb = new StringBuilder();

                @Override
                public String toString() {
                    clear(sb);
                    visit(Node.this);
                    return sb.toString();
                }

                @Override
                protected void visit(Cat node) {
                    sb.append('(');
                    visit(node.first);
                    sb.append(" · ");
                    visit(node.second);
                    sb.append(')');
                }

                @Override
                protected void visit(Alt node) {
                    sb.append('(');
                    visit(node.first);
                    sb.append(" + ");
                    visit(node.second);
                    sb.append(')');
                }

                @Override
                protected void visit(Star node) {
                    visit(node.child);
                    sb.append('*');
                }

                @Override
                protected void visit(Terminal node) {
                    sb.append(node.label());
                }
            }.toString();
        }
    }

    /**
     * A leaf: a symbol, the empty string or the empty language.
     */
    public static abstract class Terminal extends Node {

        public abstract String label();
    }

    public static final class Sym extends Terminal {

        final String label;

        private Sym(String label) {
            assert label != null;
            this.label = label;
        }

        @Override
        public String label() {
            return label;
        }
    }

    public static final class Epsilon extends Terminal {

        private Epsilon() {
        }

        @Override
        public String label() {
            return "ε";
        }
    }

    public static final class Empty extends Terminal {

        private Empty() {
        }

        @Override
        public String label() {
            return "∅";
        }
    }

    public static abstract class NonTerminal extends Node {

        abstract Node[] children();
    }

    public static abstract class Unary extends NonTerminal {

        final Node child;
        private Unary(Node child) {
            assert child != null;
            this.child = child;
        }

        public final Node child() {
            return child;
        }

        @Override
        final Node[] children() {
            return new Node[] {child};
        }
    }

    public static final class Star extends Unary {

        private Star(Node child) {
            super(child);
        }
    }

    public static abstract class Binary extends NonTerminal {

        final Node first, second;

        private Binary(Node first, Node second) {
            assert first != null && second != null;
            this.first = first;
            this.second = second;
        }

        public final Node first() {
            return first;
        }

        public final Node second() {
            return second;
        }

        @Override
        final Node[] children() {
            return new Node[] {first, second};
        }
    }

    public static final class Cat extends Binary {

        private Cat(Node first, Node second) {
            super(first, second);
        }
    }

    public static final class Alt extends Binary {

        private Alt(Node first, Node second) {
            super(first, second);
        }
    }

    public static abstract class Visitor {

        public enum TraversalOrder {
            TOP_DOWN,
            BOTTOM_UP,
            SUBCLASS_DEFINED;
        }

        private final TraversalOrder order;

        protected Visitor(TraversalOrder order) {
            this.order = order;
        }

        /*
         * multi-dispatch:
         * - allows Visitor subclasses to deal with the exact granularity they want.
         * - "instanceof" dispatch is ugly but it's only in one place - here.
         */

        protected void visit(Node node) {
            if (node instanceof NonTerminal) {
                visit((NonTerminal) node);
            } else if (node instanceof Terminal) {
                visit((Terminal) node);
            } else {
                error(node);
            }
        }

        protected void visit(NonTerminal node) {
            if (order == TraversalOrder.BOTTOM_UP) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
            if (node instanceof Binary) {
                visit((Binary) node);
            } else if (node instanceof Unary) {
                visit((Unary) node);
            } else {
                error(node);
            }
            if (order == TraversalOrder.TOP_DOWN) {
                for (Node n : node.children()) {
                    visit(n);
                }
            }
        }

        protected void visit(Binary node) {
            if (node instanceof Cat) {
                visit((Cat) node);
            } else if (node instanceof Alt) {
                visit((Alt) node);
            } else {
                error(node);
            }
        }

        protected void visit(Unary node) {
            if (node instanceof Star) {
                visit((Star) node);
            } else error(node);
        }

        protected void visit(Terminal node) {
            if (node instanceof Sym) {
                visit((Sym) node);
            } else if (node instanceof Epsilon) {
                visit((Epsilon) node);
            } else if (node instanceof Empty) {
                visit((Empty) node);
            } else error(node);
        }

        protected void visit(Cat node) {}
        protected void visit(Alt node) {}

        protected void visit(Star node) {}

        protected void visit(Sym node) {}
        protected void visit(Epsilon node) {}
        protected void visit(Empty node) {}

        private static void error(Node node) {
            assert false : "unknown node type " + node.getClass();
        }
    }

    static abstract class AbstractTreePrinter extends Visitor {

        protected abstract class Formatter {

            abstract void appendNonTerminal(String label);
            abstract void appendTerminal(int position, String label);
            abstract void push();
            abstract void pop();

            protected String prolog() {return "";}
            protected String epilog() {return "";}
        }

        protected final Appendable a;

        protected AbstractTreePrinter(Appendable a) {
            super(TraversalOrder.TOP_DOWN);
            this.a = a;
            formatter = newFormatter();
        }

        final void print(Node root) {
            try {
                a.append(formatter.prolog());
                position = 0;
                visit(root);
                a.append(formatter.epilog());
            } catch (IOException e1) {
                throw new RuntimeException(e1);
            }
            if (a instanceof Flushable) {
                try {
                    ((Flushable) a).flush();
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            }
        }

        private final Formatter formatter;
        protected abstract Formatter newFormatter();

        protected int position = 0;

        @Override
        protected final void visit(NonTerminal node) {
            super.visit(node);
            formatter.pop();
        }

        @Override
        protected final void visit(Cat node) {
            formatter.appendNonTerminal("·");
            formatter.push();
        }

        @Override
        protected final void visit(Alt node) {
            formatter.appendNonTerminal("+");
            formatter.push();
        }

        @Override
        protected final void visit(Star node) {
            formatter.appendNonTerminal("*");
            formatter.push();
        }

        @Override
        protected final void visit(Terminal node) {
            formatter.appendTerminal(position++, node.label());
        }
        /*
         * prevent subclasses from overriding
         */
        @Override
        protected final void visit(Node node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Binary node) {
            super.visit(node);
        }
        @Override
        protected final void visit(Unary node) {
            super.visit(node);
        }
    }

    /*
     * static factories of convenience for parser and testing
     */

    public static Sym sym(String label) {
        if (label == null) {
            throw new IllegalArgumentException("null symbol label");
        }
        return new Sym(label);
    }

    public static Epsilon epsilon() {
        return new Epsilon();
    }

    public static Empty empty() {
        return new Empty();
    }

    /**
     * @return the concatenation of the single character symbols of
     *         <code>s</code>, or epsilon if <code>s</code> is empty.
     */
    public static Node literal(String s) {
        Node root = null;
        for (char c : s.toCharArray()) {
            Node sym = new Sym(String.valueOf(c));
            root = root == null ? sym : new Cat(root, sym);
        }
        return root == null ? epsilon() : root;
    }

    /**
     * Left associative concatenation; epsilon for no operands.
     */
    public static Node cat(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            if (root == null) {
                root = node;
            } else {
                root = new Cat(root, node);
            }
        }
        return root == null ? epsilon() : root;
    }

    /**
     * Left associative union; the empty language for no operands.
     */
    public static Node alt(Node... nodes) {
        Node root = null;
        for (Node node : nodes) {
            if (root == null) {
                root = node;
            } else {
                root = new Alt(root, node);
            }
        }
        return root == null ? empty() : root;
    }

    public static Star star(Node child) {
        return new Star(child);
    }

    static class CopyVisitor extends Visitor {

        protected final Stack<Node> kids = new Stack<Node>();

        CopyVisitor() {
            super(TraversalOrder.BOTTOM_UP);
        }

        protected final void push(Node node) {
            kids.push(node);
        }

        Node copy(Node node) {
            assert node != null;
            visit(node);
            assert kids.size() == 1;
            return kids.pop();
        }

        @Override
        protected void visit(Sym node) {
            push(new Sym(node.label));
        }
        @Override
        protected void visit(Epsilon node) {
            push(new Epsilon());
        }
        @Override
        protected void visit(Empty node) {
            push(new Empty());
        }
        @Override
        protected void visit(Cat node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Cat(first, second));
        }
        @Override
        protected void visit(Alt node) {
            Node second = kids.pop();
            Node first = kids.pop();
            push(new Alt(first, second));
        }
        @Override
        protected void visit(Star node) {
            push(new Star(kids.pop()));
        }
    }

    private AST() {}    // uninstantiable
}
