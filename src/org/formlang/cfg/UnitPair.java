/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * A pair (A, B) of variables such that A derives B using unit productions
 * only. Every variable forms a unit pair with itself.
 */
public final class UnitPair {

    private final Variable from;
    private final Variable to;

    public UnitPair(Variable from, Variable to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("null variable");
        }
        this.from = from;
        this.to = to;
    }

    public Variable from() {
        return from;
    }

    public Variable to() {
        return to;
    }

    @Override
    public int hashCode() {
        return 31 * from.hashCode() + to.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UnitPair))
            return false;
        final UnitPair other = (UnitPair) o;
        return from.equals(other.from) && to.equals(other.to);
    }

    @Override
    public String toString() {
        return "(" + from + ", " + to + ")";
    }
}
