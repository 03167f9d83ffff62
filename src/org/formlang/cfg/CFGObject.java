/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * A symbol of a {@link CFG}: a {@link Variable}, a {@link Terminal} or
 * {@link Epsilon}. Objects are values identified by their kind and label.
 */
public abstract class CFGObject {

    private final String label;

    CFGObject(String label) {
        if (label == null) {
            throw new IllegalArgumentException("null label");
        }
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + label.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        return label.equals(((CFGObject) o).label);
    }

    @Override
    public String toString() {
        return label;
    }
}
