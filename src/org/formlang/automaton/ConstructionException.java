/*
 * @LICENSE@
 */

package org.formlang.automaton;

/**
 * A runtime exception thrown when an automaton cannot be built as requested:
 * the assembled transition relation does not fit the requested {@link Mode},
 * or a builder was handed something that is not a state or a real symbol.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
