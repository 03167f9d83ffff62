/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * Thrown by {@link CFG#fromText(String)} for malformed grammar text.
 */
public final class NotParsableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public NotParsableException(String msg, int line) {
        super(msg + " (line " + line + ")");
        this.line = line;
    }

    /**
     * @return the one based number of the offending line.
     */
    public int line() {
        return line;
    }
}
