/*
 * @LICENSE@
 */

package org.formlang.cfg;

/**
 * The empty string. All instances are equal; none is equal to a
 * {@link Terminal} or {@link Variable}, whatever its label.
 */
public final class Epsilon extends CFGObject {

    public static final Epsilon INSTANCE = new Epsilon();

    public Epsilon() {
        super("ε");
    }
}
