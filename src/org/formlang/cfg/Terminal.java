/*
 * @LICENSE@
 */

package org.formlang.cfg;

public final class Terminal extends CFGObject {

    public Terminal(String label) {
        super(label);
    }
}
