/*
 * @LICENSE@
 */

package org.formlang.cfg;

public final class Variable extends CFGObject {

    public Variable(String label) {
        super(label);
    }
}
