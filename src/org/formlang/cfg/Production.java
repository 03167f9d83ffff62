/*
 * @LICENSE@
 */

package org.formlang.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A production <code>head -> body</code>. An empty body derives the empty
 * string.
 */
public final class Production {

    private final Variable head;
    private final List<CFGObject> body;

    /**
     * Creates a production, dropping {@link Epsilon} objects from the body.
     */
    public Production(Variable head, List<? extends CFGObject> body) {
        this(head, body, true);
    }

    /**
     * @param filtering
     *            if true, {@link Epsilon} objects are dropped from the body,
     *            so that <code>A -> ε</code> has an empty body.
     */
    public Production(Variable head, List<? extends CFGObject> body, boolean filtering) {
        if (head == null) {
            throw new IllegalArgumentException("null production head");
        }
        final List<CFGObject> b = new ArrayList<CFGObject>(body.size());
        for (CFGObject o : body) {
            if (o == null) {
                throw new IllegalArgumentException("null symbol in body of " + head);
            }
            if (!filtering || !(o instanceof Epsilon)) b.add(o);
        }
        this.head = head;
        this.body = Collections.unmodifiableList(b);
    }

    public Production(Variable head, CFGObject... body) {
        this(head, Arrays.asList(body));
    }

    public Variable head() {
        return head;
    }

    public List<CFGObject> body() {
        return body;
    }

    /**
     * @return true if the body consists of one variable.
     */
    public boolean isUnit() {
        return body.size() == 1 && body.get(0) instanceof Variable;
    }

    /**
     * @return true if the body derives only the empty string, i.e. it is
     *         empty or made of {@link Epsilon} objects.
     */
    public boolean isEpsilon() {
        for (CFGObject o : body) {
            if (!(o instanceof Epsilon)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return 31 * head.hashCode() + body.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Production))
            return false;
        final Production other = (Production) o;
        return head.equals(other.head) && body.equals(other.body);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(head).append(" ->");
        if (body.isEmpty()) sb.append(' ').append(Epsilon.INSTANCE);
        for (CFGObject o : body) {
            sb.append(' ').append(o);
        }
        return sb.toString();
    }
}
