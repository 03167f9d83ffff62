/*
 * @LICENSE@
 */

package org.formlang.automaton;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Interning table mapping values (states, symbols) to compact integer
 * handles, in order of first appearance. Automata keep their relations in
 * handle indexed arrays and {@link BitSet}s; the table translates at the API
 * boundary.
 */
final class Index<T> implements Iterable<T> {

    private final Map<T, Integer> handles = new HashMap<T, Integer>();
    private final List<T> values = new ArrayList<T>();

    Index() {
    }

    Index(Index<T> that) {
        handles.putAll(that.handles);
        values.addAll(that.values);
    }

    /**
     * @return the handle of <code>t</code>, allocating one if needed.
     */
    int intern(T t) {
        Integer h = handles.get(t);
        if (h == null) {
            h = values.size();
            handles.put(t, h);
            values.add(t);
        }
        return h;
    }

    /**
     * @return the handle of <code>o</code>, or -1 if it was never interned.
     */
    int handleOf(Object o) {
        Integer h = handles.get(o);
        return h == null ? -1 : h;
    }

    boolean contains(Object o) {
        return handles.containsKey(o);
    }

    T get(int handle) {
        return values.get(handle);
    }

    int size() {
        return values.size();
    }

    Set<T> valuesOf(BitSet bits) {
        Set<T> ret = new LinkedHashSet<T>();
        for (int h = bits.nextSetBit(0); h >= 0; h = bits.nextSetBit(h + 1)) {
            ret.add(values.get(h));
        }
        return Collections.unmodifiableSet(ret);
    }

    Set<T> asSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<T>(values));
    }

    public Iterator<T> iterator() {
        return Collections.unmodifiableList(values).iterator();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
