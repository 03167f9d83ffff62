/*
 * @LICENSE@
 */

package org.formlang;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * This class implements a bunch of reusable, miscellaneous static objects,
 * classes and methods shared by the automaton, grammar and regex packages.
 */
public final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /**
     * Appends the elements as a brace enclosed, comma separated set literal,
     * e.g. <code>{q0, q1}</code>.
     */
    public static StringBuilder appendSet(StringBuilder sb, Iterable<?> elements) {
        final int mark = sb.length();
        for (Object o : elements) {
            sb.append(sb.length() == mark ? "{" : ", ").append(o);
        }
        if (sb.length() == mark) sb.append('{');
        return sb.append('}');
    }

    public static String setString(Iterable<?> elements) {
        return appendSet(new StringBuilder(), elements).toString();
    }

    /**
     * Joins the string forms of the elements.
     */
    public static String join(Iterable<?> elements, String separator) {
        StringBuilder sb = new StringBuilder();
        for (Iterator<?> it = elements.iterator(); it.hasNext();) {
            sb.append(it.next());
            if (it.hasNext()) sb.append(separator);
        }
        return sb.toString();
    }

    /**
     * Allocates single bit flags with labels, and checks flag words against
     * the defined and implemented flags.
     */
    public static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private Integer implemented = null;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        public int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

        public int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        public FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        public void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (implemented != null && !contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        public String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    }

    public static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }
}
