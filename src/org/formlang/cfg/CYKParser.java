/*
 * @LICENSE@
 */

package org.formlang.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Membership test for a context free grammar with the Cocke-Younger-Kasami
 * algorithm. The grammar is brought to {@linkplain CFG#toNormalForm() normal
 * form} once, at construction; a parser is immutable and answers any number
 * of queries.
 */
public final class CYKParser {

    private static final Logger logger = Logger.getLogger("org.formlang.cfg");
    private static final Level level = Level.FINEST;

    private final CFG normalForm;
    private final Map<Terminal, BitSet> heads;  // a -> {A | A -> a}
    private final int[][] binary;               // {A, B, C} for A -> B C
    private final int start;
    private final boolean acceptsEmpty;

    public CYKParser(CFG grammar) {
        this.normalForm = grammar.toNormalForm();

        final Map<Variable, Integer> handles = new HashMap<Variable, Integer>();
        for (Variable v : normalForm.variables()) {
            handles.put(v, handles.size());
        }
        this.heads = new HashMap<Terminal, BitSet>();
        final List<int[]> rules = new ArrayList<int[]>();
        boolean empty = false;
        for (Production p : normalForm.productions()) {
            final List<CFGObject> body = p.body();
            final int head = handles.get(p.head());
            if (body.isEmpty()) {
                empty = true;
            } else if (body.size() == 1) {
                BitSet bs = heads.get(body.get(0));
                if (bs == null) {
                    heads.put((Terminal) body.get(0), bs = new BitSet());
                }
                bs.set(head);
            } else {
                rules.add(new int[] {head, handles.get(body.get(0)), handles.get(body.get(1))});
            }
        }
        this.binary = rules.toArray(new int[rules.size()][]);
        this.start = handles.get(normalForm.start());
        this.acceptsEmpty = empty;
    }

    /**
     * @return the grammar in normal form the parser works on.
     */
    public CFG normalForm() {
        return normalForm;
    }

    public boolean contains(String... word) {
        return contains(Arrays.asList(word));
    }

    /**
     * @param word
     *            terminal labels; an unknown label makes the word rejected.
     */
    public boolean contains(List<String> word) {
        final int n = word.size();
        if (n == 0) return acceptsEmpty;

        // table[i][len]: variables deriving the len symbols starting at i
        final BitSet[][] table = new BitSet[n][n + 1];
        for (int i = 0; i < n; ++i) {
            final BitSet bs = heads.get(new Terminal(word.get(i)));
            if (bs == null) return false;
            table[i][1] = bs;
        }
        for (int len = 2; len <= n; ++len) {
            for (int i = 0; i + len <= n; ++i) {
                final BitSet cell = new BitSet();
                for (int k = 1; k < len; ++k) {
                    final BitSet left = table[i][k];
                    final BitSet right = table[i + k][len - k];
                    if (left.isEmpty() || right.isEmpty()) continue;
                    for (int[] rule : binary) {
                        if (left.get(rule[1]) && right.get(rule[2])) cell.set(rule[0]);
                    }
                }
                table[i][len] = cell;
            }
        }
        final boolean ret = table[0][n].get(start);
        if (logger.isLoggable(level)) {
            logger.log(level, "CYK " + word + ": " + ret);
        }
        return ret;
    }
}
