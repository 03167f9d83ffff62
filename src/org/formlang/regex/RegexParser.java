/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.isSet;
import static org.formlang.regex.AST.alt;
import static org.formlang.regex.AST.cat;
import static org.formlang.regex.AST.empty;
import static org.formlang.regex.AST.epsilon;
import static org.formlang.regex.AST.literal;
import static org.formlang.regex.AST.star;
import static org.formlang.regex.AST.sym;

import java.util.IdentityHashMap;
import java.util.Map;

import org.formlang.regex.AST.Node;
import org.formlang.regex.AST.Visitor;
import org.formlang.regex.AST.Visitor.TraversalOrder;

/**
 * Recursive descent parser for the regex surface syntax:
 *
 * <pre>
 * exp    := term (('+' | '|') term)*
 * term   := factor ('.'? factor)*
 * factor := atom '*'*
 * atom   := symbol | '&lt;' label '&gt;' | '\' char | '$' | 'ε' | '#' | '∅' | '(' exp ')'
 * </pre>
 *
 * White space separates tokens and is otherwise ignored. The empty string
 * denotes epsilon.
 */
final class RegexParser {

    private static final int EOX = -1;      // end of expression
    private static final int SYMBOL = -2;   // label in <label>

    private static final String OPERATORS = "()+|*.$#<\\ε∅";

    /*
     * fields to hold parameters
     */
    private String regex;
    private boolean tokenized;

    /*
     * state for nextToken()
     */
    private int token;
    private String label;

    private void init() {
        iNext = 0;
        iCurrent = -1;
        token = EOX;
        label = null;
    }

    Node parse(String regex, int flags) {
        Regex.checkFlags(flags);
        this.regex = regex;
        this.tokenized = isSet(flags, Regex.TOKENIZED);
        init();

        if (isSet(flags, Regex.LITERAL)) {
            return tokenized ? literalTokens() : literal(regex);
        }

        final Node root = regex();

        assert new Visitor(TraversalOrder.TOP_DOWN) {

            boolean noReconvergence() {
                visit(root);
                return !reconvergence;
            }

            boolean reconvergence = false;
            private final Map<Node, Object> id =
                new IdentityHashMap<Node, Object>();

            @Override
            protected void visit(Node node) {
                if (id.put(node, new Object()) != null) reconvergence = true;
                super.visit(node);
            }

        }.noReconvergence();

        return root;
    }

    private Node literalTokens() {
        final String trimmed = regex.trim();
        if (trimmed.length() == 0) return epsilon();
        final String[] tokens = trimmed.split("\\s+");
        final Node[] syms = new Node[tokens.length];
        for (int i = 0; i < tokens.length; ++i) {
            syms[i] = sym(tokens[i]);
        }
        return cat(syms);
    }

    /*
     * On entry to exp(), term(), factor() and atom() the current token is the
     * first token of the construct; on exit it is the first token after it.
     */

    private Node regex() {
        nextToken();
        if (token == EOX) return epsilon();
        final Node ret = exp();
        switch (token) {
        case EOX:
            break;
        case ')':
            syntaxError("unbalanced parenthesis");
            break;
        default:
            assert false : "unexpected token at end of expression: " + (char) token;
        }
        return ret;
    }

    private Node exp() {
        Node ret = term();
        while (token == '+' || token == '|') {
            nextToken();
            ret = alt(ret, term());
        }
        return ret;
    }

    private Node term() {
        Node ret = factor();
        while (true) {
            if (token == '.') {
                nextToken();
                ret = cat(ret, factor());
            } else if (startsAtom()) {
                ret = cat(ret, factor());
            } else {
                break;
            }
        }
        return ret;
    }

    private boolean startsAtom() {
        return token == SYMBOL || token == '(' || token == '$' || token == '#';
    }

    private Node factor() {
        Node ret = atom();
        while (token == '*') {
            ret = star(ret);
            nextToken();
        }
        return ret;
    }

    private Node atom() {
        Node ret = null;
        switch (token) {
        case SYMBOL:
            ret = sym(label);
            break;
        case '$':
            ret = epsilon();
            break;
        case '#':
            ret = empty();
            break;
        case '(':
            nextToken();
            if (token == ')') {
                syntaxError("empty group");
            }
            ret = exp();
            if (token != ')') {
                syntaxError("unbalanced parenthesis");
            }
            break;
        case EOX:
            syntaxError("missing operand at end of expression");
            break;
        default:
            syntaxError("operator '" + (char) token + "' in operand position");
        }
        nextToken();
        return ret;
    }

    /*
     * char scanner stuff
     */

    private int iNext;

    private boolean hasNextChar() {
        return iNext < regex.length();
    }

    private char nextRawChar() {
        return regex.charAt(iNext++);
    }

    private int iCurrent;

    private void nextToken() {
        while (hasNextChar() && Character.isWhitespace(regex.charAt(iNext))) {
            ++iNext;
        }
        iCurrent = iNext;
        label = null;
        if (!hasNextChar()) {
            token = EOX;
            return;
        }
        final char c = nextRawChar();
        switch (c) {
        case '(': case ')': case '+': case '|': case '*': case '.':
        case '$': case '#':
            token = c;
            return;
        case 'ε':
            token = '$';
            return;
        case '∅':
            token = '#';
            return;
        case '<':
            scanLabel();
            return;
        default:
            --iNext;
            label = tokenized ? scanRun() : String.valueOf(scanChar());
            token = SYMBOL;
        }
    }

    /*
     * one possibly escaped character
     */
    private char scanChar() {
        char c = nextRawChar();
        if (c == '\\') {
            if (!hasNextChar()) {
                syntaxError("unterminated escape");
            }
            c = nextRawChar();
        }
        return c;
    }

    /*
     * maximal run of non-operator, non-whitespace characters; escapes included
     */
    private String scanRun() {
        final StringBuilder sb = new StringBuilder();
        sb.append(scanChar());
        while (hasNextChar()) {
            final char c = regex.charAt(iNext);
            if (Character.isWhitespace(c) || (c != '\\' && OPERATORS.indexOf(c) >= 0)) {
                break;
            }
            sb.append(scanChar());
        }
        return sb.toString();
    }

    private void scanLabel() {
        final int end = regex.indexOf('>', iNext);
        if (end < 0) {
            syntaxError("unterminated symbol label");
        }
        if (end == iNext) {
            syntaxError("empty symbol label");
        }
        label = regex.substring(iNext, end);
        iNext = end + 1;
        token = SYMBOL;
    }

    private void syntaxError(String msg) {
        throw new java.util.regex.PatternSyntaxException(msg, regex, iCurrent);
    }
}
