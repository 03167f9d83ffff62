/*
 * @LICENSE@
 */

package org.formlang.regex;

import static org.formlang.Misc.LS;

import java.util.regex.PatternSyntaxException;

import org.formlang.AbstractFormLangTestCase;
import org.formlang.regex.AST.Cat;
import org.formlang.regex.AST.Node;
import org.formlang.regex.AST.Sym;

public class RegexParserTestCase extends AbstractFormLangTestCase {

    public RegexParserTestCase(String name) {
        super(name);
    }

    private static String parse(String regex) {
        return parse(regex, 0);
    }

    private static String parse(String regex, int flags) {
        return new RegexParser().parse(regex, flags).toString();
    }

    private static PatternSyntaxException assertThrows(String regex) {
        try {
            new RegexParser().parse(regex, 0);
            fail("should throw: " + regex);
        } catch (PatternSyntaxException e) {
            assertEquals(regex, e.getPattern());
            return e;
        }
        return null;
    }

    public void testPrecedence() {
        assertEquals("(((a + b)* · a) · b)", parse("(a+b)*ab"));
        assertEquals("(a + (b · c*))", parse("a+bc*"));
        assertEquals("((a + b) + c)", parse("a+b+c"));
        assertEquals("((a · b) · c)", parse("abc"));
        assertEquals("(a · (b + c))", parse("a(b+c)"));
        assertEquals("a**", parse("a**"));
    }

    public void testAlternativeSpellings() {
        assertEquals(parse("a+b"), parse("a|b"));
        assertEquals(parse("ab"), parse("a.b"));
        assertEquals(parse("ab"), parse(" a  b "));
        assertEquals("(a · ε)", parse("aε"));
        assertEquals("(a · ε)", parse("a$"));
        assertEquals("(a + ∅)", parse("a+#"));
        assertEquals("(a + ∅)", parse("a+∅"));
    }

    public void testEmptyRegex() {
        assertEquals("ε", parse(""));
        assertEquals("ε", parse("   "));
        assertEquals("ε", parse("$"));
        assertEquals("∅", parse("#"));
    }

    public void testLabels() {
        Node root = new RegexParser().parse("<ab>c", 0);
        assertTrue(root instanceof Cat);
        Node first = ((Cat) root).first();
        assertTrue(first instanceof Sym);
        assertEquals("ab", ((Sym) first).label());
        assertEquals("(ab · c)", root.toString());
        assertEquals("(a+b · x)", parse("<a+b>x"));
    }

    public void testEscape() {
        assertEquals("(+ · a)", parse("\\+a"));
        assertEquals("((( · )) · *)", parse("\\(\\)\\*"));
        assertEquals("\\", parse("\\\\"));
    }

    public void testTokenized() {
        assertEquals("((ab · cd) + e)", parse("ab cd + e", Regex.TOKENIZED));
        assertEquals("((foo + bar)* · baz)", parse("(foo+bar)* baz", Regex.TOKENIZED));
        assertEquals("(a+b · c)", parse("a\\+b c", Regex.TOKENIZED));
        assertEquals("(xy · z)", parse("<xy>z", Regex.TOKENIZED));
    }

    public void testLiteral() {
        assertEquals("((a · +) · b)", parse("a+b", Regex.LITERAL));
        assertEquals("((x · +) · y)", parse("x + y", Regex.LITERAL | Regex.TOKENIZED));
        assertEquals("ε", parse("", Regex.LITERAL));
    }

    public void testUnknownFlags() {
        try {
            new RegexParser().parse("a", 1 << 5);
            fail("should throw");
        } catch (IllegalArgumentException e) {}
        assertEquals(2, Regex.FLAG_COUNT);
    }

    public void testSyntax() {
        assertThrows("(a");
        assertThrows("a)");
        assertThrows("()");
        assertThrows("*a");
        assertThrows("a+");
        assertThrows("+a");
        assertThrows("(a+)");
        assertThrows("a.");
        assertThrows("a..b");
        assertThrows("<ab");
        assertThrows("<>");
        assertThrows("a\\");
        assertThrows("(a)*)b");
    }

    public void testErrorIndex() {
        assertEquals(1, assertThrows("a)").getIndex());
        assertEquals(2, assertThrows("(a").getIndex());
        assertEquals(0, assertThrows("*a").getIndex());
        assertEquals(2, assertThrows("a+").getIndex());
    }

    public void testTreeString() {
        assertEquals("+" + LS + "    a {0}" + LS + "    b {1}" + LS,
            new RegexParser().parse("a+b", 0).toTreeString());
        assertEquals("*" + LS + "    ·" + LS + "        a {0}" + LS + "        ε {1}" + LS,
            new RegexParser().parse("(a$)*", 0).toTreeString());
    }
}
