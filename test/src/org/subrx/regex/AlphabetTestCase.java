/* @LICENSE@
 */

package org.subrx.regex;

import junit.framework.TestCase;

import org.subrx.regex.SyntaxException.Kind;

public class AlphabetTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AlphabetTestCase.class);
    }

    public AlphabetTestCase(String name) {
        super(name);
    }

    public void testDefault() {
        Alphabet sigma = Alphabet.DEFAULT;
        assertEquals("abc", sigma.symbols());
        assertEquals('1', sigma.epsilon());
        assertTrue(sigma.contains('b'));
        assertFalse(sigma.contains('1'));
        assertTrue(sigma.isEpsilon('1'));
        assertFalse(sigma.contains('d'));
    }

    public void testDuplicatesDropped() {
        Alphabet sigma = new Alphabet("abab");
        assertEquals("ab", sigma.symbols());
        assertEquals(2, sigma.size());
        assertEquals(new Alphabet("ba"), sigma);
        assertEquals(new Alphabet("ba").hashCode(), sigma.hashCode());
    }

    public void testEpsilonDisjointFromAlphabet() {
        try {
            new Alphabet("ab1", '1');
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testOperatorsAndWhitespaceRejected() {
        String[] bad = {"a+", "a.", "*", "a b", ""};
        for (String symbols : bad) {
            try {
                new Alphabet(symbols);
                fail("should throw: " + symbols);
            } catch (IllegalArgumentException e) {}
        }
        try {
            new Alphabet("ab", '*');
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testCheckWord() {
        Alphabet.DEFAULT.checkWord("abcab");
        try {
            Alphabet.DEFAULT.checkWord("");
            fail("should throw");
        } catch (SyntaxException e) {
            assertEquals(Kind.EMPTY_WORD, e.kind());
            assertEquals(-1, e.index());
            assertEquals("Word is empty", e.getMessage());
        }
        try {
            Alphabet.DEFAULT.checkWord("abd");
            fail("should throw");
        } catch (SyntaxException e) {
            assertEquals(Kind.INVALID_WORD_SYMBOL, e.kind());
            assertEquals(2, e.index());
            assertEquals("Unknown symbol in word: 'd' (index 2 of \"abd\")", e.getMessage());
        }
    }

    public void testEpsilonIsNotAWordSymbol() {
        try {
            Alphabet.DEFAULT.checkWord("a1b");
            fail("should throw");
        } catch (SyntaxException e) {
            assertEquals(Kind.INVALID_WORD_SYMBOL, e.kind());
            assertEquals(1, e.index());
        }
    }

    public void testNonPrintableEscapedInMessage() {
        try {
            Alphabet.DEFAULT.checkWord("a\u0007");
            fail("should throw");
        } catch (SyntaxException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("'\\u0007'"));
        }
    }
}
