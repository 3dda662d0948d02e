/* @LICENSE@
 */
package org.subrx.regex;

import java.util.BitSet;

import org.subrx.regex.SyntaxException.Kind;

/**
 * A finite set of symbols together with the marker that stands for the empty
 * word in expressions. The marker is never a member of the alphabet and
 * neither of them overlaps the {@linkplain Operator operator} glyphs.
 * Instances are immutable.
 */
public final class Alphabet {

    public static final char DEFAULT_EPSILON = '1';

    /**
     * The alphabet <code>{a, b, c}</code> with <code>1</code> as the
     * epsilon marker.
     */
    public static final Alphabet DEFAULT = new Alphabet("abc", DEFAULT_EPSILON);

    private final String symbols;
    private final BitSet members = new BitSet();
    private final char epsilon;

    public Alphabet(CharSequence symbols, char epsilon) {
        if (symbols.length() == 0) {
            throw new IllegalArgumentException("empty alphabet");
        }
        checkUsable(epsilon, "epsilon marker");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < symbols.length(); ++i) {
            char c = symbols.charAt(i);
            checkUsable(c, "alphabet symbol");
            if (c == epsilon) {
                throw new IllegalArgumentException(
                    "epsilon marker '" + Misc.esc(c) + "' is in the alphabet");
            }
            if (!members.get(c)) {
                members.set(c);
                sb.append(c);
            }
        }
        this.symbols = sb.toString();
        this.epsilon = epsilon;
    }

    public Alphabet(CharSequence symbols) {
        this(symbols, DEFAULT_EPSILON);
    }

    private static void checkUsable(char c, String what) {
        if (Character.isWhitespace(c) || Operator.forGlyph(c) != null) {
            throw new IllegalArgumentException(
                what + " '" + Misc.esc(c) + "' is whitespace or an operator");
        }
    }

    public boolean contains(char c) {
        return members.get(c);
    }

    public boolean isEpsilon(char c) {
        return c == epsilon;
    }

    public char epsilon() {
        return epsilon;
    }

    /**
     * @return the symbols, in the order first given, without duplicates.
     */
    public String symbols() {
        return symbols;
    }

    public int size() {
        return symbols.length();
    }

    /**
     * Checks that <code>word</code> is a non empty word over this alphabet.
     * The epsilon marker is not a word symbol.
     *
     * @throws SyntaxException
     *             with kind {@link Kind#EMPTY_WORD} or
     *             {@link Kind#INVALID_WORD_SYMBOL}.
     */
    public void checkWord(String word) {
        if (word.isEmpty()) {
            throw new SyntaxException(Kind.EMPTY_WORD, word);
        }
        for (int i = 0; i < word.length(); ++i) {
            if (!contains(word.charAt(i))) {
                throw new SyntaxException(Kind.INVALID_WORD_SYMBOL, word, i);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Alphabet)) return false;
        Alphabet that = (Alphabet) o;
        return epsilon == that.epsilon && members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return 31 * members.hashCode() + epsilon;
    }

    @Override
    public String toString() {
        return "{" + symbols + "; epsilon=" + epsilon + '}';
    }
}
