/* @LICENSE@
 */
package org.subrx.regex;

import static org.subrx.regex.Misc.copyOf;
import static org.subrx.regex.Misc.indicesFrom;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Summarises how a fixed, non empty <em>test word</em> T of length n relates
 * to a language L, without enumerating L (which may be infinite):
 * <ul>
 * <li>{@link #containsSubstring(int, int) substring}[i][len] - the factor of
 * T starting at i with length len is in L, for 0 &lt;= i &lt; n and 1 &lt;=
 * len &lt;= n - i;</li>
 * <li>{@link #hasEpsilon()} - the empty word is in L;</li>
 * <li>{@link #hasWordAsSubstring()} - T occurs inside some word of L;</li>
 * <li>{@link #suffixEqualsPrefix(int) suffixEqualsPrefix}[len] - some word of L
 * ends with the length len prefix of T;</li>
 * <li>{@link #prefixEqualsSuffix(int) prefixEqualsSuffix}[len] - some word of L
 * starts with the length len suffix of T.</li>
 * </ul>
 * Witnesses for a regular expression are built bottom up: leaves come from
 * comparing one symbol with T, inner nodes from {@link #union(WordWitness)},
 * {@link #concat(WordWitness)} and {@link #star()}. The witness of a
 * combination depends only on the witnesses of its operands, so the algebra
 * is exact. Witnesses are immutable; operands must share the same test word.
 */
public final class WordWitness {

    private static final Logger logger = Logger.getLogger("org.subrx.regex");
    private static final Level level = Level.FINEST;

    private final String word;
    private final int n;

    /*
     * substring[i][len], column 0 unused: the empty factor is hasEpsilon.
     * suffixEqualsPrefix[len] and prefixEqualsSuffix[len], index 0 unused.
     */
    private final boolean[][] substring;
    private final boolean[] suffixEqualsPrefix;
    private final boolean[] prefixEqualsSuffix;
    private final boolean hasEpsilon;
    private final boolean hasWordAsSubstring;

    private WordWitness(String word, boolean[][] substring,
            boolean[] suffixEqualsPrefix, boolean[] prefixEqualsSuffix,
            boolean hasEpsilon, boolean hasWordAsSubstring) {
        this.word = word;
        this.n = word.length();
        this.substring = substring;
        this.suffixEqualsPrefix = suffixEqualsPrefix;
        this.prefixEqualsSuffix = prefixEqualsSuffix;
        this.hasEpsilon = hasEpsilon;
        this.hasWordAsSubstring = hasWordAsSubstring;
    }

    private static boolean[][] newTable(int n) {
        boolean[][] table = new boolean[n][];
        for (int i = 0; i < n; ++i) {
            table[i] = new boolean[n - i + 1];
        }
        return table;
    }

    private static void checkTestWord(String word) {
        if (word.isEmpty()) {
            throw new IllegalArgumentException("empty test word");
        }
    }

    /**
     * The witness of the empty language: every field false. It is the neutral
     * element of {@link #union(WordWitness)}; {@link #concat(WordWitness)}
     * expects non empty languages, which every expression denotes.
     */
    public static WordWitness empty(String word) {
        checkTestWord(word);
        int n = word.length();
        return new WordWitness(word, newTable(n), new boolean[n + 1],
            new boolean[n + 1], false, false);
    }

    /**
     * The witness of the language holding only the empty word.
     */
    public static WordWitness epsilon(String word) {
        checkTestWord(word);
        int n = word.length();
        return new WordWitness(word, newTable(n), new boolean[n + 1],
            new boolean[n + 1], true, false);
    }

    /**
     * The witness of the language holding only the one letter word
     * <code>c</code>.
     */
    public static WordWitness symbol(char c, String word) {
        checkTestWord(word);
        int n = word.length();
        boolean[][] substring = newTable(n);
        boolean[] sep = new boolean[n + 1];
        boolean[] pes = new boolean[n + 1];
        sep[1] = word.charAt(0) == c;
        pes[1] = word.charAt(n - 1) == c;
        for (int i = 0; i < n; ++i) {
            substring[i][1] = word.charAt(i) == c;
        }
        return new WordWitness(word, substring, sep, pes, false,
            n == 1 && sep[1]);
    }

    private void checkSameWord(WordWitness that) {
        if (!word.equals(that.word)) {
            throw new IllegalArgumentException("witnesses for different test words: \""
                    + word + "\" and \"" + that.word + '"');
        }
    }

    /**
     * The witness of L(this) &#x222a; L(that): every field or-ed.
     */
    public WordWitness union(WordWitness that) {
        checkSameWord(that);
        boolean[][] sub = copyOf(substring);
        boolean[] sep = suffixEqualsPrefix.clone();
        boolean[] pes = prefixEqualsSuffix.clone();
        for (int i = 0; i < n; ++i) {
            for (int len = 1; len <= n - i; ++len) {
                sub[i][len] |= that.substring[i][len];
            }
        }
        for (int len = 1; len <= n; ++len) {
            sep[len] |= that.suffixEqualsPrefix[len];
            pes[len] |= that.prefixEqualsSuffix[len];
        }
        return new WordWitness(word, sub, sep, pes,
            hasEpsilon || that.hasEpsilon,
            hasWordAsSubstring || that.hasWordAsSubstring);
    }

    /**
     * The witness of L(this) &middot; L(right).
     */
    public WordWitness concat(WordWitness right) {
        checkSameWord(right);
        final WordWitness left = this;

        // a factor of T splits into a (possibly empty) left and right part
        boolean[][] sub = newTable(n);
        for (int i = 0; i < n; ++i) {
            for (int len = 1; len <= n - i; ++len) {
                boolean in = left.hasEpsilon && right.substring[i][len]
                        || right.hasEpsilon && left.substring[i][len];
                for (int p = 1; p < len && !in; ++p) {
                    in = left.substring[i][p] && right.substring[i + p][len - p];
                }
                sub[i][len] = in;
            }
        }

        // T straddles the boundary: T[0,p) ends a left word, T[p,n) starts a right one
        boolean infix = left.hasWordAsSubstring || right.hasWordAsSubstring;
        for (int p = 1; p < n && !infix; ++p) {
            infix = left.suffixEqualsPrefix[p] && right.prefixEqualsSuffix[n - p];
        }

        // T[0,len) ends a left word and the rest of it is a whole right word
        boolean[] sep = new boolean[n + 1];
        for (int len = 1; len <= n; ++len) {
            boolean in = right.suffixEqualsPrefix[len]
                    || left.suffixEqualsPrefix[len] && right.hasEpsilon;
            for (int k = 1; k < len && !in; ++k) {
                in = left.suffixEqualsPrefix[k] && right.substring[k][len - k];
            }
            sep[len] = in;
        }

        // T[n-len,n) is a whole left word followed by the start of a right one
        boolean[] pes = new boolean[n + 1];
        for (int len = 1; len <= n; ++len) {
            boolean in = left.prefixEqualsSuffix[len]
                    || left.hasEpsilon && right.prefixEqualsSuffix[len];
            for (int k = 1; k < len && !in; ++k) {
                in = left.substring[n - len][len - k] && right.prefixEqualsSuffix[k];
            }
            pes[len] = in;
        }

        return new WordWitness(word, sub, sep, pes,
            left.hasEpsilon && right.hasEpsilon, infix);
    }

    /**
     * The witness of L(this)*, iterated to a fixed point: closure<sub>0</sub>
     * is {&epsilon;} and closure<sub>k+1</sub> = closure<sub>k</sub> &#x222a;
     * closure<sub>k</sub> &middot; L(this). Since every step depends only on
     * the previous witness, the first round which adds nothing ends the
     * iteration. Fields only ever flip to true, so this takes at most as many
     * rounds as there are fields.
     */
    public WordWitness star() {
        WordWitness closure = epsilon(word);
        int rounds = 0;
        for (;;) {
            WordWitness next = closure.union(closure.concat(this));
            ++rounds;
            if (next.equals(closure)) break;
            closure = next;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "star closure for \"" + word + "\" stable after "
                    + rounds + " rounds");
        }
        return closure;
    }

    /**
     * The witness of L(this)*, as the sum e<sup>0</sup> + e<sup>1</sup> + ...
     * + e<sup>{@link #sufficientStarRounds(int) 2n+2}</sup>, always running
     * every round. Gives the same result as {@link #star()}.
     */
    public WordWitness boundedStar() {
        WordWitness power = epsilon(word);
        WordWitness sum = power;
        int rounds = sufficientStarRounds(n);
        for (int k = 0; k < rounds; ++k) {
            power = power.concat(this);
            sum = sum.union(power);
        }
        return sum;
    }

    /**
     * A word of L* that witnesses a fact about factors of a length n test
     * word never needs more than 2n + 2 nonempty factors from L.
     */
    public static int sufficientStarRounds(int n) {
        return 2 * n + 2;
    }

    public String testWord() {
        return word;
    }

    public int length() {
        return n;
    }

    /**
     * @return true if the factor of the test word starting at <code>start</code>
     *         with <code>len</code> symbols is in the language. A zero length
     *         answers {@link #hasEpsilon()}.
     */
    public boolean containsSubstring(int start, int len) {
        if (start < 0 || len < 0 || start + len > n) {
            throw new IndexOutOfBoundsException(
                "start: " + start + ", len: " + len + ", test word length: " + n);
        }
        return len == 0 ? hasEpsilon : substring[start][len];
    }

    public boolean hasEpsilon() {
        return hasEpsilon;
    }

    public boolean hasWordAsSubstring() {
        return hasWordAsSubstring;
    }

    public boolean suffixEqualsPrefix(int len) {
        checkLength(len);
        return suffixEqualsPrefix[len];
    }

    public boolean prefixEqualsSuffix(int len) {
        checkLength(len);
        return prefixEqualsSuffix[len];
    }

    private void checkLength(int len) {
        if (len < 1 || len > n) {
            throw new IndexOutOfBoundsException(
                "len: " + len + ", test word length: " + n);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WordWitness)) return false;
        WordWitness that = (WordWitness) o;
        return hasEpsilon == that.hasEpsilon
                && hasWordAsSubstring == that.hasWordAsSubstring
                && word.equals(that.word)
                && Arrays.equals(suffixEqualsPrefix, that.suffixEqualsPrefix)
                && Arrays.equals(prefixEqualsSuffix, that.prefixEqualsSuffix)
                && Arrays.deepEquals(substring, that.substring);
    }

    @Override
    public int hashCode() {
        int h = word.hashCode();
        h = 31 * h + Arrays.deepHashCode(substring);
        h = 31 * h + Arrays.hashCode(suffixEqualsPrefix);
        h = 31 * h + Arrays.hashCode(prefixEqualsSuffix);
        h = 31 * h + (hasEpsilon ? 1 : 0);
        return 31 * h + (hasWordAsSubstring ? 1 : 0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("{word:").append(word);
        sb.append(", eps:").append(hasEpsilon);
        sb.append(", infix:").append(hasWordAsSubstring);
        sb.append(", sep:").append(indicesFrom(suffixEqualsPrefix));
        sb.append(", pes:").append(indicesFrom(prefixEqualsSuffix));
        sb.append(", sub:[");
        for (int i = 0; i < n; ++i) {
            sb.append(i == 0 ? "" : ", ").append(i).append(':')
                .append(indicesFrom(substring[i]));
        }
        return sb.append("]}").toString();
    }
}
