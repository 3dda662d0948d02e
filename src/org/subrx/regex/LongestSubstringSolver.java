/* @LICENSE@
 */
package org.subrx.regex;

import static org.subrx.regex.Misc.isSet;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.subrx.regex.Misc.FlagMgr;

/**
 * Finds the length of the longest factor (contiguous substring) of a word
 * which occurs inside some word of the language of an {@link Expression}.
 * Every candidate factor is evaluated from scratch as the test word of an
 * {@link ExpressionEvaluator}.
 * <p>
 * For a fixed start offset the factors are tried by increasing length. Since
 * an extension of a factor that occurs in no word of the language cannot
 * occur either, the search for that offset stops at the first miss unless the
 * {@link #EXHAUSTIVE} flag is given. Start offsets are independent of each
 * other and can be spread over several threads; the answer does not depend on
 * the thread count.
 */
public final class LongestSubstringSolver {

    private static final Logger logger = Logger.getLogger("org.subrx.regex");
    private static final Level level = Level.FINER;

    /**
     * System property holding the default thread count.
     */
    public static final String THREADS_PROPERTY = "org.subrx.regex.threads";

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Evaluates every (start, length) pair instead of stopping at the first
     * factor of a start offset that misses.
     */
    public static final int EXHAUSTIVE = flagMgr.next("EXHAUSTIVE");

    /**
     * Computes star closures with the fixed {@linkplain
     * WordWitness#sufficientStarRounds(int) 2n+2} rounds instead of iterating
     * to a fixed point.
     */
    public static final int BOUNDED_STAR = flagMgr.next("BOUNDED_STAR");

    static final int FLAG_COUNT = flagMgr.freezeAndCount();

    /**
     * The longest factor found: the first one by start offset among those of
     * maximal length. A miss is the zero length match at offset 0.
     */
    public static final class Match {

        final int start;
        final int length;
        final String text;

        Match(String word, int start, int length) {
            this.start = start;
            this.length = length;
            this.text = word.substring(start, start + length);
        }

        public int start() {
            return start;
        }

        public int end() {
            return start + length;
        }

        public int length() {
            return length;
        }

        public String text() {
            return text;
        }

        boolean betterThan(Match that) {
            return length > that.length
                    || length == that.length && start < that.start;
        }

        @Override
        public String toString() {
            return "\"" + text + "\" [" + start + ", " + end() + ')';
        }
    }

    private final Expression expression;
    private final ExpressionEvaluator evaluator;
    private final int flags;
    private final int threads;

    public LongestSubstringSolver(Expression expression, int flags, int threads) {
        flagMgr.check(flags);
        if (threads < 1) {
            throw new IllegalArgumentException("threads: " + threads);
        }
        this.expression = expression;
        this.flags = flags;
        this.threads = threads;
        this.evaluator = new ExpressionEvaluator(expression, isSet(flags, BOUNDED_STAR));
        if (logger.isLoggable(level)) {
            logger.log(level, "expression: " + expression + ", flags: "
                    + flagMgr.stringFrom(flags) + ", threads: " + threads);
        }
    }

    public LongestSubstringSolver(Expression expression, int flags) {
        this(expression, flags, defaultThreads());
    }

    public LongestSubstringSolver(Expression expression) {
        this(expression, 0);
    }

    static int defaultThreads() {
        return Math.max(1, Integer.getInteger(THREADS_PROPERTY, 1));
    }

    public Expression expression() {
        return expression;
    }

    public int flags() {
        return flags;
    }

    public int threads() {
        return threads;
    }

    /**
     * @return true if <code>testWord</code> occurs inside some word of the
     *         language.
     * @throws SyntaxException
     *             if the test word or the expression is malformed.
     */
    public boolean isInfix(String testWord) {
        return evaluator.evaluate(testWord).witness().hasWordAsSubstring();
    }

    /**
     * @return the length of the longest factor of <code>word</code> occurring
     *         inside some word of the language, 0 if there is none.
     * @throws SyntaxException
     *             if the word or the expression is malformed.
     */
    public int solve(String word) {
        return longest(word).length;
    }

    /**
     * @return the first longest factor of <code>word</code> occurring inside
     *         some word of the language.
     * @throws SyntaxException
     *             if the word or the expression is malformed.
     */
    public Match longest(String word) {
        expression.alphabet.checkWord(word);
        Match best = threads == 1 || word.length() == 1
                ? sequential(word)
                : parallel(word);
        logger.fine("longest factor of \"" + word + "\" in " + expression + ": " + best);
        return best;
    }

    private Match sequential(String word) {
        Match best = new Match(word, 0, 0);
        for (int start = 0; start < word.length(); ++start) {
            Match m = longestAt(word, start);
            if (m.betterThan(best)) best = m;
        }
        return best;
    }

    private Match parallel(final String word) {
        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(threads, word.length()));
        try {
            List<Future<Match>> futures = new ArrayList<Future<Match>>(word.length());
            for (int start = 0; start < word.length(); ++start) {
                final int s = start;
                futures.add(pool.submit(new Callable<Match>() {
                    public Match call() {
                        return longestAt(word, s);
                    }
                }));
            }
            Match best = new Match(word, 0, 0);
            for (Future<Match> f : futures) {
                Match m = f.get();
                if (m.betterThan(best)) best = m;
            }
            return best;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while solving", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private Match longestAt(String word, int start) {
        boolean exhaustive = isSet(flags, EXHAUSTIVE);
        int best = 0;
        for (int len = 1; len <= word.length() - start; ++len) {
            if (evaluator.evaluate(word.substring(start, start + len)).witness()
                    .hasWordAsSubstring()) {
                best = len;
            } else if (!exhaustive) {
                break;
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "start " + start + ": " + best);
        }
        return new Match(word, start, best);
    }

    @Override
    public String toString() {
        return "LongestSubstringSolver{" + expression + ", flags: "
                + flagMgr.stringFrom(flags) + ", threads: " + threads + '}';
    }
}
