/*
 * @LICENSE@
 */

/**
 * <h3><b>subrx</b> - longest factor of a word inside a regular language.</h3>
 * <p>
 * Given a regular expression E in postfix form over a small alphabet and a
 * word W, <b>subrx</b> computes the length of the longest contiguous
 * substring (factor) of W which is itself a factor of some word of L(E). The
 * language is never enumerated and no automaton is built.
 * <p>
 * <h4>Witnesses.</h4>
 * <p>
 * For a fixed <em>test word</em> T every sub-expression is summarised by a
 * {@link org.subrx.regex.WordWitness}: which factors of T belong to the
 * sub-language, which prefixes of T end one of its words, which suffixes of T
 * start one, whether it holds the empty word and whether T sits inside one of
 * its words. Union, concatenation and Kleene star act directly on these
 * summaries. Star is the only operation needing iteration; it is closed to a
 * fixed point, or optionally with the fixed number of rounds
 * {@link org.subrx.regex.WordWitness#sufficientStarRounds(int)}.
 * <p>
 * <h4>Evaluation and search.</h4>
 * <p>
 * An {@link org.subrx.regex.Expression} is a parsed postfix token list; the
 * {@link org.subrx.regex.ExpressionEvaluator} runs it as a stack machine for
 * one test word, and reports malformed input as a failed
 * {@link org.subrx.regex.Evaluation}. The
 * {@link org.subrx.regex.LongestSubstringSolver} feeds every factor of W to
 * the evaluator, optionally over several threads, and keeps the maximum.
 * <p>
 * The alphabet and the epsilon marker are configurable through
 * {@link org.subrx.regex.Alphabet}; the default is <code>{a, b, c}</code>
 * with <code>1</code> for epsilon. Operators are <code>+</code> (union),
 * <code>.</code> (concatenation) and <code>*</code> (star).
 */
package org.subrx.regex;
