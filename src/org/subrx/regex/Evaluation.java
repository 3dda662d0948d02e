/* @LICENSE@
 */
package org.subrx.regex;

/**
 * The outcome of evaluating an {@link Expression} against one test word:
 * either the root {@link WordWitness} or the {@link SyntaxException} that
 * stopped the evaluation. Failures are values here so that a caller looping
 * over many test words can collect them; {@link #witness()} turns a failure
 * back into the exception.
 */
public final class Evaluation {

    private final String testWord;
    private final WordWitness witness;
    private final SyntaxException failure;

    private Evaluation(String testWord, WordWitness witness, SyntaxException failure) {
        assert (witness == null) != (failure == null);
        this.testWord = testWord;
        this.witness = witness;
        this.failure = failure;
    }

    static Evaluation success(WordWitness witness) {
        return new Evaluation(witness.testWord(), witness, null);
    }

    static Evaluation failure(String testWord, SyntaxException failure) {
        return new Evaluation(testWord, null, failure);
    }

    public boolean succeeded() {
        return witness != null;
    }

    public String testWord() {
        return testWord;
    }

    /**
     * @return the root witness.
     * @throws SyntaxException
     *             the failure, if the evaluation failed.
     */
    public WordWitness witness() {
        if (failure != null) {
            throw failure;
        }
        return witness;
    }

    /**
     * @return the failure, or null on success.
     */
    public SyntaxException failure() {
        return failure;
    }

    /**
     * @return true if the evaluation succeeded and the test word occurs
     *         inside some word of the language.
     */
    public boolean isInfix() {
        return witness != null && witness.hasWordAsSubstring();
    }

    @Override
    public String toString() {
        return succeeded() ? "success: " + witness : "failure: " + failure.getMessage();
    }
}
