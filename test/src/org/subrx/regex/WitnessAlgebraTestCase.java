/* @LICENSE@
 */

package org.subrx.regex;

import java.util.Random;
import java.util.Set;

/**
 * Checks every witness field against a brute force enumeration of the short
 * words of the language. Expressions have at most three operands over
 * <code>{a, b}</code>, test words at most three symbols, so any fact a witness
 * records is already shown by a word of at most nine symbols.
 */
public class WitnessAlgebraTestCase extends AbstractWitnessTestCase {

    private static final int CAP = 9;

    public static void main(String[] args) {
        junit.textui.TestRunner.run(WitnessAlgebraTestCase.class);
    }

    public WitnessAlgebraTestCase(String name) {
        super(name);
    }

    private void assertAgainstBruteForce(String postfix) {
        Expression e = Expression.parse(postfix, AB);
        Set<String> language = boundedLanguage(e, CAP);
        for (String t : allWords("ab", 3)) {
            assertWitness(language, witness(e, t));
            assertWitness(language, new ExpressionEvaluator(e, true).evaluate(t).witness());
        }
    }

    public void testLeaves() {
        assertAgainstBruteForce("a");
        assertAgainstBruteForce("b");
        assertAgainstBruteForce("1");
    }

    public void testHandPicked() {
        assertAgainstBruteForce("ab.");
        assertAgainstBruteForce("ab+");
        assertAgainstBruteForce("a*");
        assertAgainstBruteForce("ab.*");
        assertAgainstBruteForce("ab+*");
        assertAgainstBruteForce("a1+b.");
        assertAgainstBruteForce("aa.b.*");
        assertAgainstBruteForce("a*b*.");
        assertAgainstBruteForce("ab*.a.");
        assertAgainstBruteForce("1*");
    }

    public void testRandomExpressions() {
        Random rnd = new Random(42);
        for (int round = 0; round < 150; ++round) {
            String postfix = randomPostfix(rnd, 1 + rnd.nextInt(3), "ab1");
            logger.log(level, postfix);
            assertAgainstBruteForce(postfix);
        }
    }
}
