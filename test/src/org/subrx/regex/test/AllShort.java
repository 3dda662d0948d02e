/* @LICENSE@  
 */


package org.subrx.regex.test;

import org.subrx.regex.AlphabetTestCase;
import org.subrx.regex.ExpressionEvaluatorTestCase;
import org.subrx.regex.ExpressionTestCase;
import org.subrx.regex.LongestSubstringSolverTestCase;
import org.subrx.regex.WitnessAlgebraTestCase;
import org.subrx.regex.WordWitnessTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(AlphabetTestCase.class);
        suite.addTestSuite(ExpressionTestCase.class);
        suite.addTestSuite(WordWitnessTestCase.class);
        suite.addTestSuite(WitnessAlgebraTestCase.class);
        suite.addTestSuite(ExpressionEvaluatorTestCase.class);
        suite.addTestSuite(LongestSubstringSolverTestCase.class);
        suite.addTestSuite(MainTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
