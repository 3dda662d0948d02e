/* @LICENSE@
 */

package org.subrx.regex;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;
import java.util.Stack;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

import org.subrx.regex.Expression.Token;

public abstract class AbstractWitnessTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.subrx.regex.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    protected static final Alphabet AB = new Alphabet("ab");

    public AbstractWitnessTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }

    protected static WordWitness witness(String postfix, String testWord) {
        return witness(Expression.parse(postfix), testWord);
    }

    protected static WordWitness witness(Expression e, String testWord) {
        return new ExpressionEvaluator(e).evaluate(testWord).witness();
    }

    protected static int solve(String postfix, String word) {
        return new LongestSubstringSolver(Expression.parse(postfix)).solve(word);
    }

    protected static void assertThrows(SyntaxException.Kind kind, Runnable r) {
        try {
            r.run();
            fail("should throw " + kind);
        } catch (SyntaxException e) {
            assertEquals(e.getMessage(), kind, e.kind());
        }
    }

    /*
     * all non empty words over the symbols up to maxLength, shortest first
     */
    protected static Set<String> allWords(String symbols, int maxLength) {
        Set<String> ret = new LinkedHashSet<String>();
        Set<String> layer = new HashSet<String>();
        layer.add("");
        for (int len = 1; len <= maxLength; ++len) {
            Set<String> next = new TreeSet<String>();
            for (String w : layer) {
                for (char c : symbols.toCharArray()) {
                    next.add(w + c);
                }
            }
            ret.addAll(next);
            layer = next;
        }
        return ret;
    }

    /**
     * A random well formed postfix expression with <code>leaves</code>
     * operands drawn from <code>operands</code>.
     */
    protected static String randomPostfix(Random rnd, int leaves, String operands) {
        StringBuilder sb = new StringBuilder();
        if (leaves == 1) {
            sb.append(operands.charAt(rnd.nextInt(operands.length())));
        } else {
            int left = 1 + rnd.nextInt(leaves - 1);
            sb.append(randomPostfix(rnd, left, operands));
            sb.append(randomPostfix(rnd, leaves - left, operands));
            sb.append(rnd.nextBoolean() ? '+' : '.');
        }
        if (rnd.nextInt(3) == 0) {
            sb.append('*');
        }
        return sb.toString();
    }

    /**
     * Brute force: every word of L(e) with at most <code>cap</code> symbols.
     */
    protected static Set<String> boundedLanguage(Expression e, int cap) {
        Stack<Set<String>> stack = new Stack<Set<String>>();
        for (Token t : e.tokens()) {
            if (t.isOperand()) {
                Set<String> leaf = new HashSet<String>();
                leaf.add(t.isEpsilon() ? "" : t.toString());
                stack.push(leaf);
                continue;
            }
            switch (t.operator()) {
            case UNION: {
                Set<String> right = stack.pop();
                Set<String> left = stack.pop();
                left.addAll(right);
                stack.push(left);
                break;
            }
            case CONCAT: {
                Set<String> right = stack.pop();
                Set<String> left = stack.pop();
                stack.push(concat(left, right, cap));
                break;
            }
            case STAR: {
                Set<String> child = stack.pop();
                Set<String> closure = new HashSet<String>();
                closure.add("");
                int size;
                do {
                    size = closure.size();
                    closure.addAll(concat(closure, child, cap));
                } while (closure.size() != size);
                stack.push(closure);
                break;
            }
            }
        }
        assertEquals(1, stack.size());
        return stack.pop();
    }

    private static Set<String> concat(Set<String> left, Set<String> right, int cap) {
        Set<String> ret = new HashSet<String>();
        for (String l : left) {
            for (String r : right) {
                if (l.length() + r.length() <= cap) {
                    ret.add(l + r);
                }
            }
        }
        return ret;
    }

    /*
     * the brute force counterpart of WordWitness.hasWordAsSubstring()
     */
    protected static boolean isInfix(Set<String> language, String testWord) {
        for (String w : language) {
            if (w.contains(testWord)) return true;
        }
        return false;
    }

    protected static void assertWitness(Set<String> language, WordWitness w) {
        String t = w.testWord();
        int n = t.length();
        String msg = w.toString();
        assertEquals(msg, language.contains(""), w.hasEpsilon());
        assertEquals(msg, isInfix(language, t), w.hasWordAsSubstring());
        for (int i = 0; i < n; ++i) {
            for (int len = 1; len <= n - i; ++len) {
                assertEquals(msg + " sub " + i + "," + len,
                    language.contains(t.substring(i, i + len)),
                    w.containsSubstring(i, len));
            }
        }
        for (int len = 1; len <= n; ++len) {
            boolean sep = false;
            boolean pes = false;
            for (String v : language) {
                sep |= v.endsWith(t.substring(0, len));
                pes |= v.startsWith(t.substring(n - len));
            }
            assertEquals(msg + " sep " + len, sep, w.suffixEqualsPrefix(len));
            assertEquals(msg + " pes " + len, pes, w.prefixEqualsSuffix(len));
        }
    }
}
