/* @LICENSE@
 */
package org.subrx.regex;

import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.subrx.regex.Expression.Token;
import org.subrx.regex.SyntaxException.Kind;

/**
 * Runs the postfix stack machine of an {@link Expression} for one test word
 * at a time. Operands push leaf {@link WordWitness}es built for that word,
 * operators pop their operands and push the combination. Every call starts
 * from a fresh stack and fresh leaves: witnesses of different test words are
 * unrelated and never reused.
 * <p>
 * Instances hold no mutable state and can be used from several threads.
 */
public final class ExpressionEvaluator {

    private static final Logger logger = Logger.getLogger("org.subrx.regex");
    private static final Level level = Level.FINEST;

    private final Expression expression;
    private final boolean boundedStar;

    /**
     * @param boundedStar
     *            use {@link WordWitness#boundedStar()} rather than the fixed
     *            point {@link WordWitness#star()}.
     */
    public ExpressionEvaluator(Expression expression, boolean boundedStar) {
        if (expression == null) {
            throw new NullPointerException("expression");
        }
        this.expression = expression;
        this.boundedStar = boundedStar;
    }

    public ExpressionEvaluator(Expression expression) {
        this(expression, false);
    }

    public Expression expression() {
        return expression;
    }

    /**
     * Evaluates the expression against <code>testWord</code>. Never throws a
     * {@link SyntaxException}; input errors are reported as a failed
     * {@link Evaluation}.
     */
    public Evaluation evaluate(String testWord) {
        try {
            expression.alphabet.checkWord(testWord);
            return Evaluation.success(run(testWord));
        } catch (SyntaxException e) {
            logger.log(level, "evaluation of " + expression + " failed: " + e.getMessage());
            return Evaluation.failure(testWord, e);
        }
    }

    private WordWitness run(String testWord) {
        Stack<WordWitness> operands = new Stack<WordWitness>();
        for (Token t : expression.tokens) {
            if (t.isOperand()) {
                operands.push(t.epsilon
                        ? WordWitness.epsilon(testWord)
                        : WordWitness.symbol(t.glyph, testWord));
                continue;
            }
            if (operands.size() < t.op.arity) {
                throw new SyntaxException(
                    Kind.MISSING_OPERANDS, expression.source, t.index);
            }
            switch (t.op) {
            case UNION: {
                WordWitness right = operands.pop();
                WordWitness left = operands.pop();
                operands.push(left.union(right));
                break;
            }
            case CONCAT: {
                WordWitness right = operands.pop();
                WordWitness left = operands.pop();
                operands.push(left.concat(right));
                break;
            }
            case STAR: {
                WordWitness child = operands.pop();
                operands.push(boundedStar ? child.boundedStar() : child.star());
                break;
            }
            default:
                throw new AssertionError(t.op);
            }
        }
        if (operands.size() > 1) {
            throw new SyntaxException(Kind.TOO_MANY_OPERANDS, expression.source);
        }
        if (operands.isEmpty()) {
            throw new SyntaxException(Kind.MISSING_OPERANDS, expression.source);
        }
        return operands.pop();
    }

    @Override
    public String toString() {
        return "ExpressionEvaluator{" + expression
                + (boundedStar ? ", bounded star}" : "}");
    }
}
