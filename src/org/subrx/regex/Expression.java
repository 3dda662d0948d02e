/* @LICENSE@
 */
package org.subrx.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.subrx.regex.SyntaxException.Kind;

/**
 * A parsed postfix regular expression over an {@link Alphabet}: symbols and
 * the epsilon marker are operands, <code>+</code> (union), <code>.</code>
 * (concatenation) and <code>*</code> (Kleene star) are operators. Instances of
 * this class are immutable and may be shared between threads.
 *
 * <blockquote><pre>
 *   Expression e = Expression.parse("ab.*c+");   // (ab)* + c
 *   e.toInfixString();                           // "((ab)*+c)"
 * </pre></blockquote>
 *
 * Parsing only checks the symbols; whether the operators have their operands
 * is found out by the {@link ExpressionEvaluator}.
 */
public final class Expression {

    private static final Logger logger = Logger.getLogger("org.subrx.regex");
    private static final Level level = Level.FINEST;

    /**
     * One character of the postfix source.
     */
    public static final class Token {

        final char glyph;
        final int index;
        final Operator op;      // null for operands
        final boolean epsilon;

        private Token(char glyph, int index, Operator op, boolean epsilon) {
            this.glyph = glyph;
            this.index = index;
            this.op = op;
            this.epsilon = epsilon;
        }

        public char glyph() {
            return glyph;
        }

        /**
         * @return position of this token in the postfix source.
         */
        public int index() {
            return index;
        }

        /**
         * @return the operator, or null if this token is an operand.
         */
        public Operator operator() {
            return op;
        }

        public boolean isOperand() {
            return op == null;
        }

        public boolean isEpsilon() {
            return epsilon;
        }

        @Override
        public String toString() {
            return String.valueOf(glyph);
        }
    }

    final String source;
    final Alphabet alphabet;
    final List<Token> tokens;

    private Expression(String source, Alphabet alphabet, List<Token> tokens) {
        this.source = source;
        this.alphabet = alphabet;
        this.tokens = Collections.unmodifiableList(tokens);
    }

    public static Expression parse(String postfix) {
        return parse(postfix, Alphabet.DEFAULT);
    }

    /**
     * Every symbol of the source is checked here, so an unknown symbol is
     * reported ahead of a bad test word or an operator short of operands.
     *
     * @throws SyntaxException
     *             with kind {@link Kind#EMPTY_EXPRESSION} or
     *             {@link Kind#UNKNOWN_EXPRESSION_SYMBOL}.
     */
    public static Expression parse(String postfix, Alphabet alphabet) {
        if (postfix.isEmpty()) {
            throw new SyntaxException(Kind.EMPTY_EXPRESSION, postfix);
        }
        List<Token> tokens = new ArrayList<Token>(postfix.length());
        for (int i = 0; i < postfix.length(); ++i) {
            char c = postfix.charAt(i);
            Operator op = Operator.forGlyph(c);
            if (op != null) {
                tokens.add(new Token(c, i, op, false));
            } else if (alphabet.contains(c) || alphabet.isEpsilon(c)) {
                tokens.add(new Token(c, i, null, alphabet.isEpsilon(c)));
            } else {
                throw new SyntaxException(
                    Kind.UNKNOWN_EXPRESSION_SYMBOL, postfix, i);
            }
        }
        logger.log(level, "expression: " + postfix + ", tokens: " + tokens.size());
        return new Expression(postfix, alphabet, tokens);
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * Renders the expression fully parenthesised in infix form, with
     * concatenation written as juxtaposition.
     *
     * @throws SyntaxException
     *             if an operator lacks operands or operands are left over.
     */
    public String toInfixString() {
        Stack<String> stack = new Stack<String>();
        for (Token t : tokens) {
            if (t.isOperand()) {
                stack.push(t.toString());
                continue;
            }
            if (stack.size() < t.op.arity) {
                throw new SyntaxException(Kind.MISSING_OPERANDS, source, t.index);
            }
            switch (t.op) {
            case STAR:
                String child = stack.pop();
                // a starred child is wrapped again: (a*)*, ((ab)*)*
                stack.push(child.length() == 1 || child.endsWith(")")
                        ? child + '*' : '(' + child + ")*");
                break;
            case UNION:
            case CONCAT:
                String right = stack.pop();
                String left = stack.pop();
                stack.push('(' + left + (t.op == Operator.UNION ? "+" : "")
                        + right + ')');
                break;
            default:
                throw new AssertionError(t.op);
            }
        }
        if (stack.size() > 1) {
            throw new SyntaxException(Kind.TOO_MANY_OPERANDS, source);
        }
        return stack.pop();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Expression)) return false;
        Expression that = (Expression) o;
        return source.equals(that.source) && alphabet.equals(that.alphabet);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    /**
     * @return the postfix source this expression was parsed from.
     */
    @Override
    public String toString() {
        return source;
    }
}
