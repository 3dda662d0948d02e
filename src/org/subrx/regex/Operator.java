/* @LICENSE@
 */
package org.subrx.regex;

/**
 * The operators of a postfix expression. The set is closed; the evaluator
 * dispatches on it with a <code>switch</code>.
 */
public enum Operator {

    UNION('+', 2),
    CONCAT('.', 2),
    STAR('*', 1);

    final char glyph;
    final int arity;

    Operator(char glyph, int arity) {
        this.glyph = glyph;
        this.arity = arity;
    }

    public char glyph() {
        return glyph;
    }

    public int arity() {
        return arity;
    }

    /**
     * @return the operator written as <code>c</code>, or null.
     */
    public static Operator forGlyph(char c) {
        switch (c) {
        case '+':
            return UNION;
        case '.':
            return CONCAT;
        case '*':
            return STAR;
        default:
            return null;
        }
    }
}
