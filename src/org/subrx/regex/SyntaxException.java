/* @LICENSE@
 */
package org.subrx.regex;

/**
 * Thrown when an expression or a word is rejected. All of these are fatal
 * input errors; nothing is retried and no partial answer is produced.
 */
public class SyntaxException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * What went wrong.
     */
    public enum Kind {
        EMPTY_EXPRESSION("Expression is empty"),
        EMPTY_WORD("Word is empty"),
        INVALID_WORD_SYMBOL("Unknown symbol in word"),
        UNKNOWN_EXPRESSION_SYMBOL("Unknown symbol in expression"),
        MISSING_OPERANDS("Missing operands"),
        TOO_MANY_OPERANDS("Too many operands");

        final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    private final Kind kind;
    private final String input;
    private final int index;

    SyntaxException(Kind kind, String input, int index) {
        super(messageFor(kind, input, index));
        this.kind = kind;
        this.input = input;
        this.index = index;
    }

    SyntaxException(Kind kind, String input) {
        this(kind, input, -1);
    }

    private static String messageFor(Kind kind, String input, int index) {
        StringBuilder sb = new StringBuilder(kind.description);
        if (index >= 0 && index < input.length()) {
            sb.append(": '").append(Misc.esc(input.charAt(index))).append('\'')
                .append(" (index ").append(index)
                .append(" of \"").append(input).append("\")");
        } else if (input.length() > 0) {
            sb.append(" in \"").append(input).append('"');
        }
        return sb.toString();
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the rejected expression or word.
     */
    public String input() {
        return input;
    }

    /**
     * @return index of the offending character in {@link #input()}, or -1
     *         when the error is not tied to a single character.
     */
    public int index() {
        return index;
    }
}
