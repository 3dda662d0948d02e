/* @LICENSE@
 */
package org.subrx.regex;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command line front end: reads a postfix expression and a word, prints the
 * length of the longest factor of the word that occurs inside a word of the
 * expression's language.
 * <pre>
 *   $ echo "ab.* aabab" | subrx
 *   4
 * </pre>
 * Exit status is 0 on success, 1 when the expression or the word is rejected
 * and 2 for usage and I/O errors.
 */
@Command(
    name = "subrx",
    description = "Length of the longest substring of WORD occurring inside a word of L(EXPRESSION).",
    version = "subrx 0.1.0",
    mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer> {

    public static final int EXIT_REJECTED = 1;
    public static final int EXIT_IO = 2;

    @Spec
    CommandSpec spec;

    @Parameters(arity = "0..2", paramLabel = "TOKEN",
        description = "EXPRESSION and WORD; tokens not given here are read from the input.")
    List<String> positional = new ArrayList<String>();

    @Option(names = {"-i", "--input"}, paramLabel = "FILE",
        description = "Read tokens from FILE instead of standard input.")
    File input;

    @Option(names = {"-a", "--alphabet"}, defaultValue = "abc",
        description = "Alphabet symbols (default: ${DEFAULT-VALUE}).")
    String alphabet;

    @Option(names = {"-e", "--epsilon"}, defaultValue = "1",
        description = "Epsilon marker (default: ${DEFAULT-VALUE}).")
    char epsilon;

    @Option(names = {"-t", "--threads"},
        description = "Worker threads (default: system property " + LongestSubstringSolver.THREADS_PROPERTY + " or 1).")
    Integer threads;

    @Option(names = "--exhaustive",
        description = "Evaluate every (start, length) pair.")
    boolean exhaustive;

    @Option(names = "--bounded-star",
        description = "Close stars with exactly 2n+2 rounds.")
    boolean boundedStar;

    @Option(names = {"-v", "--verbose"},
        description = "Log the search on standard error.")
    boolean verbose;

    private final InputStream stdin;

    public Main(InputStream stdin) {
        this.stdin = stdin;
    }

    public Main() {
        this(System.in);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            verbose();
        }
        Alphabet sigma;
        try {
            sigma = new Alphabet(alphabet, epsilon);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        if (threads != null && threads < 1) {
            throw new ParameterException(spec.commandLine(),
                "--threads must be positive: " + threads);
        }

        List<String> tokens = new ArrayList<String>();
        if (positional != null) {
            tokens.addAll(positional);
        }
        if (tokens.size() < 2) {
            try {
                tokens.addAll(readTokens(2 - tokens.size()));
            } catch (IOException e) {
                err.println("cannot read input: " + e.getMessage());
                err.flush();
                return EXIT_IO;
            }
        }
        String expr = tokens.size() > 0 ? tokens.get(0) : "";
        String word = tokens.size() > 1 ? tokens.get(1) : "";

        int flags = (exhaustive ? LongestSubstringSolver.EXHAUSTIVE : 0)
                | (boundedStar ? LongestSubstringSolver.BOUNDED_STAR : 0);
        try {
            Expression expression = Expression.parse(expr, sigma);
            LongestSubstringSolver solver = threads == null
                    ? new LongestSubstringSolver(expression, flags)
                    : new LongestSubstringSolver(expression, flags, threads);
            out.println(solver.solve(word));
            out.flush();
            return 0;
        } catch (SyntaxException e) {
            err.println(e.getMessage());
            err.flush();
            return EXIT_REJECTED;
        }
    }

    /*
     * up to max whitespace delimited tokens; fewer at end of input
     */
    private List<String> readTokens(int max) throws IOException {
        InputStream is = input != null ? new FileInputStream(input) : stdin;
        List<String> ret = new ArrayList<String>(max);
        Reader r = new InputStreamReader(is, Charset.defaultCharset());
        try {
            StringBuilder sb = new StringBuilder();
            int c;
            while (ret.size() < max && (c = r.read()) != -1) {
                if (Character.isWhitespace(c)) {
                    if (sb.length() > 0) {
                        ret.add(sb.toString());
                        Misc.clear(sb);
                    }
                } else {
                    sb.append((char) c);
                }
            }
            if (ret.size() < max && sb.length() > 0) {
                ret.add(sb.toString());
            }
        } finally {
            if (input != null) {
                r.close();
            }
        }
        return ret;
    }

    private static void verbose() {
        Logger logger = Logger.getLogger("org.subrx.regex");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
        logger.setLevel(Level.FINE);
    }
}
