package com.symdiff.cli;

import com.symdiff.derivative.DifferentiationMode;
import com.symdiff.derivative.Differentiator;
import com.symdiff.exception.SymbolicMathException;
import com.symdiff.expression.Expression;
import com.symdiff.generator.ExpressionWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Command-line driver that differentiates the built-in example expressions.
 *
 * <p>Each example is printed next to its derivative with respect to {@code x}:
 * <pre>
 * ((5 * (x ^ 69)) + (5 * (x ^ 420)))	:	((5 * (69 * (x ^ 68))) + (5 * (420 * (x ^ 419))))
 * </pre>
 *
 * <p>Usage examples:
 * <pre>
 * # Differentiate with the standard rules
 * java -cp symdiff-cli.jar com.symdiff.cli.DerivativeCommandLine
 *
 * # Reproduce the historical difference/quotient behaviour
 * java -cp symdiff-cli.jar com.symdiff.cli.DerivativeCommandLine --mode legacy
 * </pre>
 */
public class DerivativeCommandLine {

    private static final Logger logger = LoggerFactory.getLogger(DerivativeCommandLine.class);

    private static final String USAGE =
        "symdiff example driver\n\n" +
        "Usage: java -cp symdiff-cli.jar com.symdiff.cli.DerivativeCommandLine [OPTIONS]\n\n" +
        "Options:\n" +
        "  --mode MODE     Differentiation rules: standard (default) or legacy\n" +
        "  --help          Show this help message\n\n" +
        "The default mode can also be set with -D" + DifferentiationMode.SYSTEM_PROPERTY + "=legacy\n";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the driver.
     *
     * @param args command-line arguments
     * @param out destination for derivative lines
     * @param err destination for usage and error messages
     * @return the process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineArgs parsedArgs;
        DifferentiationMode mode;
        try {
            parsedArgs = parseArguments(args);
            if (parsedArgs.help) {
                out.println(USAGE);
                return 0;
            }
            mode = parsedArgs.mode != null
                ? DifferentiationMode.parse(parsedArgs.mode)
                : DifferentiationMode.fromSystemProperty();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage() + "\n");
            err.println(USAGE);
            return 1;
        }

        logger.info("Differentiating {} example expressions in {} mode",
            ExampleExpressions.all().size(), mode);

        Differentiator differentiator = Differentiator.forMode(mode);
        try {
            for (Expression expr : ExampleExpressions.all()) {
                Expression derivative = differentiator.differentiate(expr, ExampleExpressions.X);
                ExpressionWriter.writeDerivative(expr, derivative, out);
            }
        } catch (SymbolicMathException e) {
            logger.error("Differentiation failed", e);
            err.println("Error: " + e.getUserMessage());
            return 1;
        }
        out.flush();
        return 0;
    }

    /**
     * Parses command-line arguments.
     */
    private static CommandLineArgs parseArguments(String[] args) {
        CommandLineArgs result = new CommandLineArgs();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--mode":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--mode requires a value");
                    }
                    result.mode = args[++i];
                    break;
                case "--help":
                case "-h":
                    result.help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return result;
    }

    /**
     * Holder for parsed command-line arguments.
     */
    private static class CommandLineArgs {
        String mode;
        boolean help;
    }
}
