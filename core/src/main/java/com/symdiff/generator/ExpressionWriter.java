package com.symdiff.generator;

import com.symdiff.expression.Expression;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Writes expression renderings to an output stream.
 *
 * <p>A derivative line has the form:
 * <pre>
 *   f&lt;TAB&gt;:&lt;TAB&gt;f'
 * </pre>
 * for example {@code (5 ^ (69 * x))	:	(((5 ^ (69 * x)) * ln(5)) * 69)}.
 */
public final class ExpressionWriter {

    /** Separator placed between an expression and its derivative. */
    public static final String DERIVATIVE_SEPARATOR = "\t:\t";

    private ExpressionWriter() {}

    /**
     * Appends the rendering of an expression.
     *
     * @param expr the expression
     * @param out the destination
     * @throws UncheckedIOException if the destination fails
     */
    public static void write(Expression expr, Appendable out) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(out, "out must not be null");
        try {
            out.append(expr.render());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write expression", e);
        }
    }

    /**
     * Appends one line holding an expression and its derivative.
     *
     * @param expr the original expression
     * @param derivative its derivative
     * @param out the destination
     * @throws UncheckedIOException if the destination fails
     */
    public static void writeDerivative(Expression expr, Expression derivative, Appendable out) {
        Objects.requireNonNull(derivative, "derivative must not be null");
        write(expr, out);
        try {
            out.append(DERIVATIVE_SEPARATOR);
            out.append(derivative.render());
            out.append('\n');
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write derivative", e);
        }
    }

    /**
     * Formats one derivative line without the trailing newline.
     *
     * @param expr the original expression
     * @param derivative its derivative
     * @return the formatted line
     */
    public static String formatDerivative(Expression expr, Expression derivative) {
        return expr.render() + DERIVATIVE_SEPARATOR + derivative.render();
    }
}
