package com.symdiff.expression;

import com.symdiff.exception.LogOfZeroException;
import java.util.Objects;

/**
 * Expression representing the natural logarithm: {@code ln(argument)}.
 *
 * <p>The argument is never the constant 0.
 */
public final class NaturalLog implements Expression {

    private final Expression argument;

    private NaturalLog(Expression argument) {
        this.argument = argument;
    }

    /**
     * Creates a natural logarithm.
     *
     * <pre>
     *   ln(0)  -&gt; LogOfZeroException
     *   ln(e)  -&gt; 1
     * </pre>
     *
     * @param argument the argument
     * @return the simplified expression
     * @throws LogOfZeroException if the argument is the constant 0
     */
    public static Expression create(Expression argument) {
        Objects.requireNonNull(argument, "argument must not be null");

        if (argument instanceof Constant c) {
            if (c.value() == 0) {
                throw new LogOfZeroException();
            }
            if (c.isConstE()) {
                return Constant.of(1);
            }
        }
        return new NaturalLog(argument);
    }

    /**
     * Returns the argument.
     *
     * @return the argument expression
     */
    public Expression argument() {
        return argument;
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public String render() {
        return String.format("ln(%s)", argument.render());
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NaturalLog)) return false;
        NaturalLog that = (NaturalLog) obj;
        return Objects.equals(argument, that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash("ln", argument);
    }
}
