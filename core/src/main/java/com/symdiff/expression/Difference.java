package com.symdiff.expression;

import java.util.Objects;

/**
 * Expression representing subtraction: {@code left - right}.
 *
 * <p>Only a zero subtrahend is simplified; {@code x - x} is kept as is.
 */
public final class Difference extends BinaryOperation {

    private Difference(Expression left, Expression right) {
        super(left, Operator.SUBTRACT, right);
    }

    /**
     * Creates a difference.
     *
     * <pre>
     *   a - 0  -&gt; a
     * </pre>
     *
     * @param left the minuend
     * @param right the subtrahend
     * @return the simplified expression
     */
    public static Expression create(Expression left, Expression right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");

        if (ExpressionUtils.isConstantValue(right, 0)) {
            return left;
        }
        return new Difference(left, right);
    }
}
