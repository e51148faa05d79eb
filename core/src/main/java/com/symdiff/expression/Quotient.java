package com.symdiff.expression;

import com.symdiff.exception.DivisionByZeroException;
import java.util.Objects;

/**
 * Expression representing division: {@code left / right}.
 *
 * <p>A quotient never holds the constant 0 as its divisor; the factory
 * rejects it before anything is allocated.
 */
public final class Quotient extends BinaryOperation {

    private Quotient(Expression left, Expression right) {
        super(left, Operator.DIVIDE, right);
    }

    /**
     * Creates a quotient.
     *
     * <pre>
     *   a / 0  -&gt; DivisionByZeroException
     *   a / 1  -&gt; a
     *   0 / a  -&gt; 0
     * </pre>
     *
     * @param left the dividend
     * @param right the divisor
     * @return the simplified expression
     * @throws DivisionByZeroException if the divisor is the constant 0
     */
    public static Expression create(Expression left, Expression right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");

        if (ExpressionUtils.isConstantValue(right, 0)) {
            throw new DivisionByZeroException(left);
        }
        if (ExpressionUtils.isConstantValue(right, 1)) {
            return left;
        }
        if (ExpressionUtils.isConstantValue(left, 0)) {
            return Constant.of(0);
        }
        return new Quotient(left, right);
    }
}
