package com.symdiff.expression;

import java.util.Objects;

/**
 * Expression representing addition: {@code left + right}.
 *
 * <p>{@link #create(Expression, Expression)} drops a zero operand on either side.
 */
public final class Sum extends BinaryOperation {

    private Sum(Expression left, Expression right) {
        super(left, Operator.ADD, right);
    }

    /**
     * Creates a sum, simplifying additive identities.
     *
     * <pre>
     *   0 + a  -&gt; a
     *   a + 0  -&gt; a
     * </pre>
     *
     * @param left the left operand
     * @param right the right operand
     * @return the simplified expression
     */
    public static Expression create(Expression left, Expression right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");

        if (ExpressionUtils.isConstantValue(left, 0)) {
            return right;
        }
        if (ExpressionUtils.isConstantValue(right, 0)) {
            return left;
        }
        return new Sum(left, right);
    }
}
