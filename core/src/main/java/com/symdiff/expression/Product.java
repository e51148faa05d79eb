package com.symdiff.expression;

import java.util.Objects;

/**
 * Expression representing multiplication: {@code left * right}.
 */
public final class Product extends BinaryOperation {

    private Product(Expression left, Expression right) {
        super(left, Operator.MULTIPLY, right);
    }

    /**
     * Creates a product, simplifying the annihilator 0 and the identity 1.
     *
     * <pre>
     *   0 * a  -&gt; 0
     *   a * 0  -&gt; 0
     *   1 * a  -&gt; a
     *   a * 1  -&gt; a
     * </pre>
     *
     * <p>Zero is checked on both sides before the identity, so {@code 1 * 0}
     * yields a fresh {@code 0}.
     *
     * @param left the left factor
     * @param right the right factor
     * @return the simplified expression
     */
    public static Expression create(Expression left, Expression right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");

        if (ExpressionUtils.isConstantValue(left, 0) || ExpressionUtils.isConstantValue(right, 0)) {
            return Constant.of(0);
        }
        if (ExpressionUtils.isConstantValue(left, 1)) {
            return right;
        }
        if (ExpressionUtils.isConstantValue(right, 1)) {
            return left;
        }
        return new Product(left, right);
    }
}
