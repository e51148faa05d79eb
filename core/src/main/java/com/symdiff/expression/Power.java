package com.symdiff.expression;

import java.util.Objects;

/**
 * Expression representing exponentiation: {@code base ^ exponent}.
 *
 * <p>Simplification only applies to a non-constant base; a power of two
 * constants such as {@code 5 ^ 0} is kept as written.
 */
public final class Power extends BinaryOperation {

    private Power(Expression base, Expression exponent) {
        super(base, Operator.POWER, exponent);
    }

    /**
     * Creates a power.
     *
     * <pre>
     *   a ^ 0  -&gt; 1    (a not constant)
     *   a ^ 1  -&gt; a    (a not constant)
     * </pre>
     *
     * @param base the base
     * @param exponent the exponent
     * @return the simplified expression
     */
    public static Expression create(Expression base, Expression exponent) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(exponent, "exponent must not be null");

        if (!base.isConstant()) {
            if (ExpressionUtils.isConstantValue(exponent, 0)) {
                return Constant.of(1);
            }
            if (ExpressionUtils.isConstantValue(exponent, 1)) {
                return base;
            }
        }
        return new Power(base, exponent);
    }

    /**
     * Returns the base (the left operand).
     *
     * @return the base expression
     */
    public Expression base() {
        return left();
    }

    /**
     * Returns the exponent (the right operand).
     *
     * @return the exponent expression
     */
    public Expression exponent() {
        return right();
    }
}
