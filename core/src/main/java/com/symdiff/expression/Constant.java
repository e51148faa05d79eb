package com.symdiff.expression;

import java.math.BigDecimal;

/**
 * Expression representing a numeric constant.
 *
 * <p>Examples:
 * <pre>
 *   0          -- additive identity, annihilates products
 *   1          -- multiplicative identity
 *   69         -- rendered without a fractional part
 *   0.25       -- rendered in shortest round-trip form
 *   {@link #E} -- Euler's number, recognised by {@link #isConstE()}
 * </pre>
 */
public final class Constant implements Expression {

    /** Euler's number. */
    public static final double E = 2.718281828459045;

    /** Absolute tolerance used when comparing a value against {@link #E}. */
    public static final double E_TOLERANCE = 1e-10;

    // Integral values below this magnitude render as plain integers
    private static final double INTEGRAL_RENDER_LIMIT = 1e15;

    private final double value;

    private Constant(double value) {
        this.value = value;
    }

    /**
     * Creates a constant.
     *
     * @param value the numeric value
     * @return the constant expression
     */
    public static Constant of(double value) {
        return new Constant(value);
    }

    /**
     * Creates the constant {@link #E}.
     *
     * @return a constant holding Euler's number
     */
    public static Constant e() {
        return new Constant(E);
    }

    /**
     * Returns the numeric value.
     *
     * @return the value
     */
    public double value() {
        return value;
    }

    /**
     * Returns whether this constant is Euler's number within {@link #E_TOLERANCE}.
     *
     * @return true if the value is e
     */
    public boolean isConstE() {
        return Math.abs(value - E) < E_TOLERANCE;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public String render() {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < INTEGRAL_RENDER_LIMIT) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        Constant that = (Constant) obj;
        return Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }
}
