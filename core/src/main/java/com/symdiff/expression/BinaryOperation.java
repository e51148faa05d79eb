package com.symdiff.expression;

import java.util.Objects;

/**
 * Base class for expressions with two operands.
 *
 * <p>Binary operations include:
 * <ul>
 *   <li>Sum: a + b</li>
 *   <li>Difference: a - b</li>
 *   <li>Product: a * b</li>
 *   <li>Quotient: a / b</li>
 *   <li>Power: a ^ b</li>
 * </ul>
 *
 * <p>Every binary operation renders as {@code (left op right)}. Subclasses
 * are created through their static {@code create} factories only.
 */
public abstract sealed class BinaryOperation implements Expression
        permits Sum, Difference, Product, Quotient, Power {

    /**
     * Binary operators.
     */
    public enum Operator {
        ADD("+", "addition"),
        SUBTRACT("-", "subtraction"),
        MULTIPLY("*", "multiplication"),
        DIVIDE("/", "division"),
        POWER("^", "exponentiation");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    BinaryOperation(Expression left, Operator operator, Expression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    /**
     * Returns the left operand.
     *
     * @return the left expression
     */
    public Expression left() {
        return left;
    }

    /**
     * Returns the operator.
     *
     * @return the operator
     */
    public Operator operator() {
        return operator;
    }

    /**
     * Returns the right operand.
     *
     * @return the right expression
     */
    public Expression right() {
        return right;
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public String render() {
        return String.format("(%s %s %s)", left.render(), operator.symbol(), right.render());
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryOperation)) return false;
        BinaryOperation that = (BinaryOperation) obj;
        return operator == that.operator &&
               Objects.equals(left, that.left) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }
}
