package com.symdiff.exception;

import com.symdiff.expression.Expression;

/**
 * Thrown when a quotient is created with the constant 0 as its divisor.
 *
 * @see com.symdiff.expression.Quotient#create(Expression, Expression)
 */
public class DivisionByZeroException extends SymbolicMathException {

    /**
     * Creates the exception.
     *
     * @param dividend the dividend that was to be divided by zero
     */
    public DivisionByZeroException(Expression dividend) {
        super("math error: attempted to divide by zero", dividend);
    }

    /**
     * Returns the dividend of the rejected quotient.
     *
     * @return the dividend
     */
    public Expression getDividend() {
        return getFailedExpression();
    }

    @Override
    public String getUserMessage() {
        String dividend = getDividend() != null ? getDividend().render() : "an expression";
        return "Cannot divide " + dividend + " by the constant 0.";
    }
}
