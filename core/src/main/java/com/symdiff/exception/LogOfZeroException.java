package com.symdiff.exception;

/**
 * Thrown when a natural logarithm is created with the constant 0 as its argument.
 *
 * @see com.symdiff.expression.NaturalLog#create(com.symdiff.expression.Expression)
 */
public class LogOfZeroException extends SymbolicMathException {

    public LogOfZeroException() {
        super("math error: argument of ln is zero", null);
    }

    @Override
    public String getUserMessage() {
        return "The natural logarithm of 0 is undefined.";
    }
}
