package com.symdiff.exception;

import com.symdiff.expression.Expression;

/**
 * Base exception for failures while constructing or differentiating expressions.
 *
 * <p>These failures are structural, not transient: retrying the same call
 * fails the same way. Callers that want to degrade gracefully catch this
 * type at the construction or differentiation call site.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Expression derivative = differentiator.differentiate(f, x);
 *   } catch (SymbolicMathException e) {
 *       System.err.println(e.getUserMessage());
 *   }
 * </pre>
 *
 * @see DivisionByZeroException
 * @see LogOfZeroException
 * @see UnsupportedDifferentiationException
 */
public abstract class SymbolicMathException extends RuntimeException {

    private final Expression failedExpression;

    /**
     * Creates an exception.
     *
     * @param message the error message
     * @param failedExpression the expression involved in the failure, or null
     */
    protected SymbolicMathException(String message, Expression failedExpression) {
        super(message);
        this.failedExpression = failedExpression;
    }

    /**
     * Returns the expression involved in the failure.
     *
     * @return the expression, or null if not available
     */
    public Expression getFailedExpression() {
        return failedExpression;
    }

    /**
     * Returns a short explanation suitable for end users.
     *
     * @return user-friendly error message
     */
    public abstract String getUserMessage();

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedExpression != null) {
            sb.append("Expression Type: ").append(failedExpression.getClass().getSimpleName()).append("\n");
            sb.append("Expression: ").append(failedExpression.render()).append("\n");
        }

        return sb.toString();
    }
}
