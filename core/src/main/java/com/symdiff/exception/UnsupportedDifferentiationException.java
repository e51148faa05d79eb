package com.symdiff.exception;

import com.symdiff.expression.Expression;
import com.symdiff.expression.Variable;

/**
 * Thrown when the differentiation engine has no rule for an expression shape.
 *
 * <p>The engine differentiates {@code b ^ e} only when exactly one of base
 * and exponent is a constant. A power of two constants or of two
 * non-constant operands fails with this exception.
 */
public class UnsupportedDifferentiationException extends SymbolicMathException {

    private final Variable variable;

    /**
     * Creates the exception.
     *
     * @param expression the expression that could not be differentiated
     * @param variable the variable of differentiation
     * @param reason why no rule applies
     */
    public UnsupportedDifferentiationException(Expression expression, Variable variable, String reason) {
        super("Cannot differentiate " + expression.render() + " with respect to " +
              variable.name() + ": " + reason, expression);
        this.variable = variable;
    }

    /**
     * Returns the variable of differentiation.
     *
     * @return the variable
     */
    public Variable getVariable() {
        return variable;
    }

    @Override
    public String getUserMessage() {
        return "Differentiation of " + getFailedExpression().render() + " is not supported. " +
               "Powers can be differentiated only when exactly one of base and exponent is a constant.";
    }
}
