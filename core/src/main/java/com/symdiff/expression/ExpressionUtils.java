package com.symdiff.expression;

/**
 * Utility methods for classifying and inspecting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns true if the expression is a constant holding exactly the given value.
     *
     * @param expr the expression to check
     * @param value the value to compare against
     * @return true if {@code expr} is {@code Constant(value)}
     */
    public static boolean isConstantValue(Expression expr, double value) {
        return expr instanceof Constant c && c.value() == value;
    }

    /**
     * Returns the value of a constant expression.
     *
     * @param expr the expression, which must be a {@link Constant}
     * @return the constant's value
     * @throws IllegalArgumentException if the expression is not a constant
     */
    public static double constantValue(Expression expr) {
        if (expr instanceof Constant c) {
            return c.value();
        }
        throw new IllegalArgumentException("Expected a constant but got: " + expr.render());
    }

    /**
     * Returns the number of nodes in the expression tree. Shared subtrees are
     * counted once per reference.
     *
     * @param expr the expression
     * @return the node count
     */
    public static int nodeCount(Expression expr) {
        if (expr instanceof BinaryOperation bin) {
            return 1 + nodeCount(bin.left()) + nodeCount(bin.right());
        }
        if (expr instanceof NaturalLog ln) {
            return 1 + nodeCount(ln.argument());
        }
        return 1;
    }

    /**
     * Returns the depth of the expression tree; a leaf has depth 1.
     *
     * @param expr the expression
     * @return the depth
     */
    public static int depth(Expression expr) {
        if (expr instanceof BinaryOperation bin) {
            return 1 + Math.max(depth(bin.left()), depth(bin.right()));
        }
        if (expr instanceof NaturalLog ln) {
            return 1 + depth(ln.argument());
        }
        return 1;
    }

    /**
     * Returns true if the variable occurs anywhere in the expression tree.
     *
     * @param expr the expression to search
     * @param variable the variable to look for
     * @return true if a variable with the same name is present
     */
    public static boolean containsVariable(Expression expr, Variable variable) {
        if (expr instanceof Variable v) {
            return v.isSameVariable(variable);
        }
        if (expr instanceof BinaryOperation bin) {
            return containsVariable(bin.left(), variable) ||
                   containsVariable(bin.right(), variable);
        }
        if (expr instanceof NaturalLog ln) {
            return containsVariable(ln.argument(), variable);
        }
        // Constants never contain variables
        return false;
    }
}
