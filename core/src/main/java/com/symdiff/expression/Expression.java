package com.symdiff.expression;

import com.symdiff.derivative.Differentiator;

/**
 * Base interface for all nodes of an algebraic expression tree.
 *
 * <p>Expressions represent formulas built from:
 * <ul>
 *   <li>Constants (numeric literals such as 5, 0.5, e)</li>
 *   <li>Variables (symbolic names such as x, y, rate)</li>
 *   <li>Arithmetic operations (a + b, a - b, a * b, a / b, a ^ b)</li>
 *   <li>The natural logarithm, ln(a)</li>
 * </ul>
 *
 * <p>The hierarchy is closed: every implementation is one of the permitted
 * classes below and all of them are {@code final} (binary kinds extend the
 * sealed {@link BinaryOperation}). Composite nodes are only obtained through
 * their static {@code create} factories, which simplify identities and
 * annihilators before allocating a node.
 *
 * <p>Expressions are immutable. A subtree may be referenced from several
 * parents (a derivative reuses the original operands), so no code may assume
 * a node has exactly one parent.
 */
public sealed interface Expression
        permits Constant, Variable, BinaryOperation, NaturalLog {

    /**
     * Returns whether this node is a numeric {@link Constant}.
     *
     * @return true for constants, false for every other kind
     */
    boolean isConstant();

    /**
     * Renders this expression in fully parenthesized infix form.
     *
     * <p>Composite operations render as {@code (A op B)}, the natural
     * logarithm as {@code ln(A)}, variables as their name and constants as
     * a locale-independent decimal literal.
     *
     * @return the textual form
     */
    String render();

    /**
     * Differentiates this expression using the standard engine.
     *
     * @param withRespectTo the variable to differentiate with respect to
     * @return the simplified derivative
     * @see Differentiator#differentiate(Expression, Variable)
     */
    default Expression diff(Variable withRespectTo) {
        return Differentiator.standard().differentiate(this, withRespectTo);
    }
}
