package com.symdiff.derivative;

import com.symdiff.exception.UnsupportedDifferentiationException;
import com.symdiff.expression.Constant;
import com.symdiff.expression.Difference;
import com.symdiff.expression.Expression;
import com.symdiff.expression.ExpressionUtils;
import com.symdiff.expression.NaturalLog;
import com.symdiff.expression.Power;
import com.symdiff.expression.Product;
import com.symdiff.expression.Quotient;
import com.symdiff.expression.Sum;
import com.symdiff.expression.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Symbolic differentiation engine.
 *
 * <p>Walks an expression tree and builds its derivative with respect to one
 * variable. Every intermediate node is created through the smart
 * constructors, so the returned derivative is already simplified.
 *
 * <p>Rules per node kind:
 * <pre>
 *   c'          = 0
 *   x'          = 1 (0 for any other variable)
 *   (a + b)'    = a' + b'
 *   (a - b)'    = a' - b'                       (LEGACY: a' + b')
 *   (u * v)'    = u * v' + u' * v
 *   (u / v)'    = (u' * v - u * v') / v ^ 2     (LEGACY: (u * v' - v' * u) / v ^ 2)
 *   (b ^ c)'    = c * b ^ (c - 1) * b'          (c constant)
 *   (c ^ e)'    = c ^ e * ln(c) * e'            (c constant)
 *   ln(v)'      = 1 / v * v'
 * </pre>
 * When both operands of a sum or difference differentiate to constants the
 * result is folded into a single constant.
 *
 * <p>Instances are immutable and may be shared between threads.
 *
 * @see DifferentiationMode
 */
public final class Differentiator {

    private static final Logger logger = LoggerFactory.getLogger(Differentiator.class);

    private static final Differentiator STANDARD = new Differentiator(DifferentiationMode.STANDARD);
    private static final Differentiator LEGACY = new Differentiator(DifferentiationMode.LEGACY);

    private final DifferentiationMode mode;

    /**
     * Creates a differentiator.
     *
     * @param mode the rule set to apply
     */
    public Differentiator(DifferentiationMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    /**
     * Returns the shared engine using {@link DifferentiationMode#STANDARD} rules.
     *
     * @return the standard differentiator
     */
    public static Differentiator standard() {
        return STANDARD;
    }

    /**
     * Returns the shared engine using {@link DifferentiationMode#LEGACY} rules.
     *
     * @return the legacy differentiator
     */
    public static Differentiator legacy() {
        return LEGACY;
    }

    /**
     * Returns the shared engine for the given mode.
     *
     * @param mode the rule set
     * @return the differentiator
     */
    public static Differentiator forMode(DifferentiationMode mode) {
        return mode == DifferentiationMode.LEGACY ? LEGACY : STANDARD;
    }

    public DifferentiationMode mode() {
        return mode;
    }

    /**
     * Differentiates an expression.
     *
     * @param expr the expression to differentiate
     * @param withRespectTo the variable of differentiation
     * @return the simplified derivative
     * @throws UnsupportedDifferentiationException if a power has no applicable rule
     * @throws com.symdiff.exception.DivisionByZeroException if a derivative requires dividing by 0
     */
    public Expression differentiate(Expression expr, Variable withRespectTo) {
        Objects.requireNonNull(expr, "expr must not be null");
        Objects.requireNonNull(withRespectTo, "withRespectTo must not be null");

        logger.debug("Differentiating {} with respect to {} ({} mode)",
            expr.render(), withRespectTo.name(), mode);

        Expression result = diff(expr, withRespectTo);

        logger.debug("Derivative has {} nodes: {}", ExpressionUtils.nodeCount(result), result.render());
        return result;
    }

    private Expression diff(Expression expr, Variable v) {
        if (expr instanceof Constant) {
            return Constant.of(0);
        }
        if (expr instanceof Variable var) {
            // An unrelated variable is independent of v
            return Constant.of(var.isSameVariable(v) ? 1 : 0);
        }
        if (expr instanceof NaturalLog ln) {
            return diffNaturalLog(ln, v);
        }
        if (expr instanceof Sum sum) {
            return diffSum(sum, v);
        }
        if (expr instanceof Difference difference) {
            return diffDifference(difference, v);
        }
        if (expr instanceof Product product) {
            return diffProduct(product, v);
        }
        if (expr instanceof Quotient quotient) {
            return diffQuotient(quotient, v);
        }
        if (expr instanceof Power power) {
            return diffPower(power, v);
        }
        throw new UnsupportedDifferentiationException(expr, v,
            "unknown expression type " + expr.getClass().getSimpleName());
    }

    private Expression diffSum(Sum sum, Variable v) {
        Expression left = diff(sum.left(), v);
        Expression right = diff(sum.right(), v);

        if (left.isConstant() && right.isConstant()) {
            return Constant.of(ExpressionUtils.constantValue(left) + ExpressionUtils.constantValue(right));
        }
        return Sum.create(left, right);
    }

    private Expression diffDifference(Difference difference, Variable v) {
        Expression left = diff(difference.left(), v);
        Expression right = diff(difference.right(), v);

        if (left.isConstant() && right.isConstant()) {
            return Constant.of(ExpressionUtils.constantValue(left) - ExpressionUtils.constantValue(right));
        }
        if (mode == DifferentiationMode.LEGACY) {
            return Sum.create(left, right);
        }
        return Difference.create(left, right);
    }

    private Expression diffProduct(Product product, Variable v) {
        Expression u = product.left();
        Expression w = product.right();
        Expression du = diff(u, v);
        Expression dw = diff(w, v);

        return Sum.create(Product.create(u, dw), Product.create(du, w));
    }

    private Expression diffQuotient(Quotient quotient, Variable v) {
        Expression u = quotient.left();
        Expression w = quotient.right();
        Expression du = diff(u, v);
        Expression dw = diff(w, v);

        Expression numerator;
        if (mode == DifferentiationMode.LEGACY) {
            numerator = Difference.create(Product.create(u, dw), Product.create(dw, u));
        } else {
            numerator = Difference.create(Product.create(du, w), Product.create(u, dw));
        }
        return Quotient.create(numerator, Power.create(w, Constant.of(2)));
    }

    private Expression diffPower(Power power, Variable v) {
        Expression base = power.base();
        Expression exponent = power.exponent();

        if (!base.isConstant() && exponent.isConstant()) {
            double c = ExpressionUtils.constantValue(exponent);
            Expression reduced = Power.create(base, Constant.of(c - 1));
            return Product.create(Product.create(exponent, reduced), diff(base, v));
        }
        if (base.isConstant() && !exponent.isConstant()) {
            return Product.create(
                Product.create(Power.create(base, exponent), NaturalLog.create(base)),
                diff(exponent, v));
        }

        String reason = base.isConstant()
            ? "base and exponent are both constant"
            : "base and exponent are both non-constant";
        throw new UnsupportedDifferentiationException(power, v, reason);
    }

    private Expression diffNaturalLog(NaturalLog ln, Variable v) {
        Expression argument = ln.argument();
        return Product.create(Quotient.create(Constant.of(1), argument), diff(argument, v));
    }

    @Override
    public String toString() {
        return "Differentiator(" + mode + ")";
    }
}
