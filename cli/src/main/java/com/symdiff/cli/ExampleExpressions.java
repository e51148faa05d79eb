package com.symdiff.cli;

import com.symdiff.expression.Constant;
import com.symdiff.expression.Expression;
import com.symdiff.expression.Power;
import com.symdiff.expression.Product;
import com.symdiff.expression.Sum;
import com.symdiff.expression.Variable;

import java.util.List;

/**
 * The built-in example expressions differentiated by {@link DerivativeCommandLine}.
 *
 * <pre>
 *   polynomial   5 * x^69 + 5 * x^420
 *   exponential  5 ^ (69 * x)
 *   natural      e ^ (69 * x)
 * </pre>
 */
public final class ExampleExpressions {

    /** The variable every example is written in. */
    public static final Variable X = Variable.of("x");

    private ExampleExpressions() {}

    public static Expression polynomial() {
        Constant five = Constant.of(5);
        return Sum.create(
            Product.create(five, Power.create(X, Constant.of(69))),
            Product.create(five, Power.create(X, Constant.of(420))));
    }

    public static Expression exponential() {
        return Power.create(Constant.of(5), Product.create(Constant.of(69), X));
    }

    public static Expression naturalExponential() {
        return Power.create(Constant.e(), Product.create(Constant.of(69), X));
    }

    /**
     * Returns all examples in display order.
     *
     * @return the example expressions
     */
    public static List<Expression> all() {
        return List.of(polynomial(), exponential(), naturalExponential());
    }
}
