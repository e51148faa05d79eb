package com.symdiff.test;

import com.symdiff.expression.Constant;
import com.symdiff.expression.Variable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common base for symdiff tests.
 *
 * <p>Provides the usual variables and a constant shorthand, and logs the
 * name of each test as it starts.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected static final Variable X = Variable.of("x");
    protected static final Variable Y = Variable.of("y");

    @BeforeEach
    void logTestName(TestInfo testInfo) {
        logger.debug("Running {}", testInfo.getDisplayName());
    }

    protected static Constant c(double value) {
        return Constant.of(value);
    }
}
