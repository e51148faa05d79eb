package com.symdiff.cli;

import com.symdiff.derivative.DifferentiationMode;
import com.symdiff.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Integration
@DisplayName("DerivativeCommandLine Tests")
class DerivativeCommandLineTest {

    private static final String[] EXPECTED_LINES = {
        "((5 * (x ^ 69)) + (5 * (x ^ 420)))\t:\t((5 * (69 * (x ^ 68))) + (5 * (420 * (x ^ 419))))",
        "(5 ^ (69 * x))\t:\t(((5 ^ (69 * x)) * ln(5)) * 69)",
        "(2.718281828459045 ^ (69 * x))\t:\t((2.718281828459045 ^ (69 * x)) * 69)"
    };

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setup() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
    }

    @AfterEach
    void clearProperty() {
        System.clearProperty(DifferentiationMode.SYSTEM_PROPERTY);
    }

    private String stdout() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Prints each example next to its derivative")
    void testDefaultRun() {
        int status = DerivativeCommandLine.run(new String[0], out, err);

        assertThat(status).isZero();
        assertThat(stdout().split("\n")).containsExactly(EXPECTED_LINES);
    }

    @Test
    @DisplayName("Legacy mode prints the same examples")
    void testLegacyMode() {
        int status = DerivativeCommandLine.run(new String[] {"--mode", "legacy"}, out, err);

        assertThat(status).isZero();
        assertThat(stdout().split("\n")).containsExactly(EXPECTED_LINES);
    }

    @Test
    @DisplayName("Mode can come from the system property")
    void testSystemPropertyMode() {
        System.setProperty(DifferentiationMode.SYSTEM_PROPERTY, "legacy");

        int status = DerivativeCommandLine.run(new String[0], out, err);

        assertThat(status).isZero();
    }

    @Test
    @DisplayName("Unknown mode exits with status 1 and prints usage")
    void testUnknownMode() {
        int status = DerivativeCommandLine.run(new String[] {"--mode", "fast"}, out, err);

        assertThat(status).isEqualTo(1);
        assertThat(stderr()).contains("Unknown differentiation mode").contains("Usage:");
        assertThat(stdout()).isEmpty();
    }

    @Test
    @DisplayName("Missing option value exits with status 1")
    void testMissingValue() {
        int status = DerivativeCommandLine.run(new String[] {"--mode"}, out, err);

        assertThat(status).isEqualTo(1);
        assertThat(stderr()).contains("--mode requires a value");
    }

    @Test
    @DisplayName("Unknown option exits with status 1")
    void testUnknownOption() {
        int status = DerivativeCommandLine.run(new String[] {"--variable", "y"}, out, err);

        assertThat(status).isEqualTo(1);
        assertThat(stderr()).contains("Unknown option: --variable");
    }

    @Test
    @DisplayName("--help prints usage")
    void testHelp() {
        int status = DerivativeCommandLine.run(new String[] {"--help"}, out, err);

        assertThat(status).isZero();
        assertThat(stdout()).contains("Usage:").contains("--mode");
    }

    @Test
    @DisplayName("Examples are built through the smart constructors")
    void testExamples() {
        assertThat(ExampleExpressions.all()).hasSize(3);
        assertThat(ExampleExpressions.polynomial().render())
            .isEqualTo("((5 * (x ^ 69)) + (5 * (x ^ 420)))");
        assertThat(ExampleExpressions.exponential().render()).isEqualTo("(5 ^ (69 * x))");
        assertThat(ExampleExpressions.naturalExponential().render())
            .isEqualTo("(2.718281828459045 ^ (69 * x))");
    }
}
