package com.symdiff.generator;

import com.symdiff.expression.Expression;
import com.symdiff.expression.Power;
import com.symdiff.test.TestBase;
import com.symdiff.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExpressionWriter Tests")
public class ExpressionWriterTest extends TestBase {

    private final Expression cube = Power.create(X, c(3));

    @Test
    @DisplayName("write appends the rendering")
    void testWrite() {
        StringBuilder sb = new StringBuilder("f = ");

        ExpressionWriter.write(cube, sb);

        assertThat(sb.toString()).isEqualTo("f = (x ^ 3)");
    }

    @Test
    @DisplayName("writeDerivative emits one tab-separated line")
    void testWriteDerivative() {
        StringBuilder sb = new StringBuilder();

        ExpressionWriter.writeDerivative(cube, cube.diff(X), sb);

        assertThat(sb.toString()).isEqualTo("(x ^ 3)\t:\t(3 * (x ^ 2))\n");
        assertThat(ExpressionWriter.formatDerivative(cube, cube.diff(X)))
            .isEqualTo("(x ^ 3)\t:\t(3 * (x ^ 2))");
    }

    @Test
    @DisplayName("writeDerivative works with a PrintStream")
    void testPrintStream() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        ExpressionWriter.writeDerivative(X, X.diff(X), out);
        out.flush();

        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("x\t:\t1\n");
    }

    @Test
    @DisplayName("I/O failures surface as UncheckedIOException")
    void testIOFailure() {
        Appendable broken = new Appendable() {
            @Override
            public Appendable append(CharSequence csq) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public Appendable append(CharSequence csq, int start, int end) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public Appendable append(char c) throws IOException {
                throw new IOException("disk full");
            }
        };

        assertThatThrownBy(() -> ExpressionWriter.write(cube, broken))
            .isInstanceOf(UncheckedIOException.class)
            .hasRootCauseMessage("disk full");
    }
}
