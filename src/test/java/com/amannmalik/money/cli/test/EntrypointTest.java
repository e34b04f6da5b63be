package com.amannmalik.money.cli.test;

import com.amannmalik.money.cli.Entrypoint;
import com.amannmalik.money.decimal.DecimalContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.*;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class EntrypointTest {
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private CommandLine configureTestCommandLine() {
        var commandLine = Entrypoint.commandLine();
        commandLine.setOut(new PrintWriter(stdout, true, StandardCharsets.UTF_8));
        commandLine.setErr(new PrintWriter(stderr, true, StandardCharsets.UTF_8));
        return commandLine;
    }

    private int run(String... args) {
        return configureTestCommandLine().execute(args);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8).trim();
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @AfterEach
    void restoreDefaultScale() {
        DecimalContext.reset();
    }

    @Test
    void helpOptionIsAvailable() {
        assertEquals(0, run("--help"));
        assertTrue(out().contains("Usage: money"));
    }

    @Test
    void versionOptionUsesManifestVersionOrFallback() {
        assertEquals(0, run("--version"));
        assertTrue(out().toLowerCase().contains("money"));
    }

    @Test
    void sumPrintsTransferRecord() {
        assertEquals(0, run("sum", "--currency", "USD", "1.10", "2.20", "0.003"));
        assertEquals("{\"amount\":\"3.303\",\"currency\":\"USD\"}", out());
    }

    @Test
    void minAndMax() {
        assertEquals(0, run("min", "--currency", "EUR", "3", "1.5", "2"));
        assertTrue(out().contains("\"amount\":\"1.5\""));
        stdout.reset();
        assertEquals(0, run("max", "--currency", "EUR", "3", "1.5", "2"));
        assertTrue(out().contains("\"amount\":\"3\""));
    }

    @Test
    void sumRequiresAmounts() {
        assertEquals(2, run("sum", "--currency", "USD"));
    }

    @Test
    void unknownCurrencyIsReported() {
        assertEquals(1, run("sum", "--currency", "XXX", "1"));
        assertTrue(err().contains("error: Invalid currency code: XXX"));
    }

    @Test
    void invalidAmountIsReported() {
        assertEquals(1, run("to-cents", "--currency", "USD", "12,50"));
        assertTrue(err().contains("error: Invalid decimal string format"));
    }

    @Test
    void roundDividesWithExplicitScale() {
        assertEquals(0, run("round", "--currency", "USD", "--scale", "2", "--divide", "3", "10"));
        assertEquals("{\"amount\":\"3.33\",\"currency\":\"USD\"}", out());
    }

    @Test
    void roundMultipliesHalfAwayFromZero() {
        assertEquals(0, run("round", "--currency", "USD", "--scale", "2", "--multiply", "1.045", "100"));
        assertTrue(out().contains("\"amount\":\"104.5\""));
    }

    @Test
    void roundReportsDivisionByZero() {
        assertEquals(1, run("round", "--currency", "USD", "--scale", "2", "--divide", "0", "10"));
        assertTrue(err().contains("error: Division by zero"));
    }

    @Test
    void roundRejectsMultiplyWithDivide() {
        assertEquals(2, run("round", "--currency", "USD", "--multiply", "2", "--divide", "2", "10"));
    }

    @Test
    void defaultScaleAppliesWhenScaleIsOmitted() {
        assertEquals(0, run("--default-scale", "4", "round", "--currency", "USD", "--divide", "3", "1"));
        assertEquals("{\"amount\":\"0.3333\",\"currency\":\"USD\"}", out());
        assertEquals(4, DecimalContext.current().defaultScale());
    }

    @Test
    void centsConversions() {
        assertEquals(0, run("to-cents", "--currency", "USD", "100.125"));
        assertEquals("10013", out());
        stdout.reset();
        assertEquals(0, run("from-cents", "--currency", "EUR", "10050"));
        assertEquals("{\"amount\":\"100.5\",\"currency\":\"EUR\"}", out());
    }
}
