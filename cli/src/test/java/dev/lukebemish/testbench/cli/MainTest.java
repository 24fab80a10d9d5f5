package dev.lukebemish.testbench.cli;

import dev.lukebemish.testbench.cli.fixtures.AllGreen;
import dev.lukebemish.testbench.cli.fixtures.Hollow;
import dev.lukebemish.testbench.cli.fixtures.OneRed;
import dev.lukebemish.testbench.framework.RunConfiguration;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {
    private static final int USAGE = CommandLine.ExitCode.USAGE;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        return Main.commandLine()
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err))
            .execute(args);
    }

    @Test
    void testPassingRun() {
        assertEquals(Main.OK, execute("run", "--select", "class:" + AllGreen.class.getName()));
        var text = out.toString();
        assertTrue(text.contains("All green"));
        assertTrue(text.contains("first [OK]"));
        assertTrue(text.contains("[         2 tests successful      ]"));
    }

    @Test
    void testFailingRun() {
        assertEquals(Main.TESTS_FAILED, execute("run", "--details", "failures", "--select", "class:" + OneRed.class.getName()));
        assertTrue(out.toString().contains("=> ASSERTION: expected red to be green"));
        assertTrue(err.toString().contains("fails: failed with java.lang.AssertionError"));
    }

    @Test
    void testFilteredRun() {
        assertEquals(Main.OK, execute("run", "--details", "none", "--exclude-unit", "fails", "--select", "class:" + OneRed.class.getName()));
        assertTrue(out.toString().contains("[         1 tests found           ]"));
    }

    @Test
    void testNoTests() {
        assertEquals(Main.NO_TESTS, execute("run", "--select", "class:" + Hollow.class.getName()));
        assertTrue(err.toString().contains("No tests were found"));
        assertEquals(Main.NO_TESTS, execute("run"));
    }

    @Test
    void testDiscoveryFailure() {
        assertEquals(Main.DISCOVERY_FAILED, execute("run", "--select", "class:com.example.DoesNotExist"));
        assertTrue(err.toString().contains("Discovery failed"));
        assertEquals(Main.DISCOVERY_FAILED, execute("discover", "--select", "module:nope"));
    }

    @Test
    void testDiscoverPrintsPlanWithoutRunning() {
        assertEquals(Main.OK, execute("discover", "--select", "class:" + AllGreen.class.getName(), "--select", "class:" + OneRed.class.getName()));
        var lines = out.toString().lines().toList();
        assertEquals("Testbench [engine:testbench]", lines.get(0));
        assertEquals("  All green [engine:testbench]/[container:" + AllGreen.class.getName() + "]", lines.get(1));
        assertEquals("    first [engine:testbench]/[container:" + AllGreen.class.getName() + "]/[unit:first]", lines.get(2));
        assertTrue(lines.contains("    fails [engine:testbench]/[container:" + OneRed.class.getName() + "]/[unit:fails]"));
        assertEquals("2 containers, 4 tests", lines.get(lines.size() - 1));
    }

    @Test
    void testUsageErrors() {
        assertEquals(USAGE, execute("run", "--parallelism", "0", "--select", "class:" + AllGreen.class.getName()));
        assertEquals(USAGE, execute("run", "--timeout", "eventually"));
        assertEquals(USAGE, execute("run", "--details", "loud"));
    }

    @Test
    void testNonPositiveTimeoutIsAUsageError() {
        var green = "class:" + AllGreen.class.getName();
        assertEquals(USAGE, execute("run", "--timeout", "0", "--select", green));
        assertEquals(USAGE, execute("run", "--timeout", "-5", "--select", green));
        assertEquals(USAGE, execute("run", "--timeout", "0.0001", "--select", green));
        assertEquals(USAGE, execute("run", "--timeout", "PT-1S", "--select", green));
        assertFalse(err.toString().contains("Exception"));
        assertEquals(Main.OK, execute("run", "--timeout", "PT30S", "--select", green));
    }

    @Test
    void testInvalidSystemPropertyIsAUsageError() {
        System.setProperty(RunConfiguration.PARALLELISM, "many");
        try {
            assertEquals(USAGE, execute("run", "--select", "class:" + AllGreen.class.getName()));
            assertEquals(USAGE, execute("discover", "--select", "class:" + AllGreen.class.getName()));
        } finally {
            System.clearProperty(RunConfiguration.PARALLELISM);
        }
    }
}
