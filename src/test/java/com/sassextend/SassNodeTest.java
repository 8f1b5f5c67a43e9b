package com.sassextend;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class SassNodeTest {

    private record Run(int exitCode, String out, String err) {}

    private Run run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cmd = SassNode.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        int exitCode = cmd.execute(args);
        return new Run(exitCode, out.toString().strip(), err.toString().strip());
    }

    @Test
    public void testPrintsNodeTree() {
        Run run = run(".a > .b .c");
        assertEquals(0, run.exitCode());
        assertEquals("[.a, >, .b, ' ', .c]", run.out());
    }

    @Test
    public void testPrintsOneTreePerSelector() {
        Run run = run("-j", ".a, ~ .b");
        assertEquals(0, run.exitCode());
        assertEquals("[{\"selector\":\".a\"}]" + System.lineSeparator()
                + "[{\"combinator\":\"~\"},{\"selector\":\".b\"}]", run.out());
    }

    @Test
    public void testPrettyText() {
        Run run = run("--pretty", ".a + .b");
        assertEquals(0, run.exitCode());
        assertEquals(5, run.out().lines().count());
    }

    @Test
    public void testReverse() {
        Run run = run("-r", "[{\"selector\":\".a\"},{\"combinator\":\">\"},{\"selector\":\"li:hover\"}]");
        assertEquals(0, run.exitCode());
        assertEquals(".a > li:hover", run.out());
    }

    @Test
    public void testContains() {
        assertEquals("false", run(".a.b > .c, .d", "--contains", ".b.a > .c").out());
        assertEquals("true", run(".a.b > .c, .d", "--contains", ".b.a > .c", "--ignore-order").out());
        assertEquals("false", run(".a.b > .c, .d", "--contains", ".b.a .c", "--ignore-order").out());
        assertEquals("true", run(".a.b > .c, .d", "--contains", ".d").out());
    }

    @Test
    public void testPrettyJson() {
        Run run = run("-j", "-p", ".a");
        assertEquals(0, run.exitCode());
        assertTrue(run.out().contains("\"selector\" : \".a\""), run.out());
    }

    @ParameterizedTest
    @MethodSource("conflictingOptions")
    public void testConflictingModesAreRejected(List<String> args) {
        Run run = run(args.toArray(new String[0]));
        assertEquals(SassNode.EXIT_USER_ERROR, run.exitCode());
        assertEquals("", run.out());
        assertFalse(run.err().isEmpty());
    }

    static Stream<List<String>> conflictingOptions() {
        return Stream.of(
                List.of("-r", "--contains", ".a", "[{\"selector\":\".a\"}]"),
                List.of("-r", "-j", "[{\"selector\":\".a\"}]"),
                List.of("--contains", ".a", "-j", ".a"),
                List.of("--contains", ".a", "--pretty", ".a"),
                List.of("--ignore-order", ".a"));
    }

    @Test
    public void testSyntaxErrorIsAUserError() {
        Run run = run(".a >");
        assertEquals(SassNode.EXIT_USER_ERROR, run.exitCode());
        assertTrue(run.err().startsWith("Error: Trailing combinator"), run.err());
    }

    @Test
    public void testInvalidJsonIsAUserError() {
        Run run = run("-r", "[{\"colour\":\"red\"}]");
        assertEquals(SassNode.EXIT_USER_ERROR, run.exitCode());
        assertTrue(run.err().startsWith("Error:"), run.err());
    }

    @Test
    public void testMalformedTreeIsAnInternalError() {
        Run run = run("-r", "[{\"selector\":\".a\"},{\"selector\":\".b\"}]");
        assertEquals(SassNode.EXIT_INTERNAL_ERROR, run.exitCode());
        assertTrue(run.err().startsWith("Internal error:"), run.err());
        assertEquals("", run.out());
    }
}
