package io.querymesh.transpile;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

final class ScriptTranspilerTest {

    @Test
    void parsesTheEngineAnswer() throws Exception {
        assumeShell();
        ScriptTranspiler transpiler = new ScriptTranspiler("script", shell(
                "cat >/dev/null; printf '%s' '{\"converted_query\":\"SELECT 1\",\"unsupported_functions\":[\"FOO\"],"
                        + "\"tables\":[\"t\"],\"executable\":false}'"
        ), 5_000L);

        TranspileResult result = transpiler.transpile(new TranspileRequest("SELECT FOO(1) FROM t", "hive", "trino", Map.of()));
        Assertions.assertEquals("SELECT 1", result.convertedQuery());
        Assertions.assertEquals(List.of("FOO"), result.unsupportedFunctions());
        Assertions.assertEquals(List.of("t"), result.tables());
        Assertions.assertEquals(List.of(), result.udfs());
        Assertions.assertFalse(result.executable());
    }

    @Test
    void engineErrorsAreQueryLevelFailures() {
        assumeShell();
        ScriptTranspiler reportsError = new ScriptTranspiler("script", shell(
                "cat >/dev/null; printf '%s' '{\"error\":\"parse error near FROM\"}'"
        ), 5_000L);
        TranspileException parse = Assertions.assertThrows(
                TranspileException.class,
                () -> reportsError.transpile(new TranspileRequest("SELECT FROM", "hive", "trino", null))
        );
        Assertions.assertEquals("parse error near FROM", parse.getMessage());

        ScriptTranspiler exitsNonZero = new ScriptTranspiler("script", shell("cat >/dev/null; echo boom; exit 3"), 5_000L);
        TranspileException exit = Assertions.assertThrows(
                TranspileException.class,
                () -> exitsNonZero.transpile(new TranspileRequest("SELECT 1", "hive", "trino", null))
        );
        Assertions.assertTrue(exit.getMessage().contains("exit=3"));
    }

    @Test
    void answersLargerThanThePipeBufferAreReadWhileTheEngineRuns() throws Exception {
        assumeShell();
        ScriptTranspiler transpiler = new ScriptTranspiler("script", shell(
                "cat >/dev/null; printf '{\"converted_query\":\"'; head -c 200000 /dev/zero | tr '\\0' x; "
                        + "printf '\",\"executable\":true}'"
        ), 10_000L);

        TranspileResult result = transpiler.transpile(new TranspileRequest("SELECT 1", "hive", "trino", null));
        Assertions.assertEquals(200_000, result.convertedQuery().length());
        Assertions.assertTrue(result.convertedQuery().chars().allMatch(c -> c == 'x'));
        Assertions.assertTrue(result.executable());
    }

    @Test
    void missingExecutableMeansTheEngineIsUnavailable() {
        ScriptTranspiler missing = new ScriptTranspiler("script", List.of("/nonexistent/querymesh-engine"), 5_000L);
        Assertions.assertThrows(
                TranspilerUnavailableException.class,
                () -> missing.transpile(new TranspileRequest("SELECT 1", "hive", "trino", null))
        );
    }

    @Test
    void registryResolvesByIdAndRejectsUnknownIds() throws Exception {
        TranspilerRegistry registry = new TranspilerRegistry();
        registry.register(new PassthroughTranspiler());

        Transpiler passthrough = registry.require(PassthroughTranspiler.ID);
        TranspileResult result = passthrough.transpile(new TranspileRequest("  SELECT 1 ", "hive", "hive", null));
        Assertions.assertEquals("SELECT 1", result.convertedQuery());
        Assertions.assertTrue(result.executable());

        Assertions.assertTrue(registry.findById("sqlglot").isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.require("sqlglot"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptTranspiler("script", List.of(), 5_000L));
    }

    private static List<String> shell(String script) {
        return List.of("sh", "-c", script);
    }

    private static void assumeShell() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        Assumptions.assumeFalse(os.contains("win"), "requires a POSIX shell");
    }
}
