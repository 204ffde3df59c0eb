package work.lcod.layout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.layout.support.LayoutTestSupport.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.layout.flow.FlowMode;
import work.lcod.layout.geom.Rel;

class LayoutRunnerTest {
    private final LayoutRunner runner = new LayoutRunner();

    @Test
    void laysOutDocumentWithSettings() {
        var configuration = LayoutConfiguration.builder()
            .document(document("basic.yaml"))
            .settings(document("small.toml"))
            .build();

        var result = runner.run(configuration);

        assertEquals(LayoutResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata().get("error")));
        assertTrue(result.fragment().size() >= 1);
        assertEquals(result.fragment().size(), result.metadata().get("pages"));
        assertEquals(1, result.metadata().get("columns"));
        assertEquals(Map.of("width", 200.0, "height", 120.0), result.metadata().get("page"));
        assertEquals(200, result.fragment().get(0).width());
    }

    @Test
    void explicitPageValuesOverrideSettings() {
        var configuration = LayoutConfiguration.builder()
            .document(document("long.yaml"))
            .settings(document("small.toml"))
            .width(Optional.of(300.0))
            .height(Optional.of(200.0))
            .columns(Optional.of(2))
            .gutter(Optional.of(Rel.abs(20)))
            .build();

        var result = runner.run(configuration);

        assertEquals(LayoutResult.Status.SUCCESS, result.status());
        assertEquals(2, result.metadata().get("columns"));
        assertEquals(300, result.fragment().get(0).width());
    }

    @Test
    void reportsUnknownContentAsFailure() {
        var result = runner.run(LayoutConfiguration.builder().document(document("invalid.yaml")).build());

        assertEquals(LayoutResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("Unknown content kind 'shape' at invalid.yaml#/content/0", result.metadata().get("error"));
        assertEquals(0, result.fragment().size());
    }

    @Test
    void reportsLayoutErrorsWithDiagnostics() {
        var result = runner.run(LayoutConfiguration.builder().document(document("pagebreak.yaml")).build());

        assertEquals(LayoutResult.Status.FAILURE, result.status());
        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertTrue(diagnostic.isError());
        assertEquals("pagebreaks are not allowed inside of containers", diagnostic.message());
        assertTrue(diagnostic.span().source().startsWith("pagebreak.yaml#"));
        assertTrue(diagnostic.span().source().endsWith("/pagebreak"));
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void missingDocumentIsAFailure() {
        var result = runner.run(LayoutConfiguration.builder().document(document("missing.yaml")).build());

        assertEquals(LayoutResult.Status.FAILURE, result.status());
        assertTrue(String.valueOf(result.metadata().get("error")).startsWith("Failed to read document"));
    }

    @Test
    void serializesResultToJson() throws Exception {
        var result = runner.runToJson(LayoutConfiguration.builder().document(document("long.yaml")).build());

        var payload = (String) result.metadata().get("payload");
        var tree = new ObjectMapper().readTree(payload);
        assertEquals("success", tree.get("status").asText());
        assertTrue(tree.get("frames").isArray());
        assertFalse(tree.get("frames").isEmpty());
        assertEquals("root", tree.get("metadata").get("mode").asText());
    }

    @Test
    void rejectsInlineMode() {
        var builder = LayoutConfiguration.builder().document(document("basic.yaml")).mode(FlowMode.INLINE);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals("off", LogLevel.OFF.simpleLoggerLevel());
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}
