package work.lcod.layout.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.layout.engine.SourceDiagnostic;
import work.lcod.layout.frame.Fragment;
import work.lcod.layout.frame.FrameJson;

/**
 * Outcome of a {@link LayoutRunner} execution (usable by the CLI and embedding apps).
 */
public record LayoutResult(
    Status status,
    Fragment fragment,
    List<SourceDiagnostic> diagnostics,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public LayoutResult {
        fragment = fragment == null ? new Fragment(List.of()) : fragment;
        diagnostics = List.copyOf(diagnostics);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static LayoutResult success(
        Fragment fragment,
        List<SourceDiagnostic> warnings,
        Map<String, Object> metadata,
        Instant startedAt
    ) {
        return new LayoutResult(Status.SUCCESS, fragment, warnings, metadata, startedAt, Instant.now());
    }

    /** A failed run. Frames of a failed layout are discarded. */
    public static LayoutResult failure(
        String message,
        List<SourceDiagnostic> diagnostics,
        Map<String, Object> metadata,
        Instant startedAt
    ) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new LayoutResult(Status.FAILURE, null, diagnostics, meta, startedAt, Instant.now());
    }

    public LayoutResult withSerializedPayload(String payload) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("payload", payload);
        return new LayoutResult(status, fragment, diagnostics, meta, startedAt, finishedAt);
    }

    public List<SourceDiagnostic> warnings() {
        return diagnostics.stream().filter(diagnostic -> !diagnostic.isError()).toList();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("frames", FrameJson.toTree(fragment));
        var messages = new ArrayList<String>(diagnostics.size());
        for (var diagnostic : diagnostics) {
            messages.add(diagnostic.display());
        }
        serializable.put("diagnostics", messages);
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
