package work.lcod.layout.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.layout.engine.Engine;
import work.lcod.layout.engine.SourceException;
import work.lcod.layout.flow.FlowLayout;
import work.lcod.layout.geom.Regions;
import work.lcod.layout.geom.Size;
import work.lcod.layout.io.DocumentLoader;
import work.lcod.layout.io.Settings;
import work.lcod.layout.io.SettingsLoader;

/**
 * Public entry point for embedding the layout engine.
 */
public final class LayoutRunner {
    private static final Logger log = LoggerFactory.getLogger(LayoutRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public LayoutResult run(LayoutConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("document", configuration.document().toString());
        metadata.put("mode", configuration.mode().name().toLowerCase());
        metadata.put("logLevel", configuration.logLevel().name());
        try {
            var settings = resolveSettings(configuration);
            var content = DocumentLoader.load(configuration.document(), settings.styles());
            var regions = Regions.repeat(settings.page(), settings.expand());
            var engine = Engine.create();
            log.debug("Laying out {} on {}x{}pt pages with {} column(s)",
                configuration.document(), settings.page().x(), settings.page().y(), settings.columns());

            var fragment = FlowLayout.layoutDocument(
                engine,
                content,
                settings.styles(),
                regions,
                settings.columns(),
                settings.gutter(),
                configuration.mode()
            );

            metadata.put("pages", fragment.size());
            metadata.put("page", Map.of("width", settings.page().x(), "height", settings.page().y()));
            metadata.put("columns", settings.columns());
            metadata.put("status", "ok");
            return LayoutResult.success(fragment, engine.sink().warnings(), metadata, started);
        } catch (SourceException ex) {
            metadata.put("error", ex.getMessage());
            return LayoutResult.failure(ex.getMessage(), ex.diagnostics(), metadata, started);
        } catch (Exception ex) {
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                metadata.put("error", ex.getMessage());
            }
            if (Boolean.getBoolean("lcod.debug")) {
                ex.printStackTrace();
            }
            return LayoutResult.failure(ex.getMessage(), List.of(), metadata, started);
        }
    }

    public LayoutResult runToJson(LayoutConfiguration configuration) {
        var result = run(configuration);
        try {
            var json = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap());
            return result.withSerializedPayload(json);
        } catch (JsonProcessingException ex) {
            return LayoutResult.failure(
                "Unable to serialize result payload: " + ex.getMessage(),
                List.of(),
                Map.of(),
                result.startedAt()
            );
        }
    }

    private Settings resolveSettings(LayoutConfiguration configuration) {
        var settings = configuration.settings().map(SettingsLoader::load).orElseGet(Settings::defaults);
        var page = new Size(
            configuration.width().orElse(settings.page().x()),
            configuration.height().orElse(settings.page().y())
        );
        return new Settings(
            page,
            configuration.columns().orElse(settings.columns()),
            configuration.gutter().orElse(settings.gutter()),
            settings.expand(),
            settings.styles().toBuilder()
                .pageWidth(Optional.of(page.x()))
                .pageHeight(Optional.of(page.y()))
                .build()
        );
    }
}
