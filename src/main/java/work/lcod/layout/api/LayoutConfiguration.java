package work.lcod.layout.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.layout.flow.FlowMode;
import work.lcod.layout.geom.Rel;

/**
 * Immutable configuration of a layout run. Explicit page values override the settings file.
 */
public record LayoutConfiguration(
    Path document,
    Optional<Path> settings,
    Optional<Double> width,
    Optional<Double> height,
    Optional<Integer> columns,
    Optional<Rel> gutter,
    FlowMode mode,
    LogLevel logLevel
) {
    public LayoutConfiguration {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(width, "width");
        Objects.requireNonNull(height, "height");
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(gutter, "gutter");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(logLevel, "logLevel");
        if (mode == FlowMode.INLINE) {
            throw new IllegalArgumentException("Documents are laid out in root or block mode");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path document;
        private Optional<Path> settings = Optional.empty();
        private Optional<Double> width = Optional.empty();
        private Optional<Double> height = Optional.empty();
        private Optional<Integer> columns = Optional.empty();
        private Optional<Rel> gutter = Optional.empty();
        private FlowMode mode = FlowMode.ROOT;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder document(Path document) {
            this.document = document;
            return this;
        }

        public Builder settings(Path settings) {
            this.settings = Optional.ofNullable(settings);
            return this;
        }

        public Builder width(Optional<Double> width) {
            this.width = width;
            return this;
        }

        public Builder height(Optional<Double> height) {
            this.height = height;
            return this;
        }

        public Builder columns(Optional<Integer> columns) {
            this.columns = columns;
            return this;
        }

        public Builder gutter(Optional<Rel> gutter) {
            this.gutter = gutter;
            return this;
        }

        public Builder mode(FlowMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public LayoutConfiguration build() {
            return new LayoutConfiguration(document, settings, width, height, columns, gutter, mode, logLevel);
        }
    }
}
