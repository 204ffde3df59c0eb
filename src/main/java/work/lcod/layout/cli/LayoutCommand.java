package work.lcod.layout.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.layout.api.LayoutConfiguration;
import work.lcod.layout.api.LayoutResult;
import work.lcod.layout.api.LayoutRunner;
import work.lcod.layout.api.LogLevel;
import work.lcod.layout.content.Styles;
import work.lcod.layout.flow.FlowMode;
import work.lcod.layout.geom.Rel;
import work.lcod.layout.shared.LengthParser;

@CommandLine.Command(
    name = "lcod-layout",
    description = "Lay out a document across pages and columns and print the frames as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LayoutCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--document"},
        required = true,
        description = "Document file (YAML or JSON)."
    )
    private Path document;

    @CommandLine.Option(
        names = {"-s", "--settings"},
        description = "TOML settings with page geometry and styles.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settings;

    @CommandLine.Option(
        names = "--width",
        description = "Page width (e.g. 210mm, 595pt); overrides the settings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String widthRaw;

    @CommandLine.Option(
        names = "--height",
        description = "Page height; overrides the settings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String heightRaw;

    @CommandLine.Option(
        names = "--columns",
        description = "Number of columns; overrides the settings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer columns;

    @CommandLine.Option(
        names = "--gutter",
        description = "Column gutter (e.g. 12pt or 4%); overrides the settings.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String gutterRaw;

    @CommandLine.Option(
        names = "--mode",
        description = "Flow mode (root|block). Only root flows render footnotes and line numbers.",
        defaultValue = "root"
    )
    private String modeRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the JSON result to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @Override
    public Integer call() throws Exception {
        var logLevel = LogLevel.from(logLevelRaw);
        logLevel.apply();

        if (columns != null && columns < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--columns must be at least 1.");
        }

        var configuration = LayoutConfiguration.builder()
            .document(document)
            .settings(settings)
            .width(parseLength(widthRaw, "--width"))
            .height(parseLength(heightRaw, "--height"))
            .columns(Optional.ofNullable(columns))
            .gutter(parseGutter(gutterRaw))
            .mode(parseMode(modeRaw))
            .logLevel(logLevel)
            .build();

        LayoutResult result = new LayoutRunner().run(configuration);
        var json = result.toPrettyJson();
        if (output != null) {
            writeOutput(output, json);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.println(json);
            out.flush();
        }
        if (result.status() == LayoutResult.Status.FAILURE) {
            var message = String.valueOf(result.metadata().getOrDefault("error", "Layout failed"));
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(message));
        }
        return result.status().exitCode();
    }

    private Optional<Double> parseLength(String raw, String option) {
        try {
            return LengthParser.parse(raw, Styles.defaults().fontSize());
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid " + option + ": " + raw);
        }
    }

    private Optional<Rel> parseGutter(String raw) {
        try {
            return LengthParser.parseRel(raw, Styles.defaults().fontSize());
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --gutter: " + raw);
        }
    }

    private FlowMode parseMode(String raw) {
        return switch (raw == null ? "root" : raw.trim().toLowerCase(Locale.ROOT)) {
            case "root" -> FlowMode.ROOT;
            case "block" -> FlowMode.BLOCK;
            default -> throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported --mode: " + raw);
        };
    }

    private static void writeOutput(Path path, String json) throws IOException {
        var parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, json + System.lineSeparator(), StandardCharsets.UTF_8);
    }
}
