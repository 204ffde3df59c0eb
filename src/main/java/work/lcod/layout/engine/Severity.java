package work.lcod.layout.engine;

/**
 * How serious a diagnostic is.
 */
public enum Severity {
    ERROR,
    WARNING
}
