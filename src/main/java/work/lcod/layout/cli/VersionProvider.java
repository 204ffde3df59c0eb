package work.lcod.layout.cli;

import picocli.CommandLine;

/**
 * Reports the jar's implementation version and the JVM running it.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var pkg = LayoutCommand.class.getPackage();
        String version = pkg.getImplementationVersion() == null ? "development" : pkg.getImplementationVersion();
        return new String[] {
            "lcod-layout " + version,
            "JVM: " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
