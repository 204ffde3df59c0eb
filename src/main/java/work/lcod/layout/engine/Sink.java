package work.lcod.layout.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects non-fatal diagnostics emitted during layout. Duplicates are dropped, so replaying the
 * warnings of a memoized result is harmless.
 */
public final class Sink {
    private static final Logger log = LoggerFactory.getLogger(Sink.class);

    private final List<SourceDiagnostic> warnings = new ArrayList<>();
    private final Set<SourceDiagnostic> seen = new HashSet<>();

    public void warn(SourceDiagnostic diagnostic) {
        if (seen.add(diagnostic)) {
            warnings.add(diagnostic);
            log.warn(diagnostic.display());
        }
    }

    public List<SourceDiagnostic> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** A position in the warning list; see {@link #since(int)}. */
    public int mark() {
        return warnings.size();
    }

    public List<SourceDiagnostic> since(int mark) {
        return List.copyOf(warnings.subList(mark, warnings.size()));
    }
}
