package work.lcod.layout.engine;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.layout.frame.Fragment;

/**
 * Memoizes fragment layouts by their complete inputs. Warnings emitted while computing an entry
 * are stored with it and replayed on every hit; failures are memoized as well.
 */
public final class LayoutCache {
    private static final Logger log = LoggerFactory.getLogger(LayoutCache.class);

    private final Map<Object, Memo> entries = new HashMap<>();
    private int hits;
    private int misses;

    public Fragment memoize(Sink sink, Object key, Supplier<Fragment> compute) {
        var memo = entries.get(key);
        if (memo != null) {
            hits++;
            memo.warnings().forEach(sink::warn);
            if (memo.error() != null) {
                throw new SourceException(memo.error());
            }
            return memo.fragment();
        }

        misses++;
        int mark = sink.mark();
        Fragment fragment = null;
        List<SourceDiagnostic> error = null;
        try {
            fragment = compute.get();
        } catch (SourceException ex) {
            error = ex.diagnostics();
        }
        // Keyed after computing: nested layouts insert their own entries meanwhile.
        entries.put(key, new Memo(fragment, error, sink.since(mark)));
        if (log.isTraceEnabled()) {
            log.trace("Memoized layout #{} ({} entries)", misses, entries.size());
        }
        if (error != null) {
            throw new SourceException(error);
        }
        return fragment;
    }

    public int hits() {
        return hits;
    }

    public int misses() {
        return misses;
    }

    private record Memo(Fragment fragment, List<SourceDiagnostic> error, List<SourceDiagnostic> warnings) {}
}
