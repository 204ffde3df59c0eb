package work.lcod.layout.engine;

import java.util.Objects;

/**
 * Everything a layout routine needs besides its direct inputs: the external collaborators, the
 * diagnostics sink, the nesting route and the memoization cache.
 *
 * <p>One engine serves one top-level layout; engines never share state.
 */
public final class Engine {
    private final Routines routines;
    private final Sink sink;
    private final Route route;
    private final LayoutCache cache;

    public Engine(Routines routines) {
        this(routines, new Sink(), Route.root(), new LayoutCache());
    }

    private Engine(Routines routines, Sink sink, Route route, LayoutCache cache) {
        this.routines = Objects.requireNonNull(routines, "routines");
        this.sink = sink;
        this.route = route;
        this.cache = cache;
    }

    public static Engine create() {
        return new Engine(Routines.defaults());
    }

    /** An engine for a layout nested one level deeper, sharing sink and cache. */
    public Engine nested() {
        return new Engine(routines, sink, route.extend(), cache);
    }

    public Routines routines() {
        return routines;
    }

    public Sink sink() {
        return sink;
    }

    public Route route() {
        return route;
    }

    public LayoutCache cache() {
        return cache;
    }
}
