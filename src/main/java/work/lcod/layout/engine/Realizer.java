package work.lcod.layout.engine;

import java.util.List;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.Pair;
import work.lcod.layout.content.Styles;

/**
 * Turns arbitrary content into the canonical, flat sequence of nodes that flow layout consumes.
 */
public interface Realizer {
    Realization realize(Engine engine, Locator.SplitLocator locator, Content content, Styles styles);

    /** The realized pairs and whether they are inline or block-level. */
    record Realization(List<Pair> pairs, FragmentKind kind) {
        public Realization {
            pairs = List.copyOf(pairs);
        }
    }
}
