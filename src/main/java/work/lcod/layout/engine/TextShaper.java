package work.lcod.layout.engine;

import work.lcod.layout.content.Styles;
import work.lcod.layout.geom.Size;

/**
 * Measures shaped text.
 */
public interface TextShaper {
    Size measure(String text, Styles styles);
}
