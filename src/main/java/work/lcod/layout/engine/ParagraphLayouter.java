package work.lcod.layout.engine;

import java.util.List;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.Styles;
import work.lcod.layout.frame.Frame;

/**
 * Breaks a paragraph into line frames.
 *
 * <p>Line frames carry a tag for every footnote marker they contain and, when {@code numberLines}
 * is set, a line marker tag at their start.
 */
public interface ParagraphLayouter {
    List<Frame> layout(
        Engine engine,
        Locator locator,
        List<Content> inlines,
        Styles styles,
        double width,
        boolean numberLines
    );
}
