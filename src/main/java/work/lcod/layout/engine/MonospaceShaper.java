package work.lcod.layout.engine;

import work.lcod.layout.content.Styles;
import work.lcod.layout.geom.Size;

/**
 * Shapes text as if every glyph were half an em wide and one em tall.
 */
public final class MonospaceShaper implements TextShaper {
    @Override
    public Size measure(String text, Styles styles) {
        int glyphs = text.codePointCount(0, text.length());
        return new Size(glyphs * styles.em(0.5), styles.fontSize());
    }
}
