package work.lcod.layout.engine;

import java.util.Objects;

/**
 * The external collaborators flow layout calls into.
 */
public record Routines(Realizer realizer, ParagraphLayouter paragraphs, TextShaper shaper) {
    public Routines {
        Objects.requireNonNull(realizer, "realizer");
        Objects.requireNonNull(paragraphs, "paragraphs");
        Objects.requireNonNull(shaper, "shaper");
    }

    public static Routines defaults() {
        var shaper = new MonospaceShaper();
        return new Routines(new DefaultRealizer(), new DefaultParagraphLayouter(shaper), shaper);
    }
}
