package work.lcod.layout.content;

import java.util.Objects;

/**
 * A realized content node together with the styles it is laid out with.
 */
public record Pair(Content content, Styles styles) {
    public Pair {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(styles, "styles");
    }
}
