package work.lcod.layout.content;

import java.util.Objects;

/**
 * Introspection marker attached to a frame. Carries no geometry.
 */
public record Tag(Location location, Content elem) {
    public Tag {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(elem, "elem");
    }
}
