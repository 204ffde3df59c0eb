package work.lcod.layout.frame;

import java.util.Objects;
import work.lcod.layout.content.Tag;
import work.lcod.layout.geom.Size;

/**
 * Something positioned inside a {@link Frame}.
 */
public sealed interface FrameItem permits FrameItem.Group, FrameItem.Shape, FrameItem.Text, FrameItem.TagItem {
    /** A nested frame. */
    record Group(Frame frame) implements FrameItem {
        public Group {
            Objects.requireNonNull(frame, "frame");
        }
    }

    /** An opaque box standing in for visual content such as a rule, an image or a fill. */
    record Shape(String label, Size size) implements FrameItem {}

    /** A shaped run of text. */
    record Text(String text, Size size) implements FrameItem {}

    /** An introspection tag. Has no extent. */
    record TagItem(Tag tag) implements FrameItem {}
}
