package work.lcod.layout.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.ParLineMarker;
import work.lcod.layout.content.TagContent;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Size;

/**
 * Serializes frames into a JSON tree. Output is deterministic for equal frames.
 */
public final class FrameJson {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writerWithDefaultPrettyPrinter();

    private FrameJson() {}

    public static ArrayNode toTree(Fragment fragment) {
        var array = JSON.createArrayNode();
        for (var frame : fragment.frames()) {
            array.add(toTree(frame));
        }
        return array;
    }

    public static ObjectNode toTree(Frame frame) {
        var node = JSON.createObjectNode();
        putSize(node, frame.size());
        var items = node.putArray("items");
        for (var positioned : frame.items()) {
            items.add(itemNode(positioned.pos(), positioned.item()));
        }
        return node;
    }

    public static String toJson(Fragment fragment) {
        try {
            return WRITER.writeValueAsString(toTree(fragment));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize frames: " + ex.getMessage(), ex);
        }
    }

    private static ObjectNode itemNode(Point pos, FrameItem item) {
        var node = JSON.createObjectNode();
        node.put("x", pos.x());
        node.put("y", pos.y());
        if (item instanceof FrameItem.Group group) {
            node.put("type", "group");
            node.set("frame", toTree(group.frame()));
        } else if (item instanceof FrameItem.Shape shape) {
            node.put("type", "shape");
            node.put("label", shape.label());
            putSize(node, shape.size());
        } else if (item instanceof FrameItem.Text text) {
            node.put("type", "text");
            node.put("text", text.text());
            putSize(node, text.size());
        } else if (item instanceof FrameItem.TagItem tagItem) {
            node.put("type", "tag");
            node.put("location", tagItem.tag().location().key());
            var elem = tagItem.tag().elem();
            if (elem instanceof FootnoteContent note) {
                node.put("element", "footnote");
                node.put("marker", note.marker());
            } else if (elem instanceof TagContent named) {
                node.put("element", "tag");
                node.put("name", named.name());
            } else if (elem instanceof ParLineMarker) {
                node.put("element", "line");
            } else {
                node.put("element", elem.getClass().getSimpleName());
            }
        }
        return node;
    }

    private static void putSize(ObjectNode node, Size size) {
        node.put("width", size.x());
        node.put("height", size.y());
    }
}
