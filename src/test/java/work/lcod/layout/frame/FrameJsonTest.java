package work.lcod.layout.frame;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.layout.content.FootnoteContent;
import work.lcod.layout.content.Location;
import work.lcod.layout.content.Tag;
import work.lcod.layout.content.TagContent;
import work.lcod.layout.geom.Point;
import work.lcod.layout.geom.Size;

class FrameJsonTest {
    @Test
    void serializesNestedItems() {
        var inner = Frame.of(new Size(50, 20));
        inner.push(new Point(1, 2), new FrameItem.Text("hi", new Size(11, 11)));
        var page = Frame.of(new Size(100, 80));
        page.push(Point.ZERO, new FrameItem.Shape("rule", new Size(100, 1)));
        page.pushFrame(new Point(0, 10), inner);
        page.pushTag(new Point(0, 30), new Tag(new Location("0/3"), TagContent.of("mark")));
        page.pushTag(new Point(0, 40), new Tag(new Location("0/4"), FootnoteContent.of("7", "Note")));

        var tree = FrameJson.toTree(page);

        assertEquals(100, tree.get("width").asDouble());
        var items = tree.get("items");
        assertEquals(4, items.size());
        assertEquals("shape", items.get(0).get("type").asText());
        assertEquals("rule", items.get(0).get("label").asText());
        assertEquals("group", items.get(1).get("type").asText());
        assertEquals(10, items.get(1).get("y").asDouble());
        assertEquals("hi", items.get(1).get("frame").get("items").get(0).get("text").asText());
        assertEquals("mark", items.get(2).get("name").asText());
        assertEquals("0/3", items.get(2).get("location").asText());
        assertEquals("footnote", items.get(3).get("element").asText());
        assertEquals("7", items.get(3).get("marker").asText());
    }

    @Test
    void equalFramesSerializeEqually() {
        var first = Frame.of(new Size(10, 10));
        first.push(Point.ZERO, new FrameItem.Text("a", new Size(5, 10)));
        var second = Frame.of(new Size(10, 10));
        second.push(Point.ZERO, new FrameItem.Text("a", new Size(5, 10)));

        assertEquals(FrameJson.toJson(Fragment.frame(first)), FrameJson.toJson(Fragment.frame(second)));
    }
}
