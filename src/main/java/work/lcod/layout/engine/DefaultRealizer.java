package work.lcod.layout.engine;

import java.util.ArrayList;
import java.util.List;
import work.lcod.layout.content.Content;
import work.lcod.layout.content.Locator;
import work.lcod.layout.content.Pair;
import work.lcod.layout.content.ParagraphContent;
import work.lcod.layout.content.SequenceContent;
import work.lcod.layout.content.Styles;
import work.lcod.layout.content.TextContent;

/**
 * Flattens sequences and wraps runs of inline content into paragraphs. Content made only of
 * inline nodes is realized as an inline fragment instead.
 */
public final class DefaultRealizer implements Realizer {
    @Override
    public Realization realize(Engine engine, Locator.SplitLocator locator, Content content, Styles styles) {
        var flat = new ArrayList<Content>();
        flatten(content, flat);

        if (!flat.isEmpty() && flat.stream().allMatch(Content::isInline)) {
            var pairs = new ArrayList<Pair>(flat.size());
            for (var node : flat) {
                pairs.add(new Pair(node, styles));
            }
            return new Realization(pairs, FragmentKind.INLINE);
        }

        var pairs = new ArrayList<Pair>();
        var run = new ArrayList<Content>();
        for (var node : flat) {
            if (node.isInline()) {
                run.add(node);
                continue;
            }
            flushRun(run, pairs, styles);
            pairs.add(new Pair(node, styles));
        }
        flushRun(run, pairs, styles);
        return new Realization(pairs, FragmentKind.BLOCK);
    }

    private static void flatten(Content content, List<Content> out) {
        if (content instanceof SequenceContent sequence) {
            for (var child : sequence.children()) {
                flatten(child, out);
            }
            return;
        }
        out.add(content);
    }

    private static void flushRun(List<Content> run, List<Pair> pairs, Styles styles) {
        if (run.isEmpty()) {
            return;
        }
        boolean blank = run.stream().allMatch(node -> node instanceof TextContent text && text.text().isBlank());
        if (!blank) {
            pairs.add(new Pair(new ParagraphContent(run, run.get(0).span()), styles));
        }
        run.clear();
    }
}
