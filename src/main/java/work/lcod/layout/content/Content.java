package work.lcod.layout.content;

/**
 * A realized content node. The set of node kinds is closed: flow layout dispatches on it.
 */
public sealed interface Content permits
    SequenceContent,
    TextContent,
    FootnoteContent,
    ParagraphContent,
    BlockContent,
    PlaceContent,
    VSpaceContent,
    ColbreakContent,
    FlushContent,
    PagebreakContent,
    ColumnsContent,
    TagContent,
    ParLineMarker {

    /** Where this node came from. */
    Span span();

    /** Whether the node belongs into a paragraph rather than the block flow. */
    default boolean isInline() {
        return this instanceof TextContent || this instanceof FootnoteContent;
    }
}
