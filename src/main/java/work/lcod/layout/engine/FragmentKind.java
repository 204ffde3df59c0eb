package work.lcod.layout.engine;

/**
 * Whether realized content is made of inline or block-level nodes.
 */
public enum FragmentKind {
    INLINE,
    BLOCK
}
