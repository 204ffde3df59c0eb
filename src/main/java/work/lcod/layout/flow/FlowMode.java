package work.lcod.layout.flow;

import work.lcod.layout.engine.FragmentKind;

/**
 * The mode a flow is laid out in.
 */
public enum FlowMode {
    /** A root flow with block-level elements. Like {@link #BLOCK}, but can host footnotes and line numbers. */
    ROOT,
    /** A flow whose children are block-level elements. */
    BLOCK,
    /** A flow whose children are inline-level elements. */
    INLINE;

    public static FlowMode from(FragmentKind kind) {
        return kind == FragmentKind.INLINE ? INLINE : BLOCK;
    }
}
