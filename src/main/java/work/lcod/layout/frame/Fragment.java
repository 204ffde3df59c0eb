package work.lcod.layout.frame;

import java.util.List;

/**
 * The frames produced by laying content out into several regions, one per region.
 */
public record Fragment(List<Frame> frames) {
    public Fragment {
        frames = List.copyOf(frames);
    }

    public static Fragment frame(Frame frame) {
        return new Fragment(List.of(frame));
    }

    public int size() {
        return frames.size();
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    /** The single frame of a fragment laid out into one region. */
    public Frame intoFrame() {
        if (frames.size() != 1) {
            throw new IllegalStateException("Expected exactly one frame, got " + frames.size());
        }
        return frames.get(0);
    }
}
