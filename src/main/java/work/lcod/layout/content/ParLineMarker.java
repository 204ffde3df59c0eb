package work.lcod.layout.content;

import java.util.Optional;
import work.lcod.layout.geom.FixedAlignment;

/**
 * Marks the start of a numbered paragraph line inside a line frame.
 */
public record ParLineMarker(FixedAlignment numberMargin, Optional<Double> numberClearance, Span span) implements Content {
    public ParLineMarker {
        numberMargin = numberMargin == null ? FixedAlignment.START : numberMargin;
        numberClearance = numberClearance == null ? Optional.empty() : numberClearance;
        span = span == null ? Span.detached() : span;
    }
}
