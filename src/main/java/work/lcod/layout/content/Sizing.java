package work.lcod.layout.content;

import work.lcod.layout.geom.Fr;
import work.lcod.layout.geom.Rel;

/**
 * A vertical amount: either a (relative) length or a fraction of the leftover space.
 */
public sealed interface Sizing permits Sizing.Length, Sizing.Fractional {
    static Sizing abs(double points) {
        return new Length(Rel.abs(points));
    }

    static Sizing rel(Rel rel) {
        return new Length(rel);
    }

    static Sizing fr(double value) {
        return new Fractional(new Fr(value));
    }

    record Length(Rel rel) implements Sizing {}

    record Fractional(Fr fr) implements Sizing {}
}
