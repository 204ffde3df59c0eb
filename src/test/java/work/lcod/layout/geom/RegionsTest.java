package work.lcod.layout.geom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RegionsTest {
    private static final Axes<Boolean> EXPAND = Axes.splat(true);

    @Test
    void nextConsumesTheBacklogBeforeRepeating() {
        var regions = new Regions(new Size(100, 50), 50, List.of(30.0, 40.0), Optional.of(60.0), EXPAND);

        var second = regions.next();
        var third = second.next();
        var fourth = third.next();

        assertEquals(30, second.size().y());
        assertEquals(40, third.size().y());
        assertEquals(60, fourth.size().y());
        assertEquals(60, fourth.next().size().y());
        assertEquals(100, fourth.size().x());
    }

    @Test
    void singleRegionStaysPut() {
        var regions = Regions.one(new Size(100, 50), EXPAND);

        assertSame(regions, regions.next());
        assertFalse(regions.mayProgress());
        assertFalse(regions.mayBreak());
    }

    @Test
    void shrinkKeepsTheBase() {
        var regions = Regions.repeat(new Size(100, 80), EXPAND).shrink(30);

        assertEquals(50, regions.size().y());
        assertEquals(new Size(100, 80), regions.base());
        assertTrue(regions.mayProgress());
    }

    @Test
    void fullRegionWithFollowerIsFull() {
        var regions = Regions.repeat(new Size(100, 80), EXPAND);

        assertFalse(regions.isFull());
        assertTrue(regions.withHeight(0).isFull());
        assertFalse(Regions.one(new Size(100, 0), EXPAND).isFull());
    }

    @Test
    void infiniteRegionsNeverBreak() {
        var regions = Regions.repeat(new Size(100, Double.POSITIVE_INFINITY), EXPAND).withHeight(Double.POSITIVE_INFINITY);

        assertFalse(regions.mayBreak());
    }

    @Test
    void listsUpcomingHeights() {
        var regions = new Regions(new Size(100, 50), 50, List.of(30.0), Optional.empty(), EXPAND);

        assertEquals(List.of(50.0, 30.0), regions.heights(5));
        assertEquals(Optional.empty(), regions.heightAt(2));
        assertEquals(List.of(50.0, 80.0, 80.0), Regions.repeat(new Size(10, 80), EXPAND).withHeight(50).heights(3));
    }
}
