package org.sandpile.cli.rendering;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class HistogramBarRendererTest {

    @Test
    void barHeightsFollowRelativeValues() {
        HistogramBarRenderer renderer = new HistogramBarRenderer(42, 22);

        int[] pixels = renderer.render(new double[]{1.0, 0.5, 0.0, 2.0});

        int innerHeight = 20;
        assertEquals(innerHeight, barHeight(pixels, renderer, 1 + 5));
        assertEquals(innerHeight / 2, barHeight(pixels, renderer, 1 + 15));
        assertEquals(0, barHeight(pixels, renderer, 1 + 25));
        assertEquals(innerHeight, barHeight(pixels, renderer, 1 + 35));
    }

    @Test
    void emptyHistogramDrawsOnlyBorder() {
        HistogramBarRenderer renderer = new HistogramBarRenderer(10, 10);

        int[] pixels = renderer.render(new double[5]);

        for (int pixel : pixels) {
            assertNotEquals(renderer.getBarColor(), pixel);
        }
    }

    @Test
    void tinyPanelIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HistogramBarRenderer(2, 10));
    }

    private static int barHeight(int[] pixels, HistogramBarRenderer renderer, int column) {
        int height = 0;
        for (int y = 0; y < renderer.getHeight(); y++) {
            if (pixels[y * renderer.getWidth() + column] == renderer.getBarColor()) {
                height++;
            }
        }
        return height;
    }
}
