package org.sandpile.cli.rendering;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;

/**
 * Renders the avalanche histogram as vertical bars growing from the bottom.
 * <p>
 * Bar heights are relative values in {@code [0, 1]}, usually the output of
 * {@link org.sandpile.runtime.statistics.CascadeStatistics#relativeLogCounts(long[])}.
 * The panel is split into equal-width slots, one per bin.
 */
public class HistogramBarRenderer {

    private final int panelWidth;
    private final int panelHeight;
    private final BufferedImage panelImage;
    private final int[] panelBuffer;

    private final int colorBackground = Color.decode("#ffffff").getRGB();
    private final int colorBar = Color.decode("#334EF1").getRGB();
    private final int colorBorder = Color.decode("#000000").getRGB();

    /**
     * Creates a new histogram renderer.
     *
     * @param panelWidth The width of the panel in pixels, at least 3.
     * @param panelHeight The height of the panel in pixels, at least 3.
     */
    public HistogramBarRenderer(int panelWidth, int panelHeight) {
        if (panelWidth < 3 || panelHeight < 3) {
            throw new IllegalArgumentException("Histogram panel must be at least 3x3 pixels: " + panelWidth + "x" + panelHeight);
        }
        this.panelWidth = panelWidth;
        this.panelHeight = panelHeight;
        this.panelImage = new BufferedImage(panelWidth, panelHeight, BufferedImage.TYPE_INT_RGB);
        this.panelBuffer = ((DataBufferInt) panelImage.getRaster().getDataBuffer()).getData();
    }

    /**
     * Renders one bar per bin.
     *
     * @param relativeHeights Bar heights in {@code [0, 1]}; values outside are clamped.
     * @return The rendered panel as a pixel array (RGB format), row-major.
     */
    public int[] render(double[] relativeHeights) {
        Arrays.fill(panelBuffer, colorBackground);
        drawBorder();

        int innerWidth = panelWidth - 2;
        int innerHeight = panelHeight - 2;
        int bins = relativeHeights.length;
        for (int bin = 0; bin < bins; bin++) {
            double value = Math.max(0.0, Math.min(1.0, relativeHeights[bin]));
            int barHeight = (int) Math.round(value * innerHeight);
            if (barHeight == 0) {
                continue;
            }
            // Slot edges are computed from the bin index so rounding never leaves gaps or overlaps.
            int startX = 1 + (int) ((long) bin * innerWidth / bins);
            int endX = 1 + (int) ((long) (bin + 1) * innerWidth / bins);
            for (int y = panelHeight - 1 - barHeight; y < panelHeight - 1; y++) {
                Arrays.fill(panelBuffer, y * panelWidth + startX, y * panelWidth + endX, colorBar);
            }
        }
        return panelBuffer;
    }

    /**
     * Draws a 1-pixel border around the panel.
     */
    private void drawBorder() {
        Arrays.fill(panelBuffer, 0, panelWidth, colorBorder);
        Arrays.fill(panelBuffer, (panelHeight - 1) * panelWidth, panelHeight * panelWidth, colorBorder);
        for (int y = 0; y < panelHeight; y++) {
            panelBuffer[y * panelWidth] = colorBorder;
            panelBuffer[y * panelWidth + panelWidth - 1] = colorBorder;
        }
    }

    /**
     * Returns the width of the panel in pixels.
     *
     * @return The panel width.
     */
    public int getWidth() {
        return panelWidth;
    }

    /**
     * Returns the height of the panel in pixels.
     *
     * @return The panel height.
     */
    public int getHeight() {
        return panelHeight;
    }

    /**
     * Returns the color used for bars, for callers that need to match it.
     *
     * @return The RGB bar color.
     */
    public int getBarColor() {
        return colorBar;
    }
}
