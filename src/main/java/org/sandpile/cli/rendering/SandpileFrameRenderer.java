package org.sandpile.cli.rendering;

import org.sandpile.runtime.api.SimulationSnapshot;
import org.sandpile.runtime.model.GridProperties;
import org.sandpile.runtime.statistics.CascadeStatistics;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;

/**
 * Renders a simulation snapshot into a frame of four panels:
 * <pre>
 *   +----------------+----------------+
 *   | grid heights   | toppled counts |
 *   +----------------+----------------+
 *   | average height | avalanche      |
 *   | over drops     | histogram      |
 *   +----------------+----------------+
 * </pre>
 * Grids are drawn in matrix layout: the first coordinate selects the pixel row, the second the column.
 * Drawing goes directly to the pixel buffer of a BufferedImage.
 */
public class SandpileFrameRenderer {

    /**
     * Smallest edge length of a panel, so plots stay readable on tiny grids.
     */
    static final int MIN_PANEL_SIZE = 120;
    static final int MARGIN = 4;

    static final double AVERAGE_MIN = 1.45;
    static final double AVERAGE_MAX = 2.15;
    static final int TOPPLED_COUNT_MAX = 10;

    private final int gridSize;
    private final int cellSize;
    private final int iterations;
    private final int panelSize;
    private final int imageWidth;
    private final int imageHeight;
    private final BufferedImage frame;
    private final int[] frameBuffer;
    private final HistogramBarRenderer histogramRenderer;

    private final int colorBackground = Color.decode("#ffffff").getRGB();
    private final int colorAxis = Color.decode("#000000").getRGB();
    private final int colorAverageLine = Color.decode("#000000").getRGB();

    private final int[] heightPalette = {
            Color.decode("#CCD3FC").getRGB(),
            Color.decode("#99A7F8").getRGB(),
            Color.decode("#667AF5").getRGB(),
            Color.decode("#334EF1").getRGB(),
            Color.decode("#EE4B2B").getRGB()
    };

    // Diverging blue-white-red stops at 0, 0.25, 0.5, 0.75 and 1.
    private static final float[][] DIVERGING_STOPS = {
            {0.0f, 0.0f, 0.3f},
            {0.0f, 0.0f, 1.0f},
            {1.0f, 1.0f, 1.0f},
            {1.0f, 0.0f, 0.0f},
            {0.5f, 0.0f, 0.0f}
    };

    /**
     * Creates a new renderer for a simulation run.
     *
     * @param properties The grid shape.
     * @param cellSize The size of each cell in pixels, at least 1.
     * @param iterations The number of drops of the run, used to scale the average plot.
     */
    public SandpileFrameRenderer(GridProperties properties, int cellSize, int iterations) {
        if (cellSize < 1) {
            throw new IllegalArgumentException("Cell size must be at least 1: " + cellSize);
        }
        this.gridSize = properties.getGridSize();
        this.cellSize = cellSize;
        this.iterations = Math.max(iterations, 0);
        this.panelSize = Math.max(gridSize * cellSize, MIN_PANEL_SIZE);
        this.imageWidth = 2 * panelSize + 3 * MARGIN;
        this.imageHeight = 2 * panelSize + 3 * MARGIN;

        this.frame = new BufferedImage(imageWidth, imageHeight, BufferedImage.TYPE_INT_RGB);
        this.frameBuffer = ((DataBufferInt) frame.getRaster().getDataBuffer()).getData();
        this.histogramRenderer = new HistogramBarRenderer(panelSize, panelSize);
    }

    /**
     * Renders a snapshot into the frame buffer.
     *
     * @param snapshot The state to draw; its grid size must match the renderer's.
     * @return The RGB pixel data of the rendered frame. The array is reused by the next call.
     */
    public int[] render(SimulationSnapshot snapshot) {
        if (snapshot.gridSize() != gridSize) {
            throw new IllegalArgumentException("Snapshot grid size " + snapshot.gridSize() + " does not match renderer grid size " + gridSize);
        }
        Arrays.fill(frameBuffer, colorBackground);

        int left = MARGIN;
        int right = 2 * MARGIN + panelSize;
        int top = MARGIN;
        int bottom = 2 * MARGIN + panelSize;

        for (int x = 0; x < gridSize; x++) {
            for (int y = 0; y < gridSize; y++) {
                drawCell(left, top, x, y, heightColor(snapshot.heightAt(x, y)));
                drawCell(right, top, x, y, toppledCountColor(snapshot.toppledCountAt(x, y)));
            }
        }

        drawAveragePlot(left, bottom, snapshot.averageSeries());

        int[] histogram = histogramRenderer.render(CascadeStatistics.relativeLogCounts(snapshot.binCounts()));
        for (int row = 0; row < panelSize; row++) {
            System.arraycopy(histogram, row * panelSize, frameBuffer, (bottom + row) * imageWidth + right, panelSize);
        }
        return frameBuffer;
    }

    /**
     * Maps a height to the discrete palette; heights above the threshold share the last color.
     *
     * @param height A non-negative height.
     * @return The RGB color.
     */
    int heightColor(int height) {
        return heightPalette[Math.max(0, Math.min(height, heightPalette.length - 1))];
    }

    /**
     * Maps a toppled count to the diverging scale clamped to {@code [0, 10]}.
     *
     * @param count The number of topplings of a cell in the current drop.
     * @return The RGB color.
     */
    static int toppledCountColor(int count) {
        double t = Math.max(0.0, Math.min(1.0, (double) count / TOPPLED_COUNT_MAX));
        double scaled = t * (DIVERGING_STOPS.length - 1);
        int lower = Math.min((int) scaled, DIVERGING_STOPS.length - 2);
        float fraction = (float) (scaled - lower);
        float[] a = DIVERGING_STOPS[lower];
        float[] b = DIVERGING_STOPS[lower + 1];
        return new Color(
                a[0] + (b[0] - a[0]) * fraction,
                a[1] + (b[1] - a[1]) * fraction,
                a[2] + (b[2] - a[2]) * fraction).getRGB();
    }

    private void drawCell(int panelX, int panelY, int x, int y, int color) {
        int startX = panelX + y * cellSize;
        int startY = panelY + x * cellSize;
        for (int row = 0; row < cellSize; row++) {
            int startIndex = (startY + row) * imageWidth + startX;
            Arrays.fill(frameBuffer, startIndex, startIndex + cellSize, color);
        }
    }

    private void drawAveragePlot(int panelX, int panelY, double[] series) {
        drawPanelBorder(panelX, panelY);
        double xRange = Math.max(iterations * 1.05, 1.0);
        int previousX = -1;
        int previousY = -1;
        for (int i = 0; i < series.length; i++) {
            int px = panelX + 1 + (int) Math.round(i / xRange * (panelSize - 3));
            double normalized = (series[i] - AVERAGE_MIN) / (AVERAGE_MAX - AVERAGE_MIN);
            normalized = Math.max(0.0, Math.min(1.0, normalized));
            int py = panelY + panelSize - 2 - (int) Math.round(normalized * (panelSize - 3));
            px = Math.min(px, panelX + panelSize - 2);
            if (previousX >= 0) {
                drawLine(previousX, previousY, px, py, colorAverageLine);
            } else {
                frameBuffer[py * imageWidth + px] = colorAverageLine;
            }
            previousX = px;
            previousY = py;
        }
    }

    private void drawPanelBorder(int panelX, int panelY) {
        int topRow = panelY * imageWidth + panelX;
        int bottomRow = (panelY + panelSize - 1) * imageWidth + panelX;
        Arrays.fill(frameBuffer, topRow, topRow + panelSize, colorAxis);
        Arrays.fill(frameBuffer, bottomRow, bottomRow + panelSize, colorAxis);
        for (int row = 0; row < panelSize; row++) {
            frameBuffer[(panelY + row) * imageWidth + panelX] = colorAxis;
            frameBuffer[(panelY + row) * imageWidth + panelX + panelSize - 1] = colorAxis;
        }
    }

    /**
     * Bresenham line between two pixels, both inclusive.
     */
    private void drawLine(int x0, int y0, int x1, int y1, int color) {
        int dx = Math.abs(x1 - x0);
        int dy = -Math.abs(y1 - y0);
        int sx = x0 < x1 ? 1 : -1;
        int sy = y0 < y1 ? 1 : -1;
        int err = dx + dy;
        while (true) {
            frameBuffer[y0 * imageWidth + x0] = color;
            if (x0 == x1 && y0 == y1) {
                break;
            }
            int e2 = 2 * err;
            if (e2 >= dy) {
                err += dy;
                x0 += sx;
            }
            if (e2 <= dx) {
                err += dx;
                y0 += sy;
            }
        }
    }

    /**
     * Returns the image backed by the frame buffer, showing the last rendered frame.
     *
     * @return The frame image.
     */
    public BufferedImage toImage() {
        return frame;
    }

    /**
     * Returns the frame width in pixels.
     *
     * @return The width.
     */
    public int getWidth() {
        return imageWidth;
    }

    /**
     * Returns the frame height in pixels.
     *
     * @return The height.
     */
    public int getHeight() {
        return imageHeight;
    }

    /**
     * Returns the edge length of one panel in pixels.
     *
     * @return The panel size.
     */
    public int getPanelSize() {
        return panelSize;
    }
}
