package org.sandpile.runtime;

/**
 * Provides the fixed constants of the sandpile model and its frame output.
 * Tunable settings are loaded from HOCON at runtime (see {@link SimulationConfig});
 * the values here are part of the model itself and are not configurable.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The height at which a cell becomes unstable and topples.
     */
    public static final int TOPPLE_THRESHOLD = 4;

    /**
     * Orthogonal neighbor offsets as {dx, dy} pairs.
     */
    public static final int[][] NEIGHBOR_OFFSETS = {
            {-1, 0},
            {0, -1},
            {0, 1},
            {1, 0}
    };

    /**
     * Width of the zero-padded frame index used in persisted frame file names.
     * Eight digits keep lexicographic and numeric order identical for up to 10^8 frames.
     */
    public static final int FRAME_INDEX_WIDTH = 8;

    /**
     * File extension of persisted frames.
     */
    public static final String FRAME_FILE_EXTENSION = ".png";

    /**
     * The directory frames are written to when nothing else is configured.
     */
    public static final String DEFAULT_FRAME_DIRECTORY = "images";

    /**
     * Formats a frame index as a zero-padded file name, e.g. {@code 00000042.png}.
     *
     * @param frameIndex The non-negative frame index.
     * @return The frame file name.
     */
    public static String frameFileName(long frameIndex) {
        if (frameIndex < 0) {
            throw new IllegalArgumentException("Frame index must be non-negative: " + frameIndex);
        }
        return String.format("%0" + FRAME_INDEX_WIDTH + "d%s", frameIndex, FRAME_FILE_EXTENSION);
    }
}
