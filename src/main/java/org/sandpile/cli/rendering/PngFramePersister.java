package org.sandpile.cli.rendering;

import org.sandpile.runtime.Config;
import org.sandpile.runtime.api.SimulationSnapshot;
import org.sandpile.runtime.spi.ISimulationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes every published frame as a PNG file named after its zero-padded frame index,
 * so the lexicographic order of the files is the order of the frames.
 */
public class PngFramePersister implements ISimulationObserver {

    private static final Logger LOG = LoggerFactory.getLogger(PngFramePersister.class);

    private final Path directory;
    private final SandpileFrameRenderer renderer;
    private long framesWritten = 0;

    /**
     * Creates the persister and its target directory.
     *
     * @param directory The directory frames are written to; created if missing.
     * @param renderer The renderer that draws each frame.
     * @throws UncheckedIOException if the directory cannot be created.
     */
    public PngFramePersister(Path directory, SandpileFrameRenderer renderer) {
        this.directory = directory;
        this.renderer = renderer;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create frame directory " + directory.toAbsolutePath(), e);
        }
    }

    @Override
    public void onFrame(long frameIndex, SimulationSnapshot snapshot) {
        renderer.render(snapshot);
        Path file = frameFile(frameIndex);
        try {
            if (!ImageIO.write(renderer.toImage(), "png", file.toFile())) {
                throw new IOException("No PNG writer available");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write frame " + file.toAbsolutePath(), e);
        }
        framesWritten++;
        if (framesWritten % 1000 == 0) {
            LOG.debug("Wrote {} frames to {}", framesWritten, directory);
        }
    }

    @Override
    public void onRunCompleted(SimulationSnapshot snapshot) {
        LOG.info("Wrote {} frames to {}", framesWritten, directory.toAbsolutePath());
    }

    /**
     * Resolves the file a frame is written to.
     *
     * @param frameIndex The frame index.
     * @return The path of the frame file.
     */
    public Path frameFile(long frameIndex) {
        return directory.resolve(Config.frameFileName(frameIndex));
    }

    /**
     * Returns the number of frames written so far.
     *
     * @return The frame count.
     */
    public long getFramesWritten() {
        return framesWritten;
    }
}
