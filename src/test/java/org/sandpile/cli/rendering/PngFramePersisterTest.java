package org.sandpile.cli.rendering;

import org.sandpile.runtime.Simulation;
import org.sandpile.runtime.SimulationConfig;
import org.sandpile.runtime.internal.services.SeededRandomProvider;
import org.sandpile.runtime.model.GridProperties;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("integration")
class PngFramePersisterTest {

    @Test
    void writesOneZeroPaddedPngPerFrame(@TempDir Path tempDir) throws Exception {
        Path frames = tempDir.resolve("images");
        SimulationConfig config = new SimulationConfig(3, 5, 1L, 0L, 100, 50, false, true);
        Simulation simulation = new Simulation(config, new SeededRandomProvider(4L));
        SandpileFrameRenderer renderer = new SandpileFrameRenderer(new GridProperties(3), 2, 5);
        PngFramePersister persister = new PngFramePersister(frames, renderer);
        simulation.addObserver(persister);

        simulation.run();

        List<String> names;
        try (Stream<Path> files = Files.list(frames)) {
            names = files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
        assertEquals(simulation.getFramesPublished(), names.size());
        assertEquals(simulation.getFramesPublished(), persister.getFramesWritten());
        assertThat(names).startsWith("00000000.png", "00000001.png");
        assertThat(names).allMatch(n -> n.matches("\\d{8}\\.png"));

        BufferedImage first = ImageIO.read(frames.resolve("00000000.png").toFile());
        assertEquals(renderer.getWidth(), first.getWidth());
        assertEquals(renderer.getHeight(), first.getHeight());
    }

    @Test
    void frameFileUsesEightDigits(@TempDir Path tempDir) {
        PngFramePersister persister = new PngFramePersister(tempDir, new SandpileFrameRenderer(new GridProperties(3), 2, 5));

        assertEquals(tempDir.resolve("00000042.png"), persister.frameFile(42));
        assertEquals(tempDir.resolve("12345678.png"), persister.frameFile(12345678));
    }

    @Test
    void unusableDirectoryFailsFast(@TempDir Path tempDir) throws Exception {
        Path blocker = tempDir.resolve("file");
        Files.writeString(blocker, "not a directory");

        assertThrows(UncheckedIOException.class,
                () -> new PngFramePersister(blocker.resolve("images"), new SandpileFrameRenderer(new GridProperties(3), 2, 5)));
    }
}
