package org.sandpile.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.sandpile.app.ui.DisplayWindow;
import org.sandpile.cli.OutputSettings;
import org.sandpile.cli.export.RunSummary;
import org.sandpile.cli.export.RunSummaryWriter;
import org.sandpile.cli.rendering.PngFramePersister;
import org.sandpile.cli.rendering.SandpileFrameRenderer;
import org.sandpile.node.config.ConfigLoader;
import org.sandpile.node.config.LoggingConfigurator;
import org.sandpile.runtime.Simulation;
import org.sandpile.runtime.SimulationConfig;
import org.sandpile.runtime.SimulationConfigurationException;
import org.sandpile.runtime.internal.services.SeededRandomProvider;
import org.sandpile.runtime.spi.ISimulationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

@Command(name = "run", description = "Drops grains on a sandpile and records avalanche statistics.")
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"-c", "--config"}, description = "Path to custom configuration file (default: sandpile.conf)")
    private File configFile;

    @Option(names = "--grid-size", description = "Edge length of the square grid.")
    private Integer gridSize;

    @Option(names = "--iterations", description = "Number of grains to drop.")
    private Integer iterations;

    @Option(names = "--seed", description = "Seed of the random provider.")
    private Long seed;

    @Option(names = "--display", description = "Show every frame in a window.")
    private Boolean display;

    @Option(names = "--persist-frames", description = "Write every frame as a PNG file.")
    private Boolean persistFrames;

    @Option(names = "--frames", description = "Directory persisted frames are written to.")
    private File frameDirectory;

    @Option(names = "--summary", description = "Write a JSON summary of the run to this file.")
    private File summaryFile;

    private BiFunction<SandpileFrameRenderer, Long, ISimulationObserver> displayFactory = DisplayWindow::new;

    /**
     * Replaces how the display observer is created.
     *
     * @param displayFactory Creates the display from its renderer and the pause per frame.
     */
    void setDisplayFactory(BiFunction<SandpileFrameRenderer, Long, ISimulationObserver> displayFactory) {
        this.displayFactory = displayFactory;
    }

    @Override
    public Integer call() {
        final Config config;
        final SimulationConfig simulationConfig;
        final OutputSettings output;
        try {
            config = ConfigLoader.withOverrides(ConfigLoader.load(configFile), overrides());
            LoggingConfigurator.configure(config);
            simulationConfig = SimulationConfig.fromConfig(config.getConfig("sandpile"));
            output = OutputSettings.fromConfig(config.getConfig("sandpile.output"));
        } catch (ConfigException | SimulationConfigurationException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }

        log.info("Starting run with seed {}", simulationConfig.seed());
        final Simulation simulation = new Simulation(simulationConfig, new SeededRandomProvider(simulationConfig.seed()));
        try {
            if (simulationConfig.frameEventsEnabled()) {
                final SandpileFrameRenderer renderer = new SandpileFrameRenderer(
                        simulation.getGrid().getProperties(), output.cellSize(), simulationConfig.iterations());
                if (simulationConfig.persistFrames()) {
                    simulation.addObserver(new PngFramePersister(output.frameDirectory(), renderer));
                }
                if (simulationConfig.display()) {
                    // The display gets its own renderer; frames are handed to another thread.
                    simulation.addObserver(displayFactory.apply(
                            new SandpileFrameRenderer(simulation.getGrid().getProperties(), output.cellSize(), simulationConfig.iterations()),
                            output.pauseMillis()));
                }
            }
            simulation.run();
            if (output.summaryFile().isPresent()) {
                new RunSummaryWriter().write(output.summaryFile().get(), RunSummary.of(simulation));
            }
        } catch (UncheckedIOException | UnsupportedOperationException e) {
            // JavaFX reports a missing display as UnsupportedOperationException.
            log.error("Run aborted: {}", e.getMessage(), e);
            return 1;
        }
        return 0;
    }

    private Map<String, Object> overrides() {
        final Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put("sandpile.simulation.grid-size", gridSize);
        overrides.put("sandpile.simulation.iterations", iterations);
        overrides.put("sandpile.simulation.seed", seed);
        overrides.put("sandpile.output.display", display);
        overrides.put("sandpile.output.persist-frames", persistFrames);
        overrides.put("sandpile.output.frame-directory", frameDirectory == null ? null : frameDirectory.getPath());
        overrides.put("sandpile.output.summary-file", summaryFile == null ? null : summaryFile.getPath());
        return overrides;
    }
}
