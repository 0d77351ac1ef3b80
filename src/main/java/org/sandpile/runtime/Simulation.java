package org.sandpile.runtime;

import org.sandpile.runtime.api.SimulationSnapshot;
import org.sandpile.runtime.api.SimulationSnapshot.Phase;
import org.sandpile.runtime.model.Cell;
import org.sandpile.runtime.model.Grid;
import org.sandpile.runtime.model.GridProperties;
import org.sandpile.runtime.spi.IRandomProvider;
import org.sandpile.runtime.spi.ISimulationObserver;
import org.sandpile.runtime.statistics.CascadeStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Manages the sandpile run: owns the grid, the topple engine and the cascade statistics,
 * drops grains one at a time and publishes the resulting state to registered observers.
 * <p>
 * Each drop is fully relaxed before the next begins. After every drop the mean height is
 * appended to the average series and the avalanche size is binned, in that order.
 * When display or frame persistence is enabled, observers additionally receive a frame after
 * the deposit, after every individual toppling and once after the drop completes.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);
    private final SimulationConfig config;
    private final Grid grid;
    private final ToppleEngine engine;
    private final CascadeStatistics statistics;
    private final List<ISimulationObserver> observers = new ArrayList<>();
    private final boolean frameEventsEnabled;
    private long dropsCompleted = 0L;
    private long nextFrameIndex = 0L;
    private boolean started = false;

    /**
     * Constructs a simulation with a randomly initialized grid.
     * @param config The validated run settings.
     * @param randomProvider The run's random provider; grid initialization and drop positions
     *                       use independent streams derived from it.
     */
    public Simulation(SimulationConfig config, IRandomProvider randomProvider) {
        this(config,
                Grid.randomized(new GridProperties(config.gridSize()), randomProvider.deriveFor("grid-init", 0L)),
                randomProvider);
    }

    /**
     * Constructs a simulation on an existing grid.
     * @param config The validated run settings.
     * @param grid The grid to drop on; its size must match the configuration.
     * @param randomProvider The run's random provider.
     */
    public Simulation(SimulationConfig config, Grid grid, IRandomProvider randomProvider) {
        if (grid.getSize() != config.gridSize()) {
            throw new SimulationConfigurationException("simulation.grid-size",
                    "grid has size " + grid.getSize() + " but configuration requests " + config.gridSize());
        }
        this.config = config;
        this.grid = grid;
        this.engine = new ToppleEngine(randomProvider.deriveFor("drops", 0L), config.maxWaves());
        this.statistics = new CascadeStatistics(config.maxCascade(), config.numBins());
        this.frameEventsEnabled = config.frameEventsEnabled();
        this.statistics.recordAverage(grid);
    }

    /**
     * Registers an observer. Observers are notified in registration order.
     * @param observer The observer to add.
     */
    public void addObserver(ISimulationObserver observer) {
        this.observers.add(observer);
    }

    /**
     * Runs all configured drops.
     */
    public void run() {
        ensureStarted();
        for (int i = 0; i < config.iterations(); i++) {
            step();
        }
        SimulationSnapshot finalSnapshot = snapshot(Phase.DROP_COMPLETED);
        for (ISimulationObserver observer : observers) {
            observer.onRunCompleted(finalSnapshot);
        }
        LOG.info("Simulation finished: drops={}, finalMean={}, binnedAvalanches={}, discardedAvalanches={}",
                dropsCompleted, String.format("%.4f", statistics.getLatestAverage()),
                statistics.getRecordedCount(), statistics.getDiscardedCount());
    }

    /**
     * Drops a single grain, relaxes the grid, updates the statistics and notifies observers.
     * @return The outcome of the drop.
     */
    public DropResult step() {
        ensureStarted();
        DropResult result = frameEventsEnabled
                ? engine.drop(grid, new FramePublisher())
                : engine.drop(grid);

        statistics.recordAverage(grid);
        statistics.recordAvalanche(result.avalancheSize());
        dropsCompleted++;

        if (LOG.isDebugEnabled()) {
            LOG.debug("Drop={} Origin={} AvalancheSize={} Topplings={} Waves={} Mean={}",
                    dropsCompleted, result.origin(), result.avalancheSize(), result.toppleCount(),
                    result.waveCount(), statistics.getLatestAverage());
        }

        SimulationSnapshot completed = snapshot(Phase.DROP_COMPLETED);
        if (frameEventsEnabled) {
            publishFrame(completed);
        }
        for (ISimulationObserver observer : observers) {
            observer.onDropCompleted(completed, result);
        }
        return result;
    }

    private void ensureStarted() {
        if (started) {
            return;
        }
        started = true;
        LOG.info("Simulation started: gridSize={}, iterations={}, maxCascade={}, numBins={}, display={}, persistFrames={}, initialMean={}",
                config.gridSize(), config.iterations(), config.maxCascade(), config.numBins(),
                config.display(), config.persistFrames(), String.format("%.4f", statistics.getLatestAverage()));
        SimulationSnapshot initial = snapshot(Phase.INITIAL);
        for (ISimulationObserver observer : observers) {
            observer.onRunStarted(initial);
        }
    }

    private void publishFrame(SimulationSnapshot snapshot) {
        long frameIndex = nextFrameIndex++;
        for (ISimulationObserver observer : observers) {
            observer.onFrame(frameIndex, snapshot);
        }
    }

    /**
     * Builds a snapshot of the current state.
     * @param phase The step the snapshot follows.
     * @return A snapshot holding copies of all state.
     */
    public SimulationSnapshot snapshot(Phase phase) {
        return new SimulationSnapshot(
                phase,
                dropsCompleted,
                grid.snapshot(),
                engine.toppledCountSnapshot(grid.getSize()),
                statistics.getAverageSeries(),
                statistics.getBinCounts(),
                statistics.getBinCutoffs());
    }

    /**
     * Returns the grid. Callers must treat it as read-only.
     * @return The grid.
     */
    public Grid getGrid() { return grid; }

    /**
     * Returns the cascade statistics. Callers must treat them as read-only.
     * @return The statistics.
     */
    public CascadeStatistics getStatistics() { return statistics; }

    /**
     * Returns the run settings.
     * @return The configuration.
     */
    public SimulationConfig getConfig() { return config; }

    /**
     * Returns the number of completed drops.
     * @return The drop count.
     */
    public long getDropsCompleted() { return dropsCompleted; }

    /**
     * Returns the number of frames published so far.
     * @return The frame count.
     */
    public long getFramesPublished() { return nextFrameIndex; }

    private final class FramePublisher implements ToppleListener {
        @Override
        public void afterDeposit(Cell cell) {
            publishFrame(snapshot(Phase.DEPOSIT));
        }

        @Override
        public void afterTopple(ToppleEvent event) {
            publishFrame(snapshot(Phase.TOPPLE));
        }
    }
}
