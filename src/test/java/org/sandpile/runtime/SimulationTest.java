package org.sandpile.runtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.sandpile.junit.extensions.logging.LogWatchExtension;
import org.sandpile.runtime.api.SimulationSnapshot;
import org.sandpile.runtime.api.SimulationSnapshot.Phase;
import org.sandpile.runtime.internal.services.SeededRandomProvider;
import org.sandpile.runtime.model.Grid;
import org.sandpile.runtime.model.GridProperties;
import org.sandpile.runtime.spi.IRandomProvider;
import org.sandpile.runtime.spi.ISimulationObserver;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class SimulationTest {

    @Mock
    private ISimulationObserver observer;

    private static SimulationConfig config(int gridSize, int iterations, boolean persistFrames) {
        return new SimulationConfig(gridSize, iterations, 42L, 0L, 100, 50, false, persistFrames);
    }

    /**
     * A random provider whose drop stream always picks the given cell.
     */
    private static IRandomProvider fixedDrops(int gridSize, int x, int y) {
        IRandomProvider drops = mock(IRandomProvider.class);
        when(drops.nextInt(gridSize)).thenReturn(x, y);
        IRandomProvider root = mock(IRandomProvider.class);
        when(root.deriveFor(eq("drops"), anyLong())).thenReturn(drops);
        return root;
    }

    @Test
    void baselineAverageIsRecordedOnConstruction() {
        Simulation simulation = new Simulation(config(3, 1, false), new Grid(new GridProperties(3)), new SeededRandomProvider(1L));

        assertArrayEquals(new double[]{0.0}, simulation.getStatistics().getAverageSeries());
    }

    @Test
    void dropOnEmptyGridRecordsOneNinth() {
        Simulation simulation = new Simulation(config(3, 1, false), new Grid(new GridProperties(3)), new SeededRandomProvider(1L));

        DropResult result = simulation.step();

        assertEquals(0, result.avalancheSize());
        assertArrayEquals(new double[]{0.0, 1.0 / 9.0}, simulation.getStatistics().getAverageSeries(), 1e-12);
        assertEquals(1, simulation.getStatistics().getBinCounts()[0]);
        assertEquals(1, simulation.getDropsCompleted());
    }

    @Test
    void runPerformsConfiguredNumberOfDrops() {
        Simulation simulation = new Simulation(config(10, 300, false), new SeededRandomProvider(3L));

        simulation.run();

        assertEquals(300, simulation.getDropsCompleted());
        assertEquals(301, simulation.getStatistics().getAverageSeries().length);
        assertEquals(300, simulation.getStatistics().getRecordedCount() + simulation.getStatistics().getDiscardedCount());
        assertTrue(simulation.getGrid().isStable());
    }

    @Test
    void headlessRunPublishesNoFrames() {
        Simulation simulation = new Simulation(config(5, 40, false), new SeededRandomProvider(3L));
        simulation.addObserver(observer);

        simulation.run();

        verify(observer, never()).onFrame(anyLong(), any());
        verify(observer, times(40)).onDropCompleted(any(), any());
        assertEquals(0, simulation.getFramesPublished());
        InOrder order = inOrder(observer);
        order.verify(observer).onRunStarted(any());
        order.verify(observer, times(40)).onDropCompleted(any(), any());
        order.verify(observer).onRunCompleted(any());
    }

    @Test
    void frameModePublishesDepositToppleAndCompletionFrames() {
        List<DropResult> results = new ArrayList<>();
        Simulation simulation = new Simulation(config(5, 60, true), new SeededRandomProvider(8L));
        simulation.addObserver(observer);
        simulation.addObserver(new ISimulationObserver() {
            @Override
            public void onDropCompleted(SimulationSnapshot snapshot, DropResult result) {
                results.add(result);
            }
        });

        simulation.run();

        long expectedFrames = results.stream().mapToLong(r -> 2L + r.toppleCount()).sum();
        assertEquals(expectedFrames, simulation.getFramesPublished());
        ArgumentCaptor<Long> indices = ArgumentCaptor.forClass(Long.class);
        verify(observer, times((int) expectedFrames)).onFrame(indices.capture(), any());
        for (int i = 0; i < indices.getAllValues().size(); i++) {
            assertEquals(i, indices.getAllValues().get(i));
        }
        verify(observer, times(60)).onDropCompleted(any(), any());
    }

    @Test
    void framesFollowTheDropStepByStep() {
        Grid grid = Grid.of(new int[][]{
                {0, 3, 0},
                {0, 3, 0},
                {0, 0, 0}
        });
        List<SimulationSnapshot> frames = new ArrayList<>();
        Simulation simulation = new Simulation(config(3, 1, true), grid, fixedDrops(3, 1, 1));
        simulation.addObserver(new ISimulationObserver() {
            @Override
            public void onFrame(long frameIndex, SimulationSnapshot snapshot) {
                frames.add(snapshot);
            }
        });

        simulation.step();

        assertThat(frames).extracting(SimulationSnapshot::phase)
                .containsExactly(Phase.DEPOSIT, Phase.TOPPLE, Phase.TOPPLE, Phase.DROP_COMPLETED);
        assertEquals(4, frames.get(0).heightAt(1, 1));
        assertEquals(0, frames.get(0).toppledCountAt(1, 1));
        assertEquals(0, frames.get(1).heightAt(1, 1));
        assertEquals(4, frames.get(1).heightAt(0, 1));
        assertEquals(2, frames.get(1).toppledCountAt(1, 1));
        assertEquals(1, frames.get(2).toppledCountAt(0, 1));
        assertEquals(0, frames.get(2).dropsCompleted());
        assertEquals(1, frames.get(3).dropsCompleted());
        assertEquals(2, frames.get(3).averageSeries().length);
    }

    @Test
    void startIsLoggedOnceBeforeObserversAreNotified() {
        Logger logger = (Logger) LoggerFactory.getLogger(Simulation.class);
        Level previousLevel = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.INFO);
        try {
            Simulation simulation = new Simulation(config(4, 3, false), new SeededRandomProvider(5L));
            List<Long> startLogsSeenByObserver = new ArrayList<>();
            simulation.addObserver(new ISimulationObserver() {
                @Override
                public void onRunStarted(SimulationSnapshot snapshot) {
                    startLogsSeenByObserver.add(countStartLogs(appender));
                }
            });

            simulation.step();
            simulation.run();

            assertThat(startLogsSeenByObserver).containsExactly(1L);
            assertEquals(1L, countStartLogs(appender));
            assertEquals(4, simulation.getDropsCompleted());
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previousLevel);
        }
    }

    private static long countStartLogs(ListAppender<ILoggingEvent> appender) {
        return appender.list.stream()
                .filter(event -> event.getFormattedMessage().startsWith("Simulation started"))
                .count();
    }

    @Test
    void snapshotsAreIsolatedFromLaterSteps() {
        Simulation simulation = new Simulation(config(4, 100, false), new SeededRandomProvider(12L));
        SimulationSnapshot before = simulation.snapshot(Phase.INITIAL);
        int[][] heightsBefore = before.heights();

        for (int i = 0; i < 50; i++) {
            simulation.step();
        }

        assertArrayEquals(heightsBefore, before.heights());
        assertEquals(1, before.averageSeries().length);
        assertEquals(0, before.dropsCompleted());

        int[][] copy = before.heights();
        copy[0][0] = 99;
        before.averageSeries()[0] = -1;
        assertNotEquals(99, before.heightAt(0, 0));
        assertNotEquals(-1.0, before.averageSeries()[0]);
    }

    @Test
    void sameSeedReproducesRun() {
        Simulation first = new Simulation(config(8, 400, false), new SeededRandomProvider(77L));
        Simulation second = new Simulation(config(8, 400, false), new SeededRandomProvider(77L));

        first.run();
        second.run();

        assertArrayEquals(first.getGrid().snapshot(), second.getGrid().snapshot());
        assertArrayEquals(first.getStatistics().getBinCounts(), second.getStatistics().getBinCounts());
        assertArrayEquals(first.getStatistics().getAverageSeries(), second.getStatistics().getAverageSeries());
    }

    @Test
    void gridSizeMustMatchConfiguration() {
        assertThatThrownBy(() -> new Simulation(config(4, 1, false), new Grid(new GridProperties(3)), new SeededRandomProvider(1L)))
                .isInstanceOf(SimulationConfigurationException.class)
                .hasMessageContaining("simulation.grid-size");
    }
}
