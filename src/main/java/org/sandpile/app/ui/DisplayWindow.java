package org.sandpile.app.ui;

import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.scene.image.ImageView;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.WritableImage;
import javafx.scene.layout.BorderPane;
import javafx.stage.Stage;
import org.sandpile.cli.rendering.SandpileFrameRenderer;
import org.sandpile.runtime.api.SimulationSnapshot;
import org.sandpile.runtime.spi.ISimulationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Shows every published frame in a JavaFX window.
 * <p>
 * The simulation keeps running on its own thread; frames are handed to the JavaFX application
 * thread as copied pixel buffers. Only the newest undrawn frame is kept, so a busy JavaFX thread
 * skips frames. After each frame the simulation thread sleeps for the configured
 * pause so the animation can be followed. When the run completes, the call blocks until the user
 * closes the window.
 */
public class DisplayWindow implements ISimulationObserver {

    private static final Logger LOG = LoggerFactory.getLogger(DisplayWindow.class);

    private final SandpileFrameRenderer renderer;
    private final long pauseMillis;
    private final CountDownLatch closed = new CountDownLatch(1);
    private final LatestFrameSlot<Frame> pendingFrame = new LatestFrameSlot<>(Platform::runLater, this::draw);
    private WritableImage image;
    private Stage stage;

    /**
     * Creates the window. The JavaFX runtime is started with the first frame.
     *
     * @param renderer The renderer that draws each frame.
     * @param pauseMillis Delay after each frame, at least 0.
     */
    public DisplayWindow(SandpileFrameRenderer renderer, long pauseMillis) {
        if (pauseMillis < 0) {
            throw new IllegalArgumentException("Pause must not be negative: " + pauseMillis);
        }
        this.renderer = renderer;
        this.pauseMillis = pauseMillis;
    }

    @Override
    public void onFrame(long frameIndex, SimulationSnapshot snapshot) {
        ensureShown();
        int[] pixels = renderer.render(snapshot).clone();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] |= 0xFF000000;
        }
        pendingFrame.offer(new Frame(pixels, snapshot.dropsCompleted(), frameIndex));
        pause();
    }

    private void draw(Frame frame) {
        int width = renderer.getWidth();
        image.getPixelWriter().setPixels(0, 0, width, renderer.getHeight(), PixelFormat.getIntArgbInstance(), frame.pixels(), 0, width);
        stage.setTitle("Sandpile - drop " + frame.dropsCompleted() + ", frame " + frame.frameIndex());
    }

    @Override
    public void onRunCompleted(SimulationSnapshot snapshot) {
        if (stage == null) {
            return;
        }
        LOG.info("Run finished. Close the window to exit.");
        try {
            closed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Platform.exit();
    }

    private void pause() {
        if (pauseMillis == 0) {
            return;
        }
        try {
            Thread.sleep(pauseMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void ensureShown() {
        if (stage != null) {
            return;
        }
        CountDownLatch shown = new CountDownLatch(1);
        Runnable createStage = () -> {
            image = new WritableImage(renderer.getWidth(), renderer.getHeight());
            BorderPane root = new BorderPane(new ImageView(image));
            stage = new Stage();
            stage.setTitle("Sandpile");
            stage.setScene(new Scene(root, renderer.getWidth(), renderer.getHeight()));
            stage.setOnHidden(event -> closed.countDown());
            stage.show();
            shown.countDown();
        };
        try {
            Platform.startup(createStage);
        } catch (IllegalStateException alreadyRunning) {
            Platform.runLater(createStage);
        }
        Platform.setImplicitExit(false);
        try {
            shown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while opening the display window", e);
        }
    }

    private record Frame(int[] pixels, long dropsCompleted, long frameIndex) {
    }
}
