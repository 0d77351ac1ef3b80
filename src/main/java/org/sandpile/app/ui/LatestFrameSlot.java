package org.sandpile.app.ui;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Hands frames from the simulation thread to a drawing thread, keeping only the newest one.
 * <p>
 * At most one draw task is pending on the executor at any time. Frames offered while a draw is
 * pending replace the waiting frame, so a slow drawing thread skips frames instead of queueing them.
 *
 * @param <T> The frame type.
 */
final class LatestFrameSlot<T> {

    private final AtomicReference<T> latest = new AtomicReference<>();
    private final AtomicBoolean drawScheduled = new AtomicBoolean(false);
    private final Executor drawExecutor;
    private final Consumer<T> drawer;

    /**
     * @param drawExecutor Runs draw tasks, e.g. {@code Platform::runLater}.
     * @param drawer Draws a frame on the executor's thread.
     */
    LatestFrameSlot(Executor drawExecutor, Consumer<T> drawer) {
        this.drawExecutor = Objects.requireNonNull(drawExecutor, "drawExecutor");
        this.drawer = Objects.requireNonNull(drawer, "drawer");
    }

    /**
     * Stores the frame, replacing any frame not drawn yet, and schedules a draw if none is pending.
     *
     * @param frame The newest frame.
     */
    void offer(T frame) {
        latest.set(Objects.requireNonNull(frame, "frame"));
        if (drawScheduled.compareAndSet(false, true)) {
            drawExecutor.execute(this::drawLatest);
        }
    }

    private void drawLatest() {
        drawScheduled.set(false);
        T frame = latest.getAndSet(null);
        if (frame != null) {
            drawer.accept(frame);
        }
    }
}
