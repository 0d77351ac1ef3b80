package org.sandpile.app.ui;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class LatestFrameSlotTest {

    private final Deque<Runnable> queuedTasks = new ArrayDeque<>();
    private final List<Integer> drawn = new ArrayList<>();
    private final LatestFrameSlot<Integer> slot = new LatestFrameSlot<>(queuedTasks::add, drawn::add);

    @Test
    void framesOfferedWhileDrawIsPendingQueueOnlyOneTask() {
        for (int frame = 0; frame < 10_000; frame++) {
            slot.offer(frame);
        }

        assertEquals(1, queuedTasks.size());
        queuedTasks.poll().run();
        assertThat(drawn).containsExactly(9_999);
    }

    @Test
    void frameOfferedAfterDrawSchedulesNextDraw() {
        slot.offer(1);
        queuedTasks.poll().run();

        slot.offer(2);
        slot.offer(3);

        assertEquals(1, queuedTasks.size());
        queuedTasks.poll().run();
        assertThat(drawn).containsExactly(1, 3);
    }

    @Test
    void drawWithoutWaitingFrameDoesNothing() {
        slot.offer(1);
        Runnable first = queuedTasks.poll();
        first.run();
        first.run();

        assertThat(drawn).containsExactly(1);
        assertTrue(queuedTasks.isEmpty());
    }
}
