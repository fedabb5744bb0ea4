/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Mortis.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.mortis.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the virtual-clock frame scheduler.
 *
 * @author hal.hildebrand
 */
public class FrameSchedulerTest {

    private static final Duration FRAME = Duration.ofMillis(100);

    private FrameScheduler scheduler;

    @BeforeEach
    public void setup() {
        scheduler = new FrameScheduler();
    }

    @Test
    public void testDelayedTaskRunsOnlyOnceDue() {
        var runs = new AtomicInteger();
        scheduler.schedule("delayed", Duration.ofMillis(250), runs::incrementAndGet);

        scheduler.tick(FRAME);
        scheduler.tick(FRAME);
        assertEquals(0, runs.get(), "Not due before 250ms");

        scheduler.tick(FRAME);
        assertEquals(1, runs.get(), "Due at 300ms");

        scheduler.tick(FRAME);
        assertEquals(1, runs.get(), "Delayed tasks run exactly once");
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    public void testNextFrameRunsOnFollowingTick() {
        var order = new ArrayList<String>();
        scheduler.tick(FRAME);
        scheduler.nextFrame("a", () -> order.add("a"));
        assertTrue(order.isEmpty());

        scheduler.tick(Duration.ZERO);
        assertEquals(List.of("a"), order);
    }

    @Test
    public void testWorkScheduledDuringTickWaitsForNextTick() {
        var order = new ArrayList<String>();
        scheduler.nextFrame("outer", () -> {
            order.add("outer");
            scheduler.nextFrame("inner", () -> order.add("inner"));
            scheduler.schedule("zero", Duration.ZERO, () -> order.add("zero"));
        });

        scheduler.tick(FRAME);
        assertEquals(List.of("outer"), order);

        scheduler.tick(FRAME);
        assertEquals(List.of("outer", "inner", "zero"), order);
    }

    @Test
    public void testTasksRunInDueOrderThenSubmissionOrder() {
        var order = new ArrayList<String>();
        scheduler.schedule("late", Duration.ofMillis(50), () -> order.add("late"));
        scheduler.schedule("early", Duration.ofMillis(10), () -> order.add("early"));
        scheduler.schedule("early-2", Duration.ofMillis(10), () -> order.add("early-2"));

        scheduler.tick(FRAME);
        assertEquals(List.of("early", "early-2", "late"), order);
    }

    @Test
    public void testCancelledTaskNeverRuns() {
        var runs = new AtomicInteger();
        var task = scheduler.schedule("cancel-me", Duration.ofMillis(10), runs::incrementAndGet);

        assertTrue(task.cancel());
        assertFalse(task.cancel(), "Second cancel is a no-op");
        scheduler.tick(FRAME);

        assertEquals(0, runs.get());
        assertTrue(task.isCancelled());
        assertFalse(task.isDone());
    }

    @Test
    public void testEveryFrameUntilCancelled() {
        var runs = new AtomicInteger();
        var task = scheduler.everyFrame("update", runs::incrementAndGet);

        scheduler.runFor(Duration.ofMillis(500), FRAME);
        assertEquals(5, runs.get());

        task.cancel();
        scheduler.tick(FRAME);
        assertEquals(5, runs.get());
    }

    @Test
    public void testFailingTaskDoesNotStopOthers() {
        var runs = new AtomicInteger();
        var failing = scheduler.nextFrame("boom", () -> {
            throw new IllegalStateException("boom");
        });
        scheduler.nextFrame("survivor", runs::incrementAndGet);

        assertDoesNotThrow(() -> scheduler.tick(FRAME));
        assertEquals(1, runs.get());
        assertTrue(failing.isCancelled());
    }

    @Test
    public void testRunForShortensLastStep() {
        var ticks = scheduler.runFor(Duration.ofMillis(250), FRAME);

        assertEquals(3, ticks);
        assertEquals(Duration.ofMillis(250), scheduler.now());
        assertEquals(3, scheduler.frame());
    }

    @Test
    public void testRejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.tick(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class,
                     () -> scheduler.schedule("bad", Duration.ofMillis(-1), () -> {
                     }));
    }

    @Test
    public void testTickIsNotReentrant() {
        var failure = new ArrayList<Throwable>();
        scheduler.nextFrame("reenter", () -> {
            try {
                scheduler.tick(FRAME);
            } catch (IllegalStateException e) {
                failure.add(e);
            }
        });

        scheduler.tick(FRAME);
        assertEquals(1, failure.size());
    }

    @Test
    public void testCancelAll() {
        var runs = new AtomicInteger();
        scheduler.schedule("a", Duration.ofMillis(10), runs::incrementAndGet);
        scheduler.everyFrame("b", runs::incrementAndGet);

        scheduler.cancelAll();
        scheduler.tick(FRAME);

        assertEquals(0, runs.get());
        assertEquals(0, scheduler.pendingCount());
    }
}
