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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Cooperative, single-threaded task runner driven by an explicit frame tick.
 * <p>
 * Work is suspended in one of two ways:
 * <ol>
 *   <li>{@link #schedule(String, Duration, Runnable)} resumes after a fixed amount of scheduler time</li>
 *   <li>{@link #nextFrame(String, Runnable)} resumes on the following tick</li>
 * </ol>
 * plus {@link #everyFrame(String, Runnable)} for per-frame updates. Time is virtual: it only moves when the owner
 * calls {@link #tick(Duration)}, so the whole subsystem can be driven deterministically from tests.
 * <p>
 * Work scheduled while a tick is running never runs in that same tick. Tasks that throw are logged and dropped; the
 * remaining tasks of the tick still run.
 * <p>
 * Usage:
 * <pre>
 * var scheduler = new FrameScheduler();
 * scheduler.schedule("respawn", Duration.ofSeconds(2), this::respawn);
 *
 * // Main loop
 * while (running) {
 *     scheduler.tick(frameDelta);
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class FrameScheduler {
    private static final Logger log = LoggerFactory.getLogger(FrameScheduler.class);

    private static final Comparator<ScheduledTask> ORDER = Comparator.comparingLong(ScheduledTask::dueNanos)
                                                                     .thenComparingLong(ScheduledTask::sequence);

    private final PriorityQueue<ScheduledTask> queue = new PriorityQueue<>(ORDER);
    private       long                         nowNanos;
    private       long                         frame;
    private       long                         nextSequence;
    private       boolean                      ticking;

    /**
     * Cancel every pending task
     */
    public void cancelAll() {
        queue.forEach(ScheduledTask::cancel);
        queue.clear();
    }

    /**
     * Run the action on every tick, starting with the next one, until the returned task is cancelled
     */
    public ScheduledTask everyFrame(String label, Runnable action) {
        return enqueue(label, action, ScheduledTask.Kind.EVERY_FRAME, nowNanos);
    }

    /**
     * Number of ticks executed so far
     */
    public long frame() {
        return frame;
    }

    /**
     * Run the action on the next tick
     */
    public ScheduledTask nextFrame(String label, Runnable action) {
        return enqueue(label, action, ScheduledTask.Kind.NEXT_FRAME, nowNanos);
    }

    /**
     * Current scheduler time
     */
    public Duration now() {
        return Duration.ofNanos(nowNanos);
    }

    /**
     * Number of tasks still waiting to run, cancelled tasks excluded
     */
    public int pendingCount() {
        return (int) queue.stream().filter(ScheduledTask::isPending).count();
    }

    /**
     * Tick repeatedly with the given step until {@code total} scheduler time has elapsed. The last step is shortened
     * so that exactly {@code total} elapses.
     *
     * @return the number of ticks executed
     */
    public int runFor(Duration total, Duration step) {
        if (step.isNegative() || step.isZero()) {
            throw new IllegalArgumentException("Step must be positive: " + step);
        }
        var remaining = total.toNanos();
        var ticks = 0;
        while (remaining > 0) {
            var delta = Math.min(remaining, step.toNanos());
            tick(Duration.ofNanos(delta));
            remaining -= delta;
            ticks++;
        }
        return ticks;
    }

    /**
     * Resume the action once {@code delay} of scheduler time has elapsed. The action runs on the first tick at or
     * after its due time, never on the tick during which it was scheduled.
     */
    public ScheduledTask schedule(String label, Duration delay, Runnable action) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative: " + delay);
        }
        return enqueue(label, action, ScheduledTask.Kind.DELAYED, nowNanos + delay.toNanos());
    }

    /**
     * Advance the clock by {@code delta} and run every task that has become due.
     *
     * @param delta elapsed time for this frame, zero is allowed
     * @return the number of tasks run
     */
    public int tick(Duration delta) {
        Objects.requireNonNull(delta, "delta");
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Frame delta must not be negative: " + delta);
        }
        if (ticking) {
            throw new IllegalStateException("tick() is not reentrant");
        }
        ticking = true;
        try {
            frame++;
            nowNanos += delta.toNanos();

            var repeating = new ArrayList<ScheduledTask>();
            var ran = 0;
            while (!queue.isEmpty()) {
                var head = queue.peek();
                if (head.dueNanos() > nowNanos || head.eligibleFrame() > frame) {
                    break;
                }
                queue.poll();
                if (head.isCancelled()) {
                    continue;
                }
                run(head);
                ran++;
                if (head.kind() == ScheduledTask.Kind.EVERY_FRAME && !head.isCancelled()) {
                    head.rearm(nowNanos, frame + 1);
                    repeating.add(head);
                } else {
                    head.markDone();
                }
            }
            queue.addAll(repeating);
            return ran;
        } finally {
            ticking = false;
        }
    }

    @Override
    public String toString() {
        return String.format("FrameScheduler{frame=%d, now=%dns, pending=%d}", frame, nowNanos, pendingCount());
    }

    private ScheduledTask enqueue(String label, Runnable action, ScheduledTask.Kind kind, long dueNanos) {
        Objects.requireNonNull(action, "action");
        var task = new ScheduledTask(label, action, kind, nextSequence++, dueNanos, frame + 1);
        queue.add(task);
        return task;
    }

    private void run(ScheduledTask task) {
        try {
            task.action().run();
        } catch (RuntimeException e) {
            log.warn("Scheduled task {} failed at frame {}, dropping it", task.getLabel(), frame, e);
            task.cancel();
        }
    }
}
