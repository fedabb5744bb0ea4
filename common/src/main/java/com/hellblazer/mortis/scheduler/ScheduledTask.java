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

import java.time.Duration;

/**
 * Handle to a unit of work suspended in a {@link FrameScheduler}.
 *
 * @author hal.hildebrand
 */
public final class ScheduledTask {

    enum Kind {
        DELAYED, NEXT_FRAME, EVERY_FRAME
    }

    private final String   label;
    private final Runnable action;
    private final Kind     kind;
    private final long     sequence;
    private       long     dueNanos;
    private       long     eligibleFrame;
    private       boolean  cancelled;
    private       boolean  done;

    ScheduledTask(String label, Runnable action, Kind kind, long sequence, long dueNanos, long eligibleFrame) {
        this.label = label;
        this.action = action;
        this.kind = kind;
        this.sequence = sequence;
        this.dueNanos = dueNanos;
        this.eligibleFrame = eligibleFrame;
    }

    /**
     * Cancel the task. A cancelled task never runs again; cancelling a finished task has no effect.
     *
     * @return true if this call cancelled a pending task
     */
    public boolean cancel() {
        if (cancelled || done) {
            return false;
        }
        cancelled = true;
        return true;
    }

    /**
     * Scheduler time at which the task becomes runnable
     */
    public Duration getDueTime() {
        return Duration.ofNanos(dueNanos);
    }

    public String getLabel() {
        return label;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return done;
    }

    public boolean isPending() {
        return !cancelled && !done;
    }

    @Override
    public String toString() {
        return String.format("ScheduledTask{%s, kind=%s, due=%dns, %s}", label, kind, dueNanos,
                             cancelled ? "cancelled" : done ? "done" : "pending");
    }

    Runnable action() {
        return action;
    }

    long dueNanos() {
        return dueNanos;
    }

    long eligibleFrame() {
        return eligibleFrame;
    }

    Kind kind() {
        return kind;
    }

    void markDone() {
        done = true;
    }

    void rearm(long nowNanos, long nextFrame) {
        dueNanos = nowNanos;
        eligibleFrame = nextFrame;
    }

    long sequence() {
        return sequence;
    }
}
