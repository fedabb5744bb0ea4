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
package com.hellblazer.mortis.physics;

import com.hellblazer.mortis.scheduler.ScheduledTask;

import java.time.Duration;
import java.util.List;

/**
 * One time-bounded collision suppression between a set of body volumes and a target volume.
 *
 * @author hal.hildebrand
 */
public final class SuppressionRecord {

    private final List<CollisionVolume> bodyVolumes;
    private final CollisionVolume       target;
    private final Duration              expiry;
    private final int                   appliedPairs;
    private       ScheduledTask         restoreTask;
    private       boolean               restored;

    SuppressionRecord(List<CollisionVolume> bodyVolumes, CollisionVolume target, Duration expiry, int appliedPairs) {
        this.bodyVolumes = List.copyOf(bodyVolumes);
        this.target = target;
        this.expiry = expiry;
        this.appliedPairs = appliedPairs;
    }

    /**
     * Number of pairs actually marked non-colliding when the record was created
     */
    public int getAppliedPairs() {
        return appliedPairs;
    }

    public List<CollisionVolume> getBodyVolumes() {
        return bodyVolumes;
    }

    /**
     * Scheduler time at which collision is restored
     */
    public Duration getExpiry() {
        return expiry;
    }

    public CollisionVolume getTarget() {
        return target;
    }

    public boolean isRestored() {
        return restored;
    }

    @Override
    public String toString() {
        return String.format("SuppressionRecord{target=%s, volumes=%d, expiry=%s%s}", target.getName(),
                             bodyVolumes.size(), expiry, restored ? ", restored" : "");
    }

    boolean covers(CollisionVolume volume, CollisionVolume other) {
        return !restored && target == other && bodyVolumes.contains(volume);
    }

    ScheduledTask restoreTask() {
        return restoreTask;
    }

    void markRestored() {
        restored = true;
    }

    void setRestoreTask(ScheduledTask restoreTask) {
        this.restoreTask = restoreTask;
    }
}
