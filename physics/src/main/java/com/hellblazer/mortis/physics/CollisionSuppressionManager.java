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

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.scheduler.FrameScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3f;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Temporarily disables collision response between a body set and one target volume, then restores it.
 * <p>
 * Records are independent: each one restores on its own schedule, and a pair shared by two overlapping records stays
 * ignored until the last of them expires. Restoration skips volumes that have been destroyed in the meantime, so a
 * ragdoll torn down before its record expires is harmless.
 * <p>
 * Usage:
 * <pre>
 * var suppression = new CollisionSuppressionManager(world, scheduler);
 * suppression.ignore(ragdoll.volumes(), pitTrigger, Duration.ofSeconds(1));
 * suppression.nudgeAway(ragdoll, pitTrigger, 0.25f, fallback);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class CollisionSuppressionManager {
    /**
     * Velocity change applied to each body by {@link #nudgeAway}
     */
    public static final  float  DEFAULT_NUDGE_IMPULSE = 1.5f;
    private static final float  COINCIDENT_EPSILON_SQ = 0.0001f;
    private static final Logger log                   = LoggerFactory.getLogger(CollisionSuppressionManager.class);

    private final PhysicsWorld            world;
    private final FrameScheduler          scheduler;
    private final float                   nudgeImpulse;
    private final List<SuppressionRecord> active = new ArrayList<>();

    public CollisionSuppressionManager(PhysicsWorld world, FrameScheduler scheduler) {
        this(world, scheduler, DEFAULT_NUDGE_IMPULSE);
    }

    public CollisionSuppressionManager(PhysicsWorld world, FrameScheduler scheduler, float nudgeImpulse) {
        this.world = Objects.requireNonNull(world, "world");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (nudgeImpulse < 0) {
            throw new IllegalArgumentException("Nudge impulse must not be negative");
        }
        this.nudgeImpulse = nudgeImpulse;
    }

    /**
     * Records that have not yet been restored
     */
    public List<SuppressionRecord> activeRecords() {
        return Collections.unmodifiableList(active);
    }

    /**
     * Restore every active record immediately and cancel their pending restorations
     */
    public void dispose() {
        for (var record : new ArrayList<>(active)) {
            if (record.restoreTask() != null) {
                record.restoreTask().cancel();
            }
            restore(record);
        }
    }

    /**
     * Mark every pair {@code (v, target)} as non-colliding now and schedule the restoration after {@code duration}.
     *
     * @param bodyVolumes the volumes of the body set, typically a ragdoll
     * @param target      the volume to stop colliding with
     * @param duration    how long the suppression lasts, must be positive
     * @return the record tracking the suppression
     */
    public SuppressionRecord ignore(Collection<CollisionVolume> bodyVolumes, CollisionVolume target,
                                    Duration duration) {
        Objects.requireNonNull(bodyVolumes, "bodyVolumes");
        Objects.requireNonNull(target, "target");
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Suppression duration must be positive: " + duration);
        }

        var volumes = new ArrayList<CollisionVolume>();
        var applied = 0;
        for (var volume : bodyVolumes) {
            if (volume == null) {
                continue;
            }
            volumes.add(volume);
            if (world.setCollisionIgnored(volume, target, true).isApplied()) {
                applied++;
            }
        }

        var record = new SuppressionRecord(volumes, target, scheduler.now().plus(duration), applied);
        record.setRestoreTask(scheduler.schedule("restore-collision:" + target.getName(), duration,
                                                 () -> restore(record)));
        active.add(record);
        log.debug("Ignoring {} of {} pairs against {} until {}", applied, volumes.size(), target.getName(),
                  record.getExpiry());
        return record;
    }

    /**
     * Test whether an active record currently suppresses the pair
     */
    public boolean isSuppressed(CollisionVolume volume, CollisionVolume target) {
        return active.stream().anyMatch(record -> record.covers(volume, target));
    }

    /**
     * Separate an assembly from a volume it overlaps. The assembly is translated by {@code distance} along the
     * direction from the closest point on {@code target} to the assembly's root, and every body receives a small
     * velocity change along the same direction.
     *
     * @param assembly          the body set to move
     * @param target            the volume to move away from
     * @param distance          translation distance
     * @param fallbackDirection direction used when the root coincides with the closest point on the target
     * @return {@link MutationResult#STALE_REFERENCE} if the assembly or the target no longer exists
     */
    public MutationResult nudgeAway(BodyAssembly assembly, CollisionVolume target, float distance,
                                    Vector3f fallbackDirection) {
        if (assembly == null || assembly.isDestroyed() || target == null || target.isDestroyed()) {
            log.debug("Skipping nudge of {} away from {}: stale reference", assembly, target);
            return MutationResult.STALE_REFERENCE;
        }

        var root = assembly.position();
        var direction = new Vector3f();
        direction.sub(root, target.closestPoint(root));
        if (direction.lengthSquared() < COINCIDENT_EPSILON_SQ) {
            direction = fallbackDirection == null ? Pose.up() : new Vector3f(fallbackDirection);
            if (direction.lengthSquared() < COINCIDENT_EPSILON_SQ) {
                direction = Pose.up();
            }
        }
        direction.normalize();

        var delta = new Vector3f(direction);
        delta.scale(distance);
        var result = assembly.translate(delta);
        if (!result.isApplied()) {
            return result;
        }

        var impulse = new Vector3f(direction);
        impulse.scale(nudgeImpulse);
        for (var body : assembly.bodies()) {
            body.applyImpulse(impulse, PhysicsBody.ForceMode.VELOCITY_CHANGE);
        }
        log.debug("Nudged {} by {} along ({}, {}, {})", assembly.name(), distance, direction.x, direction.y,
                  direction.z);
        return MutationResult.APPLIED;
    }

    private void restore(SuppressionRecord record) {
        if (record.isRestored()) {
            return;
        }
        record.markRestored();
        active.remove(record);

        var target = record.getTarget();
        var restored = 0;
        var stale = 0;
        for (var volume : record.getBodyVolumes()) {
            if (volume.isDestroyed() || target.isDestroyed()) {
                stale++;
                continue;
            }
            if (isSuppressed(volume, target)) {
                continue;
            }
            if (world.setCollisionIgnored(volume, target, false).isApplied()) {
                restored++;
            } else {
                stale++;
            }
        }
        log.debug("Restored {} pairs against {} ({} stale)", restored, target.getName(), stale);
    }
}
