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
package com.hellblazer.mortis.mortality;

import javax.vecmath.Point3f;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of a {@link MortalityController}. Setters validate eagerly and return this for chaining.
 *
 * @author hal.hildebrand
 */
public class MortalityConfig {

    private int      maxHealth              = 100;
    private Duration respawnDelay           = Duration.ofSeconds(2);
    private boolean  reloadSceneOnDeath     = false;
    private Point3f  respawnPosition;
    private float    fallVelocityThreshold  = -5.0f;
    private float    fallHeightThreshold    = 3.0f;
    private Duration ragdollIgnoreDuration  = Duration.ofSeconds(1);
    private boolean  hideEntityOnRagdoll    = true;
    private int      suppressionRetryFrames = 20;
    private float    nudgeDistance          = 0.25f;
    private String   entityLabel            = "Player";

    public static MortalityConfig defaults() {
        return new MortalityConfig();
    }

    /**
     * Reload the scene instead of respawning in place
     */
    public static MortalityConfig reloading() {
        return new MortalityConfig().withReloadSceneOnDeath(true);
    }

    /**
     * Label given to the living entity so hazards recognize it
     */
    public String getEntityLabel() {
        return entityLabel;
    }

    /**
     * Height below the respawn anchor past which a generic death counts as a fall
     */
    public float getFallHeightThreshold() {
        return fallHeightThreshold;
    }

    /**
     * Vertical velocity below which a generic death counts as a fall
     */
    public float getFallVelocityThreshold() {
        return fallVelocityThreshold;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    public float getNudgeDistance() {
        return nudgeDistance;
    }

    /**
     * Default duration of a ragdoll collision suppression
     */
    public Duration getRagdollIgnoreDuration() {
        return ragdollIgnoreDuration;
    }

    public Duration getRespawnDelay() {
        return respawnDelay;
    }

    /**
     * Explicit respawn position; empty means the entity's position when the controller is created
     */
    public Optional<Point3f> getRespawnPosition() {
        return Optional.ofNullable(respawnPosition).map(Point3f::new);
    }

    /**
     * Frames a suppression request waits for a ragdoll before it is dropped
     */
    public int getSuppressionRetryFrames() {
        return suppressionRetryFrames;
    }

    public boolean isHideEntityOnRagdoll() {
        return hideEntityOnRagdoll;
    }

    public boolean isReloadSceneOnDeath() {
        return reloadSceneOnDeath;
    }

    public MortalityConfig withEntityLabel(String label) {
        this.entityLabel = Objects.requireNonNull(label, "label");
        return this;
    }

    public MortalityConfig withFallHeightThreshold(float threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Fall height threshold must not be negative");
        }
        this.fallHeightThreshold = threshold;
        return this;
    }

    public MortalityConfig withFallVelocityThreshold(float threshold) {
        this.fallVelocityThreshold = threshold;
        return this;
    }

    public MortalityConfig withHideEntityOnRagdoll(boolean hide) {
        this.hideEntityOnRagdoll = hide;
        return this;
    }

    public MortalityConfig withMaxHealth(int maxHealth) {
        if (maxHealth <= 0) {
            throw new IllegalArgumentException("Max health must be positive");
        }
        this.maxHealth = maxHealth;
        return this;
    }

    public MortalityConfig withNudgeDistance(float distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("Nudge distance must not be negative");
        }
        this.nudgeDistance = distance;
        return this;
    }

    public MortalityConfig withRagdollIgnoreDuration(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Ragdoll ignore duration must be positive");
        }
        this.ragdollIgnoreDuration = duration;
        return this;
    }

    public MortalityConfig withReloadSceneOnDeath(boolean reload) {
        this.reloadSceneOnDeath = reload;
        return this;
    }

    public MortalityConfig withRespawnDelay(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Respawn delay must not be negative");
        }
        this.respawnDelay = delay;
        return this;
    }

    /**
     * @param position explicit respawn position, null to capture the entity's starting position
     */
    public MortalityConfig withRespawnPosition(Point3f position) {
        this.respawnPosition = position == null ? null : new Point3f(position);
        return this;
    }

    public MortalityConfig withSuppressionRetryFrames(int frames) {
        if (frames <= 0) {
            throw new IllegalArgumentException("Suppression retry frames must be positive");
        }
        this.suppressionRetryFrames = frames;
        return this;
    }
}
