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
package com.hellblazer.mortis.camera;

import java.util.Objects;

/**
 * Configuration of a {@link CameraFocusCoordinator}. Setters validate eagerly and return this for chaining.
 *
 * @author hal.hildebrand
 */
public class CameraConfig {

    private float         fallVelocityThreshold     = -5.0f;
    private float         groundCheckDistance       = 1.5f;
    private ViewSwitching switching                 = ViewSwitching.PRIORITY;
    private int           nearPriority              = 20;
    private int           farPriority               = 10;
    private float         pitSearchRadius           = 50.0f;
    private float         deathAnchorHeightOffset   = 6.0f;
    private float         nonFallAnchorHeightOffset = 3.6f;

    public static CameraConfig defaults() {
        return new CameraConfig();
    }

    /**
     * Switch by enabling only the active viewpoint
     */
    public static CameraConfig exclusive() {
        return new CameraConfig().withSwitching(ViewSwitching.EXCLUSIVE);
    }

    /**
     * Rise above a fall death when no pit-rim marker is in range
     */
    public float getDeathAnchorHeightOffset() {
        return deathAnchorHeightOffset;
    }

    /**
     * Priority given to the viewpoint that is not active
     */
    public int getFarPriority() {
        return farPriority;
    }

    public float getFallVelocityThreshold() {
        return fallVelocityThreshold;
    }

    public float getGroundCheckDistance() {
        return groundCheckDistance;
    }

    /**
     * Priority given to the active viewpoint
     */
    public int getNearPriority() {
        return nearPriority;
    }

    /**
     * Rise above a non-fall death
     */
    public float getNonFallAnchorHeightOffset() {
        return nonFallAnchorHeightOffset;
    }

    public float getPitSearchRadius() {
        return pitSearchRadius;
    }

    public ViewSwitching getSwitching() {
        return switching;
    }

    /**
     * Sets the fall anchor offset and the non-fall offset at 60% of it
     */
    public CameraConfig withDeathAnchorHeightOffset(float offset) {
        this.deathAnchorHeightOffset = offset;
        this.nonFallAnchorHeightOffset = offset * 0.6f;
        return this;
    }

    public CameraConfig withFallVelocityThreshold(float threshold) {
        this.fallVelocityThreshold = threshold;
        return this;
    }

    public CameraConfig withGroundCheckDistance(float distance) {
        if (distance <= 0) {
            throw new IllegalArgumentException("Ground check distance must be positive");
        }
        this.groundCheckDistance = distance;
        return this;
    }

    public CameraConfig withNonFallAnchorHeightOffset(float offset) {
        this.nonFallAnchorHeightOffset = offset;
        return this;
    }

    public CameraConfig withPitSearchRadius(float radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Pit search radius must not be negative");
        }
        this.pitSearchRadius = radius;
        return this;
    }

    /**
     * @param nearPriority priority of the active viewpoint
     * @param farPriority  priority of the standby viewpoint, must be lower
     */
    public CameraConfig withPriorities(int nearPriority, int farPriority) {
        if (nearPriority <= farPriority) {
            throw new IllegalArgumentException(
            "Active priority " + nearPriority + " must exceed standby priority " + farPriority);
        }
        this.nearPriority = nearPriority;
        this.farPriority = farPriority;
        return this;
    }

    public CameraConfig withSwitching(ViewSwitching switching) {
        this.switching = Objects.requireNonNull(switching, "switching");
        return this;
    }
}
