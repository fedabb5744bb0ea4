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
package com.hellblazer.mortis.mortality.hazard;

import com.hellblazer.mortis.mortality.DeathCause;

import java.time.Duration;
import java.util.Objects;

/**
 * Behaviour of a {@link DeathTrigger}. Setters validate eagerly and return this for chaining.
 *
 * @author hal.hildebrand
 */
public class DeathTriggerConfig {

    private DeathCause cause                   = DeathCause.GENERIC;
    private Duration   delayBeforeDeath        = Duration.ZERO;
    private boolean    suppressRagdollCollision;
    private Duration   suppressionDuration;
    private boolean    oneShot;
    private String     requiredLabel           = "Player";

    /**
     * A pit: forced fall death, and the ragdoll stops colliding with the pit volume
     */
    public static DeathTriggerConfig pit() {
        return new DeathTriggerConfig().withCause(DeathCause.FORCED_FALL).withSuppressRagdollCollision(true);
    }

    /**
     * Spikes: immediate generic death
     */
    public static DeathTriggerConfig spike() {
        return new DeathTriggerConfig().withCause(DeathCause.GENERIC);
    }

    /**
     * Touch-to-ragdoll hazard: forced fall death with a one second suppression of its own volume
     */
    public static DeathTriggerConfig touch() {
        return new DeathTriggerConfig().withCause(DeathCause.FORCED_FALL)
                                       .withSuppressRagdollCollision(true)
                                       .withSuppressionDuration(Duration.ofSeconds(1));
    }

    public DeathCause getCause() {
        return cause;
    }

    public Duration getDelayBeforeDeath() {
        return delayBeforeDeath;
    }

    /**
     * Label an occupant must carry to set the trigger off, null to accept any occupant
     */
    public String getRequiredLabel() {
        return requiredLabel;
    }

    /**
     * Suppression duration, null for the controller's default
     */
    public Duration getSuppressionDuration() {
        return suppressionDuration;
    }

    public boolean isOneShot() {
        return oneShot;
    }

    public boolean isSuppressRagdollCollision() {
        return suppressRagdollCollision;
    }

    public DeathTriggerConfig withCause(DeathCause cause) {
        this.cause = Objects.requireNonNull(cause, "cause");
        return this;
    }

    public DeathTriggerConfig withDelayBeforeDeath(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("Delay before death must not be negative");
        }
        this.delayBeforeDeath = delay;
        return this;
    }

    public DeathTriggerConfig withOneShot(boolean oneShot) {
        this.oneShot = oneShot;
        return this;
    }

    public DeathTriggerConfig withRequiredLabel(String label) {
        this.requiredLabel = label;
        return this;
    }

    public DeathTriggerConfig withSuppressRagdollCollision(boolean suppress) {
        this.suppressRagdollCollision = suppress;
        return this;
    }

    public DeathTriggerConfig withSuppressionDuration(Duration duration) {
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            throw new IllegalArgumentException("Suppression duration must be positive");
        }
        this.suppressionDuration = duration;
        return this;
    }
}
