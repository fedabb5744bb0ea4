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

import com.hellblazer.mortis.mortality.Labeled;
import com.hellblazer.mortis.mortality.MortalityController;
import com.hellblazer.mortis.physics.CollisionVolume;
import com.hellblazer.mortis.scheduler.FrameScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * A hazard volume that kills the living entity when it enters. Enter detection belongs to the simulation, which calls
 * {@link #onEnter(Labeled, MortalityController)}.
 * <p>
 * Occupants without the required label are ignored, which keeps a freshly spawned, unlabeled ragdoll from setting the
 * hazard off again. An optional arming predicate gates the trigger, e.g. only while the view is first person.
 *
 * @author hal.hildebrand
 */
public class DeathTrigger {
    private static final Logger log = LoggerFactory.getLogger(DeathTrigger.class);

    private final String             name;
    private final CollisionVolume    volume;
    private final DeathTriggerConfig config;
    private final FrameScheduler     scheduler;
    private final BooleanSupplier    armed;
    private       boolean            spent;

    public DeathTrigger(String name, CollisionVolume volume, DeathTriggerConfig config, FrameScheduler scheduler) {
        this(name, volume, config, scheduler, () -> true);
    }

    public DeathTrigger(String name, CollisionVolume volume, DeathTriggerConfig config, FrameScheduler scheduler,
                        BooleanSupplier armed) {
        this.name = Objects.requireNonNull(name, "name");
        this.volume = Objects.requireNonNull(volume, "volume");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.armed = Objects.requireNonNull(armed, "armed");
        volume.setTrigger(true);
    }

    public String getName() {
        return name;
    }

    public CollisionVolume getVolume() {
        return volume;
    }

    /**
     * A one-shot trigger is spent once it has fired
     */
    public boolean isSpent() {
        return spent;
    }

    /**
     * An occupant entered the hazard volume.
     *
     * @param occupant  whatever entered
     * @param mortality the occupant's mortality controller, null when it has none
     * @return true if a death was started or scheduled
     */
    public boolean onEnter(Labeled occupant, MortalityController mortality) {
        if (spent) {
            return false;
        }
        var required = config.getRequiredLabel();
        if (occupant == null || (required != null && !occupant.hasLabel(required))) {
            log.trace("{} ignoring unlabeled occupant {}", name, occupant);
            return false;
        }
        if (!armed.getAsBoolean()) {
            log.debug("{} is not armed, ignoring {}", name, occupant);
            return false;
        }
        if (mortality == null) {
            log.warn("{} entered by {} which has no mortality controller", name, occupant);
            return false;
        }
        if (config.isOneShot()) {
            spent = true;
        }

        var delay = config.getDelayBeforeDeath();
        if (delay.isZero()) {
            fire(mortality);
        } else {
            scheduler.schedule("death-trigger:" + name, delay, () -> fire(mortality));
        }
        return true;
    }

    @Override
    public String toString() {
        return "DeathTrigger[" + name + " " + config.getCause() + (spent ? " spent" : "") + "]";
    }

    private void fire(MortalityController mortality) {
        log.info("{} triggered by {} ({})", name, mortality.getEntity().name(), config.getCause());
        mortality.die(config.getCause());
        if (config.isSuppressRagdollCollision()) {
            mortality.suppressRagdollCollisionWith(volume, config.getSuppressionDuration());
        }
    }
}
