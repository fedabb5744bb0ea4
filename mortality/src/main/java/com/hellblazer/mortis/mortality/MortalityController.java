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

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.mortality.ragdoll.RagdollHandoffController;
import com.hellblazer.mortis.mortality.ragdoll.RagdollInstance;
import com.hellblazer.mortis.physics.CollisionSuppressionManager;
import com.hellblazer.mortis.physics.CollisionVolume;
import com.hellblazer.mortis.scheduler.FrameScheduler;
import com.hellblazer.mortis.scheduler.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Owns the health of a controlled entity and its {@code ALIVE -> DYING -> DEAD -> ALIVE} life cycle.
 * <p>
 * A death transition disables the entity, hands it off to a ragdoll, hides or freezes the entity, notifies the
 * listeners, hands the ragdoll to the {@link DeathFocus} and schedules the delayed respawn (or scene reload). All of
 * that completes within the calling frame. {@link #die(DeathCause)} is idempotent: a second death while dead is
 * ignored, so simultaneous hazards never spawn a second ragdoll or notify twice.
 * <p>
 * Collision suppression requested before a ragdoll exists is buffered and retried once per frame for a bounded
 * number of frames.
 *
 * @author hal.hildebrand
 */
public class MortalityController {
    private static final Logger log = LoggerFactory.getLogger(MortalityController.class);

    private final ControlledEntity                       entity;
    private final MortalityConfig                        config;
    private final FrameScheduler                         scheduler;
    private final CollisionSuppressionManager            suppression;
    private final RagdollHandoffController               ragdolls;
    private final Vitality                               vitality;
    private final Point3f                                respawnPosition;
    private final CopyOnWriteArraySet<MortalityListener> listeners = new CopyOnWriteArraySet<>();
    private final List<PendingSuppression>               pending   = new ArrayList<>();
    private       MortalityState                         state     = MortalityState.ALIVE;
    private       RagdollInstance                        ragdoll;
    private       DeathFocus                             deathFocus;
    private       SceneReloader                          sceneReloader;
    private       ScheduledTask                          respawnTask;
    private       ScheduledTask                          retryTask;
    private       DeathCause                             lastCause;

    public MortalityController(ControlledEntity entity, MortalityConfig config, FrameScheduler scheduler,
                               CollisionSuppressionManager suppression, RagdollHandoffController ragdolls) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.suppression = Objects.requireNonNull(suppression, "suppression");
        this.ragdolls = Objects.requireNonNull(ragdolls, "ragdolls");
        this.vitality = new Vitality(config.getMaxHealth());
        this.respawnPosition = config.getRespawnPosition().orElseGet(entity::position);
        entity.addLabel(config.getEntityLabel());
        if (!ragdolls.isConfigured()) {
            log.warn("No ragdoll configured for {}, deaths will freeze the entity in place", entity.name());
        }
    }

    public void addListener(MortalityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Subtract health. Reaching zero while alive is a {@link DeathCause#GENERIC} death. No effect while dead.
     */
    public void applyDamage(int amount) {
        if (state != MortalityState.ALIVE) {
            log.debug("Ignoring {} damage to {}: not alive", amount, entity.name());
            return;
        }
        if (amount < 0) {
            log.warn("Rejecting negative damage {} to {}", amount, entity.name());
            return;
        }
        var remaining = vitality.damage(amount);
        log.debug("{} took {} damage. Health: {}/{}", entity.name(), amount, remaining, vitality.getMaxHealth());
        if (vitality.isDepleted()) {
            die(DeathCause.GENERIC);
        }
    }

    /**
     * Generic death
     */
    public boolean die() {
        return die(DeathCause.GENERIC);
    }

    /**
     * Kill the entity.
     *
     * @return false if the entity was not alive, in which case nothing happens
     */
    public boolean die(DeathCause cause) {
        Objects.requireNonNull(cause, "cause");
        if (state != MortalityState.ALIVE || !vitality.markDead()) {
            log.debug("{} is already dead, ignoring duplicate {} death", entity.name(), cause);
            return false;
        }
        state = MortalityState.DYING;
        lastCause = cause;
        log.info("{} died ({})", entity.name(), cause);

        var deathPose = entity.pose();
        var velocity = entity.getVelocity();
        var fallDeath = isFallDeath(cause, deathPose, velocity);

        entity.setLocomotionEnabled(false);
        entity.setInteractionEnabled(false);

        ragdoll = ragdolls.spawn(deathPose, velocity).orElse(null);
        if (ragdoll != null && config.isHideEntityOnRagdoll()) {
            entity.setVisible(false);
        }
        if (entity.getBody() != null) {
            entity.getBody().setKinematic(true);
        }

        state = MortalityState.DEAD;
        notifyListeners(MortalityListener::onDeath, "onDeath");

        if (ragdoll != null) {
            focus(ragdoll, deathPose, fallDeath);
        }

        // A listener may already have brought the entity back
        if (state != MortalityState.DEAD) {
            log.debug("{} left the dead state during death handling, no respawn scheduled", entity.name());
            return true;
        }
        if (respawnTask != null) {
            respawnTask.cancel();
        }
        respawnTask = scheduler.schedule(config.isReloadSceneOnDeath() ? "reload-scene" : "respawn",
                                         config.getRespawnDelay(), this::respawnOrReload);
        return true;
    }

    /**
     * Cancel pending respawn, reload and suppression retries. Active suppression records keep their own timers.
     */
    public void dispose() {
        if (respawnTask != null) {
            respawnTask.cancel();
            respawnTask = null;
        }
        cancelPendingSuppressions();
        listeners.clear();
    }

    public ControlledEntity getEntity() {
        return entity;
    }

    /**
     * Cause of the most recent death, empty before the first one
     */
    public Optional<DeathCause> getLastCause() {
        return Optional.ofNullable(lastCause);
    }

    public int getCurrentHealth() {
        return vitality.getCurrentHealth();
    }

    public int getMaxHealth() {
        return vitality.getMaxHealth();
    }

    /**
     * The current ragdoll, empty while alive or when the death produced none
     */
    public Optional<RagdollInstance> getRagdoll() {
        return Optional.ofNullable(ragdoll);
    }

    public Point3f getRespawnPosition() {
        return new Point3f(respawnPosition);
    }

    public MortalityState getState() {
        return state;
    }

    /**
     * Add health, clamped to the maximum. Ignored while dead.
     */
    public void heal(int amount) {
        if (state != MortalityState.ALIVE) {
            log.debug("Ignoring heal of {} for {}: not alive", amount, entity.name());
            return;
        }
        if (amount < 0) {
            log.warn("Rejecting negative heal {} for {}", amount, entity.name());
            return;
        }
        var health = vitality.heal(amount);
        log.debug("{} healed {}. Health: {}/{}", entity.name(), amount, health, vitality.getMaxHealth());
    }

    public boolean isDead() {
        return vitality.isDead();
    }

    /**
     * Number of suppression requests still waiting for a ragdoll
     */
    public int pendingSuppressionCount() {
        return pending.size();
    }

    public void removeListener(MortalityListener listener) {
        listeners.remove(listener);
    }

    /**
     * Bring the entity back at its respawn position with full health.
     *
     * @return false if the entity was not dead, in which case nothing happens
     */
    public boolean respawn() {
        if (state != MortalityState.DEAD) {
            log.debug("Ignoring respawn of {}: not dead", entity.name());
            return false;
        }
        if (respawnTask != null) {
            respawnTask.cancel();
            respawnTask = null;
        }
        cancelPendingSuppressions();

        entity.setPose(entity.pose().withPosition(respawnPosition));
        vitality.restore();
        entity.setLocomotionEnabled(true);
        entity.setInteractionEnabled(true);

        if (ragdoll != null) {
            ragdolls.teardown(ragdoll);
            ragdoll = null;
        }
        entity.setVisible(true);
        if (entity.getBody() != null) {
            entity.getBody().setKinematic(false);
        }

        state = MortalityState.ALIVE;
        log.info("{} respawned at ({}, {}, {})", entity.name(), respawnPosition.x, respawnPosition.y,
                 respawnPosition.z);
        notifyListeners(MortalityListener::onRespawn, "onRespawn");
        return true;
    }

    public void setDeathFocus(DeathFocus deathFocus) {
        this.deathFocus = deathFocus;
    }

    public void setSceneReloader(SceneReloader sceneReloader) {
        this.sceneReloader = sceneReloader;
    }

    /**
     * Suppress collisions between the ragdoll and a volume for the configured default duration
     */
    public boolean suppressRagdollCollisionWith(CollisionVolume volume) {
        return suppressRagdollCollisionWith(volume, null);
    }

    /**
     * Suppress collisions between the ragdoll and a volume, typically the hazard that caused the death, and nudge the
     * ragdoll clear of it. Without a ragdoll the request is retried once per frame until one appears or the retry
     * budget runs out.
     *
     * @param duration how long to suppress, null or non-positive for the configured default
     * @return true if applied immediately, false if buffered or ignored
     */
    public boolean suppressRagdollCollisionWith(CollisionVolume volume, Duration duration) {
        if (volume == null) {
            log.debug("Ignoring ragdoll suppression request without a volume");
            return false;
        }
        var effective = duration == null || duration.isNegative() || duration.isZero()
                        ? config.getRagdollIgnoreDuration() : duration;
        if (hasLiveRagdoll()) {
            applySuppression(volume, effective);
            return true;
        }
        pending.add(new PendingSuppression(volume, effective));
        if (retryTask == null) {
            retryTask = scheduler.everyFrame("ragdoll-suppression-retry", this::retryPendingSuppressions);
        }
        log.debug("No ragdoll yet, buffering suppression against {}", volume.getName());
        return false;
    }

    @Override
    public String toString() {
        return String.format("MortalityController[%s %s %s]", entity.name(), state, vitality);
    }

    private void applySuppression(CollisionVolume volume, Duration duration) {
        suppression.ignore(ragdoll.volumes(), volume, duration);
        var fallback = entity.pose().forward();
        fallback.scaleAdd(0.1f, Pose.up(), fallback);
        suppression.nudgeAway(ragdoll, volume, config.getNudgeDistance(), fallback);
    }

    private void cancelPendingSuppressions() {
        pending.clear();
        if (retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    private void focus(RagdollInstance instance, Pose deathPose, boolean fallDeath) {
        if (deathFocus == null) {
            return;
        }
        try {
            deathFocus.focusOnRagdoll(instance, deathPose, fallDeath);
        } catch (RuntimeException e) {
            log.warn("Death focus failed for {}", entity.name(), e);
        }
    }

    private boolean hasLiveRagdoll() {
        return ragdoll != null && !ragdoll.isDestroyed();
    }

    private boolean isFallDeath(DeathCause cause, Pose deathPose, Vector3f velocity) {
        if (cause == DeathCause.FORCED_FALL) {
            return true;
        }
        return velocity.y < config.getFallVelocityThreshold()
        || deathPose.position().y < respawnPosition.y - config.getFallHeightThreshold();
    }

    private void notifyListeners(Consumer<MortalityListener> event, String name) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed during {}", listener, name, e);
            }
        }
    }

    private void respawnOrReload() {
        respawnTask = null;
        if (config.isReloadSceneOnDeath()) {
            if (sceneReloader != null) {
                log.info("Reloading scene after death of {}", entity.name());
                sceneReloader.reload();
                return;
            }
            log.warn("Scene reload requested but no reloader is configured, respawning {} in place", entity.name());
        }
        respawn();
    }

    private void retryPendingSuppressions() {
        var iterator = pending.iterator();
        while (iterator.hasNext()) {
            var request = iterator.next();
            if (hasLiveRagdoll()) {
                iterator.remove();
                applySuppression(request.volume, request.duration);
                continue;
            }
            if (++request.attempts >= config.getSuppressionRetryFrames()) {
                iterator.remove();
                log.warn("Dropping suppression against {} after {} frames without a ragdoll",
                         request.volume.getName(), request.attempts);
            }
        }
        if (pending.isEmpty() && retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    private static final class PendingSuppression {
        private final CollisionVolume volume;
        private final Duration        duration;
        private       int             attempts;

        private PendingSuppression(CollisionVolume volume, Duration duration) {
            this.volume = volume;
            this.duration = duration;
        }
    }
}
