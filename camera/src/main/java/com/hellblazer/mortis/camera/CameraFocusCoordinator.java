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

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.geometry.Trackable;
import com.hellblazer.mortis.mortality.DeathFocus;
import com.hellblazer.mortis.mortality.MortalityController;
import com.hellblazer.mortis.mortality.MortalityListener;
import com.hellblazer.mortis.mortality.ragdoll.RagdollInstance;
import com.hellblazer.mortis.scheduler.FrameScheduler;
import com.hellblazer.mortis.scheduler.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3f;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps a near (first-person) and a far (third-person) viewpoint in step with the entity's mortality.
 * <p>
 * Each frame, a fast drop with no ground below switches to the far view and landing switches back; both are
 * suspended while the entity is dead. A death forces the far view. When the death produced a ragdoll, the far
 * viewpoint follows a transient {@link DeathAnchor} and looks at the ragdoll: for a fall, the anchor sits on the
 * nearest pit-rim marker in range, or above the death position without one. Respawn destroys the anchor, restores
 * the saved targets and returns to the near view.
 * <p>
 * Usage:
 * <pre>
 * var coordinator = new CameraFocusCoordinator(mortality, near, far, pitRims, probe, scheduler,
 *                                              CameraConfig.defaults());
 * coordinator.setNearTarget(eyes);
 * coordinator.setFarTarget(body);
 * coordinator.start();
 * </pre>
 *
 * @author hal.hildebrand
 */
public class CameraFocusCoordinator implements MortalityListener, DeathFocus {
    private static final Logger log = LoggerFactory.getLogger(CameraFocusCoordinator.class);

    private final MortalityController mortality;
    private final Viewpoint           near;
    private final Viewpoint           far;
    private final PitRimRegistry      pitRims;
    private final GroundProbe         groundProbe;
    private final FrameScheduler      scheduler;
    private final CameraConfig        config;
    private final ViewpointBrain      brain = new ViewpointBrain();
    private       Trackable           nearTarget;
    private       Trackable           farTarget;
    private       ViewMode            mode  = ViewMode.NEAR;
    private       boolean             deathFocused;
    private       DeathAnchor         anchor;
    private       TargetSnapshot      snapshot;
    private       ScheduledTask       updateTask;

    /**
     * @param near the first-person viewpoint, may be null
     * @param far  the third-person viewpoint, may be null in which case deaths are not framed
     */
    public CameraFocusCoordinator(MortalityController mortality, Viewpoint near, Viewpoint far,
                                  PitRimRegistry pitRims, GroundProbe groundProbe, FrameScheduler scheduler,
                                  CameraConfig config) {
        this.mortality = Objects.requireNonNull(mortality, "mortality");
        this.near = near;
        this.far = far;
        this.pitRims = Objects.requireNonNull(pitRims, "pitRims");
        this.groundProbe = Objects.requireNonNull(groundProbe, "groundProbe");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.config = Objects.requireNonNull(config, "config");
        if (near != null) {
            brain.register(near);
        }
        if (far != null) {
            brain.register(far);
        }
    }

    /**
     * The anchor the far viewpoint should follow to frame a death at {@code deathPosition}
     */
    public Pose computeAnchor(Point3f deathPosition, boolean fallDeath) {
        if (!fallDeath) {
            return Pose.at(deathPosition.x, deathPosition.y + config.getNonFallAnchorHeightOffset(), deathPosition.z);
        }
        var rim = pitRims.nearest(deathPosition, config.getPitSearchRadius());
        if (rim.isPresent()) {
            return rim.get().pose();
        }
        return Pose.at(deathPosition.x, deathPosition.y + config.getDeathAnchorHeightOffset(), deathPosition.z);
    }

    /**
     * Frame the ragdoll from an anchor chosen for the kind of death. Targets in place before the first focus are
     * saved for the respawn.
     */
    @Override
    public void focusOnRagdoll(RagdollInstance ragdoll, Pose deathPose, boolean fallDeath) {
        if (far == null) {
            log.warn("No far viewpoint configured, cannot focus on {}", ragdoll);
            return;
        }
        if (snapshot == null) {
            snapshot = TargetSnapshot.capture(near, far);
        }
        if (anchor != null) {
            anchor.destroy();
        }
        anchor = new DeathAnchor(computeAnchor(deathPose.position(), fallDeath));
        deathFocused = true;
        far.setFollow(anchor);
        far.setLookAt(ragdoll);
        switchTo(ViewMode.FAR);
        log.info("Framing {} from {} ({} death)", ragdoll == null ? "nothing" : ragdoll.name(), anchor.pose(),
                 fallDeath ? "fall" : "non-fall");
    }

    public ViewpointBrain getBrain() {
        return brain;
    }

    /**
     * The death anchor pose, present only while framing a death
     */
    public Optional<Pose> getFocusAnchor() {
        return deathFocused && anchor != null ? Optional.of(anchor.pose()) : Optional.empty();
    }

    public ViewMode getViewMode() {
        return mode;
    }

    public boolean isDeathFocused() {
        return deathFocused;
    }

    /**
     * Whether the first-person view is the current one, used to arm touch hazards
     */
    public boolean isNearView() {
        return mode == ViewMode.NEAR;
    }

    @Override
    public void onDeath() {
        switchTo(ViewMode.FAR);
    }

    @Override
    public void onRespawn() {
        if (anchor != null) {
            anchor.destroy();
            anchor = null;
        }
        deathFocused = false;
        switchTo(ViewMode.NEAR);
        // After the switch, so the targets saved before the death focus win over the defaults
        if (snapshot != null) {
            snapshot.restore(near, far);
            snapshot = null;
        }
    }

    /**
     * Default target of the near viewpoint, typically the eyes
     */
    public void setNearTarget(Trackable nearTarget) {
        this.nearTarget = nearTarget;
    }

    /**
     * Default target of the far viewpoint, typically the body. Also the origin of the ground probe.
     */
    public void setFarTarget(Trackable farTarget) {
        this.farTarget = farTarget;
    }

    /**
     * Subscribe to the mortality controller, start the per-frame update and show the near view
     */
    public void start() {
        mortality.addListener(this);
        mortality.setDeathFocus(this);
        if (updateTask == null) {
            updateTask = scheduler.everyFrame("camera-focus", this::update);
        }
        log.info("Camera focus started: near={}, far={}", near == null ? "null" : near.getName(),
                 far == null ? "null" : far.getName());
        switchTo(ViewMode.NEAR);
    }

    /**
     * Unsubscribe and stop the per-frame update
     */
    public void stop() {
        mortality.removeListener(this);
        mortality.setDeathFocus(null);
        if (updateTask != null) {
            updateTask.cancel();
            updateTask = null;
        }
    }

    @Override
    public String toString() {
        return String.format("CameraFocusCoordinator[%s%s]", mode, deathFocused ? " death-focused" : "");
    }

    /**
     * Per-frame fall detection. Does nothing while the entity is dead.
     */
    public void update() {
        if (!mortality.isDead()) {
            var falling = mortality.getEntity().getVelocity().y < config.getFallVelocityThreshold() && !isGrounded();
            if (falling && mode == ViewMode.NEAR) {
                switchTo(ViewMode.FAR);
            } else if (!falling && mode == ViewMode.FAR && isGrounded()) {
                switchTo(ViewMode.NEAR);
            }
        }
        brain.update();
    }

    private boolean isGrounded() {
        var origin = farTarget != null && farTarget.exists() ? farTarget.position()
                                                              : mortality.getEntity().position();
        return groundProbe.isGrounded(origin, config.getGroundCheckDistance());
    }

    private void switchTo(ViewMode target) {
        mode = target;
        var nearActive = target == ViewMode.NEAR;

        var switching = config.getSwitching();
        if (switching == ViewSwitching.PRIORITY && (near == null || far == null)) {
            log.warn("A viewpoint is missing, falling back to exclusive switching");
            switching = ViewSwitching.EXCLUSIVE;
        }
        switch (switching) {
            case PRIORITY -> {
                near.setEnabled(true);
                far.setEnabled(true);
                near.setPriority(nearActive ? config.getNearPriority() : config.getFarPriority());
                far.setPriority(nearActive ? config.getFarPriority() : config.getNearPriority());
                log.debug("Switched by priority: near={}, far={}", near.getPriority(), far.getPriority());
            }
            case EXCLUSIVE -> {
                if (near != null) {
                    near.setEnabled(nearActive);
                }
                if (far != null) {
                    far.setEnabled(!nearActive);
                }
            }
        }

        if (near != null && nearTarget != null) {
            near.setFollow(nearTarget);
            near.setLookAt(nearTarget);
        }
        // The death anchor owns the far targets until respawn
        if (far != null && farTarget != null && !deathFocused) {
            far.setFollow(farTarget);
            far.setLookAt(farTarget);
        }
    }
}
