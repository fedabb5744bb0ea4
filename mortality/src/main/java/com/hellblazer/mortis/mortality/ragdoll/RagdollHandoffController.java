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
package com.hellblazer.mortis.mortality.ragdoll;

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.physics.MutationResult;
import com.hellblazer.mortis.physics.PhysicsBody;
import com.hellblazer.mortis.physics.PhysicsWorld;
import com.hellblazer.mortis.physics.SphereVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Vector3f;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a dying entity into a free, physics-driven ragdoll and tears the ragdoll down again on respawn.
 * <p>
 * Every spawned part is made non-kinematic with continuous collision detection, gets its collider enabled and
 * receives the entity's velocity. The velocity is assigned uniformly to all parts rather than distributed per limb.
 * Labels are cleared on the instance and every part so hazards never mistake the ragdoll for the living entity.
 *
 * @author hal.hildebrand
 */
public class RagdollHandoffController {
    private static final Logger log = LoggerFactory.getLogger(RagdollHandoffController.class);

    private final PhysicsWorld    world;
    private final RagdollTemplate template;
    private       int             spawned;

    /**
     * @param template the ragdoll blueprint, null when no ragdoll is configured
     */
    public RagdollHandoffController(PhysicsWorld world, RagdollTemplate template) {
        this.world = Objects.requireNonNull(world, "world");
        this.template = template;
    }

    public boolean isConfigured() {
        return template != null;
    }

    /**
     * Instantiate the configured ragdoll at the given pose.
     *
     * @param sourcePose     the entity's last pose
     * @param sourceVelocity the entity's velocity before death, null for none
     * @return the ragdoll, or empty when no template is configured
     */
    public Optional<RagdollInstance> spawn(Pose sourcePose, Vector3f sourceVelocity) {
        Objects.requireNonNull(sourcePose, "sourcePose");
        if (template == null) {
            log.debug("No ragdoll template configured, nothing to spawn");
            return Optional.empty();
        }
        var velocity = sourceVelocity == null ? new Vector3f() : new Vector3f(sourceVelocity);
        var instanceName = template.getName() + "#" + (++spawned);

        var parts = new ArrayList<RagdollPart>();
        for (var part : template.getParts()) {
            var at = sourcePose.transform(part.localOffset());
            var partName = instanceName + "/" + part.name();

            var body = world.register(PhysicsBody.createKinematic(partName, at, part.mass()));
            body.setKinematic(false);
            body.setCollisionDetection(PhysicsBody.CollisionDetection.CONTINUOUS);
            body.setVelocity(velocity);

            var volume = world.register(new SphereVolume(partName, at, part.radius()));
            volume.setEnabled(true);

            parts.add(new RagdollPart(body, volume, template.getLabels()));
        }

        var instance = new RagdollInstance(instanceName, sourcePose, parts, template.getLabels(),
                                           template.isAnimated());
        instance.clearLabels();
        instance.disableAnimationDriver();
        log.debug("Spawned {} with {} parts at {}", instanceName, parts.size(), sourcePose);
        return Optional.of(instance);
    }

    /**
     * Destroy the instance's bodies and colliders. Restoring the living entity is the caller's job.
     *
     * @return {@link MutationResult#STALE_REFERENCE} if the instance is null or already destroyed
     */
    public MutationResult teardown(RagdollInstance instance) {
        if (instance == null || instance.isDestroyed()) {
            log.debug("Skipping teardown of {}: stale reference", instance);
            return MutationResult.STALE_REFERENCE;
        }
        for (var part : instance.getParts()) {
            world.destroy(part.body());
            world.destroy(part.volume());
        }
        instance.markDestroyed();
        log.debug("Tore down {}", instance.name());
        return MutationResult.APPLIED;
    }
}
