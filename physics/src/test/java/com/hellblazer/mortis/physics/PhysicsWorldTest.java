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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PhysicsWorldTest {

    private PhysicsWorld    world;
    private CollisionVolume limb;
    private CollisionVolume trigger;

    @BeforeEach
    public void setup() {
        world = new PhysicsWorld();
        limb = world.register(new SphereVolume("limb", new Point3f(0, 0, 0), 0.5f));
        trigger = world.register(new BoxVolume("pit", new Point3f(0, -5, 0), 5, 1, 5));
    }

    @Test
    public void testIgnoreIsSymmetric() {
        assertTrue(world.canCollide(limb, trigger));

        assertEquals(MutationResult.APPLIED, world.setCollisionIgnored(limb, trigger, true));

        assertTrue(world.isCollisionIgnored(trigger, limb));
        assertFalse(world.canCollide(trigger, limb));
        assertEquals(1, world.ignoredPairCount());

        world.setCollisionIgnored(trigger, limb, false);
        assertTrue(world.canCollide(limb, trigger));
        assertEquals(0, world.ignoredPairCount());
    }

    @Test
    public void testDisabledVolumesDoNotCollide() {
        limb.setEnabled(false);
        assertFalse(world.canCollide(limb, trigger));
    }

    @Test
    public void testDestroyDropsPairsAndReportsStale() {
        world.setCollisionIgnored(limb, trigger, true);

        assertEquals(MutationResult.APPLIED, world.destroy(limb));

        assertTrue(limb.isDestroyed());
        assertFalse(limb.isEnabled());
        assertEquals(0, world.ignoredPairCount());
        assertEquals(MutationResult.STALE_REFERENCE, world.setCollisionIgnored(limb, trigger, false));
        assertEquals(MutationResult.STALE_REFERENCE, world.destroy(limb), "Second destroy is stale");
    }

    @Test
    public void testUnregisteredVolumeIsStale() {
        var stray = new SphereVolume("stray", new Point3f(), 1);

        assertEquals(MutationResult.STALE_REFERENCE, world.setCollisionIgnored(stray, trigger, true));
        assertEquals(MutationResult.STALE_REFERENCE, world.setCollisionIgnored(null, trigger, true));
    }

    @Test
    public void testDestroyedBodyRejectsMutations() {
        var body = world.register(new PhysicsBody("torso", new Point3f()));
        world.destroy(body);

        assertTrue(body.isDestroyed());
        assertFalse(world.contains(body));
        assertEquals(MutationResult.STALE_REFERENCE, body.translate(new Vector3f(1, 0, 0)));
        assertEquals(MutationResult.STALE_REFERENCE,
                     body.applyImpulse(new Vector3f(1, 0, 0), PhysicsBody.ForceMode.VELOCITY_CHANGE));
    }

    @Test
    public void testImpulseModes() {
        var body = new PhysicsBody("torso", new Point3f(), 2.0f);

        body.applyImpulse(new Vector3f(4, 0, 0), PhysicsBody.ForceMode.IMPULSE);
        assertEquals(new Vector3f(2, 0, 0), body.getVelocity());

        body.applyImpulse(new Vector3f(0, 1.5f, 0), PhysicsBody.ForceMode.VELOCITY_CHANGE);
        assertEquals(new Vector3f(2, 1.5f, 0), body.getVelocity());

        body.setKinematic(true);
        body.applyImpulse(new Vector3f(10, 0, 0), PhysicsBody.ForceMode.VELOCITY_CHANGE);
        assertEquals(new Vector3f(0, 0, 0), body.getVelocity(), "Kinematic bodies are frozen");
    }

    @Test
    public void testClosestPoints() {
        var sphere = new SphereVolume("s", new Point3f(0, 0, 0), 1);
        assertEquals(new Point3f(1, 0, 0), sphere.closestPoint(new Point3f(5, 0, 0)));
        assertEquals(new Point3f(0.5f, 0, 0), sphere.closestPoint(new Point3f(0.5f, 0, 0)), "Inside is unchanged");

        var box = new BoxVolume("b", new Point3f(0, 0, 0), 1, 2, 3);
        assertEquals(new Point3f(1, 2, 0), box.closestPoint(new Point3f(4, 7, 0)));
        assertTrue(box.contains(new Point3f(0.5f, -1.5f, 2.5f)));
        assertFalse(box.contains(new Point3f(1.5f, 0, 0)));
    }

    @Test
    public void testRejectsDegenerateVolumes() {
        assertThrows(IllegalArgumentException.class, () -> new SphereVolume("s", new Point3f(), 0));
        assertThrows(IllegalArgumentException.class, () -> new BoxVolume("b", new Point3f(), 1, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new PhysicsBody("b", new Point3f(), -1));
    }
}
