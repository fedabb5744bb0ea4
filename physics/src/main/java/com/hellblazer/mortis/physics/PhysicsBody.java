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

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

/**
 * A rigid body's state flags, position and velocity. Nothing here integrates motion; the simulation that owns the
 * body does that. This class only carries the state that mortality handling flips and the discrete impulses it
 * applies.
 *
 * @author hal.hildebrand
 */
public class PhysicsBody {

    /**
     * How the owning simulation sweeps the body for contacts
     */
    public enum CollisionDetection {
        DISCRETE, CONTINUOUS
    }

    /**
     * How an impulse is interpreted
     */
    public enum ForceMode {
        /**
         * Momentum change, scaled by inverse mass
         */
        IMPULSE,
        /**
         * Direct velocity change, mass ignored
         */
        VELOCITY_CHANGE
    }

    private final String             name;
    private final Point3f            position;
    private       float              mass;
    private       Vector3f           velocity;
    private       boolean            kinematic;
    private       CollisionDetection collisionDetection;
    private       boolean            destroyed;

    /**
     * Create a dynamic body of 1kg at rest
     */
    public PhysicsBody(String name, Point3f position) {
        this(name, position, 1.0f);
    }

    public PhysicsBody(String name, Point3f position, float mass) {
        this.name = name;
        this.position = new Point3f(position);
        this.velocity = new Vector3f(0, 0, 0);
        this.collisionDetection = CollisionDetection.DISCRETE;
        setMass(mass);
    }

    /**
     * Create a kinematic body, driven by animation rather than physics
     */
    public static PhysicsBody createKinematic(String name, Point3f position, float mass) {
        var body = new PhysicsBody(name, position, mass);
        body.kinematic = true;
        return body;
    }

    /**
     * Apply an impulse to this body. Kinematic bodies ignore impulses.
     */
    public MutationResult applyImpulse(Vector3f impulse, ForceMode mode) {
        if (destroyed) {
            return MutationResult.STALE_REFERENCE;
        }
        if (!kinematic) {
            var scale = mode == ForceMode.VELOCITY_CHANGE ? 1.0f : getInverseMass();
            velocity.scaleAdd(scale, impulse, velocity);
        }
        return MutationResult.APPLIED;
    }

    public CollisionDetection getCollisionDetection() {
        return collisionDetection;
    }

    public float getInverseMass() {
        return Float.isInfinite(mass) ? 0.0f : 1.0f / mass;
    }

    public float getMass() {
        return mass;
    }

    public String getName() {
        return name;
    }

    public Point3f getPosition() {
        return new Point3f(position);
    }

    public Vector3f getVelocity() {
        return new Vector3f(velocity);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isKinematic() {
        return kinematic;
    }

    public void setCollisionDetection(CollisionDetection collisionDetection) {
        this.collisionDetection = collisionDetection;
    }

    /**
     * Kinematic bodies are frozen as far as physics is concerned: impulses are ignored and velocity is cleared.
     */
    public void setKinematic(boolean kinematic) {
        this.kinematic = kinematic;
        if (kinematic) {
            velocity.set(0, 0, 0);
        }
    }

    public void setMass(float mass) {
        if (mass <= 0) {
            throw new IllegalArgumentException("Mass must be positive");
        }
        this.mass = mass;
    }

    public void setPosition(Point3f position) {
        this.position.set(position);
    }

    public void setVelocity(Vector3f velocity) {
        this.velocity = new Vector3f(velocity);
    }

    public MutationResult translate(Vector3f delta) {
        if (destroyed) {
            return MutationResult.STALE_REFERENCE;
        }
        position.add(delta);
        return MutationResult.APPLIED;
    }

    @Override
    public String toString() {
        return String.format("PhysicsBody[%s, mass=%.2f, velocity=(%.2f,%.2f,%.2f), kinematic=%b%s]", name, mass,
                             velocity.x, velocity.y, velocity.z, kinematic, destroyed ? ", destroyed" : "");
    }

    void destroy() {
        destroyed = true;
    }
}
