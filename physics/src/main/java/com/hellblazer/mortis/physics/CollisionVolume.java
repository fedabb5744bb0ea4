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
 * Abstract base class for collision volumes: colliders attached to bodies and trigger volumes alike. Identity is
 * reference identity.
 *
 * @author hal.hildebrand
 */
public abstract sealed class CollisionVolume permits SphereVolume, BoxVolume {

    protected final String  name;
    protected final Point3f position;
    private         boolean enabled = true;
    private         boolean trigger;
    private         boolean destroyed;

    protected CollisionVolume(String name, Point3f position) {
        this.name = name;
        this.position = new Point3f(position);
    }

    /**
     * The point on or inside this volume closest to the given point. Points inside the volume are returned
     * unchanged.
     */
    public abstract Point3f closestPoint(Point3f point);

    /**
     * Test whether the point lies inside or on this volume
     */
    public abstract boolean contains(Point3f point);

    public String getName() {
        return name;
    }

    public Point3f getPosition() {
        return new Point3f(position);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isTrigger() {
        return trigger;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setTrigger(boolean trigger) {
        this.trigger = trigger;
    }

    /**
     * Translate this volume by the given delta
     */
    public void translate(Vector3f delta) {
        position.add(delta);
    }

    @Override
    public String toString() {
        return String.format("%s[%s (%.2f, %.2f, %.2f)%s]", getClass().getSimpleName(), name, position.x, position.y,
                             position.z, destroyed ? " destroyed" : "");
    }

    void destroy() {
        destroyed = true;
        enabled = false;
    }
}
