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
 * Sphere collision volume.
 *
 * @author hal.hildebrand
 */
public final class SphereVolume extends CollisionVolume {

    private final float radius;

    public SphereVolume(String name, Point3f center, float radius) {
        super(name, center);
        if (radius <= 0) {
            throw new IllegalArgumentException("Radius must be positive");
        }
        this.radius = radius;
    }

    @Override
    public Point3f closestPoint(Point3f point) {
        var offset = new Vector3f();
        offset.sub(point, position);
        if (offset.lengthSquared() <= radius * radius) {
            return new Point3f(point);
        }
        offset.normalize();
        offset.scale(radius);

        var closest = new Point3f(position);
        closest.add(offset);
        return closest;
    }

    @Override
    public boolean contains(Point3f point) {
        return position.distanceSquared(point) <= radius * radius;
    }

    public float getRadius() {
        return radius;
    }
}
