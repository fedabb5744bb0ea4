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
 * Axis-aligned box collision volume.
 *
 * @author hal.hildebrand
 */
public final class BoxVolume extends CollisionVolume {

    private final Vector3f halfExtents;

    public BoxVolume(String name, Point3f center, Vector3f halfExtents) {
        super(name, center);
        if (halfExtents.x <= 0 || halfExtents.y <= 0 || halfExtents.z <= 0) {
            throw new IllegalArgumentException("Half extents must be positive");
        }
        this.halfExtents = new Vector3f(halfExtents);
    }

    public BoxVolume(String name, Point3f center, float halfWidth, float halfHeight, float halfDepth) {
        this(name, center, new Vector3f(halfWidth, halfHeight, halfDepth));
    }

    /**
     * Get the closest point on this box to a given point
     */
    @Override
    public Point3f closestPoint(Point3f point) {
        var x = Math.max(position.x - halfExtents.x, Math.min(point.x, position.x + halfExtents.x));
        var y = Math.max(position.y - halfExtents.y, Math.min(point.y, position.y + halfExtents.y));
        var z = Math.max(position.z - halfExtents.z, Math.min(point.z, position.z + halfExtents.z));
        return new Point3f(x, y, z);
    }

    @Override
    public boolean contains(Point3f point) {
        return Math.abs(point.x - position.x) <= halfExtents.x && Math.abs(point.y - position.y) <= halfExtents.y
        && Math.abs(point.z - position.z) <= halfExtents.z;
    }

    public Vector3f getHalfExtents() {
        return new Vector3f(halfExtents);
    }
}
