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
package com.hellblazer.mortis.geometry;

import javax.vecmath.Matrix3f;
import javax.vecmath.Point3f;
import javax.vecmath.Quat4f;
import javax.vecmath.Vector3f;
import java.util.Objects;

/**
 * Immutable position and orientation. The vecmath tuples are mutable, so every accessor hands out a copy.
 *
 * @author hal.hildebrand
 */
public record Pose(Point3f position, Quat4f orientation) {

    private static final Vector3f FORWARD = new Vector3f(0, 0, 1);
    private static final Vector3f UP      = new Vector3f(0, 1, 0);

    public Pose {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(orientation, "orientation");
        position = new Point3f(position);
        orientation = new Quat4f(orientation);
        orientation.normalize();
    }

    /**
     * A pose at the given position with the identity orientation
     */
    public static Pose at(Point3f position) {
        return new Pose(position, identityRotation());
    }

    public static Pose at(float x, float y, float z) {
        return at(new Point3f(x, y, z));
    }

    /**
     * World +Y, a fresh copy on every call
     */
    public static Vector3f up() {
        return new Vector3f(UP);
    }

    /**
     * World +Z, a fresh copy on every call
     */
    public static Vector3f forwardAxis() {
        return new Vector3f(FORWARD);
    }

    public static Quat4f identityRotation() {
        return new Quat4f(0, 0, 0, 1);
    }

    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    @Override
    public Quat4f orientation() {
        return new Quat4f(orientation);
    }

    /**
     * Euclidean distance between the positions of the two poses
     */
    public float distance(Pose other) {
        return position.distance(other.position);
    }

    public float distance(Point3f point) {
        return position.distance(point);
    }

    /**
     * The local +Z axis rotated into world space
     */
    public Vector3f forward() {
        return rotate(FORWARD);
    }

    /**
     * Rotate a local-space vector into world space by this pose's orientation
     */
    public Vector3f rotate(Vector3f local) {
        var rotation = new Matrix3f();
        rotation.set(orientation);
        var result = new Vector3f(local);
        rotation.transform(result);
        return result;
    }

    /**
     * Transform a local-space offset into a world-space point
     */
    public Point3f transform(Vector3f localOffset) {
        var world = new Point3f(position);
        world.add(rotate(localOffset));
        return world;
    }

    public Pose translated(Vector3f delta) {
        var moved = new Point3f(position);
        moved.add(delta);
        return new Pose(moved, orientation);
    }

    /**
     * Same orientation, position raised (or lowered) along world Y
     */
    public Pose withHeightOffset(float dy) {
        return translated(new Vector3f(0, dy, 0));
    }

    public Pose withPosition(Point3f newPosition) {
        return new Pose(newPosition, orientation);
    }

    public Pose withOrientation(Quat4f newOrientation) {
        return new Pose(position, newOrientation);
    }

    /**
     * Tolerant comparison, the record equality is exact
     */
    public boolean epsilonEquals(Pose other, float epsilon) {
        return position.epsilonEquals(other.position, epsilon) && orientation.epsilonEquals(other.orientation,
                                                                                              epsilon);
    }

    @Override
    public String toString() {
        return String.format("Pose[(%.2f, %.2f, %.2f)]", position.x, position.y, position.z);
    }
}
