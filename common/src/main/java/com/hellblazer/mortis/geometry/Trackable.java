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

import javax.vecmath.Point3f;

/**
 * Anything a viewpoint can follow or look at.
 *
 * @author hal.hildebrand
 */
public interface Trackable {

    /**
     * Display name, used in diagnostics only
     */
    String name();

    Pose pose();

    default Point3f position() {
        return pose().position();
    }

    /**
     * Whether the underlying object still exists. Destroyed targets must not be dereferenced by trackers.
     */
    default boolean exists() {
        return true;
    }

    /**
     * A fixed point in space, e.g. a registered marker
     */
    static Trackable fixed(String name, Pose pose) {
        return new Trackable() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Pose pose() {
                return pose;
            }

            @Override
            public String toString() {
                return "Trackable[" + name + " " + pose + "]";
            }
        };
    }
}
