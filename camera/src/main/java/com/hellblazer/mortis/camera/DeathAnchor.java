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

/**
 * Transient point the far viewpoint follows while framing a ragdoll. Lives from the death focus to the respawn.
 *
 * @author hal.hildebrand
 */
public final class DeathAnchor implements Trackable {

    private final Pose    pose;
    private       boolean destroyed;

    DeathAnchor(Pose pose) {
        this.pose = pose;
    }

    @Override
    public boolean exists() {
        return !destroyed;
    }

    @Override
    public String name() {
        return "death-anchor";
    }

    @Override
    public Pose pose() {
        return pose;
    }

    @Override
    public String toString() {
        return "DeathAnchor[" + pose + (destroyed ? " destroyed" : "") + "]";
    }

    void destroy() {
        destroyed = true;
    }
}
