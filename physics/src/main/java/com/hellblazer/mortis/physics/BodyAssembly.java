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
import java.util.List;

/**
 * A collection of physics bodies and collision volumes that moves as one unit, e.g. a ragdoll.
 *
 * @author hal.hildebrand
 */
public interface BodyAssembly {

    List<PhysicsBody> bodies();

    String name();

    /**
     * Root position of the assembly
     */
    Point3f position();

    /**
     * Move the root and every body and volume by the same delta
     */
    MutationResult translate(Vector3f delta);

    List<CollisionVolume> volumes();

    boolean isDestroyed();
}
