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

import javax.vecmath.Vector3f;
import java.util.Objects;

/**
 * One body part of a ragdoll template: a sphere collider with a mass, placed at an offset from the ragdoll root in
 * the root's local frame.
 *
 * @author hal.hildebrand
 */
public record PartSpec(String name, Vector3f localOffset, float radius, float mass) {

    public PartSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(localOffset, "localOffset");
        if (radius <= 0) {
            throw new IllegalArgumentException("Part radius must be positive: " + name);
        }
        if (mass <= 0) {
            throw new IllegalArgumentException("Part mass must be positive: " + name);
        }
        localOffset = new Vector3f(localOffset);
    }

    @Override
    public Vector3f localOffset() {
        return new Vector3f(localOffset);
    }
}
