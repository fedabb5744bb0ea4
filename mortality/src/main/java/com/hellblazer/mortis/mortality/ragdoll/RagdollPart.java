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

import com.hellblazer.mortis.mortality.Labeled;
import com.hellblazer.mortis.physics.CollisionVolume;
import com.hellblazer.mortis.physics.PhysicsBody;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A body and its collider inside a ragdoll.
 *
 * @author hal.hildebrand
 */
public final class RagdollPart implements Labeled {

    private final PhysicsBody     body;
    private final CollisionVolume volume;
    private final Set<String>     labels;

    RagdollPart(PhysicsBody body, CollisionVolume volume, Set<String> labels) {
        this.body = body;
        this.volume = volume;
        this.labels = new LinkedHashSet<>(labels);
    }

    public PhysicsBody body() {
        return body;
    }

    @Override
    public void clearLabels() {
        labels.clear();
    }

    @Override
    public Set<String> labels() {
        return Collections.unmodifiableSet(labels);
    }

    public String name() {
        return body.getName();
    }

    public CollisionVolume volume() {
        return volume;
    }
}
