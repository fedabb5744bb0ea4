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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Blueprint a ragdoll is instantiated from. Like an authored prefab it may carry labels, an animation driver and
 * kinematic bodies; the handoff strips all of those from every instance.
 *
 * @author hal.hildebrand
 */
public class RagdollTemplate {

    private final String         name;
    private final List<PartSpec> parts;
    private final Set<String>    labels;
    private final boolean        animated;

    public RagdollTemplate(String name, List<PartSpec> parts, Set<String> labels, boolean animated) {
        this.name = Objects.requireNonNull(name, "name");
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("A ragdoll template needs at least one part");
        }
        this.parts = List.copyOf(parts);
        this.labels = Set.copyOf(new LinkedHashSet<>(labels));
        this.animated = animated;
    }

    /**
     * A seven-part humanoid rooted at the feet, tagged like the living entity it replaces
     */
    public static RagdollTemplate humanoid(String label) {
        return new RagdollTemplate("ragdoll", List.of(new PartSpec("pelvis", new Vector3f(0, 0.9f, 0), 0.15f, 10),
                                                      new PartSpec("torso", new Vector3f(0, 1.3f, 0), 0.2f, 12),
                                                      new PartSpec("head", new Vector3f(0, 1.7f, 0), 0.12f, 5),
                                                      new PartSpec("arm.l", new Vector3f(-0.35f, 1.3f, 0), 0.08f, 3),
                                                      new PartSpec("arm.r", new Vector3f(0.35f, 1.3f, 0), 0.08f, 3),
                                                      new PartSpec("leg.l", new Vector3f(-0.12f, 0.45f, 0), 0.1f, 7),
                                                      new PartSpec("leg.r", new Vector3f(0.12f, 0.45f, 0), 0.1f, 7)),
                                   Set.of(label), true);
    }

    public Set<String> getLabels() {
        return labels;
    }

    public String getName() {
        return name;
    }

    public List<PartSpec> getParts() {
        return parts;
    }

    public boolean isAnimated() {
        return animated;
    }
}
