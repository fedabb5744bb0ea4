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

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.geometry.Trackable;
import com.hellblazer.mortis.mortality.Labeled;
import com.hellblazer.mortis.physics.BodyAssembly;
import com.hellblazer.mortis.physics.CollisionVolume;
import com.hellblazer.mortis.physics.MutationResult;
import com.hellblazer.mortis.physics.PhysicsBody;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A spawned ragdoll standing in for a dead entity. Created and destroyed only by {@link RagdollHandoffController}.
 *
 * @author hal.hildebrand
 */
public final class RagdollInstance implements BodyAssembly, Trackable, Labeled {

    private final String            name;
    private final List<RagdollPart> parts;
    private final Set<String>       labels;
    private       Pose              pose;
    private       boolean           animationDriverEnabled;
    private       boolean           destroyed;

    RagdollInstance(String name, Pose pose, List<RagdollPart> parts, Set<String> labels, boolean animated) {
        this.name = name;
        this.pose = pose;
        this.parts = List.copyOf(parts);
        this.labels = new LinkedHashSet<>(labels);
        this.animationDriverEnabled = animated;
    }

    @Override
    public List<PhysicsBody> bodies() {
        return parts.stream().map(RagdollPart::body).toList();
    }

    /**
     * Strip labels from the instance and every part
     */
    @Override
    public void clearLabels() {
        labels.clear();
        parts.forEach(RagdollPart::clearLabels);
    }

    @Override
    public boolean exists() {
        return !destroyed;
    }

    public List<RagdollPart> getParts() {
        return parts;
    }

    public boolean isAnimationDriverEnabled() {
        return animationDriverEnabled;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public Set<String> labels() {
        return Collections.unmodifiableSet(labels);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Pose pose() {
        return pose;
    }

    @Override
    public Point3f position() {
        return pose.position();
    }

    @Override
    public String toString() {
        return "RagdollInstance[" + name + " " + pose + (destroyed ? " destroyed" : "") + "]";
    }

    @Override
    public MutationResult translate(Vector3f delta) {
        if (destroyed) {
            return MutationResult.STALE_REFERENCE;
        }
        pose = pose.translated(delta);
        for (var part : parts) {
            part.body().translate(delta);
            part.volume().translate(delta);
        }
        return MutationResult.APPLIED;
    }

    @Override
    public List<CollisionVolume> volumes() {
        return parts.stream().map(RagdollPart::volume).toList();
    }

    void disableAnimationDriver() {
        animationDriverEnabled = false;
    }

    void markDestroyed() {
        destroyed = true;
    }
}
