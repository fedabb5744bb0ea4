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
package com.hellblazer.mortis.mortality;

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.geometry.Trackable;
import com.hellblazer.mortis.physics.PhysicsBody;

import javax.vecmath.Vector3f;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The living, player-controlled entity: its pose, optional physics body, classification labels and the capability
 * flags that mortality handling switches off while dead.
 *
 * @author hal.hildebrand
 */
public class ControlledEntity implements Trackable, Labeled {

    private final String      name;
    private final PhysicsBody body;
    private final Set<String> labels = new LinkedHashSet<>();
    private       Pose        pose;
    private       boolean     locomotionEnabled  = true;
    private       boolean     interactionEnabled = true;
    private       boolean     visible            = true;

    public ControlledEntity(String name, Pose pose) {
        this(name, pose, null);
    }

    /**
     * @param body the entity's own physics body, may be null
     */
    public ControlledEntity(String name, Pose pose, PhysicsBody body) {
        this.name = Objects.requireNonNull(name, "name");
        this.pose = Objects.requireNonNull(pose, "pose");
        this.body = body;
    }

    public ControlledEntity addLabel(String label) {
        labels.add(Objects.requireNonNull(label, "label"));
        return this;
    }

    @Override
    public void clearLabels() {
        labels.clear();
    }

    /**
     * The entity's physics body, null when it has none
     */
    public PhysicsBody getBody() {
        return body;
    }

    /**
     * Linear velocity of the body, zero without one
     */
    public Vector3f getVelocity() {
        return body == null ? new Vector3f() : body.getVelocity();
    }

    public boolean isInteractionEnabled() {
        return interactionEnabled;
    }

    public boolean isLocomotionEnabled() {
        return locomotionEnabled;
    }

    public boolean isVisible() {
        return visible;
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

    public void setInteractionEnabled(boolean interactionEnabled) {
        this.interactionEnabled = interactionEnabled;
    }

    public void setLocomotionEnabled(boolean locomotionEnabled) {
        this.locomotionEnabled = locomotionEnabled;
    }

    /**
     * Move the entity, keeping its body in step
     */
    public void setPose(Pose pose) {
        this.pose = Objects.requireNonNull(pose, "pose");
        if (body != null) {
            body.setPosition(pose.position());
        }
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public String toString() {
        return "ControlledEntity[" + name + " " + pose + "]";
    }
}
