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

import com.hellblazer.mortis.geometry.Trackable;

import java.util.Objects;

/**
 * A virtual camera: it follows one target and looks at another. The {@link ViewpointBrain} picks the enabled
 * viewpoint with the highest priority as the one actually rendered.
 *
 * @author hal.hildebrand
 */
public class Viewpoint {

    private final String    name;
    private       boolean   enabled = true;
    private       int       priority;
    private       Trackable follow;
    private       Trackable lookAt;

    public Viewpoint(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Trackable getFollow() {
        return follow;
    }

    public Trackable getLookAt() {
        return lookAt;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public void setFollow(Trackable follow) {
        this.follow = follow;
    }

    public void setLookAt(Trackable lookAt) {
        this.lookAt = lookAt;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    @Override
    public String toString() {
        return String.format("Viewpoint[%s priority=%d%s]", name, priority, enabled ? "" : " disabled");
    }
}
