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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves which of its viewpoints is live: the enabled one with the highest priority, the earliest registered
 * winning ties.
 *
 * @author hal.hildebrand
 */
public class ViewpointBrain {
    private static final Logger log = LoggerFactory.getLogger(ViewpointBrain.class);

    private final List<Viewpoint> viewpoints = new ArrayList<>();
    private       Viewpoint       lastActive;

    public Optional<Viewpoint> activeViewpoint() {
        Viewpoint best = null;
        for (var viewpoint : viewpoints) {
            if (viewpoint.isEnabled() && (best == null || viewpoint.getPriority() > best.getPriority())) {
                best = viewpoint;
            }
        }
        return Optional.ofNullable(best);
    }

    public void register(Viewpoint viewpoint) {
        Objects.requireNonNull(viewpoint, "viewpoint");
        if (!viewpoints.contains(viewpoint)) {
            viewpoints.add(viewpoint);
        }
    }

    /**
     * Re-resolve the active viewpoint, logging when it changed since the last call
     */
    public Optional<Viewpoint> update() {
        var active = activeViewpoint();
        var current = active.orElse(null);
        if (current != lastActive) {
            lastActive = current;
            log.info("Active viewpoint: {}", current == null ? "none" : current.getName());
        }
        return active;
    }

    public List<Viewpoint> viewpoints() {
        return Collections.unmodifiableList(viewpoints);
    }
}
