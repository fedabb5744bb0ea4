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

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered pit-rim markers, the preferred vantage points for framing a fall death.
 *
 * @author hal.hildebrand
 */
public class PitRimRegistry {

    private final List<Trackable> markers = new ArrayList<>();

    /**
     * The existing marker closest to {@code point} within {@code radius}, inclusive
     */
    public Optional<Trackable> nearest(Point3f point, float radius) {
        Trackable best = null;
        var bestDistance = Float.MAX_VALUE;
        for (var marker : markers) {
            if (!marker.exists()) {
                continue;
            }
            var distance = marker.position().distance(point);
            if (distance <= radius && distance < bestDistance) {
                bestDistance = distance;
                best = marker;
            }
        }
        return Optional.ofNullable(best);
    }

    public void register(Trackable marker) {
        markers.add(Objects.requireNonNull(marker, "marker"));
    }

    public int size() {
        return markers.size();
    }

    public boolean unregister(Trackable marker) {
        return markers.remove(marker);
    }
}
