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

import java.util.Set;

/**
 * Something carrying classification labels, e.g. "Player". Hazard detectors use labels to decide whether an occupant
 * is the living entity.
 *
 * @author hal.hildebrand
 */
public interface Labeled {

    /**
     * Unmodifiable view of the current labels
     */
    Set<String> labels();

    void clearLabels();

    default boolean hasLabel(String label) {
        return labels().contains(label);
    }
}
