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

/**
 * Why an entity died. Only used to bias the choice of the death camera anchor.
 *
 * @author hal.hildebrand
 */
public enum DeathCause {
    /**
     * Damage, spikes, scripted deaths. Still classified as a fall when the entity was dropping fast or far below its
     * respawn anchor.
     */
    GENERIC,
    /**
     * Always treated as a fall into a pit
     */
    FORCED_FALL
}
