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
package com.hellblazer.mortis.physics;

/**
 * Outcome of a mutation against physics state. Mutations never throw for stale references; they report them.
 *
 * @author hal.hildebrand
 */
public enum MutationResult {
    /**
     * The mutation was applied
     */
    APPLIED,
    /**
     * One of the referenced objects no longer exists; nothing was changed
     */
    STALE_REFERENCE;

    public boolean isApplied() {
        return this == APPLIED;
    }
}
