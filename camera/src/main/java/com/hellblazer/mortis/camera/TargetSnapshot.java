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

/**
 * Follow and look targets of both viewpoints, saved before a death focus overrides them. Null members mean the
 * viewpoint is absent or had no target.
 *
 * @author hal.hildebrand
 */
record TargetSnapshot(Trackable nearFollow, Trackable nearLook, Trackable farFollow, Trackable farLook) {

    static TargetSnapshot capture(Viewpoint near, Viewpoint far) {
        return new TargetSnapshot(near == null ? null : near.getFollow(), near == null ? null : near.getLookAt(),
                                  far == null ? null : far.getFollow(), far == null ? null : far.getLookAt());
    }

    void restore(Viewpoint near, Viewpoint far) {
        if (near != null) {
            near.setFollow(nearFollow);
            near.setLookAt(nearLook);
        }
        if (far != null) {
            far.setFollow(farFollow);
            far.setLookAt(farLook);
        }
    }
}
