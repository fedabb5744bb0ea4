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

import com.hellblazer.mortis.geometry.Pose;
import com.hellblazer.mortis.geometry.Trackable;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ViewpointBrainTest {

    @Test
    public void testHighestEnabledPriorityWins() {
        var brain = new ViewpointBrain();
        var a = new Viewpoint("a");
        var b = new Viewpoint("b");
        brain.register(a);
        brain.register(b);
        brain.register(a);

        assertEquals(2, brain.viewpoints().size());
        assertSame(a, brain.update().orElseThrow(), "Earliest registered wins a tie");

        b.setPriority(5);
        assertSame(b, brain.activeViewpoint().orElseThrow());

        b.setEnabled(false);
        assertSame(a, brain.activeViewpoint().orElseThrow());

        a.setEnabled(false);
        assertTrue(brain.update().isEmpty());
    }

    @Test
    public void testNearestPitRim() {
        var rims = new PitRimRegistry();
        var close = Trackable.fixed("close", Pose.at(0, 0, 10));
        rims.register(new Trackable() {
            @Override
            public String name() {
                return "collapsed";
            }

            @Override
            public Pose pose() {
                return Pose.at(0, 0, -4);
            }

            @Override
            public boolean exists() {
                return false;
            }
        });
        rims.register(close);

        assertSame(close, rims.nearest(new Point3f(0, 0, 0), 50).orElseThrow());
        assertTrue(rims.nearest(new Point3f(0, 0, 0), 9.9f).isEmpty());
        assertTrue(rims.nearest(new Point3f(0, 0, 0), 10).isPresent(), "Radius is inclusive");

        rims.unregister(close);
        assertTrue(rims.nearest(new Point3f(0, 0, 0), 50).isEmpty());
    }

    @Test
    public void testGroundPlane() {
        var ground = GroundProbe.plane(2);

        assertTrue(ground.isGrounded(new Point3f(0, 3, 0), 1.5f));
        assertFalse(ground.isGrounded(new Point3f(0, 4, 0), 1.5f));
        assertFalse(ground.isGrounded(new Point3f(0, 1, 0), 1.5f), "Below the plane");
    }
}
