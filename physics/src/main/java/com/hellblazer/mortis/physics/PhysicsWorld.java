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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Registry of live bodies and volumes plus the pairwise collision-ignore matrix. The owning simulation consults
 * {@link #canCollide(CollisionVolume, CollisionVolume)} before producing contacts or trigger events for a pair.
 * <p>
 * Destroying an object removes it from the registry and drops every ignore pair it took part in. Any later mutation
 * naming it reports {@link MutationResult#STALE_REFERENCE} instead of failing.
 *
 * @author hal.hildebrand
 */
public class PhysicsWorld {
    private static final Logger log = LoggerFactory.getLogger(PhysicsWorld.class);

    private final Set<PhysicsBody>     bodies  = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<CollisionVolume> volumes = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<VolumePair>      ignored = new HashSet<>();

    /**
     * Test whether the two volumes currently produce collision response
     */
    public boolean canCollide(CollisionVolume a, CollisionVolume b) {
        if (a == b || !isLive(a) || !isLive(b)) {
            return false;
        }
        return a.isEnabled() && b.isEnabled() && !ignored.contains(new VolumePair(a, b));
    }

    public boolean contains(CollisionVolume volume) {
        return volumes.contains(volume);
    }

    public boolean contains(PhysicsBody body) {
        return bodies.contains(body);
    }

    /**
     * Destroy a body. Subsequent mutations of it are stale.
     */
    public MutationResult destroy(PhysicsBody body) {
        if (body == null || !bodies.remove(body)) {
            return MutationResult.STALE_REFERENCE;
        }
        body.destroy();
        return MutationResult.APPLIED;
    }

    /**
     * Destroy a volume and forget every ignore pair it was part of
     */
    public MutationResult destroy(CollisionVolume volume) {
        if (volume == null || !volumes.remove(volume)) {
            return MutationResult.STALE_REFERENCE;
        }
        volume.destroy();
        ignored.removeIf(pair -> pair.involves(volume));
        return MutationResult.APPLIED;
    }

    public int ignoredPairCount() {
        return ignored.size();
    }

    public boolean isCollisionIgnored(CollisionVolume a, CollisionVolume b) {
        return ignored.contains(new VolumePair(a, b));
    }

    public <T extends PhysicsBody> T register(T body) {
        bodies.add(body);
        return body;
    }

    public <T extends CollisionVolume> T register(T volume) {
        volumes.add(volume);
        return volume;
    }

    /**
     * Enable or disable collision response between two volumes
     *
     * @return {@link MutationResult#STALE_REFERENCE} if either volume is missing or destroyed
     */
    public MutationResult setCollisionIgnored(CollisionVolume a, CollisionVolume b, boolean ignore) {
        if (!isLive(a) || !isLive(b)) {
            log.debug("Skipping ignore={} for {} / {}: stale reference", ignore, a, b);
            return MutationResult.STALE_REFERENCE;
        }
        var pair = new VolumePair(a, b);
        if (ignore) {
            ignored.add(pair);
        } else {
            ignored.remove(pair);
        }
        return MutationResult.APPLIED;
    }

    @Override
    public String toString() {
        return String.format("PhysicsWorld{bodies=%d, volumes=%d, ignoredPairs=%d}", bodies.size(), volumes.size(),
                             ignored.size());
    }

    private boolean isLive(CollisionVolume volume) {
        return volume != null && !volume.isDestroyed() && volumes.contains(volume);
    }

    /**
     * Unordered pair of volumes, compared by identity
     */
    private record VolumePair(CollisionVolume a, CollisionVolume b) {

        boolean involves(CollisionVolume volume) {
            return a == volume || b == volume;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof VolumePair other)) {
                return false;
            }
            return (a == other.a && b == other.b) || (a == other.b && b == other.a);
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(a) ^ System.identityHashCode(b);
        }
    }
}
