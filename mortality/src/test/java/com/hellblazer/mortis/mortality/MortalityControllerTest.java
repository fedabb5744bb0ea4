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
import com.hellblazer.mortis.mortality.ragdoll.RagdollHandoffController;
import com.hellblazer.mortis.mortality.ragdoll.RagdollInstance;
import com.hellblazer.mortis.mortality.ragdoll.RagdollTemplate;
import com.hellblazer.mortis.physics.BoxVolume;
import com.hellblazer.mortis.physics.CollisionSuppressionManager;
import com.hellblazer.mortis.physics.PhysicsBody;
import com.hellblazer.mortis.physics.PhysicsWorld;
import com.hellblazer.mortis.scheduler.FrameScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * @author hal.hildebrand
 */
public class MortalityControllerTest {

    private static final Duration FRAME = Duration.ofMillis(100);

    private PhysicsWorld                world;
    private FrameScheduler              scheduler;
    private CollisionSuppressionManager suppression;
    private ControlledEntity            entity;
    private MortalityController         mortality;

    @BeforeEach
    public void setup() {
        world = new PhysicsWorld();
        scheduler = new FrameScheduler();
        suppression = new CollisionSuppressionManager(world, scheduler);
        entity = newEntity(new Point3f(0, 0, 0));
        mortality = newController(MortalityConfig.defaults(), RagdollTemplate.humanoid("Player"));
    }

    @Test
    public void testDamageSequencesStayInRange() {
        var random = new Random(0x5EED);
        for (var trial = 0; trial < 50; trial++) {
            setup();
            var listener = mock(MortalityListener.class);
            mortality.addListener(listener);
            var deathsSeen = 0;
            for (var i = 0; i < 20; i++) {
                var wasDead = mortality.isDead();
                mortality.applyDamage(random.nextInt(40));
                var health = mortality.getCurrentHealth();
                assertTrue(health >= 0 && health <= mortality.getMaxHealth(), "Health out of range: " + health);
                if (!wasDead && mortality.isDead()) {
                    deathsSeen++;
                    assertEquals(0, health);
                }
            }
            assertTrue(deathsSeen <= 1);
            verify(listener, times(deathsSeen)).onDeath();
        }
    }

    @Test
    public void testOverkillIsOneDeath() {
        var listener = mock(MortalityListener.class);
        mortality.addListener(listener);

        mortality.applyDamage(150);

        assertEquals(0, mortality.getCurrentHealth());
        assertTrue(mortality.isDead());
        assertEquals(MortalityState.DEAD, mortality.getState());
        assertEquals(DeathCause.GENERIC, mortality.getLastCause().orElseThrow());
        assertTrue(mortality.getRagdoll().isPresent());
        verify(listener, times(1)).onDeath();

        mortality.applyDamage(10);
        assertEquals(0, mortality.getCurrentHealth());
        verify(listener, times(1)).onDeath();
    }

    @Test
    public void testNegativeAmountsAreRejectedQuietly() {
        mortality.applyDamage(30);

        assertDoesNotThrow(() -> mortality.applyDamage(-5));
        assertDoesNotThrow(() -> mortality.heal(-5));

        assertEquals(70, mortality.getCurrentHealth());
        assertFalse(mortality.isDead());
    }

    @Test
    public void testRespawnFromDeathListenerLeavesNoStaleTask() {
        var respawnOnce = new boolean[] { true };
        mortality.addListener(new MortalityListener() {
            @Override
            public void onDeath() {
                if (respawnOnce[0]) {
                    respawnOnce[0] = false;
                    mortality.respawn();
                }
            }
        });

        assertTrue(mortality.die());
        assertFalse(mortality.isDead());
        assertEquals(0, scheduler.pendingCount(), "No respawn scheduled for a living entity");

        scheduler.runFor(Duration.ofSeconds(1), FRAME);
        assertTrue(mortality.die());

        scheduler.runFor(Duration.ofMillis(1100), FRAME);
        assertTrue(mortality.isDead(), "Respawn waits the full delay after the second death");

        scheduler.runFor(Duration.ofSeconds(1), FRAME);
        assertFalse(mortality.isDead());
    }

    @Test
    public void testDieTwiceSpawnsOneRagdoll() {
        var listener = mock(MortalityListener.class);
        mortality.addListener(listener);

        assertTrue(mortality.die(DeathCause.FORCED_FALL));
        var ragdoll = mortality.getRagdoll().orElseThrow();
        var bodies = ragdoll.bodies().size();

        assertFalse(mortality.die());

        assertSame(ragdoll, mortality.getRagdoll().orElseThrow());
        assertEquals(DeathCause.FORCED_FALL, mortality.getLastCause().orElseThrow());
        var ragdollBodies = ragdoll.bodies().stream().filter(world::contains).count();
        assertEquals(bodies, ragdollBodies, "No second set of ragdoll bodies");
        verify(listener, times(1)).onDeath();
    }

    @Test
    public void testDeathDisablesAndHidesEntity() {
        entity.getBody().setVelocity(new Vector3f(1, 0, 2));

        mortality.die();

        assertFalse(entity.isLocomotionEnabled());
        assertFalse(entity.isInteractionEnabled());
        assertFalse(entity.isVisible());
        assertTrue(entity.getBody().isKinematic());
        for (var body : mortality.getRagdoll().orElseThrow().bodies()) {
            assertEquals(new Vector3f(1, 0, 2), body.getVelocity());
        }
    }

    @Test
    public void testListenersSeeCompletedDeath() {
        var observed = new ArrayList<String>();
        mortality.addListener(new MortalityListener() {
            @Override
            public void onDeath() {
                observed.add(mortality.getState() + " " + mortality.getRagdoll().isPresent() + " "
                             + entity.isVisible());
            }
        });

        mortality.die();

        assertEquals(1, observed.size());
        assertEquals("DEAD true false", observed.get(0));
    }

    @Test
    public void testRespawnAfterDelay() {
        var listener = mock(MortalityListener.class);
        mortality.addListener(listener);
        entity.setPose(Pose.at(4, -10, 4));

        mortality.applyDamage(100);
        var ragdoll = mortality.getRagdoll().orElseThrow();

        scheduler.runFor(Duration.ofMillis(1900), FRAME);
        assertTrue(mortality.isDead(), "Still dead before the respawn delay");

        scheduler.runFor(Duration.ofMillis(200), FRAME);
        assertFalse(mortality.isDead());
        assertEquals(MortalityState.ALIVE, mortality.getState());
        assertEquals(100, mortality.getCurrentHealth());
        assertTrue(ragdoll.isDestroyed());
        assertTrue(mortality.getRagdoll().isEmpty());
        ragdoll.volumes().forEach(v -> assertFalse(world.contains(v)));
        assertEquals(new Point3f(0, 0, 0), entity.position());
        assertTrue(entity.isVisible());
        assertTrue(entity.isLocomotionEnabled());
        assertTrue(entity.isInteractionEnabled());
        assertFalse(entity.getBody().isKinematic());
        verify(listener, times(1)).onRespawn();
    }

    @Test
    public void testRespawnOnlyWhileDead() {
        var listener = mock(MortalityListener.class);
        mortality.addListener(listener);

        assertFalse(mortality.respawn());

        mortality.die();
        assertTrue(mortality.respawn());
        assertFalse(mortality.respawn());
        scheduler.runFor(Duration.ofSeconds(3), FRAME);

        verify(listener, times(1)).onRespawn();
        assertEquals(0, scheduler.pendingCount(), "Manual respawn cancels the scheduled one");
    }

    @Test
    public void testExplicitRespawnPosition() {
        mortality = newController(MortalityConfig.defaults().withRespawnPosition(new Point3f(1, 2, 3)),
                                  RagdollTemplate.humanoid("Player"));

        mortality.die();
        mortality.respawn();

        assertEquals(new Point3f(1, 2, 3), entity.position());
    }

    @Test
    public void testWithoutRagdollEntityFreezesVisible() {
        var focus = mock(DeathFocus.class);
        mortality = newController(MortalityConfig.defaults(), null);
        mortality.setDeathFocus(focus);

        assertTrue(mortality.die());

        assertTrue(mortality.getRagdoll().isEmpty());
        assertTrue(entity.isVisible());
        assertTrue(entity.getBody().isKinematic());
        verifyNoInteractions(focus);
    }

    @Test
    public void testReloadScene() {
        var reloader = mock(SceneReloader.class);
        mortality = newController(MortalityConfig.reloading(), RagdollTemplate.humanoid("Player"));
        mortality.setSceneReloader(reloader);

        mortality.die();
        scheduler.runFor(Duration.ofSeconds(3), FRAME);

        verify(reloader, times(1)).reload();
        assertTrue(mortality.isDead(), "The reloader rebuilds the world");
    }

    @Test
    public void testReloadWithoutReloaderRespawns() {
        mortality = newController(MortalityConfig.reloading(), RagdollTemplate.humanoid("Player"));

        mortality.die();
        scheduler.runFor(Duration.ofSeconds(3), FRAME);

        assertFalse(mortality.isDead());
    }

    @Test
    public void testFallClassification() {
        var focus = mock(DeathFocus.class);

        // Plain death at the respawn height
        mortality.setDeathFocus(focus);
        mortality.die();
        verify(focus).focusOnRagdoll(any(RagdollInstance.class), any(Pose.class), eq(false));

        // Forced fall
        setup();
        focus = mock(DeathFocus.class);
        mortality.setDeathFocus(focus);
        mortality.die(DeathCause.FORCED_FALL);
        verify(focus).focusOnRagdoll(any(RagdollInstance.class), any(Pose.class), eq(true));

        // Falling fast
        setup();
        focus = mock(DeathFocus.class);
        mortality.setDeathFocus(focus);
        entity.getBody().setVelocity(new Vector3f(0, -6, 0));
        mortality.die();
        verify(focus).focusOnRagdoll(any(RagdollInstance.class), any(Pose.class), eq(true));

        // Far below the respawn anchor
        setup();
        focus = mock(DeathFocus.class);
        mortality.setDeathFocus(focus);
        entity.setPose(Pose.at(0, -3.5f, 0));
        mortality.die();
        verify(focus).focusOnRagdoll(any(RagdollInstance.class), eq(Pose.at(0, -3.5f, 0)), eq(true));
    }

    @Test
    public void testFailingObserversAreIsolated() {
        var failing = mock(MortalityListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onDeath();
        var healthy = mock(MortalityListener.class);
        var focus = mock(DeathFocus.class);
        doThrow(new IllegalStateException("focus")).when(focus).focusOnRagdoll(any(), any(), anyBoolean());
        mortality.addListener(failing);
        mortality.addListener(healthy);
        mortality.setDeathFocus(focus);

        assertDoesNotThrow(() -> mortality.die());

        verify(healthy).onDeath();
        assertTrue(mortality.isDead());
        assertEquals(1, scheduler.pendingCount(), "Respawn still scheduled");
    }

    @Test
    public void testRemovedListenerIsNotNotified() {
        var listener = mock(MortalityListener.class);
        mortality.addListener(listener);
        mortality.removeListener(listener);

        mortality.die();

        verifyNoInteractions(listener);
    }

    @Test
    public void testSuppressionAppliesAndNudges() {
        var pit = world.register(new BoxVolume("pit", new Point3f(0, -2, 0), 5, 1, 5));
        mortality.die(DeathCause.FORCED_FALL);
        var ragdoll = mortality.getRagdoll().orElseThrow();
        var before = ragdoll.position();

        assertTrue(mortality.suppressRagdollCollisionWith(pit));

        ragdoll.volumes().forEach(v -> assertFalse(world.canCollide(v, pit)));
        assertEquals(before.y + 0.25f, ragdoll.position().y, 0.0001f, "Nudged up out of the pit volume");
        assertEquals(Duration.ofSeconds(1), suppression.activeRecords().get(0).getExpiry());
    }

    @Test
    public void testSuppressionBufferedUntilRagdollExists() {
        var pit = world.register(new BoxVolume("pit", new Point3f(0, -1, 0), 5, 1, 5));

        assertFalse(mortality.suppressRagdollCollisionWith(pit, Duration.ofMillis(500)));
        assertEquals(1, mortality.pendingSuppressionCount());

        scheduler.tick(FRAME);
        mortality.die();
        assertEquals(1, mortality.pendingSuppressionCount());

        scheduler.tick(FRAME);
        assertEquals(0, mortality.pendingSuppressionCount());
        var ragdoll = mortality.getRagdoll().orElseThrow();
        ragdoll.volumes().forEach(v -> assertFalse(world.canCollide(v, pit)));
    }

    @Test
    public void testSuppressionDroppedAfterRetryBudget() {
        var pit = world.register(new BoxVolume("pit", new Point3f(0, -1, 0), 5, 1, 5));
        mortality = newController(MortalityConfig.defaults().withSuppressionRetryFrames(5), null);
        mortality.die();

        mortality.suppressRagdollCollisionWith(pit);
        for (var i = 0; i < 4; i++) {
            scheduler.tick(FRAME);
        }
        assertEquals(1, mortality.pendingSuppressionCount());

        scheduler.tick(FRAME);
        assertEquals(0, mortality.pendingSuppressionCount());
        assertEquals(0, world.ignoredPairCount());
    }

    @Test
    public void testRecordOutlivesRagdoll() {
        var pit = world.register(new BoxVolume("pit", new Point3f(0, -1, 0), 5, 1, 5));
        mortality.die(DeathCause.FORCED_FALL);
        mortality.suppressRagdollCollisionWith(pit, Duration.ofSeconds(3));
        var record = suppression.activeRecords().get(0);

        scheduler.runFor(Duration.ofMillis(2000), FRAME);
        assertFalse(mortality.isDead(), "Respawned with a second of suppression left");
        assertFalse(record.isRestored());

        assertDoesNotThrow(() -> scheduler.runFor(Duration.ofMillis(1500), FRAME));
        assertTrue(record.isRestored());
        assertEquals(0, world.ignoredPairCount());
    }

    @Test
    public void testHealClampedAndIgnoredWhileDead() {
        mortality.applyDamage(30);
        mortality.heal(10);
        assertEquals(80, mortality.getCurrentHealth());
        mortality.heal(500);
        assertEquals(100, mortality.getCurrentHealth());

        mortality.applyDamage(100);
        mortality.heal(50);
        assertEquals(0, mortality.getCurrentHealth());
        assertThrows(IllegalArgumentException.class, () -> new Vitality(10).heal(-1));
    }

    @Test
    public void testEntityLabeledOnConstruction() {
        assertTrue(entity.hasLabel("Player"));
    }

    @Test
    public void testDisposeCancelsPendingWork() {
        var pit = world.register(new BoxVolume("pit", new Point3f(0, -1, 0), 5, 1, 5));
        mortality.suppressRagdollCollisionWith(pit);
        mortality.die();

        mortality.dispose();
        scheduler.runFor(Duration.ofSeconds(5), FRAME);

        assertTrue(mortality.isDead());
        assertEquals(0, mortality.pendingSuppressionCount());
    }

    private ControlledEntity newEntity(Point3f position) {
        var body = world.register(new PhysicsBody("player", position, 70));
        return new ControlledEntity("player", Pose.at(position), body);
    }

    private MortalityController newController(MortalityConfig config, RagdollTemplate template) {
        return new MortalityController(entity, config, scheduler, suppression,
                                       new RagdollHandoffController(world, template));
    }
}
