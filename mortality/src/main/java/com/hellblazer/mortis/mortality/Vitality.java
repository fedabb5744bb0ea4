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
 * Health of one entity. {@code currentHealth} always stays within {@code [0, maxHealth]}; the dead flag is set at
 * most once per life and only {@link #restore()} clears it.
 *
 * @author hal.hildebrand
 */
public final class Vitality {

    private final int     maxHealth;
    private       int     currentHealth;
    private       boolean dead;

    public Vitality(int maxHealth) {
        if (maxHealth <= 0) {
            throw new IllegalArgumentException("Max health must be positive: " + maxHealth);
        }
        this.maxHealth = maxHealth;
        this.currentHealth = maxHealth;
    }

    /**
     * Subtract damage, clamping at zero
     *
     * @return the remaining health
     */
    public int damage(int amount) {
        requireNonNegative(amount);
        currentHealth = Math.max(0, currentHealth - amount);
        return currentHealth;
    }

    public int getCurrentHealth() {
        return currentHealth;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    /**
     * Add health, clamping at the maximum
     *
     * @return the resulting health
     */
    public int heal(int amount) {
        requireNonNegative(amount);
        currentHealth = (int) Math.min(maxHealth, (long) currentHealth + amount);
        return currentHealth;
    }

    public boolean isDead() {
        return dead;
    }

    public boolean isDepleted() {
        return currentHealth == 0;
    }

    /**
     * @return false if already dead
     */
    public boolean markDead() {
        if (dead) {
            return false;
        }
        dead = true;
        return true;
    }

    /**
     * Full health, alive again
     */
    public void restore() {
        currentHealth = maxHealth;
        dead = false;
    }

    @Override
    public String toString() {
        return String.format("Vitality[%d/%d%s]", currentHealth, maxHealth, dead ? ", dead" : "");
    }

    private static void requireNonNegative(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }
}
