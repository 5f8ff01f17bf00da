package com.questrail.rover.core;

import com.questrail.rover.api.Coordinates;
import com.questrail.rover.api.Sensor;

import java.util.Collection;
import java.util.Set;

/**
 * Stock {@link Sensor} implementations.
 * <p>
 * All returned sensors are immutable and may be shared between rovers.
 */
public final class Sensors
{
    private static final Sensor ALWAYS_SAFE = (x, y) -> true;
    private static final Sensor ALWAYS_DANGEROUS = (x, y) -> false;

    private Sensors() {}

    public static Sensor alwaysSafe() {
        return ALWAYS_SAFE;
    }

    public static Sensor alwaysDangerous() {
        return ALWAYS_DANGEROUS;
    }

    /**
     * Reports exactly the given cells as unsafe.
     */
    public static Sensor forbidding(Collection<Coordinates> hazards) {
        Set<Coordinates> forbidden = Set.copyOf(hazards);
        return (x, y) -> !forbidden.contains(new Coordinates(x, y));
    }

    /**
     * Reports every cell outside the inclusive rectangle as unsafe.
     *
     * @throws IllegalArgumentException if the rectangle is empty
     */
    public static Sensor within(int minX, int minY, int maxX, int maxY) {
        if (minX > maxX || minY > maxY) {
            throw new IllegalArgumentException("Empty area: (" + minX + ", " + minY
                    + ") .. (" + maxX + ", " + maxY + ")");
        }
        return (x, y) -> x >= minX && x <= maxX && y >= minY && y <= maxY;
    }
}
