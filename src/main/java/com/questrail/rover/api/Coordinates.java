package com.questrail.rover.api;

/**
 * Coordinates
 * -----------------------------------------------------------------------------
 * An immutable cell address on the rover's unbounded 2-D grid.
 *
 * Coordinates are plain values: they carry no heading and have no lifecycle of
 * their own. Arithmetic follows Java {@code int} semantics.
 *
 * @param x horizontal component, growing towards {@link Direction#EAST}
 * @param y vertical component, growing towards {@link Direction#NORTH}
 */
public record Coordinates(int x, int y)
{
    public static final Coordinates ORIGIN = new Coordinates(0, 0);

    public static Coordinates of(int x, int y) {
        return new Coordinates(x, y);
    }

    /**
     * Returns these coordinates shifted by {@code delta}.
     */
    public Coordinates translate(Coordinates delta) {
        return new Coordinates(x + delta.x, y + delta.y);
    }

    public Coordinates negate() {
        return new Coordinates(-x, -y);
    }

    /**
     * Evaluates {@code sensor} at this cell.
     */
    public boolean isSafeFor(Sensor sensor) {
        return sensor.isSafe(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
