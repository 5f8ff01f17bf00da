package com.questrail.rover.api;

/**
 * Sensor
 * -----------------------------------------------------------------------------
 * A safety predicate consulted before the rover occupies a cell.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #isSafe(int, int)} must be free of side effects visible to the
 *       rover; it may be called any number of times per move</li>
 *   <li>A single sensor instance may back several rovers at once, so
 *       implementations are expected to be immutable or externally
 *       synchronized</li>
 * </ul>
 *
 * The rover core never inspects how a sensor reaches its verdict. A move is
 * refused as soon as any configured sensor reports the target cell unsafe.
 */
@FunctionalInterface
public interface Sensor
{
    /**
     * Reports whether the cell at {@code (x, y)} may be occupied.
     *
     * @return {@code true} if the cell is safe
     */
    boolean isSafe(int x, int y);
}
