package com.questrail.rover.api;

import java.util.Optional;
import java.util.Set;

/**
 * RoverController
 * -----------------------------------------------------------------------------
 * {@code RoverController} is the semantic façade through which a controlling
 * program drives a single rover.
 *
 * <h2>Core Responsibilities</h2>
 * A {@code RoverController} is responsible for:
 * <ul>
 *   <li>Placing the rover on the grid ({@link #land(Coordinates, Direction)})</li>
 *   <li>Interpreting command strings against its fixed command table</li>
 *   <li>Refusing any move that a configured {@link Sensor} reports unsafe</li>
 *   <li>Reporting whether the last command string ran to completion</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Evaluating terrain itself (that is delegated to sensors)</li>
 *   <li>Rolling back commands that already succeeded</li>
 *   <li>Reprogramming commands after construction</li>
 * </ul>
 *
 * <h2>Failure Model</h2>
 * Only one condition crosses this boundary as an exception:
 * {@link RoverDidNotLandException}, raised when commands arrive before landing.
 * An unprogrammed command character or a refused move is expected runtime data;
 * both halt the current command string and surface as
 * {@link RoverStatus#STOPPED}, leaving the rover at its last safe position.
 *
 * <h2>Threading and Concurrency</h2>
 * Callers are expected to drive a rover from one thread. Implementations may
 * additionally serialize concurrent callers, but must document it.
 */
public interface RoverController
{
    /**
     * Places the rover at {@code coordinates} facing {@code direction}.
     * <p>
     * Allowed in any state, including after a previous landing. Clears the
     * stopped flag.
     */
    void land(Coordinates coordinates, Direction direction);

    default void land(int x, int y, Direction direction) {
        land(new Coordinates(x, y), direction);
    }

    /**
     * Interprets {@code commands} one character at a time, left to right.
     * <p>
     * The stopped flag is cleared on entry. Interpretation halts at the first
     * character with no programmed action, or at the first action whose move a
     * sensor refuses; in both cases the rover ends {@link RoverStatus#STOPPED}.
     *
     * @param commands command characters (must not be {@code null}; may be empty)
     * @throws RoverDidNotLandException if the rover has not landed
     */
    void execute(CharSequence commands);

    RoverStatus getStatus();

    /**
     * Returns a snapshot of the current pose, or {@link Optional#empty()} before
     * landing. Mutating the snapshot does not affect the rover.
     */
    Optional<Position> getPosition();

    /**
     * Returns the characters this rover has a programmed action for.
     */
    Set<Character> programmedCommands();

    default boolean isLanded() {
        return getStatus().isLanded();
    }

    default boolean isStopped() {
        return getStatus() == RoverStatus.STOPPED;
    }
}
