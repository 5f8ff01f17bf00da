package com.questrail.rover.api;

/**
 * RoverStatus
 * -----------------------------------------------------------------------------
 * Coarse lifecycle state of a {@link RoverController}.
 *
 * No state is terminal. {@code land} moves any state to {@link #RUNNING};
 * {@code execute} moves a landed rover between {@link #RUNNING} and
 * {@link #STOPPED}.
 */
public enum RoverStatus
{
    /**
     * The rover has not landed. Its position is undefined and it refuses
     * commands.
     */
    UNLANDED,

    /**
     * The rover has landed and its most recent command string, if any, ran to
     * completion.
     */
    RUNNING,

    /**
     * The rover has landed but its most recent command string halted early,
     * either on an unprogrammed command or on a move that a sensor refused.
     * <p>
     * The rover remains at the last position it reached safely and accepts
     * further commands.
     */
    STOPPED;

    public boolean isLanded() {
        return this != UNLANDED;
    }
}
