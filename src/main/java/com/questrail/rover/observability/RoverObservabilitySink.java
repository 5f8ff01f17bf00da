package com.questrail.rover.observability;

/**
 * Main interface for receiving rover observability events.
 * Implementations can provide logging, metrics, or tracing.
 * <p>
 * Callbacks are made on the thread that drove the rover, after the rover has
 * released its internal lock.
 */
public interface RoverObservabilitySink {
    /**
     * Called after the rover has been placed on the grid.
     * @param event the landing details
     */
    void onLanded(RoverLandedEvent event);

    /**
     * Called when a command string has been interpreted to its end.
     * @param event the completion details
     */
    void onCommandsCompleted(CommandStringCompletedEvent event);

    /**
     * Called when a command string halted early and the rover stopped.
     * @param event the halt details
     */
    void onCommandsHalted(CommandStringHaltedEvent event);
}
