package com.questrail.rover.api;

/**
 * Thrown when a rover is asked to execute commands before it has landed.
 *
 * This is a caller contract violation, not a runtime condition of the terrain,
 * and is therefore never absorbed by the rover itself.
 */
public final class RoverDidNotLandException extends IllegalStateException
{
    public RoverDidNotLandException() {
        super("Rover did not land");
    }
}
