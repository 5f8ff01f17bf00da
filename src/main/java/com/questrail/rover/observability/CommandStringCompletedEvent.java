package com.questrail.rover.observability;

import com.questrail.rover.api.Position;

import java.time.Instant;

/**
 * Record representing a command string that was interpreted to its end.
 */
public record CommandStringCompletedEvent(
    Instant timestamp,
    String commands,
    Position finalPosition
) {
}
