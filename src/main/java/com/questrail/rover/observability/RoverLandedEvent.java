package com.questrail.rover.observability;

import com.questrail.rover.api.Position;

import java.time.Instant;

/**
 * Record representing a rover landing.
 */
public record RoverLandedEvent(
    Instant timestamp,
    Position position
) {
}
