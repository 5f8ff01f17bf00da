package com.questrail.rover.core;

import com.questrail.rover.action.Action;
import com.questrail.rover.api.Sensor;
import com.questrail.rover.config.RoverConfig;
import com.questrail.rover.observability.RoverObservabilitySink;

import java.util.Objects;

/**
 * RoverBuilder
 * -----------------------------------------------------------------------------
 * Builder for programming a {@link Rover} before it is deployed.
 *
 * <h2>Design Notes</h2>
 * <ul>
 *   <li>Programming the same command twice keeps the last action</li>
 *   <li>Sensors are consulted in the order they were added; adding the same
 *       sensor twice is allowed</li>
 *   <li>No validation is performed: an empty command table or sensor list is
 *       legal</li>
 *   <li>Each {@link #build()} snapshots the current programming, so the builder
 *       may be reused</li>
 * </ul>
 */
public final class RoverBuilder
{
    private final RoverConfig.Builder config = RoverConfig.builder();

    public RoverBuilder programCommand(char command, Action action) {
        config.withCommand(command, action);
        return this;
    }

    public RoverBuilder addSensor(Sensor sensor) {
        config.withSensor(sensor);
        return this;
    }

    public RoverBuilder withObservabilitySink(RoverObservabilitySink sink) {
        config.withObservabilitySink(Objects.requireNonNull(sink, "sink"));
        return this;
    }

    /**
     * Builds an unlanded {@link Rover} with the current programming.
     */
    public Rover build() {
        return new Rover(config.build());
    }
}
