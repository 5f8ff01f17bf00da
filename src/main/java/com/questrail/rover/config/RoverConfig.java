package com.questrail.rover.config;

import com.questrail.rover.action.Action;
import com.questrail.rover.api.Sensor;
import com.questrail.rover.observability.NullObservabilitySink;
import com.questrail.rover.observability.RoverObservabilitySink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated, immutable configuration of a rover.
 *
 * @param commands          command table; one action per command character
 * @param sensors           sensors consulted, in order, before every step
 * @param observabilitySink receiver of lifecycle events
 */
public record RoverConfig(
    Map<Character, Action> commands,
    List<Sensor> sensors,
    RoverObservabilitySink observabilitySink
) {
    public RoverConfig {
        Objects.requireNonNull(commands, "commands");
        Objects.requireNonNull(sensors, "sensors");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        commands = Collections.unmodifiableMap(new HashMap<>(commands));
        sensors = Collections.unmodifiableList(new ArrayList<>(sensors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Character, Action> commands = new HashMap<>();
        private final List<Sensor> sensors = new ArrayList<>();
        private RoverObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        /**
         * Binds {@code action} to {@code command}, replacing any earlier binding.
         */
        public Builder withCommand(char command, Action action) {
            commands.put(command, Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder withSensor(Sensor sensor) {
            sensors.add(Objects.requireNonNull(sensor, "sensor"));
            return this;
        }

        public Builder withObservabilitySink(RoverObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public RoverConfig build() {
            return new RoverConfig(commands, sensors, observabilitySink);
        }
    }
}
