package com.questrail.rover.core;

import com.questrail.rover.action.Action;
import com.questrail.rover.action.ActionResult;
import com.questrail.rover.api.*;
import com.questrail.rover.config.RoverConfig;
import com.questrail.rover.observability.CommandStringCompletedEvent;
import com.questrail.rover.observability.CommandStringHaltedEvent;
import com.questrail.rover.observability.CommandStringHaltedEvent.HaltReason;
import com.questrail.rover.observability.RoverLandedEvent;
import com.questrail.rover.observability.RoverObservabilitySink;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rover
 * -----------------------------------------------------------------------------
 * The command interpreter and state machine behind {@link RoverController}.
 *
 * <h2>State</h2>
 * <ul>
 *   <li>{@code landed}: false until the first {@link #land(Coordinates, Direction)}</li>
 *   <li>{@code stopped}: set when the most recent command string halted early;
 *       cleared by {@code land} and on entry to every {@code execute}</li>
 *   <li>{@code position}: meaningful only once landed</li>
 * </ul>
 *
 * The command table and sensor list come from a {@link RoverConfig} and never
 * change for the lifetime of the rover.
 *
 * <h2>Interpretation</h2>
 * Characters are looked up in the command table one at a time. A missing
 * binding and a {@link ActionResult.DangerousField} result both stop the rover
 * at whatever position the last accepted step produced. Nothing else is
 * caught: an exception thrown by a sensor propagates to the caller.
 *
 * <h2>Threading model</h2>
 * All state is guarded by a single private monitor, so concurrent callers are
 * serialized per rover. Observability callbacks run after the monitor is
 * released.
 */
public final class Rover implements RoverController
{
    private final Object lock = new Object();

    private final Map<Character, Action> commands;
    private final List<Sensor> sensors;
    private final RoverObservabilitySink sink;

    private boolean landed;
    private boolean stopped;

    /**
     * Undefined until landed; the placeholder is never observed.
     */
    private final Position position = new Position(Coordinates.ORIGIN, Direction.NORTH);

    public Rover(RoverConfig config) {
        Objects.requireNonNull(config, "config");
        this.commands = config.commands();
        this.sensors = config.sensors();
        this.sink = config.observabilitySink();
    }

    public static RoverBuilder builder() {
        return new RoverBuilder();
    }

    @Override
    public void land(Coordinates coordinates, Direction direction) {
        Position landedAt = new Position(coordinates, direction);

        synchronized (lock) {
            position.overwriteWith(landedAt);
            landed = true;
            stopped = false;
        }

        sink.onLanded(new RoverLandedEvent(Instant.now(), landedAt.copy()));
    }

    @Override
    public void execute(CharSequence commandString) {
        Objects.requireNonNull(commandString, "commandString");
        String submitted = commandString.toString();

        final int haltedAt;
        final HaltReason reason;
        final Position finalPosition;

        synchronized (lock) {
            if (!landed) {
                throw new RoverDidNotLandException();
            }
            stopped = false;

            int index = 0;
            HaltReason halt = null;
            for (; index < submitted.length(); index++) {
                Action action = commands.get(submitted.charAt(index));
                if (action == null) {
                    halt = HaltReason.UNBOUND_COMMAND;
                    break;
                }
                if (!action.execute(position, sensors).isSuccess()) {
                    halt = HaltReason.DANGEROUS_FIELD;
                    break;
                }
            }

            stopped = halt != null;
            haltedAt = index;
            reason = halt;
            finalPosition = position.copy();
        }

        if (reason == null) {
            sink.onCommandsCompleted(new CommandStringCompletedEvent(Instant.now(), submitted, finalPosition));
        } else {
            sink.onCommandsHalted(new CommandStringHaltedEvent(Instant.now(), submitted, haltedAt, reason, finalPosition));
        }
    }

    @Override
    public RoverStatus getStatus() {
        synchronized (lock) {
            if (!landed) {
                return RoverStatus.UNLANDED;
            }
            return stopped ? RoverStatus.STOPPED : RoverStatus.RUNNING;
        }
    }

    @Override
    public Optional<Position> getPosition() {
        synchronized (lock) {
            return landed ? Optional.of(position.copy()) : Optional.empty();
        }
    }

    @Override
    public Set<Character> programmedCommands() {
        return commands.keySet();
    }

    @Override
    public String toString() {
        synchronized (lock) {
            if (!landed) {
                return "unknown";
            }
            return stopped ? position + " stopped" : position.toString();
        }
    }
}
