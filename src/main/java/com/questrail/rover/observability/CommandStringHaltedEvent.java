package com.questrail.rover.observability;

import com.questrail.rover.api.Position;

import java.time.Instant;

/**
 * Record representing a command string that halted before its end.
 *
 * @param commands      the full command string as submitted
 * @param haltedAt      index of the command that halted interpretation
 * @param reason        why interpretation halted
 * @param finalPosition the position the rover stopped at
 */
public record CommandStringHaltedEvent(
    Instant timestamp,
    String commands,
    int haltedAt,
    HaltReason reason,
    Position finalPosition
) {
    public enum HaltReason {
        /** The command character has no programmed action. */
        UNBOUND_COMMAND,
        /** A sensor reported the next cell unsafe. */
        DANGEROUS_FIELD
    }

    public char haltingCommand() {
        return commands.charAt(haltedAt);
    }
}
