package com.questrail.rover.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RoverObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRoverObservabilitySink implements RoverObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRoverObservabilitySink.class);

    @Override
    public void onLanded(RoverLandedEvent event) {
        log.info("Rover landed at {}", event.position());
    }

    @Override
    public void onCommandsCompleted(CommandStringCompletedEvent event) {
        log.debug("Commands \"{}\" completed at {}", event.commands(), event.finalPosition());
    }

    @Override
    public void onCommandsHalted(CommandStringHaltedEvent event) {
        log.warn("Commands \"{}\" halted at index {} ('{}'): {}; stopped at {}",
            event.commands(),
            event.haltedAt(),
            event.haltingCommand(),
            event.reason(),
            event.finalPosition());
    }
}
