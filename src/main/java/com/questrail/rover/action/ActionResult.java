package com.questrail.rover.action;

import com.questrail.rover.api.Coordinates;

import java.util.Objects;

/**
 * Outcome of applying an {@link Action}.
 */
public sealed interface ActionResult permits ActionResult.Success, ActionResult.DangerousField
{
    ActionResult SUCCESS = new Success();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** Every step of the action was applied. */
    record Success() implements ActionResult {}

    /**
     * A step was refused because a sensor reported its target cell unsafe.
     *
     * @param rejected the cell the refused step would have entered
     */
    record DangerousField(Coordinates rejected) implements ActionResult {
        public DangerousField {
            Objects.requireNonNull(rejected, "rejected");
        }
    }
}
