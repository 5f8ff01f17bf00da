package com.questrail.rover.action;

import com.questrail.rover.api.Position;
import com.questrail.rover.api.Sensor;

import java.util.List;
import java.util.Objects;

/**
 * Move
 * -----------------------------------------------------------------------------
 * Base for single-step translations.
 *
 * <h2>Compute, validate, commit</h2>
 * <ol>
 *   <li>The step is computed on a copy of the caller's position</li>
 *   <li>The copy is checked against every sensor in list order; the first
 *       sensor reporting the target cell unsafe refuses the step</li>
 *   <li>Only when all sensors accept is the caller's position overwritten</li>
 * </ol>
 *
 * A refused step therefore leaves the caller's position untouched.
 */
public abstract sealed class Move implements Action permits MoveForward, MoveBackward
{
    Move() {}

    /**
     * Applies the raw geometric step to {@code candidate}. No sensor checks.
     */
    protected abstract void step(Position candidate);

    @Override
    public final ActionResult execute(Position position, List<Sensor> sensors) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(sensors, "sensors");

        Position candidate = position.copy();
        step(candidate);

        for (Sensor sensor : sensors) {
            if (!candidate.isSafeFor(sensor)) {
                return new ActionResult.DangerousField(candidate.coordinates());
            }
        }

        position.overwriteWith(candidate);
        return ActionResult.SUCCESS;
    }
}
