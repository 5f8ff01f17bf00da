package com.questrail.rover.action;

import com.questrail.rover.api.Position;
import com.questrail.rover.api.Sensor;

import java.util.List;

/**
 * Action
 * -----------------------------------------------------------------------------
 * A programmable rover command.
 *
 * <h2>Family</h2>
 * The family is closed:
 * <ul>
 *   <li>{@link Rotation}: {@link RotateLeft}, {@link RotateRight}; never fail</li>
 *   <li>{@link Move}: {@link MoveForward}, {@link MoveBackward}; sensor-gated</li>
 *   <li>{@link Compose}: an ordered sequence of other actions</li>
 * </ul>
 *
 * <h2>Contract</h2>
 * Actions are immutable and hold no state between invocations, so one instance
 * may be bound to several command characters or several rovers.
 * <p>
 * {@link #execute(Position, List)} mutates {@code position} in place. A refused
 * move is reported through {@link ActionResult.DangerousField} rather than an
 * exception; each single step is atomic, so a refused step leaves
 * {@code position} exactly as it was before that step.
 */
public sealed interface Action permits Rotation, Move, Compose
{
    /**
     * Applies this action to {@code position}.
     *
     * @param position the working pose to update (must not be {@code null})
     * @param sensors  sensors to consult, in order, before any step is committed
     * @return {@link ActionResult#SUCCESS} or the first refusal encountered
     */
    ActionResult execute(Position position, List<Sensor> sensors);
}
