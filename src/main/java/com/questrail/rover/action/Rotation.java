package com.questrail.rover.action;

import com.questrail.rover.api.Position;
import com.questrail.rover.api.Sensor;

import java.util.List;
import java.util.Objects;

/**
 * Base for actions that change heading only. Rotations never consult sensors
 * and never fail.
 */
public abstract sealed class Rotation implements Action permits RotateLeft, RotateRight
{
    Rotation() {}

    /** Number of clockwise quarter turns this rotation performs. */
    protected abstract int quarterTurns();

    @Override
    public final ActionResult execute(Position position, List<Sensor> sensors) {
        Objects.requireNonNull(position, "position");
        for (int i = 0; i < quarterTurns(); i++) {
            position.rotateForward();
        }
        return ActionResult.SUCCESS;
    }
}
